package ca.gc.cra.noodles.infrastructure.websocket;

/**
 * A frame carried an opcode outside the data and control opcodes this server understands.
 *
 * @since 0.1.0
 */
public final class UnknownOpcodeException extends WebSocketException {
  private final int opcode;

  public UnknownOpcodeException(int opcode) {
    super("unknown opcode 0x" + Integer.toHexString(opcode));
    this.opcode = opcode;
  }

  public int opcode() {
    return opcode;
  }
}
