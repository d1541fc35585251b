/**
 * Logging helpers: runtime level control and bounding of client-supplied text in log lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.noodles.logging;
