/**
 * Validation helpers shared by configuration parsing and the CLI. Every helper throws
 * {@link java.lang.IllegalArgumentException} with a message naming the offending parameter.
 */
package ca.gc.cra.noodles.validation;
