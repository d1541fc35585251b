/**
 * Command-line entry points. {@link ca.gc.cra.noodles.api.Main} dispatches to
 * {@link ca.gc.cra.noodles.api.ServeCli}; user-facing text goes to a caller-supplied writer while
 * diagnostics go through SLF4J.
 */
package ca.gc.cra.noodles.api;
