/**
 * Configuration for the {@code serve} command: defaults, YAML loading, merging, validation and
 * the composition root that turns a {@link ca.gc.cra.noodles.config.ServerConfig} into a running
 * {@link ca.gc.cra.noodles.application.pipeline.ReplicationServer}.
 */
package ca.gc.cra.noodles.config;
