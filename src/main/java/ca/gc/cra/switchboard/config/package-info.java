/**
 * Configuration layer: defaults, YAML loading, CLI/YAML merging, topology files and the composition root that builds
 * buses from them.
 * <p><strong>Concurrency:</strong> Invoked during bootstrap on a single thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.switchboard.config;
