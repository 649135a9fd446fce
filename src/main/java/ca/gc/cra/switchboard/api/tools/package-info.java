/**
 * Operator tools: topology wiring reports and effective configuration dumps.
 * <p><strong>Role:</strong> Adapter-side utilities built on the config loaders and the mode registry; none of them
 * starts a bus.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 */
package ca.gc.cra.switchboard.api.tools;
