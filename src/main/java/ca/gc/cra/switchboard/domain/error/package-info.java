/**
 * Error records produced by isolated handler failures and routing anomalies.
 */
package ca.gc.cra.switchboard.domain.error;
