/**
 * Log-backed listeners for ingest progress.
 */
package ca.gc.cra.harvest.infrastructure.events;
