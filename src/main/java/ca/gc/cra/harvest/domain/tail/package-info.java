/**
 * Per-file tracking state and the export file naming convention.
 */
package ca.gc.cra.harvest.domain.tail;
