/**
 * Measurement records and the data-row rules that produce them.
 */
package ca.gc.cra.harvest.domain.sample;
