/**
 * Byte-to-text decoding and quote-aware splitting of export file lines.
 */
package ca.gc.cra.harvest.domain.csv;
