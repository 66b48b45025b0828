/**
 * Filesystem adapters that discover export files and read the bytes appended to them since the previous poll.
 */
package ca.gc.cra.harvest.infrastructure.tail;
