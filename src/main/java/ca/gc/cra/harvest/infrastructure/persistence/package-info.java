/**
 * SQLite sample store reached through JDBC.
 */
package ca.gc.cra.harvest.infrastructure.persistence;
