/**
 * Application ports between the harvest pipeline and its adapters.
 *
 * <p>Each port ships a no-op or default constant so use cases and tests can run without infrastructure.</p>
 */
package ca.gc.cra.harvest.application.port;
