/**
 * Process-lifecycle helpers connecting JVM shutdown to cooperative cancellation.
 */
package ca.gc.cra.harvest.infrastructure.exec;
