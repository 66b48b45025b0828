/**
 * Clock adapters for {@link ca.gc.cra.harvest.application.port.ClockPort}.
 */
package ca.gc.cra.harvest.infrastructure.time;
