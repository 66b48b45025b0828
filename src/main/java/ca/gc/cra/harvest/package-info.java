/**
 * Harvest agent: tails instrument CSV exports and stores each measurement exactly once.
 *
 * <p>Layering follows ports and adapters: {@code domain} holds parsing rules and tracking state,
 * {@code application} the poll loop and batch ingester behind ports, {@code infrastructure} the filesystem,
 * SQLite, metrics and signal adapters, and {@code api} the command-line entry points.</p>
 */
package ca.gc.cra.harvest;
