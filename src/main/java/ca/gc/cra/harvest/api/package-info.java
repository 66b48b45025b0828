/**
 * Command-line entry points: the {@code harvest} dispatcher and its {@code ingest} and {@code watch} commands.
 *
 * <p>Commands resolve configuration (CLI, YAML, environment, defaults), wire the pipeline through
 * {@link ca.gc.cra.harvest.config.CompositionRoot}, and map failures to {@link ca.gc.cra.harvest.api.ExitCode}.</p>
 */
package ca.gc.cra.harvest.api;
