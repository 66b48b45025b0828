/**
 * Configuration loading and wiring.
 * <p>Precedence is CLI &gt; YAML &gt; environment &gt; embedded defaults. {@link ca.gc.cra.harvest.config.HarvestConfig}
 * validates the merged map and {@link ca.gc.cra.harvest.config.CompositionRoot} builds the pipeline from it.</p>
 */
package ca.gc.cra.harvest.config;
