package ca.gc.cra.harvest.api;

import ca.gc.cra.harvest.config.ConfigMerger;
import ca.gc.cra.harvest.config.DefaultsForMode;
import ca.gc.cra.harvest.config.HarvestConfig;
import ca.gc.cra.harvest.config.HarvestMode;
import ca.gc.cra.harvest.config.YamlConfigLoader;
import ca.gc.cra.harvest.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Resolves the effective {@link HarvestConfig} for a subcommand: CLI &gt; YAML &gt; environment &gt; defaults.
 *
 * <p>Each failure is logged against the calling command's logger and turned into the {@link ExitCode} the
 * command should return.</p>
 */
final class HarvestCliSupport {

  private HarvestCliSupport() {}

  /**
   * Parses, merges and validates the configuration.
   *
   * @param mode subcommand being configured
   * @param input parsed command line
   * @param knownFlags flags the subcommand accepts besides help and verbose
   * @param booleanFlags flag to configuration key mapping applied as {@code key=true}
   * @param usage one-line usage printed on argument errors
   * @param log logger of the calling command
   * @return resolved configuration or the exit code to return
   */
  static Resolution resolve(
      HarvestMode mode,
      CliInput input,
      Set<String> knownFlags,
      Map<String, String> booleanFlags,
      String usage,
      Logger log) {
    Objects.requireNonNull(mode, "mode");
    List<String> unknown = input.unknownFlags(knownFlags);
    if (!unknown.isEmpty()) {
      log.error("Unknown option(s) for {}: {}", mode.key(), String.join(", ", unknown));
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    booleanFlags.forEach((flag, key) -> ConfigCliUtils.applyFlag(input, flag, kv, key));

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Resolution.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode.key(), ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    if (!input.verbose() && Boolean.parseBoolean(effective.getOrDefault("verbose", "false").trim())) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled from configuration");
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    configInputs.remove("verbose");
    HarvestConfig config;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = HarvestConfig.fromMap(mode, configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode.key(), ex.getMessage());
      return Resolution.failed(ExitCode.CONFIG_ERROR);
    }
    return new Resolution(config, null);
  }

  /**
   * Prints the dry-run plan for a resolved configuration.
   *
   * @param config resolved configuration
   */
  static void printDryRunPlan(HarvestConfig config) {
    CliPrinter.println("Harvest " + config.mode().key() + " dry-run: nothing will be read or written.");
    for (String line : config.describe().split("\n")) {
      CliPrinter.println(" " + line);
    }
  }

  /**
   * Outcome of {@link #resolve}: exactly one of {@code config} and {@code failure} is set.
   *
   * @param config resolved configuration, or {@code null} on failure
   * @param failure exit code to return, or {@code null} on success
   */
  record Resolution(HarvestConfig config, ExitCode failure) {
    static Resolution failed(ExitCode code) {
      return new Resolution(null, code);
    }

    boolean ok() {
      return failure == null;
    }
  }
}
