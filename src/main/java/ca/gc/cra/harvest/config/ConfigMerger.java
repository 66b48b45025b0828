package ca.gc.cra.harvest.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 *
 * <p>Environment fallbacks are already folded into the defaults by {@link DefaultsForMode}. Keys without a
 * default are rejected so a typo never silently falls back to a default value.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults defaults for the mode; their key set defines the recognized keys
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a key is not recognized for {@code mode}
   */
  public static Map<String, String> buildEffectiveConfig(
      HarvestMode mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    requireKnown(mode, "YAML", yamlCopy, defaultsCopy);
    requireKnown(mode, "CLI", cliCopy, defaultsCopy);

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  private static void requireKnown(
      HarvestMode mode, String origin, Map<String, String> source, Map<String, String> defaults) {
    for (String key : source.keySet()) {
      if (key == null || !defaults.containsKey(key)) {
        throw new IllegalArgumentException(
            "Unknown " + origin + " key for " + mode.key() + ": " + key);
      }
    }
  }
}
