package ca.gc.cra.harvest.api;

import java.util.Map;

/**
 * Helpers for mixing CLI flags with the key/value configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} entry so it never reaches the merged configuration.
   *
   * @param args mutable CLI key/value map
   * @return YAML path, or {@code null} when none was given
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  /**
   * Turns a boolean flag such as {@code --backfill} into a {@code key=true} override. A flag always wins over an
   * explicit {@code key=false} on the same command line.
   */
  static void applyFlag(CliInput input, String flag, Map<String, String> args, String key) {
    if (input.hasFlag(flag)) {
      args.put(key, "true");
    }
  }
}
