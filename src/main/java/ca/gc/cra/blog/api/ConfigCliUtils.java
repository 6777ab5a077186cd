package ca.gc.cra.blog.api;

import java.util.Map;

/**
 * Pulls CLI-only selectors out of the argument map before it is merged with YAML settings.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    return extract(args, "config", "--config");
  }

  static String extractWriterName(Map<String, String> args) {
    return extract(args, "writer");
  }

  static String extractLineLevel(Map<String, String> args) {
    return extract(args, "lineLevel");
  }

  private static String extract(Map<String, String> args, String... keys) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : keys) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }
}
