package eventlist.cli;

import com.google.common.base.Splitter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Shared helpers for command line value parsing. */
final class CliParsers {
  private static final Splitter.MapSplitter SETTINGS_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings().withKeyValueSeparator('=');

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  /** Accepts {@code true/false}, {@code yes/no} and {@code on/off}. */
  static boolean parseBoolean(String raw, String optionName) {
    if (raw == null) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(
          "Invalid boolean for " + optionName + ": " + raw);
    };
  }

  /** Parses {@code key=value[,key=value...]}. */
  static Map<String, String> parseSettings(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      return Map.of();
    }
    try {
      return new LinkedHashMap<>(SETTINGS_SPLITTER.split(raw));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Invalid settings for " + optionName + ": " + raw + " (expected key=value,...)", ex);
    }
  }
}
