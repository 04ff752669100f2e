package relay.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts the top-level keys of a payload map from camelCase to snake_case.
 *
 * <p>Only the outer keys are rewritten. Nested maps and lists are passed through untouched
 * so that user-chosen names inside them (node names, parameter names) survive verbatim.
 */
public final class SnakeCaseKeys {

  private SnakeCaseKeys() {}

  /**
   * @param payload source map, not modified
   * @return a new insertion-ordered map with converted top-level keys
   */
  public static Map<String, Object> convertTopLevel(Map<String, Object> payload) {
    Map<String, Object> converted = new LinkedHashMap<>(payload.size() * 2);
    for (Map.Entry<String, Object> entry : payload.entrySet()) {
      converted.put(toSnakeCase(entry.getKey()), entry.getValue());
    }
    return converted;
  }

  /**
   * Prefixes every upper-case letter with an underscore and lower-cases it:
   * {@code workflowHashBefore} becomes {@code workflow_hash_before}.
   *
   * @param key the key to convert
   * @return the converted key
   */
  public static String toSnakeCase(String key) {
    StringBuilder sb = new StringBuilder(key.length() + 8);
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (Character.isUpperCase(c)) {
        sb.append('_').append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
