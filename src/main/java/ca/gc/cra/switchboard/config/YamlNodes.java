package ca.gc.cra.switchboard.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape checks for parsed SnakeYAML trees.
 */
final class YamlNodes {
  private YamlNodes() {}

  static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  static Map<String, Object> asMapOrEmpty(Object node, String context) {
    return node == null ? Map.of() : asMap(node, context);
  }

  static List<String> asStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (node instanceof String single) {
      return List.of(single);
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    List<String> values = new ArrayList<>(raw.size());
    for (Object item : raw) {
      if (item == null) {
        throw new IllegalArgumentException(context + " contains an empty entry");
      }
      values.add(item.toString());
    }
    return values;
  }
}
