package ca.gc.cra.switchboard.config;

import ca.gc.cra.switchboard.application.mode.ModeDefinition;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads mode definitions from a YAML topology file.
 * <p><strong>Format:</strong>
 * <pre>
 * initialMode: play
 * expectedClasses: [Emitter, Relay]
 * modes:
 *   base:
 *     nodes: [Emitter, Relay]
 *     wiring:
 *       Emitter: [Relay]
 *     attributes:
 *       Relay: {gain: 1}
 *   play:
 *     base: base
 *     wiring:
 *       Emitter: [Sink]
 * </pre>
 * <p>A wiring entry always states the complete target list for its source class; it replaces whatever the base mode
 * lists for that class.</p>
 *
 * @since 0.1.0
 */
public final class TopologyLoader {
  private static final Logger log = LoggerFactory.getLogger(TopologyLoader.class);

  private TopologyLoader() {}

  /**
   * Loads a topology.
   *
   * @param path YAML file
   * @return parsed topology
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when the YAML shape is invalid
   */
  public static Topology load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString());
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      Topology topology = parse(document == null ? Map.of() : YamlNodes.asMap(document, "topology"));
      log.debug("Loaded topology {} ({} mode(s))", path, topology.modes().size());
      return topology;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse topology at " + path, ex);
    }
  }

  static Topology parse(Map<String, Object> root) {
    List<ModeDefinition> modes = new ArrayList<>();
    Map<String, Object> modeSection = YamlNodes.asMapOrEmpty(root.get("modes"), "modes");
    for (Map.Entry<String, Object> entry : modeSection.entrySet()) {
      modes.add(parseMode(entry.getKey(), YamlNodes.asMapOrEmpty(entry.getValue(), "modes." + entry.getKey())));
    }
    List<String> expected = YamlNodes.asStringList(root.get("expectedClasses"), "expectedClasses");
    Optional<String> initial = Optional.ofNullable(root.get("initialMode"))
        .map(Object::toString)
        .filter(value -> !value.isBlank());
    if (initial.isPresent() && !modeSection.containsKey(initial.get())) {
      throw new IllegalArgumentException("initialMode " + initial.get() + " is not defined under modes");
    }
    return new Topology(modes, expected, initial);
  }

  private static ModeDefinition parseMode(String name, Map<String, Object> node) {
    String context = "modes." + name;
    Object base = node.get("base");
    List<String> nodes = YamlNodes.asStringList(node.get("nodes"), context + ".nodes");

    Map<String, List<String>> wiring = new LinkedHashMap<>();
    YamlNodes.asMapOrEmpty(node.get("wiring"), context + ".wiring").forEach((source, targets) ->
        wiring.put(source, YamlNodes.asStringList(targets, context + ".wiring." + source)));

    Map<String, Map<String, Object>> attributes = new LinkedHashMap<>();
    YamlNodes.asMapOrEmpty(node.get("attributes"), context + ".attributes").forEach((className, values) ->
        attributes.put(className, YamlNodes.asMapOrEmpty(values, context + ".attributes." + className)));

    return new ModeDefinition(
        name, base == null ? null : base.toString(), new LinkedHashSet<>(nodes), wiring, attributes);
  }
}
