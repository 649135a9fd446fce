package ca.gc.cra.switchboard.config;

import ca.gc.cra.switchboard.application.mode.ModeDefinition;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Modes, expected classes and the initial mode read from a topology file.
 *
 * @param modes mode definitions in file order
 * @param expectedClasses classes the topology relies on; verified once classes are registered
 * @param initialMode mode to activate at startup
 * @since 0.1.0
 */
public record Topology(List<ModeDefinition> modes, List<String> expectedClasses, Optional<String> initialMode) {
  public Topology {
    modes = List.copyOf(Objects.requireNonNull(modes, "modes"));
    expectedClasses = List.copyOf(Objects.requireNonNull(expectedClasses, "expectedClasses"));
    initialMode = Objects.requireNonNullElse(initialMode, Optional.empty());
  }

  /**
   * Looks up a mode by name.
   *
   * @param name mode name
   * @return definition when present
   */
  public Optional<ModeDefinition> mode(String name) {
    return modes.stream().filter(mode -> mode.name().equals(name)).findFirst();
  }
}
