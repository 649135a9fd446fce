package ca.gc.cra.switchboard.api.tools;

import ca.gc.cra.switchboard.api.CliArgsParser;
import ca.gc.cra.switchboard.api.CliInput;
import ca.gc.cra.switchboard.api.CliPrinter;
import ca.gc.cra.switchboard.api.ExitCode;
import ca.gc.cra.switchboard.application.mode.ModeConfigurationException;
import ca.gc.cra.switchboard.application.mode.ModeDefinition;
import ca.gc.cra.switchboard.application.mode.ModeRegistry;
import ca.gc.cra.switchboard.application.mode.UnknownModeException;
import ca.gc.cra.switchboard.config.Topology;
import ca.gc.cra.switchboard.config.TopologyLoader;
import ca.gc.cra.switchboard.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI that loads a topology file and prints the resolved wiring of each mode.
 *
 * <p>Each wiring entry a mode declares replaces the inherited list for that source class outright. The report flags
 * every such replacement so a mode that meant to add one target, and silently dropped the others, is visible.</p>
 */
public final class WiringReportCli {
  private static final Logger log = LoggerFactory.getLogger(WiringReportCli.class);
  private static final String SUMMARY_USAGE = "usage: wiring topology=PATH [mode=NAME]";
  private static final String HELP_TEXT = """
      Switchboard wiring report

      Usage:
        wiring topology=PATH [mode=NAME]

      Options:
        topology=PATH     Topology YAML with modes, expectedClasses and initialMode
        mode=NAME         Report a single mode instead of every mode

      Flags:
        --help            Show this message
        --verbose         Enable verbose logging

      Example:
        switchboard wiring topology=config/topology.yaml mode=play
      """;

  private WiringReportCli() {}

  /**
   * Loads the topology and prints the report.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS}, {@link ExitCode#INVALID_ARGS} for bad arguments, {@link ExitCode#IO_ERROR}
   *     for a missing or unreadable file, {@link ExitCode#CONFIG_ERROR} for an invalid topology or unknown mode
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.info("Verbose logging enabled for wiring report");
    }

    Path path;
    String only;
    try {
      Map<String, String> options = CliArgsParser.toMap(input.keyValueArgs());
      String raw = options.get("topology");
      if (raw == null) {
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      path = Path.of(raw);
      only = options.get("mode");
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Topology topology;
    try {
      topology = TopologyLoader.load(path);
    } catch (NoSuchFileException ex) {
      CliPrinter.println("Topology file not found: " + path);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Failed to read topology {}", path, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("Invalid topology: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ModeRegistry registry = new ModeRegistry();
    topology.modes().forEach(registry::define);
    List<String> names = only == null ? registry.modeNames() : List.of(only);
    try {
      List<String> lines = new ArrayList<>();
      for (String name : names) {
        lines.addAll(describe(registry, name, topology));
      }
      CliPrinter.printLines(lines);
    } catch (UnknownModeException | ModeConfigurationException ex) {
      CliPrinter.println("Invalid topology: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    return ExitCode.SUCCESS;
  }

  static List<String> describe(ModeRegistry registry, String name, Topology topology) {
    List<String> lineage = registry.lineage(name);
    List<String> lines = new ArrayList<>();
    String marker = topology.initialMode().filter(name::equals).isPresent() ? " [initial]" : "";
    lines.add("Mode " + name + marker + " (lineage: " + String.join(" -> ", lineage) + ")");
    lines.add("  nodes: " + String.join(", ", registry.resolveNodes(name)));

    Map<String, List<String>> wiring = registry.resolveWiring(name);
    if (wiring.isEmpty()) {
      lines.add("  wiring: (none)");
    } else {
      lines.add("  wiring:");
      wiring.forEach((source, targets) ->
          lines.add("    " + source + " -> " + (targets.isEmpty() ? "(nothing)" : String.join(", ", targets))));
    }

    ModeDefinition own = registry.definition(name).orElseThrow();
    if (lineage.size() > 1) {
      Map<String, List<String>> inherited = registry.resolveWiring(lineage.get(1));
      for (Map.Entry<String, List<String>> entry : own.wiring().entrySet()) {
        List<String> previous = inherited.get(entry.getKey());
        if (previous != null && !previous.equals(entry.getValue())) {
          lines.add("  note: " + entry.getKey() + " replaces inherited [" + String.join(", ", previous)
              + "] with [" + String.join(", ", entry.getValue()) + "]");
        }
      }
    }
    return lines;
  }
}
