package ca.gc.cra.switchboard.api.tools;

import ca.gc.cra.switchboard.api.CliArgsParser;
import ca.gc.cra.switchboard.api.CliInput;
import ca.gc.cra.switchboard.api.CliPrinter;
import ca.gc.cra.switchboard.api.ExitCode;
import ca.gc.cra.switchboard.config.BusConfig;
import ca.gc.cra.switchboard.config.BusDefaults;
import ca.gc.cra.switchboard.config.ConfigMerger;
import ca.gc.cra.switchboard.config.YamlConfigLoader;
import ca.gc.cra.switchboard.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI that prints the effective bus configuration after merging defaults, YAML and command-line overrides.
 */
public final class ConfigReportCli {
  private static final Logger log = LoggerFactory.getLogger(ConfigReportCli.class);
  private static final String SUMMARY_USAGE = "usage: config [file=PATH] [context=server|client] [key=value ...]";
  private static final String HELP_TEXT = """
      Switchboard effective configuration

      Usage:
        config [file=PATH] [context=server|client] [key=value ...]

      Options:
        file=PATH             YAML file with common, server and client sections
        context=server|client Section to read and execution context of the bus (default server)
        key=value             Override any setting, e.g. lockTimeoutMillis=2000 telemetry=memory

      Flags:
        --help                Show this message
        --verbose             Enable verbose logging

      Example:
        switchboard config file=config/switchboard.yaml context=client lockTimeoutMillis=2000
      """;

  private ConfigReportCli() {}

  /**
   * Merges and validates the configuration, then prints one {@code key = value} line per setting.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS}, {@link ExitCode#INVALID_ARGS}, {@link ExitCode#IO_ERROR} or
   *     {@link ExitCode#CONFIG_ERROR}
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.info("Verbose logging enabled for config report");
    }

    Map<String, String> overrides;
    Optional<Path> file;
    try {
      overrides = CliArgsParser.toMap(input.keyValueArgs());
      file = Optional.ofNullable(overrides.remove("file")).map(Path::of);
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String section = overrides.getOrDefault("context", BusDefaults.asFlatMap().get("context"));

    try {
      Optional<Map<String, String>> yaml = Optional.empty();
      if (file.isPresent()) {
        yaml = YamlConfigLoader.load(file.get(), section);
        if (yaml.isEmpty()) {
          CliPrinter.println("Config file not found: " + file.get());
          return ExitCode.IO_ERROR;
        }
      }
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          section, yaml, overrides, BusDefaults.asFlatMap(), log::warn);
      BusConfig config = BusConfig.fromMap(effective);
      CliPrinter.printLines(format(config));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to read config {}", file.orElse(null), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("Invalid configuration: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
  }

  static List<String> format(BusConfig config) {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("context", config.context().name().toLowerCase(Locale.ROOT));
    values.put("lockTimeoutMillis", Long.toString(config.lockTimeout().toMillis()));
    values.put("metricsExporter", config.metricsExporter());
    values.put("telemetry", config.telemetry().name().toLowerCase(Locale.ROOT));
    values.put("asyncTelemetry", Boolean.toString(config.asyncTelemetry()));
    values.put("verbose", Boolean.toString(config.verbose()));
    values.put("topology", config.topology().map(Path::toString).orElse(""));
    return values.entrySet().stream().map(e -> e.getKey() + " = " + e.getValue()).toList();
  }
}
