package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.config.ConfigMerger;
import ca.gc.cra.vigil.config.DefaultsForMode;
import ca.gc.cra.vigil.config.YamlConfigLoader;
import ca.gc.cra.vigil.logging.LoggingConfigurator;
import ca.gc.cra.vigil.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration loading shared by the {@code live} and {@code play} commands: CLI parsing, YAML loading,
 * and merging over the mode defaults.
 */
final class CliSupport {
  private static final Logger log = LoggerFactory.getLogger(CliSupport.class);
  static final Set<String> COMMON_FLAGS = Set.of("--dry-run");

  private CliSupport() {}

  /**
   * Produces the effective configuration for {@code mode}.
   *
   * @param mode {@code live} or {@code play}
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @return effective configuration
   * @throws CliAbort carrying the exit code when arguments, YAML, or merged values are invalid
   */
  static Map<String, String> effectiveConfig(String mode, CliInput input, String usage) throws CliAbort {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", mode);
    }
    List<String> unknown = input.unknownFlags(COMMON_FLAGS);
    if (!unknown.isEmpty()) {
      log.error("Unknown option(s): {}", Logs.truncate(String.join(" ", unknown), 128));
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    Map<String, String> cliKv;
    try {
      cliKv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", Logs.truncate(ex.getMessage(), 256));
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    cliKv.putAll(input.flagOverrides());

    Optional<Map<String, String>> yaml = loadYaml(configPath, mode, usage);
    try {
      return ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /** Early exit from a command with a prepared exit code. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(exitCode.name(), null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
