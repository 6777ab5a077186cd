package ca.gc.cra.blog.api;

import ca.gc.cra.blog.application.port.MetricsPort;
import ca.gc.cra.blog.application.writer.LeveledWriter;
import ca.gc.cra.blog.application.writer.WriterClosedException;
import ca.gc.cra.blog.config.ConfigMerger;
import ca.gc.cra.blog.config.WriterConfig;
import ca.gc.cra.blog.config.WriterFactory;
import ca.gc.cra.blog.config.YamlConfigLoader;
import ca.gc.cra.blog.domain.level.Level;
import ca.gc.cra.blog.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.blog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.blog.logging.LoggingConfigurator;
import ca.gc.cra.blog.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads lines from standard input and writes each one through a configured writer.
 *
 * @since 0.1.0
 */
public final class PipeCli {
  private static final Logger log = LoggerFactory.getLogger(PipeCli.class);
  private static final int MAX_LOGGED_VALUE_BYTES = 256;
  private static final String SUMMARY_USAGE =
      "usage: pipe [config=PATH [writer=NAME]] [lineLevel=LEVEL] [level=LEVEL] [bufferBytes=64-16777216] "
          + "[sink=console|file|socket] [file=PATH] [address=HOST:PORT] [timestampPattern=PATTERN] "
          + "[timestampRefreshMillis=1-60000] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      BLOG pipe: write stdin lines as leveled records

      Usage:
        pipe [options]

      Selection:
        config=PATH                 YAML file with a 'common' section and 'writers.<name>' sections
        writer=NAME                 Writer section to apply from the YAML file
        lineLevel=LEVEL             Level for each stdin line (default INFO)

      Writer settings (CLI overrides YAML, YAML overrides defaults):
        level=LEVEL                 Threshold: DEBUG|TRACE|INFO|WARN|ERROR|CRITICAL (default DEBUG)
        bufferBytes=64-16777216     Buffer capacity in bytes (default 4096)
        sink=console|file|socket    Destination (default console)
        file=PATH                   Append target when sink=file
        address=HOST:PORT           TCP endpoint when sink=socket
        timestampPattern=PATTERN    DateTimeFormatter pattern (default 'yyyy/MM/dd:HH:mm:ss ')
        timestampRefreshMillis=N    Timestamp cache refresh window, 1-60000 (default 1000)
        metricsExporter=otlp|none   Writer metrics exporter (default none)
        otelEndpoint=URL            OTLP metrics endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --verbose                   Enable DEBUG diagnostics
        --help                      Show this message
      """;

  private PipeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, System.in);
  }

  /**
   * Runs the pipe command against the supplied input.
   *
   * @param args raw CLI arguments
   * @param stdin source of lines; read as UTF-8 until end of stream
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args, InputStream stdin) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for pipe CLI");
    }

    Map<String, String> kv;
    String configPath;
    String writerName;
    Level lineLevel;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      configPath = ConfigCliUtils.extractConfigPath(kv);
      writerName = ConfigCliUtils.extractWriterName(kv);
      String rawLineLevel = ConfigCliUtils.extractLineLevel(kv);
      lineLevel = rawLineLevel == null ? Level.INFO : Level.parse(rawLineLevel);
      if (writerName != null && configPath == null) {
        throw new IllegalArgumentException("writer requires config");
      }
      TelemetryConfigurator.configureEndpoints(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", Logs.truncate(ex.getMessage(), MAX_LOGGED_VALUE_BYTES));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    WriterConfig config;
    try {
      Optional<Map<String, String>> yaml = loadYaml(configPath, writerName);
      Map<String, String> merged =
          ConfigMerger.buildEffectiveConfig(yaml, kv, WriterConfig.defaultsMap(), log::warn);
      config = WriterConfig.fromMap(merged);
    } catch (IOException ex) {
      log.error("Failed to read config {}", Logs.truncate(configPath, MAX_LOGGED_VALUE_BYTES), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid writer configuration: {}", Logs.truncate(ex.getMessage(), MAX_LOGGED_VALUE_BYTES));
      return ExitCode.CONFIG_ERROR;
    }

    TelemetryConfigurator.applyExporter(config.metricsExporter());
    MetricsPort metrics = config.metricsExporter().equals("otlp")
        ? new OpenTelemetryMetricsAdapter()
        : new NoOpMetricsAdapter();
    try {
      long lines = pipe(config, metrics, stdin, lineLevel);
      log.info("Piped {} lines at {} to {} sink", lines, lineLevel, config.sink());
      return ExitCode.SUCCESS;
    } catch (IOException | UncheckedIOException ex) {
      log.error("Pipe I/O failure on {} sink", config.sink(), ex);
      return ExitCode.IO_ERROR;
    } catch (WriterClosedException ex) {
      log.error("Writer closed while piping", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in pipe", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeMetrics(metrics);
    }
  }

  private static long pipe(WriterConfig config, MetricsPort metrics, InputStream stdin, Level lineLevel)
      throws IOException {
    long lines = 0;
    try (LeveledWriter writer = new LeveledWriter(WriterFactory.create(config, metrics));
        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8))) {
      if (!writer.isEnabled(lineLevel)) {
        log.warn("lineLevel {} is below threshold {}; lines will be discarded", lineLevel, writer.level());
      }
      String line;
      while ((line = reader.readLine()) != null) {
        writer.log(lineLevel, line);
        lines++;
      }
    }
    return lines;
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String writerName) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path path = Paths.get(configPath);
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("config file not found: " + configPath);
    }
    log.debug("Loading writer config from {} (writer={})", path, writerName == null ? "<common>" : writerName);
    return YamlConfigLoader.load(path, writerName);
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
