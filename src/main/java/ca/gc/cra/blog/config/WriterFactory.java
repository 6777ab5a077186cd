package ca.gc.cra.blog.config;

import ca.gc.cra.blog.application.port.ClockPort;
import ca.gc.cra.blog.application.port.MetricsPort;
import ca.gc.cra.blog.application.writer.FormattingWriter;
import ca.gc.cra.blog.infrastructure.sink.Sinks;
import ca.gc.cra.blog.infrastructure.time.CachedTimestampSource;
import ca.gc.cra.blog.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.io.OutputStream;
import java.time.ZoneId;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the configured sink and assembles a {@link FormattingWriter} around it.
 *
 * @since 0.1.0
 */
public final class WriterFactory {
  private static final Logger log = LoggerFactory.getLogger(WriterFactory.class);

  private WriterFactory() {}

  /**
   * Creates a writer using the system clock and time zone.
   *
   * @param config validated writer settings
   * @param metrics metrics sink for writer counters
   * @return open writer owning the sink
   * @throws IOException when the sink cannot be opened
   */
  public static FormattingWriter create(WriterConfig config, MetricsPort metrics) throws IOException {
    return create(config, metrics, new SystemClockAdapter(), ZoneId.systemDefault());
  }

  /**
   * Creates a writer with an explicit clock and zone.
   *
   * @param config validated writer settings
   * @param metrics metrics sink for writer counters
   * @param clock clock feeding the timestamp cache
   * @param zone zone used to render timestamps
   * @return open writer owning the sink
   * @throws IOException when the sink cannot be opened
   */
  public static FormattingWriter create(WriterConfig config, MetricsPort metrics, ClockPort clock, ZoneId zone)
      throws IOException {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(metrics, "metrics");
    CachedTimestampSource timestamps =
        new CachedTimestampSource(clock, config.timestampPattern(), zone, config.timestampRefreshMillis());
    OutputStream sink = openSink(config);
    log.debug("Opened {} sink (bufferBytes={}, level={})", config.sink(), config.bufferBytes(), config.level());
    return new FormattingWriter(
        sink,
        new FormattingWriter.Settings(config.bufferBytes(), config.level()),
        timestamps,
        metrics);
  }

  static OutputStream openSink(WriterConfig config) throws IOException {
    return switch (config.sink()) {
      case CONSOLE -> Sinks.console();
      case FILE -> Sinks.file(config.file());
      case SOCKET -> Sinks.socket(config.address());
    };
  }
}
