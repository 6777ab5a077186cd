package ca.gc.cra.blog.config;

import ca.gc.cra.blog.application.writer.FormattingWriter;
import ca.gc.cra.blog.domain.level.Level;
import ca.gc.cra.blog.infrastructure.time.CachedTimestampSource;
import ca.gc.cra.blog.validation.Net;
import ca.gc.cra.blog.validation.Numbers;
import ca.gc.cra.blog.validation.Strings;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for one configured writer.
 * <p><strong>Why:</strong> Turns the flat {@code key=value} map produced by YAML and CLI merging into typed values
 * before any sink is opened.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param level initial severity threshold
 * @param bufferBytes buffered-stream capacity
 * @param sink destination kind
 * @param file target file for {@link SinkType#FILE}; {@code null} otherwise
 * @param address target endpoint for {@link SinkType#SOCKET}; {@code null} otherwise
 * @param timestampPattern {@link java.time.format.DateTimeFormatter} pattern for record timestamps
 * @param timestampRefreshMillis timestamp cache refresh window
 * @param metricsExporter {@code none} or {@code otlp}
 * @since 0.1.0
 */
public record WriterConfig(
    Level level,
    int bufferBytes,
    SinkType sink,
    Path file,
    Net.HostPort address,
    String timestampPattern,
    long timestampRefreshMillis,
    String metricsExporter) {

  private static final int MAX_PATTERN_LENGTH = 128;

  /**
   * Validates cross-field requirements.
   *
   * @throws IllegalArgumentException when the sink lacks its target or a value is out of range
   */
  public WriterConfig {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(timestampPattern, "timestampPattern");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    Numbers.requireRange(
        "bufferBytes", bufferBytes, FormattingWriter.MIN_BUFFER_SIZE, FormattingWriter.MAX_BUFFER_SIZE);
    Numbers.requireRange("timestampRefreshMillis", timestampRefreshMillis, 1, 60_000);
    if (sink == SinkType.FILE && file == null) {
      throw new IllegalArgumentException("sink=file requires file");
    }
    if (sink == SinkType.SOCKET && address == null) {
      throw new IllegalArgumentException("sink=socket requires address");
    }
    if (!metricsExporter.equals("none") && !metricsExporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
  }

  /**
   * Console writer at {@code DEBUG} with page-sized buffering and the default timestamp layout.
   *
   * @return default configuration
   */
  public static WriterConfig defaults() {
    return new WriterConfig(
        Level.DEBUG,
        FormattingWriter.DEFAULT_BUFFER_SIZE,
        SinkType.CONSOLE,
        null,
        null,
        CachedTimestampSource.DEFAULT_PATTERN,
        CachedTimestampSource.DEFAULT_REFRESH_MILLIS,
        "none");
  }

  /**
   * Returns the defaults as the string map fed to {@link ConfigMerger}.
   *
   * @return mutable map of default values
   */
  public static Map<String, String> defaultsMap() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("level", Level.DEBUG.name());
    defaults.put("bufferBytes", Integer.toString(FormattingWriter.DEFAULT_BUFFER_SIZE));
    defaults.put("sink", "console");
    defaults.put("timestampPattern", CachedTimestampSource.DEFAULT_PATTERN);
    defaults.put("timestampRefreshMillis", Long.toString(CachedTimestampSource.DEFAULT_REFRESH_MILLIS));
    defaults.put("metricsExporter", "none");
    return defaults;
  }

  /**
   * Parses a merged key/value map. Keys that are absent fall back to {@link #defaults()}; unknown keys are ignored.
   *
   * @param values merged settings
   * @return validated configuration
   * @throws IllegalArgumentException when any value is malformed
   */
  public static WriterConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    WriterConfig base = defaults();

    Level level = has(values, "level") ? Level.parse(values.get("level")) : base.level();
    int bufferBytes = has(values, "bufferBytes")
        ? Numbers.parseIntInRange("bufferBytes", values.get("bufferBytes"),
            FormattingWriter.MIN_BUFFER_SIZE, FormattingWriter.MAX_BUFFER_SIZE)
        : base.bufferBytes();
    SinkType sink = has(values, "sink") ? SinkType.parse(values.get("sink")) : base.sink();

    Path file = null;
    if (has(values, "file")) {
      String raw = values.get("file").trim();
      if (Strings.containsControl(raw)) {
        throw new IllegalArgumentException("file must not contain control characters");
      }
      file = Paths.get(raw).toAbsolutePath().normalize();
    }
    Net.HostPort address = has(values, "address") ? Net.parseHostPort(values.get("address")) : null;

    // the pattern may end in a space, so it is not trimmed
    String pattern = values.containsKey("timestampPattern") && !values.get("timestampPattern").isEmpty()
        ? values.get("timestampPattern")
        : base.timestampPattern();
    if (pattern.length() > MAX_PATTERN_LENGTH || Strings.containsControl(pattern)) {
      throw new IllegalArgumentException("timestampPattern must be printable and at most "
          + MAX_PATTERN_LENGTH + " characters");
    }
    long refresh = has(values, "timestampRefreshMillis")
        ? Numbers.parseIntInRange("timestampRefreshMillis", values.get("timestampRefreshMillis"), 1, 60_000)
        : base.timestampRefreshMillis();
    String exporter = has(values, "metricsExporter")
        ? values.get("metricsExporter").trim().toLowerCase(Locale.ROOT)
        : base.metricsExporter();

    return new WriterConfig(level, bufferBytes, sink, file, address, pattern, refresh, exporter);
  }

  private static boolean has(Map<String, String> values, String key) {
    String value = values.get(key);
    return value != null && !value.isBlank();
  }
}
