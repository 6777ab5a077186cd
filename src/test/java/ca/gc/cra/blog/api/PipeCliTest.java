package ca.gc.cra.blog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipeCliTest {

  @TempDir Path tempDir;

  private StringWriter printed;
  private String previousExporter;

  @BeforeEach
  void captureOutput() {
    printed = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(printed, true));
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

  @AfterEach
  void restore() {
    CliPrinter.clearTestWriter();
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  private static InputStream stdin(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void pipesEachLineAtLineLevel() throws IOException {
    Path out = tempDir.resolve("pipe.log");

    ExitCode exit = PipeCli.run(
        new String[] {"sink=file", "file=" + out, "lineLevel=warn", "timestampPattern='T'"},
        stdin("first line\nsecond 100% line\n"));

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals("T[WARN] first line\nT[WARN] second 100% line\n", Files.readString(out));
  }

  @Test
  void linesBelowThresholdAreDiscarded() throws IOException {
    Path out = tempDir.resolve("quiet.log");

    ExitCode exit = PipeCli.run(
        new String[] {"sink=file", "file=" + out, "level=error", "lineLevel=info"},
        stdin("dropped\n"));

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals("", Files.readString(out));
  }

  @Test
  void yamlWriterSectionIsAppliedAndCliOverridesIt() throws IOException {
    Path out = tempDir.resolve("yaml.log");
    Path yaml = tempDir.resolve("blog.yaml");
    Files.writeString(yaml, """
        common:
          timestampPattern: "'C'"
        writers:
          audit:
            sink: file
            file: %s
            level: critical
        """.formatted(out.toString().replace("\\", "/")));

    ExitCode exit = PipeCli.run(
        new String[] {"config=" + yaml, "writer=audit", "level=info"},
        stdin("from yaml\n"));

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals("C[INFO] from yaml\n", Files.readString(out));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, PipeCli.run(new String[] {"--help"}, stdin("")));
    assertTrue(printed.toString().contains("lineLevel=LEVEL"));
  }

  @Test
  void malformedArgumentsAreInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, PipeCli.run(new String[] {"nonsense"}, stdin("")));
    assertEquals(ExitCode.INVALID_ARGS, PipeCli.run(new String[] {"lineLevel=loud"}, stdin("")));
    assertEquals(ExitCode.INVALID_ARGS, PipeCli.run(new String[] {"writer=audit"}, stdin("")));
    assertTrue(printed.toString().contains("usage: pipe"));
  }

  @Test
  void badConfigurationIsAConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, PipeCli.run(new String[] {"sink=file"}, stdin("")));
    assertEquals(ExitCode.CONFIG_ERROR, PipeCli.run(new String[] {"bufferBytes=1"}, stdin("")));
    assertEquals(ExitCode.CONFIG_ERROR,
        PipeCli.run(new String[] {"config=" + tempDir.resolve("missing.yaml")}, stdin("")));
  }

  @Test
  void unopenableSinkIsAnIoError() throws IOException {
    Path blocker = tempDir.resolve("blocker");
    Files.writeString(blocker, "not a directory");

    ExitCode exit = PipeCli.run(
        new String[] {"sink=file", "file=" + blocker.resolve("app.log")}, stdin("line\n"));

    assertEquals(ExitCode.IO_ERROR, exit);
    assertFalse(Files.isDirectory(blocker));
  }
}
