package ca.gc.cra.blog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.blog.application.port.MetricsPort;
import ca.gc.cra.blog.application.writer.FormattingWriter;
import ca.gc.cra.blog.domain.level.Level;
import ca.gc.cra.blog.validation.Net;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WriterFactoryTest {

  @TempDir Path tempDir;

  @Test
  void createsFileWriterWithConfiguredTimestampAndLevel() throws IOException {
    Path target = tempDir.resolve("out/app.log");
    WriterConfig config = WriterConfig.fromMap(Map.of(
        "sink", "file",
        "file", target.toString(),
        "level", "warn",
        "bufferBytes", "128",
        "timestampPattern", "yyyy-MM-dd ",
        "timestampRefreshMillis", "60000"));

    FormattingWriter writer = WriterFactory.create(config, MetricsPort.NO_OP, () -> 0L, ZoneOffset.UTC);
    writer.writeFormatted(Level.ERROR, "code=%d", 7);
    writer.close();

    assertEquals(Level.WARN, writer.level());
    assertEquals("1970-01-01 [ERROR] code=7\n", Files.readString(target));
  }

  @Test
  void socketSinkFailsWhenNothingListens() throws IOException {
    int port;
    try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = probe.getLocalPort();
    }
    WriterConfig config = new WriterConfig(Level.INFO, 4096, SinkType.SOCKET, null,
        new Net.HostPort("127.0.0.1", port), "HH:mm:ss ", 1000, "none");

    assertThrows(IOException.class, () -> WriterFactory.create(config, MetricsPort.NO_OP));
  }
}
