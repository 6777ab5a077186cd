package ca.gc.cra.blog.infrastructure.sink;

import ca.gc.cra.blog.validation.Net;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory methods for the byte sinks a writer can own.
 *
 * <p>Every sink is a plain {@link OutputStream}; closing it releases the underlying file, socket, or (for the
 * console) nothing, since standard output outlives any writer.</p>
 *
 * @since 0.1.0
 */
public final class Sinks {
  private static final Logger log = LoggerFactory.getLogger(Sinks.class);
  private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

  private Sinks() {}

  /**
   * Opens (or creates) a file for appending. Missing parent directories are created.
   *
   * @param path target file path
   * @return stream appending to the file; closing it forces data to disk and closes the channel
   * @throws IOException when the file cannot be opened for append
   */
  public static OutputStream file(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    FileChannel channel =
        FileChannel.open(
            path,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND);
    log.debug("Opened file sink {} at offset {}", path, channel.size());
    return new FilterOutputStream(Channels.newOutputStream(channel)) {
      @Override
      public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
      }

      @Override
      public void close() throws IOException {
        try {
          channel.force(true);
        } finally {
          super.close();
        }
      }
    };
  }

  /**
   * Connects a TCP socket and exposes its output side.
   *
   * @param address remote endpoint
   * @return stream writing to the socket; closing it closes the socket
   * @throws IOException when the connection cannot be established
   */
  public static OutputStream socket(Net.HostPort address) throws IOException {
    Objects.requireNonNull(address, "address");
    Socket socket = new Socket();
    try {
      socket.connect(new InetSocketAddress(address.host(), address.port()), CONNECT_TIMEOUT_MILLIS);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
    log.debug("Connected socket sink to {}", address);
    return new FilterOutputStream(socket.getOutputStream()) {
      @Override
      public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
      }

      @Override
      public void close() throws IOException {
        try {
          super.close();
        } finally {
          socket.close();
        }
      }
    };
  }

  /**
   * Returns a sink over the process standard output.
   *
   * @return stream writing to file descriptor 1; closing it only flushes
   */
  public static OutputStream console() {
    return nonClosing(new FileOutputStream(FileDescriptor.out));
  }

  /**
   * Wraps a stream so that closing the wrapper flushes but leaves the wrapped stream open.
   *
   * @param delegate stream owned by someone else
   * @return non-closing view of {@code delegate}
   */
  public static OutputStream nonClosing(OutputStream delegate) {
    Objects.requireNonNull(delegate, "delegate");
    return new FilterOutputStream(delegate) {
      @Override
      public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
      }

      @Override
      public void close() throws IOException {
        out.flush();
      }
    };
  }
}
