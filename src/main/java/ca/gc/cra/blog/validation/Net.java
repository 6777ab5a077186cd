package ca.gc.cra.blog.validation;

import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parses and validates {@code HOST:PORT} socket sink addresses.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern LABEL_PATTERN = Pattern.compile("\\A[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses {@code HOST:PORT}; IPv6 literals must be bracketed ({@code [::1]:514}).
   *
   * @param value candidate address
   * @return parsed host (without brackets) and port
   * @throws IllegalArgumentException when the address is malformed or the port is outside 1-65535
   */
  public static HostPort parseHostPort(String value) {
    String sanitized = Strings.requireNonBlank("address", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0 || close + 1 >= sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("address must use [IPV6]:PORT format");
      }
      host = sanitized.substring(1, close);
      portPart = sanitized.substring(close + 2);
      if (host.isEmpty() || host.indexOf(':') < 0) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("address must use HOST:PORT format");
      }
      host = sanitized.substring(0, colon);
      portPart = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHost(host);
    }
    int port = Numbers.parseIntInRange("port", portPart, 1, 65535);
    return new HostPort(host, port);
  }

  private static void validateHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (label.length() > MAX_LABEL_LENGTH || !LABEL_PATTERN.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname label: '" + label + "'");
      }
    }
  }

  /**
   * Parsed socket address.
   *
   * @param host hostname or IP literal, IPv6 without brackets
   * @param port TCP port
   */
  public record HostPort(String host, int port) {
    @Override
    public String toString() {
      return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
  }
}
