package workqueue;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates instance identities of the form {@code <hostname>-<8 hex chars>}.
 */
public final class InstanceIds {
  private static final Logger logger = Logger.getLogger(InstanceIds.class.getName());
  static final String UNKNOWN_HOST = "unknown";

  private InstanceIds() {}

  /** Generates a fresh identity for the local host. */
  public static String generate() {
    return generate(hostname());
  }

  static String generate(String hostname) {
    String host = (hostname == null || hostname.isBlank()) ? UNKNOWN_HOST : hostname;
    return host + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
  }

  /** Local host name, or {@code "unknown"} when it cannot be resolved. */
  public static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.log(Level.FINE, "Could not resolve local host name", e);
      return UNKNOWN_HOST;
    }
  }
}
