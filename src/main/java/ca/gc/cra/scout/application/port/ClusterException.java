package ca.gc.cra.scout.application.port;

import java.io.IOException;

/**
 * Raised when the cluster API cannot be reached or rejects a read (network, authentication,
 * authorization).
 */
public class ClusterException extends IOException {
  private static final long serialVersionUID = 1L;

  public ClusterException(String message) {
    super(message);
  }

  public ClusterException(String message, Throwable cause) {
    super(message, cause);
  }
}
