package ca.gc.cra.scout.application.evidence;

/**
 * Raised when an evidence source cannot be stopped cleanly or its action fails.
 */
public class EvidenceException extends Exception {
  private static final long serialVersionUID = 1L;

  public EvidenceException(String message) {
    super(message);
  }

  public EvidenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
