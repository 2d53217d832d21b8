package ca.gc.cra.scout.application.evidence;

/**
 * Raised through a handle's completion when the source never began its action, for example
 * because no running pod matched its fragment.
 */
public class EvidenceUnavailableException extends EvidenceException {
  private static final long serialVersionUID = 1L;

  public EvidenceUnavailableException(String message) {
    super(message);
  }

  public EvidenceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
