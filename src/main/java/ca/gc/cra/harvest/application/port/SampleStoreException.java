package ca.gc.cra.harvest.application.port;

/**
 * Unchecked failure of the sample store. Fatal for the batch being written.
 *
 * @since 0.1.0
 */
public class SampleStoreException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public SampleStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public SampleStoreException(String message) {
    super(message);
  }
}
