package ca.gc.cra.blog.application.writer;

/**
 * Raised when a write, flush, or destination swap reaches a writer that has been closed.
 *
 * @since 0.1.0
 */
public class WriterClosedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception naming the rejected operation.
   *
   * @param operation operation attempted after close
   */
  public WriterClosedException(String operation) {
    super("writer is closed; cannot " + operation);
  }
}
