package ca.gc.cra.display.domain;

/**
 * Raised when a stream operation names a category without a registry slot.
 *
 * @since 0.1.0
 */
public final class InvalidCategoryException extends DisplayException {
  private static final long serialVersionUID = 1L;

  public InvalidCategoryException(String category) {
    super("Invalid stream category: " + category + " (expected STANDARD, WARNING or ERROR)");
  }
}
