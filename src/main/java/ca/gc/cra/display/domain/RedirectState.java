package ca.gc.cra.display.domain;

/**
 * Records whether the inherited standard streams point at something other than an interactive terminal.
 *
 * <p>Computed once when a display is initialized and never re-probed.</p>
 *
 * @param standardRedirected {@code true} when standard output is not a terminal
 * @param errorRedirected {@code true} when standard error is not a terminal
 * @since 0.1.0
 */
public record RedirectState(boolean standardRedirected, boolean errorRedirected) {
  /** Both streams attached to a terminal. */
  public static final RedirectState INTERACTIVE = new RedirectState(false, false);

  /**
   * Indicates whether prints of the given category must be written without escape sequences.
   *
   * @param category print category
   * @return {@code true} when the category's standard stream was found redirected
   */
  public boolean redirects(PrintCategory category) {
    return switch (category) {
      case STANDARD -> standardRedirected;
      case WARNING, ERROR -> errorRedirected;
      case CUSTOM -> false;
    };
  }
}
