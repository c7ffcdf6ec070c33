package ca.gc.cra.pulse.domain.device;

/**
 * Form factor inferred from a user-agent string.
 *
 * @since 0.1.0
 */
public enum DeviceType {
  DESKTOP("Desktop"),
  MOBILE("Mobile"),
  TABLET("Tablet");

  private final String label;

  DeviceType(String label) {
    this.label = label;
  }

  /**
   * Returns the display label used in breakdowns.
   *
   * @return label such as {@code Desktop}
   */
  public String label() {
    return label;
  }
}
