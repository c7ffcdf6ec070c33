package ca.gc.cra.pulse.domain.device;

import java.util.Objects;

/**
 * Classification of a single user-agent string.
 *
 * @param browser browser family label or {@code Unknown}; never {@code null}
 * @param browserVersion version token following the browser marker; {@code null} when absent
 * @param os operating system label or {@code Unknown}; never {@code null}
 * @param osVersion operating system version; {@code null} when absent
 * @param device form factor; never {@code null}
 * @param bot {@code true} when the user agent matched a bot keyword
 *
 * @since 0.1.0
 */
public record DeviceInfo(
    String browser,
    String browserVersion,
    String os,
    String osVersion,
    DeviceType device,
    boolean bot) {

  /** Label used when a browser or operating system cannot be identified. */
  public static final String UNKNOWN = "Unknown";

  /**
   * Validates constructor invariants.
   */
  public DeviceInfo {
    browser = Objects.requireNonNull(browser, "browser");
    os = Objects.requireNonNull(os, "os");
    device = Objects.requireNonNull(device, "device");
  }

  /**
   * Returns the classification used for a missing user agent: unknown, desktop, not a bot.
   *
   * @return default classification
   */
  public static DeviceInfo unknown() {
    return new DeviceInfo(UNKNOWN, null, UNKNOWN, null, DeviceType.DESKTOP, false);
  }

  public boolean isMobile() {
    return device == DeviceType.MOBILE;
  }

  public boolean isTablet() {
    return device == DeviceType.TABLET;
  }

  public boolean isDesktop() {
    return device == DeviceType.DESKTOP;
  }
}
