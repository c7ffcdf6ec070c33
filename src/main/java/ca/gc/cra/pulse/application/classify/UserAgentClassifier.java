package ca.gc.cra.pulse.application.classify;

import ca.gc.cra.pulse.domain.device.DeviceInfo;
import ca.gc.cra.pulse.domain.device.DeviceType;
import ca.gc.cra.pulse.domain.stats.RankedCount;
import ca.gc.cra.pulse.domain.util.Rounding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Classifies user-agent strings into browser, operating system, form factor and bot flag.
 * <p><strong>Why:</strong> Device, browser and OS breakdowns on the dashboard, plus bot filtering before any
 * statistic is computed.</p>
 * <p><strong>Role:</strong> Leaf application service; consumed by the dashboard summary use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Evaluate ordered browser and OS rules where the first match wins.</li>
 *   <li>Detect bots by keyword independently of browser detection.</li>
 *   <li>Rank browsers, operating systems and devices across a batch of user agents.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; rule tables are immutable. Safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear in the user-agent length per rule; rule tables are small and fixed.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers truncate user agents before logging them.</p>
 *
 * @implNote Rule order is load-bearing: Chrome user agents also carry a {@code Safari/} token, Edge carries
 * {@code Chrome/}, and iOS user agents contain {@code like Mac OS X}.
 * @since 0.1.0
 */
public final class UserAgentClassifier {
  private static final List<String> BOT_KEYWORDS = List.of(
      "bot", "crawler", "spider", "scraper", "headless", "phantom",
      "selenium", "webdriver", "curl", "wget", "http", "python");

  private static final List<BrowserRule> BROWSER_RULES = List.of(
      new BrowserRule("Edge", ua -> ua.contains("edg/"), Pattern.compile("edg/([\\d.]+)")),
      new BrowserRule("Chrome", ua -> ua.contains("chrome/"), Pattern.compile("chrome/([\\d.]+)")),
      new BrowserRule("Firefox", ua -> ua.contains("firefox/"), Pattern.compile("firefox/([\\d.]+)")),
      new BrowserRule(
          "Safari",
          ua -> ua.contains("safari/") && !ua.contains("chrome"),
          Pattern.compile("version/([\\d.]+)")),
      new BrowserRule(
          "Opera",
          ua -> ua.contains("opr/") || ua.contains("opera/"),
          Pattern.compile("(?:opr|opera)/([\\d.]+)")),
      new BrowserRule(
          "Internet Explorer",
          ua -> ua.contains("msie") || ua.contains("trident/"),
          Pattern.compile("(?:msie |rv:)([\\d.]+)")));

  private static final Map<String, String> WINDOWS_VERSIONS = windowsVersions();
  private static final Pattern IOS_VERSION = Pattern.compile("os ([\\d_]+)");
  private static final Pattern MACOS_VERSION = Pattern.compile("mac os x ([\\d_]+)");
  private static final Pattern ANDROID_VERSION = Pattern.compile("android ([\\d.]+)");
  private static final Pattern MAJOR_VERSION = Pattern.compile("^\\s*(\\d+)");

  private static final List<OsRule> OS_RULES = List.of(
      new OsRule("Windows", ua -> ua.contains("windows"), UserAgentClassifier::windowsVersion),
      new OsRule(
          "iOS",
          ua -> ua.contains("iphone") || ua.contains("ipad") || ua.contains("ipod"),
          ua -> underscoredVersion(IOS_VERSION, ua)),
      new OsRule("macOS", ua -> ua.contains("mac os x"), ua -> underscoredVersion(MACOS_VERSION, ua)),
      new OsRule("Android", ua -> ua.contains("android"), ua -> firstGroup(ANDROID_VERSION, ua)),
      new OsRule("Linux", ua -> ua.contains("linux"), ua -> null),
      new OsRule("Chrome OS", ua -> ua.contains("cros"), ua -> null));

  private static final Map<String, Integer> MINIMUM_MAJOR_VERSIONS =
      Map.of("Chrome", 100, "Firefox", 100, "Safari", 15, "Edge", 100);

  private static final Map<String, String> BROWSER_ALIASES = Map.of(
      "chrome", "Chrome",
      "firefox", "Firefox",
      "safari", "Safari",
      "edge", "Edge",
      "opera", "Opera",
      "ie", "Internet Explorer",
      "internet explorer", "Internet Explorer");

  /**
   * Classifies a user-agent string.
   *
   * @param userAgent raw user-agent header; {@code null} or blank yields {@link DeviceInfo#unknown()}
   * @return classification; never {@code null}
   */
  public DeviceInfo classify(String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return DeviceInfo.unknown();
    }
    Detection browser = detectBrowser(userAgent);
    Detection os = detectOs(userAgent);
    return new DeviceInfo(
        browser.name(),
        browser.version(),
        os.name(),
        os.version(),
        detectDeviceType(userAgent),
        isBot(userAgent));
  }

  /**
   * Detects the browser family using the first matching rule.
   *
   * @param userAgent raw user agent; {@code null} is treated as empty
   * @return browser name and optional version
   */
  public Detection detectBrowser(String userAgent) {
    String ua = normalize(userAgent);
    for (BrowserRule rule : BROWSER_RULES) {
      if (rule.matches().test(ua)) {
        return new Detection(rule.name(), firstGroup(rule.version(), ua));
      }
    }
    return Detection.UNKNOWN;
  }

  /**
   * Detects the operating system using the first matching rule.
   *
   * @param userAgent raw user agent; {@code null} is treated as empty
   * @return operating system name and optional version
   */
  public Detection detectOs(String userAgent) {
    String ua = normalize(userAgent);
    for (OsRule rule : OS_RULES) {
      if (rule.matches().test(ua)) {
        return new Detection(rule.name(), rule.version().apply(ua));
      }
    }
    return Detection.UNKNOWN;
  }

  /**
   * Detects the form factor. Tablet signals are checked before mobile ones.
   *
   * @param userAgent raw user agent; {@code null} is treated as empty
   * @return device type; {@link DeviceType#DESKTOP} when nothing matches
   */
  public DeviceType detectDeviceType(String userAgent) {
    String ua = normalize(userAgent);
    if (ua.contains("ipad") || (ua.contains("tablet") && !ua.contains("mobile"))) {
      return DeviceType.TABLET;
    }
    if (ua.contains("mobile") || ua.contains("iphone") || ua.contains("ipod")) {
      return DeviceType.MOBILE;
    }
    return DeviceType.DESKTOP;
  }

  /**
   * Returns whether the user agent contains any bot keyword (case-insensitive).
   *
   * @param userAgent raw user agent; {@code null} is never a bot
   * @return {@code true} for automated clients
   */
  public boolean isBot(String userAgent) {
    String ua = normalize(userAgent);
    if (ua.isEmpty()) {
      return false;
    }
    for (String keyword : BOT_KEYWORDS) {
      if (ua.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Ranks browser families across a batch of user agents.
   *
   * @param userAgents user agents; must not be {@code null}
   * @return ranked rows sorted by count descending; empty for empty input
   */
  public List<RankedCount> browserStats(List<String> userAgents) {
    return rank(userAgents, ua -> detectBrowser(ua).name());
  }

  /**
   * Ranks operating systems across a batch of user agents.
   *
   * @param userAgents user agents; must not be {@code null}
   * @return ranked rows sorted by count descending; empty for empty input
   */
  public List<RankedCount> osStats(List<String> userAgents) {
    return rank(userAgents, ua -> detectOs(ua).name());
  }

  /**
   * Ranks form factors across a batch of user agents.
   *
   * @param userAgents user agents; must not be {@code null}
   * @return ranked rows sorted by count descending; empty for empty input
   */
  public List<RankedCount> deviceStats(List<String> userAgents) {
    return rank(userAgents, ua -> detectDeviceType(ua).label());
  }

  /**
   * Removes bot user agents, preserving order.
   *
   * @param userAgents user agents; must not be {@code null}
   * @return new list without bots
   */
  public List<String> filterBots(List<String> userAgents) {
    Objects.requireNonNull(userAgents, "userAgents");
    List<String> humans = new ArrayList<>(userAgents.size());
    for (String userAgent : userAgents) {
      if (!isBot(userAgent)) {
        humans.add(userAgent);
      }
    }
    return List.copyOf(humans);
  }

  /**
   * Computes the share of handheld traffic (mobile and tablet).
   *
   * @param userAgents user agents; must not be {@code null}
   * @return percentage rounded to one decimal; {@code 0} for empty input
   */
  public double mobilePercentage(List<String> userAgents) {
    Objects.requireNonNull(userAgents, "userAgents");
    long handheld = 0;
    for (String userAgent : userAgents) {
      if (detectDeviceType(userAgent) != DeviceType.DESKTOP) {
        handheld++;
      }
    }
    return Rounding.percentage(handheld, userAgents.size());
  }

  /**
   * Returns whether a browser version is below the supported minimum major version.
   *
   * @param browser canonical browser name
   * @param version version string; only the leading integer is inspected
   * @return {@code true} when the major version is below the minimum; {@code false} for browsers without a
   *     minimum or unparseable versions
   */
  public boolean isOutdated(String browser, String version) {
    Integer minimum = browser == null ? null : MINIMUM_MAJOR_VERSIONS.get(browser);
    if (minimum == null || version == null) {
      return false;
    }
    Matcher matcher = MAJOR_VERSION.matcher(version);
    if (!matcher.find()) {
      return false;
    }
    String digits = matcher.group(1);
    // Longer than any real major version; treat as current rather than overflow.
    return digits.length() < 9 && Integer.parseInt(digits) < minimum;
  }

  /**
   * Maps common lowercase or abbreviated browser names to their canonical label.
   *
   * @param browser browser name in any case
   * @return canonical label, or the input unchanged when unknown
   */
  public String normalizeBrowserName(String browser) {
    if (browser == null) {
      return null;
    }
    return BROWSER_ALIASES.getOrDefault(browser.toLowerCase(Locale.ROOT), browser);
  }

  private static List<RankedCount> rank(List<String> userAgents, Function<String, String> labeller) {
    Objects.requireNonNull(userAgents, "userAgents");
    List<String> labels = new ArrayList<>(userAgents.size());
    for (String userAgent : userAgents) {
      labels.add(labeller.apply(userAgent));
    }
    return RankedCount.rank(labels);
  }

  private static String normalize(String userAgent) {
    return userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);
  }

  private static String windowsVersion(String ua) {
    for (Map.Entry<String, String> entry : WINDOWS_VERSIONS.entrySet()) {
      if (ua.contains(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static Map<String, String> windowsVersions() {
    Map<String, String> versions = new LinkedHashMap<>();
    versions.put("windows nt 10.0", "10");
    versions.put("windows nt 6.3", "8.1");
    versions.put("windows nt 6.2", "8");
    versions.put("windows nt 6.1", "7");
    return versions;
  }

  private static String underscoredVersion(Pattern pattern, String ua) {
    String raw = firstGroup(pattern, ua);
    return raw == null ? null : raw.replace('_', '.');
  }

  private static String firstGroup(Pattern pattern, String ua) {
    Matcher matcher = pattern.matcher(ua);
    return matcher.find() ? matcher.group(1) : null;
  }

  /**
   * Name and optional version produced by a browser or OS rule.
   *
   * @param name detected label or {@code Unknown}
   * @param version version token; {@code null} when absent
   */
  public record Detection(String name, String version) {
    static final Detection UNKNOWN = new Detection(DeviceInfo.UNKNOWN, null);
  }

  private record BrowserRule(String name, Predicate<String> matches, Pattern version) {}

  private record OsRule(String name, Predicate<String> matches, Function<String, String> version) {}
}
