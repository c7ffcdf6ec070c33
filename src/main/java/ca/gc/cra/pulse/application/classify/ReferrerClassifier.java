package ca.gc.cra.pulse.application.classify;

import ca.gc.cra.pulse.domain.referrer.ReferrerInfo;
import ca.gc.cra.pulse.domain.referrer.TrafficMedium;
import ca.gc.cra.pulse.domain.stats.RankedCount;
import ca.gc.cra.pulse.domain.util.Rounding;
import ca.gc.cra.pulse.validation.Numbers;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Classifies referrer URLs into source, medium, campaign and search term.
 * <p><strong>Why:</strong> Feeds the sources, mediums, campaigns and search-term breakdowns of the dashboard.</p>
 * <p><strong>Role:</strong> Leaf application service; consumed by the dashboard summary use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve internal, search, social, campaign-tagged and plain referral traffic in that order.</li>
 *   <li>Fall back to direct traffic for empty or unparseable referrers without throwing.</li>
 *   <li>Rank sources, mediums, campaigns and search terms across a batch of referrers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> One {@link URI} parse per referrer; host lists are scanned linearly.</p>
 * <p><strong>Observability:</strong> Emits no logs.</p>
 *
 * @since 0.1.0
 */
public final class ReferrerClassifier {
  private static final List<String> SEARCH_ENGINES =
      List.of("google", "bing", "yahoo", "duckduckgo", "baidu", "yandex");
  private static final List<String> SOCIAL_NETWORKS = List.of(
      "facebook", "twitter", "linkedin", "instagram", "pinterest", "reddit", "tiktok", "youtube");
  private static final List<String> SEARCH_PARAMETERS = List.of("q", "query", "search", "p", "text");
  private static final Map<String, String> SOURCE_ALIASES = sourceAliases();
  private static final String URI_PUNCTUATION = "-._~:/?@!$&'()*+,;=";
  private static final String HEX_DIGITS = "0123456789ABCDEF";

  /**
   * Classifies a referrer without a current host; nothing is treated as internal.
   *
   * @param referrer raw referrer URL; {@code null} or blank yields direct traffic
   * @return classification; never {@code null}
   */
  public ReferrerInfo classify(String referrer) {
    return classify(referrer, null);
  }

  /**
   * Classifies a referrer relative to the site's own host.
   *
   * @param referrer raw referrer URL; {@code null}, blank or unparseable yields direct traffic
   * @param currentHost site host; {@code null} disables internal detection
   * @return classification; never {@code null}
   */
  public ReferrerInfo classify(String referrer, String currentHost) {
    Optional<ParsedReferrer> parsed = parse(referrer);
    if (parsed.isEmpty()) {
      return ReferrerInfo.direct();
    }
    String host = normalizeHost(parsed.get().host());
    if (currentHost != null && host.equals(normalizeHost(currentHost))) {
      return new ReferrerInfo(host, TrafficMedium.INTERNAL, null, null, true);
    }

    Map<String, String> query = queryParameters(parsed.get().rawQuery());
    for (String engine : SEARCH_ENGINES) {
      if (host.contains(engine)) {
        return new ReferrerInfo(engine, TrafficMedium.SEARCH, null, searchTerm(query), false);
      }
    }
    for (String network : SOCIAL_NETWORKS) {
      if (host.contains(network)) {
        return new ReferrerInfo(network, TrafficMedium.SOCIAL, null, null, false);
      }
    }

    String utmSource = query.get("utm_source");
    if (utmSource != null) {
      String medium = query.getOrDefault("utm_medium", TrafficMedium.REFERRAL);
      return new ReferrerInfo(utmSource, medium, query.get("utm_campaign"), null, false);
    }
    return new ReferrerInfo(host, TrafficMedium.REFERRAL, null, null, false);
  }

  /**
   * Returns only the medium of a referrer.
   *
   * @param referrer raw referrer URL
   * @return medium label
   */
  public String classifyMedium(String referrer) {
    return classify(referrer).medium();
  }

  public boolean isSearch(String referrer) {
    return classify(referrer).isSearch();
  }

  public boolean isSocial(String referrer) {
    return classify(referrer).isSocial();
  }

  /**
   * Returns whether the referrer is absent. Unparseable referrers also classify as direct but are not
   * considered direct here.
   *
   * @param referrer raw referrer
   * @return {@code true} for {@code null} or blank input
   */
  public boolean isDirect(String referrer) {
    return referrer == null || referrer.isBlank();
  }

  /**
   * Returns whether the referrer is an absolute URL with a host.
   *
   * @param referrer raw referrer
   * @return {@code true} when it parses
   */
  public boolean isValidReferrer(String referrer) {
    return parse(referrer).isPresent();
  }

  /**
   * Extracts the referrer host, lowercased with a leading {@code www.} removed.
   *
   * @param referrer raw referrer
   * @return host or {@code null} when the referrer is empty or unparseable
   */
  public String extractDomain(String referrer) {
    return parse(referrer).map(parsed -> normalizeHost(parsed.host())).orElse(null);
  }

  /**
   * Maps known domain variants to a canonical source label.
   *
   * @param source source or domain, any case
   * @return canonical label, or the input unchanged when unknown
   */
  public String normalizeSource(String source) {
    if (source == null) {
      return null;
    }
    String lower = source.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> alias : SOURCE_ALIASES.entrySet()) {
      String domain = alias.getKey();
      if (lower.equals(domain) || lower.endsWith("." + domain)) {
        return alias.getValue();
      }
    }
    return source;
  }

  /**
   * Ranks traffic sources.
   *
   * @param referrers raw referrers; must not be {@code null}
   * @return ranked rows, count descending; empty for empty input
   */
  public List<RankedCount> sourceStats(List<String> referrers) {
    Objects.requireNonNull(referrers, "referrers");
    List<String> sources = new ArrayList<>(referrers.size());
    for (String referrer : referrers) {
      sources.add(classify(referrer).source());
    }
    return RankedCount.rank(sources);
  }

  /**
   * Ranks traffic mediums.
   *
   * @param referrers raw referrers; must not be {@code null}
   * @return ranked rows, count descending; empty for empty input
   */
  public List<RankedCount> mediumStats(List<String> referrers) {
    Objects.requireNonNull(referrers, "referrers");
    List<String> mediums = new ArrayList<>(referrers.size());
    for (String referrer : referrers) {
      mediums.add(classify(referrer).medium());
    }
    return RankedCount.rank(mediums);
  }

  /**
   * Returns the {@code limit} most frequent sources.
   *
   * @param referrers raw referrers
   * @param limit maximum rows; must be non-negative
   * @return at most {@code limit} rows
   */
  public List<RankedCount> topReferrers(List<String> referrers, int limit) {
    Numbers.requireNonNegative("limit", limit);
    List<RankedCount> stats = sourceStats(referrers);
    return stats.subList(0, Math.min(limit, stats.size()));
  }

  /**
   * Ranks {@code utm_campaign} values. Percentages are relative to the referrers that carry a campaign.
   *
   * @param referrers raw referrers; must not be {@code null}
   * @return ranked campaigns; empty when none carry one
   */
  public List<RankedCount> campaignStats(List<String> referrers) {
    Objects.requireNonNull(referrers, "referrers");
    List<String> campaigns = new ArrayList<>();
    for (String referrer : referrers) {
      String campaign = classify(referrer).campaign();
      if (campaign != null) {
        campaigns.add(campaign);
      }
    }
    return RankedCount.rank(campaigns);
  }

  /**
   * Ranks search terms carried by search-engine referrers.
   *
   * @param referrers raw referrers; must not be {@code null}
   * @return ranked search terms; empty when none carry one
   */
  public List<RankedCount> searchTermStats(List<String> referrers) {
    Objects.requireNonNull(referrers, "referrers");
    List<String> terms = new ArrayList<>();
    for (String referrer : referrers) {
      String term = classify(referrer).searchTerm();
      if (term != null) {
        terms.add(term);
      }
    }
    return RankedCount.rank(terms);
  }

  /**
   * Keeps referrers classified under the given medium, preserving order.
   *
   * @param referrers raw referrers; must not be {@code null}
   * @param medium medium label to keep
   * @return matching referrers
   */
  public List<String> filterByMedium(List<String> referrers, String medium) {
    Objects.requireNonNull(referrers, "referrers");
    List<String> matches = new ArrayList<>();
    for (String referrer : referrers) {
      if (classify(referrer).medium().equals(medium)) {
        matches.add(referrer);
      }
    }
    return matches;
  }

  /**
   * Computes the share of search-engine traffic.
   *
   * @param referrers raw referrers; must not be {@code null}
   * @return percentage rounded to one decimal; {@code 0} for empty input
   */
  public double organicPercentage(List<String> referrers) {
    Objects.requireNonNull(referrers, "referrers");
    long organic = 0;
    for (String referrer : referrers) {
      if (isSearch(referrer)) {
        organic++;
      }
    }
    return Rounding.percentage(organic, referrers.size());
  }

  /**
   * Parses an absolute referrer. Characters that browsers send unescaped (spaces, pipes, stray {@code %})
   * are percent-encoded before {@link URI} sees them; the query is taken from the raw text.
   */
  private static Optional<ParsedReferrer> parse(String referrer) {
    if (referrer == null || referrer.isBlank()) {
      return Optional.empty();
    }
    String trimmed = referrer.trim();
    int hash = trimmed.indexOf('#');
    String withoutFragment = hash >= 0 ? trimmed.substring(0, hash) : trimmed;
    URI uri;
    try {
      uri = new URI(escapeIllegal(withoutFragment));
    } catch (URISyntaxException ex) {
      return Optional.empty();
    }
    if (!uri.isAbsolute() || uri.getHost() == null) {
      return Optional.empty();
    }
    int question = withoutFragment.indexOf('?');
    String rawQuery = question >= 0 ? withoutFragment.substring(question + 1) : null;
    return Optional.of(new ParsedReferrer(uri.getHost(), rawQuery));
  }

  private static String escapeIllegal(String text) {
    int schemeEnd = text.indexOf("://");
    int authorityStart = schemeEnd < 0 ? -1 : schemeEnd + 3;
    int authorityEnd = authorityStart < 0 ? -1 : authorityEnd(text, authorityStart);
    StringBuilder escaped = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '%') {
        boolean validEscape = i + 2 < text.length() && isHex(text.charAt(i + 1)) && isHex(text.charAt(i + 2));
        escaped.append(validEscape ? "%" : "%25");
      } else if (isUriCharacter(c)) {
        escaped.append(c);
      } else if ((c == '[' || c == ']') && i >= authorityStart && i < authorityEnd) {
        escaped.append(c);
      } else if (c >= 0x80 && !Character.isISOControl(c) && !Character.isSpaceChar(c)) {
        escaped.append(c);
      } else {
        for (byte b : String.valueOf(c).getBytes(StandardCharsets.UTF_8)) {
          escaped.append('%').append(HEX_DIGITS.charAt((b >> 4) & 0xF)).append(HEX_DIGITS.charAt(b & 0xF));
        }
      }
    }
    return escaped.toString();
  }

  private static int authorityEnd(String text, int from) {
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '/' || c == '?') {
        return i;
      }
    }
    return text.length();
  }

  private static boolean isUriCharacter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
        || URI_PUNCTUATION.indexOf(c) >= 0;
  }

  private static boolean isHex(char c) {
    return Character.digit(c, 16) >= 0 && c < 0x80;
  }

  private static String normalizeHost(String host) {
    String lower = host.trim().toLowerCase(Locale.ROOT);
    return lower.startsWith("www.") ? lower.substring(4) : lower;
  }

  private static String searchTerm(Map<String, String> query) {
    for (String parameter : SEARCH_PARAMETERS) {
      String value = query.get(parameter);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** First non-blank decoded value per parameter name. */
  private static Map<String, String> queryParameters(String rawQuery) {
    Map<String, String> parameters = new LinkedHashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return parameters;
    }
    for (String pair : rawQuery.split("&")) {
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      String name = decode(pair.substring(0, eq));
      String value = decode(pair.substring(eq + 1)).trim();
      if (!value.isEmpty()) {
        parameters.putIfAbsent(name, value);
      }
    }
    return parameters;
  }

  private static String decode(String component) {
    try {
      return URLDecoder.decode(component, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      // Malformed percent escape; keep the raw text as the label.
      return component;
    }
  }

  private static Map<String, String> sourceAliases() {
    Map<String, String> aliases = new LinkedHashMap<>();
    aliases.put("google.com", "google");
    aliases.put("google.co.uk", "google");
    aliases.put("facebook.com", "facebook");
    aliases.put("fb.com", "facebook");
    aliases.put("t.co", "twitter");
    aliases.put("twitter.com", "twitter");
    aliases.put("linkedin.com", "linkedin");
    return aliases;
  }

  private record ParsedReferrer(String host, String rawQuery) {}
}
