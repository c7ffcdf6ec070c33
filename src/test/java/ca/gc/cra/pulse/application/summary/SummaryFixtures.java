package ca.gc.cra.pulse.application.summary;

import ca.gc.cra.pulse.domain.event.ConversionEvent;
import ca.gc.cra.pulse.domain.event.EventRecord;
import ca.gc.cra.pulse.domain.event.Session;
import ca.gc.cra.pulse.domain.time.Granularity;
import ca.gc.cra.pulse.domain.time.TimeRange;
import java.time.Instant;
import java.util.List;

/** One day of traffic for example.com shared by summary, engine and JSON tests. */
public final class SummaryFixtures {
  public static final String IPHONE = "Mozilla/5.0 (iPhone; CPU iPhone OS 17_1 like Mac OS X) "
      + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Mobile/15E148 Safari/604.1";
  public static final String MAC_CHROME = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
      + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
  public static final String GOOGLEBOT =
      "Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)";

  public static final TimeRange DAY =
      new TimeRange(Instant.parse("2024-03-06T00:00:00Z"), Instant.parse("2024-03-06T23:59:59Z"));

  private SummaryFixtures() {}

  static Instant at(String iso) {
    return Instant.parse(iso);
  }

  /** Three human pageviews in the 10:00 hour, one bot pageview and one pageview the next day. */
  public static List<EventRecord> events() {
    return List.of(
        EventRecord.builder(at("2024-03-06T10:05:00Z"), "s1", "/")
            .userId("u1")
            .referrer("https://www.google.com/search?q=analytics")
            .userAgent(IPHONE)
            .geo("Canada", "Ontario", "Ottawa")
            .language("en-CA")
            .build(),
        EventRecord.builder(at("2024-03-06T10:20:00Z"), "s1", "/pricing")
            .userId("u1")
            .referrer("https://example.com/")
            .userAgent(IPHONE)
            .geo("Canada", "Ontario", "Ottawa")
            .exitPage(true)
            .build(),
        EventRecord.builder(at("2024-03-06T10:45:00Z"), "s2", "/")
            .userId("u2")
            .userAgent(MAC_CHROME)
            .geo("United States", "New York", "New York")
            .build(),
        EventRecord.builder(at("2024-03-06T11:10:00Z"), "s3", "/")
            .userId("crawler")
            .userAgent(GOOGLEBOT)
            .build(),
        EventRecord.builder(at("2024-03-07T09:00:00Z"), "s4", "/")
            .userId("u1")
            .userAgent(IPHONE)
            .build());
  }

  public static List<Session> sessions() {
    List<EventRecord> events = events();
    return List.of(
        new Session("s1", "u1", at("2024-03-06T10:05:00Z"), at("2024-03-06T10:20:00Z"),
            events.subList(0, 2), true),
        new Session("s2", "u2", at("2024-03-06T10:45:00Z"), at("2024-03-06T10:45:30Z"),
            events.subList(2, 3), false),
        new Session("s3", "crawler", at("2024-03-06T11:10:00Z"), at("2024-03-06T11:10:01Z"),
            events.subList(3, 4), false),
        new Session("s4", "u1", at("2024-03-07T09:00:00Z"), null, events.subList(4, 5), false));
  }

  public static List<ConversionEvent> conversions() {
    return List.of(new ConversionEvent("s1", at("2024-03-06T10:19:00Z"), "signup", null));
  }

  public static SummaryRequest request() {
    return new SummaryRequest(events(), sessions(), conversions(), Granularity.hour(), DAY, "example.com");
  }
}
