package io.intellixity.insight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Compiler limits. Defaults can be overridden by a classpath resource
 * {@code META-INF/insight-analytics.properties}:
 *
 * <pre>
 * insight.analytics.filter-option-limit=10000
 * insight.analytics.max-buckets=1000
 * insight.analytics.top-documents-limit=10
 * insight.analytics.feedback-events-limit=100
 * insight.analytics.default-time-zone=UTC
 * </pre>
 */
public record AnalyticsSettings(
    int filterOptionLimit,
    int maxBuckets,
    int topDocumentsLimit,
    int feedbackEventsLimit,
    String defaultTimeZone
) {
  public static final String RESOURCE = "META-INF/insight-analytics.properties";
  public static final String PREFIX = "insight.analytics.";

  private static final Logger log = LoggerFactory.getLogger(AnalyticsSettings.class);

  private static final AnalyticsSettings DEFAULTS = new AnalyticsSettings(10_000, 1000, 10, 100, "UTC");

  public AnalyticsSettings {
    requirePositive("filterOptionLimit", filterOptionLimit);
    requirePositive("maxBuckets", maxBuckets);
    requirePositive("topDocumentsLimit", topDocumentsLimit);
    requirePositive("feedbackEventsLimit", feedbackEventsLimit);
    defaultTimeZone = (defaultTimeZone == null || defaultTimeZone.isBlank()) ? "UTC" : defaultTimeZone.trim();
    // rendered into SQL as a literal
    if (!ZoneId.getAvailableZoneIds().contains(defaultTimeZone)) {
      throw new IllegalArgumentException("defaultTimeZone is not a known zone id: '" + defaultTimeZone + "'");
    }
  }

  public static AnalyticsSettings defaults() { return DEFAULTS; }

  public static AnalyticsSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static AnalyticsSettings load(ClassLoader cl) {
    if (cl == null) cl = AnalyticsSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in == null) return DEFAULTS;
      Properties p = new Properties();
      p.load(in);
      AnalyticsSettings s = fromProperties(p);
      log.debug("Loaded {} from {}", s, RESOURCE);
      return s;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE, e);
    }
  }

  public static AnalyticsSettings fromProperties(Properties p) {
    return new AnalyticsSettings(
        intProp(p, "filter-option-limit", DEFAULTS.filterOptionLimit),
        intProp(p, "max-buckets", DEFAULTS.maxBuckets),
        intProp(p, "top-documents-limit", DEFAULTS.topDocumentsLimit),
        intProp(p, "feedback-events-limit", DEFAULTS.feedbackEventsLimit),
        p.getProperty(PREFIX + "default-time-zone", DEFAULTS.defaultTimeZone)
    );
  }

  private static int intProp(Properties p, String name, int def) {
    String v = p.getProperty(PREFIX + name);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(PREFIX + name + " must be an integer, got '" + v + "'", e);
    }
  }

  private static void requirePositive(String name, int v) {
    if (v <= 0) throw new IllegalArgumentException(name + " must be > 0, got " + v);
  }
}
