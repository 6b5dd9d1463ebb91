package dev.trailanalytics.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the analytics engine.
 *
 * <p>Properties are bound from {@code trail.analytics.*} in application.yml.
 *
 * <ul>
 *   <li>{@code data-root} - directory the manifest and race document paths are resolved against
 *       (default {@code .})
 *   <li>{@code manifest-path} - manifest location relative to the data root (default {@code
 *       data/courses_index.json})
 *   <li>{@code courses-path} - directory, relative to the data root, new race documents are
 *       registered under by the import flow (default {@code data/courses})
 *   <li>{@code default-year} - edition year every panel selects on start-up (default 2025)
 *   <li>{@code closest-match-limit} - number of neighbours returned by the closest-match lookup
 *       (default 5, bounded [1, 50])
 *   <li>{@code chart-top-n} - rank window used by the chart datasets (default 30, bounded [1,
 *       300])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "trail.analytics")
public class AnalyticsProperties {

  private String dataRoot = ".";
  private String manifestPath = "data/courses_index.json";
  private String coursesPath = "data/courses";
  private int defaultYear = 2025;
  private int closestMatchLimit = 5;
  private int chartTopN = 30;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (manifestPath == null || manifestPath.isBlank()) {
      throw new IllegalStateException("trail.analytics.manifest-path must not be blank");
    }
    if (closestMatchLimit < 1 || closestMatchLimit > 50) {
      throw new IllegalStateException(
          "trail.analytics.closest-match-limit must be in [1, 50], got: " + closestMatchLimit);
    }
    if (chartTopN < 1 || chartTopN > 300) {
      throw new IllegalStateException(
          "trail.analytics.chart-top-n must be in [1, 300], got: " + chartTopN);
    }
  }

  public String getDataRoot() {
    return dataRoot;
  }

  public void setDataRoot(String dataRoot) {
    this.dataRoot = dataRoot;
  }

  public String getManifestPath() {
    return manifestPath;
  }

  public void setManifestPath(String manifestPath) {
    this.manifestPath = manifestPath;
  }

  public String getCoursesPath() {
    return coursesPath;
  }

  public void setCoursesPath(String coursesPath) {
    this.coursesPath = coursesPath;
  }

  public int getDefaultYear() {
    return defaultYear;
  }

  public void setDefaultYear(int defaultYear) {
    this.defaultYear = defaultYear;
  }

  public int getClosestMatchLimit() {
    return closestMatchLimit;
  }

  public void setClosestMatchLimit(int closestMatchLimit) {
    this.closestMatchLimit = closestMatchLimit;
  }

  public int getChartTopN() {
    return chartTopN;
  }

  public void setChartTopN(int chartTopN) {
    this.chartTopN = chartTopN;
  }
}
