package com.ospicorp.forecastapi.series.service;

import com.ospicorp.forecastapi.series.model.DataPoint;
import com.ospicorp.forecastapi.series.model.DataProfile;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Deterministic weekly sales-like series. Every call with the same profile and configuration
 * yields the same points, so generated series are safe to cache and compare.
 */
@Component
public class SyntheticSeriesProvider implements SeriesProvider {

  private static final Logger log = LoggerFactory.getLogger(SyntheticSeriesProvider.class);
  private static final double BASELINE = 500.0;
  private static final double NOISE_SPAN = 40.0;
  private static final double FLOOR = 50.0;
  private static final int WEEKS_PER_YEAR = 52;
  private static final Period STEP = Period.ofWeeks(1);

  private final LocalDate startDate;
  private final int weeks;
  private final long seed;

  public SyntheticSeriesProvider(
      @Value("${forecast.series.start-date:2024-01-07}") String startDate,
      @Value("${forecast.series.weeks:104}") int weeks,
      @Value("${forecast.series.seed:42}") long seed) {
    if (weeks < 1) {
      throw new IllegalArgumentException("forecast.series.weeks must be at least 1");
    }
    this.startDate = LocalDate.parse(startDate);
    this.weeks = weeks;
    this.seed = seed;
  }

  @Override
  public List<DataPoint> weekly(DataProfile profile) {
    LinearCongruential rng = new LinearCongruential(seed);
    List<DataPoint> points = new ArrayList<>(weeks);
    LocalDate current = startDate;
    for (int w = 0; w < weeks; w++) {
      double annual = 1 + profile.annualAmplitude()
          * Math.sin((2.0 * Math.PI * w) / WEEKS_PER_YEAR);
      double trend = profile.trendPerWeek() * w;
      double noise = (rng.next() - 0.5) * NOISE_SPAN;
      double rawValue = Math.max(FLOOR, (BASELINE + trend) * annual + noise);
      points.add(new DataPoint(current, roundToCents(rawValue)));
      current = current.plus(STEP);
    }
    log.debug("Generated {} weekly points for profile {} starting {}", weeks, profile.code(),
        startDate);
    return points;
  }

  // Rounds the exact binary value, so 0.015 (stored just below the tie) becomes 0.01.
  static double roundToCents(double value) {
    return new BigDecimal(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  // Small fixed-constant LCG; reproduces the demo series exactly across platforms.
  private static final class LinearCongruential {
    private static final long MULTIPLIER = 9301L;
    private static final long INCREMENT = 49297L;
    private static final long MODULUS = 233280L;

    private long state;

    LinearCongruential(long seed) {
      this.state = seed;
    }

    double next() {
      state = Math.floorMod(state * MULTIPLIER + INCREMENT, MODULUS);
      return (double) state / MODULUS;
    }
  }
}
