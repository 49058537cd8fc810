package com.ospicorp.forecastapi.series.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Shape of a generated weekly series. */
public enum DataProfile {
  /** Baseline plus noise. */
  FLAT(0.0, 0.0),
  /** Baseline, linear trend and noise. */
  TREND(3.0, 0.0),
  /** Baseline, linear trend, 52-week sine seasonality and noise. */
  SEASON_TREND(3.0, 0.2);

  private final double trendPerWeek;
  private final double annualAmplitude;

  DataProfile(double trendPerWeek, double annualAmplitude) {
    this.trendPerWeek = trendPerWeek;
    this.annualAmplitude = annualAmplitude;
  }

  public double trendPerWeek() {
    return trendPerWeek;
  }

  public double annualAmplitude() {
    return annualAmplitude;
  }

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
