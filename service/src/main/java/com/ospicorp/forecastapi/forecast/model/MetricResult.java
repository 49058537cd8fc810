package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Score produced by a metric. A {@code null} value means no actual/predicted pair survived
 * filtering, which is not the same thing as a perfect score of zero.
 */
public record MetricResult(Metric metric, Double value) {

  public static MetricResult undefined(Metric metric) {
    return new MetricResult(metric, null);
  }

  @JsonIgnore
  public boolean isDefined() {
    return value != null;
  }
}
