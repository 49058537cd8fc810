package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.Metric;
import com.ospicorp.forecastapi.forecast.model.MetricResult;
import java.util.List;

/**
 * Error metrics over index-aligned actual/predicted sequences. Pairs with a missing or
 * non-finite side are skipped; MAPE also skips pairs whose actual is zero.
 */
public final class MetricEvaluator {
  private MetricEvaluator() {
  }

  public static MetricResult score(Metric metric, List<Double> actual, List<Double> predicted) {
    Double value = switch (metric) {
      case MAPE -> mape(actual, predicted);
      case RMSE -> rmse(actual, predicted);
    };
    return new MetricResult(metric, value);
  }

  /** Mean absolute percentage error in percent, or {@code null} when nothing is comparable. */
  public static Double mape(List<Double> actual, List<Double> predicted) {
    int pairs = Math.min(actual.size(), predicted.size());
    double sum = 0d;
    int count = 0;
    for (int i = 0; i < pairs; i++) {
      Double a = actual.get(i);
      Double p = predicted.get(i);
      if (!comparable(a, p) || a == 0d) {
        continue;
      }
      sum += Math.abs((a - p) / a);
      count++;
    }
    return count == 0 ? null : (sum / count) * 100d;
  }

  /** Root mean squared error, or {@code null} when nothing is comparable. */
  public static Double rmse(List<Double> actual, List<Double> predicted) {
    int pairs = Math.min(actual.size(), predicted.size());
    double sum = 0d;
    int count = 0;
    for (int i = 0; i < pairs; i++) {
      Double a = actual.get(i);
      Double p = predicted.get(i);
      if (!comparable(a, p)) {
        continue;
      }
      double diff = a - p;
      sum += diff * diff;
      count++;
    }
    return count == 0 ? null : Math.sqrt(sum / count);
  }

  private static boolean comparable(Double a, Double p) {
    return a != null && p != null && Double.isFinite(a) && Double.isFinite(p);
  }
}
