package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.EvaluationMode;
import com.ospicorp.forecastapi.forecast.model.EvaluationSummary;
import com.ospicorp.forecastapi.forecast.model.ForecastMethod;
import com.ospicorp.forecastapi.forecast.model.ForecastParameters;
import com.ospicorp.forecastapi.forecast.model.HoltWintersParams;
import com.ospicorp.forecastapi.forecast.model.Metric;
import com.ospicorp.forecastapi.forecast.model.MetricResult;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class EvaluationHarness {
  private EvaluationHarness() {
  }

  public static EvaluationSummary evaluate(List<Double> values, ForecastParameters params) {
    return switch (params.mode()) {
      case ROLLING -> new EvaluationSummary(EvaluationMode.ROLLING, params.metric(), null,
          rolling(values, params.window(), params.holtWinters(), params.metric()));
      case HOLDOUT -> new EvaluationSummary(EvaluationMode.HOLDOUT, params.metric(),
          values.isEmpty() ? null : holdoutLength(values.size(), params.horizon()),
          holdout(values, params.horizon(), params.window(), params.holtWinters(),
              params.metric()));
    };
  }

  /**
   * Scores each method's one-step-ahead predictions against the full series. There is no
   * train/test split: every prediction only uses observations before its own index.
   */
  public static Map<ForecastMethod, MetricResult> rolling(List<Double> values, int window,
      HoltWintersParams hw, Metric metric) {
    Map<ForecastMethod, MetricResult> out = new EnumMap<>(ForecastMethod.class);
    out.put(ForecastMethod.SMA,
        MetricEvaluator.score(metric, values, SmaEngine.oneStepAhead(values, window)));
    out.put(ForecastMethod.HW,
        MetricEvaluator.score(metric, values, HoltWintersEngine.fit(values, hw).oneStepAhead()));
    return out;
  }

  /**
   * Forecasts the last {@code holdoutLength(n, horizon)} observations from the prefix before
   * them and scores the forecast against the withheld values.
   */
  public static Map<ForecastMethod, MetricResult> holdout(List<Double> values, int horizon,
      int window, HoltWintersParams hw, Metric metric) {
    Map<ForecastMethod, MetricResult> out = new EnumMap<>(ForecastMethod.class);
    int n = values.size();
    if (n == 0) {
      out.put(ForecastMethod.SMA, MetricResult.undefined(metric));
      out.put(ForecastMethod.HW, MetricResult.undefined(metric));
      return out;
    }
    int h = holdoutLength(n, horizon);
    List<Double> train = values.subList(0, n - h);
    List<Double> test = values.subList(n - h, n);
    out.put(ForecastMethod.SMA,
        MetricEvaluator.score(metric, test, SmaEngine.forecast(train, window, h)));
    out.put(ForecastMethod.HW,
        MetricEvaluator.score(metric, test, HoltWintersEngine.forecast(train, hw, h)));
    return out;
  }

  /** Holdout length clamped to [1, n - 1]; a series of two or more keeps a non-empty prefix. */
  public static int holdoutLength(int n, int horizon) {
    return Math.max(1, Math.min(horizon, n - 1));
  }
}
