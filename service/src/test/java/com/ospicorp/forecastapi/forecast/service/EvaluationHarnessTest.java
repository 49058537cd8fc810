package com.ospicorp.forecastapi.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.forecastapi.forecast.model.EvaluationMode;
import com.ospicorp.forecastapi.forecast.model.EvaluationSummary;
import com.ospicorp.forecastapi.forecast.model.ForecastMethod;
import com.ospicorp.forecastapi.forecast.model.ForecastParameters;
import com.ospicorp.forecastapi.forecast.model.HoltWintersParams;
import com.ospicorp.forecastapi.forecast.model.Metric;
import com.ospicorp.forecastapi.forecast.model.MetricResult;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluationHarnessTest {

  private static final HoltWintersParams HW = new HoltWintersParams(0.3, 0.1, 0.2, 4);

  @Test
  void rollingScoresOneStepAheadPredictions() {
    var input = List.of(1d, 2d, 3d, 4d, 5d);

    Map<ForecastMethod, MetricResult> scores =
        EvaluationHarness.rolling(input, 3, HW, Metric.RMSE);

    assertEquals(Math.sqrt((1d + 2.25d + 4d + 4d) / 4), scores.get(ForecastMethod.SMA).value(),
        1e-9);
    var expectedHw = MetricEvaluator.rmse(input,
        HoltWintersEngine.fit(input, HW).oneStepAhead());
    assertEquals(expectedHw, scores.get(ForecastMethod.HW).value(), 1e-9);
  }

  @Test
  void holdoutClampsHorizonToLeaveOneTrainingValue() {
    var input = List.of(10d, 20d, 30d, 40d, 50d);

    Map<ForecastMethod, MetricResult> scores =
        EvaluationHarness.holdout(input, 10, 2, HW, Metric.RMSE);

    assertEquals(4, EvaluationHarness.holdoutLength(input.size(), 10));
    // the single training value 10 is forecast flat across the four withheld weeks
    assertEquals(Math.sqrt((100d + 400d + 900d + 1600d) / 4),
        scores.get(ForecastMethod.SMA).value(), 1e-9);
    // one observation has no trend, so Holt-Winters cannot forecast
    assertNull(scores.get(ForecastMethod.HW).value());
  }

  @Test
  void holdoutMapeOnFlatForecast() {
    var input = List.of(10d, 20d, 30d, 40d, 50d);

    var scores = EvaluationHarness.holdout(input, 4, 1, HW, Metric.MAPE);

    double expected = (10d / 20 + 20d / 30 + 30d / 40 + 40d / 50) / 4 * 100d;
    assertEquals(expected, scores.get(ForecastMethod.SMA).value(), 1e-9);
  }

  @Test
  void holdoutScoresWithheldSuffix() {
    var input = Collections.nCopies(20, 100d);

    var scores = EvaluationHarness.holdout(input, 6, 4, HW, Metric.RMSE);

    assertEquals(0d, scores.get(ForecastMethod.SMA).value(), 1e-9);
    assertEquals(0d, scores.get(ForecastMethod.HW).value(), 1e-9);
  }

  @Test
  void holdoutLengthBounds() {
    assertEquals(12, EvaluationHarness.holdoutLength(104, 12));
    assertEquals(103, EvaluationHarness.holdoutLength(104, 500));
    assertEquals(1, EvaluationHarness.holdoutLength(104, 0));
    assertEquals(1, EvaluationHarness.holdoutLength(1, 12));
  }

  @Test
  void emptySeriesIsUndefinedForBothModes() {
    for (EvaluationMode mode : EvaluationMode.values()) {
      var params = new ForecastParameters(4, HW, 3, mode, Metric.MAPE);

      EvaluationSummary summary = EvaluationHarness.evaluate(List.of(), params);

      assertNull(summary.holdoutLength());
      assertNull(summary.results().get(ForecastMethod.SMA).value());
      assertNull(summary.results().get(ForecastMethod.HW).value());
    }
  }

  @Test
  void evaluateReportsHoldoutLengthOnlyForHoldout() {
    var input = List.of(5d, 6d, 7d, 8d, 9d, 10d);

    var rolling = EvaluationHarness.evaluate(input,
        new ForecastParameters(2, HW, 3, EvaluationMode.ROLLING, Metric.RMSE));
    var holdout = EvaluationHarness.evaluate(input,
        new ForecastParameters(2, HW, 3, EvaluationMode.HOLDOUT, Metric.RMSE));

    assertNull(rolling.holdoutLength());
    assertEquals(EvaluationMode.ROLLING, rolling.mode());
    assertEquals(3, holdout.holdoutLength());
    assertEquals(Metric.RMSE, holdout.metric());
    assertEquals(2, holdout.results().size());
  }
}
