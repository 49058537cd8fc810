package com.ospicorp.forecastapi.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.forecastapi.forecast.model.EvaluationMode;
import com.ospicorp.forecastapi.forecast.model.ForecastMethod;
import com.ospicorp.forecastapi.forecast.model.ForecastParameters;
import com.ospicorp.forecastapi.forecast.model.ForecastResult;
import com.ospicorp.forecastapi.forecast.model.ForecastRow;
import com.ospicorp.forecastapi.forecast.model.HoltWintersParams;
import com.ospicorp.forecastapi.forecast.model.Metric;
import com.ospicorp.forecastapi.series.model.DataPoint;
import com.ospicorp.forecastapi.series.model.DataProfile;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ForecastServiceTest {

  private static final ForecastParameters PARAMS = new ForecastParameters(2,
      new HoltWintersParams(0.3, 0.1, 0.2, 4), 3, EvaluationMode.ROLLING, Metric.MAPE);

  private final List<DataPoint> series = weekly(LocalDate.of(2024, 1, 7),
      List.of(10d, 12d, 14d, 13d, 11d, 13d, 15d, 14d));
  private final ForecastService service = new ForecastService(profile -> series, "2024-01-07");

  @Test
  void forecastContinuesWeeklyAfterLastObservation() {
    ForecastResult result = service.forecast(DataProfile.TREND, PARAMS);

    var response = result.response();
    assertEquals("trend", response.profile());
    assertEquals("W", response.frequency());
    assertEquals(LocalDate.of(2024, 1, 7), response.startDate());
    assertEquals(LocalDate.of(2024, 2, 25), response.endDate());
    assertEquals(8, response.pointCount());

    var sma = response.methods().get(ForecastMethod.SMA);
    assertEquals(8, sma.fit().size());
    assertEquals(8, sma.oneStepAhead().size());
    assertEquals(3, sma.forecast().size());
    assertEquals(List.of("2024-03-03", 14.5d), sma.forecast().get(0));
    assertEquals("2024-03-17", sma.forecast().get(2).get(0));

    var hw = response.methods().get(ForecastMethod.HW);
    assertEquals(3, hw.forecast().size());
    assertNotNull(response.evaluation().results().get(ForecastMethod.HW).value());
  }

  @Test
  void csvRowsCoverHistoryThenForecast() {
    List<ForecastRow> rows = service.forecast(DataProfile.TREND, PARAMS).rows();

    assertEquals(11, rows.size());
    ForecastRow first = rows.get(0);
    assertEquals(10d, first.actual());
    assertNull(first.smaFit());
    assertNull(first.smaForecast());
    ForecastRow future = rows.get(8);
    assertEquals(LocalDate.of(2024, 3, 3), future.date());
    assertNull(future.actual());
    assertEquals(14.5d, future.smaForecast());
    assertNotNull(future.hwForecast());
  }

  @Test
  void etagTracksParametersAndData() {
    String etag = service.forecast(DataProfile.TREND, PARAMS).etag();

    assertEquals(etag, service.forecast(DataProfile.TREND, PARAMS).etag());
    assertTrue(etag.startsWith("\"") && etag.endsWith("\""));

    var otherParams = new ForecastParameters(3, PARAMS.holtWinters(), 3, EvaluationMode.ROLLING,
        Metric.MAPE);
    assertNotEquals(etag, service.forecast(DataProfile.TREND, otherParams).etag());

    var otherSeries = new ArrayList<>(series);
    otherSeries.set(3, new DataPoint(otherSeries.get(3).date(), 99d));
    assertNotEquals(etag, service.forecast("trend", otherSeries, PARAMS).etag());
  }

  @Test
  void weeklyPointsUseDefaultStartDate() {
    List<DataPoint> points = service.weeklyPoints(List.of(1d, 2d, 3d), null);

    assertEquals(LocalDate.of(2024, 1, 7), points.get(0).date());
    assertEquals(LocalDate.of(2024, 1, 21), points.get(2).date());

    List<DataPoint> shifted = service.weeklyPoints(List.of(1d), LocalDate.of(2025, 6, 1));
    assertEquals(LocalDate.of(2025, 6, 1), shifted.get(0).date());
  }

  @Test
  void weeklyPointsRejectEmptyValues() {
    assertThrows(IllegalArgumentException.class, () -> service.weeklyPoints(List.of(), null));
  }

  @Test
  void holdoutEvaluationReportsEffectiveLength() {
    var params = new ForecastParameters(2, PARAMS.holtWinters(), 50, EvaluationMode.HOLDOUT,
        Metric.RMSE);

    var summary = service.evaluate(series, params);

    assertEquals(7, summary.holdoutLength());
    assertEquals(EvaluationMode.HOLDOUT, summary.mode());
  }

  private static List<DataPoint> weekly(LocalDate start, List<Double> values) {
    List<DataPoint> out = new ArrayList<>();
    for (int i = 0; i < values.size(); i++) {
      out.add(new DataPoint(start.plusWeeks(i), values.get(i)));
    }
    return out;
  }
}
