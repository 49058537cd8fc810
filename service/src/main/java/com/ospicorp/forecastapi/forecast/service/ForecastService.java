package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.EvaluationSummary;
import com.ospicorp.forecastapi.forecast.model.ForecastMethod;
import com.ospicorp.forecastapi.forecast.model.ForecastParameters;
import com.ospicorp.forecastapi.forecast.model.ForecastResponse;
import com.ospicorp.forecastapi.forecast.model.ForecastResult;
import com.ospicorp.forecastapi.forecast.model.ForecastRow;
import com.ospicorp.forecastapi.forecast.model.HoltWintersParams;
import com.ospicorp.forecastapi.forecast.model.HoltWintersResult;
import com.ospicorp.forecastapi.forecast.model.MethodResult;
import com.ospicorp.forecastapi.series.model.DataPoint;
import com.ospicorp.forecastapi.series.model.DataProfile;
import com.ospicorp.forecastapi.series.service.SeriesProvider;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

@Service
public class ForecastService {

  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);
  static final String WEEKLY_FREQUENCY = "W";
  private static final Period STEP = Period.ofWeeks(1);

  private final SeriesProvider seriesProvider;
  private final LocalDate defaultStartDate;

  public ForecastService(SeriesProvider seriesProvider,
      @Value("${forecast.series.start-date:2024-01-07}") String defaultStartDate) {
    this.seriesProvider = seriesProvider;
    this.defaultStartDate = LocalDate.parse(defaultStartDate);
  }

  public List<DataPoint> series(DataProfile profile) {
    return seriesProvider.weekly(profile);
  }

  /** Dates caller-supplied values one week apart, starting at {@code start} or the default. */
  public List<DataPoint> weeklyPoints(List<Double> values, LocalDate start) {
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("values must contain at least one observation");
    }
    LocalDate current = start != null ? start : defaultStartDate;
    List<DataPoint> points = new ArrayList<>(values.size());
    for (Double value : values) {
      points.add(new DataPoint(current, value));
      current = current.plus(STEP);
    }
    return points;
  }

  public ForecastResult forecast(DataProfile profile, ForecastParameters params) {
    return forecast(profile.code(), series(profile), params);
  }

  public ForecastResult forecast(String label, List<DataPoint> points,
      ForecastParameters params) {
    List<Double> values = values(points);
    HoltWintersParams hw = params.holtWinters();
    int window = params.window();
    int horizon = params.horizon();

    List<Double> smaFit = SmaEngine.fit(values, window);
    List<Double> smaOsa = SmaEngine.oneStepAhead(values, window);
    List<Double> smaForecast = SmaEngine.forecast(values, window, horizon);
    HoltWintersResult hwState = HoltWintersEngine.fit(values, hw);
    List<Double> hwForecast = HoltWintersEngine.forecast(values, hw, horizon);
    EvaluationSummary evaluation = EvaluationHarness.evaluate(values, params);

    List<LocalDate> futureDates = futureDates(points, smaForecast.size());
    Map<ForecastMethod, MethodResult> methods = new LinkedHashMap<>();
    methods.put(ForecastMethod.SMA,
        new MethodResult(smaFit, smaOsa, tuples(futureDates, smaForecast)));
    methods.put(ForecastMethod.HW,
        new MethodResult(hwState.fit(), hwState.oneStepAhead(), tuples(futureDates, hwForecast)));

    LocalDate firstDate = points.isEmpty() ? null : points.get(0).date();
    LocalDate lastDate = points.isEmpty() ? null : points.get(points.size() - 1).date();
    ForecastResponse response = new ForecastResponse(label, WEEKLY_FREQUENCY, firstDate, lastDate,
        points.size(), params, pointTuples(points), methods, evaluation);

    List<ForecastRow> rows = buildRows(points, futureDates, smaFit, smaOsa, smaForecast,
        hwState, hwForecast);
    String etag = computeEtag(label, params, points);

    log.debug("Forecast {} over {} points: window={} hw={} horizon={} {} {} -> {}", label,
        points.size(), window, hw, horizon, params.mode().code(), params.metric().code(),
        evaluation.results());
    return new ForecastResult(response, rows, etag);
  }

  public EvaluationSummary evaluate(List<DataPoint> points, ForecastParameters params) {
    return EvaluationHarness.evaluate(values(points), params);
  }

  static List<Double> values(List<DataPoint> points) {
    List<Double> values = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      values.add(point.value());
    }
    return values;
  }

  static List<List<Object>> pointTuples(List<DataPoint> points) {
    List<List<Object>> tuples = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      List<Object> tuple = new ArrayList<>(2);
      tuple.add(point.date() != null ? point.date().toString() : null);
      tuple.add(point.value());
      tuples.add(tuple);
    }
    return tuples;
  }

  private static List<List<Object>> tuples(List<LocalDate> dates, List<Double> values) {
    List<List<Object>> tuples = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      LocalDate date = i < dates.size() ? dates.get(i) : null;
      List<Object> tuple = new ArrayList<>(2);
      tuple.add(date != null ? date.toString() : null);
      tuple.add(values.get(i));
      tuples.add(tuple);
    }
    return tuples;
  }

  private static List<LocalDate> futureDates(List<DataPoint> points, int horizon) {
    List<LocalDate> dates = new ArrayList<>(horizon);
    if (points.isEmpty() || points.get(points.size() - 1).date() == null) {
      return dates;
    }
    LocalDate last = points.get(points.size() - 1).date();
    for (int h = 1; h <= horizon; h++) {
      dates.add(last.plus(STEP.multipliedBy(h)));
    }
    return dates;
  }

  private static List<ForecastRow> buildRows(List<DataPoint> points, List<LocalDate> futureDates,
      List<Double> smaFit, List<Double> smaOsa, List<Double> smaForecast,
      HoltWintersResult hwState, List<Double> hwForecast) {
    List<ForecastRow> rows = new ArrayList<>(points.size() + futureDates.size());
    for (int t = 0; t < points.size(); t++) {
      DataPoint point = points.get(t);
      rows.add(new ForecastRow(point.date(), point.value(), smaFit.get(t), smaOsa.get(t), null,
          hwState.fit().get(t), hwState.oneStepAhead().get(t), null));
    }
    for (int h = 0; h < futureDates.size(); h++) {
      rows.add(new ForecastRow(futureDates.get(h), null, null, null, smaForecast.get(h), null,
          null, hwForecast.get(h)));
    }
    return rows;
  }

  private String computeEtag(String label, ForecastParameters params, List<DataPoint> points) {
    HoltWintersParams hw = params.holtWinters();
    StringBuilder builder = new StringBuilder();
    builder.append(Objects.toString(label, "")).append('|')
        .append(params.window()).append('|')
        .append(hw.alpha()).append('|')
        .append(hw.beta()).append('|')
        .append(hw.gamma()).append('|')
        .append(hw.seasonLength()).append('|')
        .append(params.horizon()).append('|')
        .append(params.mode().name()).append('|')
        .append(params.metric().name()).append('|')
        .append(points.size());

    for (DataPoint point : points) {
      builder.append('|')
          .append(point.date() != null ? point.date().toString() : "")
          .append('=');
      Double value = point.value();
      if (value != null) {
        builder.append(value);
      }
    }

    byte[] bytes = builder.toString().getBytes(StandardCharsets.UTF_8);
    return "\"" + DigestUtils.md5DigestAsHex(bytes) + "\"";
  }
}
