package com.ospicorp.forecastapi.forecast.controller;

import com.ospicorp.forecastapi.forecast.model.EvaluationMode;
import com.ospicorp.forecastapi.forecast.model.ForecastParameters;
import com.ospicorp.forecastapi.forecast.model.HoltWintersParams;
import com.ospicorp.forecastapi.forecast.model.Metric;
import com.ospicorp.forecastapi.series.model.DataProfile;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.http.MediaType;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Parsing and range checks for request parameters shared by the series and forecast endpoints.
 * The engines accept anything; this is where out-of-range input is rejected.
 */
public final class ApiParameters {
  public static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  static final String DEFAULT_PROFILE = "season_trend";
  static final String DEFAULT_WINDOW = "8";
  static final String DEFAULT_ALPHA = "0.3";
  static final String DEFAULT_BETA = "0.1";
  static final String DEFAULT_GAMMA = "0.2";
  static final String DEFAULT_SEASON_LENGTH = "52";
  static final String DEFAULT_HORIZON = "12";
  static final String DEFAULT_MODE = "rolling";
  static final String DEFAULT_METRIC = "mape";

  static final int MAX_WINDOW = 520;
  static final int MAX_SEASON_LENGTH = 520;
  static final int MAX_HORIZON = 260;

  private ApiParameters() {
  }

  public static DataProfile parseProfile(String value) {
    try {
      return DataProfile.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid profile. Supported values: flat,trend,season_trend.", 2001);
    }
  }

  static EvaluationMode parseMode(String value) {
    try {
      return EvaluationMode.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid evaluation mode. Supported values: rolling,holdout.", 2002);
    }
  }

  static Metric parseMetric(String value) {
    try {
      return Metric.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid metric. Supported values: mape,rmse.", 2003);
    }
  }

  static ForecastParameters build(int window, double alpha, double beta, double gamma,
      int seasonLength, int horizon, String mode, String metric) {
    if (window < 1 || window > MAX_WINDOW) {
      throw invalidParameter(
          "Invalid window parameter. Supported range: 1-" + MAX_WINDOW + ".", 2005);
    }
    if (seasonLength < 1 || seasonLength > MAX_SEASON_LENGTH) {
      throw invalidParameter(
          "Invalid season_length parameter. Supported range: 1-" + MAX_SEASON_LENGTH + ".", 2006);
    }
    if (horizon < 1 || horizon > MAX_HORIZON) {
      throw invalidParameter(
          "Invalid horizon parameter. Supported range: 1-" + MAX_HORIZON + ".", 2007);
    }
    validateSmoothing("alpha", alpha);
    validateSmoothing("beta", beta);
    validateSmoothing("gamma", gamma);
    return new ForecastParameters(window, new HoltWintersParams(alpha, beta, gamma, seasonLength),
        horizon, parseMode(mode), parseMetric(metric));
  }

  public static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 2004);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  public static String currentRequestHeader(String headerName) {
    RequestAttributes attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletRequestAttributes) {
      return servletRequestAttributes.getRequest().getHeader(headerName);
    }
    return null;
  }

  static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }

  private static void validateSmoothing(String name, double value) {
    if (!(value > 0d && value < 1d)) {
      throw invalidParameter(
          "Invalid " + name + " parameter. Must be strictly between 0 and 1.", 2008);
    }
  }
}
