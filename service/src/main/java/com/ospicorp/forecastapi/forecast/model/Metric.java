package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Metric {
  MAPE,
  RMSE;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
