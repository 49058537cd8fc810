package com.ospicorp.forecastapi.forecast.model;

public enum ForecastMethod {
  SMA,
  HW
}
