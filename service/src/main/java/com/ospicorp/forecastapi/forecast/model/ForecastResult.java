package com.ospicorp.forecastapi.forecast.model;

import java.util.List;

public record ForecastResult(
    ForecastResponse response,
    List<ForecastRow> rows,
    String etag
) {}
