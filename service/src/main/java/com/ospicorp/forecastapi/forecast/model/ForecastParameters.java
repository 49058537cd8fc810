package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ForecastParameters(
    int window,
    @JsonProperty("holt_winters") HoltWintersParams holtWinters,
    int horizon,
    EvaluationMode mode,
    Metric metric
) {}
