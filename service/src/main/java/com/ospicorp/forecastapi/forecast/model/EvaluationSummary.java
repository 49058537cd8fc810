package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationSummary(
    EvaluationMode mode,
    Metric metric,
    @JsonProperty("holdout_length") Integer holdoutLength,
    Map<ForecastMethod, MetricResult> results
) {}
