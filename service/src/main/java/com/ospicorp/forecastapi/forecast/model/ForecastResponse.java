package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResponse(
    String profile,
    @JsonProperty("freq") String frequency,
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    @JsonProperty("point_count") int pointCount,
    ForecastParameters parameters,
    List<List<Object>> points,
    Map<ForecastMethod, MethodResult> methods,
    EvaluationSummary evaluation
) {}
