package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record MethodResult(
    List<Double> fit,
    @JsonProperty("one_step_ahead") List<Double> oneStepAhead,
    List<List<Object>> forecast
) {}
