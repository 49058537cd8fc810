package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

// One CSV line per date: observed weeks carry actual/fit columns, future weeks the forecasts.
@JsonPropertyOrder({"date", "actual", "sma_fit", "sma_one_step_ahead", "sma_forecast", "hw_fit",
    "hw_one_step_ahead", "hw_forecast"})
public record ForecastRow(
    LocalDate date,
    Double actual,
    @JsonProperty("sma_fit") Double smaFit,
    @JsonProperty("sma_one_step_ahead") Double smaOneStepAhead,
    @JsonProperty("sma_forecast") Double smaForecast,
    @JsonProperty("hw_fit") Double hwFit,
    @JsonProperty("hw_one_step_ahead") Double hwOneStepAhead,
    @JsonProperty("hw_forecast") Double hwForecast
) {}
