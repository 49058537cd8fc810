package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

/**
 * Body of a forecast request for a caller-supplied weekly series. Parameters left out fall back
 * to the same defaults as the query-string endpoints. Every observation must be present.
 */
public record ForecastRequest(
    @NotEmpty List<@NotNull Double> values,
    @JsonProperty("start_date") LocalDate startDate,
    Integer window,
    Double alpha,
    Double beta,
    Double gamma,
    @JsonProperty("season_length") Integer seasonLength,
    Integer horizon,
    String mode,
    String metric
) {}
