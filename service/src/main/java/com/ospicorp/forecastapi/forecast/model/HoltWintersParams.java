package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Smoothing constants for additive Holt-Winters. Values are taken as given; range checks belong
 * to whoever supplies them.
 */
public record HoltWintersParams(
    double alpha,
    double beta,
    double gamma,
    @JsonProperty("season_length") int seasonLength
) {}
