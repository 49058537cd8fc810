package com.ospicorp.forecastapi.forecast.model;

import java.util.List;

/**
 * Smoothing state of one Holt-Winters run. Every list has the length of the input series and
 * holds {@code null} where the value is undefined.
 */
public record HoltWintersResult(
    List<Double> level,
    List<Double> trend,
    List<Double> seasonal,
    List<Double> fit,
    List<Double> oneStepAhead
) {}
