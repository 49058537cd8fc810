package com.ospicorp.forecastapi.series.model;

import java.time.LocalDate;

// Weekly observation; a null value is a missing observation
public record DataPoint(LocalDate date, Double value) {}
