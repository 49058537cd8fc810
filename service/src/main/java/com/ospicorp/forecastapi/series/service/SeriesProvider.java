package com.ospicorp.forecastapi.series.service;

import com.ospicorp.forecastapi.series.model.DataPoint;
import com.ospicorp.forecastapi.series.model.DataProfile;
import java.util.List;

/**
 * Source of weekly series. Points are returned in time order, one per week; only the values
 * feed the forecasting engines.
 */
public interface SeriesProvider {

  List<DataPoint> weekly(DataProfile profile);
}
