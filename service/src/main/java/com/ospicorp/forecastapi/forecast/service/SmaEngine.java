package com.ospicorp.forecastapi.forecast.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Simple moving average over a trailing window. Windows below one are treated as one; a window
 * longer than the series shrinks to the series where a value is still meaningful.
 */
public final class SmaEngine {
  private SmaEngine() {
  }

  /**
   * Historical fit: the mean of the {@code window} observations ending at each index, undefined
   * until the first full window and wherever the window holds a missing observation.
   */
  public static List<Double> fit(List<Double> values, int window) {
    double[] y = Sequences.toArray(values);
    int w = Math.max(1, window);
    if (w == 1) {
      return Sequences.toList(y);
    }
    double[] out = Sequences.undefinedArray(y.length);
    // Missing observations are counted, not summed; a window holding one stays undefined.
    double sum = 0d;
    int missing = 0;
    for (int t = 0; t < y.length; t++) {
      if (Double.isFinite(y[t])) {
        sum += y[t];
      } else {
        missing++;
      }
      if (t - w >= 0) {
        if (Double.isFinite(y[t - w])) {
          sum -= y[t - w];
        } else {
          missing--;
        }
      }
      if (t >= w - 1 && missing == 0) {
        out[t] = sum / w;
      }
    }
    return Sequences.toList(out);
  }

  /**
   * One-step-ahead prediction: index t gets the mean of the {@code min(window, t)} observations
   * strictly before it. Index 0 has no history and stays undefined.
   */
  public static List<Double> oneStepAhead(List<Double> values, int window) {
    double[] y = Sequences.toArray(values);
    int w = Math.max(1, window);
    double[] out = Sequences.undefinedArray(y.length);
    for (int t = 1; t < y.length; t++) {
      int span = Math.min(w, t);
      double sum = 0d;
      for (int k = 1; k <= span; k++) {
        sum += y[t - k];
      }
      out[t] = sum / span;
    }
    return Sequences.toList(out);
  }

  /**
   * Flat multi-step forecast: the mean of the last {@code min(window, n)} observations repeated
   * {@code horizon} times. An empty series gives an all-undefined forecast.
   */
  public static List<Double> forecast(List<Double> values, int window, int horizon) {
    int h = Math.max(1, horizon);
    int n = values.size();
    if (n == 0) {
      return Sequences.undefined(h);
    }
    double[] y = Sequences.toArray(values);
    int w = Math.max(1, Math.min(window, n));
    double sum = 0d;
    for (int i = n - w; i < n; i++) {
      sum += y[i];
    }
    double mean = sum / w;
    Double value = Double.isFinite(mean) ? mean : null;
    return new ArrayList<>(Collections.nCopies(h, value));
  }
}
