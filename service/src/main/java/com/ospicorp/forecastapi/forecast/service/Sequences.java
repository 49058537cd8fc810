package com.ospicorp.forecastapi.forecast.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Conversions between the nullable sequences used at the API boundary and the flat arrays the
 * recursions run on.
 */
final class Sequences {
  private Sequences() {
  }

  static double[] toArray(List<Double> values) {
    double[] out = new double[values.size()];
    for (int i = 0; i < out.length; i++) {
      Double value = values.get(i);
      out[i] = value == null ? Double.NaN : value;
    }
    return out;
  }

  static List<Double> toList(double[] values) {
    List<Double> out = new ArrayList<>(values.length);
    for (double value : values) {
      out.add(Double.isFinite(value) ? value : null);
    }
    return out;
  }

  static double[] undefinedArray(int size) {
    double[] out = new double[size];
    Arrays.fill(out, Double.NaN);
    return out;
  }

  static List<Double> undefined(int size) {
    return new ArrayList<>(Collections.nCopies(Math.max(0, size), (Double) null));
  }
}
