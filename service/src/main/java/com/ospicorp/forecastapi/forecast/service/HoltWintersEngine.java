package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.HoltWintersParams;
import com.ospicorp.forecastapi.forecast.model.HoltWintersResult;
import java.util.List;

/**
 * Additive Holt-Winters smoothing with level, trend and a seasonal component of period
 * {@code s}.
 *
 * <p>State is kept in flat arrays indexed by time. The seasonal estimate at t is derived from
 * the estimate at t - s once a full period has elapsed, and from the initial seasonal table
 * before that:
 *
 * <pre>
 * yhat[t]  = L[t-1] + B[t-1] + S_prev
 * L[t]     = alpha * (y[t] - S_prev) + (1 - alpha) * (L[t-1] + B[t-1])
 * B[t]     = beta * (L[t] - L[t-1]) + (1 - beta) * B[t-1]
 * S[t]     = gamma * (y[t] - L[t]) + (1 - gamma) * S_prev
 * fit[t]   = L[t] + B[t] + S_prev
 * </pre>
 *
 * <p>The in-sample fit uses {@code S_prev}, not the freshly updated {@code S[t]}: only what was
 * known at prediction time enters the seasonal term. Nothing here validates the smoothing
 * constants; the period is floored to 1.
 */
public final class HoltWintersEngine {
  private static final int MAX_TREND_LOOKBACK = 10;

  private HoltWintersEngine() {
  }

  public static HoltWintersResult fit(List<Double> values, HoltWintersParams params) {
    State state = run(Sequences.toArray(values), params);
    return new HoltWintersResult(
        Sequences.toList(state.level),
        Sequences.toList(state.trend),
        Sequences.toList(state.seasonal),
        Sequences.toList(state.fit),
        Sequences.toList(state.oneStepAhead));
  }

  /**
   * Extrapolates the terminal level and trend linearly and adds, for each future step, the most
   * recent seasonal estimate of the same within-period position. Positions never observed
   * contribute zero. An empty series gives an all-undefined forecast.
   */
  public static List<Double> forecast(List<Double> values, HoltWintersParams params, int horizon) {
    int h = Math.max(1, horizon);
    int n = values.size();
    if (n == 0) {
      return Sequences.undefined(h);
    }
    int s = period(params);
    State state = run(Sequences.toArray(values), params);
    double terminalLevel = state.level[n - 1];
    double terminalTrend = state.trend[n - 1];

    double[] lastSeasonal = new double[s];
    boolean[] seen = new boolean[s];
    int seenCount = 0;
    for (int t = n - 1; t >= 0 && seenCount < s; t--) {
      int pos = t % s;
      if (!seen[pos] && Double.isFinite(state.seasonal[t])) {
        lastSeasonal[pos] = state.seasonal[t];
        seen[pos] = true;
        seenCount++;
      }
    }

    double[] out = new double[h];
    for (int step = 1; step <= h; step++) {
      out[step - 1] = terminalLevel + step * terminalTrend + lastSeasonal[(n + step - 1) % s];
    }
    return Sequences.toList(out);
  }

  /**
   * Initial seasonal table: for each within-period position, the mean over all complete periods
   * minus the overall mean. Positions not covered by a complete period fall back to the raw
   * observation at that position, or to the overall mean past the end of the series.
   */
  static double[] initialSeasonals(double[] y, int period) {
    int n = y.length;
    int s = Math.max(1, period);
    int periods = n / s;
    double overallMean = 0d;
    for (double value : y) {
      overallMean += value;
    }
    overallMean /= Math.max(1, n);

    double[] seasonMeans = new double[s];
    int[] counts = new int[s];
    for (int k = 0; k < periods; k++) {
      for (int i = 0; i < s; i++) {
        seasonMeans[i] += y[k * s + i];
        counts[i]++;
      }
    }
    for (int i = 0; i < s; i++) {
      if (counts[i] > 0) {
        seasonMeans[i] /= counts[i];
      } else {
        seasonMeans[i] = i < n ? y[i] : overallMean;
      }
      seasonMeans[i] -= overallMean;
    }
    return seasonMeans;
  }

  private static State run(double[] y, HoltWintersParams params) {
    int n = y.length;
    State state = new State(n);
    if (n == 0) {
      return state;
    }
    int s = period(params);
    double alpha = params.alpha();
    double beta = params.beta();
    double gamma = params.gamma();

    double[] initial = initialSeasonals(y, s);
    double[] level = state.level;
    double[] trend = state.trend;
    double[] seasonal = state.seasonal;

    level[0] = y[0] - initial[0];
    // Bounded lookback keeps the initial slope from chasing noise on long series.
    int span = Math.max(1, Math.min(MAX_TREND_LOOKBACK, n - 1));
    double diffSum = 0d;
    for (int i = 1; i <= span; i++) {
      diffSum += (i < n ? y[i] : Double.NaN) - y[i - 1];
    }
    trend[0] = diffSum / span;

    for (int t = 0; t < Math.min(s, n); t++) {
      seasonal[t] = initial[t];
    }

    for (int t = 1; t < n; t++) {
      double sPrev = t - s >= 0 ? seasonal[t - s] : initial[t % s];
      state.oneStepAhead[t] = level[t - 1] + trend[t - 1] + sPrev;
      double lt = alpha * (y[t] - sPrev) + (1 - alpha) * (level[t - 1] + trend[t - 1]);
      double bt = beta * (lt - level[t - 1]) + (1 - beta) * trend[t - 1];
      double st = gamma * (y[t] - lt) + (1 - gamma) * sPrev;
      level[t] = lt;
      trend[t] = bt;
      seasonal[t] = st;
      state.fit[t] = lt + bt + sPrev;
    }
    state.fit[0] = level[0] + trend[0] + initial[0];
    return state;
  }

  private static int period(HoltWintersParams params) {
    return Math.max(1, params.seasonLength());
  }

  private static final class State {
    final double[] level;
    final double[] trend;
    final double[] seasonal;
    final double[] fit;
    final double[] oneStepAhead;

    State(int n) {
      level = Sequences.undefinedArray(n);
      trend = Sequences.undefinedArray(n);
      seasonal = Sequences.undefinedArray(n);
      fit = Sequences.undefinedArray(n);
      oneStepAhead = Sequences.undefinedArray(n);
    }
  }
}
