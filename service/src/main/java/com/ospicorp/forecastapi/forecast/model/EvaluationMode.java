package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EvaluationMode {
  /** One-step-ahead predictions over the whole series, no train/test split. */
  ROLLING,
  /** Multi-step forecast from a training prefix, scored on the withheld suffix. */
  HOLDOUT;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
