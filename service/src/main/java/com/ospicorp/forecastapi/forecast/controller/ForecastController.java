package com.ospicorp.forecastapi.forecast.controller;

import static com.ospicorp.forecastapi.forecast.controller.ApiParameters.CSV_MEDIA_TYPE;

import com.ospicorp.forecastapi.forecast.model.EvaluationSummary;
import com.ospicorp.forecastapi.forecast.model.ForecastParameters;
import com.ospicorp.forecastapi.forecast.model.ForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ForecastResponse;
import com.ospicorp.forecastapi.forecast.model.ForecastResult;
import com.ospicorp.forecastapi.forecast.service.ForecastService;
import com.ospicorp.forecastapi.series.model.DataPoint;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/forecasts")
@Validated
@Tag(name = "Forecasts")
public class ForecastController {
  static final String CUSTOM_LABEL = "custom";

  private final ForecastService svc;

  public ForecastController(ForecastService svc) {
    this.svc = svc;
  }

  @GetMapping
  @Operation(summary = "Forecast a generated series",
      description = "Fit, one-step-ahead and multi-step forecasts of SMA and additive Holt-Winters "
          + "for a synthetic weekly series, with rolling or holdout evaluation.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "304", description = "Not modified"),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/json"))
  })
  public ResponseEntity<?> forecast(
      @RequestParam(defaultValue = ApiParameters.DEFAULT_PROFILE)
          @Parameter(description = "Series profile", example = "season_trend") String profile,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_WINDOW)
          @Parameter(description = "SMA window (weeks)", example = "8") int window,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_ALPHA)
          @Parameter(description = "Level smoothing constant", example = "0.3") double alpha,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_BETA)
          @Parameter(description = "Trend smoothing constant", example = "0.1") double beta,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_GAMMA)
          @Parameter(description = "Seasonal smoothing constant", example = "0.2") double gamma,
      @RequestParam(name = "season_length", defaultValue = ApiParameters.DEFAULT_SEASON_LENGTH)
          @Parameter(description = "Seasonal period (weeks)", example = "52") int seasonLength,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_HORIZON)
          @Parameter(description = "Forecast horizon and holdout length", example = "12") int horizon,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_MODE)
          @Parameter(description = "Evaluation mode", example = "rolling") String mode,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_METRIC)
          @Parameter(description = "Error metric", example = "mape") String metric,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    var dataProfile = ApiParameters.parseProfile(profile);
    ForecastParameters params = ApiParameters.build(window, alpha, beta, gamma, seasonLength,
        horizon, mode, metric);
    MediaType contentType = ApiParameters.selectMediaType(format, accept);
    return respond(svc.forecast(dataProfile, params), contentType, true);
  }

  @PostMapping
  @Operation(summary = "Forecast a supplied series",
      description = "Same as the GET variant, for a weekly series given in the request body.")
  public ResponseEntity<?> forecastSupplied(@Valid @RequestBody ForecastRequest request,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    ForecastParameters params = fromRequest(request);
    MediaType contentType = ApiParameters.selectMediaType(format, accept);
    List<DataPoint> points = svc.weeklyPoints(request.values(), request.startDate());
    return respond(svc.forecast(CUSTOM_LABEL, points, params), contentType, false);
  }

  @GetMapping("/evaluation")
  @Operation(summary = "Evaluate forecasting methods",
      description = "Per-method error of SMA and Holt-Winters under rolling or holdout evaluation.")
  public EvaluationSummary evaluation(
      @RequestParam(defaultValue = ApiParameters.DEFAULT_PROFILE) String profile,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_WINDOW) int window,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_ALPHA) double alpha,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_BETA) double beta,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_GAMMA) double gamma,
      @RequestParam(name = "season_length", defaultValue = ApiParameters.DEFAULT_SEASON_LENGTH)
          int seasonLength,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_HORIZON) int horizon,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_MODE) String mode,
      @RequestParam(defaultValue = ApiParameters.DEFAULT_METRIC) String metric) {
    var dataProfile = ApiParameters.parseProfile(profile);
    ForecastParameters params = ApiParameters.build(window, alpha, beta, gamma, seasonLength,
        horizon, mode, metric);
    return svc.evaluate(svc.series(dataProfile), params);
  }

  // If-None-Match only short-circuits safe requests; a POST always gets the full body.
  private ResponseEntity<?> respond(ForecastResult result, MediaType contentType,
      boolean conditional) {
    String etag = result.etag();
    String ifNoneMatch = conditional
        ? ApiParameters.currentRequestHeader(HttpHeaders.IF_NONE_MATCH)
        : null;
    if (etag != null && etag.equals(ifNoneMatch)) {
      return ResponseEntity.status(HttpStatus.NOT_MODIFIED)
          .eTag(etag)
          .build();
    }
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE)
        ? result.rows()
        : result.response();
    return ResponseEntity.ok()
        .eTag(etag)
        .contentType(contentType)
        .body(body);
  }

  private static ForecastParameters fromRequest(ForecastRequest request) {
    return ApiParameters.build(
        orDefault(request.window(), Integer.parseInt(ApiParameters.DEFAULT_WINDOW)),
        orDefault(request.alpha(), Double.parseDouble(ApiParameters.DEFAULT_ALPHA)),
        orDefault(request.beta(), Double.parseDouble(ApiParameters.DEFAULT_BETA)),
        orDefault(request.gamma(), Double.parseDouble(ApiParameters.DEFAULT_GAMMA)),
        orDefault(request.seasonLength(), Integer.parseInt(ApiParameters.DEFAULT_SEASON_LENGTH)),
        orDefault(request.horizon(), Integer.parseInt(ApiParameters.DEFAULT_HORIZON)),
        orDefault(request.mode(), ApiParameters.DEFAULT_MODE),
        orDefault(request.metric(), ApiParameters.DEFAULT_METRIC));
  }

  private static <T> T orDefault(T value, T fallback) {
    return value != null ? value : fallback;
  }
}
