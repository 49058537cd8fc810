package com.ospicorp.forecastapi.series.controller;

import com.ospicorp.forecastapi.forecast.controller.ApiParameters;
import com.ospicorp.forecastapi.series.model.DataPoint;
import com.ospicorp.forecastapi.series.model.DataProfile;
import com.ospicorp.forecastapi.series.model.SeriesResponse;
import com.ospicorp.forecastapi.series.service.SeriesProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/series")
@Tag(name = "Series")
public class SeriesController {
  private static final String WEEKLY_FREQUENCY = "W";

  private final SeriesProvider seriesProvider;

  public SeriesController(SeriesProvider seriesProvider) {
    this.seriesProvider = seriesProvider;
  }

  @GetMapping("/{profile}")
  @Operation(summary = "Get a generated weekly series",
      description = "Deterministic synthetic weekly series for one of the built-in profiles.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Data points",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = SeriesResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Unknown profile",
          content = @Content(mediaType = "application/json"))
  })
  public ResponseEntity<?> series(
      @PathVariable @Parameter(description = "Series profile", example = "season_trend")
          String profile,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    DataProfile dataProfile = ApiParameters.parseProfile(profile);
    MediaType contentType = ApiParameters.selectMediaType(format, accept);
    List<DataPoint> points = seriesProvider.weekly(dataProfile);
    Object body = contentType.isCompatibleWith(ApiParameters.CSV_MEDIA_TYPE)
        ? points
        : toResponse(dataProfile, points);
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static SeriesResponse toResponse(DataProfile profile, List<DataPoint> points) {
    List<List<Object>> tuples = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      List<Object> tuple = new ArrayList<>(2);
      tuple.add(point.date() != null ? point.date().toString() : null);
      tuple.add(point.value());
      tuples.add(tuple);
    }
    return new SeriesResponse(
        profile,
        WEEKLY_FREQUENCY,
        points.isEmpty() ? null : points.get(0).date(),
        points.isEmpty() ? null : points.get(points.size() - 1).date(),
        points.size(),
        tuples);
  }
}
