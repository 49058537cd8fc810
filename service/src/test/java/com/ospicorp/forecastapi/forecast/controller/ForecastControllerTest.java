package com.ospicorp.forecastapi.forecast.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ForecastControllerTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void defaultForecastCoversBothMethods() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/forecasts", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getETag()).isNotBlank();
    Map<String, Object> body = map(response.getBody());
    assertThat(body).isNotNull();
    assertThat(body.get("profile")).isEqualTo("season_trend");
    assertThat(body.get("point_count")).isEqualTo(104);
    assertThat(body.get("start_date")).isEqualTo("2024-01-07");

    Map<String, Object> methods = map(body.get("methods"));
    assertThat(methods).containsKeys("SMA", "HW");
    Map<String, Object> sma = map(methods.get("SMA"));
    assertThat((List<?>) sma.get("fit")).hasSize(104);
    assertThat((List<?>) sma.get("one_step_ahead")).hasSize(104);
    assertThat((List<?>) sma.get("forecast")).hasSize(12);

    Map<String, Object> evaluation = map(body.get("evaluation"));
    assertThat(evaluation.get("mode")).isEqualTo("rolling");
    assertThat(evaluation.get("metric")).isEqualTo("mape");
    Map<String, Object> parameters = map(body.get("parameters"));
    assertThat(parameters.get("mode")).isEqualTo("rolling");
    assertThat(parameters.get("metric")).isEqualTo("mape");
    assertThat(evaluation).doesNotContainKey("holdout_length");
  }

  @Test
  void holdoutEvaluationEndpoint() {
    ResponseEntity<Map> response = rest.getForEntity(
        "/v1/forecasts/evaluation?profile=trend&mode=holdout&metric=rmse&horizon=8", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = map(response.getBody());
    assertThat(body).isNotNull();
    assertThat(body.get("holdout_length")).isEqualTo(8);
    assertThat(body.get("metric")).isEqualTo("rmse");
    Map<String, Object> results = map(body.get("results"));
    assertThat(map(results.get("SMA")).get("metric")).isEqualTo("rmse");
    assertThat(map(results.get("SMA"))).containsKey("value");
    assertThat(map(results.get("HW")).get("value")).isInstanceOf(Number.class);
  }

  @Test
  void csvFormatListsHistoryAndForecastRows() {
    ResponseEntity<String> response = rest.getForEntity(
        "/v1/forecasts?profile=flat&horizon=4&format=csv", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().isCompatibleWith(MediaType.valueOf("text/csv")))
        .isTrue();
    String[] lines = response.getBody().trim().split("\n");
    assertThat(lines[0].trim()).isEqualTo(
        "date,actual,sma_fit,sma_one_step_ahead,sma_forecast,hw_fit,hw_one_step_ahead,hw_forecast");
    assertThat(lines).hasSize(1 + 104 + 4);
    assertThat(lines[1]).startsWith("2024-01-07,515.44,");
  }

  @Test
  void acceptHeaderSelectsCsv() {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.ACCEPT, "text/csv");

    ResponseEntity<String> response = rest.exchange("/v1/forecasts?horizon=2", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).startsWith("date,actual,");
  }

  @Test
  void matchingEtagReturnsNotModified() {
    ResponseEntity<String> first = rest.getForEntity("/v1/forecasts?window=4", String.class);
    String etag = first.getHeaders().getETag();
    assertThat(etag).isNotBlank();

    HttpHeaders headers = new HttpHeaders();
    headers.setIfNoneMatch(etag);
    ResponseEntity<String> second = rest.exchange("/v1/forecasts?window=4", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);

    assertThat(second.getStatusCode()).isEqualTo(HttpStatus.NOT_MODIFIED);
    assertThat(second.getBody()).isNull();

    ResponseEntity<String> changed = rest.exchange("/v1/forecasts?window=5", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);
    assertThat(changed.getStatusCode()).isEqualTo(HttpStatus.OK);
  }

  @Test
  void suppliedSeriesIsForecast() {
    Map<String, Object> request = Map.of(
        "values", List.of(10, 12, 14, 13, 11, 13, 15, 14),
        "start_date", "2025-01-05",
        "window", 2,
        "season_length", 4,
        "horizon", 3);

    ResponseEntity<Map> response = rest.postForEntity("/v1/forecasts", request, Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = map(response.getBody());
    assertThat(body).isNotNull();
    assertThat(body.get("profile")).isEqualTo("custom");
    assertThat(body.get("point_count")).isEqualTo(8);
    assertThat(body.get("end_date")).isEqualTo("2025-02-23");
    Map<String, Object> sma = map(map(body.get("methods")).get("SMA"));
    assertThat((List<?>) sma.get("forecast")).first()
        .isEqualTo(List.of("2025-03-02", 14.5));
  }

  @Test
  void missingObservationInSuppliedSeriesIsRejected() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/forecasts",
        Map.of("values", Arrays.asList(1, null, 3)), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
    assertThat(map(response.getBody())).containsEntry("status", 400);
  }

  @Test
  void postIgnoresIfNoneMatch() {
    Map<String, Object> request = Map.of("values", List.of(5, 6, 7, 8), "horizon", 2);
    ResponseEntity<String> first = rest.postForEntity("/v1/forecasts", request, String.class);
    String etag = first.getHeaders().getETag();
    assertThat(etag).isNotBlank();

    HttpHeaders headers = new HttpHeaders();
    headers.setIfNoneMatch(etag);
    ResponseEntity<String> second = rest.postForEntity("/v1/forecasts",
        new HttpEntity<>(request, headers), String.class);

    assertThat(second.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(second.getBody()).contains("\"point_count\":4");
  }

  @Test
  void emptySuppliedSeriesIsRejected() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/forecasts",
        Map.of("values", List.of()), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void unknownModeReturnsErrorCode() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/forecasts?mode=expanding", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(map(response.getBody())).containsEntry("errorCode", 2002);
    assertThat(map(response.getBody())).containsEntry("path", "/v1/forecasts");
    assertThat(map(response.getBody()).get("moreInfo").toString()).endsWith("/2002");
  }

  @Test
  void unknownMetricReturnsErrorCode() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/forecasts/evaluation?metric=mae",
        Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(map(response.getBody())).containsEntry("errorCode", 2003);
  }

  @Test
  void outOfRangeParametersAreRejected() {
    assertThat(map(rest.getForEntity("/v1/forecasts?window=0", Map.class).getBody()))
        .containsEntry("errorCode", 2005);
    assertThat(map(rest.getForEntity("/v1/forecasts?season_length=521", Map.class).getBody()))
        .containsEntry("errorCode", 2006);
    assertThat(map(rest.getForEntity("/v1/forecasts?horizon=0", Map.class).getBody()))
        .containsEntry("errorCode", 2007);
    assertThat(map(rest.getForEntity("/v1/forecasts?alpha=1", Map.class).getBody()))
        .containsEntry("errorCode", 2008);
    assertThat(map(rest.getForEntity("/v1/forecasts?format=xml", Map.class).getBody()))
        .containsEntry("errorCode", 2004);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> map(Object value) {
    return (Map<String, Object>) value;
  }
}
