package com.flamingo.ai.problemscan.service.ocr;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.OcrReading;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("OcrServiceClient Tests")
class OcrServiceClientTest {

  private static final byte[] IMAGE = {1, 2, 3};

  private ScanConfig scanConfig;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    scanConfig = new ScanConfig();
    scanConfig.getOcr().setTimeoutMs(200);
    scanConfig.getOcr().setHealthTimeoutMs(200);
    meterRegistry = new SimpleMeterRegistry();
  }

  @Nested
  @DisplayName("recognize")
  class Recognize {

    @Test
    @DisplayName("Should post the image to /ocr and map the reply")
    void shouldPostImageAndMapReply() {
      AtomicReference<ClientRequest> captured = new AtomicReference<>();
      OcrServiceClient client =
          client(
              request -> {
                captured.set(request);
                return Mono.just(
                    json(
                        HttpStatus.OK,
                        "{\"success\": true, \"text\": \"1. Find x\", \"confidence\": 0.87,"
                            + " \"bboxes\": [[1, 2, 3, 4]]}"));
              });

      OcrReading reading = client.recognize(IMAGE, "sheet.png");

      assertThat(captured.get().url().getPath()).isEqualTo("/ocr");
      assertThat(reading.success()).isTrue();
      assertThat(reading.text()).isEqualTo("1. Find x");
      assertThat(reading.confidence()).isEqualTo(0.87);
      assertThat(reading.bboxes()).containsExactly(new BoundingBox(1, 2, 3, 4));
    }

    @Test
    @DisplayName("Should return a failed reading on non-2xx status")
    void shouldReturnFailedReadingOnErrorStatus() {
      OcrServiceClient client =
          client(request -> Mono.just(json(HttpStatus.INTERNAL_SERVER_ERROR, "{}")));

      OcrReading reading = client.recognize(IMAGE, "sheet.png");

      assertThat(reading).isEqualTo(OcrReading.failed());
      assertThat(meterRegistry.counter("scan.ocr.failures").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return a failed reading on timeout")
    void shouldReturnFailedReadingOnTimeout() {
      OcrServiceClient client = client(request -> Mono.never());

      assertThat(client.recognize(IMAGE, "sheet.png").success()).isFalse();
    }
  }

  @Nested
  @DisplayName("isHealthy")
  class IsHealthy {

    @Test
    @DisplayName("Should be healthy on 200")
    void shouldBeHealthyOn200() {
      OcrServiceClient client = client(request -> Mono.just(json(HttpStatus.OK, "{}")));

      assertThat(client.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Should be unhealthy on 503")
    void shouldBeUnhealthyOn503() {
      OcrServiceClient client =
          client(request -> Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{}")));

      assertThat(client.isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Should be unhealthy when the service does not answer")
    void shouldBeUnhealthyWhenUnreachable() {
      OcrServiceClient client =
          client(request -> Mono.error(new IllegalStateException("connection refused")));

      assertThat(client.isHealthy()).isFalse();
    }
  }

  @Nested
  @DisplayName("parseReading")
  class ParseReading {

    @Test
    @DisplayName("Should default missing fields")
    void shouldDefaultMissingFields() {
      OcrReading reading = OcrServiceClient.parseReading(Map.of("success", true));

      assertThat(reading.success()).isTrue();
      assertThat(reading.text()).isEmpty();
      assertThat(reading.confidence()).isZero();
      assertThat(reading.bboxes()).isEmpty();
    }

    @Test
    @DisplayName("Should read malformed boxes as zero boxes")
    void shouldReadMalformedBoxesAsZero() {
      Map<String, Object> data = new HashMap<>();
      data.put("success", true);
      data.put("text", "text");
      data.put("bboxes", List.of("oops", List.of(5, 6)));

      OcrReading reading = OcrServiceClient.parseReading(data);

      assertThat(reading.bboxes())
          .containsExactly(BoundingBox.ZERO, new BoundingBox(5, 6, 0, 0));
    }

    @Test
    @DisplayName("Should treat a null body as a failure")
    void shouldTreatNullAsFailure() {
      assertThat(OcrServiceClient.parseReading(null)).isEqualTo(OcrReading.failed());
    }
  }

  private OcrServiceClient client(ExchangeFunction exchangeFunction) {
    WebClient webClient =
        WebClient.builder()
            .baseUrl("http://ocr.test")
            .exchangeFunction(exchangeFunction)
            .build();
    return new OcrServiceClient(webClient, scanConfig, meterRegistry);
  }

  private static ClientResponse json(HttpStatus status, String body) {
    return ClientResponse.create(status)
        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .body(body)
        .build();
  }
}
