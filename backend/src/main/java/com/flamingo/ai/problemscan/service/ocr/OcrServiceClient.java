package com.flamingo.ai.problemscan.service.ocr;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.OcrReading;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the external OCR service. Posts the image as multipart to {@code /ocr} and
 * shapes the JSON reply into an {@link OcrReading}.
 */
@Component
@Slf4j
public class OcrServiceClient implements OcrEngine {

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final MeterRegistry meterRegistry;
  private final int timeoutMs;
  private final int healthTimeoutMs;

  public OcrServiceClient(ScanConfig scanConfig, MeterRegistry meterRegistry) {
    this(
        WebClient.builder()
            .baseUrl(scanConfig.getOcr().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build(),
        scanConfig,
        meterRegistry);
    log.info("OCR client initialized: baseUrl={}", scanConfig.getOcr().getBaseUrl());
  }

  OcrServiceClient(WebClient webClient, ScanConfig scanConfig, MeterRegistry meterRegistry) {
    this.webClient = webClient;
    this.meterRegistry = meterRegistry;
    this.timeoutMs = scanConfig.getOcr().getTimeoutMs();
    this.healthTimeoutMs = scanConfig.getOcr().getHealthTimeoutMs();
  }

  @Override
  @Timed(value = "scan.ocr", description = "Time for OCR service calls")
  public OcrReading recognize(byte[] image, String filename) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part(
        "file",
        new ByteArrayResource(image) {
          @Override
          public String getFilename() {
            return filename;
          }
        });

    try {
      Map<String, Object> response =
          webClient
              .post()
              .uri("/ocr")
              .contentType(MediaType.MULTIPART_FORM_DATA)
              .body(BodyInserters.fromMultipartData(body.build()))
              .retrieve()
              .bodyToMono(JSON_MAP)
              .timeout(Duration.ofMillis(timeoutMs))
              .block();

      OcrReading reading = parseReading(response);
      log.debug(
          "OCR finished for {}: success={}, chars={}, confidence={}",
          filename,
          reading.success(),
          reading.text().length(),
          reading.confidence());
      return reading;
    } catch (RuntimeException e) {
      log.warn("OCR service call failed for {}: {}", filename, e.getMessage());
      meterRegistry.counter("scan.ocr.failures").increment();
      return OcrReading.failed();
    }
  }

  @Override
  public boolean isHealthy() {
    try {
      return Boolean.TRUE.equals(
          webClient
              .get()
              .uri("/health")
              .exchangeToMono(r -> r.releaseBody().thenReturn(r.statusCode().value() == 200))
              .timeout(Duration.ofMillis(healthTimeoutMs))
              .block());
    } catch (RuntimeException e) {
      log.warn("OCR service health check failed: {}", e.getMessage());
      return false;
    }
  }

  /** Maps the service's {@code {success, text, confidence, bboxes}} payload. */
  static OcrReading parseReading(Map<String, Object> data) {
    if (data == null) {
      return OcrReading.failed();
    }

    boolean success = Boolean.TRUE.equals(data.get("success"));
    String text = data.get("text") instanceof String s ? s : "";
    double confidence = data.get("confidence") instanceof Number n ? n.doubleValue() : 0.0;

    List<BoundingBox> boxes = new ArrayList<>();
    if (data.get("bboxes") instanceof List<?> rawBoxes) {
      for (Object raw : rawBoxes) {
        boxes.add(raw instanceof List<?> coords ? BoundingBox.fromList(coords) : BoundingBox.ZERO);
      }
    }

    return new OcrReading(success, text, confidence, boxes);
  }
}
