package com.flamingo.ai.problemscan.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.problemscan.api.rest.HealthController;
import com.flamingo.ai.problemscan.api.rest.OcrController;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Objects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the public endpoints.
 *
 * <ul>
 *   <li>POST /api/ocr/process - Scan an uploaded image
 *   <li>POST /api/ocr/process-base64 - Scan a base64 image
 *   <li>POST /api/ocr/identify - Match a single problem text
 *   <li>GET /api/ocr/health - OCR service health
 *   <li>GET /health - Service liveness
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("OcrController API contract")
  class OcrControllerContract {

    @Test
    @DisplayName("should be mapped to /api/ocr")
    void shouldBeMappedToApiOcr() {
      RequestMapping mapping = OcrController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/ocr");
    }

    @Test
    @DisplayName("should expose process, process-base64 and identify as POST")
    void shouldExposePostEndpoints() {
      assertThat(
              Arrays.stream(OcrController.class.getDeclaredMethods())
                  .map(m -> m.getAnnotation(PostMapping.class))
                  .filter(Objects::nonNull)
                  .flatMap(p -> Arrays.stream(p.value())))
          .containsExactlyInAnyOrder("/process", "/process-base64", "/identify");
    }

    @Test
    @DisplayName("should expose health as GET")
    void shouldExposeHealthAsGet() throws NoSuchMethodException {
      Method health = OcrController.class.getMethod("health");
      assertThat(health.getAnnotation(GetMapping.class).value()).containsExactly("/health");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
