package com.flamingo.ai.problemscan.api.rest;

import com.flamingo.ai.problemscan.api.dto.request.IdentifyRequest;
import com.flamingo.ai.problemscan.api.dto.request.ImageDataRequest;
import com.flamingo.ai.problemscan.api.dto.response.IdentifyResponse;
import com.flamingo.ai.problemscan.api.dto.response.ScanResponse;
import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.exception.InvalidImageException;
import com.flamingo.ai.problemscan.service.scan.Identification;
import com.flamingo.ai.problemscan.service.scan.ProblemScanService;
import com.flamingo.ai.problemscan.service.scan.ScanResult;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST controller for scanning worksheet images.
 *
 * <p>Callers are scoped by the {@code X-Tenant-Id} header; every repository lookup is restricted
 * to that tenant.
 */
@RestController
@RequestMapping("/api/ocr")
@RequiredArgsConstructor
@Slf4j
public class OcrController {

  static final String TENANT_HEADER = "X-Tenant-Id";

  private final ProblemScanService problemScanService;
  private final ScanConfig scanConfig;

  /** Scans an uploaded image and matches every detected problem. */
  @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ScanResponse> processImage(
      @RequestHeader(TENANT_HEADER) String tenantId,
      @RequestParam("image") MultipartFile image) {
    validateImage(image);
    ScanResult result =
        problemScanService.scan(readBytes(image), image.getOriginalFilename(), tenantId);
    return ResponseEntity.ok(
        ScanResponse.fromResult(result, scanConfig.getMatching().getTopMatches()));
  }

  /** Scans a base64-encoded image. */
  @PostMapping("/process-base64")
  public ResponseEntity<ScanResponse> processImageData(
      @RequestHeader(TENANT_HEADER) String tenantId,
      @Valid @RequestBody ImageDataRequest request) {
    byte[] image = decode(request.getImageData());
    ScanResult result = problemScanService.scan(image, request.filenameOrDefault(), tenantId);
    return ResponseEntity.ok(
        ScanResponse.fromResult(result, scanConfig.getMatching().getTopMatches()));
  }

  /** Matches a single problem text without segmenting it. */
  @PostMapping("/identify")
  public ResponseEntity<IdentifyResponse> identify(
      @RequestHeader(TENANT_HEADER) String tenantId,
      @Valid @RequestBody IdentifyRequest request) {
    Identification identification = problemScanService.identifyProblem(request.getText(), tenantId);
    return ResponseEntity.ok(
        IdentifyResponse.fromIdentification(
            identification, scanConfig.getMatching().getTopMatches()));
  }

  /** Reports whether the OCR service is reachable. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    boolean healthy = problemScanService.isOcrAvailable();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", healthy ? "healthy" : "unhealthy");
    body.put("ocrService", healthy ? "available" : "unavailable");
    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(body);
  }

  private void validateImage(MultipartFile image) {
    if (image == null || image.isEmpty()) {
      throw new InvalidImageException("No image file provided");
    }
    List<String> allowed = scanConfig.getOcr().getAllowedTypes();
    String extension = extensionOf(image.getOriginalFilename());
    String contentType =
        image.getContentType() == null ? "" : image.getContentType().toLowerCase(Locale.ROOT);
    boolean extensionAllowed = allowed.contains(extension);
    boolean typeAllowed = allowed.stream().anyMatch(contentType::contains);
    if (!extensionAllowed || !typeAllowed) {
      throw new InvalidImageException("Invalid file type. Only image files are allowed.");
    }
  }

  static String extensionOf(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static byte[] readBytes(MultipartFile image) {
    try {
      return image.getBytes();
    } catch (IOException e) {
      throw new InvalidImageException("Could not read uploaded image: " + e.getMessage());
    }
  }

  private static byte[] decode(String imageData) {
    try {
      byte[] bytes = Base64.getDecoder().decode(imageData);
      if (bytes.length == 0) {
        throw new InvalidImageException("No image data provided");
      }
      return bytes;
    } catch (IllegalArgumentException e) {
      log.debug("Rejected image data: {}", e.getMessage());
      throw new InvalidImageException("Image data is not valid base64");
    }
  }
}
