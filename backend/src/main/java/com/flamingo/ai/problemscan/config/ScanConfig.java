package com.flamingo.ai.problemscan.config;

import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the worksheet scanning pipeline. */
@Configuration
@ConfigurationProperties(prefix = "scan")
@Getter
@Setter
public class ScanConfig {

  private Ocr ocr = new Ocr();
  private Segmentation segmentation = new Segmentation();
  private Matching matching = new Matching();
  private Ai ai = new Ai();

  @Getter
  @Setter
  public static class Ocr {
    private String baseUrl = "http://localhost:8000";
    private int timeoutMs = 30000;
    private int healthTimeoutMs = 5000;

    /** Accepted image extensions, also matched against the upload's MIME subtype. */
    private List<String> allowedTypes = List.of("jpeg", "jpg", "png", "gif", "bmp", "webp");
  }

  @Getter
  @Setter
  public static class Segmentation {
    /** Pattern-based pieces at or below this trimmed length are dropped. */
    private int minSegmentLength = 10;

    /** Paragraphs must be strictly longer than this after trimming. */
    private int minParagraphLength = 20;

    private double numberedConfidence = 0.85;
    private double paragraphConfidence = 0.7;
    private double singleBlockConfidence = 0.9;

    /** Try AI segmentation before the regex chain (only when {@code scan.ai.enabled}). */
    private boolean aiEnabled = true;
  }

  @Getter
  @Setter
  public static class Matching {
    private int candidateLimit = 10;

    /** Matches must score strictly above this value. */
    private double acceptanceThreshold = 0.3;

    private double similarThreshold = 0.7;
    private double exactThreshold = 0.9;

    /** Characters of candidate content included in the ranking prompt. */
    private int excerptLength = 200;

    /** Matches returned per segment in API responses. */
    private int topMatches = 5;
  }

  @Getter
  @Setter
  public static class Ai {
    /** Enables the LLM-backed segmentation and ranking paths. */
    private boolean enabled = true;

    private double temperature = 0.1;
    private int timeoutSeconds = 30;
    private int segmentationMaxTokens = 2000;
    private int rankingMaxTokens = 1000;
  }
}
