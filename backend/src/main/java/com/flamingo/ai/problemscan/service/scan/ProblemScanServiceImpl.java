package com.flamingo.ai.problemscan.service.scan;

import com.flamingo.ai.problemscan.exception.OcrProcessingException;
import com.flamingo.ai.problemscan.service.matching.ProblemMatcher;
import com.flamingo.ai.problemscan.service.metadata.MetadataSuggestionExtractor;
import com.flamingo.ai.problemscan.service.model.MetadataSuggestion;
import com.flamingo.ai.problemscan.service.model.OcrReading;
import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import com.flamingo.ai.problemscan.service.ocr.OcrEngine;
import com.flamingo.ai.problemscan.service.segmentation.SegmentationService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Implementation of the scanning pipeline: OCR, segmentation, then one concurrent match lookup
 * per segment.
 *
 * <p>The fan-out waits for every lookup. A failed lookup degrades its own segment to an empty
 * match list and never affects the other segments or the response shape. That includes a lookup
 * the executor refuses to accept. If the calling thread is interrupted while waiting, every
 * outstanding lookup is cancelled and its worker thread interrupted.
 */
@Service
@Slf4j
public class ProblemScanServiceImpl implements ProblemScanService {

  private final OcrEngine ocrEngine;
  private final SegmentationService segmentationService;
  private final ProblemMatcher problemMatcher;
  private final MetadataSuggestionExtractor metadataSuggestionExtractor;
  private final Executor matchingExecutor;
  private final MeterRegistry meterRegistry;

  public ProblemScanServiceImpl(
      OcrEngine ocrEngine,
      SegmentationService segmentationService,
      ProblemMatcher problemMatcher,
      MetadataSuggestionExtractor metadataSuggestionExtractor,
      @Qualifier("matchingExecutor") Executor matchingExecutor,
      MeterRegistry meterRegistry) {
    this.ocrEngine = ocrEngine;
    this.segmentationService = segmentationService;
    this.problemMatcher = problemMatcher;
    this.metadataSuggestionExtractor = metadataSuggestionExtractor;
    this.matchingExecutor = matchingExecutor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "scan.pipeline", description = "Time to scan one worksheet image")
  public ScanResult scan(byte[] image, String filename, String tenantId) {
    OcrReading reading = ocrEngine.recognize(image, filename);
    if (!reading.success()) {
      meterRegistry.counter("scan.ocr.unsuccessful").increment();
      throw new OcrProcessingException("OCR service returned no usable text for " + filename);
    }
    return process(reading, tenantId);
  }

  @Override
  public ScanResult process(OcrReading reading, String tenantId) {
    List<ProblemSegment> segments =
        segmentationService.detectProblemsEnhanced(reading.text(), reading.bboxes());
    MetadataSuggestion suggestions = metadataSuggestionExtractor.suggest(reading.text());

    List<SegmentMatches> matched = matchConcurrently(segments, tenantId);
    long failed = matched.stream().filter(SegmentMatches::lookupFailed).count();
    log.info(
        "Scan finished for tenant {}: {} problems detected, {} lookups failed",
        tenantId,
        segments.size(),
        failed);

    return new ScanResult(reading, matched, suggestions);
  }

  @Override
  public Identification identifyProblem(String text, String tenantId) {
    List<ProblemMatch> matches =
        text == null || text.isBlank() ? List.of() : problemMatcher.findMatches(text, tenantId);
    return new Identification(matches, metadataSuggestionExtractor.suggest(text));
  }

  @Override
  public boolean isOcrAvailable() {
    return ocrEngine.isHealthy();
  }

  private List<SegmentMatches> matchConcurrently(List<ProblemSegment> segments, String tenantId) {
    if (segments.isEmpty()) {
      return List.of();
    }

    List<FutureTask<List<ProblemMatch>>> tasks = new ArrayList<>(segments.size());
    for (ProblemSegment segment : segments) {
      tasks.add(submit(segment, tenantId));
    }

    List<SegmentMatches> matched = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      ProblemSegment segment = segments.get(i);
      try {
        matched.add(new SegmentMatches(segment, tasks.get(i).get(), false));
      } catch (InterruptedException e) {
        tasks.forEach(task -> task.cancel(true));
        Thread.currentThread().interrupt();
        throw new OcrProcessingException("Scan interrupted while matching problems", e);
      } catch (ExecutionException e) {
        matched.add(degraded(segment, e.getCause()));
      } catch (CancellationException e) {
        matched.add(degraded(segment, e));
      }
    }
    return matched;
  }

  /**
   * Hands one lookup to the matching executor. A rejected submission leaves the task cancelled,
   * so only that segment degrades.
   */
  private FutureTask<List<ProblemMatch>> submit(ProblemSegment segment, String tenantId) {
    FutureTask<List<ProblemMatch>> task =
        new FutureTask<>(() -> problemMatcher.findMatches(segment.text(), tenantId));
    try {
      matchingExecutor.execute(task);
    } catch (RejectedExecutionException e) {
      log.warn("Matching executor rejected lookup for problem {}", segment.problemNumber());
      task.cancel(false);
    }
    return task;
  }

  private SegmentMatches degraded(ProblemSegment segment, Throwable cause) {
    log.warn(
        "Match lookup failed for problem {}: {}", segment.problemNumber(), cause.getMessage());
    meterRegistry.counter("scan.matching.segment_failures").increment();
    return new SegmentMatches(segment, List.of(), true);
  }
}
