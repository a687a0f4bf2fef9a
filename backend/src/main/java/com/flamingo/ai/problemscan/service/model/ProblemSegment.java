package com.flamingo.ai.problemscan.service.model;

/**
 * One problem statement cut out of a larger OCR text block.
 *
 * @param text trimmed problem text, longer than the configured minimum
 * @param boundingBox region on the page, {@link BoundingBox#ZERO} when unknown
 * @param confidence detection confidence in [0, 1]
 * @param problemNumber printed problem index, or null when none was detected
 */
public record ProblemSegment(
    String text, BoundingBox boundingBox, double confidence, Integer problemNumber) {}
