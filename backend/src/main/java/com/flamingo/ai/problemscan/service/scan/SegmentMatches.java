package com.flamingo.ai.problemscan.service.scan;

import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import java.util.List;

/**
 * Matches found for one detected problem.
 *
 * @param segment the detected problem
 * @param matches matches sorted by similarity descending
 * @param lookupFailed true when the lookup failed and {@code matches} is empty for that reason
 */
public record SegmentMatches(
    ProblemSegment segment, List<ProblemMatch> matches, boolean lookupFailed) {}
