package com.flamingo.ai.problemscan.service.scan;

import com.flamingo.ai.problemscan.service.model.MetadataSuggestion;
import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import java.util.List;

/** Matches and metadata suggestions for a single, unsegmented problem text. */
public record Identification(List<ProblemMatch> matches, MetadataSuggestion suggestions) {}
