package com.flamingo.ai.problemscan.service.matching;

import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import java.util.List;

/** Full-text lookup of stored problems that might match a detected problem. */
public interface CandidateRetriever {

  /**
   * Searches the tenant's problem repository.
   *
   * @param text query text, typically one segment
   * @param tenantId tenant whose problems are searched
   * @param limit maximum number of candidates
   * @return candidates in the search engine's relevance order
   * @throws com.flamingo.ai.problemscan.exception.SearchException if the repository is unavailable
   */
  List<CandidateProblem> search(String text, String tenantId, int limit);
}
