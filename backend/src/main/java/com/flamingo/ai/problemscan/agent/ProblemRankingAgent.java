package com.flamingo.ai.problemscan.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that ranks repository candidates against a problem read from a worksheet. */
public interface ProblemRankingAgent {

  @SystemMessage(
      """
        You are an expert at matching mathematical problems. Analyze the input problem and rank
        the candidate matches based on similarity.
        """)
  @UserMessage("{{prompt}}")
  String rank(@V("prompt") String prompt);
}
