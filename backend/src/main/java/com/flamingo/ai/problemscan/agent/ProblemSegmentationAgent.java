package com.flamingo.ai.problemscan.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that splits OCR text from a worksheet photo into individual problems.
 *
 * <p>Handles layouts the regex chain cannot: unnumbered problems, multi-column pages and OCR
 * artifacts between problems. The reply must be a bare JSON array; the caller rejects anything
 * else.
 */
public interface ProblemSegmentationAgent {

  @SystemMessage(
      """
        You split OCR text from photographed worksheets into individual problems.

        Rules:
        - Each problem keeps its full statement, including answer choices such as (A) ... (E).
        - Never merge two problems and never split one problem into several.
        - Drop page headers, footers, instructions and OCR noise that belong to no problem.
        - Use the printed problem number when there is one, otherwise null.
        - confidence is your certainty (0.0 to 1.0) that the text is exactly one complete problem.

        Respond with ONLY a JSON array, no prose and no markdown:
        [{"problemNumber": 1, "text": "...", "confidence": 0.95}]
        """)
  @UserMessage("""
        OCR text:
        {{text}}
        """)
  String segment(@V("text") String text);
}
