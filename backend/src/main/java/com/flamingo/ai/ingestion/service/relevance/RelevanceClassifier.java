package com.flamingo.ai.ingestion.service.relevance;

import java.util.List;

/** Decides whether a text relates to any of a list of topics. */
public interface RelevanceClassifier {

  /**
   * Classifies one text.
   *
   * @param text the text to judge
   * @param topics topics of interest, never empty
   * @return true when the text is related to at least one topic
   * @throws com.flamingo.ai.ingestion.exception.LlmServiceException when the classifier fails;
   *     {@code isRateLimited()} tells whether waiting may help
   */
  boolean classify(String text, List<String> topics);
}
