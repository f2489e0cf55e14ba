package com.flamingo.ai.ingestion.service.relevance;

import com.flamingo.ai.ingestion.agent.TopicRelevanceAgent;
import com.flamingo.ai.ingestion.agent.dto.RelevanceVerdict;
import com.flamingo.ai.ingestion.exception.LlmServiceException;
import dev.langchain4j.exception.RateLimitException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link RelevanceClassifier} backed by the {@link TopicRelevanceAgent}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmRelevanceClassifier implements RelevanceClassifier {

  private final TopicRelevanceAgent topicRelevanceAgent;

  @Override
  public boolean classify(String text, List<String> topics) {
    RelevanceVerdict verdict;
    try {
      verdict = topicRelevanceAgent.classify(String.join(", ", topics), text);
    } catch (RateLimitException e) {
      throw new LlmServiceException("Topic detector was rate limited", true, e);
    } catch (RuntimeException e) {
      throw new LlmServiceException("Topic detector failed: " + e.getMessage(), e);
    }
    if (verdict == null) {
      throw new LlmServiceException("Topic detector returned no verdict");
    }
    log.debug("Topic verdict {} for {} chars", verdict.verdict(), text.length());
    return verdict.verdict();
  }
}
