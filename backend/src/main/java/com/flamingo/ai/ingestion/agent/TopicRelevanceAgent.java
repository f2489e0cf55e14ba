package com.flamingo.ai.ingestion.agent;

import com.flamingo.ai.ingestion.agent.dto.RelevanceVerdict;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent deciding whether a piece of content relates to any of a list of topics.
 *
 * <p>Used by the relevance filter to drop chunks that have nothing to do with what the user asked
 * to collect.
 */
public interface TopicRelevanceAgent {

  @SystemMessage(
      """
        You are a topic detector. You receive a list of topics and a piece of content taken from
        an email, a file or a shared drive document. Decide whether the content is related to at
        least one of the topics. Related means the content discusses, mentions or is clearly
        relevant to the topic, not merely that it shares a word with it.

        Return ONLY valid JSON matching this structure:
        {"verdict": true}
        or
        {"verdict": false}
        """)
  @UserMessage("""
        Topics: {{topics}}

        Content:
        {{content}}
        """)
  RelevanceVerdict classify(@V("topics") String topics, @V("content") String content);
}
