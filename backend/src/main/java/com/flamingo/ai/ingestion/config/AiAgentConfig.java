package com.flamingo.ai.ingestion.config;

import com.flamingo.ai.ingestion.agent.TopicRelevanceAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** LangChain4j AI Services used by the pipeline. */
@Configuration
public class AiAgentConfig {

  @Bean
  public TopicRelevanceAgent topicRelevanceAgent(ChatModel chatModel) {
    return AiServices.builder(TopicRelevanceAgent.class).chatModel(chatModel).build();
  }
}
