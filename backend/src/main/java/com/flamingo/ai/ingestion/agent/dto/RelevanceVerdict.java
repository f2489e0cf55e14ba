package com.flamingo.ai.ingestion.agent.dto;

/** Structured output from TopicRelevanceAgent. */
public record RelevanceVerdict(boolean verdict) {}
