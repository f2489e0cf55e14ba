package com.flamingo.ai.ingestion.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.HttpHost;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Client for the chunk vector index, connected to the endpoint under {@code
 * ingestion.elasticsearch}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchConfig {

  private final IngestionConfig ingestionConfig;

  @Bean(destroyMethod = "close")
  public Rest5Client chunkIndexRestClient() {
    IngestionConfig.Elasticsearch settings = ingestionConfig.getElasticsearch();
    HttpHost endpoint = new HttpHost(settings.getScheme(), settings.getHost(), settings.getPort());
    log.info("Chunk index '{}' served by {}", settings.getIndexName(), endpoint.toURI());
    return Rest5Client.builder(endpoint).build();
  }

  @Bean
  public ElasticsearchTransport chunkIndexTransport(Rest5Client chunkIndexRestClient) {
    return new Rest5ClientTransport(chunkIndexRestClient, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport chunkIndexTransport) {
    return new ElasticsearchClient(chunkIndexTransport);
  }
}
