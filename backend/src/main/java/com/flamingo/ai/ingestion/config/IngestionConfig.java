package com.flamingo.ai.ingestion.config;

import com.flamingo.ai.ingestion.domain.enums.SourceService;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  private Elasticsearch elasticsearch = new Elasticsearch();
  private Chunking chunking = new Chunking();
  private Pdf pdf = new Pdf();
  private Relevance relevance = new Relevance();
  private VectorStore vectorStore = new VectorStore();
  private Tasks tasks = new Tasks();
  private Workers workers = new Workers();
  private Scheduling scheduling = new Scheduling();

  /** Per-connector switches, keyed by source service. Missing entries use the defaults. */
  private Map<SourceService, Source> sources = new EnumMap<>(SourceService.class);

  /**
   * Returns the settings for a source service, falling back to defaults when not configured.
   *
   * @param service the source service
   * @return the connector settings
   */
  public Source sourceSettings(SourceService service) {
    return sources.getOrDefault(service, new Source());
  }

  @Getter
  @Setter
  public static class Elasticsearch {
    private String host = "localhost";
    private int port = 9200;
    private String scheme = "http";

    /** Index holding the ingested chunks. */
    private String indexName = "ingested-chunks";

    private int vectorDimensions = 1536;
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum chunk length in tokens. */
    private int size = 2000;

    /** Tokens shared between consecutive chunks of one document. */
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Pdf {
    /** Fraction of the page area an image must cover for the page to be OCR'd. */
    private double imageAreaThreshold = 0.7;

    private float renderDpi = 150f;
  }

  @Getter
  @Setter
  public static class Relevance {
    private int maxAttempts = 3;
    private Duration rateLimitBackoff = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class VectorStore {
    private int maxAttempts = 3;
    private Duration retryBackoff = Duration.ofSeconds(60);
    private String urlPlaceholder = "[URL]";
  }

  @Getter
  @Setter
  public static class Tasks {
    /** Number of tasks retained per owner and service; the oldest finished ones are evicted. */
    private int historySize = 10;

    private Duration staleAfter = Duration.ofHours(6);

    /** How often the stale task check runs. */
    private Duration staleCheckInterval = Duration.ofMinutes(30);
  }

  @Getter
  @Setter
  public static class Workers {
    private Pool manual = new Pool(4, 8, 100);
    private Pool scheduled = new Pool(2, 2, 500);

    @Getter
    @Setter
    public static class Pool {
      private int coreSize;
      private int maxSize;
      private int queueCapacity;

      public Pool() {}

      public Pool(int coreSize, int maxSize, int queueCapacity) {
        this.coreSize = coreSize;
        this.maxSize = maxSize;
        this.queueCapacity = queueCapacity;
      }
    }
  }

  @Getter
  @Setter
  public static class Scheduling {
    private boolean enabled = false;
    private String cron = "0 0 2 * * *";
  }

  @Getter
  @Setter
  public static class Source {
    /** Delete the previous generation of a source's chunks before writing the new one. */
    private boolean dedupDeleteEnabled = true;

    /** Run the topic relevance filter when the request carries topics. */
    private boolean relevanceFilterEnabled = true;
  }
}
