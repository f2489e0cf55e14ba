package com.flamingo.ai.ingestion.service.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.springframework.stereotype.Component;

/**
 * Counts tokens with the {@code cl100k_base} encoding used by {@code text-embedding-3-small}.
 *
 * <p>Chunk bounds are measured with this counter so stored chunks always fit the embedding model.
 */
@Component
public class TokenCounter {

  private final Encoding encoding;

  public TokenCounter() {
    EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
    this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
  }

  /** Counts tokens, treating special-token markup as ordinary text. */
  public int count(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return encoding.countTokensOrdinary(text);
  }
}
