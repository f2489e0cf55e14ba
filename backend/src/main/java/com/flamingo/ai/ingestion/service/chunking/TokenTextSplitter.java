package com.flamingo.ai.ingestion.service.chunking;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.service.ingestion.model.Chunk;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceDocument;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Splits extracted text into ordered chunks bounded by token count.
 *
 * <p>Text is split recursively on the first separator of {@link #SEPARATORS} that occurs in it,
 * keeping each separator at the start of the piece that follows it. Pieces are merged back
 * greedily up to the chunk size. Pieces that still exceed the bound once every separator is used
 * up are cut into token windows on code point boundaries.
 *
 * <p>Every chunk after the first starts with a suffix of the previous chunk holding at least the
 * configured overlap in tokens, or the whole previous chunk when that one is shorter. This holds
 * across merged groups, recursive splits and token windows alike.
 *
 * <p>Chunk indices start at 0 per document and follow document order.
 */
@Service
@Slf4j
public class TokenTextSplitter {

  /** Separators in priority order. The fourth entry is a literal backslash followed by n. */
  static final List<String> SEPARATORS =
      List.of("\n\n", "\n", "\t", "\\n", "\r\n\r\n", " ", ".", ",");

  // upper bound on code points scanned per hard-split window
  private static final int MAX_CODE_POINTS_PER_TOKEN = 32;

  private final TokenCounter tokenCounter;
  private final int chunkSize;
  private final int chunkOverlap;

  @Autowired
  public TokenTextSplitter(TokenCounter tokenCounter, IngestionConfig ingestionConfig) {
    this(
        tokenCounter,
        ingestionConfig.getChunking().getSize(),
        ingestionConfig.getChunking().getOverlap());
  }

  @VisibleForTesting
  public TokenTextSplitter(TokenCounter tokenCounter, int chunkSize, int chunkOverlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          String.format(
              "Chunk overlap must be between 0 and the chunk size (%d), got %d",
              chunkSize, chunkOverlap));
    }
    this.tokenCounter = tokenCounter;
    this.chunkSize = chunkSize;
    this.chunkOverlap = chunkOverlap;
  }

  /**
   * Splits a document into chunks carrying the document metadata plus {@code chunkIndex}.
   *
   * @param document the extracted document
   * @return chunks in document order, without ids; empty for blank documents
   */
  public List<Chunk> split(SourceDocument document) {
    String text = document.rawText();
    if (text.isBlank()) {
      return List.of();
    }

    List<String> pieces = enforceBound(splitText(text, SEPARATORS, ""));
    List<Chunk> chunks = new ArrayList<>(pieces.size());
    for (int i = 0; i < pieces.size(); i++) {
      String content = pieces.get(i);
      Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
      metadata.put(MetadataKeys.CHUNK_INDEX, i);
      chunks.add(new Chunk(null, content, metadata, i, tokenCounter.count(content)));
    }
    log.debug(
        "Split {} chars into {} chunks (size={}, overlap={})",
        text.length(),
        chunks.size(),
        chunkSize,
        chunkOverlap);
    return chunks;
  }

  private List<String> splitText(String text, List<String> separators, String lead) {
    String separator = separators.get(separators.size() - 1);
    List<String> finerSeparators = List.of();
    for (int i = 0; i < separators.size(); i++) {
      String candidate = separators.get(i);
      if (text.contains(candidate)) {
        separator = candidate;
        finerSeparators = separators.subList(i + 1, separators.size());
        break;
      }
    }

    List<String> result = new ArrayList<>();
    List<String> fitting = new ArrayList<>();
    String carry = lead;
    for (String split : splitKeepingSeparator(text, separator)) {
      if (tokenCounter.count(split) < chunkSize) {
        fitting.add(split);
        continue;
      }
      if (!fitting.isEmpty()) {
        carry = extend(result, mergeSplits(fitting, carry), carry);
        fitting.clear();
      }
      if (finerSeparators.isEmpty()) {
        carry = extend(result, hardSplit(split, carry), carry);
      } else {
        carry = extend(result, splitText(split, finerSeparators, carry), carry);
      }
    }
    if (!fitting.isEmpty()) {
      extend(result, mergeSplits(fitting, carry), carry);
    }
    return result;
  }

  /** Appends chunks and returns the text the next chunk has to start with. */
  private String extend(List<String> result, List<String> chunks, String carry) {
    if (chunks.isEmpty()) {
      return carry;
    }
    result.addAll(chunks);
    return tail(chunks.get(chunks.size() - 1), chunkOverlap, chunkSize - chunkOverlap);
  }

  /** Splits on every occurrence of the separator; the separator starts the following piece. */
  @VisibleForTesting
  static List<String> splitKeepingSeparator(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    int start = 0;
    int index = text.indexOf(separator);
    while (index >= 0) {
      if (index > start) {
        pieces.add(text.substring(start, index));
      }
      start = index;
      index = text.indexOf(separator, index + separator.length());
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }

  private List<String> mergeSplits(List<String> splits, String lead) {
    List<String> docs = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int total = 0;
    // true once current holds non-blank text beyond the carried head
    boolean fresh = false;

    if (!lead.isEmpty()) {
      String head = tail(lead, chunkOverlap, chunkSize - tokenCounter.count(splits.get(0)));
      if (!head.isEmpty()) {
        current.add(head);
        total = tokenCounter.count(head);
      }
    }

    for (String split : splits) {
      int length = tokenCounter.count(split);
      if (total + length > chunkSize && !current.isEmpty()) {
        String doc = String.join("", current).strip();
        if (fresh) {
          addIfNotBlank(docs, doc);
        }
        current.clear();
        total = 0;
        fresh = false;
        String head = tail(doc, chunkOverlap, chunkSize - length);
        if (!head.isEmpty()) {
          current.add(head);
          total = tokenCounter.count(head);
        }
      }
      current.add(split);
      total += length;
      fresh |= !split.isBlank();
    }
    if (fresh) {
      addIfNotBlank(docs, String.join("", current));
    }
    return docs;
  }

  /**
   * Returns the shortest suffix of {@code text} holding at least {@code wanted} tokens, but never
   * more than {@code budget} tokens. Whitespace boundaries are preferred; text without usable
   * whitespace is cut on a code point boundary. Text shorter than the target is returned whole.
   */
  private String tail(String text, int wanted, int budget) {
    if (wanted <= 0 || budget <= 0 || text.isEmpty()) {
      return "";
    }
    int target = Math.min(wanted, budget);
    if (tokenCounter.count(text) <= target) {
      return text;
    }
    String suffix = suffixWithTokens(text, target, budget);
    if (!suffix.isEmpty() && tokenCounter.count(suffix.strip()) >= target) {
      return suffix;
    }
    int start = suffixStart(text, 0, text.length(), target);
    while (start < text.length() && tokenCounter.count(text.substring(start)) > budget) {
      start = text.offsetByCodePoints(start, 1);
    }
    return text.substring(start);
  }

  /**
   * Returns the shortest suffix of {@code text} cut at a whitespace boundary whose stripped form
   * holds at least {@code target} tokens, but never more than {@code budget} tokens. Returns an
   * empty string when nothing fits.
   */
  private String suffixWithTokens(String text, int target, int budget) {
    List<Integer> cuts = new ArrayList<>();
    for (int i = text.length() - 1; i > 0; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        cuts.add(i);
      }
    }
    if (cuts.isEmpty()) {
      return "";
    }

    // cuts run from the shortest suffix to the longest
    int low = 0;
    int high = cuts.size() - 1;
    int best = -1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (tokenCounter.count(text.substring(cuts.get(mid)).strip()) >= target) {
        best = mid;
        high = mid - 1;
      } else {
        low = mid + 1;
      }
    }
    int index = best >= 0 ? best : cuts.size() - 1;
    while (index >= 0 && tokenCounter.count(text.substring(cuts.get(index))) > budget) {
      index--;
    }
    return index >= 0 ? text.substring(cuts.get(index)) : "";
  }

  /**
   * Returns the start of the shortest code point suffix of {@code text[from, to)} holding at least
   * {@code target} tokens, or {@code from} when the whole range holds fewer.
   */
  private int suffixStart(String text, int from, int to, int target) {
    int available = text.codePointCount(from, to);
    int low = 1;
    int high = available;
    int best = available;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (tokenCounter.count(text.substring(text.offsetByCodePoints(to, -mid), to)) >= target) {
        best = mid;
        high = mid - 1;
      } else {
        low = mid + 1;
      }
    }
    return text.offsetByCodePoints(to, -best);
  }

  private List<String> enforceBound(List<String> pieces) {
    List<String> bounded = new ArrayList<>(pieces.size());
    for (String piece : pieces) {
      if (tokenCounter.count(piece) <= chunkSize) {
        bounded.add(piece);
      } else {
        bounded.addAll(hardSplit(piece, ""));
      }
    }
    return bounded;
  }

  /**
   * Cuts {@code lead + body} into windows of at most {@code chunkSize} tokens on code point
   * boundaries. Each window after the first starts {@code chunkOverlap} tokens before the end of
   * the previous one.
   */
  private List<String> hardSplit(String body, String lead) {
    String text = lead + body;
    List<String> pieces = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      int end = windowEnd(text, start);
      addIfNotBlank(pieces, text.substring(start, end));
      if (end >= text.length()) {
        break;
      }
      int next = chunkOverlap == 0 ? end : suffixStart(text, start, end, chunkOverlap);
      start = Math.max(next, text.offsetByCodePoints(start, 1));
    }
    return pieces;
  }

  /** Returns the end of the longest window starting at {@code start} within the token bound. */
  private int windowEnd(String text, int start) {
    int remainingCodePoints = text.codePointCount(start, text.length());
    int high = Math.min(remainingCodePoints, chunkSize * MAX_CODE_POINTS_PER_TOKEN);
    int low = 1;
    int fit = 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      int end = text.offsetByCodePoints(start, mid);
      if (tokenCounter.count(text.substring(start, end)) <= chunkSize) {
        fit = mid;
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    return text.offsetByCodePoints(start, fit);
  }

  private static void addIfNotBlank(List<String> docs, String text) {
    String stripped = text.strip();
    if (!stripped.isEmpty()) {
      docs.add(stripped);
    }
  }
}
