package io.mapreducer.summarizer;

import io.mapreducer.core.Segment;
import io.mapreducer.core.SegmentSource;
import io.mapreducer.core.TokenCounter;
import io.mapreducer.core.TokenEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Token-aware recursive splitter. Tries paragraph breaks first, then line breaks, then spaces,
 * then single characters, and greedily packs the pieces into chunks of at most {@code chunkTokens}
 * tokens, carrying up to {@code overlapTokens} tokens of trailing context into the next chunk.
 * Separators stay attached to the piece that follows them.
 */
public class RecursiveTextSplitter implements SegmentSource {
    private static final Logger log = LoggerFactory.getLogger(RecursiveTextSplitter.class);
    public static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

    private final TokenCounter counter;
    private final TokenEncoding encoding;
    private final int chunkTokens;
    private final int overlapTokens;

    public RecursiveTextSplitter(TokenCounter counter, TokenEncoding encoding, int chunkTokens, int overlapTokens) {
        if (chunkTokens <= 0) throw new IllegalArgumentException("chunkTokens must be > 0");
        if (overlapTokens < 0 || overlapTokens >= chunkTokens) {
            throw new IllegalArgumentException("overlapTokens must be >= 0 and < chunkTokens");
        }
        this.counter = Objects.requireNonNull(counter, "counter");
        this.encoding = Objects.requireNonNull(encoding, "encoding");
        this.chunkTokens = chunkTokens;
        this.overlapTokens = overlapTokens;
    }

    @Override
    public List<Segment> split(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> chunks = splitText(text, SEPARATORS);
        List<Segment> segments = new ArrayList<>(chunks.size());
        long total = 0;
        for (String chunk : chunks) {
            int tokens = tokens(chunk);
            total += tokens;
            segments.add(new Segment(segments.size(), chunk, tokens));
            log.debug("Chunk {}/{}: {} tokens", segments.size(), chunks.size(), tokens);
        }
        log.info("Created {} chunks with total {} tokens", segments.size(), total);
        return segments;
    }

    private List<String> splitText(String text, List<String> separators) {
        String separator = separators.get(separators.size() - 1);
        List<String> remaining = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String s = separators.get(i);
            if (s.isEmpty() || text.contains(s)) {
                separator = s;
                remaining = separators.subList(i + 1, separators.size());
                break;
            }
        }

        List<String> out = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (tokens(piece) < chunkTokens) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                out.addAll(merge(fitting));
                fitting.clear();
            }
            if (remaining.isEmpty()) {
                out.add(piece);
            } else {
                out.addAll(splitText(piece, remaining));
            }
        }
        if (!fitting.isEmpty()) out.addAll(merge(fitting));
        return out;
    }

    private List<String> merge(List<String> pieces) {
        List<String> chunks = new ArrayList<>();
        Deque<String> current = new ArrayDeque<>();
        Deque<Integer> currentTokens = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int len = tokens(piece);
            if (total + len > chunkTokens) {
                if (total > chunkTokens) {
                    log.warn("Created a chunk of {} tokens, which is longer than the specified {}", total, chunkTokens);
                }
                if (!current.isEmpty()) {
                    addIfPresent(chunks, String.join("", current));
                    while (total > overlapTokens || (total + len > chunkTokens && total > 0)) {
                        total -= currentTokens.removeFirst();
                        current.removeFirst();
                    }
                }
            }
            current.addLast(piece);
            currentTokens.addLast(len);
            total += len;
        }
        addIfPresent(chunks, String.join("", current));
        return chunks;
    }

    private static void addIfPresent(List<String> chunks, String chunk) {
        String trimmed = chunk.trim();
        if (!trimmed.isEmpty()) chunks.add(trimmed);
    }

    private static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
            return pieces;
        }
        for (String p : Pattern.compile("(?=" + Pattern.quote(separator) + ")").split(text)) {
            if (!p.isEmpty()) pieces.add(p);
        }
        return pieces;
    }

    private int tokens(String text) { return counter.count(text, encoding); }
}
