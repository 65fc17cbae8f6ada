package eu.virtualparadox.docsift.ingest.chunker;

import eu.virtualparadox.docsift.catalog.model.Document;
import eu.virtualparadox.docsift.ingest.model.Chunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Paragraph-first, sentence-aware {@code Chunker} producing overlapping windows for keyword retrieval.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Paragraph split:</strong> the text is cut after every blank-line run. Each paragraph
 *       keeps its trailing separator, so consecutive paragraphs tile the document without gaps.
 *       Leading blank lines are attributed to the paragraph that follows them.</li>
 *   <li><strong>Window split:</strong> a paragraph with more than {@code maxTokens} whitespace-delimited
 *       tokens is split into windows of at most {@code maxTokens} tokens. Consecutive windows share
 *       exactly {@code overlapTokens} tokens so a match spanning a window boundary is still seen by
 *       at least one chunk.</li>
 *   <li><strong>Sentence preference:</strong> a window that would be cut mid-paragraph is pulled back
 *       to the latest sentence start, as long as the window keeps at least half of
 *       {@code maxTokens} and still advances past the overlap. Sentence starts use an
 *       uppercase-aware boundary rule with an abbreviation guard.</li>
 * </ul>
 *
 * <h2>Offsets</h2>
 * Every {@link Chunk} is an exact slice {@code text.substring(start, end)} of the source. The first
 * chunk starts at {@code 0}, the last one ends at {@code text.length()}, and each chunk starts at or
 * before the end of its predecessor. Dropping the overlapping prefix of every chunk therefore
 * reconstructs the original text byte for byte.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction; the same input always yields the same chunk list.
 */
@Component
public class Chunker {

    /**
     * Maximum number of whitespace-delimited tokens per chunk.
     */
    private final int maxTokens;

    /**
     * Number of trailing tokens of a window repeated at the start of the next window.
     */
    private final int overlapTokens;

    /**
     * A line break, optional horizontal whitespace, another line break, and any whitespace after it.
     */
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R[ \\t\\x0B\\f]*\\R\\s*");

    private static final Pattern TOKEN = Pattern.compile("\\S+");

    /**
     * Unicode-capital-aware sentence boundary:
     * <pre>
     *     (?&lt;=[.!?])     # trailing ., ! or ? must precede the split
     *     (?![.!?])        # do not allow runs of punctuation to trigger multiple splits
     *     \s+              # one or more whitespace characters form the divider
     *     (?=[\p{Lu}"'])   # next sentence starts with uppercase/quote
     * </pre>
     */
    private static final Pattern SENTENCE_SPLIT = Pattern.compile(
            "(?<=[.!?])" +
                    "(?![.!?])" +
                    "\\s+" +
                    "(?=[\\p{Lu}\"'])"
    );

    /**
     * Matches when the text right before a split candidate ends with a known abbreviation
     * (e.g. {@code Dr.}, {@code Inc.}, {@code Jan.}); such candidates are not sentence boundaries.
     */
    private static final Pattern ABBREVIATION_PATTERN = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Prof|Sr|Jr|Inc|Ltd|Corp|Co|St|Ave|Blvd|Rd|etc|vs|eg|ie|cf|ca|approx|Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec|Mon|Tue|Wed|Thu|Fri|Sat|Sun|U\\.S\\.A|U\\.K|U\\.N)\\.$"
    );

    /**
     * Constructs a {@code Chunker}.
     *
     * @param maxTokens     maximum tokens per chunk (must be {@code > 0})
     * @param overlapTokens tokens shared by consecutive windows of one paragraph
     *                      (must be {@code >= 0} and {@code < maxTokens})
     * @throws IllegalArgumentException if constraints are violated
     */
    public Chunker(@Value("${docsift.chunker.max-tokens:500}") final int maxTokens,
                   @Value("${docsift.chunker.overlap-tokens:50}") final int overlapTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (overlapTokens < 0 || overlapTokens >= maxTokens) {
            throw new IllegalArgumentException("overlapTokens must be non-negative and less than maxTokens");
        }
        this.maxTokens = maxTokens;
        this.overlapTokens = overlapTokens;
    }

    /**
     * Chunks a loaded document.
     *
     * @param document source document
     * @return ordered, fully materialized chunk list (empty for a blank document)
     */
    public List<Chunk> chunk(final Document document) {
        return chunk(document.id(), document.text());
    }

    /**
     * Chunks raw text on behalf of a document id.
     *
     * @param docId document identifier (non-blank)
     * @param text  input text (non-null)
     * @return ordered list of chunks covering {@code text}; empty if {@code text} is blank
     * @throws IllegalArgumentException if inputs are invalid
     */
    public List<Chunk> chunk(final String docId, final String text) {
        validateInputs(docId, text);

        final List<Chunk> result = new ArrayList<>();
        if (text.isBlank()) {
            return result;
        }

        for (TextSpan paragraph : splitParagraphs(text)) {
            final List<TextSpan> tokens = tokenSpans(text, paragraph);
            if (tokens.size() <= maxTokens) {
                result.add(createChunk(docId, text, paragraph, result.size()));
                continue;
            }
            for (TextSpan window : windows(text, paragraph, tokens)) {
                result.add(createChunk(docId, text, window, result.size()));
            }
        }
        return result;
    }

    private void validateInputs(final String docId, final String text) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    private static Chunk createChunk(final String docId,
                                     final String text,
                                     final TextSpan span,
                                     final int index) {
        return new Chunk(docId, index, text.substring(span.start, span.end), span.start, span.end);
    }

    /**
     * Cuts the text after each blank-line run. A cut whose preceding region is blank is skipped so
     * leading blank lines join the next paragraph; a blank tail joins the last paragraph.
     */
    private static List<TextSpan> splitParagraphs(final String text) {
        final List<TextSpan> paragraphs = new ArrayList<>();
        final Matcher matcher = PARAGRAPH_BREAK.matcher(text);

        int start = 0;
        while (matcher.find()) {
            if (text.substring(start, matcher.start()).isBlank()) {
                continue;
            }
            paragraphs.add(new TextSpan(start, matcher.end()));
            start = matcher.end();
        }

        if (start < text.length()) {
            if (!paragraphs.isEmpty() && text.substring(start).isBlank()) {
                final TextSpan last = paragraphs.remove(paragraphs.size() - 1);
                paragraphs.add(new TextSpan(last.start, text.length()));
            } else {
                paragraphs.add(new TextSpan(start, text.length()));
            }
        }
        return paragraphs;
    }

    private static List<TextSpan> tokenSpans(final String text, final TextSpan paragraph) {
        final List<TextSpan> tokens = new ArrayList<>();
        final Matcher matcher = TOKEN.matcher(text);
        matcher.region(paragraph.start, paragraph.end);
        while (matcher.find()) {
            tokens.add(new TextSpan(matcher.start(), matcher.end()));
        }
        return tokens;
    }

    /**
     * Slides a token window across an oversized paragraph.
     *
     * <p>Window {@code [first, last)} in token indices maps to the character span from the first
     * token's start (or the paragraph start for the first window) to the start of token
     * {@code last} (or the paragraph end for the final window). The next window begins
     * {@code overlapTokens} tokens before {@code last}.</p>
     */
    private List<TextSpan> windows(final String text,
                                   final TextSpan paragraph,
                                   final List<TextSpan> tokens) {
        final boolean[] sentenceStart = sentenceStarts(text, paragraph, tokens);
        final int tokenCount = tokens.size();
        final List<TextSpan> windows = new ArrayList<>();

        int first = 0;
        while (true) {
            int last = Math.min(first + maxTokens, tokenCount);
            if (last < tokenCount) {
                last = preferSentenceBoundary(first, last, sentenceStart);
            }

            final int start = first == 0 ? paragraph.start : tokens.get(first).start;
            final int end = last == tokenCount ? paragraph.end : tokens.get(last).start;
            windows.add(new TextSpan(start, end));

            if (last == tokenCount) {
                return windows;
            }
            first = last - overlapTokens;
        }
    }

    /**
     * Pulls the exclusive window end back to the latest sentence start that keeps the window
     * at least half full and strictly longer than the overlap.
     */
    private int preferSentenceBoundary(final int first, final int last, final boolean[] sentenceStart) {
        final int minimum = first + Math.max(overlapTokens + 1, maxTokens / 2);
        for (int candidate = last; candidate >= minimum; candidate--) {
            if (sentenceStart[candidate]) {
                return candidate;
            }
        }
        return last;
    }

    /**
     * Marks the token indices at which a sentence begins.
     */
    private static boolean[] sentenceStarts(final String text,
                                            final TextSpan paragraph,
                                            final List<TextSpan> tokens) {
        final Map<Integer, Integer> tokenByOffset = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            tokenByOffset.put(tokens.get(i).start, i);
        }

        final boolean[] starts = new boolean[tokens.size() + 1];
        final String paragraphText = text.substring(paragraph.start, paragraph.end);
        for (TextSpan sentence : splitSentences(paragraphText)) {
            final Integer token = tokenByOffset.get(paragraph.start + sentence.start);
            if (token != null) {
                starts[token] = true;
            }
        }
        return starts;
    }

    /**
     * Splits {@code text} into sentence spans using {@link #SENTENCE_SPLIT} as a primary indicator
     * and {@link #ABBREVIATION_PATTERN} to suppress false boundaries. Up to 20 characters before
     * each candidate are inspected for a trailing abbreviation.
     *
     * @param text source text
     * @return ordered list of half-open spans {@code [start, end)} covering each sentence
     */
    private static List<TextSpan> splitSentences(final String text) {
        final List<TextSpan> sentences = new ArrayList<>();
        final Matcher matcher = SENTENCE_SPLIT.matcher(text);

        int lastEnd = 0;
        while (matcher.find()) {
            final int splitPoint = matcher.start();
            final String beforeSplit = text.substring(Math.max(0, splitPoint - 20), splitPoint).trim();

            if (!ABBREVIATION_PATTERN.matcher(beforeSplit).find()) {
                if (splitPoint > lastEnd) {
                    sentences.add(new TextSpan(lastEnd, splitPoint));
                }
                lastEnd = matcher.end();
            }
        }
        if (lastEnd < text.length()) {
            sentences.add(new TextSpan(lastEnd, text.length()));
        }
        return sentences;
    }
}
