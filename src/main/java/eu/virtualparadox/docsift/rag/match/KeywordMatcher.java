package eu.virtualparadox.docsift.rag.match;

import eu.virtualparadox.docsift.catalog.model.Document;
import eu.virtualparadox.docsift.ingest.model.Chunk;
import eu.virtualparadox.docsift.ingest.model.ChunkRef;
import eu.virtualparadox.docsift.rag.analysis.TermExtractor;
import eu.virtualparadox.docsift.rag.index.CategoryIndex;
import eu.virtualparadox.docsift.rag.index.Posting;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds the chunks of a category that contain query terms.
 * <p>
 * Steps:
 * <ol>
 *   <li>Tokenize the query with the indexing analyzer and deduplicate the terms</li>
 *   <li>Look up each term's posting list and collect, per chunk, the matched terms and their frequency;
 *       with {@link EMatchStrategy#SCAN} the chunk text is scanned by the query automaton instead</li>
 *   <li>Optionally add documents whose file name is mentioned in the query, found with one
 *       automaton pass over the raw query</li>
 * </ol>
 * A query without recognized terms matches nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KeywordMatcher {

    private final TermExtractor termExtractor;

    /**
     * Normalizes a query. Never fails: unrecognized characters are dropped by tokenization.
     *
     * @param query raw query text, may be {@code null}
     * @return parsed query (possibly without terms)
     */
    public QueryTerms parse(final String query) {
        return new QueryTerms(query, new ArrayList<>(termExtractor.distinctTerms(query)));
    }

    /**
     * Collects chunk-level matches.
     *
     * @param index          category to search
     * @param query          parsed query
     * @param strategy       index lookup or raw-text scan
     * @param matchFileNames whether file-name mentions in the query select documents
     * @return matches keyed by chunk location, in location order; empty when nothing matches
     */
    public Map<ChunkRef, MatchCandidate> match(final CategoryIndex index,
                                               final QueryTerms query,
                                               final EMatchStrategy strategy,
                                               final boolean matchFileNames) {
        if (query.isEmpty()) {
            return Map.of();
        }

        final Map<ChunkRef, Map<String, Integer>> matched = new TreeMap<>();
        if (strategy == EMatchStrategy.SCAN) {
            final List<Chunk> chunks = new ArrayList<>();
            index.documents().keySet().forEach(docId -> chunks.addAll(index.chunks(docId)));
            scan(chunks, query).forEach((ref, match) -> matched.put(ref, new LinkedHashMap<>(match.termFrequencies())));
        } else {
            for (String term : query.terms()) {
                for (Posting posting : index.index().postings(term)) {
                    matched.computeIfAbsent(posting.ref(), ref -> new LinkedHashMap<>())
                            .put(term, posting.termFrequency());
                }
            }
        }

        if (matchFileNames) {
            addFileNameMentions(index, query, matched);
        }

        final Map<ChunkRef, MatchCandidate> candidates = new LinkedHashMap<>();
        matched.forEach((ref, terms) -> index.chunk(ref).ifPresent(chunk ->
                candidates.put(ref, new MatchCandidate(chunk.docId(), chunk, chunk.text(), terms))));
        return candidates;
    }

    /**
     * Every chunk of a document whose file stem appears in the query gets the stem as a matched term.
     */
    private void addFileNameMentions(final CategoryIndex index,
                                     final QueryTerms query,
                                     final Map<ChunkRef, Map<String, Integer>> matched) {
        for (Map.Entry<String, Set<String>> mention : index.documentsMentionedIn(query.raw()).entrySet()) {
            for (String docId : mention.getValue()) {
                for (Chunk chunk : index.chunks(docId)) {
                    matched.computeIfAbsent(chunk.ref(), ref -> new LinkedHashMap<>())
                            .putIfAbsent(mention.getKey(), 1);
                }
                log.debug("Query mentions file of {}", docId);
            }
        }
    }

    /**
     * Scans chunk text directly with the query's automaton instead of using the index.
     *
     * @param chunks chunks to scan
     * @param query  parsed query
     * @return matches for every chunk containing at least one query term as a whole word
     */
    public Map<ChunkRef, MatchCandidate> scan(final Collection<Chunk> chunks, final QueryTerms query) {
        final Map<ChunkRef, MatchCandidate> candidates = new LinkedHashMap<>();
        if (query.isEmpty()) {
            return candidates;
        }
        for (Chunk chunk : chunks) {
            final Map<String, Integer> frequencies = new LinkedHashMap<>();
            for (TermAutomaton.Hit hit : query.automaton().scan(chunk.text())) {
                frequencies.merge(hit.pattern(), 1, Integer::sum);
            }
            if (!frequencies.isEmpty()) {
                candidates.put(chunk.ref(), new MatchCandidate(chunk.docId(), chunk, chunk.text(), frequencies));
            }
        }
        return candidates;
    }

    /**
     * Merges chunk matches into one candidate per document: the union of matched terms with
     * summed frequencies, carrying the full document text.
     *
     * @param matches chunk-level matches
     * @param index   category the matches came from
     * @return document-level candidates in document id order
     */
    public List<MatchCandidate> byDocument(final Map<ChunkRef, MatchCandidate> matches, final CategoryIndex index) {
        final Map<String, Map<String, Integer>> merged = new TreeMap<>();
        for (MatchCandidate match : matches.values()) {
            final Map<String, Integer> terms = merged.computeIfAbsent(match.docId(), id -> new LinkedHashMap<>());
            match.termFrequencies().forEach((term, frequency) -> terms.merge(term, frequency, Integer::sum));
        }

        final List<MatchCandidate> documents = new ArrayList<>(merged.size());
        merged.forEach((docId, terms) -> {
            final Document document = index.document(docId)
                    .orElseThrow(() -> new IllegalStateException("Match for unknown document: " + docId));
            documents.add(new MatchCandidate(docId, null, document.text(), terms));
        });
        return documents;
    }
}
