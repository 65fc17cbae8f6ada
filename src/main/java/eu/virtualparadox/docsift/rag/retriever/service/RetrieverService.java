package eu.virtualparadox.docsift.rag.retriever.service;

import eu.virtualparadox.docsift.catalog.ECategory;
import eu.virtualparadox.docsift.rag.index.CorpusHandle;
import eu.virtualparadox.docsift.rag.retriever.model.SearchResult;

import java.util.List;
import java.util.function.Function;

public interface RetrieverService {

    /**
     * Retrieves the best {@code k} results for {@code query} from one category of the given corpus version.
     *
     * @return results best first; empty when nothing matches
     */
    List<SearchResult> retrieve(final CorpusHandle corpus, final String query, final ECategory category, final int k);

    /**
     * Same as {@link #retrieve(CorpusHandle, String, ECategory, int)} against the currently published corpus.
     *
     * @throws eu.virtualparadox.docsift.rag.index.IndexNotReadyException if no corpus has been loaded yet
     */
    List<SearchResult> retrieve(final String query, final ECategory category, final int k);

    /**
     * Retrieves and hands the results to {@code answerer}; the answer is memoized with the results.
     */
    String answer(final CorpusHandle corpus,
                  final String query,
                  final ECategory category,
                  final int k,
                  final Function<List<SearchResult>, String> answerer);

}
