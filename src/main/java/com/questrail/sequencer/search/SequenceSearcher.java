package com.questrail.sequencer.search;

import com.questrail.sequencer.api.CacheStatistics;
import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.api.SearchMode;
import com.questrail.sequencer.cache.BoundedCache;
import com.questrail.sequencer.parse.CommandClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * SequenceSearcher
 * =============================================================================
 * Query surface over a {@link SearchIndex} of stored sequences and buttons.
 *
 * <h2>Results</h2>
 * <p>Results are owner names: a sequence name, or {@code button:<name>} for a
 * button whose command matched. They are sorted and truncated to the
 * requested maximum.</p>
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>{@link SearchMode#EXACT}: a command equals the query, ignoring case and
 *       surrounding whitespace.</li>
 *   <li>{@link SearchMode#CONTAINS}: a command contains the query.</li>
 *   <li>{@link SearchMode#STARTS_WITH}: a command starts with the query.</li>
 *   <li>{@link SearchMode#KEYWORD}: the owner has every keyword of the
 *       query.</li>
 * </ul>
 *
 * <h2>Rebuild</h2>
 * <p>{@link #rebuild} replaces the whole index and clears the result cache.
 * The index reference is swapped atomically, so readers never see a partial
 * index.</p>
 */
public final class SequenceSearcher {
    private static final Logger log = LoggerFactory.getLogger(SequenceSearcher.class);

    static final int MIN_SUGGEST_PREFIX = 2;

    private final CommandClassifier classifier;
    private final BoundedCache<String, List<String>> results;

    private volatile SearchIndex index = SearchIndex.empty();

    public SequenceSearcher(CommandClassifier classifier, BoundedCache<String, List<String>> results) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.results = Objects.requireNonNull(results, "results");
    }

    public void rebuild(Map<String, List<String>> sequences, Map<String, String> buttons) {
        Objects.requireNonNull(sequences, "sequences");
        Objects.requireNonNull(buttons, "buttons");
        SearchIndex rebuilt = SearchIndex.build(sequences, buttons, classifier);
        index = rebuilt;
        results.clear();
        log.debug("Search index rebuilt: {} command texts, {} keywords",
                rebuilt.textCount(), rebuilt.keywordCount());
    }

    /**
     * @throws IllegalArgumentException if {@code maxResults} is not positive
     */
    public List<String> search(String query, SearchMode mode, int maxResults) {
        Objects.requireNonNull(mode, "mode");
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String normalized = SearchIndex.normalize(query);
        String key = mode + ":" + maxResults + ":" + normalized;
        return results.get(key).orElseGet(() -> {
            List<String> found = truncate(find(index, normalized, mode), maxResults);
            results.put(key, found);
            return found;
        });
    }

    private static Set<String> find(SearchIndex idx, String query, SearchMode mode) {
        Set<String> owners = new TreeSet<>();
        switch (mode) {
            case EXACT -> {
                SortedSet<String> exact = idx.byText().get(query);
                if (exact != null) {
                    owners.addAll(exact);
                }
            }
            case CONTAINS -> idx.byText().forEach((text, who) -> {
                if (text.contains(query)) {
                    owners.addAll(who);
                }
            });
            case STARTS_WITH -> idx.byText().forEach((text, who) -> {
                if (text.startsWith(query)) {
                    owners.addAll(who);
                }
            });
            case KEYWORD -> {
                Set<String> words = SearchIndex.keywords(query);
                boolean first = true;
                for (String word : words) {
                    if (first) {
                        owners.addAll(idx.ownersOfKeyword(word));
                        first = false;
                    }
                    else {
                        owners.retainAll(idx.ownersOfKeyword(word));
                    }
                }
            }
        }
        return owners;
    }

    public List<String> searchByKind(CommandKind kind) {
        Objects.requireNonNull(kind, "kind");
        return List.copyOf(index.ownersOfKind(kind));
    }

    /**
     * Completion candidates: indexed command texts first, then keywords, all
     * lower-case. Prefixes shorter than two characters yield nothing.
     */
    public List<String> suggest(String prefix, int maxSuggestions) {
        if (maxSuggestions <= 0) {
            throw new IllegalArgumentException("maxSuggestions must be positive");
        }
        if (prefix == null || prefix.strip().length() < MIN_SUGGEST_PREFIX) {
            return List.of();
        }
        String p = SearchIndex.normalize(prefix);
        SearchIndex idx = index;
        Set<String> out = new LinkedHashSet<>();
        for (String text : idx.byText().tailMap(p).keySet()) {
            if (!text.startsWith(p) || out.size() >= maxSuggestions) {
                break;
            }
            out.add(text);
        }
        for (String keyword : idx.byKeyword().tailMap(p).keySet()) {
            if (!keyword.startsWith(p) || out.size() >= maxSuggestions) {
                break;
            }
            out.add(keyword);
        }
        return List.copyOf(out);
    }

    public CacheStatistics cacheStatistics() {
        return results.statistics();
    }

    public void resetStatistics() {
        results.resetStatistics();
    }

    private static List<String> truncate(Set<String> owners, int max) {
        List<String> out = new ArrayList<>(Math.min(owners.size(), max));
        for (String owner : owners) {
            if (out.size() >= max) {
                break;
            }
            out.add(owner);
        }
        return List.copyOf(out);
    }
}
