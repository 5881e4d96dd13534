package com.questrail.sequencer.search;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.parse.CommandClassifier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable inverted index over stored sequences and buttons.
 *
 * <p>Three maps point back at owners: lower-cased command text, command kind,
 * and keyword. An owner is a sequence name, or {@code button:<name>} for a
 * button. Keys and owner sets are sorted so results are stable.</p>
 */
final class SearchIndex {

    static final String BUTTON_PREFIX = "button:";
    static final int MIN_KEYWORD_LENGTH = 2;

    private static final SearchIndex EMPTY = new SearchIndex(new TreeMap<>(), new EnumMap<>(CommandKind.class),
            new TreeMap<>());

    private final SortedMap<String, SortedSet<String>> byText;
    private final Map<CommandKind, SortedSet<String>> byKind;
    private final SortedMap<String, SortedSet<String>> byKeyword;

    private SearchIndex(SortedMap<String, SortedSet<String>> byText,
                        Map<CommandKind, SortedSet<String>> byKind,
                        SortedMap<String, SortedSet<String>> byKeyword) {
        this.byText = byText;
        this.byKind = byKind;
        this.byKeyword = byKeyword;
    }

    static SearchIndex empty() {
        return EMPTY;
    }

    static SearchIndex build(Map<String, List<String>> sequences,
                             Map<String, String> buttons,
                             CommandClassifier classifier) {
        SortedMap<String, SortedSet<String>> byText = new TreeMap<>();
        Map<CommandKind, SortedSet<String>> byKind = new EnumMap<>(CommandKind.class);
        SortedMap<String, SortedSet<String>> byKeyword = new TreeMap<>();

        for (Map.Entry<String, List<String>> e : sequences.entrySet()) {
            for (String command : e.getValue()) {
                add(command, e.getKey(), classifier, byText, byKind, byKeyword);
            }
        }
        for (Map.Entry<String, String> e : buttons.entrySet()) {
            add(e.getValue(), BUTTON_PREFIX + e.getKey(), classifier, byText, byKind, byKeyword);
        }
        return new SearchIndex(byText, byKind, byKeyword);
    }

    private static void add(String command,
                            String owner,
                            CommandClassifier classifier,
                            SortedMap<String, SortedSet<String>> byText,
                            Map<CommandKind, SortedSet<String>> byKind,
                            SortedMap<String, SortedSet<String>> byKeyword) {
        if (command == null || command.isBlank()) {
            return;
        }
        String text = normalize(command);
        byText.computeIfAbsent(text, k -> new TreeSet<>()).add(owner);
        byKind.computeIfAbsent(classifier.classify(command).kind(), k -> new TreeSet<>()).add(owner);
        for (String keyword : keywords(text)) {
            byKeyword.computeIfAbsent(keyword, k -> new TreeSet<>()).add(owner);
        }
    }

    static String normalize(String text) {
        return text.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Words of at least two characters with non-word characters removed.
     */
    static Set<String> keywords(String text) {
        Set<String> out = new TreeSet<>();
        for (String word : normalize(text).split("\\s+")) {
            String clean = word.replaceAll("[^\\w]", "");
            if (clean.length() >= MIN_KEYWORD_LENGTH) {
                out.add(clean);
            }
        }
        return out;
    }

    SortedMap<String, SortedSet<String>> byText() {
        return Collections.unmodifiableSortedMap(byText);
    }

    SortedMap<String, SortedSet<String>> byKeyword() {
        return Collections.unmodifiableSortedMap(byKeyword);
    }

    Set<String> ownersOfKind(CommandKind kind) {
        SortedSet<String> owners = byKind.get(kind);
        return owners == null ? Set.of() : Collections.unmodifiableSet(owners);
    }

    Set<String> ownersOfKeyword(String keyword) {
        SortedSet<String> owners = byKeyword.get(keyword);
        return owners == null ? Set.of() : Collections.unmodifiableSet(owners);
    }

    int textCount() {
        return byText.size();
    }

    int keywordCount() {
        return byKeyword.size();
    }
}
