package com.questrail.sequencer.api;

/**
 * How a search query is matched against indexed command text.
 */
public enum SearchMode {
    /** Whole command text equals the query (case-insensitive). */
    EXACT,
    /** Command text contains the query. */
    CONTAINS,
    /** Command text starts with the query. */
    STARTS_WITH,
    /** Every word of the query appears as an indexed word. */
    KEYWORD
}
