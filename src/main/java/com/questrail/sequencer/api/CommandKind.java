package com.questrail.sequencer.api;

/**
 * Classification of a single command line of the sequence language.
 */
public enum CommandKind {
    REGULAR,
    WAIT,
    SEQUENCE_REF,
    BUTTON_REF,
    IF,
    ELSE,
    END_IF,
    STOP_IF_NOT,
    MULTIZONE,
    TAGGED,
    UNKNOWN;

    /**
     * Whether this kind belongs to the if/else/endif block structure.
     * Such commands are processed even while a branch is suppressed.
     */
    public boolean isConditionalKeyword() {
        return this == IF || this == ELSE || this == END_IF;
    }
}
