package com.questrail.sequencer.macro;

import java.util.Objects;

/**
 * What a sequence item points at, if anything.
 *
 * @param type target table
 * @param name referenced name; empty for {@link Type#NONE}. For
 *             {@link Type#UNRESOLVED} the bare item text, which becomes a
 *             reference once a sequence or button of that name is defined.
 */
public record Reference(Type type, String name) {

    public enum Type { SEQUENCE, BUTTON, UNRESOLVED, NONE }

    private static final Reference NONE = new Reference(Type.NONE, "");

    public Reference {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
    }

    public static Reference none() {
        return NONE;
    }

    public static Reference sequence(String name) {
        return new Reference(Type.SEQUENCE, name);
    }

    public static Reference button(String name) {
        return new Reference(Type.BUTTON, name);
    }

    public static Reference unresolved(String bare) {
        return new Reference(Type.UNRESOLVED, bare);
    }

    public boolean isSequence() {
        return type == Type.SEQUENCE;
    }

    public boolean isButton() {
        return type == Type.BUTTON;
    }
}
