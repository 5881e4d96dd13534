package com.questrail.sequencer.condition;

/**
 * Read access to the named boolean flags that conditions test.
 *
 * <p>Unknown flags read as {@code false}.</p>
 */
@FunctionalInterface
public interface FlagSource {

    boolean getFlag(String name);

    /**
     * A source in which every flag is false.
     */
    static FlagSource none() {
        return name -> false;
    }
}
