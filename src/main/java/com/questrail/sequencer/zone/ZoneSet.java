package com.questrail.sequencer.zone;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ZoneSet
 * -----------------------------------------------------------------------------
 * Immutable selection of zones, stored as a 4-bit mask: bit {@code i} is set
 * iff zone {@code i + 1} is selected.
 */
public final class ZoneSet {

    public static final int MIN_ZONE = 1;
    public static final int MAX_ZONE = 4;

    private static final ZoneSet EMPTY = new ZoneSet(0);

    private final int mask;

    private ZoneSet(int mask) {
        this.mask = mask;
    }

    /**
     * @throws IllegalArgumentException if {@code ids} is empty, holds an id
     *         outside 1..4, or holds a duplicate
     */
    public static ZoneSet of(Collection<Integer> ids) {
        Objects.requireNonNull(ids, "ids");
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("at least one zone must be selected");
        }
        Set<Integer> seen = new HashSet<>();
        int mask = 0;
        for (Integer id : ids) {
            Objects.requireNonNull(id, "zone id");
            checkZone(id);
            if (!seen.add(id)) {
                throw new IllegalArgumentException("duplicate zone " + id);
            }
            mask |= bit(id);
        }
        return new ZoneSet(mask);
    }

    public static ZoneSet of(int... ids) {
        List<Integer> boxed = new ArrayList<>(ids.length);
        for (int id : ids) {
            boxed.add(id);
        }
        return of(boxed);
    }

    public static ZoneSet empty() {
        return EMPTY;
    }

    public static ZoneSet fromMask(int mask) {
        if (mask < 0 || mask > 0b1111) {
            throw new IllegalArgumentException("zone mask must fit in 4 bits: " + mask);
        }
        return mask == 0 ? EMPTY : new ZoneSet(mask);
    }

    /**
     * The device command that selects a single zone, e.g.
     * {@code maskCommand(3) == "multizone 0100"}.
     */
    public static String maskCommand(int zone) {
        return "multizone " + toBinary(bit(checkZone(zone)));
    }

    static int checkZone(int zone) {
        if (zone < MIN_ZONE || zone > MAX_ZONE) {
            throw new IllegalArgumentException("zone must be in " + MIN_ZONE + ".." + MAX_ZONE + ": " + zone);
        }
        return zone;
    }

    private static int bit(int zone) {
        return 1 << (zone - 1);
    }

    private static String toBinary(int mask) {
        String bits = Integer.toBinaryString(mask);
        return "0".repeat(4 - bits.length()) + bits;
    }

    public int mask() {
        return mask;
    }

    public String maskBits() {
        return toBinary(mask);
    }

    public boolean contains(int zone) {
        return zone >= MIN_ZONE && zone <= MAX_ZONE && (mask & bit(zone)) != 0;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    /**
     * Selected ids in ascending order.
     */
    public List<Integer> ids() {
        List<Integer> ids = new ArrayList<>();
        for (int z = MIN_ZONE; z <= MAX_ZONE; z++) {
            if (contains(z)) {
                ids.add(z);
            }
        }
        return ids;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ZoneSet other && other.mask == mask;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(mask);
    }

    @Override
    public String toString() {
        return "ZoneSet" + ids();
    }
}
