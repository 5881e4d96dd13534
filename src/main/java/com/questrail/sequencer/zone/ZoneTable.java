package com.questrail.sequencer.zone;

import com.questrail.sequencer.observability.NullObservabilitySink;
import com.questrail.sequencer.observability.SequenceObservabilitySink;
import com.questrail.sequencer.observability.ZoneTransitionEvent;
import com.questrail.sequencer.time.WallClock;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ZoneTable
 * =============================================================================
 * Selection and per-zone status of the four zones.
 *
 * <p>Shared between the caller thread and the worker, so every access goes
 * through a private lock. Status changes are reported to the observability
 * sink after the lock is released.</p>
 */
public final class ZoneTable {

    private final Object lock = new Object();
    private final WallClock wallClock;
    private volatile SequenceObservabilitySink sink = NullObservabilitySink.INSTANCE;

    private ZoneSet selection = ZoneSet.empty();
    private final ZoneState[] states = new ZoneState[ZoneSet.MAX_ZONE + 1];

    public ZoneTable(WallClock wallClock) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        for (int z = ZoneSet.MIN_ZONE; z <= ZoneSet.MAX_ZONE; z++) {
            states[z] = ZoneState.inactive(z);
        }
    }

    public void setObservabilitySink(SequenceObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Makes {@code zones} the active selection: selected zones become ACTIVE,
     * the others INACTIVE.
     */
    public void select(ZoneSet zones) {
        Objects.requireNonNull(zones, "zones");
        List<ZoneTransitionEvent> events = new ArrayList<>();
        synchronized (lock) {
            selection = zones;
            for (int z = ZoneSet.MIN_ZONE; z <= ZoneSet.MAX_ZONE; z++) {
                ZoneStatus target = zones.contains(z) ? ZoneStatus.ACTIVE : ZoneStatus.INACTIVE;
                setLocked(z, new ZoneState(z, target, 0.0, null), events);
            }
        }
        publish(events);
    }

    public ZoneSet selection() {
        synchronized (lock) {
            return selection;
        }
    }

    public int mask() {
        return selection().mask();
    }

    public ZoneState state(int zone) {
        ZoneSet.checkZone(zone);
        synchronized (lock) {
            return states[zone];
        }
    }

    public List<ZoneState> states() {
        synchronized (lock) {
            List<ZoneState> out = new ArrayList<>(ZoneSet.MAX_ZONE);
            for (int z = ZoneSet.MIN_ZONE; z <= ZoneSet.MAX_ZONE; z++) {
                out.add(states[z]);
            }
            return out;
        }
    }

    /**
     * Clears the selection and returns every zone to INACTIVE.
     */
    public void reset() {
        select(ZoneSet.empty());
    }

    /**
     * Returns selected zones to ACTIVE, clearing errors and progress.
     */
    public void rearm() {
        select(selection());
    }

    void update(int zone, ZoneStatus status, double progress, String error) {
        List<ZoneTransitionEvent> events = new ArrayList<>(1);
        synchronized (lock) {
            setLocked(zone, new ZoneState(zone, status, progress, error), events);
        }
        publish(events);
    }

    private void setLocked(int zone, ZoneState next, List<ZoneTransitionEvent> events) {
        ZoneState prev = states[zone];
        states[zone] = next;
        if (prev.status() != next.status()) {
            events.add(new ZoneTransitionEvent(wallClock.now(), zone, prev.status(), next.status(), next.error()));
        }
    }

    private void publish(List<ZoneTransitionEvent> events) {
        SequenceObservabilitySink s = sink;
        for (ZoneTransitionEvent e : events) {
            s.onZoneTransition(e);
        }
    }
}
