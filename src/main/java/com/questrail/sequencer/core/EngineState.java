package com.questrail.sequencer.core;

import com.questrail.sequencer.condition.FlagSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sequence table, button table and condition flags of one engine.
 *
 * <p>Everything is guarded by one reentrant lock. The engine takes the same
 * lock around a mutation and the cache invalidation that follows it, so no
 * reader sees a table change without the matching cache state. Snapshots are
 * immutable copies and may be used after the lock is released.</p>
 */
final class EngineState implements FlagSource {

    final ReentrantLock lock = new ReentrantLock();

    private final Map<String, List<String>> sequences = new LinkedHashMap<>();
    private final Map<String, String> buttons = new LinkedHashMap<>();
    private final Map<String, Boolean> flags = new HashMap<>();

    boolean putSequence(String name, List<String> commands) {
        lock.lock();
        try {
            return sequences.put(name, List.copyOf(commands)) != null;
        } finally {
            lock.unlock();
        }
    }

    boolean removeSequence(String name) {
        lock.lock();
        try {
            return sequences.remove(name) != null;
        } finally {
            lock.unlock();
        }
    }

    Optional<List<String>> sequence(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(sequences.get(name));
        } finally {
            lock.unlock();
        }
    }

    List<String> sequenceNames() {
        lock.lock();
        try {
            return List.copyOf(new ArrayList<>(sequences.keySet()));
        } finally {
            lock.unlock();
        }
    }

    boolean putButton(String name, String command) {
        lock.lock();
        try {
            return buttons.put(name, command) != null;
        } finally {
            lock.unlock();
        }
    }

    boolean removeButton(String name) {
        lock.lock();
        try {
            return buttons.remove(name) != null;
        } finally {
            lock.unlock();
        }
    }

    Optional<String> button(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(buttons.get(name));
        } finally {
            lock.unlock();
        }
    }

    List<String> buttonNames() {
        lock.lock();
        try {
            return List.copyOf(new ArrayList<>(buttons.keySet()));
        } finally {
            lock.unlock();
        }
    }

    Map<String, List<String>> sequencesSnapshot() {
        lock.lock();
        try {
            return Map.copyOf(sequences);
        } finally {
            lock.unlock();
        }
    }

    Map<String, String> buttonsSnapshot() {
        lock.lock();
        try {
            return Map.copyOf(buttons);
        } finally {
            lock.unlock();
        }
    }

    void setFlag(String name, boolean value) {
        lock.lock();
        try {
            flags.put(name, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean getFlag(String name) {
        lock.lock();
        try {
            return flags.getOrDefault(name, Boolean.FALSE);
        } finally {
            lock.unlock();
        }
    }

    void clearFlags() {
        lock.lock();
        try {
            flags.clear();
        } finally {
            lock.unlock();
        }
    }
}
