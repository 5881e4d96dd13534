package com.questrail.sequencer.core;

import com.questrail.sequencer.api.CacheStatistics;
import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.api.CommandResult;
import com.questrail.sequencer.api.EngineStatistics;
import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ExecutionOutcome;
import com.questrail.sequencer.api.ExecutionProgress;
import com.questrail.sequencer.api.RunStatus;
import com.questrail.sequencer.api.SearchMode;
import com.questrail.sequencer.api.SequenceEngine;
import com.questrail.sequencer.api.SequenceInfo;
import com.questrail.sequencer.api.ValidationIssue;
import com.questrail.sequencer.api.ValidationOutcome;
import com.questrail.sequencer.api.ValidationReport;
import com.questrail.sequencer.cache.BoundedCache;
import com.questrail.sequencer.cache.CacheLimits;
import com.questrail.sequencer.config.EngineConfig;
import com.questrail.sequencer.exec.AcknowledgedSender;
import com.questrail.sequencer.exec.CancellationToken;
import com.questrail.sequencer.exec.CommandDispatcher;
import com.questrail.sequencer.exec.ProgressListener;
import com.questrail.sequencer.exec.SequenceExecutor;
import com.questrail.sequencer.exec.SequenceRunner;
import com.questrail.sequencer.exec.SequenceWorker;
import com.questrail.sequencer.exec.handler.CommandHandlerRegistry;
import com.questrail.sequencer.macro.Expansion;
import com.questrail.sequencer.macro.MacroExpander;
import com.questrail.sequencer.macro.ReferenceResolver;
import com.questrail.sequencer.observability.SequenceObservabilitySink;
import com.questrail.sequencer.parse.Command;
import com.questrail.sequencer.parse.CommandClassifier;
import com.questrail.sequencer.search.SequenceSearcher;
import com.questrail.sequencer.time.MonotonicClock;
import com.questrail.sequencer.time.MonotonicScheduler;
import com.questrail.sequencer.time.WallClock;
import com.questrail.sequencer.transport.DeviceTransport;
import com.questrail.sequencer.validate.SequenceValidator;
import com.questrail.sequencer.zone.ZoneFanOut;
import com.questrail.sequencer.zone.ZoneSet;
import com.questrail.sequencer.zone.ZoneState;
import com.questrail.sequencer.zone.ZoneTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DefaultSequenceEngine
 * =============================================================================
 * Thread-safe {@link SequenceEngine} over a {@link DeviceTransport}.
 *
 * <h2>Ownership</h2>
 * <p>The engine owns the tables ({@link EngineState}), the caches, the search
 * index, the zone table and one {@link SequenceWorker}. It does NOT own the
 * transport or the scheduler; their lifecycle belongs to the caller (see
 * {@link SequenceEngineRuntime}).</p>
 *
 * <h2>Mutation</h2>
 * <p>Adding, replacing or removing a sequence or button happens under the
 * state lock together with its consequences: dependent validation and
 * expansion entries are dropped, the search cache is cleared and the index
 * rebuilt. Cached validation and expansion results are also computed under
 * the lock so an invalidation can never be overtaken by a stale insert.</p>
 *
 * <h2>Execution</h2>
 * <p>Commands are expanded, validated and run. The synchronous path and the
 * background worker may not run at the same time: the device takes one
 * command stream at a time.</p>
 */
public final class DefaultSequenceEngine implements SequenceEngine {
    private static final Logger log = LoggerFactory.getLogger(DefaultSequenceEngine.class);

    static final Duration PER_COMMAND_ALLOWANCE = Duration.ofMillis(100);

    private final EngineState state = new EngineState();

    private final CommandClassifier classifier;
    private final MacroExpander expander;
    private final SequenceValidator validator;
    private final SequenceSearcher searcher;
    private final ZoneTable zones;
    private final SequenceExecutor executor;
    private final SequenceWorker worker;

    private final BoundedCache<String, ValidationOutcome> classifyCache;
    private final BoundedCache<String, ValidationReport> validateCache;
    private final BoundedCache<String, Expansion> expandCache;

    private final Object syncLock = new Object();
    private CancellationToken syncToken;

    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong successfulRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final AtomicLong cancelledRuns = new AtomicLong();
    private final AtomicLong commandsExecuted = new AtomicLong();
    private final AtomicLong commandsSucceeded = new AtomicLong();
    private final AtomicLong commandsFailed = new AtomicLong();

    public DefaultSequenceEngine(EngineConfig config,
                                 DeviceTransport transport,
                                 MonotonicClock clock,
                                 WallClock wallClock,
                                 MonotonicScheduler scheduler,
                                 SequenceObservabilitySink sink) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(sink, "sink");

        CacheLimits limits = config.cacheLimits();
        this.classifyCache = new BoundedCache<>("classify", limits.classifyCapacity(), limits.evictionFraction(), clock);
        this.validateCache = new BoundedCache<>("validate", limits.validateCapacity(), limits.evictionFraction(), clock);
        this.expandCache = new BoundedCache<>("expand", limits.expandCapacity(), limits.evictionFraction(), clock);
        BoundedCache<String, List<String>> searchCache =
                new BoundedCache<>("search", limits.searchCapacity(), limits.evictionFraction(), clock);

        this.classifier = new CommandClassifier(config.languageLimits(), clock, classifyCache);
        ReferenceResolver resolver = new ReferenceResolver(classifier);
        this.expander = new MacroExpander(resolver, config.languageLimits().maxExpansionDepth());
        this.validator = new SequenceValidator(classifier, resolver);
        this.searcher = new SequenceSearcher(classifier, searchCache);

        this.zones = new ZoneTable(wallClock);
        zones.setObservabilitySink(sink);

        AcknowledgedSender sender = new AcknowledgedSender(transport, clock, config.timingPolicy().slice());
        ZoneFanOut fanOut = new ZoneFanOut(zones, sender, config.timingPolicy().zoneAckTimeout());
        CommandHandlerRegistry registry = CommandHandlerRegistry.standard(sender, fanOut, config.timingPolicy(), clock);
        CommandDispatcher dispatcher = new CommandDispatcher(classifier, registry, clock);

        SequenceRunner runner = new SequenceRunner(classifier, validator, dispatcher, state,
                config.nestedConditionPolicy(), config.failurePolicy(), config.timingPolicy(), sink, wallClock);
        this.executor = new SequenceExecutor(runner);
        this.worker = new SequenceWorker(runner, scheduler, clock);
    }

    // ---------------------------------------------------------------------
    // Tables
    // ---------------------------------------------------------------------

    @Override
    public void addSequence(String name, List<String> commands) {
        requireName(name);
        Objects.requireNonNull(commands, "commands");
        for (String command : commands) {
            Objects.requireNonNull(command, "command");
        }
        state.lock.lock();
        try {
            boolean replaced = state.putSequence(name, commands);
            tablesChanged(name);
            log.debug("{} sequence '{}' ({} commands)", replaced ? "Redefined" : "Added", name, commands.size());
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public boolean removeSequence(String name) {
        state.lock.lock();
        try {
            boolean removed = name != null && state.removeSequence(name);
            if (removed) {
                tablesChanged(name);
            }
            return removed;
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public Optional<List<String>> getSequence(String name) {
        return name == null ? Optional.empty() : state.sequence(name);
    }

    @Override
    public List<String> sequenceNames() {
        return state.sequenceNames();
    }

    @Override
    public void addButton(String name, String command) {
        requireName(name);
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("button command must not be blank");
        }
        state.lock.lock();
        try {
            state.putButton(name, command);
            tablesChanged(name);
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public boolean removeButton(String name) {
        state.lock.lock();
        try {
            boolean removed = name != null && state.removeButton(name);
            if (removed) {
                tablesChanged(name);
            }
            return removed;
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public Optional<String> getButton(String name) {
        return name == null ? Optional.empty() : state.button(name);
    }

    @Override
    public List<String> buttonNames() {
        return state.buttonNames();
    }

    // Caller holds state.lock.
    private void tablesChanged(String name) {
        int dropped = validateCache.invalidateDependents(name) + expandCache.invalidateDependents(name);
        searcher.rebuild(state.sequencesSnapshot(), state.buttonsSnapshot());
        if (dropped > 0) {
            log.debug("Change to '{}' invalidated {} cached results", name, dropped);
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    // ---------------------------------------------------------------------
    // Language
    // ---------------------------------------------------------------------

    @Override
    public ValidationOutcome classify(String command) {
        return classifier.classify(command);
    }

    @Override
    public ValidationReport validate(String name) {
        state.lock.lock();
        try {
            if (name == null || state.sequence(name).isEmpty()) {
                return new ValidationReport(List.of(
                        new ValidationIssue(0, "unknown sequence '" + name + "'", ErrorCategory.STRUCTURAL)));
            }
            Optional<ValidationReport> cached = validateCache.get(name);
            if (cached.isPresent()) {
                return cached.get();
            }
            Map<String, List<String>> sequences = state.sequencesSnapshot();
            Map<String, String> buttons = state.buttonsSnapshot();
            Expansion expansion = expansionLocked(name);

            ValidationReport report = validator.validateReferences(sequences.get(name), sequences, buttons)
                    .merge(validator.validateSequence(expansion.commands()));
            Set<String> deps = new HashSet<>(expansion.dependencies());
            deps.add(name);
            validateCache.put(name, report, deps);
            return report;
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public ValidationReport validateCommands(List<String> commands) {
        Objects.requireNonNull(commands, "commands");
        Map<String, List<String>> sequences;
        Map<String, String> buttons;
        state.lock.lock();
        try {
            sequences = state.sequencesSnapshot();
            buttons = state.buttonsSnapshot();
        } finally {
            state.lock.unlock();
        }
        Expansion expansion = expander.expandItems(commands, sequences, buttons);
        return validator.validateReferences(commands, sequences, buttons)
                .merge(validator.validateSequence(expansion.commands()));
    }

    @Override
    public List<String> expand(String name) {
        if (name == null) {
            return List.of();
        }
        state.lock.lock();
        try {
            return expansionLocked(name).commands();
        } finally {
            state.lock.unlock();
        }
    }

    // Caller holds state.lock.
    private Expansion expansionLocked(String name) {
        Optional<Expansion> cached = expandCache.get(name);
        if (cached.isPresent()) {
            return cached.get();
        }
        Expansion expansion = expander.expand(name, state.sequencesSnapshot(), state.buttonsSnapshot());
        Set<String> deps = new HashSet<>(expansion.dependencies());
        deps.add(name);
        expandCache.put(name, expansion, deps);
        return expansion;
    }

    @Override
    public List<String> search(String query, SearchMode mode, int maxResults) {
        return searcher.search(query, mode, maxResults);
    }

    @Override
    public List<String> searchByKind(CommandKind kind) {
        return searcher.searchByKind(kind);
    }

    @Override
    public List<String> suggest(String prefix, int maxSuggestions) {
        return searcher.suggest(prefix, maxSuggestions);
    }

    /**
     * Estimated duration is the sum of waits plus a fixed allowance for every
     * other dispatched command. Complexity weights: {@code if} 2, {@code wait} 1,
     * zone fan-out 3, anything else 1.
     */
    @Override
    public Optional<SequenceInfo> describe(String name) {
        Optional<List<String>> stored = getSequence(name);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        Expansion expansion;
        state.lock.lock();
        try {
            expansion = expansionLocked(name);
        } finally {
            state.lock.unlock();
        }

        Map<CommandKind, Integer> counts = new EnumMap<>(CommandKind.class);
        Duration estimate = Duration.ZERO;
        int complexity = 0;
        for (String raw : expansion.commands()) {
            ValidationOutcome outcome = classifier.classify(raw);
            counts.merge(outcome.kind(), 1, Integer::sum);
            switch (outcome.kind()) {
                case WAIT -> {
                    complexity += 1;
                    if (outcome.valid()) {
                        Command command = new Command(raw, outcome.kind(), outcome.payload());
                        estimate = estimate.plusNanos((long) (command.waitSeconds() * 1_000_000_000L));
                    }
                }
                case IF -> complexity += 2;
                case ELSE, END_IF -> complexity += 1;
                case MULTIZONE -> {
                    boolean fanOut = outcome.valid()
                            && Boolean.TRUE.equals(outcome.payload().get(Command.FAN_OUT));
                    complexity += fanOut ? 3 : 1;
                    estimate = estimate.plus(PER_COMMAND_ALLOWANCE);
                }
                default -> {
                    complexity += 1;
                    estimate = estimate.plus(PER_COMMAND_ALLOWANCE);
                }
            }
        }
        return Optional.of(new SequenceInfo(name, stored.get().size(), expansion.commands().size(), counts,
                estimate, complexity, expansion.dependencies()));
    }

    // ---------------------------------------------------------------------
    // Flags and zones
    // ---------------------------------------------------------------------

    @Override
    public void setFlag(String name, boolean value) {
        requireName(name);
        state.setFlag(name, value);
    }

    @Override
    public boolean flag(String name) {
        return name != null && state.getFlag(name);
    }

    @Override
    public void clearFlags() {
        state.clearFlags();
    }

    @Override
    public void setZones(List<Integer> zoneIds) {
        zones.select(ZoneSet.of(Objects.requireNonNull(zoneIds, "zoneIds")));
    }

    @Override
    public int zoneMask() {
        return zones.mask();
    }

    @Override
    public List<ZoneState> zoneStates() {
        return zones.states();
    }

    @Override
    public void resetZones() {
        zones.reset();
    }

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    /**
     * @throws IllegalStateException if a background run is active
     */
    @Override
    public ExecutionOutcome execute(List<String> commands) {
        List<String> expanded = expandForRun(commands);
        CancellationToken token = new CancellationToken();
        synchronized (syncLock) {
            if (worker.isRunning()) {
                throw new IllegalStateException("a background run is in progress");
            }
            if (syncToken != null) {
                throw new IllegalStateException("a run is already in progress");
            }
            syncToken = token;
        }
        try {
            zones.rearm();
            ExecutionOutcome outcome = executor.execute(expanded, token, ProgressListener.NONE);
            record(outcome);
            return outcome;
        } finally {
            synchronized (syncLock) {
                syncToken = null;
            }
        }
    }

    @Override
    public ExecutionOutcome executeSequence(String name) {
        if (getSequence(name).isEmpty()) {
            String message = "unknown sequence '" + name + "'";
            ExecutionOutcome outcome = ExecutionOutcome.failed(message, null, null, ErrorCategory.STRUCTURAL, List.of());
            record(outcome);
            return outcome;
        }
        return execute(List.of(name));
    }

    @Override
    public CompletableFuture<ExecutionOutcome> executeAsync(List<String> commands) {
        return executeAsync(commands, null);
    }

    @Override
    public CompletableFuture<ExecutionOutcome> executeAsync(List<String> commands, Duration timeout) {
        List<String> expanded = expandForRun(commands);
        CompletableFuture<ExecutionOutcome> future;
        synchronized (syncLock) {
            if (syncToken != null) {
                throw new IllegalStateException("a synchronous run is in progress");
            }
            // Rejected starts must leave the active run's zones alone.
            if (worker.isRunning()) {
                throw new IllegalStateException("a run is already in progress");
            }
            zones.rearm();
            future = worker.start(expanded, timeout);
        }
        return future.whenComplete((outcome, error) -> {
            if (outcome != null) {
                record(outcome);
            }
        });
    }

    private List<String> expandForRun(List<String> commands) {
        Objects.requireNonNull(commands, "commands");
        Expansion expansion;
        state.lock.lock();
        try {
            expansion = expander.expandItems(commands, state.sequencesSnapshot(), state.buttonsSnapshot());
        } finally {
            state.lock.unlock();
        }
        if (expansion.truncated()) {
            log.warn("Expansion was cut at depth {}; some referenced commands will not run",
                    classifier.limits().maxExpansionDepth());
        }
        return expansion.commands();
    }

    @Override
    public boolean pause() {
        return worker.pause();
    }

    @Override
    public boolean resume() {
        return worker.resume();
    }

    @Override
    public boolean cancel() {
        boolean any = worker.cancel();
        synchronized (syncLock) {
            if (syncToken != null) {
                syncToken.cancel();
                any = true;
            }
        }
        return any;
    }

    @Override
    public ExecutionProgress progress() {
        return worker.progress();
    }

    // ---------------------------------------------------------------------
    // Statistics and lifecycle
    // ---------------------------------------------------------------------

    private void record(ExecutionOutcome outcome) {
        totalRuns.incrementAndGet();
        if (outcome.status() == RunStatus.COMPLETED) {
            successfulRuns.incrementAndGet();
        }
        else if (outcome.status() == RunStatus.CANCELLED) {
            cancelledRuns.incrementAndGet();
        }
        else {
            failedRuns.incrementAndGet();
        }
        for (CommandResult result : outcome.results()) {
            if (result.skipped()) {
                continue;
            }
            commandsExecuted.incrementAndGet();
            if (result.success()) {
                commandsSucceeded.incrementAndGet();
            }
            else {
                commandsFailed.incrementAndGet();
            }
        }
    }

    @Override
    public EngineStatistics statistics() {
        List<CacheStatistics> caches = List.of(
                classifyCache.statistics(),
                validateCache.statistics(),
                expandCache.statistics(),
                searcher.cacheStatistics());
        return new EngineStatistics(
                state.sequenceNames().size(),
                state.buttonNames().size(),
                totalRuns.get(),
                successfulRuns.get(),
                failedRuns.get(),
                cancelledRuns.get(),
                commandsExecuted.get(),
                commandsSucceeded.get(),
                commandsFailed.get(),
                caches);
    }

    @Override
    public void resetStatistics() {
        totalRuns.set(0);
        successfulRuns.set(0);
        failedRuns.set(0);
        cancelledRuns.set(0);
        commandsExecuted.set(0);
        commandsSucceeded.set(0);
        commandsFailed.set(0);
        classifyCache.resetStatistics();
        validateCache.resetStatistics();
        expandCache.resetStatistics();
        searcher.resetStatistics();
    }

    @Override
    public void close() {
        cancel();
        worker.close();
    }
}
