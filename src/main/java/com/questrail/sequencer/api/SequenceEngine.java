package com.questrail.sequencer.api;

import com.questrail.sequencer.zone.ZoneState;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * SequenceEngine
 * -----------------------------------------------------------------------------
 * {@code SequenceEngine} is the single entry point for storing, inspecting and
 * running command sequences against a device.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Owning the sequence and button tables</li>
 *   <li>Classifying, validating, expanding and searching commands</li>
 *   <li>Holding the condition flags and the active zone selection</li>
 *   <li>Running command lists synchronously or on a background worker</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Opening or framing the serial link (see the transport port)</li>
 *   <li>Loading or persisting configuration files</li>
 *   <li>Presenting anything to a user</li>
 * </ul>
 *
 * <h2>Validation before execution</h2>
 * Every execution path validates first. A list that fails validation yields a
 * FAILED {@link ExecutionOutcome} and sends nothing to the device.
 *
 * <h2>Caches</h2>
 * Classification, validation, expansion and search results are cached.
 * Adding, replacing or removing a sequence or button invalidates exactly the
 * cached results that consulted that name, so callers never observe a stale
 * expansion.
 *
 * <h2>Threading and Concurrency</h2>
 * Implementations are thread-safe. Table reads and writes are serialized; a
 * run in progress does not block table access.
 */
public interface SequenceEngine extends AutoCloseable
{
    // ---------------------------------------------------------------------
    // Tables
    // ---------------------------------------------------------------------

    /**
     * Stores or replaces a sequence.
     *
     * @throws IllegalArgumentException if the name is blank
     */
    void addSequence(String name, List<String> commands);

    /**
     * @return whether a sequence of that name existed
     */
    boolean removeSequence(String name);

    Optional<List<String>> getSequence(String name);

    List<String> sequenceNames();

    /**
     * Stores or replaces a button macro.
     *
     * @throws IllegalArgumentException if the name or command is blank
     */
    void addButton(String name, String command);

    boolean removeButton(String name);

    Optional<String> getButton(String name);

    List<String> buttonNames();

    // ---------------------------------------------------------------------
    // Language
    // ---------------------------------------------------------------------

    ValidationOutcome classify(String command);

    /**
     * Validates a stored sequence after expansion, including its references.
     * An unknown name yields a report with a single STRUCTURAL issue.
     */
    ValidationReport validate(String name);

    ValidationReport validateCommands(List<String> commands);

    /**
     * Flattens a stored sequence. Unknown or cyclic sequences expand to an
     * empty list.
     */
    List<String> expand(String name);

    List<String> search(String query, SearchMode mode, int maxResults);

    List<String> searchByKind(CommandKind kind);

    List<String> suggest(String prefix, int maxSuggestions);

    Optional<SequenceInfo> describe(String name);

    // ---------------------------------------------------------------------
    // Flags and zones
    // ---------------------------------------------------------------------

    void setFlag(String name, boolean value);

    boolean flag(String name);

    void clearFlags();

    /**
     * Selects the zones used by fan-out commands.
     *
     * @throws IllegalArgumentException if the ids are empty, out of range or repeated
     */
    void setZones(List<Integer> zoneIds);

    int zoneMask();

    List<ZoneState> zoneStates();

    void resetZones();

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    /**
     * Expands and runs the commands on the calling thread.
     */
    ExecutionOutcome execute(List<String> commands);

    /**
     * Expands and runs a stored sequence on the calling thread.
     */
    ExecutionOutcome executeSequence(String name);

    CompletableFuture<ExecutionOutcome> executeAsync(List<String> commands);

    /**
     * Runs in the background with an overall deadline. A run stopped by the
     * deadline ends FAILED with category {@link ErrorCategory#TIMEOUT}.
     *
     * @throws IllegalStateException if a background run is already active
     */
    CompletableFuture<ExecutionOutcome> executeAsync(List<String> commands, Duration timeout);

    boolean pause();

    boolean resume();

    boolean cancel();

    ExecutionProgress progress();

    // ---------------------------------------------------------------------
    // Statistics and lifecycle
    // ---------------------------------------------------------------------

    EngineStatistics statistics();

    void resetStatistics();

    /**
     * Cancels any background run and releases the worker thread.
     */
    @Override
    void close();
}
