package com.questrail.sequencer.zone;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.error.SequenceCancelledException;
import com.questrail.sequencer.error.SequenceException;
import com.questrail.sequencer.exec.AcknowledgedSender;
import com.questrail.sequencer.exec.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ZoneFanOut
 * =============================================================================
 * Runs one logical command once per active zone.
 *
 * <h2>Per zone, ascending id order</h2>
 * <ol>
 *   <li>mark EXECUTING</li>
 *   <li>send the zone's mask command ({@link ZoneSet#maskCommand(int)}) and
 *       await acknowledgement</li>
 *   <li>send the base command and await acknowledgement</li>
 *   <li>mark COMPLETED</li>
 * </ol>
 *
 * <h2>Failure</h2>
 * <p>The first failed send or acknowledgement marks that zone ERROR and ends
 * the fan-out; zones after it are not attempted and keep their prior status.
 * Cancellation marks the current zone ERROR before propagating, so no zone is
 * ever left EXECUTING. There is no retry at this layer.</p>
 */
public final class ZoneFanOut {
    private static final Logger log = LoggerFactory.getLogger(ZoneFanOut.class);

    private final ZoneTable zones;
    private final AcknowledgedSender sender;
    private final Duration ackTimeout;

    public ZoneFanOut(ZoneTable zones, AcknowledgedSender sender, Duration ackTimeout) {
        this.zones = Objects.requireNonNull(zones, "zones");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
    }

    /**
     * @throws SequenceCancelledException if the token is cancelled mid fan-out
     */
    public FanOutResult execute(String baseCommand, CancellationToken token) {
        Objects.requireNonNull(baseCommand, "baseCommand");
        Objects.requireNonNull(token, "token");

        List<Integer> active = zones.selection().ids();
        if (active.isEmpty()) {
            return new FanOutResult(false, List.of(), null, "no active zones selected",
                    ErrorCategory.STRUCTURAL, baseCommand, null);
        }

        List<Integer> completed = new ArrayList<>();
        for (int zone : active) {
            token.throwIfCancelled();
            zones.update(zone, ZoneStatus.EXECUTING, 0.0, null);
            String current = ZoneSet.maskCommand(zone);
            double progress = 0.0;
            try {
                sender.sendAndAwait(current, ackTimeout, token);
                progress = 0.5;
                zones.update(zone, ZoneStatus.EXECUTING, progress, null);

                current = baseCommand;
                sender.sendAndAwait(current, ackTimeout, token);
                zones.update(zone, ZoneStatus.COMPLETED, 1.0, null);
                completed.add(zone);
            }
            catch (SequenceCancelledException e) {
                zones.update(zone, ZoneStatus.ERROR, progress, "cancelled");
                throw e;
            }
            catch (SequenceException e) {
                zones.update(zone, ZoneStatus.ERROR, progress, e.getMessage());
                log.warn("Fan-out of '{}' failed in zone {}: {}", baseCommand, zone, e.getMessage());
                return new FanOutResult(false, completed, zone,
                        "zone " + zone + ": " + e.getMessage(), e.category(), current, e.deviceResponse());
            }
            catch (RuntimeException e) {
                zones.update(zone, ZoneStatus.ERROR, progress, String.valueOf(e.getMessage()));
                throw e;
            }
        }
        return FanOutResult.succeeded(completed);
    }
}
