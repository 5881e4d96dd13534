package com.questrail.sequencer.exec;

import com.questrail.sequencer.error.CommandTimeoutException;
import com.questrail.sequencer.error.DeviceErrorException;
import com.questrail.sequencer.error.SequenceCancelledException;
import com.questrail.sequencer.error.TransportException;
import com.questrail.sequencer.time.MonotonicClock;
import com.questrail.sequencer.transport.Acknowledgement;
import com.questrail.sequencer.transport.DeviceTransport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AcknowledgedSender
 * =============================================================================
 * Sends one command and waits for the device to acknowledge it.
 *
 * <h2>Single slot</h2>
 * <p>Send and acknowledgement wait happen under one lock, so commands issued
 * through the same sender never overlap on the transport.</p>
 *
 * <h2>Sliced wait</h2>
 * <p>The acknowledgement deadline is measured on the monotonic clock; the
 * transport is polled in slices no longer than the configured slice and the
 * cancellation token is checked between slices.</p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>send refused: {@link TransportException}</li>
 *   <li>error keyword: {@link DeviceErrorException}</li>
 *   <li>no acknowledgement by the deadline: {@link CommandTimeoutException}</li>
 *   <li>cancelled while waiting: {@link SequenceCancelledException}</li>
 * </ul>
 */
public final class AcknowledgedSender {

    private final DeviceTransport transport;
    private final MonotonicClock clock;
    private final Duration slice;
    private final ReentrantLock inFlight = new ReentrantLock();

    public AcknowledgedSender(DeviceTransport transport, MonotonicClock clock, Duration slice) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.slice = Objects.requireNonNull(slice, "slice");
    }

    /**
     * @return the successful acknowledgement
     */
    public Acknowledgement sendAndAwait(String command, Duration timeout, CancellationToken token) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(token, "token");

        inFlight.lock();
        try {
            token.throwIfCancelled();
            boolean accepted;
            try {
                accepted = transport.send(command);
            } catch (TransportException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TransportException(command, "send of '" + command + "' failed: " + e.getMessage(), e);
            }
            if (!accepted) {
                throw new TransportException(command, "transport refused '" + command + "'");
            }

            long deadline = clock.nowNanos() + timeout.toNanos();
            while (true) {
                long remaining = deadline - clock.nowNanos();
                if (remaining <= 0) {
                    throw new CommandTimeoutException(command, timeout);
                }
                Acknowledgement ack;
                try {
                    ack = transport.awaitAcknowledgement(Duration.ofNanos(Math.min(remaining, slice.toNanos())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel("interrupted");
                    throw new SequenceCancelledException("interrupted while awaiting acknowledgement", command);
                }
                switch (ack.status()) {
                    case SUCCESS:
                        return ack;
                    case ERROR_KEYWORD:
                        throw new DeviceErrorException(command, ack.rawResponse());
                    default:
                        token.throwIfCancelled();
                }
            }
        } finally {
            inFlight.unlock();
        }
    }
}
