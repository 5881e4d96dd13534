package com.questrail.sequencer.transport;

import com.questrail.sequencer.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * LineBufferedDeviceTransport
 * =============================================================================
 * Base for transports that receive the device's output as text lines.
 *
 * <h2>Behaviour</h2>
 * <ul>
 *   <li>Subclasses push every received line through {@link #onLine(String)},
 *       from any thread.</li>
 *   <li>{@link #send(String)} discards lines buffered before the command so a
 *       stale response cannot acknowledge it.</li>
 *   <li>{@link #awaitAcknowledgement(Duration)} consumes lines until one
 *       matches a keyword or the timeout expires. Non-matching lines (echo,
 *       debug output) are skipped.</li>
 * </ul>
 */
public abstract class LineBufferedDeviceTransport implements DeviceTransport
{
    private static final Logger log = LoggerFactory.getLogger(LineBufferedDeviceTransport.class);

    private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
    private final AcknowledgementClassifier classifier;
    private final MonotonicClock clock;

    protected LineBufferedDeviceTransport(ResponseKeywords keywords, MonotonicClock clock)
    {
        this.classifier = new AcknowledgementClassifier(Objects.requireNonNull(keywords, "keywords"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Writes one command line to the link.
     *
     * @return {@code true} if the link accepted it
     */
    protected abstract boolean write(String command);

    @Override
    public final boolean send(String command)
    {
        Objects.requireNonNull(command, "command");
        lines.clear();
        return write(command);
    }

    @Override
    public Acknowledgement awaitAcknowledgement(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        long deadline = clock.nowNanos() + timeout.toNanos();
        while (true) {
            long remaining = deadline - clock.nowNanos();
            if (remaining <= 0) {
                return Acknowledgement.timeout();
            }
            String line = lines.poll(remaining, TimeUnit.NANOSECONDS);
            if (line == null) {
                return Acknowledgement.timeout();
            }
            Optional<Acknowledgement> ack = classifier.classify(line);
            if (ack.isPresent()) {
                return ack.get();
            }
            log.trace("Ignoring device line '{}'", line);
        }
    }

    /**
     * Delivers a line received from the device.
     */
    protected final void onLine(String line)
    {
        if (line != null) {
            lines.offer(line.strip());
        }
    }
}
