package com.questrail.sequencer.transport;

import java.time.Duration;

/**
 * DeviceTransport
 * =============================================================================
 * Port through which the engine talks to the device.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #send(String)} hands one command line to the link and reports
 *       whether that succeeded. It does not wait for the device.</li>
 *   <li>{@link #awaitAcknowledgement(Duration)} blocks up to the timeout for a
 *       response line to the most recent command, classified by
 *       {@link AcknowledgementClassifier}.</li>
 *   <li>The engine keeps at most one command in flight. Implementations used
 *       by several engines must serialize senders themselves.</li>
 * </ul>
 *
 * <p>Port open/close and framing belong to implementations.</p>
 */
public interface DeviceTransport
{
    /**
     * @return {@code true} if the command was accepted by the link
     */
    boolean send(String command);

    /**
     * @return the classified response, or a {@link AckStatus#TIMEOUT}
     *         acknowledgement if none arrived in time
     * @throws InterruptedException if the calling thread is interrupted
     */
    Acknowledgement awaitAcknowledgement(Duration timeout) throws InterruptedException;
}
