package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.error.CommandTimeoutException;
import com.questrail.sequencer.error.DeviceErrorException;
import com.questrail.sequencer.error.SequenceCancelledException;
import com.questrail.sequencer.error.TransportException;
import com.questrail.sequencer.test.ScriptedDeviceTransport;
import com.questrail.sequencer.test.ScriptedDeviceTransport.Reply;
import com.questrail.sequencer.time.SystemMonotonicClock;
import com.questrail.sequencer.transport.AckStatus;
import com.questrail.sequencer.transport.Acknowledgement;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AcknowledgedSenderTest {

    private final ScriptedDeviceTransport device = new ScriptedDeviceTransport();
    private final AcknowledgedSender sender =
            new AcknowledgedSender(device, SystemMonotonicClock.INSTANCE, Duration.ofMillis(10));
    private final Duration timeout = Duration.ofMillis(100);

    @Test
    void successKeywordAcknowledges() {
        device.script("led on", Reply.line("LED ON COMPLETE"));

        Acknowledgement ack = sender.sendAndAwait("led on", timeout, new CancellationToken());

        assertEquals(AckStatus.SUCCESS, ack.status());
        assertEquals("LED ON COMPLETE", ack.rawResponse());
        assertEquals(List.of("led on"), device.sent());
    }

    @Test
    void errorKeywordIsDeviceFailure() {
        device.script("led on", Reply.error("Error: no such led"));

        DeviceErrorException e = assertThrows(DeviceErrorException.class,
                () -> sender.sendAndAwait("led on", timeout, new CancellationToken()));

        assertEquals(ErrorCategory.DEVICE, e.category());
        assertEquals("Error: no such led", e.deviceResponse());
    }

    @Test
    void silenceTimesOut() {
        device.script("led on", Reply.silence());

        CommandTimeoutException e = assertThrows(CommandTimeoutException.class,
                () -> sender.sendAndAwait("led on", timeout, new CancellationToken()));

        assertEquals(ErrorCategory.TIMEOUT, e.category());
    }

    @Test
    void refusedSendIsTransportFailure() {
        device.script("led on", Reply.refuse());

        TransportException e = assertThrows(TransportException.class,
                () -> sender.sendAndAwait("led on", timeout, new CancellationToken()));

        assertEquals(ErrorCategory.TRANSPORT, e.category());
        assertTrue(device.sent().isEmpty());
    }

    @Test
    void cancelledTokenSendsNothing() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(SequenceCancelledException.class, () -> sender.sendAndAwait("led on", timeout, token));
        assertTrue(device.sent().isEmpty());
    }

    @Test
    void nonKeywordLinesAreIgnored() {
        device.script("led on", Reply.line("echo: led on"));

        assertThrows(CommandTimeoutException.class,
                () -> sender.sendAndAwait("led on", timeout, new CancellationToken()));
    }
}
