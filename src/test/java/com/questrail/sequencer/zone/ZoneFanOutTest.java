package com.questrail.sequencer.zone;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.error.SequenceCancelledException;
import com.questrail.sequencer.exec.AcknowledgedSender;
import com.questrail.sequencer.exec.CancellationToken;
import com.questrail.sequencer.observability.RecordingObservabilitySink;
import com.questrail.sequencer.observability.ZoneTransitionEvent;
import com.questrail.sequencer.test.ScriptedDeviceTransport;
import com.questrail.sequencer.test.ScriptedDeviceTransport.Reply;
import com.questrail.sequencer.time.SystemMonotonicClock;
import com.questrail.sequencer.time.SystemWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ZoneFanOutTest {

    private ScriptedDeviceTransport device;
    private ZoneTable zones;
    private ZoneFanOut fanOut;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        device = new ScriptedDeviceTransport();
        zones = new ZoneTable(SystemWallClock.INSTANCE);
        sink = new RecordingObservabilitySink();
        zones.setObservabilitySink(sink);
        AcknowledgedSender sender =
                new AcknowledgedSender(device, SystemMonotonicClock.INSTANCE, Duration.ofMillis(20));
        fanOut = new ZoneFanOut(zones, sender, Duration.ofMillis(200));
    }

    @Test
    void runsEachZoneInAscendingOrder() {
        zones.select(ZoneSet.of(3, 1));

        FanOutResult result = fanOut.execute("pump on", new CancellationToken());

        assertTrue(result.success());
        assertEquals(List.of(1, 3), result.completedZones());
        assertEquals(List.of("multizone 0001", "pump on", "multizone 0100", "pump on"), device.sent());
        assertEquals(ZoneStatus.COMPLETED, zones.state(1).status());
        assertEquals(ZoneStatus.COMPLETED, zones.state(3).status());
        assertEquals(ZoneStatus.INACTIVE, zones.state(2).status());
    }

    @Test
    void failedMaskSendStopsFanOut() {
        zones.select(ZoneSet.of(1, 2, 3));
        device.script("multizone 0010", Reply.refuse());

        FanOutResult result = fanOut.execute("pump on", new CancellationToken());

        assertFalse(result.success());
        assertEquals(List.of(1), result.completedZones());
        assertEquals(2, result.failedZone());
        assertEquals(ErrorCategory.TRANSPORT, result.category());
        assertEquals("multizone 0010", result.failedCommand());

        assertEquals(ZoneStatus.COMPLETED, zones.state(1).status());
        assertEquals(ZoneStatus.ERROR, zones.state(2).status());
        assertEquals(ZoneStatus.ACTIVE, zones.state(3).status());
        assertFalse(device.sent().contains("multizone 0100"));
    }

    @Test
    void deviceErrorOnBaseCommandKeepsRawResponse() {
        zones.select(ZoneSet.of(2));
        device.script("pump on", Reply.error("ERR 17 pump jammed"));

        FanOutResult result = fanOut.execute("pump on", new CancellationToken());

        assertFalse(result.success());
        assertEquals(ErrorCategory.DEVICE, result.category());
        assertEquals("ERR 17 pump jammed", result.deviceResponse());
        assertEquals(0.5, zones.state(2).progress());
    }

    @Test
    void noSelectionIsStructuralFailure() {
        FanOutResult result = fanOut.execute("pump on", new CancellationToken());

        assertFalse(result.success());
        assertEquals(ErrorCategory.STRUCTURAL, result.category());
        assertTrue(device.sent().isEmpty());
    }

    @Test
    void cancellationLeavesNoZoneExecuting() {
        zones.select(ZoneSet.of(1));
        device.defaultReply(Reply.silence());
        CancellationToken token = new CancellationToken();

        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        canceller.start();

        ZoneFanOut slow = new ZoneFanOut(zones,
                new AcknowledgedSender(device, SystemMonotonicClock.INSTANCE, Duration.ofMillis(10)),
                Duration.ofSeconds(5));
        assertThrows(SequenceCancelledException.class, () -> slow.execute("pump on", token));

        assertEquals(ZoneStatus.ERROR, zones.state(1).status());
        assertTrue(sink.eventsOfType(ZoneTransitionEvent.class).stream()
                .anyMatch(e -> e.to() == ZoneStatus.ERROR));
    }

    @Test
    void rearmReturnsSelectedZonesToActive() {
        zones.select(ZoneSet.of(1, 2));
        device.script("multizone 0010", Reply.refuse());
        fanOut.execute("pump on", new CancellationToken());

        zones.rearm();

        assertEquals(ZoneStatus.ACTIVE, zones.state(1).status());
        assertEquals(ZoneStatus.ACTIVE, zones.state(2).status());
        assertNull(zones.state(2).error());
    }
}
