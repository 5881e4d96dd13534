package com.questrail.sequencer.transport.netty;

import com.questrail.sequencer.time.SystemMonotonicClock;
import com.questrail.sequencer.transport.AckStatus;
import com.questrail.sequencer.transport.Acknowledgement;
import com.questrail.sequencer.transport.ResponseKeywords;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NettyDeviceTransportTest {

    private NettyDeviceTransport transport;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        transport = new NettyDeviceTransport(new InetSocketAddress("127.0.0.1", 9),
                ResponseKeywords.defaults(), SystemMonotonicClock.INSTANCE);
        channel = new EmbeddedChannel();
        transport.initPipeline(channel.pipeline());
        transport.attach(channel);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
        transport.stop();
    }

    @Test
    void commandIsWrittenAsNewlineTerminatedLine() {
        assertTrue(transport.send("led on"));

        ByteBuf out = channel.readOutbound();
        try {
            assertEquals("led on\n", out.toString(StandardCharsets.US_ASCII));
        } finally {
            out.release();
        }
    }

    @Test
    void inboundLinesAreClassified() throws Exception {
        transport.send("home");
        channel.writeInbound(Unpooled.copiedBuffer("echo home\r\nHoming DONE\n", StandardCharsets.US_ASCII));

        Acknowledgement ack = transport.awaitAcknowledgement(Duration.ofMillis(200));

        assertEquals(AckStatus.SUCCESS, ack.status());
        assertEquals("Homing DONE", ack.rawResponse());
    }

    @Test
    void staleLinesDoNotAcknowledgeNextCommand() throws Exception {
        channel.writeInbound(Unpooled.copiedBuffer("complete\n", StandardCharsets.US_ASCII));
        transport.send("home");

        assertEquals(AckStatus.TIMEOUT, transport.awaitAcknowledgement(Duration.ofMillis(50)).status());
    }

    @Test
    void partialLineWaitsForTerminator() throws Exception {
        transport.send("home");
        channel.writeInbound(Unpooled.copiedBuffer("ERR", StandardCharsets.US_ASCII));
        assertEquals(AckStatus.TIMEOUT, transport.awaitAcknowledgement(Duration.ofMillis(30)).status());

        channel.writeInbound(Unpooled.copiedBuffer(" 4\n", StandardCharsets.US_ASCII));
        Acknowledgement ack = transport.awaitAcknowledgement(Duration.ofMillis(200));
        assertEquals(AckStatus.ERROR_KEYWORD, ack.status());
        assertEquals("ERR 4", ack.rawResponse());
    }

    @Test
    void closedChannelRefusesSend() {
        channel.close();

        assertFalse(transport.send("home"));
        assertFalse(transport.isConnected());
    }
}
