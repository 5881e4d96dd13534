package com.questrail.sequencer.transport.netty;

import com.questrail.sequencer.error.TransportException;
import com.questrail.sequencer.time.MonotonicClock;
import com.questrail.sequencer.transport.LineBufferedDeviceTransport;
import com.questrail.sequencer.transport.ResponseKeywords;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * NettyDeviceTransport
 * =============================================================================
 * Netty-backed {@link com.questrail.sequencer.transport.DeviceTransport} for
 * devices exposed through a serial-to-TCP bridge.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. Commands go out as
 * newline-terminated ASCII lines; inbound bytes are split into lines and handed
 * to {@link LineBufferedDeviceTransport} for acknowledgement classification.
 *
 * It MUST NOT interpret commands, retry sends, or track zones.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect(Duration)} opens the TCP connection.
 * - {@link #stop()} closes it and shuts down the event loop group.
 */
public final class NettyDeviceTransport extends LineBufferedDeviceTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyDeviceTransport.class);

    static final int MAX_LINE_LENGTH = 4096;

    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile Channel channel;

    public NettyDeviceTransport(InetSocketAddress remoteAddress, ResponseKeywords keywords, MonotonicClock clock)
    {
        super(keywords, clock);
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        initPipeline(ch.pipeline());
                    }
                });
    }

    /**
     * Connects to the bridge, blocking up to {@code timeout}.
     *
     * @throws TransportException if the connection cannot be established
     */
    public void connect(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        ChannelFuture f = bootstrap.connect(remoteAddress);
        if (!f.awaitUninterruptibly(timeout.toMillis())) {
            f.cancel(false);
            throw new TransportException(null, "timed out connecting to " + remoteAddress);
        }
        if (!f.isSuccess()) {
            throw new TransportException(null, "could not connect to " + remoteAddress, f.cause());
        }
        channel = f.channel();
        log.info("Connected to device bridge at {}", remoteAddress);
    }

    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully();
    }

    public boolean isConnected()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    protected boolean write(String command)
    {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            log.warn("Cannot send '{}': not connected to {}", command, remoteAddress);
            return false;
        }
        ch.writeAndFlush(command + "\n").addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Write of '{}' failed", command, future.cause());
            }
        });
        return true;
    }

    void initPipeline(ChannelPipeline p)
    {
        p.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
        p.addLast(new StringDecoder(StandardCharsets.US_ASCII));
        p.addLast(new StringEncoder(StandardCharsets.US_ASCII));
        p.addLast(new InboundHandler());
    }

    /**
     * Uses an already connected channel. Package-private for tests with
     * {@code EmbeddedChannel}.
     */
    void attach(Channel ch)
    {
        this.channel = Objects.requireNonNull(ch, "ch");
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards decoded lines to the acknowledgement buffer.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            onLine(line);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            log.warn("Device bridge connection to {} closed", remoteAddress);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.error("Device bridge connection error", cause);
            ctx.close();
        }
    }
}
