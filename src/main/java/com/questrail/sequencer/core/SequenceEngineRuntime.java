package com.questrail.sequencer.core;

import com.questrail.sequencer.api.SequenceEngine;
import com.questrail.sequencer.config.EngineConfig;
import com.questrail.sequencer.observability.CompositeObservabilitySink;
import com.questrail.sequencer.observability.NullObservabilitySink;
import com.questrail.sequencer.observability.SequenceObservabilitySink;
import com.questrail.sequencer.observability.Slf4jSequenceObservabilitySink;
import com.questrail.sequencer.time.MonotonicClock;
import com.questrail.sequencer.time.MonotonicScheduler;
import com.questrail.sequencer.time.ScheduledExecutorScheduler;
import com.questrail.sequencer.time.SystemMonotonicClock;
import com.questrail.sequencer.time.SystemWallClock;
import com.questrail.sequencer.transport.netty.NettyDeviceTransport;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * SequenceEngineRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for a production engine talking
 * to a device behind a serial-to-TCP bridge.
 *
 * <p>Wires the system clocks, a single-thread scheduler for run timeouts, the
 * Netty transport and a {@link DefaultSequenceEngine}. Events always go to the
 * SLF4J sink; a caller-supplied sink receives them as well.</p>
 */
public final class SequenceEngineRuntime {
    private final DefaultSequenceEngine engine;
    private final NettyDeviceTransport transport;
    private final ScheduledExecutorService schedulerExecutor;
    private final Duration connectTimeout;

    private SequenceEngineRuntime(DefaultSequenceEngine engine,
                                  NettyDeviceTransport transport,
                                  ScheduledExecutorService schedulerExecutor,
                                  Duration connectTimeout) {
        this.engine = engine;
        this.transport = transport;
        this.schedulerExecutor = schedulerExecutor;
        this.connectTimeout = connectTimeout;
    }

    /**
     * Connects to the device bridge.
     *
     * @throws com.questrail.sequencer.error.TransportException if the bridge cannot be reached
     */
    public void start() {
        transport.connect(connectTimeout);
    }

    public void stop() {
        engine.close();
        transport.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public SequenceEngine engine() {
        return engine;
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private InetSocketAddress deviceAddress;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private SequenceObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder withDeviceAddress(InetSocketAddress address) {
            this.deviceAddress = address;
            return this;
        }

        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withObservabilitySink(SequenceObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public SequenceEngineRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(deviceAddress, "deviceAddress");
            Objects.requireNonNull(connectTimeout, "connectTimeout");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Time sources
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "sequence-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Transport
            NettyDeviceTransport transport =
                    new NettyDeviceTransport(deviceAddress, config.responseKeywords(), clock);

            // 3. Observability
            SequenceObservabilitySink sink = observabilitySink == NullObservabilitySink.INSTANCE
                    ? new Slf4jSequenceObservabilitySink()
                    : CompositeObservabilitySink.of(new Slf4jSequenceObservabilitySink(), observabilitySink);

            // 4. Engine
            DefaultSequenceEngine engine = new DefaultSequenceEngine(
                    config, transport, clock, SystemWallClock.INSTANCE, scheduler, sink);

            return new SequenceEngineRuntime(engine, transport, schedulerExec, connectTimeout);
        }
    }
}
