package com.questrail.taskchannel.runtime;

import com.questrail.taskchannel.api.TaskChannel;
import com.questrail.taskchannel.codec.FrameCodec;
import com.questrail.taskchannel.codec.impl.JacksonFrameCodec;
import com.questrail.taskchannel.config.ChannelConfig;
import com.questrail.taskchannel.core.ResilientTaskChannel;
import com.questrail.taskchannel.internal.time.ExecutorMonotonicScheduler;
import com.questrail.taskchannel.internal.time.MonotonicClock;
import com.questrail.taskchannel.internal.time.MonotonicScheduler;
import com.questrail.taskchannel.internal.time.WallClock;
import com.questrail.taskchannel.observability.ChannelObservabilitySink;
import com.questrail.taskchannel.observability.Slf4jChannelObservabilitySink;
import com.questrail.taskchannel.transport.ChannelTransport;
import com.questrail.taskchannel.transport.websocket.netty.NettyWebSocketTransport;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * TaskChannelRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production task channel.
 *
 * <p>Wires configuration, the Netty WebSocket transport, the Jackson codec, a
 * single-threaded timer executor and the SLF4J observability sink into one
 * {@link ResilientTaskChannel}. Callers that supply their own transport keep
 * ownership of it; a transport created here is shut down by {@link #stop()}.</p>
 */
public final class TaskChannelRuntime {
    private final ResilientTaskChannel channel;
    private final ScheduledExecutorService timerExecutor;
    private final NettyWebSocketTransport ownedTransport;

    private TaskChannelRuntime(ResilientTaskChannel channel,
                               ScheduledExecutorService timerExecutor,
                               NettyWebSocketTransport ownedTransport) {
        this.channel = channel;
        this.timerExecutor = timerExecutor;
        this.ownedTransport = ownedTransport;
    }

    public TaskChannel channel() {
        return channel;
    }

    public void start() {
        channel.connect();
    }

    public void stop() {
        channel.disconnect();
        timerExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            timerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownedTransport != null) {
            ownedTransport.shutdown();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChannelConfig config;
        private ChannelTransport transport;
        private FrameCodec codec;
        private ChannelObservabilitySink observabilitySink = new Slf4jChannelObservabilitySink();
        private WallClock wallClock = WallClock.system();

        /**
         * Defaults to {@link ChannelConfig#load()} when not set.
         */
        public Builder withConfig(ChannelConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(ChannelTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withCodec(FrameCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withObservabilitySink(ChannelObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public TaskChannelRuntime build() {
            ChannelConfig effectiveConfig = config != null ? config : ChannelConfig.load();
            FrameCodec effectiveCodec = codec != null ? codec : new JacksonFrameCodec();

            NettyWebSocketTransport owned = null;
            ChannelTransport effectiveTransport = transport;
            if (effectiveTransport == null) {
                owned = new NettyWebSocketTransport();
                effectiveTransport = owned;
            }

            ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "task-channel-timer");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ExecutorMonotonicScheduler(timerExecutor, MonotonicClock.system());

            ResilientTaskChannel channel = new ResilientTaskChannel(
                    effectiveConfig,
                    effectiveTransport,
                    effectiveCodec,
                    scheduler,
                    wallClock,
                    observabilitySink
            );
            return new TaskChannelRuntime(channel, timerExecutor, owned);
        }
    }
}
