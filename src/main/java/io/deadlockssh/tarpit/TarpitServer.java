package io.deadlockssh.tarpit;

import io.deadlockssh.TarpitException;
import io.deadlockssh.config.TarpitConf;
import io.deadlockssh.event.EventSink;
import io.deadlockssh.ledger.OffenseLedger;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static io.deadlockssh.TarpitExceptionType.BIND_FAILED;
import static io.deadlockssh.constant.TarpitConstant.ACCEPT_BACKLOG;
import static io.deadlockssh.constant.TarpitConstant.READ_CHUNK_SIZE;
import static io.deadlockssh.tarpit.ServerState.DRAINING;
import static io.deadlockssh.tarpit.ServerState.RUNNING;
import static io.deadlockssh.tarpit.ServerState.STARTING;
import static io.deadlockssh.tarpit.ServerState.STOPPED;
import static java.util.Objects.nonNull;

/**
 * Listener and dispatcher of the tarpit. Lifecycle: {@code STARTING -> RUNNING -> DRAINING -> STOPPED};
 * a failed bind goes straight from {@code STARTING} to {@code STOPPED}.
 */
@Slf4j
public class TarpitServer {

    private static final long FORCE_CLOSE_WAIT_MILLIS = 2_000;
    private static final long EVENT_LOOP_SHUTDOWN_TIMEOUT_MILLIS = 2_000;

    @Getter
    private final TarpitContext context;
    @Getter
    private final ConnectionLimiter limiter;

    private final AtomicReference<ServerState> state = new AtomicReference<>(STARTING);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ChannelGroup sessions;
    private Channel serverChannel;

    public TarpitServer(TarpitConf conf, OffenseLedger ledger, EventSink eventSink, TarpitStats stats) {
        this(new TarpitContext(conf, ledger, eventSink, stats, Clock.systemUTC()));
    }

    public TarpitServer(TarpitContext context) {
        this.context = context;
        this.limiter = new ConnectionLimiter(context.getConf().getMaxConnections());
    }

    /**
     * Binds the listening socket. A bind failure is final: the server is {@code STOPPED} afterwards.
     */
    public void start() throws TarpitException {
        if (state.get() != STARTING) {
            throw new IllegalStateException("Tarpit server can only be started once, state is " + state.get());
        }
        var conf = context.getConf();
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("tarpit-boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("tarpit-worker"));
        sessions = new DefaultChannelGroup("tarpit-sessions", GlobalEventExecutor.INSTANCE);

        var bootstrap = new ServerBootstrap();
        bootstrap
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, ACCEPT_BACKLOG)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, conf.isTcpKeepalive())
                // one segment per banner character
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(READ_CHUNK_SIZE))
                .childHandler(new TarpitChannelInitializer(context, limiter, sessions));

        try {
            serverChannel = bootstrap.bind(conf.getBindAddress(), conf.getPort()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopAfterFailedStart();
            throw new TarpitException(BIND_FAILED, "Interrupted while binding " + describeEndpoint(), e);
        } catch (Exception e) {
            stopAfterFailedStart();
            throw new TarpitException(BIND_FAILED, "Could not listen on " + describeEndpoint() + ": " + e.getMessage(), e);
        }

        state.set(RUNNING);
        log.info("DeadlockSSH listening on {}", serverChannel.localAddress());
    }

    /**
     * Stops accepting, lets sessions wind down for {@code shutdown_grace}, then force-closes what is left.
     * Returns once every session has reached a terminal state. Safe to call more than once.
     *
     * @return {@code true} if all sessions finished within the grace period
     */
    public boolean shutdown() {
        if (state.compareAndSet(STARTING, STOPPED)) {
            stopped.countDown();
            return true;
        }
        if (!state.compareAndSet(RUNNING, DRAINING)) {
            awaitStoppedUninterruptibly();
            return true;
        }
        var grace = context.getConf().getShutdownGraceDuration();
        log.info("Draining tarpit: {} active sessions, grace period {}", limiter.active(), grace);

        context.getDrainSignal().trigger();
        serverChannel.close().syncUninterruptibly();
        sessions.forEach(channel -> channel.pipeline().fireUserEventTriggered(SessionControlEvent.DRAIN));

        var drained = awaitIdle(grace);
        if (!drained) {
            log.warn("{} sessions still active after {}, forcing them closed", limiter.active(), grace);
            sessions.forEach(channel -> channel.pipeline().fireUserEventTriggered(SessionControlEvent.FORCE_CLOSE));
            sessions.close().awaitUninterruptibly(FORCE_CLOSE_WAIT_MILLIS);
            awaitIdle(Duration.ofMillis(FORCE_CLOSE_WAIT_MILLIS));
        }

        shutdownEventLoops();
        state.set(STOPPED);
        stopped.countDown();
        log.info("Tarpit listener stopped");

        return drained;
    }

    public void awaitStopped() throws InterruptedException {
        stopped.await();
    }

    public ServerState getState() {
        return state.get();
    }

    public int activeSessions() {
        return limiter.active();
    }

    /**
     * @return the bound port, useful when configured with port 0
     */
    public int getPort() {
        if (nonNull(serverChannel) && serverChannel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return context.getConf().getPort();
    }

    private boolean awaitIdle(Duration timeout) {
        try {
            return limiter.awaitIdle(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return limiter.active() == 0;
        }
    }

    private void awaitStoppedUninterruptibly() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void stopAfterFailedStart() {
        shutdownEventLoops();
        state.set(STOPPED);
        stopped.countDown();
    }

    private void shutdownEventLoops() {
        if (nonNull(workerGroup)) {
            workerGroup.shutdownGracefully(0, EVENT_LOOP_SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        if (nonNull(bossGroup)) {
            bossGroup.shutdownGracefully(0, EVENT_LOOP_SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
    }

    private String describeEndpoint() {
        return context.getConf().getBindAddress() + ":" + context.getConf().getPort();
    }
}
