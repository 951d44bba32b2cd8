package io.deadlockssh.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.deadlockssh.TarpitException;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

import static io.deadlockssh.TarpitExceptionType.STATS_BIND_FAILED;
import static java.util.Objects.nonNull;

/**
 * Small HTTP server publishing {@link StatsReport}s. Runs on its own event loop so that stats traffic never
 * competes with tarpit sessions.
 */
@Slf4j
public class StatsServer {

    private final String bindAddress;
    private final int port;
    private final StatsReporter reporter;
    private final ObjectMapper mapper = new ObjectMapper();

    private EventLoopGroup group;
    private Channel serverChannel;

    public StatsServer(String bindAddress, int port, StatsReporter reporter) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.reporter = reporter;
    }

    public synchronized void start() throws TarpitException {
        group = new NioEventLoopGroup(1, new DefaultThreadFactory("stats-http"));
        var bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childHandler(new StatsChannelInitializer(reporter, mapper));
        try {
            serverChannel = bootstrap.bind(bindAddress, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new TarpitException(STATS_BIND_FAILED, "Interrupted while binding HTTP stats server", e);
        } catch (Exception e) {
            stop();
            throw new TarpitException(STATS_BIND_FAILED,
                    "Failed to start HTTP stats server on " + bindAddress + ":" + port + ": " + e.getMessage(), e);
        }
        log.info("HTTP Stats Server listening on {}", serverChannel.localAddress());
    }

    public synchronized void stop() {
        if (nonNull(serverChannel)) {
            log.info("Shutting down HTTP Stats Server...");
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (nonNull(group)) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
            group = null;
        }
    }

    public synchronized int getPort() {
        if (nonNull(serverChannel) && serverChannel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return port;
    }
}
