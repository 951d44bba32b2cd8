package io.deadlockssh.tarpit;

import io.deadlockssh.event.SessionEvent;
import io.deadlockssh.session.ConnectionSession;
import io.deadlockssh.session.SessionOutcome;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

import static io.deadlockssh.session.SessionOutcome.COMPLETED;
import static io.deadlockssh.session.SessionOutcome.DRAINED;
import static io.deadlockssh.session.SessionOutcome.ERROR;
import static io.deadlockssh.session.SessionOutcome.FORCED;
import static io.deadlockssh.session.SessionOutcome.RESET;
import static io.deadlockssh.session.SessionOutcome.TIMEOUT;
import static io.deadlockssh.session.SessionPhase.BANNER;
import static io.deadlockssh.session.SessionPhase.LISTENING;
import static io.deadlockssh.utils.AddressUtils.ledgerKey;
import static io.deadlockssh.utils.AddressUtils.port;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.apache.commons.lang3.StringUtils.replaceEach;

/**
 * Owns one admitted socket: limbo delay, banner trickle, listening, close.
 * <p>
 * Every wait is a task scheduled on the channel's event loop, so a sleeping session holds no thread.
 * All fields are touched from that event loop only.
 */
@Slf4j
public class TarpitSessionHandler extends ChannelInboundHandlerAdapter {

    static final String IDLE_HANDLER_NAME = "listenIdle";

    private final TarpitContext context;

    private ConnectionSession session;
    private ScheduledFuture<?> pendingStep;
    private ScheduledFuture<?> listenCeiling;

    public TarpitSessionHandler(TarpitContext context) {
        this.context = context;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        var conf = context.getConf();
        var remote = ctx.channel().remoteAddress();
        session = new ConnectionSession(ledgerKey(remote), port(remote), conf.getMaxInputLength(), context.getClock());

        var record = context.getLedger().record(session.getAddress());
        var delay = context.getDelayPolicy().compute(record.getConnectionCount());
        session.assign(record.getConnectionCount(), delay);

        log.info("Connection from {}:{} (attempt #{}, delay: {}s)",
                session.getAddress(), session.getPort(), record.getConnectionCount(), delay.toMillis() / 1000.0);

        pendingStep = ctx.executor().schedule(() -> delayElapsed(ctx), delay.toMillis(), MILLISECONDS);

        super.channelActive(ctx);
    }

    private void delayElapsed(ChannelHandlerContext ctx) {
        if (session.isFinished()) {
            return;
        }
        if (context.getDrainSignal().isDraining()) {
            terminate(ctx, DRAINED);
            return;
        }
        session.enter(BANNER);
        sendBannerUnit(ctx, 0);
    }

    /**
     * Writes one banner unit and, once the write has completed, schedules the next one {@code banner_delay} later.
     * A banner already under way is finished even when draining.
     */
    private void sendBannerUnit(ChannelHandlerContext ctx, int index) {
        if (session.isFinished()) {
            return;
        }
        var units = context.getBannerUnits();
        var unit = units.get(index);
        ctx.writeAndFlush(Unpooled.wrappedBuffer(unit)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.debug("Banner write to {} failed: {}", session.getAddress(), String.valueOf(future.cause()));
                terminate(ctx, RESET);
                return;
            }
            session.sent(unit.length);
            if (index + 1 >= units.size()) {
                bannerSent(ctx);
            } else {
                pendingStep = ctx.executor().schedule(
                        () -> sendBannerUnit(ctx, index + 1),
                        context.getConf().getBannerDelayDuration().toMillis(),
                        MILLISECONDS
                );
            }
        });
    }

    private void bannerSent(ChannelHandlerContext ctx) {
        if (session.isFinished()) {
            return;
        }
        session.enter(LISTENING);
        if (context.getDrainSignal().isDraining()) {
            terminate(ctx, COMPLETED);
            return;
        }

        var conf = context.getConf();
        ctx.pipeline().addBefore(
                ctx.name(),
                IDLE_HANDLER_NAME,
                new IdleStateHandler(conf.getConnectionTimeoutDuration().toMillis(), 0, 0, MILLISECONDS)
        );
        listenCeiling = ctx.executor().schedule(() -> {
            log.info("Connection from {} reached the listen ceiling of {}", session.getAddress(), conf.getMaxListenTimeDuration());
            terminate(ctx, TIMEOUT);
        }, conf.getMaxListenTimeDuration().toMillis(), MILLISECONDS);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf)) {
            ctx.fireChannelRead(msg);
            return;
        }
        try {
            var data = (ByteBuf) msg;
            if (nonNull(session) && !session.isFinished() && data.isReadable()) {
                session.received(data);
                log.info("Data from {}: {}", session.getAddress(), preview(data));
            }
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.info("Connection from {} timed out", isNull(session) ? ctx.channel().remoteAddress() : session.getAddress());
            terminate(ctx, TIMEOUT);
        } else if (evt == SessionControlEvent.DRAIN) {
            // limbo and banner phases see the signal at their next step
            if (nonNull(session) && session.getPhase() == LISTENING) {
                terminate(ctx, COMPLETED);
            }
        } else if (evt == SessionControlEvent.FORCE_CLOSE) {
            terminate(ctx, FORCED);
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (nonNull(session) && !session.isFinished()) {
            var outcome = session.getPhase() == LISTENING ? COMPLETED : RESET;
            if (outcome == RESET) {
                log.info("Connection from {} reset by peer during {}", session.getAddress(), session.getPhase());
            }
            terminate(ctx, outcome);
        }

        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        var peer = isNull(session) ? String.valueOf(ctx.channel().remoteAddress()) : session.getAddress();
        if (cause instanceof IOException) {
            log.info("Connection from {} reset: {}", peer, cause.getMessage());
            terminate(ctx, RESET);
        } else {
            log.error("Error handling client {}", peer, cause);
            terminate(ctx, ERROR);
        }
    }

    /**
     * Ends the session: the event goes out first, then the channel is closed. Later calls are no-ops.
     */
    private void terminate(ChannelHandlerContext ctx, SessionOutcome outcome) {
        if (isNull(session) || !session.finish(outcome)) {
            return;
        }
        cancel(pendingStep);
        cancel(listenCeiling);

        try {
            log.info("Connection from {} closed: {} after {} ms, {} bytes received",
                    session.getAddress(), outcome.getLabel(), session.duration().toMillis(), session.getBytesReceived());
            context.getEventSink().emit(SessionEvent.of(session));
        } finally {
            ctx.close();
        }
    }

    private String preview(ByteBuf data) {
        var limit = context.getConf().getMaxInputLength();
        var length = Math.min(data.readableBytes(), limit);
        var text = data.toString(data.readerIndex(), length, UTF_8);
        var escaped = replaceEach(text, new String[]{"\r", "\n"}, new String[]{"\\r", "\\n"});

        return data.readableBytes() > limit ? escaped + "...[truncated]" : escaped;
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (nonNull(future)) {
            future.cancel(false);
        }
    }
}
