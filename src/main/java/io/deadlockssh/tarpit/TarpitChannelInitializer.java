package io.deadlockssh.tarpit;

import io.deadlockssh.event.SessionEvent;
import io.deadlockssh.ledger.OffenseRecord;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.socket.SocketChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import static io.deadlockssh.utils.AddressUtils.ledgerKey;
import static io.deadlockssh.utils.AddressUtils.port;

/**
 * Admission point of the listener. An accepted socket either takes a slot and gets a
 * {@link TarpitSessionHandler}, or is closed on the spot.
 */
@Slf4j
@RequiredArgsConstructor
public class TarpitChannelInitializer extends ChannelInitializer<SocketChannel> {

    private final TarpitContext context;
    private final ConnectionLimiter limiter;
    private final ChannelGroup sessions;

    @Override
    protected void initChannel(SocketChannel ch) {
        if (context.getDrainSignal().isDraining() || !limiter.tryAcquire()) {
            reject(ch);
            return;
        }
        ch.closeFuture().addListener((ChannelFutureListener) future -> limiter.release());
        sessions.add(ch);
        context.getStats().connectionAdmitted();

        ch.pipeline().addLast(new TarpitSessionHandler(context));
    }

    // no ledger increment, no delay, no banner
    private void reject(SocketChannel ch) {
        var remote = ch.remoteAddress();
        var address = ledgerKey(remote);
        context.getStats().connectionRejected();
        log.debug("Rejected {} ({} of {} sessions active, draining: {})",
                address, limiter.active(), limiter.getMaxConnections(), context.getDrainSignal().isDraining());

        ch.close();
        var count = context.getLedger().find(address).map(OffenseRecord::getConnectionCount).orElse(0L);
        context.getEventSink().emit(SessionEvent.rejected(address, port(remote), count, context.getClock().instant()));
    }
}
