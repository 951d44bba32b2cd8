package io.deadlockssh.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import lombok.RequiredArgsConstructor;

import static io.deadlockssh.constant.TarpitConstant.STATS_MAX_CONTENT_LENGTH;

@RequiredArgsConstructor
public class StatsChannelInitializer extends ChannelInitializer<SocketChannel> {

    private final StatsReporter reporter;
    private final ObjectMapper mapper;

    @Override
    protected void initChannel(SocketChannel ch) {
        ch.pipeline()
                .addLast(
                        new HttpServerCodec(),
                        new HttpObjectAggregator(STATS_MAX_CONTENT_LENGTH),
                        new StatsRequestHandler(reporter, mapper)
                );
    }
}
