package io.deadlockssh.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import static io.deadlockssh.constant.TarpitConstant.STATS_PATH;
import static io.netty.handler.codec.http.HttpResponseStatus.METHOD_NOT_ALLOWED;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Answers {@code GET /stats}. Every response closes the connection.
 */
@Slf4j
@RequiredArgsConstructor
public class StatsRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final StatsReporter reporter;
    private final ObjectMapper mapper;

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) throws Exception {
        var path = new QueryStringDecoder(request.uri()).path();
        var remote = ctx.channel().remoteAddress();

        if (!STATS_PATH.equals(path)) {
            log.warn("HTTP Stats request from {}: {} (404)", remote, path);
            respond(ctx, NOT_FOUND, "text/html; charset=UTF-8", "<h1>404 Not Found</h1>".getBytes(UTF_8));
            return;
        }
        if (!HttpMethod.GET.equals(request.method())) {
            log.warn("HTTP Stats request from {}: {} {} (405)", remote, request.method(), path);
            respond(ctx, METHOD_NOT_ALLOWED, "text/plain; charset=UTF-8", "Method Not Allowed".getBytes(UTF_8));
            return;
        }

        var body = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(reporter.report());
        log.info("HTTP Stats request from {}: {}", remote, path);
        respond(ctx, OK, HttpHeaderValues.APPLICATION_JSON.toString(), body);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Error while serving stats request from {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    private static void respond(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, byte[] body) {
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, contentType)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, body.length)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
