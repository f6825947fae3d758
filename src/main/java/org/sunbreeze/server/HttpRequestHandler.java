package org.sunbreeze.server;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;
import org.sunbreeze.Sunbreeze;
import org.sunbreeze.http.dispatch.ErrorBoundary;
import org.sunbreeze.http.message.Request;
import org.sunbreeze.http.message.Response;

import java.nio.charset.StandardCharsets;
import java.util.Map;

@Slf4j
@ChannelHandler.Sharable
public class HttpRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final Sunbreeze application;

    public HttpRequestHandler(Sunbreeze application) {
        this.application = application;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest httpRequest) {
        if (!httpRequest.decoderResult().isSuccess()) {
            write(ctx, badRequest(), false);
            return;
        }
        Request request = toRequest(httpRequest);
        boolean keepAlive = HttpUtil.isKeepAlive(httpRequest);
        boolean head = HttpMethod.HEAD.equals(httpRequest.method());

        application.handle(request).whenComplete((response, failure) -> {
            if (failure != null) {
                log.error("Request {} aborted, closing connection {}", request, ctx.channel().id(), failure);
                ctx.close();
                return;
            }
            FullHttpResponse httpResponse;
            boolean reuse = keepAlive;
            try {
                httpResponse = toHttpResponse(response, head);
            } catch (RuntimeException e) {
                log.error("Could not convert {} for request {}", response, request, e);
                httpResponse = internalServerError();
                reuse = false;
            }
            FullHttpResponse toWrite = httpResponse;
            boolean keepOpen = reuse;
            if (ctx.executor().inEventLoop()) {
                write(ctx, toWrite, keepOpen);
            } else {
                ctx.executor().execute(() -> write(ctx, toWrite, keepOpen));
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unexpected error on channel {}", ctx.channel().id(), cause);
        ctx.close();
    }

    static Request toRequest(FullHttpRequest httpRequest) {
        QueryStringDecoder decoder = new QueryStringDecoder(httpRequest.uri());
        Request.RequestBuilder builder = Request.builder()
                .method(httpRequest.method().name())
                .path(decoder.path())
                .queryParams(decoder.parameters())
                .body(ByteBufUtil.getBytes(httpRequest.content()));
        for (Map.Entry<String, String> header : httpRequest.headers()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    static FullHttpResponse toHttpResponse(Response response, boolean head) {
        byte[] body = response.getBody();
        FullHttpResponse httpResponse = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.valueOf(response.getStatus()),
                head ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(body)
        );
        response.getHeaders().forEach((name, value) -> httpResponse.headers().set(name, value));
        httpResponse.headers().set(HttpHeaderNames.CONTENT_TYPE, response.getMediaType());
        httpResponse.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return httpResponse;
    }

    private static FullHttpResponse badRequest() {
        return plainText(HttpResponseStatus.BAD_REQUEST, "Bad Request");
    }

    private static FullHttpResponse internalServerError() {
        return plainText(HttpResponseStatus.INTERNAL_SERVER_ERROR, ErrorBoundary.GENERIC_MESSAGE);
    }

    private static FullHttpResponse plainText(HttpResponseStatus status, String text) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                status, Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, Response.TEXT_PLAIN);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        return response;
    }

    private static void write(ChannelHandlerContext ctx, FullHttpResponse response, boolean keepAlive) {
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

}
