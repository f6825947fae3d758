package org.sunbreeze.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import lombok.extern.slf4j.Slf4j;
import org.sunbreeze.Sunbreeze;
import org.sunbreeze.server.dto.SunbreezeProperties;

@Slf4j
public class SunbreezeHttp {

    private final Sunbreeze application;
    private final HttpRequestHandler requestHandler;

    public SunbreezeHttp(Sunbreeze application) {
        this.application = application;
        this.requestHandler = new HttpRequestHandler(application);
    }

    public void start() throws InterruptedException {
        SunbreezeProperties properties = application.getProperties();
        application.freeze();
        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            ChannelPipeline pipeline = ch.pipeline();
                            pipeline.addLast("codec", new HttpServerCodec());
                            pipeline.addLast("aggregator", new HttpObjectAggregator(properties.getMaxContentLength()));
                            pipeline.addLast("handler", requestHandler);
                        }
                    });

            ChannelFuture future = bootstrap.bind(properties.getHost(), properties.getPort()).sync();
            log.info("Serving {} on http://{}:{}", properties.getName(), properties.getHost(), properties.getPort());
            future.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

}
