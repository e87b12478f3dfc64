package com.bell.alerter.server;

import com.bell.alerter.alert.AlertDispatcher;
import com.bell.protocol.AnomalyEventCodec;
import com.bell.protocol.netty.AlertFraming;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Accepts analyzer connections and hands each decoded {@link com.bell.protocol.AnomalyEvent}
 * to the {@link AlertDispatcher}. Every connection is an independent stream of frames.
 */
@Component
public class AnomalyEventServer {

  private static final Logger log = LoggerFactory.getLogger(AnomalyEventServer.class);

  private final String address;
  private final int port;
  private final int ioThreads;
  private final AnomalyEventCodec codec;
  private final AnomalyEventHandler handler;

  private EventLoopGroup bossGroup;
  private EventLoopGroup ioGroup;
  private Channel channel;

  public AnomalyEventServer(@Value("${bell.alerter.bind-address:0.0.0.0}") String address,
                            @Value("${bell.alerter.port:8389}") int port,
                            @Value("${bell.alerter.io-threads:2}") int ioThreads,
                            AnomalyEventCodec codec,
                            AlertDispatcher dispatcher) {
    this.address = address;
    this.port = port;
    this.ioThreads = ioThreads;
    this.codec = codec;
    this.handler = new AnomalyEventHandler(dispatcher);
  }

  @PostConstruct
  public synchronized void start() {
    bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("bell-alerter-accept", true));
    ioGroup = new NioEventLoopGroup(ioThreads, new DefaultThreadFactory("bell-alerter-io", true));
    ServerBootstrap bootstrap = new ServerBootstrap()
        .option(ChannelOption.SO_BACKLOG, 1024)
        .option(ChannelOption.SO_REUSEADDR, true)
        .group(bossGroup, ioGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            log.info("analyzer connected from {}", ch.remoteAddress());
            AlertFraming.configureReceiver(ch.pipeline(), codec);
            ch.pipeline().addLast("anomaly-handler", handler);
          }
        });
    channel = bootstrap.bind(address, port).syncUninterruptibly().channel();
    log.info("Alerter listening on {}:{}", address, boundPort());
  }

  /** The port actually bound, which differs from the configured one when that is 0. */
  public int boundPort() {
    return ((InetSocketAddress) channel.localAddress()).getPort();
  }

  @PreDestroy
  public synchronized void stop() {
    if (channel != null) {
      channel.close().syncUninterruptibly();
      channel = null;
    }
    if (bossGroup != null) {
      bossGroup.shutdownGracefully();
      ioGroup.shutdownGracefully();
      bossGroup = null;
      ioGroup = null;
    }
    log.info("Alerter stopped");
  }
}
