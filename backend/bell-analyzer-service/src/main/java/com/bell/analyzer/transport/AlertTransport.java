package com.bell.analyzer.transport;

import com.bell.protocol.AnomalyEvent;
import com.bell.protocol.AnomalyEventCodec;
import com.bell.protocol.netty.AlertFraming;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;

/**
 * Lazily connected link to the alerter. A connect or channel error drops the events held
 * meanwhile; the next send starts over.
 */
public class AlertTransport implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(AlertTransport.class);

  public enum State { DISCONNECTED, CONNECTING, CONNECTED }

  private final String host;
  private final int port;
  private final EventLoopGroup group;
  private final Bootstrap bootstrap;

  private State state = State.DISCONNECTED;
  private ChannelFuture pending;
  private Channel channel;
  private final List<AnomalyEvent> queued = new ArrayList<>();

  public AlertTransport(String host, int port, int connectTimeoutMs, AnomalyEventCodec codec,
                        EventLoopGroup group) {
    this.host = host;
    this.port = port;
    this.group = group;
    this.bootstrap = new Bootstrap()
        .group(group)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
        .option(ChannelOption.TCP_NODELAY, true)
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            AlertFraming.configureSender(ch.pipeline(), codec);
          }
        });
  }

  public synchronized void send(AnomalyEvent event) {
    switch (state) {
      case CONNECTED -> write(channel, event);
      case CONNECTING -> queued.add(event);
      case DISCONNECTED -> {
        queued.add(event);
        connect();
      }
    }
  }

  public synchronized State state() {
    return state;
  }

  private void connect() {
    state = State.CONNECTING;
    ChannelFuture f = bootstrap.connect(host, port);
    pending = f;
    f.addListener((ChannelFutureListener) this::onConnect);
  }

  private synchronized void onConnect(ChannelFuture f) {
    if (f != pending) return;
    pending = null;
    if (f.isSuccess()) {
      channel = f.channel();
      state = State.CONNECTED;
      Channel ch = channel;
      ch.closeFuture().addListener(cf -> onClosed(ch));
      log.info("connected to alerter on {}:{}", host, port);
      // still inside the lock, so these go out before any later send
      for (AnomalyEvent event : queued) {
        write(ch, event);
      }
      queued.clear();
    } else {
      log.warn("alerter may not be up on {}:{}, {}", host, port, String.valueOf(f.cause()));
      if (!queued.isEmpty()) {
        log.warn("dropped {} anomalies while the alerter was unreachable", queued.size());
      }
      f.channel().close();
      reset();
    }
  }

  private synchronized void onClosed(Channel ch) {
    if (ch != channel) return;
    log.warn("connection to alerter on {}:{} closed", host, port);
    reset();
  }

  private void write(Channel ch, AnomalyEvent event) {
    // completion is logged, never awaited
    ch.writeAndFlush(event).addListener(f -> {
      if (f.isSuccess()) {
        log.info("send to alerter: {}", event);
      } else {
        log.debug("write to alerter failed for {}: {}", event.name(), String.valueOf(f.cause()));
      }
    });
  }

  private void reset() {
    queued.clear();
    channel = null;
    pending = null;
    state = State.DISCONNECTED;
  }

  @Override
  public void close() {
    Channel ch;
    synchronized (this) {
      ch = channel;
      reset();
    }
    if (ch != null) {
      ch.close().awaitUninterruptibly();
    }
    group.shutdownGracefully();
  }
}
