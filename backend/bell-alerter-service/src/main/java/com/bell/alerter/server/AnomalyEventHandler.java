package com.bell.alerter.server;

import com.bell.alerter.alert.AlertDispatcher;
import com.bell.protocol.AnomalyEvent;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ChannelHandler.Sharable
public class AnomalyEventHandler extends SimpleChannelInboundHandler<AnomalyEvent> {

  private static final Logger log = LoggerFactory.getLogger(AnomalyEventHandler.class);

  private final AlertDispatcher dispatcher;

  public AnomalyEventHandler(AlertDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, AnomalyEvent event) {
    dispatcher.dispatch(event);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    if (cause instanceof DecoderException) {
      // framing is lost after a bad frame, the analyzer reconnects
      log.warn("malformed alert frame from {}, closing: {}", ctx.channel().remoteAddress(), cause.getMessage());
    } else {
      log.warn("alert connection {} failed: {}", ctx.channel().remoteAddress(), cause.getMessage());
    }
    ctx.close();
  }
}
