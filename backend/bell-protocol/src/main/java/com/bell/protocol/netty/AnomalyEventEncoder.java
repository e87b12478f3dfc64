package com.bell.protocol.netty;

import com.bell.protocol.AnomalyEvent;
import com.bell.protocol.AnomalyEventCodec;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

@ChannelHandler.Sharable
public class AnomalyEventEncoder extends MessageToByteEncoder<AnomalyEvent> {

  private final AnomalyEventCodec codec;

  public AnomalyEventEncoder(AnomalyEventCodec codec) {
    super(AnomalyEvent.class);
    this.codec = codec;
  }

  @Override
  protected void encode(ChannelHandlerContext ctx, AnomalyEvent event, ByteBuf out) {
    out.writeBytes(codec.encode(event));
  }
}
