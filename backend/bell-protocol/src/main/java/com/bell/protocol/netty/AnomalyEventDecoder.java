package com.bell.protocol.netty;

import com.bell.protocol.AnomalyEventCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

import java.util.List;

/** Turns one complete frame body into an {@link com.bell.protocol.AnomalyEvent}. */
@ChannelHandler.Sharable
public class AnomalyEventDecoder extends MessageToMessageDecoder<ByteBuf> {

  private final AnomalyEventCodec codec;

  public AnomalyEventDecoder(AnomalyEventCodec codec) {
    this.codec = codec;
  }

  @Override
  protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
    out.add(codec.decode(ByteBufUtil.getBytes(frame)));
  }
}
