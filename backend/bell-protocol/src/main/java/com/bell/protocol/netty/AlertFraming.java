package com.bell.protocol.netty;

import com.bell.protocol.AnomalyEventCodec;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

/**
 * Frame layout of the alert stream: a 4-byte big-endian length followed by that many bytes
 * of JSON produced by {@link AnomalyEventCodec}.
 */
public final class AlertFraming {

  public static final int LENGTH_FIELD_BYTES = 4;
  public static final int MAX_FRAME_BYTES = 1024 * 1024;

  private AlertFraming() {}

  public static void configureSender(ChannelPipeline pipeline, AnomalyEventCodec codec) {
    pipeline.addLast("frame-prepender", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
    pipeline.addLast("event-encoder", new AnomalyEventEncoder(codec));
  }

  // event handlers go after these
  public static void configureReceiver(ChannelPipeline pipeline, AnomalyEventCodec codec) {
    pipeline.addLast("frame-decoder", new LengthFieldBasedFrameDecoder(
        MAX_FRAME_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
    pipeline.addLast("event-decoder", new AnomalyEventDecoder(codec));
  }
}
