package livefeed.netty;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import livefeed.spi.SessionTransport;

import java.util.Objects;

/**
 * {@link SessionTransport} writing WebSocket frames to one Netty channel. Writes are safe from
 * any thread; frames written from one thread keep their order.
 */
final class NettySessionTransport implements SessionTransport {
  private final Channel channel;

  NettySessionTransport(Channel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public void send(String frame) {
    if (channel.isActive()) {
      channel.writeAndFlush(new TextWebSocketFrame(frame));
    }
  }

  @Override
  public void ping() {
    if (channel.isActive()) {
      channel.writeAndFlush(new PingWebSocketFrame());
    }
  }

  @Override
  public void terminate() {
    channel.close();
  }
}
