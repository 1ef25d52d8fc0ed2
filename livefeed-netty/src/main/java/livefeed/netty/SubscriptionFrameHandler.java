package livefeed.netty;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.CharsetUtil;
import livefeed.AccountId;
import livefeed.session.SessionGroup;
import livefeed.session.SubscriptionSession;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binds one WebSocket connection to one {@link SubscriptionSession}.
 *
 * <p>The session is created when the handshake completes and joins the group; it is closed and
 * leaves the group when the channel goes inactive, however that happens.
 */
final class SubscriptionFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {
  private static final Logger logger = Logger.getLogger(SubscriptionFrameHandler.class.getName());

  private final SessionFactory sessionFactory;
  private final SessionGroup sessions;
  private SubscriptionSession session;

  SubscriptionFrameHandler(SessionFactory sessionFactory, SessionGroup sessions) {
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
  }

  SubscriptionSession session() {
    return session;
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
      AccountId accountId = ctx.channel().attr(HandshakeAuthenticator.ACCOUNT_ID).get();
      if (accountId == null) {
        logger.log(Level.SEVERE, "Handshake completed without an authenticated account, closing");
        ctx.close();
        return;
      }
      session = sessionFactory.create(accountId, new NettySessionTransport(ctx.channel()));
      sessions.add(session);
      logger.log(Level.FINE, "Session opened for account {0}", accountId);
    }
    super.userEventTriggered(ctx, evt);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
    if (session == null) {
      return;
    }
    if (frame instanceof TextWebSocketFrame text) {
      if (ByteBufUtil.isText(text.content(), CharsetUtil.UTF_8)) {
        session.onText(text.text());
      } else {
        session.onUndecodableText();
      }
    } else if (frame instanceof BinaryWebSocketFrame) {
      session.onBinary();
    } else if (frame instanceof PongWebSocketFrame) {
      session.confirmAlive();
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    if (session != null) {
      SubscriptionSession closing = session;
      sessions.remove(closing);
      closing.close();
      logger.log(Level.FINE, "Session closed for account {0}", closing.accountId());
    }
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.log(Level.WARNING, "Connection error, closing", cause);
    ctx.close();
  }
}
