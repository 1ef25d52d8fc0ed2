package livefeed.netty;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;
import livefeed.AccountId;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Authenticates the HTTP upgrade request before the WebSocket handshake runs.
 *
 * <p>Requests for other paths are answered with {@code 404}. On the subscription path the
 * {@code access_token} query parameter is resolved through the {@link Authenticator}; on
 * success the account is stored in {@link #ACCOUNT_ID}, this handler removes itself and the
 * request continues to the handshake. On failure the client gets {@code 401} and the
 * connection is closed.
 */
final class HandshakeAuthenticator extends ChannelInboundHandlerAdapter {
  private static final Logger logger = Logger.getLogger(HandshakeAuthenticator.class.getName());

  static final AttributeKey<AccountId> ACCOUNT_ID = AttributeKey.valueOf("livefeed.accountId");
  static final String ACCESS_TOKEN_PARAM = "access_token";

  private final String path;
  private final Authenticator authenticator;

  HandshakeAuthenticator(String path, Authenticator authenticator) {
    this.path = Objects.requireNonNull(path, "path");
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) {
    if (!(msg instanceof FullHttpRequest request)) {
      ctx.fireChannelRead(msg);
      return;
    }
    QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
    if (!path.equals(decoder.path())) {
      ReferenceCountUtil.release(request);
      reject(ctx, HttpResponseStatus.NOT_FOUND);
      return;
    }
    Optional<AccountId> account = authenticate(decoder.parameters().get(ACCESS_TOKEN_PARAM));
    if (account.isEmpty()) {
      ReferenceCountUtil.release(request);
      reject(ctx, HttpResponseStatus.UNAUTHORIZED);
      return;
    }
    ctx.channel().attr(ACCOUNT_ID).set(account.get());
    ctx.pipeline().remove(this);
    ctx.fireChannelRead(request);
  }

  private Optional<AccountId> authenticate(List<String> tokens) {
    if (tokens == null || tokens.size() != 1 || tokens.get(0).isEmpty()) {
      return Optional.empty();
    }
    try {
      Optional<AccountId> account = authenticator.authenticate(tokens.get(0));
      return account != null ? account : Optional.empty();
    } catch (Exception e) {
      logger.log(Level.FINE, "Access token rejected", e);
      return Optional.empty();
    }
  }

  private static void reject(ChannelHandlerContext ctx, HttpResponseStatus status) {
    FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
        Unpooled.copiedBuffer(status.reasonPhrase(), StandardCharsets.UTF_8));
    response.headers()
        .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN)
        .setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes())
        .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }
}
