package livefeed.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livefeed.AccountId;
import livefeed.ApiErrorCode;
import livefeed.ApiException;
import livefeed.SqlQuery;
import livefeed.context.SubscriptionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionSessionTest {
  record Topic(String name) {}

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final AccountId ACCOUNT = AccountId.of(7);

  private ExecutorService handlerExecutor;
  private RecordingTransport transport;
  private StubContexts contexts;
  private SubscriptionRouter router;
  private AtomicInteger unsubscribes;
  private AtomicReference<SubscriptionContext<Object>> lastContext;

  @BeforeEach
  void setUp() {
    handlerExecutor = Executors.newCachedThreadPool();
    transport = new RecordingTransport();
    contexts = new StubContexts();
    unsubscribes = new AtomicInteger();
    lastContext = new AtomicReference<>();
    router = new SubscriptionRouter()
        .register("/topic/watch", InputReader.json(MAPPER, Topic.class), (ctx, input) -> {
          lastContext.set(ctx);
          return unsubscribes::incrementAndGet;
        });
  }

  @AfterEach
  void tearDown() {
    handlerExecutor.shutdownNow();
  }

  private SubscriptionSession newSession() {
    return newSession(SessionOptions.DEFAULTS);
  }

  private SubscriptionSession newSession(SessionOptions options) {
    return SubscriptionSession.builder()
        .accountId(ACCOUNT)
        .transport(transport)
        .router(router)
        .contexts(contexts)
        .handlerExecutor(handlerExecutor)
        .options(options)
        .build();
  }

  private static String subscribe(String id, String path, String input) {
    return "{\"type\":\"subscribe\",\"id\":\"" + id + "\",\"path\":\"" + path + "\",\"input\":" + input + "}";
  }

  private static String unsubscribe(String id) {
    return "{\"type\":\"unsubscribe\",\"id\":\"" + id + "\"}";
  }

  private static void await(CompletableFuture<?> future) throws Exception {
    future.get(5, TimeUnit.SECONDS);
  }

  @Test
  void acknowledgesSuccessfulSubscribe() throws Exception {
    SubscriptionSession session = newSession();

    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"news\"}")));

    List<JsonNode> frames = transport.frames();
    assertEquals(1, frames.size());
    assertEquals("subscribed", frames.get(0).get("type").asText());
    assertEquals("s1", frames.get(0).get("id").asText());
    assertEquals(1, session.subscriptionCount());
    assertEquals(ACCOUNT, lastContext.get().accountId());
  }

  @Test
  void duplicateIdWhileFirstInFlightIsRejected() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    router.register("/slow", InputReader.json(MAPPER, Topic.class), (ctx, input) -> {
      release.await();
      return Unsubscribe.NOOP;
    });
    SubscriptionSession session = newSession();

    CompletableFuture<Void> first = session.onText(subscribe("s1", "/slow", "{\"name\":\"a\"}"));
    CompletableFuture<Void> second = session.onText(subscribe("s1", "/slow", "{\"name\":\"b\"}"));
    await(second);

    assertEquals(List.of("ALREADY_EXISTS"), transport.errorCodes());
    assertEquals("s1", transport.framesOfType("error").get(0).get("id").asText());
    assertFalse(first.isDone());

    release.countDown();
    await(first);
    assertEquals(1, transport.framesOfType("subscribed").size());
  }

  @Test
  void concurrentDuplicateSubscribesYieldOneSuccessAndOneAlreadyExists() throws Exception {
    ExecutorService senders = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < 50; round++) {
        transport = new RecordingTransport();
        SubscriptionSession session = newSession();
        CountDownLatch start = new CountDownLatch(1);
        String frame = subscribe("dup", "/topic/watch", "{\"name\":\"x\"}");
        CompletableFuture<CompletableFuture<Void>> a = CompletableFuture.supplyAsync(() -> {
          awaitQuietly(start);
          return session.onText(frame);
        }, senders);
        CompletableFuture<CompletableFuture<Void>> b = CompletableFuture.supplyAsync(() -> {
          awaitQuietly(start);
          return session.onText(frame);
        }, senders);
        start.countDown();
        await(a.get(5, TimeUnit.SECONDS));
        await(b.get(5, TimeUnit.SECONDS));

        assertEquals(1, transport.framesOfType("subscribed").size());
        assertEquals(List.of("ALREADY_EXISTS"), transport.errorCodes());
      }
    } finally {
      senders.shutdownNow();
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  @Test
  void unknownPathIsNotFound() throws Exception {
    SubscriptionSession session = newSession();

    await(session.onText(subscribe("s1", "/nope", "{}")));

    assertEquals(List.of("NOT_FOUND"), transport.errorCodes());
    assertEquals(0, session.subscriptionCount());
  }

  @Test
  void invalidInputIsBadInput() throws Exception {
    router.register("/strict",
        InputReader.json(MAPPER, Topic.class).validate(topic -> topic.name() != null, "name required"),
        (ctx, input) -> Unsubscribe.NOOP);
    SubscriptionSession session = newSession();

    await(session.onText(subscribe("s1", "/topic/watch", "[1,2]")));
    await(session.onText(subscribe("s2", "/strict", "{}")));
    await(session.onText("{\"type\":\"subscribe\",\"id\":\"s3\",\"path\":\"/topic/watch\"}"));

    assertEquals(List.of("BAD_INPUT", "BAD_INPUT", "BAD_INPUT"), transport.errorCodes());
    assertEquals(0, session.subscriptionCount());
  }

  @Test
  void malformedFramesAreBadInputAndKeepSessionUsable() throws Exception {
    SubscriptionSession session = newSession();

    await(session.onText("not json"));
    await(session.onText("[]"));
    await(session.onText("{\"type\":\"publish\",\"id\":\"x\"}"));
    await(session.onText("{\"type\":\"unsubscribe\"}"));
    session.onBinary();
    session.onUndecodableText();

    assertEquals(List.of("BAD_INPUT", "BAD_INPUT", "BAD_INPUT", "BAD_INPUT", "BAD_INPUT", "BAD_INPUT"),
        transport.errorCodes());
    assertTrue(transport.framesOfType("error").stream().noneMatch(frame -> frame.has("id")));

    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"news\"}")));
    assertEquals(1, transport.framesOfType("subscribed").size());
  }

  @Test
  void unsubscribeUnknownIdIsNotFound() throws Exception {
    SubscriptionSession session = newSession();

    await(session.onText(unsubscribe("ghost")));

    JsonNode error = transport.framesOfType("error").get(0);
    assertEquals("NOT_FOUND", error.get("error").get("code").asText());
    assertEquals("ghost", error.get("id").asText());
  }

  @Test
  void unsubscribeTwiceYieldsNotFoundSecondTime() throws Exception {
    SubscriptionSession session = newSession();
    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"news\"}")));

    await(session.onText(unsubscribe("s1")));
    await(session.onText(unsubscribe("s1")));

    assertEquals(1, unsubscribes.get());
    assertEquals(List.of("NOT_FOUND"), transport.errorCodes());
  }

  @Test
  void handlerApiErrorIsReportedAndIdStaysTakenUntilUnsubscribed() throws Exception {
    router.register("/private", InputReader.json(MAPPER, Topic.class), (ctx, input) -> {
      throw new ApiException(ApiErrorCode.UNAUTHORIZED, "not yours");
    });
    SubscriptionSession session = newSession();

    await(session.onText(subscribe("s1", "/private", "{\"name\":\"x\"}")));
    JsonNode error = transport.framesOfType("error").get(0);
    assertEquals("UNAUTHORIZED", error.get("error").get("code").asText());
    assertEquals("s1", error.get("id").asText());
    assertFalse(error.get("error").has("serverStack"));

    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"x\"}")));
    assertEquals(List.of("UNAUTHORIZED", "ALREADY_EXISTS"), transport.errorCodes());

    await(session.onText(unsubscribe("s1")));
    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"x\"}")));
    assertEquals(1, transport.framesOfType("subscribed").size());
    assertEquals(2, transport.errorCodes().size());
  }

  @Test
  void unexpectedHandlerErrorIsUnknownWithOptionalStack() throws Exception {
    router.register("/broken", InputReader.json(MAPPER, Topic.class), (ctx, input) -> {
      throw new IllegalStateException("handler bug");
    });

    newSession().onText(subscribe("s1", "/broken", "{\"name\":\"x\"}")).get(5, TimeUnit.SECONDS);
    JsonNode hidden = transport.framesOfType("error").get(0).get("error");
    assertEquals("UNKNOWN", hidden.get("code").asText());
    assertFalse(hidden.has("serverStack"));

    transport = new RecordingTransport();
    newSession(new SessionOptions(true)).onText(subscribe("s1", "/broken", "{\"name\":\"x\"}"))
        .get(5, TimeUnit.SECONDS);
    JsonNode exposed = transport.framesOfType("error").get(0).get("error");
    assertEquals("UNKNOWN", exposed.get("code").asText());
    assertTrue(exposed.get("serverStack").asText().contains("handler bug"));
  }

  @Test
  void publishedMessagesArriveInOrderAndStopAfterUnsubscribe() throws Exception {
    SubscriptionSession session = newSession();
    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"news\"}")));
    SubscriptionContext<Object> ctx = lastContext.get();

    for (int i = 0; i < 20; i++) {
      ctx.publish(new Topic("m" + i));
    }
    await(session.onText(unsubscribe("s1")));
    ctx.publish(new Topic("late"));

    List<JsonNode> messages = transport.framesOfType("message");
    assertEquals(20, messages.size());
    for (int i = 0; i < 20; i++) {
      assertEquals("s1", messages.get(i).get("id").asText());
      assertEquals("m" + i, messages.get(i).get("message").get("name").asText());
    }
    assertFalse(ctx.isActive());
    assertEquals(1, unsubscribes.get());
  }

  @Test
  void stepUpRunsAsSessionAccount() throws Exception {
    router.register("/read", InputReader.json(MAPPER, Topic.class), (ctx, input) -> {
      int rows = ctx.withAuthorized(tx -> tx.update(SqlQuery.of("SELECT 1")));
      ctx.publish(new Topic("rows=" + rows));
      return Unsubscribe.NOOP;
    });
    SubscriptionSession session = newSession();

    await(session.onText(subscribe("s1", "/read", "{\"name\":\"x\"}")));

    assertEquals(List.of(ACCOUNT), contexts.authorized());
    assertEquals(1, transport.framesOfType("message").size());
  }

  @Test
  void closeUnsubscribesEverythingIncludingInFlight() throws Exception {
    CountDownLatch handlerEntered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger slowUnsubscribes = new AtomicInteger();
    router.register("/slow", InputReader.json(MAPPER, Topic.class), (ctx, input) -> {
      handlerEntered.countDown();
      release.await();
      return slowUnsubscribes::incrementAndGet;
    });
    SubscriptionSession session = newSession();
    await(session.onText(subscribe("ready", "/topic/watch", "{\"name\":\"a\"}")));
    CompletableFuture<Void> inFlight = session.onText(subscribe("pending", "/slow", "{\"name\":\"b\"}"));
    assertTrue(handlerEntered.await(5, TimeUnit.SECONDS));

    CompletableFuture<Void> closed = session.close();
    Thread.sleep(50);
    assertFalse(closed.isDone());
    assertEquals(1, unsubscribes.get());

    release.countDown();
    await(closed);
    await(inFlight);
    assertEquals(1, slowUnsubscribes.get());
    assertEquals(0, session.subscriptionCount());
    assertTrue(transport.framesOfType("subscribed").stream()
        .noneMatch(frame -> "pending".equals(frame.get("id").asText())));

    assertSame(closed, session.close());
    assertEquals(1, unsubscribes.get());
    assertEquals(1, slowUnsubscribes.get());
  }

  @Test
  void inFlightHandlerIsUnsubscribedAfterExecutorShutdown() throws Exception {
    CountDownLatch handlerEntered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger slowUnsubscribes = new AtomicInteger();
    router.register("/slow", InputReader.json(MAPPER, Topic.class), (ctx, input) -> {
      handlerEntered.countDown();
      release.await();
      return slowUnsubscribes::incrementAndGet;
    });
    SubscriptionSession session = newSession();
    CompletableFuture<Void> inFlight = session.onText(subscribe("pending", "/slow", "{\"name\":\"b\"}"));
    assertTrue(handlerEntered.await(5, TimeUnit.SECONDS));

    CompletableFuture<Void> closed = session.close();
    handlerExecutor.shutdown();
    release.countDown();
    await(closed);
    await(inFlight);

    assertEquals(1, slowUnsubscribes.get());
  }

  @Test
  void unsubscribeRunsWhenExecutorAlreadyShutDown() throws Exception {
    SubscriptionSession session = newSession();
    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"a\"}")));
    handlerExecutor.shutdown();

    await(session.close());

    assertEquals(1, unsubscribes.get());
  }

  @Test
  void closeSwallowsUnsubscribeFailures() throws Exception {
    router.register("/faulty", InputReader.json(MAPPER, Topic.class), (ctx, input) -> () -> {
      throw new IllegalStateException("teardown failed");
    });
    SubscriptionSession session = newSession();
    await(session.onText(subscribe("a", "/faulty", "{\"name\":\"a\"}")));
    await(session.onText(subscribe("b", "/topic/watch", "{\"name\":\"b\"}")));

    await(session.close());

    assertEquals(1, unsubscribes.get());
    assertTrue(session.isClosed());
  }

  @Test
  void framesAfterCloseAreIgnored() throws Exception {
    SubscriptionSession session = newSession();
    await(session.close());

    await(session.onText(subscribe("s1", "/topic/watch", "{\"name\":\"a\"}")));

    assertEquals(0, transport.frameCount());
    assertEquals(0, session.subscriptionCount());
  }

  @Test
  void builderRequiresCollaborators() {
    assertThrows(NullPointerException.class, () -> SubscriptionSession.builder().build());
  }
}
