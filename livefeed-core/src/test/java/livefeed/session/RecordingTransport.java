package livefeed.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livefeed.spi.SessionTransport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Transport stub that records sent frames, pings and terminations.
 */
public final class RecordingTransport implements SessionTransport {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final List<String> frames = new CopyOnWriteArrayList<>();
  private final AtomicInteger pings = new AtomicInteger();
  private final AtomicBoolean terminated = new AtomicBoolean();

  @Override
  public void send(String frame) {
    frames.add(frame);
  }

  @Override
  public void ping() {
    pings.incrementAndGet();
  }

  @Override
  public void terminate() {
    terminated.set(true);
  }

  public List<JsonNode> frames() {
    return frames.stream().map(RecordingTransport::parse).collect(Collectors.toList());
  }

  public List<JsonNode> framesOfType(String type) {
    return frames().stream()
        .filter(frame -> type.equals(frame.path("type").asText()))
        .collect(Collectors.toList());
  }

  public List<String> errorCodes() {
    return framesOfType("error").stream()
        .map(frame -> frame.path("error").path("code").asText())
        .collect(Collectors.toList());
  }

  public int frameCount() {
    return frames.size();
  }

  public int pings() {
    return pings.get();
  }

  public boolean terminated() {
    return terminated.get();
  }

  private static JsonNode parse(String frame) {
    try {
      return MAPPER.readTree(frame);
    } catch (JsonProcessingException e) {
      throw new AssertionError("Server sent invalid JSON: " + frame, e);
    }
  }
}
