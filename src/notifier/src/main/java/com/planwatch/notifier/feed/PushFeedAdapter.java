package com.planwatch.notifier.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.event.FlightEventMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Push transport: one persistent WebSocket connection delivering {@code {t|type, d|data}}
 * envelopes.
 *
 * <p>Only allow-listed event types are decoded. Each flight-plan record becomes one event; no
 * snapshot diffing happens here. A keep-alive ping is sent every ping interval and the
 * connection is aborted when the pong does not arrive in time. Any connection loss is followed
 * by a fixed cooldown and a reconnect, forever.
 */
public class PushFeedAdapter implements FeedAdapter {
  private static final Logger log = LoggerFactory.getLogger(PushFeedAdapter.class);
  private static final int INBOX_CAPACITY = 10_000;
  private static final long INBOX_POLL_MS = 250L;
  private static final int LOG_PREVIEW_CHARS = 100;
  private static final byte[] PING_PAYLOAD = "keepalive".getBytes(StandardCharsets.US_ASCII);

  private final String name;
  private final Settings settings;
  private final WebSocketConnector connector;
  private final ObjectMapper objectMapper;
  private final PayloadDecoder decoder;
  private final FlightEventMapper mapper;
  private final Sleeper sleeper;
  private final BlockingQueue<FlightEvent> inbox = new LinkedBlockingQueue<>(INBOX_CAPACITY);
  private final ScheduledExecutorService keepAlive;
  private final AtomicBoolean consumed = new AtomicBoolean(false);
  private final Counter acceptedCounter;
  private final Counter ignoredCounter;
  private final Counter malformedCounter;
  private final Counter droppedCounter;
  private final Counter reconnectCounter;
  private volatile StreamSession session;
  private volatile boolean closed;

  /** Connection and keep-alive settings of one stream. */
  public record Settings(
      URI uri,
      Set<String> eventTypes,
      Duration pingInterval,
      Duration pingTimeout,
      Duration reconnectDelay,
      Duration connectTimeout) {
    public Settings {
      eventTypes = Set.copyOf(eventTypes);
    }
  }

  public PushFeedAdapter(
      String name,
      Settings settings,
      WebSocketConnector connector,
      ObjectMapper objectMapper,
      PayloadDecoder decoder,
      FlightEventMapper mapper,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.name = name;
    this.settings = settings;
    this.connector = connector;
    this.objectMapper = objectMapper;
    this.decoder = decoder;
    this.mapper = mapper;
    this.sleeper = sleeper;
    this.keepAlive = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "feed-" + name + "-keepalive");
      thread.setDaemon(true);
      return thread;
    });
    this.acceptedCounter = messageCounter(meterRegistry, "accepted");
    this.ignoredCounter = messageCounter(meterRegistry, "ignored");
    this.malformedCounter = messageCounter(meterRegistry, "malformed");
    this.droppedCounter = messageCounter(meterRegistry, "dropped");
    this.reconnectCounter = meterRegistry.counter("notifier.stream.reconnects.total");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public FeedTransport transport() {
    return FeedTransport.PUSH;
  }

  @Override
  public Iterator<FlightEvent> events() {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException("Feed adapter " + name + " is not restartable");
    }
    return new StreamIterator();
  }

  @Override
  public void close() {
    closed = true;
    StreamSession current = session;
    if (current != null) {
      current.shutdown();
    }
    keepAlive.shutdownNow();
  }

  /** Decodes one complete text message and queues the flight plans it carries. */
  void onMessage(String text) {
    JsonNode envelope;
    try {
      envelope = objectMapper.readTree(text);
    } catch (JsonProcessingException ex) {
      malformedCounter.increment();
      log.warn("Received invalid JSON from stream: {}...", preview(text));
      return;
    }
    JsonNode type = firstPresent(envelope, "t", "type");
    JsonNode data = firstPresent(envelope, "d", "data");
    if (type == null || data == null) {
      malformedCounter.increment();
      log.debug("Invalid message format: {}", preview(text));
      return;
    }
    if (!settings.eventTypes().contains(type.asText())) {
      ignoredCounter.increment();
      return;
    }

    Optional<List<ObjectNode>> records = decoder.decodeMessage(data);
    if (records.isEmpty()) {
      malformedCounter.increment();
      log.debug("No flight plans found in {} payload: {}", type.asText(), preview(data.toString()));
      return;
    }
    for (ObjectNode record : records.get()) {
      Optional<FlightEvent> event = mapper.fromRecord(record);
      if (event.isEmpty()) {
        malformedCounter.increment();
        continue;
      }
      if (inbox.offer(event.get())) {
        acceptedCounter.increment();
      } else {
        droppedCounter.increment();
        log.warn("Stream inbox full, dropping flight plan {}", event.get().callsign());
      }
    }
  }

  private StreamSession openSession() throws InterruptedException {
    StreamSession candidate = new StreamSession();
    log.info("Attempting to connect to stream {}", settings.uri());
    CompletableFuture<WebSocket> pending = connector.connect(settings.uri(), candidate);
    try {
      WebSocket socket = pending.get(settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
      candidate.attach(socket);
      log.info("Connected to stream {}", settings.uri());
      return candidate;
    } catch (ExecutionException ex) {
      log.warn("Stream connection to {} failed: {}", settings.uri(), String.valueOf(ex.getCause()));
    } catch (TimeoutException ex) {
      abandon(candidate, pending);
      log.warn("Stream connection to {} timed out after {}ms", settings.uri(), settings.connectTimeout().toMillis());
    } catch (InterruptedException ex) {
      abandon(candidate, pending);
      throw ex;
    }
    return null;
  }

  /** Gives up on a handshake; a socket that still opens afterwards is aborted by its session. */
  private static void abandon(StreamSession candidate, CompletableFuture<WebSocket> pending) {
    candidate.abandon();
    pending.whenComplete((socket, ex) -> {
      if (socket != null) {
        socket.abort();
      }
    });
    pending.cancel(true);
  }

  private static JsonNode firstPresent(JsonNode envelope, String... names) {
    if (envelope == null || !envelope.isObject()) {
      return null;
    }
    for (String name : names) {
      JsonNode node = envelope.get(name);
      if (node != null && !node.isNull()) {
        return node;
      }
    }
    return null;
  }

  private static String preview(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= LOG_PREVIEW_CHARS ? text : text.substring(0, LOG_PREVIEW_CHARS);
  }

  private static Counter messageCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("notifier.stream.messages.total")
        .description("Stream messages and records (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private final class StreamIterator implements Iterator<FlightEvent> {
    private FlightEvent pending;

    @Override
    public boolean hasNext() {
      if (pending != null) {
        return true;
      }
      try {
        while (!closed) {
          pending = inbox.poll();
          if (pending != null) {
            return true;
          }
          StreamSession current = session;
          if (current == null) {
            current = openSession();
            session = current;
            if (current == null) {
              sleeper.sleep(settings.reconnectDelay());
              continue;
            }
          }
          pending = inbox.poll(INBOX_POLL_MS, TimeUnit.MILLISECONDS);
          if (pending != null) {
            return true;
          }
          if (current.isClosed() && !closed) {
            reconnectCounter.increment();
            log.warn("Stream connection to {} lost ({}), reconnecting in {}ms",
                settings.uri(), current.closeReason(), settings.reconnectDelay().toMillis());
            current.abort();
            session = null;
            sleeper.sleep(settings.reconnectDelay());
          }
        }
        return false;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Feed adapter {} interrupted", name);
        return false;
      }
    }

    @Override
    public FlightEvent next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      FlightEvent next = pending;
      pending = null;
      return next;
    }
  }

  /** Listener of one connection; a new session is created for every reconnect. */
  private final class StreamSession implements WebSocket.Listener {
    private final StringBuilder partial = new StringBuilder();
    private volatile WebSocket socket;
    private volatile boolean sessionClosed;
    private volatile boolean awaitingPong;
    private volatile boolean abandoned;
    private volatile String closeReason = "open";
    private volatile ScheduledFuture<?> pinger;

    void attach(WebSocket socket) {
      this.socket = socket;
      long intervalMs = settings.pingInterval().toMillis();
      if (intervalMs > 0 && !sessionClosed && !keepAlive.isShutdown()) {
        pinger = keepAlive.scheduleAtFixedRate(this::probe, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
      }
    }

    boolean isClosed() {
      return sessionClosed;
    }

    String closeReason() {
      return closeReason;
    }

    void abandon() {
      abandoned = true;
      markClosed("abandoned");
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      if (abandoned) {
        webSocket.abort();
        return;
      }
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        String message = partial.toString();
        partial.setLength(0);
        try {
          onMessage(message);
        } catch (RuntimeException ex) {
          log.error("Error processing stream message", ex);
        }
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
      awaitingPong = false;
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      markClosed("closed by server: " + statusCode + (reason == null || reason.isBlank() ? "" : " " + reason));
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      markClosed("error: " + error);
    }

    private void probe() {
      WebSocket current = socket;
      if (sessionClosed || current == null || awaitingPong) {
        return;
      }
      awaitingPong = true;
      current.sendPing(ByteBuffer.wrap(PING_PAYLOAD)).exceptionally(ex -> {
        markClosed("ping failed: " + ex);
        return null;
      });
      keepAlive.schedule(() -> {
        if (awaitingPong && !sessionClosed) {
          log.warn("No pong from {} within {}ms", settings.uri(), settings.pingTimeout().toMillis());
          abort();
        }
      }, settings.pingTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void markClosed(String reason) {
      if (!sessionClosed) {
        closeReason = reason;
      }
      sessionClosed = true;
      ScheduledFuture<?> current = pinger;
      if (current != null) {
        current.cancel(false);
      }
    }

    void abort() {
      markClosed(sessionClosed ? closeReason : "aborted");
      WebSocket current = socket;
      if (current != null) {
        current.abort();
      }
    }

    void shutdown() {
      markClosed("shutdown");
      WebSocket current = socket;
      if (current == null) {
        return;
      }
      current.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown").whenComplete((ignored, ex) -> {
        if (ex != null) {
          current.abort();
        }
      });
    }
  }
}
