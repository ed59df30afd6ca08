package com.planwatch.notifier.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.notifier.config.DiscordProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Posts notifications as a single embed to a Discord channel over the REST API. */
@Component
public class DiscordDestinationClient implements DestinationClient {
  private static final Logger log = LoggerFactory.getLogger(DiscordDestinationClient.class);
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final DiscordProperties properties;
  private final Map<DeliveryResult, Counter> outcomeCounters = new EnumMap<>(DeliveryResult.class);

  public DiscordDestinationClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      DiscordProperties properties,
      MeterRegistry meterRegistry) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
    for (DeliveryResult result : DeliveryResult.values()) {
      outcomeCounters.put(result, Counter.builder("notifier.destination.http.requests.total")
          .description("Destination HTTP deliveries (by outcome)")
          .tag("outcome", result.tag())
          .register(meterRegistry));
    }
  }

  @Override
  public DeliveryResult send(long destinationId, Notification notification) {
    DeliveryResult result = deliver(destinationId, notification);
    outcomeCounters.get(result).increment();
    return result;
  }

  private DeliveryResult deliver(long destinationId, Notification notification) {
    String token = properties.botToken();
    if (token == null || token.isBlank()) {
      log.error("Discord bot token is not configured, cannot deliver to channel {}", destinationId);
      return DeliveryResult.ERROR;
    }

    String body;
    try {
      body = objectMapper.writeValueAsString(toMessage(notification));
    } catch (JsonProcessingException ex) {
      log.error("Failed to serialize notification for channel {}", destinationId, ex);
      return DeliveryResult.ERROR;
    }

    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/channels/" + destinationId + "/messages"))
        .timeout(timeout())
        .header("Authorization", "Bot " + token)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();

    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        return DeliveryResult.SUCCESS;
      }
      if (status == 403) {
        return DeliveryResult.PERMISSION_DENIED;
      }
      if (status == 404) {
        return DeliveryResult.NOT_FOUND;
      }
      log.warn("Discord rejected message for channel {}: status={} body={}", destinationId, status, response.body());
      return DeliveryResult.ERROR;
    } catch (IOException ex) {
      log.warn("Discord request for channel {} failed: {}", destinationId, ex.toString());
      return DeliveryResult.ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Discord request for channel {} interrupted", destinationId);
      return DeliveryResult.ERROR;
    }
  }

  ObjectNode toMessage(Notification notification) {
    ObjectNode embed = objectMapper.createObjectNode();
    embed.put("title", notification.title());
    embed.put("description", notification.description());
    embed.put("color", notification.color());
    if (notification.timestamp() != null) {
      embed.put("timestamp", notification.timestamp().toString());
    }
    ArrayNode fields = embed.putArray("fields");
    for (Notification.Field field : notification.fields()) {
      fields.addObject()
          .put("name", field.name())
          .put("value", field.value())
          .put("inline", field.inline());
    }
    if (notification.thumbnailUrl() != null) {
      embed.putObject("thumbnail").put("url", notification.thumbnailUrl());
    }
    if (notification.imageUrl() != null) {
      embed.putObject("image").put("url", notification.imageUrl());
    }
    if (notification.footer() != null) {
      embed.putObject("footer").put("text", notification.footer());
    }

    ObjectNode message = objectMapper.createObjectNode();
    message.putArray("embeds").add(embed);
    return message;
  }

  private String baseUrl() {
    String base = properties.apiBaseUrl();
    if (base == null || base.isBlank()) {
      base = "https://discord.com/api/v10";
    }
    return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }

  private Duration timeout() {
    return properties.requestTimeoutMs() > 0 ? Duration.ofMillis(properties.requestTimeoutMs()) : DEFAULT_TIMEOUT;
  }
}
