package com.planwatch.notifier.feed;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** Opens a streaming connection and binds it to a listener. */
@FunctionalInterface
public interface WebSocketConnector {
  CompletableFuture<WebSocket> connect(URI uri, WebSocket.Listener listener);

  static WebSocketConnector of(HttpClient httpClient, Duration connectTimeout) {
    return (uri, listener) -> httpClient.newWebSocketBuilder()
        .connectTimeout(connectTimeout)
        .buildAsync(uri, listener);
  }
}
