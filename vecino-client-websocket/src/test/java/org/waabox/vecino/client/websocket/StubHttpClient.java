package org.waabox.vecino.client.websocket;

import java.io.IOException;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;

/**
 * An {@link HttpClient} that only hands out a given
 * {@link WebSocket.Builder}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class StubHttpClient extends HttpClient {

  /** The builder returned for every WebSocket. */
  private final WebSocket.Builder webSocketBuilder;

  /** Creates a client.
   *
   * @param theWebSocketBuilder the builder to hand out.
   */
  StubHttpClient(final WebSocket.Builder theWebSocketBuilder) {
    webSocketBuilder = theWebSocketBuilder;
  }

  @Override
  public WebSocket.Builder newWebSocketBuilder() {
    return webSocketBuilder;
  }

  @Override
  public Optional<CookieHandler> cookieHandler() {
    return Optional.empty();
  }

  @Override
  public Optional<Duration> connectTimeout() {
    return Optional.empty();
  }

  @Override
  public Redirect followRedirects() {
    return Redirect.NEVER;
  }

  @Override
  public Optional<ProxySelector> proxy() {
    return Optional.empty();
  }

  @Override
  public SSLContext sslContext() {
    throw new UnsupportedOperationException();
  }

  @Override
  public SSLParameters sslParameters() {
    throw new UnsupportedOperationException();
  }

  @Override
  public Optional<Authenticator> authenticator() {
    return Optional.empty();
  }

  @Override
  public Version version() {
    return Version.HTTP_1_1;
  }

  @Override
  public Optional<Executor> executor() {
    return Optional.empty();
  }

  @Override
  public <T> HttpResponse<T> send(final HttpRequest request,
      final HttpResponse.BodyHandler<T> handler)
      throws IOException, InterruptedException {
    throw new UnsupportedOperationException();
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      final HttpRequest request, final HttpResponse.BodyHandler<T> handler) {
    throw new UnsupportedOperationException();
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      final HttpRequest request, final HttpResponse.BodyHandler<T> handler,
      final HttpResponse.PushPromiseHandler<T> pushPromiseHandler) {
    throw new UnsupportedOperationException();
  }
}
