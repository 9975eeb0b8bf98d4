/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.middleman;

import static com.github.mizosoft.middleman.internal.Validate.requireArgument;
import static com.github.mizosoft.middleman.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.middleman.cache.Cache;
import com.github.mizosoft.middleman.cache.CacheEntry;
import com.github.mizosoft.middleman.cache.Lookup;
import com.github.mizosoft.middleman.cache.Store;
import com.github.mizosoft.middleman.internal.Utils;
import com.github.mizosoft.middleman.internal.cache.CapturingBodySubscriber;
import com.github.mizosoft.middleman.internal.cache.ResponseCaptureBuffer;
import com.github.mizosoft.middleman.internal.server.JdkServerExchange;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpClient.Version;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpResponse.ResponseInfo;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A caching reverse proxy for a single target. Requests are forwarded to the target and the
 * responses are streamed back to clients. Responses to requests with a {@link
 * Builder#cacheMethods(String...) cacheable method} are captured while being streamed, and are
 * stored in a {@link Cache} under a key computed from the request, unless the {@link
 * Builder#bypass(Predicate) bypass predicate} says otherwise. Later requests with the same key are
 * served from the cache till the entry expires or is evicted.
 *
 * <p>Failures to populate the cache never affect the response already delivered to the client.
 * Failures to read from the cache are not silently bypassed. The request is instead failed with
 * the {@link Builder#httpError(ErrorResponder) error responder}.
 */
public final class Middleman {
  private static final Logger logger = System.getLogger(Middleman.class.getName());

  private static final Pattern ANY_METHOD = Pattern.compile("\\w+");

  /** Headers that aren't forwarded in either direction or that the HTTP client sets itself. */
  private static final Set<String> HOP_BY_HOP_HEADERS =
      Set.of(
          "connection",
          "content-length",
          "date",
          "expect",
          "from",
          "host",
          "http2-settings",
          "keep-alive",
          "proxy-connection",
          "te",
          "trailer",
          "transfer-encoding",
          "upgrade",
          "via",
          "warning");

  private final URI target;
  private final Map<String, List<String>> setHeaders;
  private final List<Pattern> cacheMethods;
  private final Function<ServerExchange, String> cacheKey;
  private final Predicate<ResponseInfo> bypass;
  private final ErrorResponder httpError;
  private final Listener listener;
  private final Cache cache;
  private final HttpClient httpClient;

  private Middleman(Builder builder) {
    this.target = builder.target();
    this.setHeaders = Collections.unmodifiableMap(new TreeMap<>(builder.setHeaders));
    this.cacheMethods = List.copyOf(builder.cacheMethods);
    this.cacheKey = builder.cacheKey;
    this.bypass = builder.bypass;
    this.httpError = builder.httpError;
    this.listener = builder.listener != null ? builder.listener.guarded() : Listener.disabled();
    this.cache = builder.cache();
    this.httpClient = builder.httpClient();
  }

  public URI target() {
    return target;
  }

  public Cache cache() {
    return cache;
  }

  public HttpClient httpClient() {
    return httpClient;
  }

  /**
   * Handles the given exchange, either from cache or by forwarding it to the target. The returned
   * future completes when the response is fully written to the client, and never completes
   * exceptionally as failures are reported to the listener and responded to.
   */
  public CompletableFuture<Void> handle(ServerExchange exchange) {
    requireNonNull(exchange);
    listener.onRequest(exchange);
    if (!isCacheable(exchange.method())) {
      return proxy(exchange, null);
    }

    String key;
    try {
      key = requireNonNull(cacheKey.apply(exchange), "cache key");
    } catch (RuntimeException e) {
      return fail(exchange, e);
    }
    return cache
        .get(key)
        .handle(
            (lookup, ex) -> {
              if (ex != null) {
                return fail(exchange, Utils.getDeepCompletionCause(ex));
              }
              return lookup.isHit()
                  ? serveFromCache(exchange, lookup.entry().orElseThrow())
                  : proxy(exchange, key);
            })
        .thenCompose(Function.identity());
  }

  /** Returns an {@code HttpHandler} that {@link #handle(ServerExchange) handles} exchanges. */
  public HttpHandler handler() {
    return exchange -> handle(new JdkServerExchange(exchange));
  }

  /**
   * Starts an {@code HttpServer} bound to the given address and serving all paths with this proxy.
   * The caller is responsible for stopping the server.
   */
  public HttpServer listen(InetSocketAddress address) throws IOException {
    var server = HttpServer.create(address, 0);
    server.createContext("/", handler());
    server.start();
    logger.log(Level.INFO, () -> "Proxying " + server.getAddress() + " to " + target);
    return server;
  }

  private boolean isCacheable(String method) {
    return cacheMethods.stream().anyMatch(pattern -> pattern.matcher(method).matches());
  }

  private CompletableFuture<Void> serveFromCache(ServerExchange exchange, CacheEntry entry) {
    listener.onCacheRequest(exchange);
    CachedResponse response;
    try {
      response = CachedResponse.parse(entry.value());
    } catch (InvalidCachedResponseException e) {
      return fail(exchange, new InvalidCachedResponseException("Invalid cache value", e));
    }

    try {
      var body = response.bodyBuffer();
      exchange.sendHeaders(response.statusCode(), response.headers(), body.remaining());
      exchange.write(body);
      exchange.end();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Couldn't send cached response to client", e);
      listener.onError(e);
    }
    return CompletableFuture.completedFuture(null);
  }

  private CompletableFuture<Void> proxy(ServerExchange exchange, @Nullable String key) {
    listener.onProxyRequest(exchange);
    HttpRequest request;
    try {
      request = newProxyRequest(exchange);
    } catch (RuntimeException e) {
      return fail(exchange, e);
    }
    var call = new ProxyCall(exchange, key);
    return Utils.invokeAsync(() -> httpClient.sendAsync(request, call))
        .handle(
            (__, ex) -> {
              if (ex != null) {
                call.onFailure(Utils.getDeepCompletionCause(ex));
              } else {
                call.onSuccess();
              }
              return null;
            });
  }

  private HttpRequest newProxyRequest(ServerExchange exchange) {
    var requestUri = exchange.requestUri();
    var builder =
        HttpRequest.newBuilder(Utils.joinPath(target, pathAndQuery(requestUri)))
            .method(exchange.method(), bodyPublisher(exchange));
    var forwarded = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
    exchange.requestHeaders().forEach(forwarded::put);
    forwarded.putAll(setHeaders); // Set headers take precedence.
    forwarded.forEach(
        (name, values) -> {
          if (!HOP_BY_HOP_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
            values.forEach(value -> builder.header(name, value));
          }
        });
    return builder.build();
  }

  private static BodyPublisher bodyPublisher(ServerExchange exchange) {
    var headers = exchange.requestHeaders();
    long contentLength = contentLength(headers);
    if (contentLength > 0) {
      return BodyPublishers.fromPublisher(
          BodyPublishers.ofInputStream(exchange::requestBody), contentLength);
    } else if (firstValue(headers, "Transfer-Encoding") != null) {
      return BodyPublishers.ofInputStream(exchange::requestBody);
    }
    return BodyPublishers.noBody();
  }

  private CompletableFuture<Void> fail(ServerExchange exchange, Throwable error) {
    listener.onError(error);
    try {
      httpError.respond(exchange, error);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Couldn't send error response to client", e);
    }
    return CompletableFuture.completedFuture(null);
  }

  /** Returns the default cache key of the given exchange: {@code METHOD:path[?query]}. */
  public static String defaultCacheKey(ServerExchange exchange) {
    return exchange.method() + ":" + pathAndQuery(exchange.requestUri());
  }

  private static String pathAndQuery(URI uri) {
    var path = uri.getRawPath();
    var query = uri.getRawQuery();
    return (path != null ? path : "") + (query != null ? "?" + query : "");
  }

  private static long contentLength(Map<String, List<String>> headers) {
    var value = firstValue(headers, "Content-Length");
    if (value == null) {
      return -1;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static @Nullable String firstValue(Map<String, List<String>> headers, String name) {
    for (var entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
        return entry.getValue().get(0);
      }
    }
    return null;
  }

  /** Returns a new {@code Middleman.Builder}. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** Forwards one request to the target, streaming the response and possibly capturing it. */
  private final class ProxyCall implements BodyHandler<Void> {
    private final ServerExchange exchange;
    private final @Nullable String key;
    private final @Nullable ResponseCaptureBuffer capture;
    private volatile @MonotonicNonNull ResponseInfo responseInfo;
    private volatile boolean bypassed;

    ProxyCall(ServerExchange exchange, @Nullable String key) {
      this.exchange = exchange;
      this.key = key;
      this.capture = key != null ? new ResponseCaptureBuffer() : null;
    }

    @Override
    public BodySubscriber<Void> apply(ResponseInfo responseInfo) {
      this.responseInfo = responseInfo;
      bypassed = key == null || bypass.test(responseInfo);
      var headers = responseHeaders(responseInfo);
      try {
        exchange.sendHeaders(
            responseInfo.statusCode(), headers, contentLength(responseInfo.headers().map()));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return new CapturingBodySubscriber(exchange, bypassed ? null : capture);
    }

    void onSuccess() {
      populateCache();
      try {
        exchange.end();
      } catch (IOException e) {
        logger.log(Level.WARNING, "Couldn't complete response to client", e);
        listener.onError(e);
      }
    }

    private void populateCache() {
      var capture = this.capture;
      var key = this.key;
      var responseInfo = this.responseInfo;
      if (capture == null || key == null || responseInfo == null) {
        return;
      }
      if (bypassed) {
        capture.close();
        return;
      }

      var response =
          new CachedResponse(
              responseInfo.statusCode(), responseHeaders(responseInfo), capture.toBytes());
      capture.close();
      cache
          .set(key, response)
          .whenComplete(
              (__, ex) -> {
                if (ex != null) {
                  var cause = Utils.getDeepCompletionCause(ex);
                  logger.log(Level.WARNING, "Couldn't cache response for <" + key + ">", cause);
                  listener.onError(cause);
                }
              });
    }

    void onFailure(Throwable error) {
      if (capture != null) {
        capture.close();
      }
      if (!exchange.headersSent()) {
        fail(exchange, error);
        return;
      }

      // The client got a partial response, all that can be done is cutting it off.
      listener.onError(error);
      try {
        exchange.end();
      } catch (IOException e) {
        logger.log(Level.WARNING, "Couldn't end response to client", e);
      }
    }
  }

  private static Map<String, List<String>> responseHeaders(ResponseInfo responseInfo) {
    var headers = new LinkedHashMap<String, List<String>>();
    responseInfo
        .headers()
        .map()
        .forEach(
            (name, values) -> {
              if (!name.startsWith(":")) {
                headers.put(name, values);
              }
            });
    return headers;
  }

  /** A listener to the requests handled by a {@code Middleman}. */
  public interface Listener {

    /** Called for every request received. */
    default void onRequest(ServerExchange exchange) {}

    /** Called when a request is about to be forwarded to the target. */
    default void onProxyRequest(ServerExchange exchange) {}

    /** Called when a request is about to be served from cache. */
    default void onCacheRequest(ServerExchange exchange) {}

    /** Called when a failure is encountered in the cache or the proxy path. */
    default void onError(Throwable exception) {}

    /** Returns a listener that logs and drops exceptions thrown by this listener. */
    default Listener guarded() {
      return new Listener() {
        @Override
        public void onRequest(ServerExchange exchange) {
          try {
            Listener.this.onRequest(exchange);
          } catch (Throwable e) {
            logger.log(Level.WARNING, "Exception thrown by Listener::onRequest", e);
          }
        }

        @Override
        public void onProxyRequest(ServerExchange exchange) {
          try {
            Listener.this.onProxyRequest(exchange);
          } catch (Throwable e) {
            logger.log(Level.WARNING, "Exception thrown by Listener::onProxyRequest", e);
          }
        }

        @Override
        public void onCacheRequest(ServerExchange exchange) {
          try {
            Listener.this.onCacheRequest(exchange);
          } catch (Throwable e) {
            logger.log(Level.WARNING, "Exception thrown by Listener::onCacheRequest", e);
          }
        }

        @Override
        public void onError(Throwable exception) {
          try {
            Listener.this.onError(exception);
          } catch (Throwable e) {
            logger.log(Level.WARNING, "Exception thrown by Listener::onError", e);
          }
        }
      };
    }

    static Listener disabled() {
      return DisabledListener.INSTANCE;
    }
  }

  private enum DisabledListener implements Listener {
    INSTANCE
  }

  /** A builder of {@code Middlemen}. */
  public static final class Builder {
    @MonotonicNonNull URI target;
    final Map<String, List<String>> setHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    List<Pattern> cacheMethods = List.of(ANY_METHOD);
    boolean followRedirects = true;
    Function<ServerExchange, String> cacheKey = Middleman::defaultCacheKey;
    Predicate<ResponseInfo> bypass = __ -> false;
    ErrorResponder httpError = ErrorResponder.internalServerError();
    @MonotonicNonNull Listener listener;
    @MonotonicNonNull Cache cache;
    @MonotonicNonNull HttpClient httpClient;
    private final Cache.Builder cacheBuilder = Cache.newBuilder();
    private boolean cacheConfigured;

    Builder() {}

    /** Sets the URI requests are forwarded to. Request paths are appended to the target's. */
    @CanIgnoreReturnValue
    public Builder target(URI target) {
      requireNonNull(target);
      requireArgument(
          target.isAbsolute() && target.getHost() != null, "target must be absolute: %s", target);
      this.target = target;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder target(String target) {
      return target(URI.create(target));
    }

    /** Sets a header sent with every forwarded request, replacing any the client sent. */
    @CanIgnoreReturnValue
    public Builder setHeader(String name, String value) {
      requireNonNull(name);
      requireNonNull(value);
      setHeaders.put(name, List.of(value));
      return this;
    }

    /** Sets the headers sent with every forwarded request. */
    @CanIgnoreReturnValue
    public Builder setHeaders(Map<String, String> headers) {
      headers.forEach(this::setHeader);
      return this;
    }

    /**
     * Sets the methods whose responses are cached. Each method is a pattern matched against the
     * whole request method, ignoring case. {@code "any"} matches all methods, which is the
     * default. Requests with other methods are always forwarded and never cached.
     */
    @CanIgnoreReturnValue
    public Builder cacheMethods(String... methods) {
      requireArgument(methods.length > 0, "no cache methods");
      var patterns = new ArrayList<Pattern>(methods.length);
      for (var method : methods) {
        requireNonNull(method);
        patterns.add(
            method.equals("any")
                ? ANY_METHOD
                : Pattern.compile("^" + method + "$", Pattern.CASE_INSENSITIVE));
      }
      this.cacheMethods = patterns;
      return this;
    }

    /** Sets whether the HTTP client follows redirects from the target, which is the default. */
    @CanIgnoreReturnValue
    public Builder followRedirects(boolean followRedirects) {
      this.followRedirects = followRedirects;
      return this;
    }

    /**
     * Sets the function computing a request's cache key. The default is {@link
     * #defaultCacheKey(ServerExchange)}.
     */
    @CanIgnoreReturnValue
    public Builder cacheKey(Function<ServerExchange, String> cacheKey) {
      this.cacheKey = requireNonNull(cacheKey);
      return this;
    }

    /**
     * Sets a predicate evaluated against the target's response, before its body is received,
     * which returns {@code true} if the response is not to be cached. The default never bypasses.
     */
    @CanIgnoreReturnValue
    public Builder bypass(Predicate<ResponseInfo> bypass) {
      this.bypass = requireNonNull(bypass);
      return this;
    }

    /** Sets the responder of failed requests. The default sends a {@code 500}. */
    @CanIgnoreReturnValue
    public Builder httpError(ErrorResponder httpError) {
      this.httpError = requireNonNull(httpError);
      return this;
    }

    /** Sets the {@code Listener}. */
    @CanIgnoreReturnValue
    public Builder listener(Listener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    /**
     * Sets the cache to use. This can't be combined with the methods configuring a cache to be
     * created by this builder.
     */
    @CanIgnoreReturnValue
    public Builder cache(Cache cache) {
      this.cache = requireNonNull(cache);
      return this;
    }

    /** Sets the max age of cached responses. */
    @CanIgnoreReturnValue
    public Builder maxAge(Duration maxAge) {
      cacheBuilder.maxAge(maxAge);
      cacheConfigured = true;
      return this;
    }

    /** Sets the max total size of cached responses, in bytes. */
    @CanIgnoreReturnValue
    public Builder maxSize(long maxSize) {
      cacheBuilder.maxSize(maxSize);
      cacheConfigured = true;
      return this;
    }

    /** Sets the max total size of cached responses from a human-readable size like "10mb". */
    @CanIgnoreReturnValue
    public Builder maxSize(String maxSize) {
      cacheBuilder.maxSize(maxSize);
      cacheConfigured = true;
      return this;
    }

    /** Sets whether least-recently-used responses are evicted when the max size is exceeded. */
    @CanIgnoreReturnValue
    public Builder sizeEviction(boolean sizeEviction) {
      cacheBuilder.sizeEviction(sizeEviction);
      cacheConfigured = true;
      return this;
    }

    /** Sets the store of cached responses. */
    @CanIgnoreReturnValue
    public Builder store(Store store) {
      cacheBuilder.store(store);
      cacheConfigured = true;
      return this;
    }

    /**
     * Sets the HTTP client used to forward requests. The client's redirect policy is used instead
     * of {@link #followRedirects(boolean)}.
     */
    @CanIgnoreReturnValue
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = requireNonNull(httpClient);
      return this;
    }

    private URI target() {
      var target = this.target;
      requireState(target != null, "a target must be specified");
      return target;
    }

    private Cache cache() {
      var cache = this.cache;
      if (cache != null) {
        requireState(!cacheConfigured, "a cache is given along with options to create one");
        return cache;
      }
      return cacheBuilder.build();
    }

    private HttpClient httpClient() {
      var httpClient = this.httpClient;
      if (httpClient != null) {
        return httpClient;
      }
      return HttpClient.newBuilder()
          .version(Version.HTTP_1_1)
          .followRedirects(followRedirects ? Redirect.NORMAL : Redirect.NEVER)
          .build();
    }

    /** Creates a new {@code Middleman}. */
    public Middleman build() {
      return new Middleman(this);
    }
  }
}
