package com.company.sentinel.transport;

import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.util.Ticker;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Transport on the JDK HttpClient. DNS, TCP connect and TLS handshake are
 * timed on a dedicated pre-flight connection, since the client does not
 * expose its own connection phases. The exchange itself is split at the
 * moment response headers arrive.
 * <p>
 * Each probe therefore opens two connections to the target, and the connect
 * and TLS timings describe the pre-flight one rather than the connection that
 * carried the request. The DNS lookup blocks in the system resolver and is
 * only bounded by its own timeout settings, not by the probe budget.
 * <p>
 * At most {@code maxBodyChars * 4} bytes of a body are read, enough for that
 * many characters in any charset; the rest of the response is not consumed.
 */
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;
    private final Ticker ticker;
    private final SSLSocketFactory sslSocketFactory;
    private final int maxBodyChars;
    private final String userAgent;

    public JdkHttpTransport(Ticker ticker, int maxBodyChars, String userAgent) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .version(HttpClient.Version.HTTP_1_1)
                        .build(),
                ticker,
                (SSLSocketFactory) SSLSocketFactory.getDefault(),
                maxBodyChars,
                userAgent);
    }

    public JdkHttpTransport(HttpClient httpClient, Ticker ticker, SSLSocketFactory sslSocketFactory,
                            int maxBodyChars, String userAgent) {
        this.httpClient = httpClient;
        this.ticker = ticker;
        this.sslSocketFactory = sslSocketFactory;
        this.maxBodyChars = maxBodyChars;
        this.userAgent = userAgent;
    }

    @Override
    public HttpProbeResponse execute(TargetConfig target, Duration timeout, PhaseRecorder recorder)
            throws IOException, InterruptedException {
        URI uri = URI.create(target.getUrl());
        long budget = timeout.toNanos();

        measureConnection(uri, budget, recorder);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(remaining(recorder, budget, uri))
                .header("User-Agent", userAgent)
                .method(target.getMethod().name(), HttpRequest.BodyPublishers.noBody())
                .build();

        AtomicLong headersAt = new AtomicLong();
        long maxBodyBytes = maxBodyChars * 4L;
        HttpResponse.BodyHandler<byte[]> handler = info -> {
            headersAt.set(ticker.nanoTime());
            if (!target.getMethod().readsBody()) {
                return HttpResponse.BodySubscribers.replacing(new byte[0]);
            }
            return new CappedBodySubscriber(maxBodyBytes);
        };

        recorder.requestSent();
        CompletableFuture<HttpResponse<byte[]>> pending = httpClient.sendAsync(request, handler);
        HttpResponse<byte[]> response = await(pending, remaining(recorder, budget, uri), uri);

        recorder.headersReceivedAt(headersAt.get());
        recorder.bodyReceived();

        byte[] body = response.body() != null ? response.body() : new byte[0];
        return HttpProbeResponse.builder()
                .statusCode(response.statusCode())
                .body(target.getMethod().readsBody() ? decode(body, charsetOf(response)) : null)
                .contentSizeBytes(contentSize(response, body))
                .headers(flatten(response.headers().map()))
                .build();
    }

    private void measureConnection(URI uri, long budget, PhaseRecorder recorder) throws IOException {
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("URL has no host: " + uri);
        }
        boolean secure = "https".equalsIgnoreCase(uri.getScheme());
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        InetAddress address = InetAddress.getByName(host);
        recorder.dnsResolved();

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address, port), timeoutMillis(recorder, budget, uri));
            recorder.connected();

            if (secure) {
                try (SSLSocket tls = (SSLSocket) sslSocketFactory.createSocket(socket, host, port, false)) {
                    tls.setSoTimeout(timeoutMillis(recorder, budget, uri));
                    tls.startHandshake();
                    recorder.tlsEstablished();
                }
            }
        }
    }

    private HttpResponse<byte[]> await(CompletableFuture<HttpResponse<byte[]>> pending, Duration wait, URI uri)
            throws IOException, InterruptedException {
        try {
            return pending.get(wait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new HttpTimeoutException("No complete response from " + uri + " within budget");
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Request to " + uri + " failed", cause);
        }
    }

    private Duration remaining(PhaseRecorder recorder, long budget, URI uri) throws HttpTimeoutException {
        long remaining = recorder.remainingNanos(budget);
        if (remaining <= 0) {
            throw new HttpTimeoutException("Timeout budget exhausted before request to " + uri);
        }
        return Duration.ofNanos(remaining);
    }

    private int timeoutMillis(PhaseRecorder recorder, long budget, URI uri) throws SocketTimeoutException {
        long remaining = recorder.remainingNanos(budget);
        if (remaining <= 0) {
            throw new SocketTimeoutException("Timeout budget exhausted connecting to " + uri);
        }
        return (int) Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining));
    }

    private String decode(byte[] body, Charset charset) {
        String text = new String(body, charset);
        if (text.length() <= maxBodyChars) {
            return text;
        }
        return text.substring(0, maxBodyChars);
    }

    /**
     * Declared Content-Length, or the bytes actually read when the server
     * sends none
     */
    private long contentSize(HttpResponse<byte[]> response, byte[] body) {
        return response.headers().firstValueAsLong("Content-Length").orElse(body.length);
    }

    static Charset charsetOf(HttpResponse<?> response) {
        return response.headers().firstValue("Content-Type")
                .map(JdkHttpTransport::charsetParameter)
                .orElse(StandardCharsets.UTF_8);
    }

    static Charset charsetParameter(String contentType) {
        for (String parameter : contentType.split(";")) {
            String[] pair = parameter.trim().split("=", 2);
            if (pair.length == 2 && pair[0].trim().equalsIgnoreCase("charset")) {
                String name = pair[1].trim().replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    // IllegalCharsetName and UnsupportedCharset both land here
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    /**
     * Collects a body up to a byte limit, then cancels the subscription so the
     * client stops reading from the connection
     */
    static final class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {

        private final long limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final CompletableFuture<byte[]> body = new CompletableFuture<>();
        private Flow.Subscription subscription;

        CappedBodySubscriber(long limit) {
            this.limit = limit;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (limit <= 0) {
                subscription.cancel();
                body.complete(new byte[0]);
            } else {
                subscription.request(Long.MAX_VALUE);
            }
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (body.isDone()) {
                return;
            }
            for (ByteBuffer item : items) {
                int take = (int) Math.min(item.remaining(), limit - buffer.size());
                byte[] chunk = new byte[take];
                item.get(chunk);
                buffer.write(chunk, 0, take);
                if (buffer.size() >= limit) {
                    subscription.cancel();
                    body.complete(buffer.toByteArray());
                    return;
                }
            }
        }

        @Override
        public void onError(Throwable throwable) {
            body.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            body.complete(buffer.toByteArray());
        }
    }

    private Map<String, String> flatten(Map<String, List<String>> headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) {
                flat.put(name, String.join(", ", values));
            }
        });
        return flat;
    }
}
