package com.myscrollr.delivery.client;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Server-sent-events transport on the JDK {@link HttpClient}.
 *
 * Each session reads on its own daemon thread. Comment lines are keepalives and are skipped;
 * {@code data:} lines are joined until the blank line that ends the event. The connect timeout
 * bounds both the TCP handshake and the wait for response headers.
 */
@Slf4j
public class SseStreamTransport implements StreamTransport {

    private final HttpClient httpClient;
    private final URI streamUri;
    private final Supplier<String> tokenSupplier;
    private final Duration connectTimeout;

    public SseStreamTransport(URI streamUri, Duration connectTimeout, Supplier<String> tokenSupplier) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), streamUri, connectTimeout, tokenSupplier);
    }

    SseStreamTransport(HttpClient httpClient, URI streamUri, Duration connectTimeout, Supplier<String> tokenSupplier) {
        this.httpClient = httpClient;
        this.streamUri = streamUri;
        this.connectTimeout = connectTimeout;
        this.tokenSupplier = tokenSupplier;
    }

    @Override
    public StreamSession open(Listener listener) {
        AtomicBoolean closed = new AtomicBoolean();
        AtomicReference<InputStream> body = new AtomicReference<>();

        Thread reader = new Thread(() -> run(listener, closed, body), "scrollr-sse");
        reader.setDaemon(true);
        reader.start();

        return () -> {
            if (closed.compareAndSet(false, true)) {
                closeQuietly(body.get());
                reader.interrupt();
            }
        };
    }

    private void run(Listener listener, AtomicBoolean closed, AtomicReference<InputStream> body) {
        Throwable cause = null;
        try {
            HttpResponse<InputStream> response = httpClient.send(buildRequest(), HttpResponse.BodyHandlers.ofInputStream());
            body.set(response.body());
            if (response.statusCode() != 200) {
                closeQuietly(response.body());
                throw new IOException("Stream rejected with status " + response.statusCode());
            }
            listener.onOpen();
            readEvents(response.body(), listener, closed);
        } catch (HttpTimeoutException e) {
            log.debug("[CLIENT] No response from {} within {} ms", streamUri, connectTimeout.toMillis());
            cause = e;
        } catch (IOException e) {
            cause = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cause = e;
        }
        if (!closed.get()) {
            listener.onClosed(cause);
        }
    }

    private HttpRequest buildRequest() {
        HttpRequest.Builder builder = HttpRequest.newBuilder(streamUri)
                .header("Accept", "text/event-stream")
                .timeout(connectTimeout)
                .GET();
        String token = tokenSupplier != null ? tokenSupplier.get() : null;
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    static void readEvents(InputStream in, Listener listener, AtomicBoolean closed) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            StringBuilder data = new StringBuilder();
            String line;
            while (!closed.get() && (line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (data.length() > 0) {
                        listener.onData(data.toString());
                        data.setLength(0);
                    }
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    String value = line.substring(5);
                    data.append(value.startsWith(" ") ? value.substring(1) : value);
                }
                // ':' comments are keepalives; event, id and retry fields carry nothing we use
            }
        }
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            log.debug("[CLIENT] Error closing stream body: {}", e.getMessage());
        }
    }
}
