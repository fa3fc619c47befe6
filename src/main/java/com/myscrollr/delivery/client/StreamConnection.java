package com.myscrollr.delivery.client;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Keeps the event stream open: reconnects with backoff after failures and reacts to the
 * periodic wake signal. All state is touched only on the {@link EventLoop}.
 *
 * A stale session (one replaced or closed by {@link #stop()}) may still report from its
 * reader thread; such callbacks are discarded.
 *
 * <p>Backoff counts failed reconnect attempts. The wait before a retry is taken from the
 * policy before the failure that triggered it is recorded, so the first retry (including
 * the one after the initial {@link #start()} connect fails) waits the base delay, and the
 * retry following {@code k} failed reconnects waits {@code min(base * 2^k, max)}:
 * 1s, 2s, 4s, 8s, 16s, then 30s.
 */
@Slf4j
public class StreamConnection {

    /**
     * Receives what the connection observes. Called on the event loop.
     */
    public interface Events {
        void onFrame(String data);

        void onStatusChanged(ConnectionStatus status);
    }

    private final StreamTransport transport;
    private final ReconnectPolicy policy;
    private final EventLoop loop;
    private final Events events;
    private final Clock clock;

    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private boolean running;
    private StreamTransport.StreamSession session;
    private EventLoop.Cancellable pendingAttempt;
    private long pendingDueAt;
    private EventLoop.Cancellable wakeTimer;
    private long generation;

    public StreamConnection(StreamTransport transport, ReconnectPolicy policy, EventLoop loop, Events events) {
        this(transport, policy, loop, events, Clock.systemUTC());
    }

    StreamConnection(StreamTransport transport, ReconnectPolicy policy, EventLoop loop, Events events, Clock clock) {
        this.transport = transport;
        this.policy = policy;
        this.loop = loop;
        this.events = events;
        this.clock = clock;
    }

    public void start() {
        loop.execute(() -> {
            if (running) {
                return;
            }
            running = true;
            connect();
        });
    }

    public void stop() {
        loop.execute(() -> {
            running = false;
            cancelPendingAttempt();
            closeSession();
            policy.reset();
            updateStatus(ConnectionStatus.DISCONNECTED);
            log.info("[CLIENT] Stream stopped");
        });
    }

    /**
     * Starts the periodic wake signal that forces a reconnect check.
     */
    public void startWakeTimer(Duration interval) {
        loop.execute(() -> {
            if (wakeTimer == null) {
                wakeTimer = loop.scheduleAtFixedRate(this::onWake, interval);
            }
        });
    }

    public void stopWakeTimer() {
        loop.execute(() -> {
            if (wakeTimer != null) {
                wakeTimer.cancel();
                wakeTimer = null;
            }
        });
    }

    public void wake() {
        loop.execute(this::onWake);
    }

    /**
     * Current status. Only meaningful on the event loop.
     */
    public ConnectionStatus status() {
        return status;
    }

    private void onWake() {
        if (!running || session != null) {
            return;
        }
        if (pendingAttempt != null) {
            if (clock.millis() < pendingDueAt) {
                return;
            }
            // the retry timer did not fire while the host was suspended
            cancelPendingAttempt();
        }
        if (status == ConnectionStatus.DISCONNECTED || status == ConnectionStatus.RECONNECTING) {
            log.info("[CLIENT] Wake signal found stream {}, reconnecting", status.wireName());
            policy.reset();
            connect();
        }
    }

    private void connect() {
        pendingAttempt = null;
        if (!running) {
            return;
        }
        long attempt = ++generation;
        try {
            StreamTransport.StreamSession opened = transport.open(new StreamTransport.Listener() {
                @Override
                public void onOpen() {
                    loop.execute(() -> handleOpen(attempt));
                }

                @Override
                public void onData(String data) {
                    loop.execute(() -> handleData(attempt, data));
                }

                @Override
                public void onClosed(Throwable cause) {
                    loop.execute(() -> handleClosed(attempt, cause));
                }
            });
            if (attempt == generation) {
                session = opened;
            } else {
                // the attempt already ended while opening
                opened.close();
            }
        } catch (RuntimeException e) {
            handleClosed(attempt, e);
        }
    }

    private void handleOpen(long attempt) {
        if (attempt != generation || !running) {
            return;
        }
        policy.recordSuccess();
        updateStatus(ConnectionStatus.CONNECTED);
        log.info("[CLIENT] Stream connected");
    }

    private void handleData(long attempt, String data) {
        if (attempt != generation || !running) {
            return;
        }
        events.onFrame(data);
    }

    private void handleClosed(long attempt, Throwable cause) {
        if (attempt != generation || !running) {
            return;
        }
        closeSession();
        if (cause != null) {
            log.warn("[CLIENT] Stream failed: {}", cause.getMessage());
        } else {
            log.info("[CLIENT] Stream ended by server");
        }
        updateStatus(ConnectionStatus.DISCONNECTED);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (pendingAttempt != null) {
            return;
        }
        Duration delay = policy.nextDelay();
        policy.recordFailure();
        updateStatus(ConnectionStatus.RECONNECTING);
        log.info("[CLIENT] Reconnecting in {} ms (attempt {})", delay.toMillis(), policy.consecutiveFailures());
        pendingDueAt = clock.millis() + delay.toMillis();
        pendingAttempt = loop.schedule(this::connect, delay);
    }

    private void cancelPendingAttempt() {
        if (pendingAttempt != null) {
            pendingAttempt.cancel();
            pendingAttempt = null;
        }
    }

    private void closeSession() {
        generation++;
        if (session != null) {
            session.close();
            session = null;
        }
    }

    private void updateStatus(ConnectionStatus next) {
        if (status == next) {
            return;
        }
        status = next;
        events.onStatusChanged(next);
    }
}
