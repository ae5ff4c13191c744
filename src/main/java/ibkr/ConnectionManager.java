package ibkr;

import data.RequestRegistry;
import ibkr.model.GatewayError;
import ibkr.wire.GatewayClient;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.Constants;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the socket lifecycle: connect with handshake, the reader thread, teardown, reconnect and the
 * supervisor that repairs a lost connection.
 *
 * <p>Every connect, disconnect and reconnect runs under one lock, so the supervisor and callers never
 * rebuild the connection at the same time. The state field is also written from the reader thread
 * (fatal errors, connection closed) without taking the lock.
 */
public class ConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final RequestRegistry registry;
    private final OrderIdAllocator orderIds;
    private final MarketDataCache marketData;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<CompletableFuture<Boolean>> reconnectInFlight = new AtomicReference<>();
    private final List<Runnable> connectListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong generation = new AtomicLong();

    private GatewayClient client;
    private volatile CompletableFuture<Integer> handshake = new CompletableFuture<>();
    private volatile Thread readerThread;
    private volatile boolean tearingDown;
    private volatile boolean autoReconnect;

    @Getter
    private volatile String host;
    @Getter
    private volatile int port;
    @Getter
    private volatile int clientId;
    private volatile Duration connectTimeout;

    private ScheduledExecutorService supervisor;
    private ScheduledFuture<?> supervisorTask;

    public ConnectionManager(RequestRegistry registry, OrderIdAllocator orderIds, MarketDataCache marketData) {
        this.registry = registry;
        this.orderIds = orderIds;
        this.marketData = marketData;
    }

    /** The client and its listener reference each other through this manager, so it is wired after construction. */
    public void attach(GatewayClient client) {
        this.client = client;
    }

    /** Runs after every successful handshake, including supervisor reconnects. */
    public void addConnectListener(Runnable listener) {
        connectListeners.add(listener);
    }

    /** Bumped by every teardown; ids handed out before the bump belong to a dead connection. */
    public long getGeneration() {
        return generation.get();
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED && client.isConnected();
    }

    /**
     * Opens the socket and blocks until the gateway hands out the first valid order id.
     *
     * @return true when the handshake completed within the timeout
     */
    public boolean connect(String host, int port, int clientId, Duration timeout) {
        lock.lock();
        try {
            this.host = host;
            this.port = port;
            this.clientId = clientId;
            this.connectTimeout = timeout;
            autoReconnect = true;
            return connectLocked();
        } finally {
            lock.unlock();
        }
    }

    private boolean connectLocked() {
        if (state.get() == ConnectionState.CONNECTED && client.isConnected()) {
            log.debug("Already connected to {}:{}", host, port);
            return true;
        }
        if (client.isConnected() || readerThread != null) {
            // stale socket from a session that went to ERROR
            teardownLocked();
        }

        state.set(ConnectionState.CONNECTING);
        CompletableFuture<Integer> pendingHandshake = new CompletableFuture<>();
        handshake = pendingHandshake;
        log.info("Connecting to gateway at {}:{} with clientId={}", host, port, clientId);
        try {
            client.connect(host, port, clientId);
        } catch (IOException | RuntimeException e) {
            log.error("Could not connect to {}:{}: {}", host, port, e.getMessage());
            state.set(ConnectionState.ERROR);
            return false;
        }
        startReader();

        try {
            int firstOrderId = pendingHandshake.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CONNECTED)) {
                log.info("Connected to gateway at {}:{} (next order id {})", host, port, firstOrderId);
                for (Runnable listener : connectListeners) {
                    try {
                        listener.run();
                    } catch (RuntimeException e) {
                        log.error("Error in connect listener: {}", e.getMessage(), e);
                    }
                }
                return true;
            }
            log.warn("Connection to {}:{} dropped during handshake", host, port);
        } catch (TimeoutException e) {
            log.error("No handshake from {}:{} within {}ms - tearing down", host, port, connectTimeout.toMillis());
        } catch (ExecutionException e) {
            log.error("Handshake with {}:{} failed: {}", host, port, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for handshake");
        }
        teardownLocked();
        state.set(ConnectionState.DISCONNECTED);
        return false;
    }

    private void startReader() {
        Thread reader = new Thread(this::readLoop, "gateway-reader-" + clientId);
        reader.setDaemon(true);
        readerThread = reader;
        reader.start();
    }

    private void readLoop() {
        log.debug("Reader thread started");
        try {
            while (client.isConnected()) {
                try {
                    client.processMessages();
                } catch (RuntimeException e) {
                    // one bad callback must not stop the reader
                    log.error("Error handling gateway message: {}", e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            if (!tearingDown) {
                log.error("Error processing messages: {}", e.getMessage());
            }
        }
        // a reader replaced by a newer connection must not touch the new session
        if (!tearingDown && readerThread == Thread.currentThread()) {
            log.warn("Reader thread exited while the session was {}", state.get());
            markBroken(GatewayError.notConnected());
        }
        log.debug("Reader thread stopped");
    }

    /**
     * Closes the socket and stops the supervisor from reconnecting until the next explicit connect.
     */
    public void disconnect() {
        lock.lock();
        try {
            autoReconnect = false;
            teardownLocked();
            state.set(ConnectionState.DISCONNECTED);
            log.info("Disconnected from gateway");
        } finally {
            lock.unlock();
        }
    }

    private void teardownLocked() {
        tearingDown = true;
        try {
            for (Integer reqId : marketData.activeSubscriptions()) {
                if (client.isConnected()) {
                    client.cancelMktData(reqId);
                }
            }
            marketData.clear();
            client.disconnect();

            Thread reader = readerThread;
            readerThread = null;
            if (reader != null && reader != Thread.currentThread()) {
                try {
                    reader.join(Constants.READER_JOIN_MILLIS);
                    if (reader.isAlive()) {
                        log.warn("Reader thread did not stop within {}ms", Constants.READER_JOIN_MILLIS);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            handshake.completeExceptionally(new IllegalStateException("Connection torn down"));
            registry.failAll(GatewayError.notConnected());
            registry.resetIds();
            orderIds.reset();
            generation.incrementAndGet();
        } finally {
            tearingDown = false;
        }
    }

    /**
     * Disconnect then connect as one step. Concurrent callers share a single attempt and its result.
     */
    public boolean reconnect(Duration timeout) {
        CompletableFuture<Boolean> mine = new CompletableFuture<>();
        CompletableFuture<Boolean> running = reconnectInFlight.compareAndExchange(null, mine);
        if (running != null) {
            log.debug("Reconnect already in progress - waiting for it");
            return running.join();
        }
        boolean result = false;
        lock.lock();
        try {
            if (host == null) {
                throw new IllegalStateException("reconnect before any connect");
            }
            log.info("Reconnecting to {}:{}", host, port);
            connectTimeout = timeout;
            autoReconnect = true;
            teardownLocked();
            state.set(ConnectionState.DISCONNECTED);
            result = connectLocked();
            return result;
        } finally {
            lock.unlock();
            reconnectInFlight.set(null);
            mine.complete(result);
        }
    }

    public synchronized void startSupervisor(Duration interval) {
        if (supervisor != null) {
            return;
        }
        supervisor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "gateway-supervisor");
            thread.setDaemon(true);
            return thread;
        });
        supervisorTask = supervisor.scheduleWithFixedDelay(this::superviseOnce,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Connection supervisor started, checking every {}s", interval.toSeconds());
    }

    public synchronized void stopSupervisor() {
        if (supervisor == null) {
            return;
        }
        supervisorTask.cancel(false);
        supervisor.shutdownNow();
        supervisor = null;
        supervisorTask = null;
    }

    /**
     * One supervisor tick: reconnects when the session should be up but isn't. Skips the tick when a
     * caller holds the lock.
     */
    void superviseOnce() {
        if (!autoReconnect || host == null || isConnected()) {
            return;
        }
        if (!lock.tryLock()) {
            log.debug("Connection busy - supervisor skipping this tick");
            return;
        }
        try {
            if (!autoReconnect || isConnected()) {
                return;
            }
            log.warn("Connection is {} - supervisor reconnecting to {}:{}", state.get(), host, port);
            connectLocked();
        } catch (RuntimeException e) {
            log.error("Supervisor reconnect failed: {}", e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    // ---- reader thread side ----

    void onNextValidId(int orderId) {
        orderIds.seed(orderId);
        handshake.complete(orderId);
    }

    /**
     * A fatal gateway error: the session is unusable until the supervisor reconnects.
     */
    void onFatalError(GatewayError error) {
        log.error("Connection fatal error {}", error);
        markBroken(error);
    }

    void onConnectionClosed() {
        if (tearingDown) {
            return;
        }
        log.warn("Gateway closed the connection");
        markBroken(GatewayError.notConnected());
    }

    private void markBroken(GatewayError error) {
        ConnectionState previous = state.getAndUpdate(s -> s == ConnectionState.DISCONNECTED ? s : ConnectionState.ERROR);
        if (previous == ConnectionState.DISCONNECTED) {
            return;
        }
        handshake.completeExceptionally(new IllegalStateException(error.toString()));
        registry.failAll(error);
    }

    boolean isAutoReconnect() {
        return autoReconnect;
    }
}
