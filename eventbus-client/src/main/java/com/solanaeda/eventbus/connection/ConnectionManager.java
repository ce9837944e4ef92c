package com.solanaeda.eventbus.connection;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.solanaeda.eventbus.BrokerConnectionException;
import com.solanaeda.eventbus.NotInitializedException;
import com.solanaeda.eventbus.config.BrokerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the single broker connection and the single multiplexed channel shared by the
 * publisher, the consumer and the dead-letter handlers.
 *
 * <p>Client-side automatic recovery is disabled; a lost connection or channel is replaced by
 * one reconnect scheduled with {@link ReconnectBackoff}. Dependants learn about the new channel
 * through {@link ConnectionListener#onReconnected} and must re-fetch {@link #getChannel()}.
 * {@link #close()} is terminal.
 */
public class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final BrokerSettings settings;
  private final ConnectionFactory connectionFactory;
  private final ReconnectBackoff backoff;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
  private final PublishConfirmations confirmations = new PublishConfirmations();
  private final FlowControl flowControl = new FlowControl();
  private final AtomicInteger attempt = new AtomicInteger();
  private final Object lock = new Object();

  private volatile Connection connection;
  private volatile Channel channel;
  private volatile boolean closed;
  private volatile String lastError;
  private volatile Instant connectedAt;
  private ScheduledFuture<?> reconnectTask; // guarded by lock

  public ConnectionManager(BrokerSettings settings) {
    this(settings, connectionFactory(settings), new ReconnectBackoff(settings.getReconnectDelay()), null);
  }

  public ConnectionManager(BrokerSettings settings, ConnectionFactory connectionFactory,
                           ReconnectBackoff backoff, ScheduledExecutorService scheduler) {
    this.settings = settings;
    this.connectionFactory = connectionFactory;
    this.backoff = backoff;
    this.ownsScheduler = scheduler == null;
    this.scheduler = scheduler != null ? scheduler : Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "eventbus-reconnect");
      t.setDaemon(true);
      return t;
    });
    this.confirmations.setTrackReturns(settings.isPublisherConfirms());
  }

  static ConnectionFactory connectionFactory(BrokerSettings settings) {
    ConnectionFactory cf = new ConnectionFactory();
    try {
      cf.setUri(settings.getUrl());
    } catch (URISyntaxException | GeneralSecurityException e) {
      throw new IllegalArgumentException("Invalid broker URL " + settings.sanitizedUrl(), e);
    }
    cf.setAutomaticRecoveryEnabled(false);
    cf.setTopologyRecoveryEnabled(false);
    cf.setConnectionTimeout((int) settings.getConnectionTimeout().toMillis());
    cf.setRequestedHeartbeat((int) settings.getHeartbeat().toSeconds());
    return cf;
  }

  /**
   * Opens the connection and channel, retrying with backoff until {@code maxInitialRetries}
   * attempts have failed (0 retries forever). No-op when already connected.
   */
  public void connect() {
    if (closed) throw new IllegalStateException("Connection manager has been closed");
    if (isConnected()) return;
    int maxRetries = settings.getMaxInitialRetries();
    while (true) {
      try {
        log.info("Connecting to {}...", settings.sanitizedUrl());
        open();
        return;
      } catch (IOException | TimeoutException e) {
        int failures = attempt.incrementAndGet();
        lastError = e.getMessage();
        log.error("Connection to {} failed (attempt {}): {}", settings.sanitizedUrl(), failures, e.getMessage());
        if (maxRetries > 0 && failures >= maxRetries) {
          throw new BrokerConnectionException("Max connection attempts (" + maxRetries + ") reached for " + settings.sanitizedUrl(), e);
        }
        sleep(backoff.delayFor(failures - 1));
      }
    }
  }

  private void open() throws IOException, TimeoutException {
    synchronized (lock) {
      if (closed) throw new IllegalStateException("Connection manager has been closed");
      discardCurrent();
      Connection conn = connectionFactory.newConnection(settings.getConnectionName());
      Channel ch;
      try {
        ch = conn.createChannel();
        if (ch == null) throw new IOException("Broker refused to open a channel");
        if (settings.isPublisherConfirms()) ch.confirmSelect();
        ch.addConfirmListener(confirmations);
        ch.addReturnListener(confirmations);
        ch.addShutdownListener(this::onShutdown);
        conn.addShutdownListener(this::onShutdown);
        conn.addBlockedListener(flowControl);
      } catch (IOException | RuntimeException e) {
        conn.abort();
        throw e;
      }
      connection = conn;
      channel = ch;
      attempt.set(0);
      lastError = null;
      connectedAt = Instant.now();
      flowControl.release();
    }
    log.info("Connected to {} and channel created (confirms={})", settings.sanitizedUrl(), settings.isPublisherConfirms());
  }

  private void onShutdown(ShutdownSignalException cause) {
    if (closed || cause.isInitiatedByApplication()) return;
    Object ref = cause.getReference();
    if (ref != connection && ref != channel) return; // stale object from a previous connection
    if (isReconnectPending()) return; // channel and connection both report a hard error
    lastError = cause.getMessage();
    log.error("{} closed unexpectedly: {}", cause.isHardError() ? "Connection" : "Channel", cause.getMessage());
    confirmations.failAll(cause);
    for (ConnectionListener l : listeners) {
      try {
        l.onDisconnected(this, cause);
      } catch (RuntimeException e) {
        log.warn("Connection listener {} failed on disconnect", l, e);
      }
    }
    scheduleReconnect();
  }

  /**
   * Schedules one reconnect after the backoff delay unless one is already pending. Also used
   * by listeners whose post-reconnect setup failed, to get a fresh connection and another try.
   */
  public void scheduleReconnect() {
    synchronized (lock) {
      if (closed || reconnectTask != null) return;
      Duration delay = backoff.delayFor(attempt.get());
      log.info("Scheduling reconnect in {}s (attempt {})", Math.round(delay.toMillis() / 1000.0), attempt.get() + 1);
      reconnectTask = scheduler.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void reconnect() {
    synchronized (lock) {
      reconnectTask = null;
      if (closed) return;
    }
    try {
      open();
    } catch (IOException | TimeoutException | RuntimeException e) {
      int failures = attempt.incrementAndGet();
      lastError = e.getMessage();
      log.warn("Reconnect attempt {} failed: {}", failures, e.getMessage());
      scheduleReconnect();
      return;
    }
    log.info("Reconnected to {}", settings.sanitizedUrl());
    for (ConnectionListener l : listeners) {
      try {
        l.onReconnected(this);
      } catch (RuntimeException e) {
        log.error("Connection listener {} failed after reconnect", l, e);
      }
    }
  }

  public void addListener(ConnectionListener listener) { listeners.add(listener); }

  public void removeListener(ConnectionListener listener) { listeners.remove(listener); }

  public Channel getChannel() {
    Channel ch = channel;
    if (ch == null) throw new NotInitializedException("Channel not available. Call connect() first.");
    return ch;
  }

  public Connection getConnection() {
    Connection conn = connection;
    if (conn == null) throw new NotInitializedException("Connection not available. Call connect() first.");
    return conn;
  }

  public boolean isConnected() {
    Connection conn = connection;
    Channel ch = channel;
    return conn != null && ch != null && conn.isOpen() && ch.isOpen();
  }

  public boolean isReconnectPending() {
    synchronized (lock) {
      return reconnectTask != null;
    }
  }

  public BrokerSettings settings() { return settings; }

  public PublishConfirmations confirmations() { return confirmations; }

  /**
   * Publishes on the shared channel. Sequence-number registration and the write happen under
   * the channel monitor so concurrent publishers cannot interleave. The returned future
   * completes on broker confirm, or immediately when confirms are off.
   */
  public CompletableFuture<Void> publish(String exchange, String routingKey, boolean mandatory,
                                         AMQP.BasicProperties properties, byte[] body) throws IOException {
    Channel ch = getChannel();
    synchronized (ch) {
      if (!settings.isPublisherConfirms()) {
        ch.basicPublish(exchange, routingKey, mandatory, properties, body);
        return CompletableFuture.completedFuture(null);
      }
      long seq = ch.getNextPublishSeqNo();
      CompletableFuture<Void> confirm = confirmations.register(seq, properties.getMessageId());
      try {
        ch.basicPublish(exchange, routingKey, mandatory, properties, body);
      } catch (IOException | RuntimeException e) {
        confirmations.discard(seq);
        throw e;
      }
      return confirm;
    }
  }

  /**
   * Blocks while the broker has flagged this connection as blocked.
   *
   * @return false if still blocked after {@code timeout}
   */
  public boolean awaitWritable(Duration timeout) throws InterruptedException {
    return flowControl.awaitWritable(timeout);
  }

  public boolean isBlocked() { return flowControl.isBlocked(); }

  /**
   * Runs {@code callback} on a short-lived channel of the current connection. Used for
   * declarations and passive checks, whose failures close the channel they run on.
   */
  public <T> T withTemporaryChannel(ChannelCallback<T> callback) throws IOException {
    Channel temp = getConnection().createChannel();
    if (temp == null) throw new IOException("Broker refused to open a channel");
    try {
      return callback.doWithChannel(temp);
    } finally {
      closeQuietly(temp);
    }
  }

  public ConnectionHealth getHealth() {
    return new ConnectionHealth(isConnected(), settings.sanitizedUrl(), attempt.get(), isReconnectPending(),
        lastError, connectedAt);
  }

  @Override
  public void close() {
    ScheduledFuture<?> pending;
    synchronized (lock) {
      if (closed) return;
      closed = true;
      pending = reconnectTask;
      reconnectTask = null;
    }
    if (pending != null) pending.cancel(false);
    Channel ch = channel;
    Connection conn = connection;
    channel = null;
    connection = null;
    try {
      if (ch != null && ch.isOpen()) ch.close();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      log.warn("Error closing channel: {}", e.getMessage());
    }
    try {
      if (conn != null && conn.isOpen()) conn.close();
    } catch (IOException | ShutdownSignalException e) {
      log.warn("Error closing connection: {}", e.getMessage());
    }
    confirmations.failAll(new NotInitializedException("Connection closed"));
    flowControl.release();
    if (ownsScheduler) scheduler.shutdownNow();
    log.info("Connection closed gracefully");
  }

  public boolean isClosed() { return closed; }

  // caller holds lock
  private void discardCurrent() {
    Channel ch = channel;
    Connection conn = connection;
    channel = null;
    connection = null;
    if (ch != null) closeQuietly(ch);
    if (conn != null && conn.isOpen()) {
      try {
        conn.abort();
      } catch (RuntimeException e) {
        log.debug("Ignoring error aborting stale connection: {}", e.getMessage());
      }
    }
    confirmations.failAll(new IOException("Channel replaced"));
  }

  private static void closeQuietly(Channel ch) {
    try {
      if (ch.isOpen()) ch.close();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      log.debug("Ignoring error closing channel {}: {}", ch.getChannelNumber(), e.getMessage());
    }
  }

  private static void sleep(Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerConnectionException("Interrupted while waiting to reconnect", e);
    }
  }
}
