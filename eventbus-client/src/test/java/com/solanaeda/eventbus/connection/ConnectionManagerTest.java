package com.solanaeda.eventbus.connection;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.solanaeda.eventbus.BrokerConnectionException;
import com.solanaeda.eventbus.NotInitializedException;
import com.solanaeda.eventbus.config.BrokerSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ConnectionManagerTest {

  private BrokerSettings settings;
  private ConnectionFactory factory;
  private Connection connection;
  private Channel channel;
  private ScheduledExecutorService scheduler;
  private ConnectionManager manager;
  private final List<Runnable> scheduled = new ArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    settings = new BrokerSettings();
    settings.setMaxInitialRetries(3);
    factory = mock(ConnectionFactory.class);
    connection = mock(Connection.class);
    channel = mock(Channel.class);
    scheduler = mock(ScheduledExecutorService.class);
    when(factory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    when(connection.isOpen()).thenReturn(true);
    when(channel.isOpen()).thenReturn(true);
    doAnswer(inv -> {
      scheduled.add(inv.getArgument(0));
      return mock(ScheduledFuture.class);
    }).when(scheduler).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));

    ReconnectBackoff immediate = new ReconnectBackoff(Duration.ZERO, Duration.ZERO, Duration.ZERO, () -> 0.0);
    manager = new ConnectionManager(settings, factory, immediate, scheduler);
  }

  @Test
  void channel_is_unavailable_before_connect() {
    assertThatThrownBy(() -> manager.getChannel()).isInstanceOf(NotInitializedException.class);
    assertThatThrownBy(() -> manager.getConnection()).isInstanceOf(NotInitializedException.class);
    assertThat(manager.isConnected()).isFalse();
  }

  @Test
  void connect_opens_channel_in_confirm_mode() throws Exception {
    manager.connect();

    assertThat(manager.isConnected()).isTrue();
    assertThat(manager.getChannel()).isSameAs(channel);
    verify(channel).confirmSelect();
    verify(channel).addConfirmListener(manager.confirmations());
    verify(connection).addBlockedListener(any(com.rabbitmq.client.BlockedListener.class));
    assertThat(manager.getHealth().connected()).isTrue();
    assertThat(manager.getHealth().url()).contains("****").doesNotContain("solana123");
  }

  @Test
  void confirm_mode_is_skipped_when_disabled() throws Exception {
    settings.setPublisherConfirms(false);
    manager.connect();

    verify(channel, never()).confirmSelect();
  }

  @Test
  void initial_connect_gives_up_after_max_retries() throws Exception {
    when(factory.newConnection(anyString())).thenThrow(new ConnectException("Connection refused"));

    assertThatThrownBy(() -> manager.connect())
        .isInstanceOf(BrokerConnectionException.class)
        .hasMessageContaining("3");
    verify(factory, times(3)).newConnection(anyString());
    assertThat(manager.getHealth().lastError()).isEqualTo("Connection refused");
  }

  @Test
  void initial_connect_succeeds_after_transient_failures() throws Exception {
    when(factory.newConnection(anyString()))
        .thenThrow(new ConnectException("Connection refused"))
        .thenReturn(connection);

    manager.connect();

    assertThat(manager.isConnected()).isTrue();
    assertThat(manager.getHealth().attempt()).isZero();
  }

  @Test
  void unexpected_shutdown_schedules_one_reconnect_and_notifies_listeners_in_order() throws Exception {
    manager.connect();
    List<String> calls = new ArrayList<>();
    manager.addListener(m -> {
      calls.add("first");
      throw new IllegalStateException("listener bug");
    });
    manager.addListener(m -> calls.add("second"));

    ShutdownListener shutdown = captureConnectionShutdownListener();
    ShutdownSignalException cause = new ShutdownSignalException(true, false, null, connection);
    shutdown.shutdownCompleted(cause);
    shutdown.shutdownCompleted(cause);

    assertThat(scheduled).hasSize(1);
    assertThat(manager.isReconnectPending()).isTrue();

    scheduled.get(0).run();

    assertThat(calls).containsExactly("first", "second");
    assertThat(manager.isReconnectPending()).isFalse();
    verify(factory, times(2)).newConnection(anyString());
  }

  @Test
  void failed_reconnect_reschedules_with_incremented_attempt() throws Exception {
    manager.connect();
    ShutdownListener shutdown = captureConnectionShutdownListener();
    when(factory.newConnection(anyString())).thenThrow(new ConnectException("still down"));

    shutdown.shutdownCompleted(new ShutdownSignalException(true, false, null, connection));
    scheduled.get(0).run();

    assertThat(scheduled).hasSize(2);
    assertThat(manager.getHealth().attempt()).isEqualTo(1);
    assertThat(manager.getHealth().lastError()).isEqualTo("still down");
  }

  @Test
  void backoff_returns_to_base_delay_after_successful_reconnect() throws Exception {
    List<Long> delays = new ArrayList<>();
    doAnswer(inv -> {
      scheduled.add(inv.getArgument(0));
      delays.add(inv.getArgument(1));
      return mock(ScheduledFuture.class);
    }).when(scheduler).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));
    ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofMillis(100), Duration.ofSeconds(30), Duration.ZERO, () -> 0.0);
    ConnectionManager withBackoff = new ConnectionManager(settings, factory, backoff, scheduler);
    withBackoff.connect();
    ShutdownListener first = captureConnectionShutdownListener();
    when(factory.newConnection(anyString()))
        .thenThrow(new ConnectException("still down"))
        .thenReturn(connection);

    first.shutdownCompleted(new ShutdownSignalException(true, false, null, connection));
    scheduled.get(0).run();
    scheduled.get(1).run();
    assertThat(withBackoff.getHealth().attempt()).isZero();

    ArgumentCaptor<ShutdownListener> listeners = ArgumentCaptor.forClass(ShutdownListener.class);
    verify(connection, times(2)).addShutdownListener(listeners.capture());
    listeners.getAllValues().get(1).shutdownCompleted(new ShutdownSignalException(true, false, null, connection));

    assertThat(delays).containsExactly(100L, 200L, 100L);
  }

  @Test
  void application_initiated_shutdown_does_not_reconnect() throws Exception {
    manager.connect();
    ShutdownListener shutdown = captureConnectionShutdownListener();

    shutdown.shutdownCompleted(new ShutdownSignalException(true, true, null, connection));

    assertThat(scheduled).isEmpty();
  }

  @Test
  void close_is_terminal() throws Exception {
    manager.connect();
    ShutdownListener shutdown = captureConnectionShutdownListener();

    manager.close();

    InOrder order = inOrder(channel, connection);
    order.verify(channel).close();
    order.verify(connection).close();
    shutdown.shutdownCompleted(new ShutdownSignalException(true, false, null, connection));
    assertThat(scheduled).isEmpty();
    assertThatThrownBy(() -> manager.getChannel()).isInstanceOf(NotInitializedException.class);
    assertThatThrownBy(() -> manager.connect()).isInstanceOf(IllegalStateException.class);
    assertThat(manager.isClosed()).isTrue();
  }

  @Test
  void publish_registers_sequence_number_and_completes_on_ack() throws Exception {
    manager.connect();
    when(channel.getNextPublishSeqNo()).thenReturn(42L);
    var props = new com.rabbitmq.client.AMQP.BasicProperties.Builder().messageId("m-1").build();

    CompletableFuture<Void> confirm = manager.publish("solana.events", "burn.detected", true, props, new byte[] {1});

    verify(channel).basicPublish("solana.events", "burn.detected", true, props, new byte[] {1});
    assertThat(confirm).isNotDone();
    manager.confirmations().handleAck(42L, false);
    assertThat(confirm).isCompleted();
  }

  @Test
  void failed_write_discards_the_pending_confirm() throws Exception {
    manager.connect();
    when(channel.getNextPublishSeqNo()).thenReturn(1L);
    doThrow(new IOException("socket closed")).when(channel)
        .basicPublish(anyString(), anyString(), eq(true), any(), any());
    var props = new com.rabbitmq.client.AMQP.BasicProperties.Builder().messageId("m-2").build();

    assertThatThrownBy(() -> manager.publish("solana.events", "burn.detected", true, props, new byte[0]))
        .isInstanceOf(IOException.class);
    assertThat(manager.confirmations().pendingCount()).isZero();
  }

  @Test
  void temporary_channel_is_closed_after_use() throws Exception {
    manager.connect();
    Channel temp = mock(Channel.class);
    when(temp.isOpen()).thenReturn(true);
    when(connection.createChannel()).thenReturn(temp);

    String result = manager.withTemporaryChannel(ch -> "done");

    assertThat(result).isEqualTo("done");
    verify(temp).close();
    assertThat(manager.getChannel()).isSameAs(channel);
  }

  @Test
  void flow_control_blocks_until_unblocked() throws Exception {
    manager.connect();
    ArgumentCaptor<com.rabbitmq.client.BlockedListener> captor =
        ArgumentCaptor.forClass(com.rabbitmq.client.BlockedListener.class);
    verify(connection).addBlockedListener(captor.capture());

    captor.getValue().handleBlocked("low on memory");
    assertThat(manager.isBlocked()).isTrue();
    assertThat(manager.awaitWritable(Duration.ofMillis(20))).isFalse();

    captor.getValue().handleUnblocked();
    assertThat(manager.awaitWritable(Duration.ofMillis(20))).isTrue();
  }

  private ShutdownListener captureConnectionShutdownListener() {
    ArgumentCaptor<ShutdownListener> captor = ArgumentCaptor.forClass(ShutdownListener.class);
    verify(connection).addShutdownListener(captor.capture());
    return captor.getValue();
  }
}
