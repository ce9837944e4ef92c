package com.solanaeda.eventbus.topology;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import com.solanaeda.eventbus.EventBusException;
import com.solanaeda.eventbus.TopologyConflictException;
import com.solanaeda.eventbus.connection.ChannelCallback;
import com.solanaeda.eventbus.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;

import java.io.IOException;
import java.util.Optional;

/**
 * Declares {@link EventTopology} on the broker. Declarations are idempotent; a declaration that
 * conflicts with an existing entity fails with {@link TopologyConflictException}.
 *
 * <p>Every call runs on a temporary channel because a failed declaration closes its channel.
 */
public class TopologyBuilder {
  private static final Logger log = LoggerFactory.getLogger(TopologyBuilder.class);

  static final int PRECONDITION_FAILED = AMQP.PRECONDITION_FAILED;
  static final int NOT_FOUND = AMQP.NOT_FOUND;

  private final ConnectionManager connectionManager;
  private final EventTopology topology;

  public TopologyBuilder(ConnectionManager connectionManager, EventTopology topology) {
    this.connectionManager = connectionManager;
    this.topology = topology;
  }

  public EventTopology topology() { return topology; }

  public void setupTopology() {
    run("topology", ch -> {
      for (Exchange e : topology.exchanges()) {
        ch.exchangeDeclare(e.getName(), e.getType(), e.isDurable(), e.isAutoDelete(), e.getArguments());
        log.debug("Exchange declared: {} ({})", e.getName(), e.getType());
      }
      for (Queue q : topology.queues()) {
        declareQueue(ch, q);
      }
      for (Binding b : topology.bindings()) {
        bind(ch, b);
      }
      return null;
    });
    log.info("Topology setup complete: {} exchanges, {} queues, {} bindings",
        topology.exchanges().size(), topology.queues().size(), topology.bindings().size());
  }

  public void setupDlq() {
    run("dead-letter queues", ch -> {
      Exchange dlx = topology.deadLetterExchange();
      ch.exchangeDeclare(dlx.getName(), dlx.getType(), dlx.isDurable(), dlx.isAutoDelete(), dlx.getArguments());
      for (Queue q : topology.deadLetterQueues()) {
        declareQueue(ch, q);
      }
      for (Binding b : topology.deadLetterBindings()) {
        bind(ch, b);
      }
      return null;
    });
    log.info("DLQ setup complete: {} dead-letter queues on {}", topology.deadLetterQueues().size(),
        topology.deadLetterExchange().getName());
  }

  public int purgeQueue(String queueName) {
    int count = run("purge " + queueName, ch -> ch.queuePurge(queueName).getMessageCount());
    log.info("Purged {} messages from {}", count, queueName);
    return count;
  }

  public void deleteQueue(String queueName) {
    run("delete " + queueName, ch -> ch.queueDelete(queueName));
    log.info("Deleted queue: {}", queueName);
  }

  /**
   * Passive check of a queue.
   *
   * @return empty when the queue does not exist
   */
  public Optional<QueueInfo> getQueueInfo(String queueName) {
    try {
      return connectionManager.withTemporaryChannel(ch -> {
        AMQP.Queue.DeclareOk ok = ch.queueDeclarePassive(queueName);
        return Optional.of(new QueueInfo(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount()));
      });
    } catch (IOException e) {
      if (replyCode(e) == NOT_FOUND) {
        log.debug("Queue {} does not exist", queueName);
        return Optional.empty();
      }
      throw new EventBusException("Failed to get queue info for " + queueName, e);
    }
  }

  private static void declareQueue(Channel ch, Queue q) throws IOException {
    ch.queueDeclare(q.getName(), q.isDurable(), q.isExclusive(), q.isAutoDelete(), q.getArguments());
    log.debug("Queue declared: {}", q.getName());
  }

  private static void bind(Channel ch, Binding b) throws IOException {
    ch.queueBind(b.getDestination(), b.getExchange(), b.getRoutingKey(), b.getArguments());
    log.debug("Bound {} to {} with {}", b.getDestination(), b.getExchange(), b.getRoutingKey());
  }

  private <T> T run(String what, ChannelCallback<T> callback) {
    try {
      return connectionManager.withTemporaryChannel(callback);
    } catch (IOException e) {
      if (replyCode(e) == PRECONDITION_FAILED) {
        throw new TopologyConflictException("Conflicting declaration while setting up " + what + ": "
            + e.getCause().getMessage(), e);
      }
      throw new EventBusException("Failed to set up " + what, e);
    }
  }

  /**
   * AMQP reply code of a channel-level error, or -1.
   */
  static int replyCode(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof ShutdownSignalException sse && sse.getReason() instanceof AMQP.Channel.Close close) {
        return close.getReplyCode();
      }
    }
    return -1;
  }
}
