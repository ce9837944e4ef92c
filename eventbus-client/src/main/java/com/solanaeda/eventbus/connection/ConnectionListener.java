package com.solanaeda.eventbus.connection;

/**
 * Observer for connection lifecycle transitions. Callbacks run on the reconnect thread or
 * the client's connection thread and must not block for long.
 */
public interface ConnectionListener {

  /**
   * A new connection and channel replaced a lost one. Channel references taken before this
   * call are dead; re-declare topology and re-subscribe here.
   */
  void onReconnected(ConnectionManager connectionManager);

  default void onDisconnected(ConnectionManager connectionManager, Throwable cause) {}
}
