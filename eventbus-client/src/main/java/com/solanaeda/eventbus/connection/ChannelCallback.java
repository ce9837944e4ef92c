package com.solanaeda.eventbus.connection;

import com.rabbitmq.client.Channel;

import java.io.IOException;

@FunctionalInterface
public interface ChannelCallback<T> {
  T doWithChannel(Channel channel) throws IOException;
}
