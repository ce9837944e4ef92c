package com.solanaeda.dlqworker.config;

import com.solanaeda.eventbus.EventBusClient;
import com.solanaeda.eventbus.config.BrokerSettings;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DeadLetterProperties.class)
public class EventBusConfig {

  @Bean
  @ConfigurationProperties("eventbus.rabbitmq")
  BrokerSettings brokerSettings() {
    return new BrokerSettings();
  }

  /**
   * Connects and declares topology during context startup; the context fails to start if the
   * broker stays unreachable for {@code max-initial-retries} attempts.
   */
  @Bean(destroyMethod = "close")
  EventBusClient eventBusClient(BrokerSettings brokerSettings,
                                @Value("${spring.application.name:dlq-worker}") String source,
                                MeterRegistry registry) {
    return EventBusClient.create(brokerSettings, source, registry);
  }
}
