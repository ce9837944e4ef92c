package com.solanaeda.dlqworker.config;

import com.solanaeda.eventbus.dlq.DeadLetterOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("eventbus.dlq")
public class DeadLetterProperties {
  private boolean enabled = true;
  private int maxRetryAttempts = DeadLetterOptions.DEFAULT_MAX_RETRY_ATTEMPTS;
  private int prefetch = 10;

  public boolean isEnabled() { return enabled; }
  public void setEnabled(boolean enabled) { this.enabled = enabled; }
  public int getMaxRetryAttempts() { return maxRetryAttempts; }
  public void setMaxRetryAttempts(int maxRetryAttempts) { this.maxRetryAttempts = maxRetryAttempts; }
  public int getPrefetch() { return prefetch; }
  public void setPrefetch(int prefetch) { this.prefetch = prefetch; }
}
