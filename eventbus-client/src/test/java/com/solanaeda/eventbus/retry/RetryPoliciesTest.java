package com.solanaeda.eventbus.retry;

import com.solanaeda.eventbus.PublishException;
import com.solanaeda.eventbus.validation.EventValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import java.net.ConnectException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RetryPoliciesTest {

  @Test
  void picks_policy_from_error() {
    assertThat(RetryPolicies.forError(new PublishException("publish failed", new ConnectException("ECONNREFUSED"))))
        .isEqualTo(RetryPolicies.MEDIUM);
    assertThat(RetryPolicies.forError(new RuntimeException("429 too many requests"))).isEqualTo(RetryPolicies.LONG);
    assertThat(RetryPolicies.forError(new PublishException("Timed out waiting for confirm"))).isEqualTo(RetryPolicies.SHORT);
    assertThat(RetryPolicies.forError(new RuntimeException("unauthorized"))).isEqualTo(RetryPolicies.NONE);
    assertThat(RetryPolicies.forError(new EventValidationException("X", List.of("bad")))).isEqualTo(RetryPolicies.NONE);
    assertThat(RetryPolicies.forError(new RuntimeException("boom"))).isEqualTo(RetryPolicies.SHORT);
  }

  @Test
  void immediate_template_retries_until_success() {
    RetryTemplate template = RetryPolicies.IMMEDIATE.toRetryTemplate();
    AtomicInteger attempts = new AtomicInteger();

    String result = template.execute(ctx -> {
      if (attempts.incrementAndGet() < 3) throw new PublishException("Broker nacked message");
      return "ok";
    });

    assertThat(result).isEqualTo("ok");
    assertThat(attempts).hasValue(3);
  }

  @Test
  void none_template_makes_a_single_attempt() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(() -> RetryPolicies.NONE.toRetryTemplate().execute(ctx -> {
      attempts.incrementAndGet();
      throw new PublishException("nope");
    })).isInstanceOf(PublishException.class);
    assertThat(attempts).hasValue(1);
  }

  @Test
  void validation_errors_are_not_retried() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(() -> RetryPolicies.IMMEDIATE.toRetryTemplate().execute(ctx -> {
      attempts.incrementAndGet();
      throw new EventValidationException("BURN_DETECTED", List.of("amount missing"));
    })).isInstanceOf(EventValidationException.class);
    assertThat(attempts).hasValue(1);
  }
}
