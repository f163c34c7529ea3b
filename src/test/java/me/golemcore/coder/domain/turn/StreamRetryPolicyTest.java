package me.golemcore.coder.domain.turn;

import dev.langchain4j.exception.AuthenticationException;
import me.golemcore.coder.domain.model.MessageError;
import me.golemcore.coder.domain.model.ProviderException;
import me.golemcore.coder.domain.model.StreamIdleTimeoutException;
import me.golemcore.coder.domain.service.SessionRetryService;
import me.golemcore.coder.domain.system.LlmErrorClassifier;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamRetryPolicyTest {

    private SessionRetryService retryService;

    @BeforeEach
    void setUp() {
        CoderProperties.RetryProperties settings = new CoderProperties.RetryProperties();
        settings.setInitialDelay(Duration.ofMillis(100));
        retryService = new SessionRetryService(settings, Schedulers.immediate());
    }

    @Test
    void shouldRetryIdleTimeoutExactlyMaxTimes() {
        StreamRetryPolicy policy = new StreamRetryPolicy(retryService, "p", 3, 8);
        StreamIdleTimeoutException timeout = new StreamIdleTimeoutException(100);

        for (int i = 1; i <= 3; i++) {
            RetryDecision decision = policy.onFailure(timeout);
            RetryDecision.Retry retry = assertInstanceOf(RetryDecision.Retry.class, decision);
            assertEquals(i, retry.attempt());
            assertEquals("Stream idle timeout (attempt " + i + "/3)", retry.message());
        }

        RetryDecision.GiveUp giveUp = assertInstanceOf(RetryDecision.GiveUp.class, policy.onFailure(timeout));
        MessageError error = giveUp.error();
        assertEquals(LlmErrorClassifier.STREAM_IDLE_TIMEOUT_EXHAUSTED, error.code());
        assertTrue(error.message().startsWith("Stream timed out after 3 retries (100ms idle)."));
        assertEquals("3", error.metadata().get("retries"));
        assertEquals(3, policy.getIdleTimeoutRetries());
    }

    @Test
    void shouldGiveUpOnFirstIdleTimeoutWhenRetriesDisabled() {
        StreamRetryPolicy policy = new StreamRetryPolicy(retryService, "p", 0, 8);

        RetryDecision decision = policy.onFailure(new StreamIdleTimeoutException(100));

        assertInstanceOf(RetryDecision.GiveUp.class, decision);
    }

    @Test
    void shouldRetryTransientProviderFailureWithBackoff() {
        StreamRetryPolicy policy = new StreamRetryPolicy(retryService, "p", 3, 8);
        ProviderException overloaded = new ProviderException("p", 529, "overloaded");

        RetryDecision.Retry first = assertInstanceOf(RetryDecision.Retry.class, policy.onFailure(overloaded));
        RetryDecision.Retry second = assertInstanceOf(RetryDecision.Retry.class, policy.onFailure(overloaded));

        assertEquals(1, first.attempt());
        assertEquals(100L, first.delayMs());
        assertEquals("Provider is overloaded", first.message());
        assertEquals(2, second.attempt());
        assertEquals(200L, second.delayMs());
    }

    @Test
    void shouldGiveUpOnNonRetryableFailure() {
        StreamRetryPolicy policy = new StreamRetryPolicy(retryService, "p", 3, 8);

        RetryDecision.GiveUp giveUp = assertInstanceOf(RetryDecision.GiveUp.class,
                policy.onFailure(new AuthenticationException("bad key")));

        assertEquals(LlmErrorClassifier.LANGCHAIN4J_AUTHENTICATION, giveUp.error().code());
        assertEquals(0, policy.getAttempt());
    }

    @Test
    void shouldStopAfterMaxAttempts() {
        StreamRetryPolicy policy = new StreamRetryPolicy(retryService, "p", 3, 2);
        ProviderException rateLimited = new ProviderException("p", 429, "slow down");

        assertInstanceOf(RetryDecision.Retry.class, policy.onFailure(rateLimited));
        assertInstanceOf(RetryDecision.Retry.class, policy.onFailure(rateLimited));
        RetryDecision.GiveUp giveUp = assertInstanceOf(RetryDecision.GiveUp.class, policy.onFailure(rateLimited));

        assertEquals(LlmErrorClassifier.PROVIDER_RATE_LIMIT, giveUp.error().code());
    }

    @Test
    void shouldKeepIdleAndProviderBudgetsSeparate() {
        StreamRetryPolicy policy = new StreamRetryPolicy(retryService, "p", 1, 8);

        assertInstanceOf(RetryDecision.Retry.class, policy.onFailure(new ProviderException("p", 500, "oops")));
        assertInstanceOf(RetryDecision.Retry.class, policy.onFailure(new StreamIdleTimeoutException(100)));

        assertEquals(1, policy.getAttempt());
        assertEquals(1, policy.getIdleTimeoutRetries());
    }
}
