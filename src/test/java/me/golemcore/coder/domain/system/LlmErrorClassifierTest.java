package me.golemcore.coder.domain.system;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ContentFilteredException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import me.golemcore.coder.domain.model.MessageError;
import me.golemcore.coder.domain.model.PermissionRejectedException;
import me.golemcore.coder.domain.model.ProviderException;
import me.golemcore.coder.domain.model.StreamIdleTimeoutException;
import me.golemcore.coder.domain.model.TurnAbortedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmErrorClassifierTest {

    @Test
    void shouldClassifyLangchainRateLimitFromCauseChain() {
        Throwable throwable = new CompletionException(
                new RuntimeException("wrapper", new RateLimitException("too many requests")));

        String code = LlmErrorClassifier.classifyFromThrowable(throwable);

        assertEquals(LlmErrorClassifier.LANGCHAIN4J_RATE_LIMIT, code);
    }

    @ParameterizedTest
    @CsvSource({
            "429, llm.langchain4j.rate_limit",
            "401, llm.langchain4j.authentication",
            "403, llm.langchain4j.authentication",
            "408, llm.langchain4j.timeout",
            "504, llm.langchain4j.timeout",
            "500, llm.langchain4j.internal_server",
            "400, llm.langchain4j.invalid_request",
            "200, llm.langchain4j.http_error"
    })
    void shouldClassifyLangchainHttpStatuses(int statusCode, String expectedCode) {
        String code = LlmErrorClassifier.classifyFromThrowable(new HttpException(statusCode, "status"));

        assertEquals(expectedCode, code);
    }

    @ParameterizedTest
    @CsvSource({
            "429, llm.provider.rate_limit",
            "503, llm.provider.overloaded",
            "529, llm.provider.overloaded",
            "408, llm.provider.timeout",
            "500, llm.provider.internal_server",
            "401, llm.provider.authentication",
            "422, llm.provider.invalid_request",
            "0, llm.provider.error"
    })
    void shouldClassifyProviderStatuses(int statusCode, String expectedCode) {
        String code = LlmErrorClassifier.classifyFromThrowable(new ProviderException("p", statusCode, "failed"));

        assertEquals(expectedCode, code);
    }

    @Test
    void shouldClassifyLangchainSpecificExceptions() {
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_AUTHENTICATION,
                LlmErrorClassifier.classifyFromThrowable(new AuthenticationException("auth")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_CONTENT_FILTERED,
                LlmErrorClassifier.classifyFromThrowable(new ContentFilteredException("filtered")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_INTERNAL_SERVER,
                LlmErrorClassifier.classifyFromThrowable(new InternalServerException("internal")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_INVALID_REQUEST,
                LlmErrorClassifier.classifyFromThrowable(new InvalidRequestException("invalid")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_MODEL_NOT_FOUND,
                LlmErrorClassifier.classifyFromThrowable(new ModelNotFoundException("not-found")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new TimeoutException("timeout")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_RETRIABLE,
                LlmErrorClassifier.classifyFromThrowable(new RetriableException("retriable")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_NON_RETRIABLE,
                LlmErrorClassifier.classifyFromThrowable(new NonRetriableException("non-retriable")));
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_ERROR,
                LlmErrorClassifier.classifyFromThrowable(new LangChain4jException("generic")));
    }

    @Test
    void shouldClassifyTurnFailures() {
        assertEquals(LlmErrorClassifier.STREAM_IDLE_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new StreamIdleTimeoutException(100)));
        assertEquals(LlmErrorClassifier.REQUEST_ABORTED,
                LlmErrorClassifier.classifyFromThrowable(new TurnAbortedException("user")));
        assertEquals(LlmErrorClassifier.PERMISSION_REJECTED,
                LlmErrorClassifier.classifyFromThrowable(new PermissionRejectedException("doom_loop", "no")));
    }

    @Test
    void shouldClassifyRequestAbortAndTimeoutFromJdkExceptions() {
        assertEquals(LlmErrorClassifier.REQUEST_ABORTED,
                LlmErrorClassifier.classifyFromThrowable(new CancellationException("cancelled")));
        assertEquals(LlmErrorClassifier.REQUEST_ABORTED,
                LlmErrorClassifier
                        .classifyFromThrowable(new RuntimeException(new InterruptedException("interrupted"))));
        assertEquals(LlmErrorClassifier.REQUEST_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new SocketTimeoutException("socket timeout")));
        assertEquals(LlmErrorClassifier.REQUEST_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new HttpTimeoutException("http timeout")));
        assertEquals(LlmErrorClassifier.REQUEST_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new java.util.concurrent.TimeoutException("timeout")));
        assertEquals(LlmErrorClassifier.NETWORK_ERROR,
                LlmErrorClassifier.classifyFromThrowable(new IOException("connection reset")));
    }

    @Test
    void shouldClassifyContextOverflowFromMessage() {
        String code = LlmErrorClassifier.classifyFromThrowable(
                new InvalidRequestException("This model's maximum context length is 128000 tokens"));

        assertEquals(LlmErrorClassifier.CONTEXT_LENGTH_EXCEEDED, code);
    }

    @Test
    void shouldPreferEmbeddedCodeOverExceptionType() {
        String code = LlmErrorClassifier.classifyFromThrowable(
                new RateLimitException("[llm.custom.synthetic] explicit code"));

        assertEquals("llm.custom.synthetic", code);
    }

    @Test
    void shouldHandleCodeHelpersEdgeCases() {
        assertEquals("llm.sample.code", LlmErrorClassifier.extractCode("[llm.sample.code] details"));
        assertNull(LlmErrorClassifier.extractCode("llm.sample.code"));
        assertNull(LlmErrorClassifier.extractCode("[missing_end"));
        assertNull(LlmErrorClassifier.extractCode(null));
        assertEquals("[llm.x]", LlmErrorClassifier.withCode("llm.x", ""));
        assertEquals("[llm.x] details", LlmErrorClassifier.withCode("llm.x", "details"));
        assertEquals("[llm.x] details", LlmErrorClassifier.withCode("llm.x", "[llm.x] details"));
    }

    @Test
    void shouldReturnUnknownWhenThrowableChainHasNoKnownSignals() {
        String code = LlmErrorClassifier
                .classifyFromThrowable(new CompletionException(new RuntimeException("generic")));

        assertEquals(LlmErrorClassifier.UNKNOWN, code);
        assertEquals(LlmErrorClassifier.UNKNOWN, LlmErrorClassifier.classifyFromThrowable(null));
    }

    @Test
    void shouldConvertProviderFailureToRetryableApiError() {
        ProviderException failure = new ProviderException("openai", 429, "slow down", 5000L, null);

        MessageError error = LlmErrorClassifier.toMessageError(failure, "openai");

        assertEquals(MessageError.API_ERROR, error.name());
        assertEquals(LlmErrorClassifier.PROVIDER_RATE_LIMIT, error.code());
        assertTrue(error.retryable());
        assertEquals(429, error.statusCode());
        assertEquals(5000L, error.retryAfterMs());
        assertEquals("openai", error.metadata().get("providerId"));
    }

    @Test
    void shouldHonorExplicitProviderRetryableFlag() {
        ProviderException failure = new ProviderException("openai", 500, "broken", null, Boolean.FALSE);

        MessageError error = LlmErrorClassifier.toMessageError(failure, "openai");

        assertFalse(error.retryable());
    }

    @Test
    void shouldConvertAbortAndOverflowToDedicatedErrors() {
        MessageError aborted = LlmErrorClassifier.toMessageError(new TurnAbortedException("user cancel"), null);
        MessageError overflow = LlmErrorClassifier.toMessageError(
                new RuntimeException("prompt is too long: 210000 tokens"), null);

        assertTrue(aborted.isAborted());
        assertEquals("user cancel", aborted.message());
        assertFalse(aborted.retryable());
        assertEquals(MessageError.CONTEXT_OVERFLOW, overflow.name());
        assertFalse(overflow.retryable());
    }

    @Test
    void shouldConvertIdleTimeoutWithTimeoutMetadata() {
        MessageError error = LlmErrorClassifier.toMessageError(new StreamIdleTimeoutException(250), "p");

        assertEquals(MessageError.API_ERROR, error.name());
        assertEquals(LlmErrorClassifier.STREAM_IDLE_TIMEOUT, error.code());
        assertTrue(error.retryable());
        assertEquals("250", error.metadata().get("timeoutMs"));
    }

    @Test
    void shouldTreatUnknownFailureAsTerminal() {
        MessageError error = LlmErrorClassifier.toMessageError(new IllegalStateException("boom"), null);

        assertEquals(MessageError.UNKNOWN, error.name());
        assertFalse(error.retryable());
        assertEquals("boom", error.message());
    }
}
