package me.golemcore.coder.domain.system;

import me.golemcore.coder.domain.model.MessageError;
import me.golemcore.coder.domain.model.PermissionRejectedException;
import me.golemcore.coder.domain.model.ProviderException;
import me.golemcore.coder.domain.model.StreamIdleTimeoutException;
import me.golemcore.coder.domain.model.TurnAbortedException;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies stream failures into stable machine-readable reason codes and
 * converts them into message errors.
 */
public final class LlmErrorClassifier {

    public static final String STREAM_IDLE_TIMEOUT = "llm.stream.idle_timeout";
    public static final String STREAM_IDLE_TIMEOUT_EXHAUSTED = "llm.stream.idle_timeout_exhausted";
    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String NETWORK_ERROR = "llm.network.error";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String PERMISSION_REJECTED = "tool.permission.rejected";
    public static final String PROVIDER_RATE_LIMIT = "llm.provider.rate_limit";
    public static final String PROVIDER_OVERLOADED = "llm.provider.overloaded";
    public static final String PROVIDER_INTERNAL_SERVER = "llm.provider.internal_server";
    public static final String PROVIDER_AUTHENTICATION = "llm.provider.authentication";
    public static final String PROVIDER_TIMEOUT = "llm.provider.timeout";
    public static final String PROVIDER_INVALID_REQUEST = "llm.provider.invalid_request";
    public static final String PROVIDER_ERROR = "llm.provider.error";
    public static final String LANGCHAIN4J_RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String LANGCHAIN4J_TIMEOUT = "llm.langchain4j.timeout";
    public static final String LANGCHAIN4J_AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String LANGCHAIN4J_INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String LANGCHAIN4J_MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String LANGCHAIN4J_CONTENT_FILTERED = "llm.langchain4j.content_filtered";
    public static final String LANGCHAIN4J_INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String LANGCHAIN4J_RETRIABLE = "llm.langchain4j.retriable";
    public static final String LANGCHAIN4J_NON_RETRIABLE = "llm.langchain4j.non_retriable";
    public static final String LANGCHAIN4J_HTTP_ERROR = "llm.langchain4j.http_error";
    public static final String LANGCHAIN4J_ERROR = "llm.langchain4j.error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final Map<String, String> LANGCHAIN4J_CODES = Map.ofEntries(
            Map.entry("RateLimitException", LANGCHAIN4J_RATE_LIMIT),
            Map.entry("TimeoutException", LANGCHAIN4J_TIMEOUT),
            Map.entry("AuthenticationException", LANGCHAIN4J_AUTHENTICATION),
            Map.entry("InvalidRequestException", LANGCHAIN4J_INVALID_REQUEST),
            Map.entry("ModelNotFoundException", LANGCHAIN4J_MODEL_NOT_FOUND),
            Map.entry("ContentFilteredException", LANGCHAIN4J_CONTENT_FILTERED),
            Map.entry("InternalServerException", LANGCHAIN4J_INTERNAL_SERVER),
            Map.entry("RetriableException", LANGCHAIN4J_RETRIABLE),
            Map.entry("NonRetriableException", LANGCHAIN4J_NON_RETRIABLE),
            Map.entry("LangChain4jException", LANGCHAIN4J_ERROR));
    private static final String LANGCHAIN4J_HTTP_EXCEPTION = "HttpException";

    private static final Set<String> TRANSIENT_CODES = Set.of(
            STREAM_IDLE_TIMEOUT,
            REQUEST_TIMEOUT,
            NETWORK_ERROR,
            PROVIDER_RATE_LIMIT,
            PROVIDER_OVERLOADED,
            PROVIDER_INTERNAL_SERVER,
            PROVIDER_TIMEOUT,
            LANGCHAIN4J_RATE_LIMIT,
            LANGCHAIN4J_TIMEOUT,
            LANGCHAIN4J_INTERNAL_SERVER,
            LANGCHAIN4J_RETRIABLE);

    private LlmErrorClassifier() {
    }

    /**
     * Classify a failure based on its type, cause chain and message.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Convert a failure into the error recorded on the assistant message.
     */
    public static MessageError toMessageError(Throwable throwable, String providerId) {
        String code = classifyFromThrowable(throwable);
        String message = describe(throwable);
        Map<String, String> metadata = new LinkedHashMap<>();
        if (providerId != null) {
            metadata.put("providerId", providerId);
        }

        if (REQUEST_ABORTED.equals(code)) {
            return MessageError.builder()
                    .name(MessageError.ABORTED)
                    .message(message)
                    .code(code)
                    .metadata(metadata)
                    .build();
        }
        if (PERMISSION_REJECTED.equals(code)) {
            return MessageError.builder()
                    .name(MessageError.PERMISSION_REJECTED)
                    .message(message)
                    .code(code)
                    .metadata(metadata)
                    .build();
        }
        if (isContextOverflowCode(code)) {
            return MessageError.builder()
                    .name(MessageError.CONTEXT_OVERFLOW)
                    .message(message)
                    .code(code)
                    .metadata(metadata)
                    .build();
        }

        ProviderException provider = findCause(throwable, ProviderException.class);
        StreamIdleTimeoutException idleTimeout = findCause(throwable, StreamIdleTimeoutException.class);
        Integer statusCode = provider != null ? Integer.valueOf(provider.getStatusCode()) : readStatusCode(throwable);
        boolean retryable = provider != null && provider.getRetryable() != null
                ? provider.getRetryable()
                : isTransientCode(code);
        if (idleTimeout != null) {
            metadata.put("timeoutMs", String.valueOf(idleTimeout.getTimeoutMs()));
        }
        boolean apiError = provider != null || idleTimeout != null || code.startsWith("llm.langchain4j.")
                || code.startsWith("llm.provider.");
        return MessageError.builder()
                .name(apiError ? MessageError.API_ERROR : MessageError.UNKNOWN)
                .message(message)
                .code(code)
                .retryable(retryable)
                .statusCode(statusCode)
                .retryAfterMs(provider != null ? provider.getRetryAfterMs() : null)
                .metadata(metadata)
                .build();
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[llm.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    public static boolean isTransientCode(String code) {
        return code != null && TRANSIENT_CODES.contains(code);
    }

    public static boolean isRateLimitCode(String code) {
        return PROVIDER_RATE_LIMIT.equals(code) || LANGCHAIN4J_RATE_LIMIT.equals(code);
    }

    public static boolean isContextOverflowCode(String code) {
        return CONTEXT_LENGTH_EXCEEDED.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof TurnAbortedException
                || throwable instanceof CancellationException
                || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof StreamIdleTimeoutException) {
            return STREAM_IDLE_TIMEOUT;
        }
        if (throwable instanceof PermissionRejectedException) {
            return PERMISSION_REJECTED;
        }
        if (throwable instanceof ProviderException provider) {
            return classifyProviderStatus(provider.getStatusCode());
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        if (throwable instanceof IOException) {
            return NETWORK_ERROR;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        String simpleName = className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length());
        if (LANGCHAIN4J_HTTP_EXCEPTION.equals(simpleName)) {
            return classifyHttpExceptionByStatus(throwable);
        }
        return LANGCHAIN4J_CODES.getOrDefault(simpleName, LANGCHAIN4J_ERROR);
    }

    private static String classifyProviderStatus(int statusCode) {
        if (statusCode == 429) {
            return PROVIDER_RATE_LIMIT;
        }
        if (statusCode == 503 || statusCode == 529) {
            return PROVIDER_OVERLOADED;
        }
        if (statusCode == 408 || statusCode == 504) {
            return PROVIDER_TIMEOUT;
        }
        if (statusCode >= 500) {
            return PROVIDER_INTERNAL_SERVER;
        }
        if (statusCode == 401 || statusCode == 403) {
            return PROVIDER_AUTHENTICATION;
        }
        if (statusCode >= 400) {
            return PROVIDER_INVALID_REQUEST;
        }
        return PROVIDER_ERROR;
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return LANGCHAIN4J_HTTP_ERROR;
        }
        if (statusCode == 429) {
            return LANGCHAIN4J_RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return LANGCHAIN4J_AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return LANGCHAIN4J_TIMEOUT;
        }
        if (statusCode >= 500) {
            return LANGCHAIN4J_INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return LANGCHAIN4J_INVALID_REQUEST;
        }
        return LANGCHAIN4J_HTTP_ERROR;
    }

    private static Integer readStatusCode(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current.getClass().getName().startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
                Integer statusCode = readHttpStatusCode(current);
                if (statusCode != null) {
                    return statusCode;
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException ignored) {
            return null;
        } catch (IllegalAccessException ignored) {
            return null;
        } catch (InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("token limit exceeded")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }

        return UNKNOWN;
    }

    private static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        String message = throwable.getMessage();
        return message != null && !message.isBlank() ? message : throwable.getClass().getSimpleName();
    }
}
