package me.golemcore.report.domain.service;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies provider failures into stable machine-readable reason codes.
 * Timeout, rate-limit and server-side codes are transient; everything else is
 * final for the call that raised it.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String SERVER_ERROR = "llm.server_error";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String MODEL_NOT_FOUND = "llm.model_not_found";
    public static final String CONTENT_FILTERED = "llm.content_filtered";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String EMPTY_RESPONSE = "llm.empty_response";
    public static final String PROVIDER_NOT_CONFIGURED = "llm.provider.not_configured";
    public static final String RETRIABLE = "llm.retriable";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private static final Map<String, String> LANGCHAIN4J_CODES = Map.of(
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException", RATE_LIMIT,
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException", REQUEST_TIMEOUT,
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "AuthenticationException", AUTHENTICATION,
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "InvalidRequestException", INVALID_REQUEST,
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "ModelNotFoundException", MODEL_NOT_FOUND,
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "ContentFilteredException", CONTENT_FILTERED,
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "InternalServerException", SERVER_ERROR,
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException", RETRIABLE);

    private LlmErrorClassifier() {
    }

    /**
     * Classify a failure by walking the cause chain: embedded code markers first,
     * then known exception types, then message heuristics.
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

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
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
        if (code == null || code.isBlank()) {
            return false;
        }
        return RATE_LIMIT.equals(code)
                || REQUEST_TIMEOUT.equals(code)
                || SERVER_ERROR.equals(code)
                || RETRIABLE.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyHttpExceptionByStatus(throwable);
        }
        return LANGCHAIN4J_CODES.getOrDefault(className, UNKNOWN);
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return UNKNOWN;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return REQUEST_TIMEOUT;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
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
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("too many requests") || normalized.contains("rate_limit")) {
            return RATE_LIMIT;
        }
        if (normalized.contains("timed out") || normalized.contains("timeout")) {
            return REQUEST_TIMEOUT;
        }

        return UNKNOWN;
    }
}
