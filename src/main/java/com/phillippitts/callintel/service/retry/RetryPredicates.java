package com.phillippitts.callintel.service.retry;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Factory methods for common retry predicates.
 *
 * <p>Token matching ({@link #matchingTokens(Collection)}) follows these rules, in order:
 * <ol>
 *   <li>an empty token set makes every failure retryable;</li>
 *   <li>a timeout (an {@link OperationTimeoutException}, or a message containing "timed out")
 *       is retryable only if some token is timeout-related ({@link #isTimeoutToken});</li>
 *   <li>a {@link ClassifiedFailure} with an error code is retryable only if the code equals a
 *       token, ignoring case;</li>
 *   <li>any other failure is retryable if its message contains a token, ignoring case.</li>
 * </ol>
 */
public final class RetryPredicates {

    private static final Predicate<Throwable> ANY = error -> true;

    private RetryPredicates() {
    }

    public static Predicate<Throwable> anyError() {
        return ANY;
    }

    public static Predicate<Throwable> matchingTokens(String... tokens) {
        return matchingTokens(List.of(tokens));
    }

    public static Predicate<Throwable> matchingTokens(Collection<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return ANY;
        }
        List<String> normalized = tokens.stream()
                .filter(Objects::nonNull)
                .map(token -> token.toLowerCase(Locale.ROOT))
                .toList();
        boolean timeoutAllowed = normalized.stream().anyMatch(RetryPredicates::isTimeoutToken);

        return error -> {
            String message = messageOf(error);
            if (isTimeout(error, message)) {
                return timeoutAllowed;
            }
            if (error instanceof ClassifiedFailure classified && classified.getErrorCode() != null) {
                return normalized.contains(classified.getErrorCode().toLowerCase(Locale.ROOT));
            }
            return normalized.stream().anyMatch(message::contains);
        };
    }

    /**
     * @return true for tokens such as {@code timeout}, {@code ETIMEDOUT} or {@code timed out}
     */
    public static boolean isTimeoutToken(String token) {
        if (token == null) {
            return false;
        }
        String t = token.toLowerCase(Locale.ROOT);
        return t.contains("timeout") || t.contains("timedout") || t.contains("timed out");
    }

    private static boolean isTimeout(Throwable error, String lowerMessage) {
        return error instanceof OperationTimeoutException || lowerMessage.contains("timed out");
    }

    private static String messageOf(Throwable error) {
        String message = error == null ? null : error.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
