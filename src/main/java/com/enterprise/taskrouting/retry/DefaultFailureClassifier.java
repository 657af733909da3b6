package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.exception.ActionNotFoundException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Classifies failures by exception type and by keywords in the response detail.
 * A transient keyword wins over a permanent one, so "auth service unavailable"
 * is retried. Details matching neither list are transient.
 */
public class DefaultFailureClassifier implements FailureClassifier {

    public static final List<String> DEFAULT_TRANSIENT_KEYWORDS =
        List.of("timeout", "timed out", "rate limit", "429", "503", "unavailable", "connection reset", "try again");
    public static final List<String> DEFAULT_PERMANENT_KEYWORDS =
        List.of("auth", "401", "403", "forbidden", "permission", "not found", "404", "invalid credentials");

    private final List<String> transientKeywords;
    private final List<String> permanentKeywords;

    public DefaultFailureClassifier() {
        this(DEFAULT_TRANSIENT_KEYWORDS, DEFAULT_PERMANENT_KEYWORDS);
    }

    public DefaultFailureClassifier(List<String> transientKeywords, List<String> permanentKeywords) {
        this.transientKeywords = lowercase(transientKeywords);
        this.permanentKeywords = lowercase(permanentKeywords);
    }

    @Override
    public FailureClass classify(String actionName, InvocationResponse response) {
        FailureClass byDetail = matchDetail(response.getDetail());
        return byDetail != null ? byDetail : FailureClass.TRANSIENT;
    }

    @Override
    public FailureClass classify(String actionName, Throwable error) {
        if (error instanceof SocketTimeoutException
                || error instanceof ConnectException
                || error instanceof TimeoutException) {
            return FailureClass.TRANSIENT;
        }
        if (error instanceof SecurityException || error instanceof ActionNotFoundException) {
            return FailureClass.PERMANENT;
        }
        FailureClass byMessage = matchDetail(String.valueOf(error.getMessage()));
        if (byMessage != null) {
            return byMessage;
        }
        return FailureClass.TRANSIENT;
    }

    /**
     * @return the class named by the first matching keyword list, or null when neither matches
     */
    private FailureClass matchDetail(String detail) {
        if (detail == null) {
            return null;
        }
        String text = detail.toLowerCase(Locale.ROOT);
        if (transientKeywords.stream().anyMatch(text::contains)) {
            return FailureClass.TRANSIENT;
        }
        if (permanentKeywords.stream().anyMatch(text::contains)) {
            return FailureClass.PERMANENT;
        }
        return null;
    }

    private static List<String> lowercase(List<String> keywords) {
        return keywords.stream()
            .map(keyword -> keyword.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
    }
}
