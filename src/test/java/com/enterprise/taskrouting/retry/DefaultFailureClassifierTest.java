package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.exception.ActionNotFoundException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultFailureClassifierTest {

    private final DefaultFailureClassifier classifier = new DefaultFailureClassifier();

    @Test
    void testDefaultKeywords() {
        assertEquals(FailureClass.TRANSIENT, classify("429 Too Many Requests"));
        assertEquals(FailureClass.TRANSIENT, classify("Rate limit exceeded"));
        assertEquals(FailureClass.PERMANENT, classify("401 invalid credentials"));
        assertEquals(FailureClass.PERMANENT, classify("Page not found"));
        assertEquals(FailureClass.TRANSIENT, classify("something odd happened"));
    }

    @Test
    void testTransientKeywordWinsOverPermanentKeyword() {
        assertEquals(FailureClass.TRANSIENT, classify("auth service unavailable"));
        assertEquals(FailureClass.TRANSIENT, classify("403 from proxy, try again"));
    }

    @Test
    void testCustomTransientKeywordChangesOutcome() {
        String detail = "account locked during maintenance";
        DefaultFailureClassifier withoutMaintenance =
            new DefaultFailureClassifier(List.of("timeout"), List.of("account locked"));
        DefaultFailureClassifier withMaintenance =
            new DefaultFailureClassifier(List.of("timeout", "MAINTENANCE"), List.of("account locked"));

        assertEquals(FailureClass.PERMANENT,
            withoutMaintenance.classify("post", InvocationResponse.failure(detail)));
        assertEquals(FailureClass.TRANSIENT,
            withMaintenance.classify("post", InvocationResponse.failure(detail)));
        assertEquals(FailureClass.TRANSIENT,
            withMaintenance.classify("post", new IllegalStateException(detail)));
    }

    @Test
    void testExceptionTypesTakePrecedenceOverMessage() {
        assertEquals(FailureClass.TRANSIENT,
            classifier.classify("post", new SocketTimeoutException("403 forbidden")));
        assertEquals(FailureClass.PERMANENT,
            classifier.classify("post", new ActionNotFoundException("teleport")));
        assertEquals(FailureClass.PERMANENT,
            classifier.classify("post", new IOException("permission denied")));
        assertEquals(FailureClass.TRANSIENT,
            classifier.classify("post", new IOException("broken pipe")));
        assertEquals(FailureClass.TRANSIENT,
            classifier.classify("post", new IllegalStateException()));
    }

    private FailureClass classify(String detail) {
        return classifier.classify("post", InvocationResponse.failure(detail));
    }
}
