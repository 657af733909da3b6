package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.core.Payload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandActionInvokerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Test
    void testSuccessfulCommandSeesActionFieldsAndBody() throws Exception {
        CommandActionInvoker invoker = new CommandActionInvoker(
            List.of("sh", "-c", "read line; echo \"$TASK_ACTION $TASK_CONTACT $line\""), TIMEOUT);

        InvocationResponse response = invoker.invoke("post.publish",
            new Payload("hello world\n", Map.of(Payload.CONTACT, "alice")));

        assertTrue(response.isSuccess());
        assertEquals("post.publish alice hello world", response.getDetail());
    }

    @Test
    void testNonZeroExitIsFailure() throws Exception {
        CommandActionInvoker invoker = new CommandActionInvoker(
            List.of("sh", "-c", "echo 403 forbidden; exit 3"), TIMEOUT);

        InvocationResponse response = invoker.invoke("post", Payload.ofBody(""));

        assertFalse(response.isSuccess());
        assertEquals("exit 3: 403 forbidden", response.getDetail());
        assertEquals(FailureClass.PERMANENT, new DefaultFailureClassifier().classify("post", response));
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testSlowCommandTimesOut() {
        CommandActionInvoker invoker = new CommandActionInvoker(List.of("sleep", "20"), Duration.ofMillis(200));

        TimeoutException e = assertThrows(TimeoutException.class, () -> invoker.invoke("post", Payload.ofBody("")));

        assertEquals(FailureClass.TRANSIENT, new DefaultFailureClassifier().classify("post", e));
    }

    @Test
    void testCommandLineIsSplitOnWhitespace() {
        CommandActionInvoker invoker = CommandActionInvoker.ofCommandLine("  /usr/bin/poster  --mode  live ", TIMEOUT);

        assertEquals(List.of("/usr/bin/poster", "--mode", "live"), invoker.getCommand());
        assertThrows(IllegalArgumentException.class, () -> new CommandActionInvoker(List.of(), TIMEOUT));
    }
}
