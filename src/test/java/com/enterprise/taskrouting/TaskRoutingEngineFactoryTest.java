package com.enterprise.taskrouting;

import com.enterprise.taskrouting.config.RoutingConfig;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.orchestrator.PassSummary;
import com.enterprise.taskrouting.retry.InvocationResponse;
import com.enterprise.taskrouting.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class TaskRoutingEngineFactoryTest {

    @TempDir
    Path tempDir;

    private TaskRoutingEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    @Test
    void testCreateWithCustomRoot() {
        engine = TaskRoutingEngineFactory.create(RoutingConfig.builder().root(tempDir).build());

        assertNotNull(engine.getOrchestrator());
        assertNotNull(engine.getApprovalService());
        assertFalse(engine.isRunning());
        assertEquals(tempDir, engine.getStore().getRoot());
        assertTrue(Files.isDirectory(tempDir.resolve("needs_action")));
    }

    @Test
    void testCreateWithInvalidConfig() {
        RoutingConfig invalidConfig = RoutingConfig.builder()
            .root(tempDir)
            .executorConfig(new RoutingConfig.ExecutorConfig(-1, Duration.ofSeconds(1), Duration.ofSeconds(1)))
            .build();

        assertThrows(IllegalArgumentException.class, () -> TaskRoutingEngineFactory.create(invalidConfig));
    }

    @Test
    void testActionRegistryFromCommands() {
        RoutingConfig.ActionConfig actions = new RoutingConfig.ActionConfig(
            Map.of("post", "python3 social_poster.py"), false, Duration.ofSeconds(5));

        assertEquals(Set.of("post"),
            TaskRoutingEngineFactory.createActionRegistry(actions, null).getRegisteredActions());
    }

    @Test
    void testRetryPolicyFromConfig() {
        RetryPolicy policy = TaskRoutingEngineFactory.createRetryPolicy(
            new RoutingConfig.RetryConfig(4, Duration.ofSeconds(1), 3.0, Duration.ofSeconds(30)));

        assertEquals(4, policy.getMaxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.getBaseDelay());
    }

    @Test
    void testSensitiveTaskWaitsForApprovalThenRuns() throws Exception {
        List<String> invoked = new CopyOnWriteArrayList<>();
        engine = TaskRoutingEngineFactory.create(RoutingConfig.builder().root(tempDir).build(),
            (action, payload) -> {
                invoked.add(action);
                return InvocationResponse.success("sent");
            },
            duration -> { },
            Clock.systemUTC());

        Task submitted = engine.getOrchestrator().submit(TaskImpl.builder()
            .source(Source.GMAIL)
            .title("Send the bank password reset link")
            .status(TaskStatus.NEW)
            .payload(Payload.ofBody("Please send the bank password reset link to the client."))
            .createdAt(Instant.now())
            .build());

        PassSummary first = engine.getOrchestrator().processPending();
        assertEquals(1, first.getAwaitingApproval());
        assertEquals(TaskStatus.NEEDS_ACTION, engine.getStore().get(submitted.getId()).orElseThrow().getStatus());
        assertTrue(invoked.isEmpty());

        engine.getApprovalService().decide(submitted.getId(), true);
        PassSummary second = engine.getOrchestrator().processPending();

        assertEquals(1, second.getCompleted());
        assertEquals(TaskStatus.DONE, engine.getStore().get(submitted.getId()).orElseThrow().getStatus());
        assertEquals(1, invoked.size());
    }
}
