package com.enterprise.taskrouting.orchestrator;

import com.enterprise.taskrouting.approval.ApprovalContext;
import com.enterprise.taskrouting.approval.ApprovalDecision;
import com.enterprise.taskrouting.approval.ApprovalGate;
import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.classify.Classification;
import com.enterprise.taskrouting.classify.DomainClassifier;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.DuplicateTaskException;
import com.enterprise.taskrouting.exception.IllegalTransitionException;
import com.enterprise.taskrouting.exception.TaskNotClaimableException;
import com.enterprise.taskrouting.exception.TaskNotFoundException;
import com.enterprise.taskrouting.exception.TaskRoutingException;
import com.enterprise.taskrouting.logging.MdcContext;
import com.enterprise.taskrouting.loop.CompletionLoop;
import com.enterprise.taskrouting.loop.LoopResult;
import com.enterprise.taskrouting.loop.StepFunction;
import com.enterprise.taskrouting.monitoring.MetricsCollector;
import com.enterprise.taskrouting.retry.RetryExecutor;
import com.enterprise.taskrouting.store.IntakeItem;
import com.enterprise.taskrouting.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default orchestrator.
 * <p>
 * Each dispatched task runs on a worker from the {@link WorkerPool}. The in-flight
 * map keeps a task on at most one worker in this process; the store's atomic claim
 * covers other processes sharing the same root. Processing never lets an exception
 * escape a worker: anything unexpected fails the task and is audited.
 * <p>
 * Approval fields found on an intake document are never trusted: every task in
 * {@code new} goes through the approval gate, and the gate's decision overwrites them.
 * History for the gate is read once per poll pass.
 */
public class OrchestratorImpl implements Orchestrator {

    private static final Logger logger = LoggerFactory.getLogger(OrchestratorImpl.class);

    static final String OVERRIDE_DETAIL = "auto-approved by force-auto-approve override";

    private final TaskStore store;
    private final AuditLog auditLog;
    private final DomainClassifier classifier;
    private final ApprovalGate approvalGate;
    private final WorkerPool workerPool;
    private final MetricsCollector metricsCollector;
    private final CompletionLoop completionLoop;
    private final StepFunction step;
    private final StuckTaskResumer resumer;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;

    private final Map<String, FutureTask<Outcome>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> poller;
    private ApprovalContext approvalContext;

    public OrchestratorImpl(TaskStore store, AuditLog auditLog, DomainClassifier classifier,
                            ApprovalGate approvalGate, RetryExecutor retryExecutor, WorkerPool workerPool,
                            MetricsCollector metricsCollector, int maxIterations,
                            Duration pollInterval, Duration shutdownTimeout, StuckTaskResumer resumer) {
        this.store = store;
        this.auditLog = auditLog;
        this.classifier = classifier;
        this.approvalGate = approvalGate;
        this.workerPool = workerPool;
        this.metricsCollector = metricsCollector;
        this.pollInterval = pollInterval;
        this.shutdownTimeout = shutdownTimeout;
        this.completionLoop = new CompletionLoop(store, auditLog, maxIterations, shuttingDown::get);
        this.step = new ActionStep(retryExecutor);
        this.resumer = resumer;
        retryExecutor.setAttemptListener(this::persistRetryCount);
    }

    @Override
    public Task submit(Task task) throws DuplicateTaskException {
        Task stored = store.enqueue(task);
        auditLog.record(stored.getId(), AuditEventType.CREATED,
            "submitted from " + stored.getSource().wireName(), stored.getStatus());
        metricsCollector.recordIntake(stored);
        logger.debug("Submitted task {}", stored.getId());

        if (running.get()) {
            dispatch(stored.getId());
        }
        return stored;
    }

    @Override
    public int pollOnce() {
        return poll().size();
    }

    @Override
    public PassSummary processPending() {
        List<FutureTask<Outcome>> dispatched = poll();
        int completed = 0;
        int failed = 0;
        int awaiting = 0;
        for (FutureTask<Outcome> work : dispatched) {
            try {
                switch (work.get()) {
                    case COMPLETED:
                        completed++;
                        break;
                    case FAILED:
                        failed++;
                        break;
                    case AWAITING_APPROVAL:
                        awaiting++;
                        break;
                    default:
                        break;
                }
            } catch (CancellationException e) {
                logger.info("Processing was cancelled before finishing");
            } catch (ExecutionException e) {
                logger.error("Worker ended abnormally", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the processing pass");
                break;
            }
        }
        PassSummary summary = new PassSummary(dispatched.size(), completed, failed, awaiting);
        logger.info("Processing pass finished: {}", summary);
        return summary;
    }

    @Override
    public void onApproved(Task task) {
        if (!running.get()) {
            logger.info("Approved task {} will be resumed on the next poll", task.getId());
            return;
        }
        dispatch(task.getId());
    }

    @Override
    public void start() {
        if (shuttingDown.get()) {
            throw new IllegalStateException("Orchestrator has been stopped");
        }
        if (running.compareAndSet(false, true)) {
            logger.info("Starting orchestrator (poll interval {})...", pollInterval);

            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "task-poller");
                t.setDaemon(false);
                return t;
            });
            poller = scheduler.scheduleWithFixedDelay(
                this::safePoll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);

            logger.info("Orchestrator started successfully");
        }
    }

    @Override
    public CompletableFuture<Void> stop() {
        return CompletableFuture.runAsync(() -> {
            if (!shuttingDown.compareAndSet(false, true)) {
                return;
            }
            logger.info("Stopping orchestrator...");

            if (running.compareAndSet(true, false)) {
                if (poller != null) {
                    poller.cancel(false);
                }
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            // interrupting workers cancels their loops, which requeue the tasks
            workerPool.shutdownNow(shutdownTimeout);
            if (!inFlight.isEmpty()) {
                logger.warn("{} tasks were still queued at shutdown and stay in their partitions", inFlight.size());
                inFlight.clear();
            }
            metricsCollector.updateInFlight(0);

            logger.info("Orchestrator stopped successfully");
        });
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getInFlightCount() {
        return inFlight.size();
    }

    private void safePoll() {
        try {
            resumeStuckTasks();
        } catch (RuntimeException e) {
            logger.error("Error while resuming stuck tasks", e);
        }
        try {
            poll();
        } catch (RuntimeException e) {
            logger.error("Error during intake poll", e);
        }
    }

    /**
     * Daemon only: one-shot passes leave staging files and stuck tasks alone.
     */
    int resumeStuckTasks() {
        if (shuttingDown.get()) {
            return 0;
        }
        return resumer.resume(inFlight::containsKey);
    }

    private List<FutureTask<Outcome>> poll() {
        List<FutureTask<Outcome>> dispatched = new ArrayList<>();
        if (shuttingDown.get()) {
            return dispatched;
        }
        resetApprovalContext();

        for (IntakeItem item : store.scanIntake()) {
            if (item.isRejected()) {
                quarantine(item);
                continue;
            }
            Task task = item.getTask().orElseThrow();
            if (item.isNewlyRegistered()) {
                auditLog.record(task.getId(), AuditEventType.CREATED,
                    "registered " + item.getPath().getFileName() + " from " + task.getSource().wireName(),
                    task.getStatus());
                metricsCollector.recordIntake(task);
            }
            dispatch(task.getId()).ifPresent(dispatched::add);
        }

        for (Task waiting : store.list(TaskStatus.NEEDS_ACTION)) {
            if (Boolean.TRUE.equals(waiting.getApproved())) {
                dispatch(waiting.getId()).ifPresent(dispatched::add);
            }
        }

        if (!dispatched.isEmpty()) {
            logger.debug("Dispatched {} tasks", dispatched.size());
        }
        return dispatched;
    }

    private void quarantine(IntakeItem item) {
        String error = item.getError().orElse("unreadable document");
        Task quarantined = store.quarantine(item.getPath(), error);
        auditLog.record(quarantined.getId(), AuditEventType.MOVED,
            "quarantined " + item.getPath().getFileName() + ": " + error, quarantined.getStatus());
        metricsCollector.recordQuarantined();
        logger.warn("Quarantined malformed document {}: {}", item.getPath().getFileName(), error);
    }

    private Optional<FutureTask<Outcome>> dispatch(String id) {
        FutureTask<Outcome> work = new FutureTask<>(() -> process(id));
        if (inFlight.putIfAbsent(id, work) != null) {
            return Optional.empty();
        }
        try {
            workerPool.submit(work);
        } catch (RejectedExecutionException e) {
            inFlight.remove(id, work);
            logger.warn("Could not dispatch task {}: {}", id, e.getMessage());
            return Optional.empty();
        }
        metricsCollector.updateInFlight(inFlight.size());
        return Optional.of(work);
    }

    Outcome process(String id) {
        long startTime = System.currentTimeMillis();
        try {
            Optional<Task> found = store.get(id);
            if (found.isEmpty()) {
                logger.debug("Task {} disappeared before processing", id);
                return Outcome.SKIPPED;
            }
            Task task = found.get();
            MdcContext.setTask(id, task.getSource().wireName());

            if (task.getStatus() == TaskStatus.NEW) {
                task = classifyIfNeeded(task);
                task = gate(task);
                if (task.getStatus() == TaskStatus.NEEDS_ACTION) {
                    return Outcome.AWAITING_APPROVAL;
                }
            } else if (task.getStatus() == TaskStatus.NEEDS_ACTION) {
                if (!Boolean.TRUE.equals(task.getApproved())) {
                    return Outcome.AWAITING_APPROVAL;
                }
            } else {
                logger.debug("Task {} is {}, nothing to do", id, task.getStatus());
                return Outcome.SKIPPED;
            }

            if (shuttingDown.get()) {
                return Outcome.SKIPPED;
            }
            Task claimed = store.claim(id);
            return runLoop(claimed, startTime);
        } catch (TaskNotClaimableException e) {
            logger.info("Task {} not claimable: {}", id, e.getMessage());
            return Outcome.SKIPPED;
        } catch (TaskNotFoundException | IllegalTransitionException e) {
            logger.info("Task {} changed state during processing: {}", id, e.getMessage());
            return Outcome.SKIPPED;
        } catch (Exception e) {
            return failUnexpected(id, e, startTime);
        } finally {
            inFlight.remove(id);
            metricsCollector.updateInFlight(inFlight.size());
            MdcContext.clear();
        }
    }

    private Task classifyIfNeeded(Task task) throws TaskNotFoundException, IllegalTransitionException {
        if (task.isClassified()) {
            return task;
        }
        String content = Objects.toString(task.getTitle(), "") + "\n" + task.getPayload().getBody();
        Classification classification = classifier.classify(task.getSource(), content);
        String route = classifier.route(classification, content);

        Task classified = store.update(task.getId(), TaskStatus.NEW, t -> t.toBuilder()
            .domain(t.getDomain() != null ? t.getDomain() : classification.getDomain())
            .intent(t.getIntent() != null ? t.getIntent() : classification.getIntent())
            .priority(t.getPriority() != null ? t.getPriority() : classification.getPriority())
            .build());
        auditLog.record(task.getId(), AuditEventType.CLASSIFIED,
            "domain=" + classified.getDomain().wireName()
                + " intent=" + classified.getIntent()
                + " priority=" + classified.getPriority().wireName()
                + " route=" + route,
            classified.getStatus());
        metricsCollector.recordClassified(classified, route);
        logger.info("Classified task {} as {} ({})", task.getId(), classification, route);
        return classified;
    }

    private Task gate(Task task) throws TaskNotFoundException, IllegalTransitionException {
        ApprovalDecision decision = approvalGate.evaluate(task, approvalContext());

        if (decision.isOverride()) {
            Task approved = store.update(task.getId(), TaskStatus.NEW,
                t -> t.toBuilder().requiresApproval(false).approved(Boolean.TRUE).build());
            auditLog.record(task.getId(), AuditEventType.APPROVAL_GRANTED,
                OVERRIDE_DETAIL + " (" + decision.getReason() + ")", approved.getStatus());
            metricsCollector.recordApprovalGranted();
            return approved;
        }
        if (decision.requiresApproval()) {
            Task waiting = store.awaitApproval(task.getId(),
                t -> t.toBuilder().requiresApproval(true).approved(null).build());
            auditLog.record(task.getId(), AuditEventType.APPROVAL_REQUESTED,
                decision.getRule() + ": " + decision.getReason(), waiting.getStatus());
            metricsCollector.recordApprovalRequested();
            logger.info("Task {} awaits approval ({})", task.getId(), decision.getReason());
            return waiting;
        }

        logger.debug("Task {} auto-approved by rule {}", task.getId(), decision.getRule());
        if (task.isRequiresApproval() || task.getApproved() != null) {
            return store.update(task.getId(), TaskStatus.NEW,
                t -> t.toBuilder().requiresApproval(false).approved(null).build());
        }
        return task;
    }

    private synchronized ApprovalContext approvalContext() {
        if (approvalContext == null) {
            approvalContext = ApprovalContext.fromHistory(store.list(TaskStatus.DONE));
        }
        return approvalContext;
    }

    private synchronized void resetApprovalContext() {
        approvalContext = null;
    }

    private Outcome runLoop(Task claimed, long startTime) throws TaskNotFoundException, IllegalTransitionException {
        LoopResult result = completionLoop.run(claimed, step);
        long processingTime = System.currentTimeMillis() - startTime;

        switch (result.getOutcome()) {
            case COMPLETED:
                metricsCollector.recordCompleted(result.getTask(), processingTime);
                return Outcome.COMPLETED;
            case FAILED:
                metricsCollector.recordFailed(result.getTask(), processingTime);
                return Outcome.FAILED;
            default:
                requeueCancelled(claimed.getId());
                return Outcome.CANCELLED;
        }
    }

    private void requeueCancelled(String id) throws TaskNotFoundException, IllegalTransitionException {
        // file channels refuse to write on an interrupted thread
        boolean interrupted = Thread.interrupted();
        try {
            Task requeued = store.requeue(id);
            auditLog.record(id, AuditEventType.MOVED,
                "cancelled, requeued to " + requeued.getStatus().wireName(), requeued.getStatus());
            metricsCollector.recordCancelled(id);
            logger.info("Task {} cancelled and requeued to {}", id, requeued.getStatus());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Outcome failUnexpected(String id, Exception cause, long startTime) {
        logger.error("Unexpected error processing task {}", id, cause);
        boolean interrupted = Thread.interrupted();
        try {
            String reason = "unexpected_error: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
            Task failed = store.fail(id, reason);
            auditLog.record(id, AuditEventType.FAILURE, reason, failed.getStatus());
            metricsCollector.recordFailed(failed, System.currentTimeMillis() - startTime);
        } catch (TaskRoutingException | RuntimeException e) {
            logger.error("Could not mark task {} failed after an unexpected error", id, e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        return Outcome.FAILED;
    }

    private void persistRetryCount(String taskId, int attempt) {
        try {
            store.update(taskId, TaskStatus.IN_PROGRESS, t -> t.toBuilder().retryCount(attempt).build());
        } catch (TaskNotFoundException | IllegalTransitionException e) {
            logger.warn("Could not record attempt {} on task {}: {}", attempt, taskId, e.getMessage());
        }
    }

    enum Outcome {
        COMPLETED,
        FAILED,
        AWAITING_APPROVAL,
        CANCELLED,
        SKIPPED
    }
}
