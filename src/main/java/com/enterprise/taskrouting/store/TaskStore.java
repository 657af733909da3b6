package com.enterprise.taskrouting.store;

import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.DuplicateTaskException;
import com.enterprise.taskrouting.exception.IllegalTransitionException;
import com.enterprise.taskrouting.exception.TaskNotClaimableException;
import com.enterprise.taskrouting.exception.TaskNotFoundException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable, partitioned collection of task records driven by the task state machine:
 * {@code new -> needs_action -> in_progress -> done | failed}, with
 * {@code new -> in_progress} when no approval is required.
 * <p>
 * Every transition is atomic: the partition move and the status update
 * succeed together or not at all. Terminal states are final.
 */
public interface TaskStore {

    /**
     * Adds a task to the intake partition, assigning an id if it has none.
     *
     * @return the stored task
     * @throws DuplicateTaskException if a task with the same id exists in any partition
     */
    Task enqueue(Task task) throws DuplicateTaskException;

    /**
     * Atomic check-and-set {@code new | needs_action -> in_progress}.
     * Exactly one of several concurrent callers succeeds. Resets the
     * retry counter for the new execution phase.
     *
     * @throws TaskNotClaimableException if the task is not in an eligible state or its approval is unmet
     */
    Task claim(String id) throws TaskNotFoundException, TaskNotClaimableException;

    /**
     * {@code in_progress -> done}
     */
    Task complete(String id) throws TaskNotFoundException, IllegalTransitionException;

    /**
     * Any non-terminal state {@code -> failed}, recording the reason
     */
    Task fail(String id, String reason) throws TaskNotFoundException, IllegalTransitionException;

    /**
     * {@code new -> needs_action}, applying the approval gate's decision to the task
     */
    Task awaitApproval(String id, UnaryOperator<Task> mutator) throws TaskNotFoundException, IllegalTransitionException;

    /**
     * Rewrites task fields without changing partition.
     *
     * @throws IllegalTransitionException if the task is no longer in {@code expectedStatus}
     */
    Task update(String id, TaskStatus expectedStatus, UnaryOperator<Task> mutator)
        throws TaskNotFoundException, IllegalTransitionException;

    /**
     * Returns an interrupted {@code in_progress} task to a resumable state:
     * {@code needs_action} when it went through the approval gate, otherwise {@code new}
     */
    Task requeue(String id) throws TaskNotFoundException, IllegalTransitionException;

    Optional<Task> get(String id);

    List<Task> list(TaskStatus status);

    List<Task> listAll();

    /**
     * Scans the intake partition. Producer documents without an id or with a
     * non-canonical filename are assigned an id and renamed; malformed
     * documents are returned as rejected items for quarantine.
     */
    List<IntakeItem> scanIntake();

    /**
     * Moves a malformed intake document into the failed partition, keeping
     * its raw text as the body and the parse error as the failure reason.
     *
     * @return the quarantined task record
     */
    Task quarantine(Path document, String error);

    /**
     * Resolves transitions interrupted by a crash, rolling each one forward or back.
     * Staging files younger than {@code minAge} are left alone, since they may belong
     * to a transition another process is still running. Meant for the single daemon
     * that owns the store, never for read-only or one-shot opens.
     *
     * @return the number of staging files resolved
     */
    int recover(Duration minAge);

    /**
     * Root directory of the store
     */
    Path getRoot();
}
