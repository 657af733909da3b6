package com.enterprise.taskrouting.store;

import com.enterprise.taskrouting.core.Task;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One document found in the intake partition. Either a readable task, or a
 * rejected document awaiting quarantine together with its parse error.
 */
public final class IntakeItem {

    private final Path path;
    private final Task task;
    private final boolean newlyRegistered;
    private final String error;

    private IntakeItem(Path path, Task task, boolean newlyRegistered, String error) {
        this.path = path;
        this.task = task;
        this.newlyRegistered = newlyRegistered;
        this.error = error;
    }

    static IntakeItem accepted(Path path, Task task, boolean newlyRegistered) {
        return new IntakeItem(path, task, newlyRegistered, null);
    }

    static IntakeItem rejected(Path path, String error) {
        return new IntakeItem(path, null, false, error);
    }

    public Path getPath() {
        return path;
    }

    public Optional<Task> getTask() {
        return Optional.ofNullable(task);
    }

    /**
     * True when this scan assigned the id and canonical filename, i.e. the
     * producer deposited the document since the previous scan
     */
    public boolean isNewlyRegistered() {
        return newlyRegistered;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isRejected() {
        return error != null;
    }
}
