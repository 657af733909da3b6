package com.enterprise.taskrouting.classify;

import com.enterprise.taskrouting.core.Domain;
import com.enterprise.taskrouting.core.Priority;

import java.util.Objects;

/**
 * Result of classifying a task: domain, intent and priority
 */
public final class Classification {

    private final Domain domain;
    private final String intent;
    private final Priority priority;

    public Classification(Domain domain, String intent, Priority priority) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.intent = Objects.requireNonNull(intent, "intent");
        this.priority = Objects.requireNonNull(priority, "priority");
    }

    public Domain getDomain() {
        return domain;
    }

    public String getIntent() {
        return intent;
    }

    public Priority getPriority() {
        return priority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Classification that = (Classification) o;
        return domain == that.domain && intent.equals(that.intent) && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, intent, priority);
    }

    @Override
    public String toString() {
        return "domain=" + domain.wireName() + " intent=" + intent + " priority=" + priority.wireName();
    }
}
