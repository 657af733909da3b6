package com.enterprise.taskrouting.approval;

import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskStatus;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable snapshot of prior activity the approval rules consult:
 * platforms that already have a completed action, and contacts already dealt with.
 */
public final class ApprovalContext {

    private static final ApprovalContext EMPTY = new ApprovalContext(Set.of(), Set.of());

    private final Set<Source> actedPlatforms;
    private final Set<String> knownContacts;

    public ApprovalContext(Set<Source> actedPlatforms, Set<String> knownContacts) {
        Set<Source> platforms = EnumSet.noneOf(Source.class);
        platforms.addAll(actedPlatforms);
        this.actedPlatforms = Collections.unmodifiableSet(platforms);
        Set<String> contacts = new HashSet<>();
        knownContacts.forEach(contact -> contacts.add(normalize(contact)));
        this.knownContacts = Collections.unmodifiableSet(contacts);
    }

    public static ApprovalContext empty() {
        return EMPTY;
    }

    /**
     * Builds the context from tasks; only completed tasks count as prior activity
     */
    public static ApprovalContext fromHistory(Collection<Task> tasks) {
        Set<Source> platforms = EnumSet.noneOf(Source.class);
        Set<String> contacts = new HashSet<>();
        for (Task task : tasks) {
            if (task.getStatus() != TaskStatus.DONE) {
                continue;
            }
            platforms.add(task.getSource());
            task.getPayload().field(Payload.CONTACT).ifPresent(contacts::add);
        }
        return new ApprovalContext(platforms, contacts);
    }

    public boolean hasActedOn(Source platform) {
        return actedPlatforms.contains(platform);
    }

    public boolean isKnownContact(String contact) {
        return contact != null && knownContacts.contains(normalize(contact));
    }

    public Set<Source> getActedPlatforms() {
        return actedPlatforms;
    }

    public Set<String> getKnownContacts() {
        return knownContacts;
    }

    private static String normalize(String contact) {
        return contact.trim().toLowerCase(Locale.ROOT);
    }
}
