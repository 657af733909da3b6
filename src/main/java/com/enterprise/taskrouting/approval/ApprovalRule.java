package com.enterprise.taskrouting.approval;

import com.enterprise.taskrouting.core.Domain;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Priority;
import com.enterprise.taskrouting.core.Task;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One entry of an approval policy: a named predicate over the task and the
 * approval context, and what happens when it matches.
 */
public final class ApprovalRule {

    public enum Action {
        REQUIRE_APPROVAL,
        AUTO_APPROVE
    }

    private final String name;
    private final Action action;
    private final BiPredicate<Task, ApprovalContext> predicate;
    private final Function<Task, String> reason;

    public ApprovalRule(String name, Action action, BiPredicate<Task, ApprovalContext> predicate) {
        this(name, action, predicate, task -> name.replace('_', ' '));
    }

    public ApprovalRule(String name, Action action, BiPredicate<Task, ApprovalContext> predicate,
                        Function<Task, String> reason) {
        this.name = name;
        this.action = action;
        this.predicate = predicate;
        this.reason = reason;
    }

    public boolean matches(Task task, ApprovalContext context) {
        return predicate.test(task, context);
    }

    public String getName() {
        return name;
    }

    public Action getAction() {
        return action;
    }

    ApprovalDecision toDecision(Task task) {
        String description = reason.apply(task);
        return action == Action.REQUIRE_APPROVAL
            ? ApprovalDecision.require(name, description)
            : ApprovalDecision.autoApprove(name, description);
    }

    public static ApprovalRule sensitiveKeyword(List<String> keywords) {
        List<String> lowered = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
        return new ApprovalRule("sensitive_keyword", Action.REQUIRE_APPROVAL,
            (task, context) -> firstHit(task, lowered).isPresent(),
            task -> "sensitive keyword '" + firstHit(task, lowered).orElse("") + "'");
    }

    public static ApprovalRule batchSizeOver(int limit) {
        return new ApprovalRule("batch_size", Action.REQUIRE_APPROVAL,
            (task, context) -> batchSize(task).map(size -> size > limit).orElse(false),
            task -> "batch size " + batchSize(task).orElse(0) + " over limit " + limit);
    }

    public static ApprovalRule firstActionOnPlatform() {
        return new ApprovalRule("first_action_on_platform", Action.REQUIRE_APPROVAL,
            (task, context) -> !context.hasActedOn(task.getSource()),
            task -> "first action on platform " + task.getSource().wireName());
    }

    public static ApprovalRule newContact() {
        return new ApprovalRule("new_contact", Action.REQUIRE_APPROVAL,
            (task, context) -> task.getPayload().field(Payload.CONTACT)
                .map(contact -> !context.isKnownContact(contact))
                .orElse(false),
            task -> "new contact " + task.getPayload().field(Payload.CONTACT).orElse(""));
    }

    public static ApprovalRule lowPriorityUpdate() {
        return new ApprovalRule("low_priority_update", Action.AUTO_APPROVE,
            (task, context) -> task.getPriority() == Priority.LOW && "update".equals(task.getIntent()));
    }

    public static ApprovalRule knownPersonalContact() {
        return new ApprovalRule("known_personal_contact", Action.AUTO_APPROVE,
            (task, context) -> task.getDomain() == Domain.PERSONAL
                && task.getPayload().field(Payload.CONTACT).map(context::isKnownContact).orElse(false));
    }

    private static Optional<String> firstHit(Task task, List<String> keywords) {
        String text = (task.getTitle() + "\n" + task.getPayload().getBody()).toLowerCase(Locale.ROOT);
        return keywords.stream().filter(text::contains).findFirst();
    }

    private static Optional<Integer> batchSize(Task task) {
        return task.getPayload().field(Payload.BATCH_SIZE).flatMap(value -> {
            try {
                return Optional.of(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }
}
