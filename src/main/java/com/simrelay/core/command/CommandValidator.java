package com.simrelay.core.command;

import com.simrelay.core.error.BadRequestException;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape checks for command submissions. The queue does not interpret task
 * semantics beyond what is checked here.
 */
public final class CommandValidator {

    public static final int MIN_PURPOSE_LENGTH = 3;
    public static final int MAX_PURPOSE_LENGTH = 200;
    public static final int MIN_PRIORITY = -10;
    public static final int MAX_PRIORITY = 10;
    public static final double DEFAULT_HOLD_SECONDS = 1.0;

    private CommandValidator() {}

    public static String purpose(String purpose) {
        String trimmed = purpose == null ? "" : purpose.trim();
        if (trimmed.length() < MIN_PURPOSE_LENGTH || trimmed.length() > MAX_PURPOSE_LENGTH) {
            throw new BadRequestException("purpose must be between %d and %d characters"
                    .formatted(MIN_PURPOSE_LENGTH, MAX_PURPOSE_LENGTH));
        }
        return trimmed;
    }

    public static int priority(Integer priority) {
        if (priority == null) {
            return 0;
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new BadRequestException("priority must be between %d and %d"
                    .formatted(MIN_PRIORITY, MAX_PRIORITY));
        }
        return priority;
    }

    public static List<Task> tasks(List<TaskDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new BadRequestException("At least one task is required");
        }
        var tasks = new ArrayList<Task>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            tasks.add(task(i, drafts.get(i)));
        }
        return tasks;
    }

    static Task task(int index, TaskDraft draft) {
        String where = "tasks[" + index + "]";
        if (draft == null) {
            throw new BadRequestException(where + " must be an object");
        }
        TaskOperation operation = TaskOperation.fromWire(draft.operation())
                .orElseThrow(() -> new BadRequestException(where + ".operation must be 'set' or 'pulse'"));
        if (draft.variable() == null || draft.variable().isBlank()) {
            throw new BadRequestException(where + ".variable is required");
        }
        if (draft.value() == null || draft.value().isNull()) {
            throw new BadRequestException(where + ".value is required");
        }

        if (operation == TaskOperation.SET) {
            return new Task(operation, draft.variable().trim(), draft.value(), null, 0.0, draft.comment());
        }

        if (draft.resetValue() == null || draft.resetValue().isNull()) {
            throw new BadRequestException(where + ".reset_value is required for pulse");
        }
        double hold = draft.holdSeconds() == null ? DEFAULT_HOLD_SECONDS : draft.holdSeconds();
        if (hold < 0 || Double.isNaN(hold) || Double.isInfinite(hold)) {
            throw new BadRequestException(where + ".hold_seconds must be a non-negative number");
        }
        return new Task(operation, draft.variable().trim(), draft.value(), draft.resetValue(), hold, draft.comment());
    }
}
