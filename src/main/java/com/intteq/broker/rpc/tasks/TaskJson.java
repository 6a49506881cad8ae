package com.intteq.broker.rpc.tasks;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire representation of a task. Date-times are ISO-8601 without offset, null when unset.
 */
final class TaskJson {

    private TaskJson() {
    }

    static Map<String, Object> of(TaskEntity task) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", task.getId());
        json.put("owner_id", task.getOwnerId());
        json.put("title", task.getTitle());
        json.put("description", task.getDescription());
        json.put("status", task.getStatus().wireValue());
        json.put("priority", task.getPriority().wireValue());
        json.put("due_date", format(task.getDueDate()));
        json.put("created_at", format(task.getCreatedAt()));
        json.put("updated_at", format(task.getUpdatedAt()));
        return json;
    }

    private static String format(LocalDateTime value) {
        return value != null ? value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null;
    }
}
