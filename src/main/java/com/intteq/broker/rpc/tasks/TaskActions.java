package com.intteq.broker.rpc.tasks;

import com.intteq.broker.rpc.annotation.RpcAction;
import com.intteq.broker.rpc.annotation.RpcController;
import com.intteq.broker.rpc.dispatch.HandlerResult;
import com.intteq.broker.rpc.dispatch.Principal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Task CRUD for the authenticated user, served under {@code v1} and {@code v2}.
 * Only {@code v2} reads the {@code priority} argument.
 *
 * <p>Every argument is validated before anything is written, so a business error
 * leaves the store untouched.
 */
@Slf4j
@RpcController(description = "Tasks of the calling user")
@RequiredArgsConstructor
@Transactional
public class TaskActions {

    static final String V2 = "v2";

    private static final String DUE_DATE_HINT = "due_date must be ISO format, e.g. 2025-12-31 or 2025-12-31T10:00:00";

    private final TaskRepository tasks;
    private final Clock clock;

    @RpcAction(value = "create_task", versions = {"v1", "v2"})
    public HandlerResult createTask(Principal principal, String version, Map<String, Object> data) {
        RequestData args = new RequestData(data);
        if (args.isBlank("title")) {
            return HandlerResult.error("title required");
        }

        Optional<TaskPriority> priority = Optional.empty();
        if (V2.equals(version) && !args.isBlank("priority")) {
            priority = TaskPriority.fromWire(args.text("priority"));
            if (priority.isEmpty()) {
                return HandlerResult.error(invalidPriority());
            }
        }

        LocalDateTime dueDate = null;
        if (!args.isBlank("due_date")) {
            Optional<LocalDateTime> parsed = RequestData.parseDateTime(args.raw("due_date"));
            if (parsed.isEmpty()) {
                return HandlerResult.error(DUE_DATE_HINT);
            }
            dueDate = parsed.get();
        }

        TaskEntity task = new TaskEntity(principal.userId(), args.text("title"), args.text("description"),
                LocalDateTime.now(clock));
        priority.ifPresent(task::setPriority);
        task.setDueDate(dueDate);

        TaskEntity saved = tasks.saveAndFlush(task);
        log.debug("Created task {} for user {}", saved.getId(), principal.userId());
        return HandlerResult.ok(TaskJson.of(saved));
    }

    @Transactional(readOnly = true)
    @RpcAction(value = "list_tasks", versions = {"v1", "v2"})
    public HandlerResult listTasks(Principal principal, String version, Map<String, Object> data) {
        List<Map<String, Object>> result = tasks.findByOwnerIdOrderByIdDesc(principal.userId())
                .stream()
                .map(TaskJson::of)
                .collect(Collectors.toList());
        return HandlerResult.ok(result);
    }

    @Transactional(readOnly = true)
    @RpcAction(value = "get_task", versions = {"v1", "v2"})
    public HandlerResult getTask(Principal principal, String version, Map<String, Object> data) {
        Lookup lookup = lookup(principal, new RequestData(data));
        if (lookup.error() != null) {
            return HandlerResult.error(lookup.error());
        }
        return HandlerResult.ok(TaskJson.of(lookup.task()));
    }

    @RpcAction(value = "update_task", versions = {"v1", "v2"})
    public HandlerResult updateTask(Principal principal, String version, Map<String, Object> data) {
        RequestData args = new RequestData(data);
        Lookup lookup = lookup(principal, args);
        if (lookup.error() != null) {
            return HandlerResult.error(lookup.error());
        }
        TaskEntity task = lookup.task();

        Optional<TaskStatus> status = Optional.empty();
        if (args.hasValue("status")) {
            status = TaskStatus.fromWire(args.text("status"));
            if (status.isEmpty()) {
                return HandlerResult.error("status must be one of todo, in_progress, done");
            }
        }

        Optional<TaskPriority> priority = Optional.empty();
        if (V2.equals(version) && args.hasValue("priority")) {
            priority = TaskPriority.fromWire(args.text("priority"));
            if (priority.isEmpty()) {
                return HandlerResult.error(invalidPriority());
            }
        }

        boolean touchDueDate = args.has("due_date");
        LocalDateTime dueDate = null;
        if (touchDueDate && args.hasValue("due_date")) {
            Optional<LocalDateTime> parsed = RequestData.parseDateTime(args.raw("due_date"));
            if (parsed.isEmpty()) {
                return HandlerResult.error("due_date must be ISO format");
            }
            dueDate = parsed.get();
        }

        if (args.hasValue("title")) {
            task.setTitle(args.text("title"));
        }
        if (args.hasValue("description")) {
            task.setDescription(args.text("description"));
        }
        status.ifPresent(task::setStatus);
        priority.ifPresent(task::setPriority);
        if (touchDueDate) {
            task.setDueDate(dueDate);
        }
        task.setUpdatedAt(LocalDateTime.now(clock));

        return HandlerResult.ok(TaskJson.of(tasks.saveAndFlush(task)));
    }

    @RpcAction(value = "delete_task", versions = {"v1", "v2"})
    public HandlerResult deleteTask(Principal principal, String version, Map<String, Object> data) {
        Lookup lookup = lookup(principal, new RequestData(data));
        if (lookup.error() != null) {
            return HandlerResult.error(lookup.error());
        }
        tasks.delete(lookup.task());
        tasks.flush();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deleted", true);
        result.put("task_id", lookup.task().getId());
        return HandlerResult.ok(result);
    }

    // ========================================================================
    //   Helpers
    // ========================================================================

    private Lookup lookup(Principal principal, RequestData args) {
        if (args.isBlank("task_id")) {
            return Lookup.failed("task_id required");
        }
        Optional<Long> taskId = args.id("task_id");
        if (taskId.isEmpty()) {
            return Lookup.failed("task_id must be an integer");
        }
        return tasks.findByIdAndOwnerId(taskId.get(), principal.userId())
                .map(Lookup::found)
                .orElseGet(() -> Lookup.failed("Task not found"));
    }

    private static String invalidPriority() {
        return "priority must be one of low, medium, high";
    }

    private record Lookup(TaskEntity task, String error) {

        static Lookup found(TaskEntity task) {
            return new Lookup(task, null);
        }

        static Lookup failed(String error) {
            return new Lookup(null, error);
        }
    }
}
