package com.casewright.dispatch.api;

import com.casewright.core.engine.TaskEngine;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * REST controller for polling background tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskEngine taskEngine;
    private final SseStreamingService sseStreamingService;

    public TaskController(TaskEngine taskEngine, SseStreamingService sseStreamingService) {
        this.taskEngine = taskEngine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/tasks: All tracked tasks, newest first.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks() {
        return ResponseEntity.ok(taskEngine.listTasks().stream().map(TaskResponse::from).toList());
    }

    /**
     * GET /api/v1/tasks/{id}: Snapshot of one task. Unknown ids yield 404.
     */
    @GetMapping("/{id}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String id) {
        return ResponseEntity.ok(TaskResponse.from(taskEngine.getTask(id)));
    }

    /**
     * GET /api/v1/tasks/{id}/events: Live task events over SSE.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        taskEngine.getTask(id);
        return sseStreamingService.open(id, taskEngine::getTask);
    }
}
