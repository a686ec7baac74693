package com.taskhub.api.api.controller;

import com.taskhub.api.api.dto.CreateTaskRequestDto;
import com.taskhub.api.api.dto.DataResponseDto;
import com.taskhub.api.api.dto.MessageResponseDto;
import com.taskhub.api.api.dto.PagedResponseDto;
import com.taskhub.api.api.dto.TaskResponseDto;
import com.taskhub.api.api.dto.UpdateTaskRequestDto;
import com.taskhub.api.config.TaskHubProperties;
import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.model.PageRequestParams;
import com.taskhub.api.domain.service.TaskService;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.data.domain.Slice;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Task Controller - the caller's own tasks
 *
 * Endpoints:
 * - GET    /tasks?page=&page_size=
 * - POST   /tasks
 * - GET    /tasks/{id}
 * - PUT    /tasks/{id}
 * - DELETE /tasks/{id}
 */
@RestController
@RequestMapping("/tasks")
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "Tasks", description = "Per-user task management")
public class TaskController {

    private final TaskService taskService;
    private final TaskHubProperties.Pagination pagination;

    public TaskController(TaskService taskService, TaskHubProperties properties) {
        this.taskService = taskService;
        this.pagination = properties.getPagination();
    }

    /**
     * List the caller's tasks, oldest first
     * Returns 200 OK with data, meta and links
     */
    @GetMapping
    public ResponseEntity<PagedResponseDto<TaskResponseDto>> list(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestParam(value = "page", required = false) String page,
            @RequestParam(value = "page_size", required = false) String pageSize) {
        PageRequestParams params = PageRequestParams.of(page, pageSize, pagination);
        Slice<TaskResponseDto> tasks = taskService.list(principal, params);

        ServletUriComponentsBuilder current = ServletUriComponentsBuilder.fromCurrentRequest();
        return ResponseEntity.ok(PagedResponseDto.from(tasks, params,
                number -> current.cloneBuilder()
                        .replaceQueryParam("page", number)
                        .replaceQueryParam("page_size", params.pageSize())
                        .toUriString()));
    }

    /**
     * Create a task owned by the caller
     * Returns 201 Created
     */
    @PostMapping
    public ResponseEntity<DataResponseDto<TaskResponseDto>> create(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody CreateTaskRequestDto request) {
        TaskResponseDto task = taskService.create(principal, request);

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(DataResponseDto.of(task));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DataResponseDto<TaskResponseDto>> get(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable("id") Long id) {
        return ResponseEntity.ok(DataResponseDto.of(taskService.get(principal, id)));
    }

    /**
     * Change the state of a task the caller owns
     * Returns 200 OK
     */
    @PutMapping("/{id}")
    public ResponseEntity<DataResponseDto<TaskResponseDto>> update(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateTaskRequestDto request) {
        TaskResponseDto task = taskService.updateState(principal, id, request);
        return ResponseEntity.ok(new DataResponseDto<>("Task Updated", task));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponseDto> delete(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable("id") Long id) {
        taskService.delete(principal, id);
        return ResponseEntity.ok(new MessageResponseDto("Task deleted"));
    }
}
