package com.taskhub.api.domain.service;

import com.taskhub.api.api.dto.CreateTaskRequestDto;
import com.taskhub.api.api.dto.TaskResponseDto;
import com.taskhub.api.api.dto.UpdateTaskRequestDto;
import com.taskhub.api.domain.exception.TaskAccessDeniedException;
import com.taskhub.api.domain.exception.TaskNotFoundException;
import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.model.PageRequestParams;
import com.taskhub.api.infrastructure.entity.TaskEntity;
import com.taskhub.api.infrastructure.repository.TaskRepository;
import com.taskhub.api.infrastructure.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

import static com.taskhub.api.domain.constants.AuthConstants.DEFAULT_TASK_STATE;

/**
 * Task Service - Owner-scoped task CRUD
 *
 * Lookups by id distinguish a missing task (404) from a task owned by someone else (403).
 * Listing filters by owner in the query itself.
 */
@Service
@Slf4j
public class TaskService {

    private final TaskRepository taskRepository;
    private final UserRepository userRepository;
    private final TaskAccessPolicy accessPolicy;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository,
                       UserRepository userRepository,
                       TaskAccessPolicy accessPolicy,
                       Clock clock) {
        this.taskRepository = taskRepository;
        this.userRepository = userRepository;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Slice<TaskResponseDto> list(AuthenticatedUser principal, PageRequestParams page) {
        Slice<TaskEntity> tasks = taskRepository.findByOwner_Id(principal.id(), page.toPageable());
        log.debug("[TASK_LIST] Listed tasks | userId={} | page={} | size={} | returned={} | hasMore={}",
                principal.id(), page.page(), page.pageSize(), tasks.getNumberOfElements(), tasks.hasNext());
        return tasks.map(TaskResponseDto::from);
    }

    /**
     * Create a task owned by the caller, in the default "active" state.
     */
    @Transactional
    public TaskResponseDto create(AuthenticatedUser principal, CreateTaskRequestDto request) {
        Instant now = clock.instant();
        TaskEntity task = new TaskEntity();
        task.setName(request.getName());
        task.setState(DEFAULT_TASK_STATE);
        task.setOwner(userRepository.getReferenceById(principal.id()));
        task.setCreatedAt(now);
        task.setUpdatedAt(now);

        TaskEntity saved = taskRepository.save(task);
        log.info("[TASK_CREATED] Task created | userId={} | taskId={}", principal.id(), saved.getId());
        return TaskResponseDto.from(saved);
    }

    @Transactional(readOnly = true)
    public TaskResponseDto get(AuthenticatedUser principal, Long taskId) {
        return TaskResponseDto.from(loadAuthorized(principal, taskId, "view"));
    }

    @Transactional
    public TaskResponseDto updateState(AuthenticatedUser principal, Long taskId, UpdateTaskRequestDto request) {
        TaskEntity task = loadAuthorized(principal, taskId, "update");
        String previousState = task.getState();
        task.setState(request.getState());
        task.setUpdatedAt(clock.instant());

        TaskEntity saved = taskRepository.save(task);
        log.info("[TASK_UPDATED] Task state changed | userId={} | taskId={} | from={} | to={}",
                principal.id(), taskId, previousState, saved.getState());
        return TaskResponseDto.from(saved);
    }

    /**
     * Hard delete; there is no undo.
     */
    @Transactional
    public void delete(AuthenticatedUser principal, Long taskId) {
        TaskEntity task = loadAuthorized(principal, taskId, "delete");
        taskRepository.delete(task);
        log.info("[TASK_DELETED] Task deleted | userId={} | taskId={}", principal.id(), taskId);
    }

    private TaskEntity loadAuthorized(AuthenticatedUser principal, Long taskId, String action) {
        TaskEntity task = taskRepository.findById(taskId)
                .orElseThrow(() -> {
                    log.debug("[TASK_NOT_FOUND] No task with id | userId={} | taskId={}", principal.id(), taskId);
                    return new TaskNotFoundException(taskId);
                });

        if (!accessPolicy.canAct(principal, task)) {
            log.warn("[TASK_FORBIDDEN] Non-owner attempted {} | userId={} | taskId={} | ownerId={}",
                    action, principal.id(), taskId, task.getOwnerId());
            throw new TaskAccessDeniedException("This action is unauthorized.");
        }
        return task;
    }
}
