package com.taskhub.api.domain.service;

import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.infrastructure.entity.TaskEntity;
import org.springframework.stereotype.Component;

/**
 * Ownership rule for tasks: only the user who created a task may see or change it.
 */
@Component
public class TaskAccessPolicy {

    public boolean canAct(AuthenticatedUser user, TaskEntity task) {
        return user != null
                && task != null
                && task.getOwnerId() != null
                && task.getOwnerId().equals(user.id());
    }
}
