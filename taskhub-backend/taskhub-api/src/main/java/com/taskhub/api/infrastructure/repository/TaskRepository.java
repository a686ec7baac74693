package com.taskhub.api.infrastructure.repository;

import com.taskhub.api.infrastructure.entity.TaskEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaskRepository extends JpaRepository<TaskEntity, Long> {

    /**
     * Owner-scoped listing. Returning a Slice fetches one extra row instead of running a count query.
     * The underscore pins the path to {@code owner.id}; {@code TaskEntity#getOwnerId} would otherwise shadow it.
     */
    Slice<TaskEntity> findByOwner_Id(Long ownerId, Pageable pageable);
}
