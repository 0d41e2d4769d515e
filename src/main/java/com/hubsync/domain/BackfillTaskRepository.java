package com.hubsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface BackfillTaskRepository extends MongoRepository<BackfillTask, String> {

    List<BackfillTask> findByStatusOrderBySequenceAsc(BackfillTask.TaskStatus status);

    long countByNameAndStatusIn(String name, Collection<BackfillTask.TaskStatus> statuses);
}
