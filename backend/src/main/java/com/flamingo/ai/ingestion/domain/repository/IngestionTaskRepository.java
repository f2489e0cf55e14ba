package com.flamingo.ai.ingestion.domain.repository;

import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.enums.TaskStatus;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for IngestionTask entities. */
@Repository
public interface IngestionTaskRepository extends JpaRepository<IngestionTask, String> {

  /** Finds an owner's tasks for one service, newest first. */
  List<IngestionTask> findByOwnerIdAndServiceOrderByCreatedAtDesc(
      String ownerId, SourceService service);

  /** Finds tasks in a status that have not been touched since the cutoff. */
  List<IngestionTask> findByStatusAndUpdatedAtBefore(TaskStatus status, LocalDateTime cutoff);
}
