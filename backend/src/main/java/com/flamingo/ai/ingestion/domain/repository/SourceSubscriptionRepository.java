package com.flamingo.ai.ingestion.domain.repository;

import com.flamingo.ai.ingestion.domain.entity.SourceSubscription;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for SourceSubscription entities. */
@Repository
public interface SourceSubscriptionRepository extends JpaRepository<SourceSubscription, UUID> {

  List<SourceSubscription> findByEnabledTrue();
}
