package com.trackflow.repository;

import com.trackflow.model.PromotionAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PromotionAuditRepository extends JpaRepository<PromotionAuditEntry, Long> {

    List<PromotionAuditEntry> findByTrackIdOrderByRecordedAtDesc(String trackId);
}
