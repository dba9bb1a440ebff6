package com.trackflow.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "promotion_audit")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromotionAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "track_id", nullable = false, length = 64)
    private String trackId;

    @Column(name = "source_environment", nullable = false, length = 32)
    private String sourceEnvironment;

    @Column(name = "target_environment", nullable = false, length = 32)
    private String targetEnvironment;

    @Column(nullable = false)
    private Boolean success;

    @Column(name = "files_copied", nullable = false)
    private Integer filesCopied;

    @Column(name = "record_created", nullable = false)
    private Boolean recordCreated;

    @Column(name = "failure_kind", length = 32)
    private String failureKind;

    @Column(length = 2000)
    private String error;

    @Column(name = "promotion_date")
    private Instant promotionDate;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) {
            recordedAt = Instant.now();
        }
    }
}
