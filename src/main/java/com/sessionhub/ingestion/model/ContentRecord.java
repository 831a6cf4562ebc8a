package com.sessionhub.ingestion.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A session created from one row of a bulk upload, with its linked assets.
 */
@Entity
@Table(name = "content_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "session_id", nullable = false, columnDefinition = "TEXT")
    private String sessionId;

    @Column(name = "status", columnDefinition = "TEXT")
    private String status;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "track", columnDefinition = "TEXT")
    private String track;

    @Column(name = "session_type", columnDefinition = "TEXT")
    private String sessionType;

    @Column(name = "learning_level", columnDefinition = "TEXT")
    private String learningLevel;

    @Column(name = "topic", columnDefinition = "TEXT")
    private String topic;

    @Column(name = "industry", columnDefinition = "TEXT")
    private String industry;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "topics", columnDefinition = "jsonb")
    private List<String> topics;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", columnDefinition = "jsonb")
    private List<String> tags;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "job_roles", columnDefinition = "jsonb")
    private List<String> jobRoles;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "areas_of_interest", columnDefinition = "jsonb")
    private List<String> areasOfInterest;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "presenters", columnDefinition = "jsonb")
    private List<Presenter> presenters;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "file_urls", columnDefinition = "jsonb")
    private List<AssetEntry> fileUrls = new ArrayList<>();

    // Legacy convenience fields kept in sync with the two deck slots.
    @Column(name = "presentation_slides_url", columnDefinition = "TEXT")
    private String presentationSlidesUrl;

    @Column(name = "recap_slides_url", columnDefinition = "TEXT")
    private String recapSlidesUrl;

    @Column(name = "drive_link", columnDefinition = "TEXT")
    private String driveLink;

    @Column(name = "video_youtube_url", columnDefinition = "TEXT")
    private String videoYoutubeUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @Column(name = "batch_job_id")
    private UUID batchJobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_state", nullable = false)
    private ProcessingState processingState;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (processingState == null) {
            processingState = ProcessingState.INGESTED;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
