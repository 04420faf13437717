package com.nectarstudio.realtime.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last successfully delivered watermark of a polling job.
 * Keyed by the canonical job key so a restarted service resumes where it stopped.
 */
@Data
@Entity
@NoArgsConstructor
@Table(name = "job_cursor")
public class JobCursor {

    @Id
    @Column(length = 1024)
    private String jobKey;

    private String serviceName;
    private String entityName;
    private String watermarkColumn;

    private Instant cursorValue; // UTC, already clock-skew adjusted
    private Instant updatedAt;

    public JobCursor(String jobKey, String serviceName, String entityName, String watermarkColumn) {
        this.jobKey = jobKey;
        this.serviceName = serviceName;
        this.entityName = entityName;
        this.watermarkColumn = watermarkColumn;
    }
}
