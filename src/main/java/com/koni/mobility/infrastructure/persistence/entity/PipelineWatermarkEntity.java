package com.koni.mobility.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity holding the watermark of each pipeline's last successful run.
 */
@Entity
@Table(name = "pipeline_watermarks")
@Getter
@Setter
@NoArgsConstructor
public class PipelineWatermarkEntity {

    @Id
    @Column(name = "pipeline")
    private String pipeline;

    @Column(name = "watermark", nullable = false)
    private Instant watermark;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public PipelineWatermarkEntity(String pipeline, Instant watermark) {
        this.pipeline = pipeline;
        this.watermark = watermark;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
