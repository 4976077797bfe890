package com.koni.mobility.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.time.Instant;

/**
 * JPA mapping of the measurements table. Rows are written through JDBC batches by
 * {@code JdbcMeasurementRepositoryAdapter}; the mapping keeps the schema in one place
 * for schema generation.
 */
@Entity
@Table(name = "measurements")
@IdClass(MeasurementEntity.Key.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementEntity {

    @Id
    @Column(name = "datastream_id")
    private Long datastreamId;

    @Id
    @Column(name = "\"timestamp\"")
    private Instant timestamp;

    @Column(name = "value", nullable = false)
    private double value;

    @Column(name = "confidential", nullable = false)
    private boolean confidential;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private Long datastreamId;
        private Instant timestamp;
    }
}
