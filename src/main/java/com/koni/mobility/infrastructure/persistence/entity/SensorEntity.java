package com.koni.mobility.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the sensors table. Uniqueness of (source, ex_id) for known external ids
 * is a partial unique index declared in schema.sql.
 */
@Entity
@Table(
    name = "sensors",
    indexes = {
        @Index(name = "idx_sensors_source_ex_id", columnList = "source, ex_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SensorEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ex_id", nullable = false)
    private String externalId;

    @Column(name = "source", nullable = false)
    private String source;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "geometry", columnDefinition = "TEXT")
    private String geometry;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "confidential", nullable = false)
    private boolean confidential;
}
