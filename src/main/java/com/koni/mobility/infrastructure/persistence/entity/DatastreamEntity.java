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
 * JPA entity for the datastreams table.
 */
@Entity
@Table(
    name = "datastreams",
    indexes = {
        @Index(name = "idx_datastreams_sensor_id", columnList = "sensor_id"),
        @Index(name = "idx_datastreams_ex_id", columnList = "ex_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DatastreamEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ex_id", nullable = false)
    private String externalId;

    @Column(name = "sensor_id", nullable = false)
    private Long sensorId;

    @Column(name = "type", nullable = false)
    private String type;

    @Column(name = "unit", nullable = false)
    private String unit;

    @Column(name = "confidential", nullable = false)
    private boolean confidential;
}
