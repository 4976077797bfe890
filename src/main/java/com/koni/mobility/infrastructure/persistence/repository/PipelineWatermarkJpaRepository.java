package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.infrastructure.persistence.entity.PipelineWatermarkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PipelineWatermarkJpaRepository extends JpaRepository<PipelineWatermarkEntity, String> {
}
