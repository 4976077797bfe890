package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.domain.repository.PipelineWatermarkRepository;
import com.koni.mobility.infrastructure.persistence.entity.PipelineWatermarkEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;

/**
 * JPA adapter for PipelineWatermarkRepository.
 */
@Slf4j
@Component
public class JpaPipelineWatermarkRepositoryAdapter implements PipelineWatermarkRepository {

    private final PipelineWatermarkJpaRepository jpaRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaPipelineWatermarkRepositoryAdapter(PipelineWatermarkJpaRepository jpaRepository,
                                                 PlatformTransactionManager transactionManager) {
        this.jpaRepository = jpaRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<Instant> findWatermark(String pipeline) {
        return DataAccessFailures.translate("watermark lookup", () ->
                jpaRepository.findById(pipeline).map(PipelineWatermarkEntity::getWatermark));
    }

    /**
     * Creates or moves the watermark of a pipeline.
     */
    @Override
    public void saveWatermark(String pipeline, Instant watermark) {
        DataAccessFailures.translate("watermark update", () -> transactionTemplate.execute(status -> {
            PipelineWatermarkEntity entity = jpaRepository.findById(pipeline)
                    .orElseGet(() -> new PipelineWatermarkEntity(pipeline, watermark));
            entity.setWatermark(watermark);
            return jpaRepository.save(entity);
        }));
        log.debug("Watermark saved: pipeline={}, watermark={}", pipeline, watermark);
    }
}
