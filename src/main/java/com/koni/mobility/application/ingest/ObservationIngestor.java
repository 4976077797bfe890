package com.koni.mobility.application.ingest;

import com.koni.mobility.domain.exception.ValidationException;
import com.koni.mobility.domain.model.IngestResult;
import com.koni.mobility.domain.model.Measurement;
import com.koni.mobility.domain.model.Observation;
import com.koni.mobility.domain.repository.MeasurementRepository;
import com.koni.mobility.infrastructure.observability.IngestionMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Writes observations as measurements, idempotently.
 *
 * Responsibilities:
 * - Drop observations without datastream id or timestamp
 * - Coerce raw values to numbers, dropping what is not numeric
 * - Collapse observations sharing (datastreamId, timestamp); the last one wins
 * - Insert in sub-batches, leaving already stored keys untouched
 *
 * Ingesting the same batch twice writes nothing the second time.
 */
@Slf4j
@Service
public class ObservationIngestor {

    private final MeasurementRepository measurementRepository;
    private final IngestionMetrics metrics;
    private final int batchSize;

    public ObservationIngestor(MeasurementRepository measurementRepository,
                               IngestionMetrics metrics,
                               @Value("${mobility.ingestion.batch-size:10000}") int batchSize) {
        this.measurementRepository = measurementRepository;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    /**
     * Ingests a batch of observations.
     *
     * @param observations observations with internal datastream ids
     * @return how many rows were written and why the others were not
     * @throws com.koni.mobility.domain.exception.DatabaseUnavailableException if the store fails; sub-batches
     *         committed before the failure stay written
     */
    @Observed(name = "ingestor.ingest", contextualName = "ingest-observations")
    public IngestResult ingest(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            return IngestResult.empty();
        }

        int malformed = 0;
        int nonNumeric = 0;
        int numeric = 0;
        Set<Measurement> latest = new LinkedHashSet<>();
        for (Observation observation : observations) {
            try {
                observation.validate();
            } catch (ValidationException e) {
                malformed++;
                log.warn("Dropping malformed observation: {}: observation={}", e.getMessage(), observation);
                continue;
            }
            OptionalDouble value = ValueCoercer.toDouble(observation.getRawValue());
            if (value.isEmpty()) {
                nonNumeric++;
                log.debug("Dropping non-numeric value: datastreamId={}, timestamp={}, value={}",
                        observation.getDatastreamId(), observation.getTimestamp(), observation.getRawValue());
                continue;
            }
            numeric++;
            Measurement measurement = new Measurement(observation.getDatastreamId(), observation.getTimestamp(),
                    value.getAsDouble(), observation.isConfidential());
            // equality is the natural key, so this replaces an earlier occurrence
            latest.remove(measurement);
            latest.add(measurement);
        }

        List<Measurement> rows = new ArrayList<>(latest);
        int written = 0;
        for (int from = 0; from < rows.size(); from += batchSize) {
            List<Measurement> chunk = rows.subList(from, Math.min(from + batchSize, rows.size()));
            written += measurementRepository.insertIgnoringConflicts(chunk);
        }

        int duplicates = (numeric - rows.size()) + (rows.size() - written);
        IngestResult result = new IngestResult(written, nonNumeric, duplicates, malformed);
        metrics.recordIngestResult(result);
        log.info("Observations ingested: received={}, written={}, skippedNonNumeric={}, skippedDuplicate={}, skippedMalformed={}",
                observations.size(), written, nonNumeric, duplicates, malformed);
        return result;
    }
}
