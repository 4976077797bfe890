package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.domain.model.Measurement;
import com.koni.mobility.domain.repository.MeasurementRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC adapter for MeasurementRepository.
 *
 * Measurements bypass the persistence context: they are written as one parameterised
 * batch of {@code INSERT ... ON CONFLICT DO NOTHING} per call, which keeps writes
 * idempotent on the (datastream_id, timestamp) primary key.
 */
@Slf4j
@Component
public class JdbcMeasurementRepositoryAdapter implements MeasurementRepository {

    static final String INSERT_SQL =
            "INSERT INTO measurements (datastream_id, \"timestamp\", value, confidential) "
                    + "VALUES (:datastreamId, :timestamp, :value, :confidential) "
                    + "ON CONFLICT (datastream_id, \"timestamp\") DO NOTHING";

    static final String LATEST_SQL =
            "SELECT datastream_id, MAX(\"timestamp\") AS latest FROM measurements "
                    + "WHERE datastream_id IN (:ids) GROUP BY datastream_id";

    private static final int MAX_IDS_PER_QUERY = 10_000;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcMeasurementRepositoryAdapter(NamedParameterJdbcTemplate jdbcTemplate,
                                            PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Batch insert with {@code ON CONFLICT DO NOTHING} on (datastream_id, timestamp).
     *
     * @param measurements rows to write, already deduplicated by the caller
     * @return number of rows actually written; ignored conflicts are not counted
     * @throws com.koni.mobility.domain.exception.DatabaseUnavailableException if the store cannot be reached
     */
    @Override
    public int insertIgnoringConflicts(List<Measurement> measurements) {
        if (measurements.isEmpty()) {
            return 0;
        }
        SqlParameterSource[] batch = new SqlParameterSource[measurements.size()];
        for (int i = 0; i < measurements.size(); i++) {
            Measurement measurement = measurements.get(i);
            batch[i] = new MapSqlParameterSource()
                    .addValue("datastreamId", measurement.getDatastreamId())
                    .addValue("timestamp", OffsetDateTime.ofInstant(measurement.getTimestamp(), ZoneOffset.UTC))
                    .addValue("value", measurement.getValue())
                    .addValue("confidential", measurement.isConfidential());
        }
        int[] counts = DataAccessFailures.translate("measurement insert",
                () -> transactionTemplate.execute(status -> jdbcTemplate.batchUpdate(INSERT_SQL, batch)));
        int written = 0;
        for (int count : counts) {
            // drivers rewriting batches report SUCCESS_NO_INFO instead of a row count
            if (count > 0 || count == Statement.SUCCESS_NO_INFO) {
                written++;
            }
        }
        log.debug("Measurement batch inserted: rows={}, written={}", measurements.size(), written);
        return written;
    }

    @Override
    public Map<Long, Instant> findLatestTimestamps(Collection<Long> datastreamIds) {
        Map<Long, Instant> latest = new HashMap<>();
        List<Long> ids = new ArrayList<>(datastreamIds);
        for (int from = 0; from < ids.size(); from += MAX_IDS_PER_QUERY) {
            List<Long> chunk = ids.subList(from, Math.min(from + MAX_IDS_PER_QUERY, ids.size()));
            DataAccessFailures.translate("latest measurement lookup", () -> {
                jdbcTemplate.query(LATEST_SQL, new MapSqlParameterSource("ids", chunk), (RowCallbackHandler) rs ->
                        latest.put(rs.getLong("datastream_id"), rs.getObject("latest", OffsetDateTime.class).toInstant()));
                return null;
            });
        }
        return latest;
    }
}
