package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.application.port.LatestMeasurementsView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Refreshes the {@code latest_measurements} materialized view. CONCURRENTLY relies on
 * the view's unique index and lets readers keep querying during the refresh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcLatestMeasurementsView implements LatestMeasurementsView {

    static final String REFRESH_SQL = "REFRESH MATERIALIZED VIEW CONCURRENTLY latest_measurements";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void refresh() {
        long started = System.nanoTime();
        DataAccessFailures.translate("latest measurements refresh", () -> {
            jdbcTemplate.execute(REFRESH_SQL);
            return null;
        });
        log.debug("latest_measurements refreshed in {} ms", (System.nanoTime() - started) / 1_000_000);
    }
}
