package com.koni.mobility.application.pipeline;

import com.koni.mobility.domain.model.ExternalId;
import lombok.Getter;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * What a source adapter may know about the run it fetches for.
 */
public class FetchContext {

    @Getter
    private final FetchWindow window;
    @Getter
    private final Instant defaultStart;
    private final Function<Collection<ExternalId>, Map<ExternalId, Instant>> latestTimestamps;

    public FetchContext(FetchWindow window, Instant defaultStart,
                        Function<Collection<ExternalId>, Map<ExternalId, Instant>> latestTimestamps) {
        this.window = window;
        this.defaultStart = defaultStart;
        this.latestTimestamps = latestTimestamps;
    }

    /**
     * Per-datastream fetch start: the latest stored measurement timestamp, or the
     * configured default start for datastreams without measurements. One bulk lookup.
     */
    public Map<ExternalId, Instant> datastreamStarts(Collection<ExternalId> datastreamExternalIds) {
        Map<ExternalId, Instant> latest = latestTimestamps.apply(datastreamExternalIds);
        Map<ExternalId, Instant> starts = new LinkedHashMap<>();
        for (ExternalId externalId : datastreamExternalIds) {
            starts.put(externalId, latest.getOrDefault(externalId, defaultStart));
        }
        return starts;
    }
}
