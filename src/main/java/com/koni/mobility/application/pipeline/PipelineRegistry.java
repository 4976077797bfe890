package com.koni.mobility.application.pipeline;

import com.koni.mobility.domain.exception.PipelineNotFoundException;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds one {@link IngestionPipeline} per source adapter, configured from
 * {@code mobility.pipelines.<adapter name>}.
 */
@Slf4j
@Component
public class PipelineRegistry {

    private final Map<String, IngestionPipeline> pipelines = new LinkedHashMap<>();

    public PipelineRegistry(List<SourceAdapter> adapters, MobilityProperties properties, PipelineServices services) {
        for (SourceAdapter adapter : adapters) {
            MobilityProperties.Pipeline settings = properties.getPipelines().get(adapter.name());
            if (settings == null) {
                log.info("No configuration for pipeline, using defaults: pipeline={}", adapter.name());
                settings = new MobilityProperties.Pipeline();
            }
            if (pipelines.putIfAbsent(adapter.name(), new IngestionPipeline(adapter, settings, services)) != null) {
                throw new IllegalStateException("Two source adapters are named '" + adapter.name() + "'");
            }
            log.info("Pipeline registered: pipeline={}, source={}, enabled={}, interval={}",
                    adapter.name(), adapter.source(), settings.isEnabled(), settings.getInterval());
        }
    }

    /**
     * Every registered pipeline in adapter order, disabled ones included.
     */
    public Collection<IngestionPipeline> all() {
        return Collections.unmodifiableCollection(pipelines.values());
    }

    /**
     * Pipelines the scheduler drives. Pipelines without a {@code mobility.pipelines}
     * entry run on defaults and are enabled.
     */
    public List<IngestionPipeline> enabled() {
        return pipelines.values().stream()
                .filter(IngestionPipeline::isEnabled)
                .collect(Collectors.toList());
    }

    /**
     * Looks up a pipeline by name, which equals its source adapter name.
     *
     * @param name pipeline name, e.g. {@code frost}
     * @return the pipeline
     * @throws PipelineNotFoundException if no pipeline has this name
     */
    public IngestionPipeline get(String name) {
        IngestionPipeline pipeline = pipelines.get(name);
        if (pipeline == null) {
            throw new PipelineNotFoundException("Unknown pipeline: " + name);
        }
        return pipeline;
    }
}
