package com.koni.mobility.application.pipeline;

import com.koni.mobility.application.reconcile.CategoryMapping;
import com.koni.mobility.domain.exception.MalformedPayloadException;
import com.koni.mobility.domain.exception.SourceUnavailableException;

/**
 * Port implemented once per external source. An adapter fetches and normalizes; it never
 * touches the store except through the watermark lookup offered by {@link FetchContext}.
 */
public interface SourceAdapter {

    /**
     * Pipeline name, also the key of the pipeline's configuration block.
     */
    String name();

    /**
     * Namespace of the external ids this adapter produces.
     */
    String source();

    CategoryMapping categoryMapping();

    /**
     * Fetches everything new within the context's window.
     *
     * @throws SourceUnavailableException on transient failures; the pipeline retries
     * @throws MalformedPayloadException when the source answers with something undecodable
     */
    SourceBatch fetch(FetchContext context);
}
