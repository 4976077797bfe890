package com.koni.mobility.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared infrastructure beans: configuration properties, the clock and the HTTP client
 * used by the source adapters.
 */
@Configuration
@EnableConfigurationProperties(MobilityProperties.class)
public class ApplicationConfiguration {

    /**
     * UTC clock for fetch windows and timestamps. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Creates the RestTemplate shared by all source adapters, with the connect and
     * read timeouts from {@code mobility.sources.http}.
     *
     * @param builder Boot's builder, carrying the auto-configured message converters
     * @param properties mobility settings
     * @return RestTemplate for source fetches
     */
    @Bean
    public RestTemplate sourceRestTemplate(RestTemplateBuilder builder, MobilityProperties properties) {
        MobilityProperties.Http http = properties.getSources().getHttp();
        return builder
                .setConnectTimeout(http.getConnectTimeout())
                .setReadTimeout(http.getReadTimeout())
                .build();
    }
}
