package com.koni.mobility.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.koni.mobility.domain.exception.MalformedPayloadException;
import com.koni.mobility.domain.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.Charset;
import java.util.List;

/**
 * JSON GET requests against external sources, with failures classified for the pipeline:
 * IO errors, timeouts, 5xx and 429 become {@link SourceUnavailableException}; other
 * client errors and undecodable bodies become {@link MalformedPayloadException}.
 */
@Slf4j
@Component
public class SourceHttpClient {

    private final RestTemplate restTemplate;

    public SourceHttpClient(RestTemplate sourceRestTemplate) {
        this.restTemplate = sourceRestTemplate;
    }

    public JsonNode getJson(String source, URI uri) {
        return getJson(source, uri, new HttpHeaders());
    }

    public JsonNode getJson(String source, URI uri, HttpHeaders headers) {
        HttpHeaders requestHeaders = new HttpHeaders();
        requestHeaders.addAll(headers);
        requestHeaders.setAccept(List.of(MediaType.APPLICATION_JSON));
        JsonNode body = exchange(source, uri, requestHeaders, JsonNode.class);
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new MalformedPayloadException("Empty response from " + source + ": " + uri);
        }
        return body;
    }

    /**
     * Fetches a plain text document such as a CSV export, decoded with the given charset
     * regardless of what the server declares.
     */
    public String getText(String source, URI uri, Charset charset) {
        HttpHeaders requestHeaders = new HttpHeaders();
        requestHeaders.setAccept(List.of(MediaType.TEXT_PLAIN, MediaType.ALL));
        byte[] body = exchange(source, uri, requestHeaders, byte[].class);
        if (body == null || body.length == 0) {
            throw new MalformedPayloadException("Empty response from " + source + ": " + uri);
        }
        return new String(body, charset);
    }

    private <T> T exchange(String source, URI uri, HttpHeaders headers, Class<T> bodyType) {
        log.debug("GET {}: source={}", uri, source);
        try {
            ResponseEntity<T> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), bodyType);
            return response.getBody();
        } catch (HttpServerErrorException e) {
            throw new SourceUnavailableException(source, source + " answered " + e.getStatusCode() + " for " + uri, e);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)) {
                throw new SourceUnavailableException(source, source + " is rate limiting requests: " + uri, e);
            }
            throw new MalformedPayloadException(source + " rejected request with " + e.getStatusCode() + ": " + uri, e);
        } catch (ResourceAccessException e) {
            throw new SourceUnavailableException(source, source + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new MalformedPayloadException("Undecodable response from " + source + ": " + uri, e);
        }
    }
}
