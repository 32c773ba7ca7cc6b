package com.spreadpool.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadpool.config.PoolSettings;
import com.spreadpool.service.JobCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * JSON GET against the provider with the retry template applied. HTTP 5xx, 429, I/O errors and
 * unreadable bodies are transient; any other 4xx is permanent.
 */
class ProviderHttp {
    private static final Logger log = LoggerFactory.getLogger(ProviderHttp.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RetryTemplate retryTemplate;
    private final PoolSettings settings;

    ProviderHttp(RestTemplate restTemplate, ObjectMapper objectMapper, RetryTemplate retryTemplate, PoolSettings settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.retryTemplate = retryTemplate;
        this.settings = settings;
    }

    /**
     * @param what short label of the request for log and cancellation messages
     * @throws ProviderException permanent at once, transient once the attempts are spent
     * @throws JobCancelledException when the calling thread is interrupted during a backoff wait
     */
    JsonNode getJson(String url, String what) {
        try {
            return retryTemplate.execute(ctx -> {
                int attempt = ctx.getRetryCount() + 1;
                try {
                    return getOnce(url);
                } catch (ProviderException ex) {
                    if (ex.isTransient()) {
                        log.warn("GET {} failed (attempt {}/{}): {}", url, attempt, settings.getProviderMaxAttempts(), ex.getMessage());
                    }
                    throw ex;
                }
            }, ctx -> {
                Throwable t = ctx.getLastThrowable();
                if (!(t instanceof ProviderException)) {
                    throw (RuntimeException) t;
                }
                ProviderException last = (ProviderException) t;
                if (!last.isTransient()) throw last;
                log.error("GET {} ultimately failed after {} attempts: {}", url, ctx.getRetryCount(), last.getMessage());
                throw ProviderException.exhausted(ctx.getRetryCount(), last);
            });
        } catch (BackOffInterruptedException ex) {
            throw new JobCancelledException("Provider retry cancelled for " + what, ex);
        }
    }

    private JsonNode getOnce(String url) {
        if (Thread.currentThread().isInterrupted()) {
            throw new JobCancelledException("Cancelled before calling " + url, null);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, "spreadpool/1.0");
        ResponseEntity<String> entity;
        try {
            entity = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            if (status >= 500 || status == 429) {
                throw ProviderException.transientFailure("HTTP " + status, status, ex);
            }
            throw ProviderException.permanentFailure("HTTP " + status, status, ex);
        } catch (ResourceAccessException ex) {
            throw ProviderException.transientFailure("I/O error: " + ex.getMessage(), null, ex);
        } catch (RestClientException ex) {
            throw ProviderException.transientFailure(ex.getMessage(), null, ex);
        }
        String body = entity.getBody();
        if (body == null || body.isBlank()) {
            throw ProviderException.transientFailure("Empty response body", entity.getStatusCode().value(), null);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw ProviderException.transientFailure("Malformed JSON: " + ex.getOriginalMessage(), entity.getStatusCode().value(), ex);
        }
    }
}
