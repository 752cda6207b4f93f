package com.scosim.simulator.service.event;

import com.scosim.simulator.model.EventKind;
import com.scosim.simulator.model.dto.EventBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;

/**
 * Posts one event to the external API. Never retries and never throws.
 */
public class EventApiClient {

    private static final Logger logger = LoggerFactory.getLogger(EventApiClient.class);

    private final RestTemplate restTemplate;
    private final String apiUrl;
    private final String deviceId;

    public EventApiClient(RestTemplate restTemplate, String apiUrl, String deviceId) {
        this.restTemplate = restTemplate;
        this.apiUrl = stripTrailingSlash(apiUrl);
        this.deviceId = deviceId;
    }

    public String urlFor(EventKind kind) {
        return apiUrl + kind.path(deviceId);
    }

    public DispatchOutcome post(EventKind kind, EventBody body) {
        String url = urlFor(kind);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            logger.debug("Sent {} to {}", kind, url);
            return DispatchOutcome.SENT;
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                logger.warn("Request timeout for {}: {}", kind, url);
                return DispatchOutcome.TIMEOUT;
            }
            logger.error("Request error for {}: {}", kind, e.getMessage());
            return DispatchOutcome.TRANSPORT_ERROR;
        } catch (RestClientResponseException e) {
            logger.error("API rejected {}: HTTP {} {}", kind, e.getStatusCode().value(), e.getStatusText());
            return DispatchOutcome.REJECTED;
        } catch (RestClientException e) {
            logger.error("Request error for {}: {}", kind, e.getMessage());
            return DispatchOutcome.TRANSPORT_ERROR;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
