package com.chatguard.moderation.engine.reputation;

import com.chatguard.moderation.config.ReputationConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * URL reputation over the VirusTotal v3 REST API. The URL identifier is the
 * unpadded URL-safe base64 of the URL itself.
 */
@Component
public class HttpReputationClient implements ReputationClient {

    private static final Logger log = LoggerFactory.getLogger(HttpReputationClient.class);

    private final RestTemplate restTemplate;
    private final ReputationConfig config;

    public HttpReputationClient(RestTemplateBuilder restTemplateBuilder, ReputationConfig config) {
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        this.config = config;
    }

    @Override
    public ReputationVerdict lookup(String url) {
        String id = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(url.getBytes(StandardCharsets.UTF_8));

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("x-apikey", config.getApiKey());

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    config.getBaseUrl() + "/urls/{id}",
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    JsonNode.class,
                    id);

            JsonNode body = response.getBody();
            if (body == null) {
                throw new ReputationLookupException("Empty reputation response for " + url);
            }
            JsonNode stats = body.path("data").path("attributes").path("last_analysis_stats");
            return new ReputationVerdict(url,
                    stats.path("malicious").asInt(0),
                    stats.path("suspicious").asInt(0),
                    true);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("URL {} unknown to reputation provider", url);
            return ReputationVerdict.unknown(url);
        } catch (RestClientException e) {
            throw new ReputationLookupException("Reputation lookup failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
