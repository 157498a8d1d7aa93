package com.oekaki.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.oekaki.relay.config.AppProperties;
import com.oekaki.relay.dto.PreviewAsset;
import com.oekaki.relay.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Client for the Imgur-compatible preview host. Uploads take base64 image data and
 * return an asset id plus the delete token needed to remove it again.
 *
 * <p>Every call is bounded by {@code app.preview.response-timeout}; a timeout, a
 * network fault or a non-2xx answer all surface as {@link UpstreamException}.
 */
@Service
@Slf4j
public class PreviewHostClient {

    private static final Pattern DATA_URI_PREFIX = Pattern.compile("^data:image/(png|jpeg);base64,");

    private final WebClient webClient;
    private final AppProperties props;

    public PreviewHostClient(@Qualifier("previewWebClient") WebClient webClient, AppProperties props) {
        this.webClient = webClient;
        this.props = props;
    }

    public PreviewAsset upload(String imageData) {
        Map<String, Object> body = Map.of("image", stripDataUri(imageData));

        JsonNode resp = call("upload", webClient.post()
                .uri("/3/image")
                .header(HttpHeaders.AUTHORIZATION, authorization())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class));

        JsonNode data = resp == null ? null : resp.path("data");
        String assetId = textOf(data, "id");
        String deleteToken = textOf(data, "deletehash");
        if (!StringUtils.hasText(assetId) || !StringUtils.hasText(deleteToken)) {
            throw new UpstreamException("Preview host upload returned no asset id or delete token");
        }

        log.debug("Preview uploaded as {}", assetId);
        return new PreviewAsset(assetId, deleteToken);
    }

    public void delete(String deleteToken) {
        if (!StringUtils.hasText(deleteToken)) {
            log.warn("No preview delete token recorded, nothing to delete");
            return;
        }

        call("delete", webClient.delete()
                .uri("/3/image/{deleteHash}", deleteToken)
                .header(HttpHeaders.AUTHORIZATION, authorization())
                .retrieve()
                .toBodilessEntity());
    }

    static String stripDataUri(String imageData) {
        return DATA_URI_PREFIX.matcher(imageData).replaceFirst("");
    }

    private static String textOf(JsonNode node, String field) {
        if (node == null || !node.path(field).isTextual()) {
            return null;
        }
        return node.path(field).asText();
    }

    private String authorization() {
        return "Client-ID " + props.getPreview().getClientId();
    }

    private <T> T call(String op, Mono<T> request) {
        Duration timeout = props.getPreview().getResponseTimeout();
        try {
            return request.timeout(timeout).block();
        } catch (WebClientResponseException e) {
            log.error("Preview host {} failed: Status={}, Body={}", op, e.getStatusCode(), e.getResponseBodyAsString());
            throw new UpstreamException("Preview host " + op + " returned " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("Preview host {} failed", op, cause);
            throw new UpstreamException("Preview host " + op + " failed: " + cause.getMessage(), cause);
        }
    }
}
