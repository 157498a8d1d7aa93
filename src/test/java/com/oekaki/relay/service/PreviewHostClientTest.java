package com.oekaki.relay.service;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.oekaki.relay.config.AppProperties;
import com.oekaki.relay.config.PreviewHostConfig;
import com.oekaki.relay.dto.PreviewAsset;
import com.oekaki.relay.exception.UpstreamException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreviewHostClientTest {

    private WireMockServer server;
    private PreviewHostClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(wireMockConfig().dynamicPort());
        server.start();

        AppProperties props = new AppProperties();
        props.getPreview().setBaseUrl(server.baseUrl());
        props.getPreview().setClientId("client-123");
        props.getPreview().setConnectTimeout(Duration.ofSeconds(1));
        props.getPreview().setResponseTimeout(Duration.ofMillis(500));

        WebClient webClient = new PreviewHostConfig(props).previewWebClient(WebClient.builder());
        client = new PreviewHostClient(webClient, props);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Upload strips the data-URI prefix and returns id and delete token")
    void uploadReturnsAsset() {
        server.stubFor(post(urlEqualTo("/3/image"))
                .willReturn(okJson("{\"data\":{\"id\":\"abc123\",\"deletehash\":\"del456\"},\"success\":true,\"status\":200}")));

        PreviewAsset asset = client.upload("data:image/png;base64,iVBORw0KGgo=");

        assertThat(asset.getAssetId()).isEqualTo("abc123");
        assertThat(asset.getDeleteToken()).isEqualTo("del456");
        server.verify(postRequestedFor(urlEqualTo("/3/image"))
                .withHeader("Authorization", equalTo("Client-ID client-123"))
                .withRequestBody(equalToJson("{\"image\":\"iVBORw0KGgo=\"}")));
    }

    @Test
    void uploadErrorStatusIsUpstreamFailure() {
        server.stubFor(post(urlEqualTo("/3/image"))
                .willReturn(aResponse().withStatus(429).withBody("{\"data\":{\"error\":\"rate limited\"}}")));

        assertThatThrownBy(() -> client.upload("AAAA"))
                .isInstanceOf(UpstreamException.class)
                .extracting("reason").isEqualTo("internal server error");
    }

    @Test
    void uploadWithoutDeleteHashIsUpstreamFailure() {
        server.stubFor(post(urlEqualTo("/3/image"))
                .willReturn(okJson("{\"data\":{\"id\":\"abc123\",\"deletehash\":null}}")));

        assertThatThrownBy(() -> client.upload("AAAA")).isInstanceOf(UpstreamException.class);
    }

    @Test
    @DisplayName("A slow preview host is cut off by the response timeout")
    void slowHostTimesOut() {
        server.stubFor(post(urlEqualTo("/3/image"))
                .willReturn(okJson("{\"data\":{\"id\":\"a\",\"deletehash\":\"b\"}}").withFixedDelay(3000)));

        assertThatThrownBy(() -> client.upload("AAAA")).isInstanceOf(UpstreamException.class);
    }

    @Test
    void deleteUsesTheDeleteToken() {
        server.stubFor(delete(urlEqualTo("/3/image/del456")).willReturn(okJson("{\"success\":true}")));

        assertThatCode(() -> client.delete("del456")).doesNotThrowAnyException();

        server.verify(deleteRequestedFor(urlEqualTo("/3/image/del456"))
                .withHeader("Authorization", equalTo("Client-ID client-123")));
    }

    @Test
    @DisplayName("A drawing with no recorded delete token skips the remote delete")
    void blankDeleteTokenSendsNothing() {
        assertThatCode(() -> client.delete(null)).doesNotThrowAnyException();
        assertThatCode(() -> client.delete(" ")).doesNotThrowAnyException();

        server.verify(0, deleteRequestedFor(anyUrl()));
    }

    @Test
    void deleteFailureIsUpstreamFailure() {
        server.stubFor(delete(urlEqualTo("/3/image/gone")).willReturn(aResponse().withStatus(404)));

        assertThatThrownBy(() -> client.delete("gone")).isInstanceOf(UpstreamException.class);
    }

    @Test
    void unreachableHostIsUpstreamFailure() {
        server.stop();

        assertThatThrownBy(() -> client.upload("AAAA")).isInstanceOf(UpstreamException.class);
    }

    @Test
    void stripDataUriOnlyRemovesKnownPrefix() {
        assertThat(PreviewHostClient.stripDataUri("data:image/jpeg;base64,QUJD")).isEqualTo("QUJD");
        assertThat(PreviewHostClient.stripDataUri("QUJD")).isEqualTo("QUJD");
        assertThat(PreviewHostClient.stripDataUri("data:image/gif;base64,QUJD")).isEqualTo("data:image/gif;base64,QUJD");
    }
}
