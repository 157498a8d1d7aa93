package com.oekaki.relay.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/** WebClient used for the preview host; every call is bounded by the configured timeouts. */
@Configuration
@RequiredArgsConstructor
public class PreviewHostConfig {

    private final AppProperties props;

    @Bean
    public WebClient previewWebClient(WebClient.Builder builder) {
        AppProperties.Preview preview = props.getPreview();
        long responseMillis = preview.getResponseTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(preview.getResponseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) preview.getConnectTimeout().toMillis())
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(responseMillis, TimeUnit.MILLISECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(responseMillis, TimeUnit.MILLISECONDS)));

        return builder
                .baseUrl(preview.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
