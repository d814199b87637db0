package com.lumen.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for HTTP requests to the inference runtime.
 */
@Configuration
public class WebClientConfiguration {

    private final LumenProperties properties;

    public WebClientConfiguration(LumenProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient runtimeWebClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getRuntime().getTimeout());

        return WebClient.builder()
                .baseUrl(properties.getRuntime().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
