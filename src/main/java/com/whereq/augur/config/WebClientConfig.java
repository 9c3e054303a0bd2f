package com.whereq.augur.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for the context broker
 *
 * @author WhereQ Inc.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient brokerWebClient(WebClient.Builder builder, AugurProperties properties) {
        AugurProperties.BrokerConfig broker = properties.getBroker();

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) broker.getRequestTimeout().toMillis())
            .responseTimeout(broker.getRequestTimeout());

        return builder
            .baseUrl(broker.getUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)) // 16MB
            .build();
    }
}
