package com.example.trackscribe.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(AsrProperties.class)
public class AsrClientConfig {

    @Bean("asrWebClient")
    public WebClient asrWebClient(AsrProperties props) {
        var to = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        int toSec = (int) to.getSeconds();

        // aligned results with char timings get large
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(to)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 15_000)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(toSec))
                        .addHandlerLast(new WriteTimeoutHandler(toSec))
                );

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .build();
    }
}
