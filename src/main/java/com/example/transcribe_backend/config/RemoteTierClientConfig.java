package com.example.transcribe_backend.config;

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
@EnableConfigurationProperties(RemoteTierProperties.class)
public class RemoteTierClientConfig {

    @Bean("remoteTierWebClient")
    public WebClient remoteTierWebClient(RemoteTierProperties props) {
        var to = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(to)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 15_000)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler((int) to.getSeconds()))
                        .addHandlerLast(new WriteTimeoutHandler((int) to.getSeconds()))
                );

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies);
        // unconfigured tier: the client still exists, RemoteTierClient refuses to call it
        if (props.isConfigured()) {
            builder.baseUrl(props.getBaseUrl())
                    .defaultHeader("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return builder.build();
    }
}
