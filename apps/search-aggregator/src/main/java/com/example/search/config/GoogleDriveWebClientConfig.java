package com.example.search.config;

import com.example.search.config.properties.SourcesProperties;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * WebClient for the Google Drive v3 REST API.
 * The bearer token is per caller, so it is set on each request by the adapter rather than by a filter here.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.sources.gdrive", name = "mode", havingValue = "live")
public class GoogleDriveWebClientConfig {

    /**
     * Bean qualifier for the Drive WebClient.
     */
    public static final String GDRIVE_WEBCLIENT = "googleDriveWebClient";

    @Bean
    @Qualifier(GDRIVE_WEBCLIENT)
    public WebClient googleDriveWebClient(
            WebClient.Builder webClientBuilder,
            SourcesProperties sourcesProperties) {

        var gdrive = sourcesProperties.gdrive();

        ConnectionProvider connectionProvider = ConnectionProvider.builder("gdrive-pool")
                .maxConnections(50)
                .pendingAcquireMaxCount(250)
                .pendingAcquireTimeout(Duration.ofSeconds(10))
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3000)
                .responseTimeout(gdrive.timeout())
                .keepAlive(true);

        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(gdrive.baseUrl())
                // Exported documents can exceed the 256 KB default
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }
}
