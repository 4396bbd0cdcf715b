package me.go_gradually.phonedesk.infrastructure.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    @Bean("webhookWebClient")
    public WebClient webhookWebClient(AppProperties properties) {
        // 웹훅 URL은 분류마다 다르므로 baseUrl 없이 절대 URL로 호출한다.
        return createWebClient(null, Duration.ofMillis(properties.getNotification().getTimeoutMs()));
    }

    @Bean("twilioWebClient")
    public WebClient twilioWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getTwilio().getBaseUrl(), Duration.ofSeconds(10));
    }

    private WebClient createWebClient(String baseUrl, Duration responseTimeout) {
        ConnectionProvider provider = createConnectionProvider();
        HttpClient httpClient = createHttpClient(provider, responseTimeout);
        ExchangeStrategies strategies = createExchangeStrategies();
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies);
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    private ConnectionProvider createConnectionProvider() {
        return ConnectionProvider.builder("phonedesk-http")
                .maxConnections(50)
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .build();
    }

    private HttpClient createHttpClient(ConnectionProvider provider, Duration responseTimeout) {
        return HttpClient.create(provider).responseTimeout(responseTimeout);
    }

    private ExchangeStrategies createExchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }
}
