package com.netintel.wigle.config;

import com.netintel.wigle.service.CredentialProvider;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client and retry policy for the WiGLE API.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RestClientConfig {

    public static final String RETRY_NAME = "wigleApi";

    private final WigleExporterProperties properties;

    @Bean
    public RestTemplate wigleRestTemplate(RestTemplateBuilder builder, CredentialProvider credentialProvider) {
        WigleExporterProperties.Api api = properties.getApi();
        return builder
                .setConnectTimeout(Duration.ofMillis(api.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(api.getReadTimeoutMs()))
                .defaultHeader(HttpHeaders.USER_AGENT, api.getUserAgent())
                .additionalInterceptors(credentialInterceptor(credentialProvider))
                .build();
    }

    /**
     * Retry instance configured under resilience4j.retry.instances.wigleApi.
     */
    @Bean
    public Retry wigleApiRetry(RetryRegistry registry) {
        Retry retry = registry.retry(RETRY_NAME);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying WiGLE call (attempt {}) after: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    /**
     * Attaches HTTP Basic credentials to every request, looked up at call time.
     */
    public static ClientHttpRequestInterceptor credentialInterceptor(CredentialProvider credentialProvider) {
        return (request, body, execution) -> {
            credentialProvider.credentials().ifPresent(c ->
                    request.getHeaders().setBasicAuth(c.name(), c.token()));
            return execution.execute(request, body);
        };
    }
}
