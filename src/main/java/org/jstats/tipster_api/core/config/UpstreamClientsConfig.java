package org.jstats.tipster_api.core.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

@ConfigurationProperties(prefix = "tipster.upstream")
record UpstreamProperties(
        Endpoint models,
        Endpoint userService,
        Endpoint billing,
        String userAgent) {

    record Endpoint(
            String baseUrl,
            @DurationUnit(ChronoUnit.MILLIS) Duration connectTimeout,
            @DurationUnit(ChronoUnit.MILLIS) Duration readTimeout) {}
}

@Configuration
@EnableConfigurationProperties(UpstreamProperties.class)
public class UpstreamClientsConfig {

    private static final Logger log = LoggerFactory.getLogger(UpstreamClientsConfig.class);

    public static final String MODELS = "predictionModels";
    public static final String USER_SERVICE = "userService";
    public static final String BILLING = "billing";

    /**
     * Model endpoints are absolute URIs taken from the registry, so this client has no base URL.
     */
    @Bean(name = MODELS)
    RestClient predictionModelsRestClient(RestClient.Builder builder, UpstreamProperties p) {
        return build(builder, MODELS, null, p.models(), p.userAgent());
    }

    @Bean(name = USER_SERVICE)
    RestClient userServiceRestClient(RestClient.Builder builder, UpstreamProperties p) {
        return build(builder, USER_SERVICE, p.userService().baseUrl(), p.userService(), p.userAgent());
    }

    @Bean(name = BILLING)
    RestClient billingRestClient(RestClient.Builder builder, UpstreamProperties p) {
        return build(builder, BILLING, p.billing().baseUrl(), p.billing(), p.userAgent());
    }

    private static RestClient build(RestClient.Builder builder,
                                    String name,
                                    @Nullable String baseUrl,
                                    UpstreamProperties.@Nullable Endpoint endpoint,
                                    String userAgent) {
        // Connect timeout is configured on the underlying JDK HttpClient:
        var httpClientBuilder = HttpClient.newBuilder();
        if (endpoint != null && endpoint.connectTimeout() != null) {
            httpClientBuilder.connectTimeout(endpoint.connectTimeout());
        }
        final var factory = new JdkClientHttpRequestFactory(httpClientBuilder.build());
        // Read timeout applies per request; a timeout surfaces as ResourceAccessException
        if (endpoint != null && endpoint.readTimeout() != null) {
            factory.setReadTimeout(endpoint.readTimeout());
        }

        // RestClient.Builder is a prototype bean but mutable, so each client gets its own clone
        var b = builder.clone()
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(userAgent)) {
            b.defaultHeader(HttpHeaders.USER_AGENT, userAgent);
        }
        if (StringUtils.hasText(baseUrl)) {
            b.baseUrl(baseUrl);
        }
        log.info("Upstream client '{}' configured (baseUrl={}, connectTimeout={}, readTimeout={})",
                name, baseUrl,
                endpoint == null ? null : endpoint.connectTimeout(),
                endpoint == null ? null : endpoint.readTimeout());
        return b.build();
    }
}
