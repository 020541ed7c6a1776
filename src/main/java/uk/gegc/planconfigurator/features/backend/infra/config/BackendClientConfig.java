package uk.gegc.planconfigurator.features.backend.infra.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import uk.gegc.planconfigurator.features.backend.application.BackendProperties;

import java.net.http.HttpClient;
import java.time.Duration;

@Slf4j
@Configuration
public class BackendClientConfig {

    @Bean(name = "backendRestClient")
    public RestClient backendRestClient(RestClient.Builder builder, BackendProperties properties) {
        log.info("Backend client configured - baseUrl: {}, connectTimeout: {}ms, readTimeout: {}ms, maxRetries: {}",
                properties.getBaseUrl(), properties.getConnectTimeoutMs(), properties.getReadTimeoutMs(),
                properties.getRetry().getMaxRetries());
        return createRestClient(builder, properties);
    }

    public static RestClient createRestClient(RestClient.Builder builder, BackendProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()));

        return builder
                .requestFactory(requestFactory)
                .build();
    }
}
