package kr.hhplus.be.reconciliation.infrastructure.pos;

import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class PosClientConfig {

    @Bean
    public RestClient posRestClient(RestClient.Builder builder, ReconciliationProperties properties) {
        ReconciliationProperties.Pos pos = properties.getPos();
        Duration timeout = Duration.ofSeconds(pos.getTimeoutSeconds());

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        return builder
                .baseUrl(pos.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + pos.getAuthToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
