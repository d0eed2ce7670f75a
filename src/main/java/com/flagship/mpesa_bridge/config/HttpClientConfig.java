package com.flagship.mpesa_bridge.config;

import com.flagship.mpesa_bridge.audit.NotionProperties;
import com.flagship.mpesa_bridge.daraja.MpesaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Outbound HTTP clients. Every upstream call is bounded by connect and read timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClient darajaRestClient(RestClient.Builder builder, MpesaProperties properties) {
        return builder.clone()
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory(properties.getConnectTimeout(), properties.getReadTimeout()))
                .build();
    }

    @Bean
    public RestClient notionRestClient(RestClient.Builder builder, NotionProperties properties) {
        return builder.clone()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory(properties.getConnectTimeout(), properties.getReadTimeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
