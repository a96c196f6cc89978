package com.apimonitor.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.client.support.BasicAuthenticationInterceptor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * HTTP clients for the telemetry store and the alert channels, each with its own connect/read timeout.
 */
@Configuration
public class HttpClientConfig {

    @Bean(name = "storeRestTemplate")
    public RestTemplate storeRestTemplate(DetectorProperties properties) {
        DetectorProperties.Store store = properties.store();
        RestTemplate restTemplate = new RestTemplate(requestFactory(store.timeout()));
        if (store.hasCredentials()) {
            restTemplate.getInterceptors().add(new BasicAuthenticationInterceptor(store.username(), store.password()));
        }
        return restTemplate;
    }

    @Bean(name = "alertRestTemplate")
    public RestTemplate alertRestTemplate(DetectorProperties properties) {
        return new RestTemplate(requestFactory(properties.alerting().timeout()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
