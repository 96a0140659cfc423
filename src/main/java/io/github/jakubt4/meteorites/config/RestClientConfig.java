package io.github.jakubt4.meteorites.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Bounds every outbound HTTP exchange. The JDK client aborts an exchange when its
 * calling thread is interrupted, which is how per-call deadlines in
 * {@link io.github.jakubt4.meteorites.client.NasaMeteoriteClient} cancel a request.
 */
@Configuration
public class RestClientConfig {

    @Bean
    RestClientCustomizer restClientCustomizer(
            @Value("${explorer.source.connect-timeout:5s}") final Duration connectTimeout,
            @Value("${explorer.source.read-timeout:60s}") final Duration readTimeout) {
        return builder -> {
            final var httpClient = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout)
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
            final var requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory);
        };
    }
}
