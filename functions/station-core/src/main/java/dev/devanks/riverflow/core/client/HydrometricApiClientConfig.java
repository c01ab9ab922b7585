package dev.devanks.riverflow.core.client;

import dev.devanks.riverflow.core.config.StationsProperties;
import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.ACCEPT;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Feign customisation for {@link HydrometricApiClient}. Not a @Configuration on purpose:
 * it is only applied to that client.
 */
@RequiredArgsConstructor
@Slf4j
public class HydrometricApiClientConfig {

    private final StationsProperties stationsProperties;

    @Bean
    public RequestInterceptor hydrometricHeadersInterceptor() {
        return template -> {
            log.debug("Adding headers to hydrometric API request {}", template.path());
            template.header(USER_AGENT, stationsProperties.getProvider().getEnvironmentCanada().getUserAgent());
            template.header(ACCEPT, "text/csv, text/plain;q=0.9, */*;q=0.8");
        };
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
