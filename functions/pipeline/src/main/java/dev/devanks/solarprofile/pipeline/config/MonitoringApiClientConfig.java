package dev.devanks.solarprofile.pipeline.config;

import feign.Logger.Level;
import feign.RequestInterceptor;
import feign.Retryer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Feign configuration of the monitoring API client. Not a component: only the client uses it.
 */
@RequiredArgsConstructor
@Slf4j
public class MonitoringApiClientConfig {

    private static final String DEFAULT_USER_AGENT = "Solarprofile-Pipeline-Java-Feign/1.0";

    private final PipelineProperties pipelineProperties;

    @Bean
    public RequestInterceptor monitoringHeadersInterceptor() {
        return template -> {
            var headers = pipelineProperties.getApi().getHeaders();
            log.debug("Adding {} configured header(s) to monitoring API request.", headers.size());
            headers.forEach((name, value) -> template.header(name, value));
            if (headers.keySet().stream().noneMatch(USER_AGENT::equalsIgnoreCase)) {
                template.header(USER_AGENT, DEFAULT_USER_AGENT);
            }
        };
    }

    // Retries live in MonitoringApiService
    @Bean
    public Retryer monitoringApiRetryer() {
        return Retryer.NEVER_RETRY;
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
