package edustats.oecd.pipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Application-wide infrastructure beans
 */
@Configuration
public class AppConfig {

    /**
     * Clock used for extraction dates and metadata timestamps.
     * Tests swap in a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * HTTP client for the statistics API.
     * The per-request deadline is set on each request from pipeline.source.timeout-seconds.
     */
    @Bean
    public HttpClient statisticsHttpClient(PipelineConfig pipelineConfig) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(pipelineConfig.getSource().getTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
