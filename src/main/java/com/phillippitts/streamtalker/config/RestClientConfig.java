package com.phillippitts.streamtalker.config;

import com.phillippitts.streamtalker.config.properties.TtsClientProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplates for the TTS server: one with the long read timeout that synthesis needs, and
 * one with short timeouts for health probes and inference skips.
 */
@Configuration
public class RestClientConfig {

    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    @Bean(name = "ttsRestTemplate")
    public RestTemplate ttsRestTemplate(RestTemplateBuilder builder, TtsClientProperties props) {
        return builder
                .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                .build();
    }

    @Bean(name = "ttsProbeRestTemplate")
    public RestTemplate ttsProbeRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(PROBE_TIMEOUT)
                .setReadTimeout(PROBE_TIMEOUT)
                .build();
    }
}
