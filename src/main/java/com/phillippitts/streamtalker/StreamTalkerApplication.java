package com.phillippitts.streamtalker;

import com.phillippitts.streamtalker.config.properties.CacheProperties;
import com.phillippitts.streamtalker.config.properties.ChatProperties;
import com.phillippitts.streamtalker.config.properties.PlaybackProperties;
import com.phillippitts.streamtalker.config.properties.SynthesisProperties;
import com.phillippitts.streamtalker.config.properties.TtsClientProperties;
import com.phillippitts.streamtalker.config.properties.VoiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CacheProperties.class,
        SynthesisProperties.class,
        PlaybackProperties.class,
        VoiceProperties.class,
        ChatProperties.class,
        TtsClientProperties.class
})
@EnableScheduling
public class StreamTalkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamTalkerApplication.class, args);
    }

}
