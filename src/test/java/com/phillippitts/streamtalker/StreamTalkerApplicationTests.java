package com.phillippitts.streamtalker;

import com.phillippitts.streamtalker.service.pipeline.PipelineCommands;
import com.phillippitts.streamtalker.service.pipeline.PipelineLifecycle;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    properties = {
        "cache.directory=${java.io.tmpdir}/streamtalker-context-test", // keep test blobs out of the working dir
        "tts.client.base-url=http://127.0.0.1:9",
        "synthesis.health-check-interval-ms=600000"
    }
)
class StreamTalkerApplicationTests {

    @Autowired
    private PipelineCommands commands;

    @Autowired
    private PipelineLifecycle lifecycle;

    @Test
    void contextLoads() {
        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(commands.status().queuedMessages()).isZero();
    }

}
