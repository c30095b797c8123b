package com.phillippitts.voicedispatch;

import com.phillippitts.voicedispatch.service.dispatch.Dispatcher;
import com.phillippitts.voicedispatch.service.input.UtteranceQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
    properties = {
        "dispatcher.key-phrases[0]=Hey Dexter",
        "dispatcher.poll-interval-ms=10",
        "dispatcher.apology=No idea",
        "dispatcher.components.inputs[0].kind=http-text",
        "dispatcher.components.outputs[0].kind=log",
        "management.endpoints.web.exposure.include=health"
    }
)
@AutoConfigureMockMvc
class VoiceDispatchApplicationTests {

    @Autowired
    MockMvc mvc;

    @Autowired
    Dispatcher dispatcher;

    @Autowired
    UtteranceQueue queue;

    @Autowired
    MeterRegistry meterRegistry;

    @Test
    void contextLoads() {
        await().atMost(Duration.ofSeconds(5)).until(dispatcher::isLooping);
    }

    @Test
    void postedUtteranceIsDispatched() throws Exception {
        await().atMost(Duration.ofSeconds(5)).until(dispatcher::isLooping);

        mvc.perform(post("/api/utterances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Hey Dexter make me a sandwich\"}"))
                .andExpect(status().isAccepted());

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            Counter apologies = meterRegistry.find("voicedispatch.cycles").tag("outcome", "apology").counter();
            assertThat(apologies).isNotNull();
            assertThat(apologies.count()).isGreaterThanOrEqualTo(1.0);
        });
        assertThat(queue.size()).isZero();
    }

    @Test
    void statusAndHealthReportRunningLoop() throws Exception {
        await().atMost(Duration.ofSeconds(5)).until(dispatcher::isLooping);

        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loop").value("running"))
                .andExpect(jsonPath("$.keyPhrases[0]").value("Hey Dexter"));

        mvc.perform(get("/actuator/health"))
                .andExpect(jsonPath("$.components.component.status").value("UP"))
                .andExpect(jsonPath("$.components.component.details.loop").value("running"));
    }
}
