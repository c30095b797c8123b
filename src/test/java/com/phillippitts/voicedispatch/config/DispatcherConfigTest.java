package com.phillippitts.voicedispatch.config;

import com.phillippitts.voicedispatch.config.properties.DispatcherProperties;
import com.phillippitts.voicedispatch.config.properties.DispatcherProperties.ComponentEntry;
import com.phillippitts.voicedispatch.config.properties.DispatcherProperties.Components;
import com.phillippitts.voicedispatch.exception.ComponentConfigurationException;
import com.phillippitts.voicedispatch.service.component.Input;
import com.phillippitts.voicedispatch.service.component.Output;
import com.phillippitts.voicedispatch.service.dispatch.Dispatcher;
import com.phillippitts.voicedispatch.service.handler.Service;
import com.phillippitts.voicedispatch.service.input.HttpTextInput;
import com.phillippitts.voicedispatch.service.input.UtteranceQueue;
import com.phillippitts.voicedispatch.service.metrics.DispatchMetricsPublisher;
import com.phillippitts.voicedispatch.service.output.LogOutput;
import com.phillippitts.voicedispatch.service.purpleair.PurpleAirClient;
import com.phillippitts.voicedispatch.service.purpleair.PurpleAirService;
import com.phillippitts.voicedispatch.service.registry.ComponentArgs;
import com.phillippitts.voicedispatch.service.registry.ComponentRegistry;
import com.phillippitts.voicedispatch.testutil.EventCapturingPublisher;
import com.phillippitts.voicedispatch.testutil.RecordingNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatcherConfigTest {

    @TempDir
    Path cacheDir;

    private DispatcherConfig config;
    private ComponentRegistry registry;
    private RecordingNotifier notifier;

    @BeforeEach
    void setUp() {
        config = new DispatcherConfig();
        PurpleAirClient client = new PurpleAirClient("http://localhost:1/json",
                Duration.ofSeconds(60), cacheDir, Duration.ofSeconds(1));
        registry = config.componentRegistry(new UtteranceQueue(5), client);
        notifier = new RecordingNotifier();
    }

    @Test
    void registersBuiltInKinds() {
        assertThat(registry.kinds()).containsExactlyInAnyOrder(
                "http-text", "console", "log", "clipboard", "keyboard-action", "purpleair");
    }

    @Test
    void buildsPurpleAirServiceFromSensorId() {
        Service service = registry.create("purpleair", ComponentArgs.of(Map.of("sensor-id", "12345")),
                notifier, Service.class);

        assertThat(service).isInstanceOf(PurpleAirService.class);
    }

    @Test
    void purpleAirWithoutSensorIdIsRejected() {
        assertThatThrownBy(() -> registry.create("purpleair", ComponentArgs.empty(), notifier, Service.class))
                .isInstanceOf(ComponentConfigurationException.class)
                .hasMessageContaining("Sensor ID was not given");
    }

    @Test
    void purpleAirWithNonNumericSensorIdIsRejected() {
        assertThatThrownBy(() -> registry.create("purpleair",
                ComponentArgs.of(Map.of("sensor-id", "downtown")), notifier, Service.class))
                .isInstanceOf(ComponentConfigurationException.class)
                .hasMessageContaining("must be an integer");
    }

    @Test
    void buildRejectsComponentInWrongRole() {
        List<ComponentEntry> entries = List.of(new ComponentEntry("log", null));

        assertThatThrownBy(() -> DispatcherConfig.build(registry, entries, notifier, Input.class))
                .isInstanceOf(ComponentConfigurationException.class)
                .hasMessageContaining("is not a Input");
    }

    @Test
    void buildKeepsConfiguredOrder() {
        List<ComponentEntry> entries = List.of(
                new ComponentEntry("log", null),
                new ComponentEntry("log", Map.of()));

        List<Output> outputs = DispatcherConfig.build(registry, entries, notifier, Output.class);

        assertThat(outputs).hasSize(2).allMatch(o -> o instanceof LogOutput);
        assertThat(outputs.get(0)).isNotSameAs(outputs.get(1));
    }

    @Test
    void dispatcherIsBuiltFromProperties() {
        DispatcherProperties props = new DispatcherProperties(
                List.of("Hey Dexter"), 50L, "No idea", null, null,
                new Components(List.of(new ComponentEntry("http-text", null)),
                        List.of(new ComponentEntry("log", null)),
                        null));

        Dispatcher dispatcher = config.dispatcher(props, registry,
                config.statusNotifier(new EventCapturingPublisher()),
                new EventCapturingPublisher(), DispatchMetricsPublisher.NOOP);

        assertThat(dispatcher.getInputs()).singleElement().isInstanceOf(HttpTextInput.class);
        assertThat(dispatcher.getOutputs()).singleElement().isInstanceOf(LogOutput.class);
        assertThat(dispatcher.getServices()).isEmpty();
        assertThat(dispatcher.getKeyPhrases()).extracting(k -> k.source()).containsExactly("Hey Dexter");
        assertThat(dispatcher.isLooping()).isFalse();
    }
}
