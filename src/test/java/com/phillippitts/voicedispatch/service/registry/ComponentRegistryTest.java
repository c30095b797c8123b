package com.phillippitts.voicedispatch.service.registry;

import com.phillippitts.voicedispatch.exception.ComponentConfigurationException;
import com.phillippitts.voicedispatch.service.component.Input;
import com.phillippitts.voicedispatch.service.component.Output;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import com.phillippitts.voicedispatch.testutil.FakeInput;
import com.phillippitts.voicedispatch.testutil.RecordingOutput;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentRegistryTest {

    private final ComponentRegistry registry = new ComponentRegistry()
            .register("fake", (notifier, args) -> new FakeInput(notifier))
            .register("recording", (notifier, args) -> new RecordingOutput())
            .register("picky", (notifier, args) -> {
                args.require("needed");
                return new FakeInput(notifier);
            });

    @Test
    void createsRegisteredKindInExpectedRole() {
        Input input = registry.create("fake", ComponentArgs.empty(), StatusNotifier.NOOP, Input.class);

        assertThat(input).isInstanceOf(FakeInput.class);
    }

    @Test
    void unknownKindIsConfigurationError() {
        assertThatThrownBy(() -> registry.create("telepathy", ComponentArgs.empty(), StatusNotifier.NOOP, Input.class))
                .isInstanceOf(ComponentConfigurationException.class)
                .hasMessageContaining("telepathy")
                .hasMessageContaining("fake");
    }

    @Test
    void factoryFailureIsWrappedWithKind() {
        assertThatThrownBy(() -> registry.create("picky", ComponentArgs.empty(), StatusNotifier.NOOP, Input.class))
                .isInstanceOf(ComponentConfigurationException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .satisfies(e -> assertThat(((ComponentConfigurationException) e).getKind()).isEqualTo("picky"));
    }

    @Test
    void factoryReceivesArguments() {
        Input input = registry.create("picky", ComponentArgs.of(Map.of("needed", "yes")),
                StatusNotifier.NOOP, Input.class);

        assertThat(input).isNotNull();
    }

    @Test
    void wrongRoleIsConfigurationError() {
        assertThatThrownBy(() -> registry.create("recording", ComponentArgs.empty(), StatusNotifier.NOOP, Input.class))
                .isInstanceOf(ComponentConfigurationException.class)
                .hasMessageContaining("is not a Input");
        assertThat(registry.create("recording", ComponentArgs.empty(), StatusNotifier.NOOP, Output.class))
                .isInstanceOf(RecordingOutput.class);
    }

    @Test
    void listsKindsInRegistrationOrder() {
        assertThat(registry.kinds()).containsExactly("fake", "recording", "picky");
        assertThat(registry.contains("fake")).isTrue();
        assertThat(registry.contains("nope")).isFalse();
    }

    @Test
    void reRegisteringReplacesFactory() {
        registry.register("fake", (notifier, args) -> new RecordingOutput());

        assertThat(registry.create("fake", ComponentArgs.empty(), StatusNotifier.NOOP, Output.class))
                .isInstanceOf(RecordingOutput.class);
    }
}
