package com.phillippitts.voicedispatch.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsAreUncheckedVoiceDispatchExceptions() {
        assertThat(new ComponentStartupException("X", new RuntimeException("r")))
                .isInstanceOf(VoiceDispatchException.class)
                .isInstanceOf(RuntimeException.class);
        assertThat(new ComponentConfigurationException("k", "m")).isInstanceOf(VoiceDispatchException.class);
        assertThat(new SensorDataException(1, "m", null)).isInstanceOf(VoiceDispatchException.class);
        assertThat(new UtteranceRejectedException(5)).isInstanceOf(VoiceDispatchException.class);
    }

    @Test
    void startupExceptionCarriesComponentNameAndCause() {
        IllegalStateException cause = new IllegalStateException("no display");
        ComponentStartupException e = new ComponentStartupException("ClipboardOutput", cause);

        assertThat(e.getComponentName()).isEqualTo("ClipboardOutput");
        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.getMessage()).contains("ClipboardOutput").contains("no display");
    }

    @Test
    void configurationExceptionNamesKind() {
        ComponentConfigurationException e = new ComponentConfigurationException("purpleair", "Sensor ID was not given");

        assertThat(e.getKind()).isEqualTo("purpleair");
        assertThat(e.getMessage()).isEqualTo("Sensor ID was not given (kind: purpleair)");
    }

    @Test
    void sensorExceptionNamesSensor() {
        SensorDataException e = new SensorDataException(42, "Failed to fetch sensor data", null);

        assertThat(e.getSensorId()).isEqualTo(42);
        assertThat(e.getMessage()).contains("sensor: 42");
    }

    @Test
    void rejectedUtteranceReportsCapacity() {
        assertThat(new UtteranceRejectedException(100).getCapacity()).isEqualTo(100);
    }
}
