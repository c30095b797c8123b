package com.phillippitts.voicedispatch.config.properties;

import com.phillippitts.voicedispatch.service.dispatch.Dispatcher;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

/**
 * Typed properties for the dispatcher: key-phrases, loop timing and the components to build.
 *
 * <p>Example:
 * <pre>
 * dispatcher.key-phrases[0]=Hey Dexter
 * dispatcher.components.inputs[0].kind=http-text
 * dispatcher.components.services[0].kind=purpleair
 * dispatcher.components.services[0].args.sensor-id=12345
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "dispatcher")
public class DispatcherProperties {

    @NotEmpty
    private final List<@NotBlank String> keyPhrases;

    /** Pause between sweeps over all inputs. */
    @Min(1)
    private final long pollIntervalMs;

    @NotBlank
    private final String apology;

    /** Maximum time to wait for the loop and components to stop on shutdown. */
    @Min(0)
    private final long shutdownTimeoutMs;

    /** Pending utterances accepted over HTTP before new ones are rejected. */
    @Min(1)
    private final int utteranceQueueCapacity;

    @Valid
    @NotNull
    private final Components components;

    @ConstructorBinding
    public DispatcherProperties(List<String> keyPhrases, Long pollIntervalMs, String apology,
                                Long shutdownTimeoutMs, Integer utteranceQueueCapacity,
                                Components components) {
        this.keyPhrases = keyPhrases == null ? List.of() : List.copyOf(keyPhrases);
        this.pollIntervalMs = pollIntervalMs == null ? Dispatcher.DEFAULT_POLL_INTERVAL.toMillis() : pollIntervalMs;
        this.apology = apology == null ? Dispatcher.DEFAULT_APOLOGY : apology;
        this.shutdownTimeoutMs = shutdownTimeoutMs == null ? 5000 : shutdownTimeoutMs;
        this.utteranceQueueCapacity = utteranceQueueCapacity == null ? 100 : utteranceQueueCapacity;
        this.components = components == null ? new Components(null, null, null) : components;
    }

    public List<String> getKeyPhrases() {
        return keyPhrases;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public String getApology() {
        return apology;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public int getUtteranceQueueCapacity() {
        return utteranceQueueCapacity;
    }

    public Components getComponents() {
        return components;
    }

    /**
     * Ordered component lists. Order matters: inputs are polled, and services evaluated,
     * in the configured order.
     */
    public record Components(@Valid List<ComponentEntry> inputs,
                             @Valid List<ComponentEntry> outputs,
                             @Valid List<ComponentEntry> services) {
        public Components {
            inputs = inputs == null ? List.of() : List.copyOf(inputs);
            outputs = outputs == null ? List.of() : List.copyOf(outputs);
            services = services == null ? List.of() : List.copyOf(services);
        }
    }

    /**
     * One configured component.
     *
     * @param kind registry identifier, e.g. {@code keyboard-action}
     * @param args kind-specific string arguments
     */
    public record ComponentEntry(@NotBlank String kind, Map<String, String> args) {
        public ComponentEntry {
            args = args == null ? Map.of() : Map.copyOf(args);
        }
    }
}
