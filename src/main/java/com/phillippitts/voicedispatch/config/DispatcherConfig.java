package com.phillippitts.voicedispatch.config;

import com.phillippitts.voicedispatch.config.properties.DispatcherProperties;
import com.phillippitts.voicedispatch.config.properties.DispatcherProperties.ComponentEntry;
import com.phillippitts.voicedispatch.config.properties.PurpleAirProperties;
import com.phillippitts.voicedispatch.service.component.Component;
import com.phillippitts.voicedispatch.service.component.Input;
import com.phillippitts.voicedispatch.service.component.Output;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import com.phillippitts.voicedispatch.service.dispatch.Dispatcher;
import com.phillippitts.voicedispatch.service.dispatch.DispatcherLifecycle;
import com.phillippitts.voicedispatch.service.handler.Service;
import com.phillippitts.voicedispatch.service.input.ConsoleTextInput;
import com.phillippitts.voicedispatch.service.input.HttpTextInput;
import com.phillippitts.voicedispatch.service.input.UtteranceQueue;
import com.phillippitts.voicedispatch.service.keyboard.KeyboardActionService;
import com.phillippitts.voicedispatch.service.metrics.DispatchMetricsPublisher;
import com.phillippitts.voicedispatch.service.notifier.TrackingStatusNotifier;
import com.phillippitts.voicedispatch.service.output.ClipboardOutput;
import com.phillippitts.voicedispatch.service.output.LogOutput;
import com.phillippitts.voicedispatch.service.purpleair.PurpleAirClient;
import com.phillippitts.voicedispatch.service.purpleair.PurpleAirService;
import com.phillippitts.voicedispatch.service.registry.ComponentArgs;
import com.phillippitts.voicedispatch.service.registry.ComponentRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the dispatcher: registers every built-in component kind, builds the configured
 * components in order and ties the main loop to the application lifecycle.
 *
 * <p>Built-in kinds:
 * <ul>
 *   <li>Inputs: {@code http-text}, {@code console}</li>
 *   <li>Outputs: {@code log}, {@code clipboard}</li>
 *   <li>Services: {@code keyboard-action} (arg {@code belief}), {@code purpleair}
 *       (arg {@code sensor-id}, required)</li>
 * </ul>
 */
@Configuration
public class DispatcherConfig {

    private static final Logger LOG = LogManager.getLogger(DispatcherConfig.class);

    static final String ARG_BELIEF = "belief";
    static final String ARG_SENSOR_ID = "sensor-id";

    @Bean
    public TrackingStatusNotifier statusNotifier(ApplicationEventPublisher publisher) {
        return new TrackingStatusNotifier(publisher);
    }

    @Bean
    public UtteranceQueue utteranceQueue(DispatcherProperties props) {
        return new UtteranceQueue(props.getUtteranceQueueCapacity());
    }

    @Bean
    public PurpleAirClient purpleAirClient(PurpleAirProperties props) {
        return new PurpleAirClient(
                props.getBaseUrl(),
                Duration.ofSeconds(props.getCacheTtlSeconds()),
                Path.of(props.getCacheDir()),
                Duration.ofMillis(props.getTimeoutMs()));
    }

    @Bean
    public ComponentRegistry componentRegistry(UtteranceQueue utteranceQueue, PurpleAirClient purpleAirClient) {
        return new ComponentRegistry()
                .register("http-text", (notifier, args) -> new HttpTextInput(notifier, utteranceQueue))
                .register("console", (notifier, args) -> new ConsoleTextInput(notifier))
                .register("log", (notifier, args) -> new LogOutput(notifier))
                .register("clipboard", (notifier, args) -> new ClipboardOutput(notifier))
                .register("keyboard-action", (notifier, args) -> new KeyboardActionService(notifier,
                        args.getDouble(ARG_BELIEF, KeyboardActionService.DEFAULT_BELIEF)))
                .register("purpleair", (notifier, args) -> new PurpleAirService(notifier,
                        sensorId(args), purpleAirClient));
    }

    static long sensorId(ComponentArgs args) {
        if (args.get(ARG_SENSOR_ID).isEmpty()) {
            throw new IllegalArgumentException("Sensor ID was not given");
        }
        return args.requireLong(ARG_SENSOR_ID);
    }

    @Bean
    public Dispatcher dispatcher(DispatcherProperties props,
                                 ComponentRegistry registry,
                                 TrackingStatusNotifier statusNotifier,
                                 ApplicationEventPublisher publisher,
                                 DispatchMetricsPublisher metrics) {
        DispatcherProperties.Components c = props.getComponents();
        List<Input> inputs = build(registry, c.inputs(), statusNotifier, Input.class);
        List<Output> outputs = build(registry, c.outputs(), statusNotifier, Output.class);
        List<Service> services = build(registry, c.services(), statusNotifier, Service.class);
        LOG.info("Configured inputs={}, outputs={}, services={}", inputs, outputs, services);
        return Dispatcher.builder()
                .inputs(inputs)
                .outputs(outputs)
                .services(services)
                .keyPhrases(props.getKeyPhrases())
                .apology(props.getApology())
                .pollInterval(Duration.ofMillis(props.getPollIntervalMs()))
                .publisher(publisher)
                .metrics(metrics)
                .build();
    }

    static <T extends Component> List<T> build(ComponentRegistry registry, List<ComponentEntry> entries,
                                               StatusNotifier notifier, Class<T> role) {
        List<T> out = new ArrayList<>(entries.size());
        for (ComponentEntry entry : entries) {
            out.add(registry.create(entry.kind(), ComponentArgs.of(entry.args()), notifier, role));
        }
        return out;
    }

    @Bean
    public DispatcherLifecycle dispatcherLifecycle(Dispatcher dispatcher,
                                                   @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                                   DispatcherProperties props) {
        return new DispatcherLifecycle(dispatcher, dispatchExecutor,
                Duration.ofMillis(props.getShutdownTimeoutMs()));
    }
}
