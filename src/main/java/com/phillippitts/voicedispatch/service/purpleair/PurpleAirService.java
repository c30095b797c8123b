package com.phillippitts.voicedispatch.service.purpleair;

import com.phillippitts.voicedispatch.domain.Status;
import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.service.component.AbstractComponent;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import com.phillippitts.voicedispatch.service.handler.AbstractHandler;
import com.phillippitts.voicedispatch.service.handler.Handler;
import com.phillippitts.voicedispatch.service.handler.Result;
import com.phillippitts.voicedispatch.service.handler.Service;
import com.phillippitts.voicedispatch.util.Tokenizer;

import java.util.List;
import java.util.Objects;

/**
 * Answers questions about a PurpleAir sensor: "what is the air quality", "what's the
 * humidity" and so on.
 *
 * <p>The question must start the command. Handlers have belief 1.0 and their results are
 * exclusive.
 */
public class PurpleAirService extends AbstractComponent implements Service {

    private static final List<List<String>> PREFIXES = List.of(
            List.of("what", "is", "the"),
            List.of("whats", "the"));

    /** Questions in matching order; "air quality index" must precede "air quality". */
    enum Question {
        AIR_QUALITY_INDEX("air", "quality", "index"),
        AIR_QUALITY("air", "quality"),
        HUMIDITY("humidity"),
        TEMPERATURE("temperature");

        private final List<String> words;

        Question(String... words) {
            this.words = List.of(words);
        }
    }

    private final long sensorId;
    private final PurpleAirClient client;

    public PurpleAirService(StatusNotifier notifier, long sensorId, PurpleAirClient client) {
        super(notifier);
        this.sensorId = sensorId;
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public Handler evaluate(List<Token> tokens) {
        List<String> words = Tokenizer.words(tokens);
        for (Question question : Question.values()) {
            for (List<String> prefix : PREFIXES) {
                if (startsWith(words, prefix, question.words)) {
                    return new PurpleAirHandler(this, tokens, question);
                }
            }
        }
        return null;
    }

    private static boolean startsWith(List<String> words, List<String> prefix, List<String> what) {
        int n = prefix.size() + what.size();
        if (words.size() < n) {
            return false;
        }
        return words.subList(0, prefix.size()).equals(prefix)
                && words.subList(prefix.size(), n).equals(what);
    }

    public long getSensorId() {
        return sensorId;
    }

    private SensorReading fetch() {
        notifyStatus(Status.WORKING);
        try {
            return client.read(sensorId);
        } finally {
            notifyStatus(Status.IDLE);
        }
    }

    /**
     * Rough AQI approximation from the PM2.5 concentration.
     */
    static double approximateAqi(double pm25) {
        return pm25 * pm25 / 285;
    }

    static String describe(double aqi) {
        if (aqi < 50) {
            return "okay";
        } else if (aqi < 100) {
            return "acceptable";
        } else if (aqi < 150) {
            return "poor";
        } else if (aqi < 200) {
            return "bad";
        } else if (aqi < 250) {
            return "hazardous";
        }
        return "extremely hazardous";
    }

    static String answer(Question question, SensorReading reading) {
        String where = reading.location().isEmpty() ? "" : " " + reading.location();
        return switch (question) {
            case AIR_QUALITY_INDEX -> reading.pm25() == null
                    ? "The air quality index" + where + " is unknown."
                    : "The air quality index" + where + " is " + (long) approximateAqi(reading.pm25()) + ".";
            case AIR_QUALITY -> reading.pm25() == null
                    ? "The air quality" + where + " is unknown."
                    : "The air quality" + where + " is " + describe(approximateAqi(reading.pm25())) + ".";
            case HUMIDITY -> "The humidity" + where + " is "
                    + (reading.humidity() == null ? "unknown" : reading.humidity() + " percent") + ".";
            case TEMPERATURE -> "The temperature" + where + " is "
                    + (reading.temperatureF() == null ? "unknown" : reading.temperatureF() + " degrees fahrenheit")
                    + ".";
        };
    }

    private static final class PurpleAirHandler extends AbstractHandler {
        private final Question question;

        PurpleAirHandler(PurpleAirService service, List<Token> tokens, Question question) {
            super(service, tokens, 1.0);
            this.question = question;
        }

        @Override
        public Result handle() {
            SensorReading reading = ((PurpleAirService) service()).fetch();
            return Result.exclusive(answer(question, reading));
        }

        @Override
        public String toString() {
            return "PurpleAirHandler[question=" + question + "]";
        }
    }
}
