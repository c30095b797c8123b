package com.phillippitts.voicedispatch.service.input;

import com.phillippitts.voicedispatch.domain.Status;
import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.service.component.AbstractComponent;
import com.phillippitts.voicedispatch.service.component.Input;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;

import java.util.List;
import java.util.Objects;

/**
 * Input fed by {@code POST /api/utterances}. Reports {@link Status#ACTIVE} while utterances
 * are waiting and {@link Status#IDLE} once the queue is drained.
 */
public class HttpTextInput extends AbstractComponent implements Input {

    private final UtteranceQueue queue;

    public HttpTextInput(StatusNotifier notifier, UtteranceQueue queue) {
        super(notifier);
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
    }

    @Override
    public List<Token> read() {
        List<Token> tokens = queue.poll();
        notifyStatus(queue.size() > 0 ? Status.ACTIVE : Status.IDLE);
        return tokens;
    }
}
