package com.phillippitts.voicedispatch.service.handler;

import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.service.component.Component;

import java.util.List;

/**
 * A component that may answer a command.
 *
 * <p>The dispatcher calls {@link #evaluate(List)} exactly once per dispatch cycle with the
 * tokens that follow the detected key-phrase. Evaluation should be cheap and free of side
 * effects; the actual work belongs in {@link Handler#handle()}.
 */
public interface Service extends Component {

    /**
     * Decides whether this service applies to the given command.
     *
     * @param tokens tokens after the key-phrase, never null (may be empty)
     * @return a handler claiming the command, or {@code null} if the service does not apply
     */
    Handler evaluate(List<Token> tokens);
}
