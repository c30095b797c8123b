package com.phillippitts.voicedispatch.service.component;

import com.phillippitts.voicedispatch.domain.Token;

import java.util.List;

/**
 * Source of tokenized utterances.
 */
public interface Input extends Component {

    /**
     * Polls for pending input. Must never block: the dispatcher polls every input from a
     * single thread and a blocking read stalls the whole system.
     *
     * @return a non-empty batch of tokens, or {@code null} if nothing is pending
     */
    List<Token> read();
}
