package com.phillippitts.voicedispatch.service.output;

import com.phillippitts.voicedispatch.service.component.AbstractComponent;
import com.phillippitts.voicedispatch.service.component.Output;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Writes every response to the application log at INFO. */
public class LogOutput extends AbstractComponent implements Output {

    private static final Logger LOG = LogManager.getLogger(LogOutput.class);

    public LogOutput(StatusNotifier notifier) {
        super(notifier);
    }

    @Override
    public void write(String text) {
        LOG.info("Response: {}", text);
    }
}
