package com.phillippitts.voicedispatch.service.output;

import com.phillippitts.voicedispatch.domain.Status;
import com.phillippitts.voicedispatch.service.component.AbstractComponent;
import com.phillippitts.voicedispatch.service.component.Output;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.StringSelection;
import java.util.Objects;

/**
 * Places each response on the system clipboard so it can be pasted anywhere.
 *
 * <p>Requires a display; {@link #start()} fails when the clipboard is unavailable.
 * For hermetic tests, the {@link ClipboardFacade} can be replaced.
 */
public class ClipboardOutput extends AbstractComponent implements Output {

    private static final Logger LOG = LogManager.getLogger(ClipboardOutput.class);

    interface ClipboardFacade {
        Clipboard getSystemClipboard();
    }

    static final class AwtClipboardFacade implements ClipboardFacade {
        @Override
        public Clipboard getSystemClipboard() {
            if (GraphicsEnvironment.isHeadless()) {
                throw new IllegalStateException("No display available for the system clipboard");
            }
            return Toolkit.getDefaultToolkit().getSystemClipboard();
        }
    }

    private final ClipboardFacade facade;
    private Clipboard clipboard;

    public ClipboardOutput(StatusNotifier notifier) {
        this(notifier, new AwtClipboardFacade());
    }

    // Package-private for tests
    ClipboardOutput(StatusNotifier notifier, ClipboardFacade facade) {
        super(notifier);
        this.facade = Objects.requireNonNull(facade, "facade must not be null");
    }

    @Override
    protected void doStart() {
        clipboard = facade.getSystemClipboard();
    }

    @Override
    public void write(String text) {
        if (clipboard == null) {
            throw new IllegalStateException("ClipboardOutput has not been started");
        }
        notifyStatus(Status.WORKING);
        try {
            clipboard.setContents(new StringSelection(text == null ? "" : text), null);
            LOG.debug("Copied {} chars to clipboard", text == null ? 0 : text.length());
        } finally {
            notifyStatus(Status.IDLE);
        }
    }
}
