package org.javai.gitpulse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards to a caller-supplied sink, logging and dropping anything the sink throws.
 */
final class GuardedProgressSink implements ProgressSink {

    private static final Logger log = LoggerFactory.getLogger(GuardedProgressSink.class);

    private final ProgressSink delegate;

    GuardedProgressSink(ProgressSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void info(String message) {
        try {
            delegate.info(message);
        } catch (RuntimeException e) {
            log.debug("Progress sink rejected info notification: {}", e.toString());
        }
    }

    @Override
    public void error(String message) {
        try {
            delegate.error(message);
        } catch (RuntimeException e) {
            log.debug("Progress sink rejected error notification: {}", e.toString());
        }
    }

    @Override
    public void progress(int done, int total) {
        try {
            delegate.progress(done, total);
        } catch (RuntimeException e) {
            log.debug("Progress sink rejected progress {}/{}: {}", done, total, e.toString());
        }
    }
}
