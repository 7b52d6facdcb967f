package org.javai.gitpulse;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every notification for assertions. Safe to use from several threads.
 */
public class RecordingProgressSink implements ProgressSink {

    public final List<String> infos = new CopyOnWriteArrayList<>();
    public final List<String> errors = new CopyOnWriteArrayList<>();
    public final List<int[]> progress = new CopyOnWriteArrayList<>();

    @Override
    public void info(String message) {
        infos.add(message);
    }

    @Override
    public void error(String message) {
        errors.add(message);
    }

    @Override
    public void progress(int done, int total) {
        progress.add(new int[]{done, total});
    }
}
