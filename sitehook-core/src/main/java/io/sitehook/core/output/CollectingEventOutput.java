package io.sitehook.core.output;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// {@link EventOutput} that records every line, for diagnostics and tests.
public final class CollectingEventOutput implements EventOutput {

    private final List<String> lines = new CopyOnWriteArrayList<>();

    @Override
    public void writeln(String line) {
        lines.add(line);
    }

    /// Returns the lines written so far, oldest first.
    ///
    /// @return immutable copy of the recorded lines, never null
    public List<String> lines() {
        return List.copyOf(lines);
    }

    public void clear() {
        lines.clear();
    }
}
