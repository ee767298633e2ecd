package io.sitehook.core.output;

import java.io.PrintStream;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Sink for human-readable progress and result lines.
///
/// The dispatcher writes to it and handlers may too; nothing ever reads the
/// lines back to make decisions. Use {@link #discard()} when no sink is wanted.
///
/// {@snippet :
/// Event event = SitehookFactory.create("site_install", Map.of(), EventOutput.printing(System.out));
/// }
@FunctionalInterface
public interface EventOutput {

    /// Writes a single line.
    ///
    /// @param line the message, not null
    void writeln(String line);

    /// Returns a sink that drops every line.
    ///
    /// @return discarding sink, never null
    static EventOutput discard() {
        return line -> {};
    }

    /// Returns a sink that prints each line to a stream.
    ///
    /// @param stream the target stream, not null
    /// @return printing sink, never null
    static EventOutput printing(PrintStream stream) {
        Objects.requireNonNull(stream, "stream must not be null");
        return stream::println;
    }

    /// Returns a sink that forwards each line to a JUL logger at `INFO`.
    ///
    /// @param logger the target logger, not null
    /// @return logging sink, never null
    static EventOutput logging(Logger logger) {
        Objects.requireNonNull(logger, "logger must not be null");
        return line -> logger.log(Level.INFO, line);
    }

    /// Returns a sink that keeps lines in memory.
    ///
    /// @return new collecting sink, never null
    static CollectingEventOutput collecting() {
        return new CollectingEventOutput();
    }
}
