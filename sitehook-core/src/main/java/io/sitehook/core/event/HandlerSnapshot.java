package io.sitehook.core.event;

import java.time.Instant;

/// Debug view of one handler.
///
/// @param className implementation identity of the handler
/// @param started when execution began, null if not yet started
/// @param completed when execution finished, null if not finished
/// @param message outcome message, null if none yet
public record HandlerSnapshot(
        String className, Instant started, Instant completed, String message) {}
