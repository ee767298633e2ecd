package io.sitehook.core.exception;

import java.io.Serial;

/// Thrown when a single dispatch would invoke more handlers than the configured bound.
///
/// Usually means a handler keeps re-enqueuing itself. Handlers still waiting
/// are left in the `incomplete` bucket.
public class DispatchLimitExceededException extends SitehookDispatchException {

    @Serial private static final long serialVersionUID = -1587394772203645312L;

    private final String eventType;
    private final int limit;

    public DispatchLimitExceededException(String eventType, int limit) {
        super(
                "Event '"
                        + eventType
                        + "' exceeded the maximum of "
                        + limit
                        + " handler executions per dispatch");
        this.eventType = eventType;
        this.limit = limit;
    }

    public String getEventType() {
        return eventType;
    }

    public int getLimit() {
        return limit;
    }
}
