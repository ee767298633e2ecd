package io.sitehook.core.handler.builtin;

import io.sitehook.core.event.HandlerScope;
import io.sitehook.core.handler.EventHandler;
import io.sitehook.core.handler.HandlerOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Precondition step: succeeds only when every required context key is present.
///
/// A key mapped to null counts as present.
public final class RequireContextHandler implements EventHandler {

    private final List<String> requiredKeys;

    public RequireContextHandler(List<String> requiredKeys) {
        Objects.requireNonNull(requiredKeys, "requiredKeys must not be null");
        this.requiredKeys = List.copyOf(requiredKeys);
    }

    public static RequireContextHandler of(String... requiredKeys) {
        return new RequireContextHandler(List.of(requiredKeys));
    }

    @Override
    public HandlerOutcome execute(HandlerScope scope) {
        List<String> missing = new ArrayList<>();
        for (String key : requiredKeys) {
            if (!scope.context().containsKey(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            return HandlerOutcome.failure("Missing context keys: " + missing);
        }
        return HandlerOutcome.success("All " + requiredKeys.size() + " context keys present");
    }
}
