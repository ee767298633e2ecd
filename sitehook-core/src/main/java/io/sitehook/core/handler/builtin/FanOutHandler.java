package io.sitehook.core.handler.builtin;

import io.sitehook.core.event.HandlerScope;
import io.sitehook.core.handler.EventHandler;
import io.sitehook.core.handler.HandlerOutcome;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/// Expands one context entry into one follow-up handler per element.
///
/// Reads a collection from the context and enqueues `factory.apply(element)` for
/// each element in iteration order, e.g. a per-site handler for every site in a group.
/// Every element is type-checked before anything is enqueued, so a bad element
/// enqueues nothing.
///
/// {@snippet :
/// event.enqueue(new FanOutHandler<>("group.sites", Site.class, ScrubSiteHandler::new));
/// }
///
/// @param <T> element type expected in the collection
public final class FanOutHandler<T> implements EventHandler {

    private final String contextKey;
    private final Class<T> elementType;
    private final Function<? super T, ? extends EventHandler> factory;

    /// Creates a fan-out handler.
    ///
    /// @param contextKey the context entry holding the collection, not null
    /// @param elementType required element type, not null
    /// @param factory builds one handler per element, not null
    public FanOutHandler(
            String contextKey,
            Class<T> elementType,
            Function<? super T, ? extends EventHandler> factory) {
        this.contextKey = Objects.requireNonNull(contextKey, "contextKey must not be null");
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    @Override
    public HandlerOutcome execute(HandlerScope scope) {
        Object value = scope.context().get(contextKey);
        if (value == null) {
            return HandlerOutcome.failure("Context key '" + contextKey + "' is not set");
        }
        if (!(value instanceof Collection<?> elements)) {
            return HandlerOutcome.failure(
                    "Context key '"
                            + contextKey
                            + "' holds "
                            + value.getClass().getSimpleName()
                            + ", expected a collection");
        }

        List<EventHandler> followUps = new ArrayList<>(elements.size());
        for (Object element : elements) {
            if (!elementType.isInstance(element)) {
                return HandlerOutcome.failure(
                        "Context key '"
                                + contextKey
                                + "' contains "
                                + (element == null ? "null" : element.getClass().getSimpleName())
                                + ", expected "
                                + elementType.getSimpleName());
            }
            EventHandler followUp = factory.apply(elementType.cast(element));
            if (followUp == null) {
                return HandlerOutcome.failure("Fan-out factory returned no handler for " + element);
            }
            followUps.add(followUp);
        }

        followUps.forEach(scope::enqueue);
        return HandlerOutcome.success(
                "Enqueued " + followUps.size() + " handlers for '" + contextKey + "'");
    }
}
