package io.sitehook.core;

import io.sitehook.core.dispatch.EventDispatcher;
import io.sitehook.core.event.Event;
import io.sitehook.core.handler.HandlerCatalog;
import io.sitehook.core.output.EventOutput;
import io.sitehook.core.registry.RegistrySource;
import io.sitehook.core.site.Site;
import java.util.Map;
import java.util.Objects;

/// Wired set of collaborators that new events are built from.
///
/// Each {@code newEvent} call takes a fresh registry snapshot from the
/// {@link RegistrySource}; the catalog and dispatcher are shared.
///
/// ### Contracts
/// - **Precondition**: all constructor parameters must be non-null
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link SitehookFactory#createEnvironment()} or
/// {@link SitehookFactory.Builder} rather than direct construction.
public final class SitehookEnvironment {

    private final SitehookConfig config;
    private final RegistrySource registrySource;
    private final HandlerCatalog handlerCatalog;
    private final EventDispatcher dispatcher;

    public SitehookEnvironment(
            SitehookConfig config,
            RegistrySource registrySource,
            HandlerCatalog handlerCatalog,
            EventDispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registrySource = Objects.requireNonNull(registrySource, "registrySource must not be null");
        this.handlerCatalog = Objects.requireNonNull(handlerCatalog, "handlerCatalog must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /// Creates a global event whose output is discarded.
    ///
    /// @param type the event type, not null
    /// @param context initial context, may be null
    /// @return a ready-to-run event, never null
    public Event newEvent(String type, Map<String, Object> context) {
        return newEvent(type, context, null, null);
    }

    /// Creates a global event.
    ///
    /// @param type the event type, not null
    /// @param context initial context, may be null
    /// @param output progress sink, may be null
    /// @return a ready-to-run event, never null
    public Event newEvent(String type, Map<String, Object> context, EventOutput output) {
        return newEvent(type, context, output, null);
    }

    /// Creates an event, site-scoped when `site` is given.
    ///
    /// @param type the event type, not null
    /// @param context initial context, may be null
    /// @param output progress sink, may be null
    /// @param site the target site, may be null
    /// @return a ready-to-run event, never null
    public Event newEvent(String type, Map<String, Object> context, EventOutput output, Site site) {
        return new Event(
                dispatcher, handlerCatalog, output, type, registrySource.load(), context, site);
    }

    public SitehookConfig getConfig() {
        return config;
    }

    public RegistrySource getRegistrySource() {
        return registrySource;
    }

    public HandlerCatalog getHandlerCatalog() {
        return handlerCatalog;
    }

    public EventDispatcher getDispatcher() {
        return dispatcher;
    }
}
