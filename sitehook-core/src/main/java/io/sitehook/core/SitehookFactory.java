package io.sitehook.core;

import io.sitehook.core.dispatch.DefaultEventDispatcher;
import io.sitehook.core.dispatch.DispatchObserver;
import io.sitehook.core.dispatch.EventDispatcher;
import io.sitehook.core.event.Event;
import io.sitehook.core.handler.DefaultHandlerCatalog;
import io.sitehook.core.handler.HandlerCatalog;
import io.sitehook.core.handler.spi.HandlerProvider;
import io.sitehook.core.output.EventOutput;
import io.sitehook.core.registry.RegistrySource;
import io.sitehook.core.registry.RegistrySources;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Entry point for building events and the environments they come from.
///
/// ### Usage Patterns
///
/// **Process defaults** (registry and handlers discovered via ServiceLoader):
/// {@snippet :
/// Event event = SitehookFactory.create("site_install", Map.of("profile", "standard"));
/// DispatchResult result = event.run();
/// }
///
/// **Explicit wiring** (tests, embedded use):
/// {@snippet :
/// SitehookEnvironment env = SitehookFactory.builder()
///     .config(SitehookConfig.builder().stopOnFirstFailure(true).build())
///     .registrySource(RegistrySource.of(registry))
///     .handlerCatalog(catalog)
///     .observer(trace::add)
///     .build();
/// Event event = env.newEvent("site_install", Map.of());
/// }
///
/// @implNote The default environment behind {@link #create(String, Map)} is built lazily
/// on first use and shared for the life of the process.
///
/// @see SitehookEnvironment
/// @see Builder
public final class SitehookFactory {

    private SitehookFactory() {}

    /// Holder for the lazily created process-wide environment.
    private static final class DefaultEnvironmentHolder {
        private static final SitehookEnvironment INSTANCE = createEnvironment();
    }

    /// Creates a global event from the process-wide default environment, dropping output.
    ///
    /// @param type the event type, not null
    /// @param context initial context, may be null
    /// @return a ready-to-run event, never null
    public static Event create(String type, Map<String, Object> context) {
        return create(type, context, null);
    }

    /// Creates a global event from the process-wide default environment.
    ///
    /// @param type the event type, not null
    /// @param context initial context, may be null
    /// @param output progress sink, null drops output
    /// @return a ready-to-run event, never null
    public static Event create(String type, Map<String, Object> context, EventOutput output) {
        return defaultEnvironment().newEvent(type, context, output);
    }

    /// Returns the process-wide default environment, creating it on first call.
    ///
    /// @return the shared environment, never null
    public static SitehookEnvironment defaultEnvironment() {
        return DefaultEnvironmentHolder.INSTANCE;
    }

    /// Creates an environment from default configuration and discovered providers.
    ///
    /// @return a new environment, never null
    public static SitehookEnvironment createEnvironment() {
        return createEnvironment(new SitehookConfig());
    }

    /// Creates an environment from the given configuration and discovered providers.
    ///
    /// @param config configuration, not null
    /// @return a new environment, never null
    public static SitehookEnvironment createEnvironment(SitehookConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new environment builder.
    ///
    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link SitehookEnvironment}.
    ///
    /// Anything left unset is discovered: the registry source through
    /// {@link RegistrySources#discover(SitehookConfig)} and the handler catalog through
    /// {@link DefaultHandlerCatalog#discover()}.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private SitehookConfig config = new SitehookConfig();
        private RegistrySource registrySource;
        private HandlerCatalog handlerCatalog;
        private final List<HandlerProvider> handlerProviders = new ArrayList<>();
        private EventDispatcher dispatcher;
        private final List<DispatchObserver> observers = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        public Builder config(SitehookConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the registry source; leave unset to discover one.
        ///
        /// @param registrySource the source, may be null for discovery
        /// @return this builder for chaining, never null
        public Builder registrySource(RegistrySource registrySource) {
            this.registrySource = registrySource;
            return this;
        }

        /// Sets the handler catalog; leave unset to discover one.
        ///
        /// @param handlerCatalog the catalog, may be null for discovery
        /// @return this builder for chaining, never null
        public Builder handlerCatalog(HandlerCatalog handlerCatalog) {
            this.handlerCatalog = handlerCatalog;
            return this;
        }

        /// Adds a provider whose handlers are registered on top of the catalog.
        ///
        /// @param provider the provider, not null
        /// @return this builder for chaining, never null
        public Builder handlerProvider(HandlerProvider provider) {
            this.handlerProviders.add(Objects.requireNonNull(provider, "provider must not be null"));
            return this;
        }

        /// Sets a custom dispatcher instead of a {@link DefaultEventDispatcher}.
        ///
        /// @param dispatcher the dispatcher, may be null for the default
        /// @return this builder for chaining, never null
        public Builder dispatcher(EventDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /// Adds an observer to the default dispatcher.
        ///
        /// @param observer the observer, not null
        /// @return this builder for chaining, never null
        public Builder observer(DispatchObserver observer) {
            this.observers.add(Objects.requireNonNull(observer, "observer must not be null"));
            return this;
        }

        /// Sets the clock used for handler timestamps by the default dispatcher.
        ///
        /// @param clock the clock, not null
        /// @return this builder for chaining, never null
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /// Builds the environment.
        ///
        /// @return a wired environment, never null
        /// @throws IllegalStateException if observers are combined with a custom dispatcher
        public SitehookEnvironment build() {
            RegistrySource source =
                    registrySource != null ? registrySource : RegistrySources.discover(config);

            HandlerCatalog catalog =
                    handlerCatalog != null ? handlerCatalog : DefaultHandlerCatalog.discover();
            for (HandlerProvider provider : handlerProviders) {
                provider.registerHandlers(catalog);
            }

            EventDispatcher eventDispatcher = dispatcher;
            if (eventDispatcher == null) {
                DefaultEventDispatcher defaultDispatcher =
                        new DefaultEventDispatcher(config.toDispatchPolicy(), clock);
                observers.forEach(defaultDispatcher::addObserver);
                eventDispatcher = defaultDispatcher;
            } else if (!observers.isEmpty()) {
                throw new IllegalStateException(
                        "Observers can only be attached to the default dispatcher");
            }

            return new SitehookEnvironment(config, source, catalog, eventDispatcher);
        }
    }
}
