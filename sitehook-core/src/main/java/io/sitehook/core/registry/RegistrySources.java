package io.sitehook.core.registry;

import io.sitehook.core.SitehookConfig;
import io.sitehook.core.registry.spi.RegistrySourceProvider;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Static helpers for obtaining {@link RegistrySource} instances.
///
/// {@link #discover(SitehookConfig)} consults {@link RegistrySourceProvider}s found on
/// the classpath; without any, events see an empty registry.
public final class RegistrySources {

    private static final Logger logger = Logger.getLogger(RegistrySources.class.getName());

    private RegistrySources() {}

    /// Returns a source yielding {@link HandlerRegistry#empty()}.
    ///
    /// @return empty source, never null
    public static RegistrySource empty() {
        return HandlerRegistry::empty;
    }

    /// Picks the highest-priority discovered provider and creates its source.
    ///
    /// @param config the active configuration, not null
    /// @return discovered source, or an empty source if no provider is installed
    public static RegistrySource discover(SitehookConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        List<RegistrySourceProvider> providers = loadProviders();
        if (providers.isEmpty()) {
            logger.info("No registry source provider found; using an empty registry");
            return empty();
        }
        RegistrySourceProvider selected =
                providers.stream()
                        .max(Comparator.comparingInt(RegistrySourceProvider::getPriority))
                        .orElseThrow();
        logger.info("Using registry source provider: " + selected.getName());
        return selected.create(config);
    }

    private static List<RegistrySourceProvider> loadProviders() {
        List<RegistrySourceProvider> discovered = new ArrayList<>();
        for (RegistrySourceProvider provider : ServiceLoader.load(RegistrySourceProvider.class)) {
            discovered.add(provider);
            logger.fine("Discovered registry source provider: " + provider.getName());
        }
        return discovered;
    }
}
