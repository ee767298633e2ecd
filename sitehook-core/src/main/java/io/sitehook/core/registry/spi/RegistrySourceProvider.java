package io.sitehook.core.registry.spi;

import io.sitehook.core.SitehookConfig;
import io.sitehook.core.registry.RegistrySource;

/// Provider interface for pluggable registry sources.
///
/// Implementations are discovered with {@link java.util.ServiceLoader} from
/// `META-INF/services/io.sitehook.core.registry.spi.RegistrySourceProvider`.
/// When several are present, the highest {@link #getPriority()} wins.
///
/// @see io.sitehook.core.registry.RegistrySources#discover(SitehookConfig)
public interface RegistrySourceProvider {

    /// Returns the provider name for logging.
    ///
    /// @return provider name, never null
    String getName();

    /// Returns the selection priority; higher wins.
    ///
    /// @return priority value
    default int getPriority() {
        return 0;
    }

    /// Creates a registry source for the given configuration.
    ///
    /// @param config the active configuration, not null
    /// @return a registry source, never null
    RegistrySource create(SitehookConfig config);
}
