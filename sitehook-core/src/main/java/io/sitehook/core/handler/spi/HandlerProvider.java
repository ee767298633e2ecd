package io.sitehook.core.handler.spi;

import io.sitehook.core.handler.HandlerCatalog;

/// Contributes handler factories to a {@link HandlerCatalog} at startup.
///
/// Implementations are listed in
/// `META-INF/services/io.sitehook.core.handler.spi.HandlerProvider` and picked up by
/// {@link io.sitehook.core.handler.DefaultHandlerCatalog#discover()}.
///
/// {@snippet :
/// public final class ProvisioningHandlers implements HandlerProvider {
///     public String getName() { return "provisioning"; }
///
///     public void registerHandlers(HandlerCatalog catalog) {
///         catalog.register("CreateDatabase", d -> new CreateDatabaseHandler());
///         catalog.register("provisioning/Scrub", d -> new ScrubHandler());
///     }
/// }
/// }
public interface HandlerProvider {

    /// Returns the provider name for logging.
    ///
    /// @return provider name, never null
    String getName();

    /// Registers this provider's factories.
    ///
    /// @param catalog the catalog being built, not null
    void registerHandlers(HandlerCatalog catalog);
}
