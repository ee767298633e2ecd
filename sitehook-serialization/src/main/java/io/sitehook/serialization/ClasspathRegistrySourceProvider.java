package io.sitehook.serialization;

import io.sitehook.core.SitehookConfig;
import io.sitehook.core.registry.RegistrySource;
import io.sitehook.core.registry.spi.RegistrySourceProvider;

/// Registers {@link ClasspathRegistrySource} as the default registry source when this
/// module is on the classpath.
///
/// Reads {@link SitehookConfig#getRegistryResource()}.
public class ClasspathRegistrySourceProvider implements RegistrySourceProvider {

    @Override
    public String getName() {
        return "classpath-json";
    }

    @Override
    public RegistrySource create(SitehookConfig config) {
        return new ClasspathRegistrySource(config.getRegistryResource());
    }
}
