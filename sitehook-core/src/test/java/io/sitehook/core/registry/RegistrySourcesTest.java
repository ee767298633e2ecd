package io.sitehook.core.registry;

import static org.assertj.core.api.Assertions.assertThat;

import io.sitehook.core.SitehookConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

class RegistrySourcesTest {

    @Test
    void shouldFallBackToEmptyRegistryWithoutProviders() {
        RegistrySource source = RegistrySources.discover(new SitehookConfig());

        assertThat(source.load()).isEqualTo(HandlerRegistry.empty());
    }

    @Test
    void shouldReturnFixedSnapshot() {
        HandlerRegistry registry = HandlerRegistry.of(List.of(HandlerDescriptor.of("a", "B")));

        RegistrySource source = RegistrySource.of(registry);

        assertThat(source.load()).isSameAs(registry);
        assertThat(source.load()).isSameAs(registry);
    }
}
