package io.sitehook.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HandlerDescriptorTest {

    @Test
    void shouldUseBareIdentifierWithoutPath() {
        HandlerDescriptor descriptor = HandlerDescriptor.of("site_install", "CreateDatabase");

        assertThat(descriptor.hasPath()).isFalse();
        assertThat(descriptor.qualifiedName()).isEqualTo("CreateDatabase");
    }

    @Test
    void shouldStripSurroundingSlashesFromPath() {
        HandlerDescriptor descriptor =
                new HandlerDescriptor("site_install", "CreateDatabase", "/hooks/provisioning/");

        assertThat(descriptor.path()).isEqualTo("hooks/provisioning");
        assertThat(descriptor.qualifiedName()).isEqualTo("hooks/provisioning/CreateDatabase");
    }

    @Test
    void shouldTreatBlankPathAsAbsent() {
        HandlerDescriptor descriptor =
                new HandlerDescriptor("site_install", "CreateDatabase", "//");

        assertThat(descriptor.path()).isNull();
        assertThat(descriptor).isEqualTo(HandlerDescriptor.of("site_install", "CreateDatabase"));
    }

    @Test
    void shouldRejectBlankHandler() {
        assertThatThrownBy(() -> HandlerDescriptor.of("site_install", ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("handler must not be blank");
    }

    @Test
    void shouldRejectNullType() {
        assertThatThrownBy(() -> HandlerDescriptor.of(null, "CreateDatabase"))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("type must not be null");
    }
}
