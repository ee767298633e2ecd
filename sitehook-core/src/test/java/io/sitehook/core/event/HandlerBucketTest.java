package io.sitehook.core.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sitehook.core.exception.IncompatibleHandlerBucketException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class HandlerBucketTest {

    @ParameterizedTest
    @EnumSource(HandlerBucket.class)
    void shouldParseOwnName(HandlerBucket bucket) {
        assertThat(HandlerBucket.fromName(bucket.bucketName())).isSameAs(bucket);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "pending", "Complete", " failed"})
    void shouldRejectUnknownNames(String name) {
        assertThatThrownBy(() -> HandlerBucket.fromName(name))
                .isInstanceOf(IncompatibleHandlerBucketException.class)
                .hasMessage("The handler type \"" + name + "\" is incompatible with this event.");
    }

    @Test
    void shouldRejectNullName() {
        assertThatThrownBy(() -> HandlerBucket.fromName(null))
                .isInstanceOf(IncompatibleHandlerBucketException.class)
                .hasMessage("The handler type \"null\" is incompatible with this event.");
    }
}
