package io.sitehook.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.sitehook.core.event.HandlerSnapshot;
import io.sitehook.core.registry.HandlerRegistry;
import java.io.Serial;

/// Jackson `SimpleModule` registering all Sitehook type handlers in one place.
///
/// - `HandlerRegistry`: read through `HandlerRegistryDeserializer`
/// - `HandlerSnapshot`: written through `HandlerSnapshotSerializer` with a `"class"` key
///
/// `EventDebugSnapshot` needs no registration; it is a record whose single
/// `handlers` component serializes as-is.
///
/// @see SitehookObjectMapper for the preconfigured mapper
public class SitehookJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = -4478236691260541963L;

    public SitehookJacksonModule() {
        super("SitehookJacksonModule");

        addDeserializer(HandlerRegistry.class, new HandlerRegistryDeserializer());
        addSerializer(HandlerSnapshot.class, new HandlerSnapshotSerializer());
    }
}
