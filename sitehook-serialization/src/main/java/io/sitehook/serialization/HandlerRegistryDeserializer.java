package io.sitehook.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.sitehook.core.registry.HandlerDescriptor;
import io.sitehook.core.registry.HandlerRegistry;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes a registry document into a {@link HandlerRegistry}.
///
/// ```json
/// {
///   "events": [
///     {"type": "site_install", "handler": "CreateDatabase"},
///     {"type": "site_install", "class": "Scrub", "path": "modules/scrub"}
///   ],
///   "modules": ["scrub"]
/// }
/// ```
///
/// - `events` may be missing or null; it becomes an empty listing
/// - each entry needs `type` and `handler`; `class` is accepted in place of `handler`
/// - `path` is optional
/// - every other top-level field is kept as opaque platform data
///
/// @implNote Package-private. Registered by {@link SitehookJacksonModule}.
class HandlerRegistryDeserializer extends StdDeserializer<HandlerRegistry> {

    @Serial private static final long serialVersionUID = -6081355209421476433L;

    static final String EVENTS_FIELD = "events";

    HandlerRegistryDeserializer() {
        super(HandlerRegistry.class);
    }

    @Override
    public HandlerRegistry deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Registry document must be a JSON object");
        }

        List<HandlerDescriptor> events = new ArrayList<>();
        JsonNode eventsNode = root.get(EVENTS_FIELD);
        if (eventsNode != null && !eventsNode.isNull()) {
            if (!eventsNode.isArray()) {
                throw JsonMappingException.from(p, "Registry 'events' must be an array");
            }
            int index = 0;
            for (JsonNode entry : eventsNode) {
                events.add(readDescriptor(p, entry, index++));
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!EVENTS_FIELD.equals(field.getKey())) {
                Object value = mapper.convertValue(field.getValue(), new TypeReference<Object>() {});
                data.put(field.getKey(), value);
            }
        }

        return new HandlerRegistry(events, data);
    }

    private static HandlerDescriptor readDescriptor(JsonParser p, JsonNode entry, int index)
            throws JsonMappingException {
        if (!entry.isObject()) {
            throw JsonMappingException.from(p, "Registry event #" + index + " must be an object");
        }
        String type = text(entry, "type");
        String handler = text(entry, "handler");
        if (handler == null) {
            handler = text(entry, "class");
        }
        if (type == null || handler == null) {
            throw JsonMappingException.from(
                    p, "Registry event #" + index + " requires 'type' and 'handler' (or 'class')");
        }
        try {
            return new HandlerDescriptor(type, handler, text(entry, "path"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Registry event #" + index + " is invalid: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
