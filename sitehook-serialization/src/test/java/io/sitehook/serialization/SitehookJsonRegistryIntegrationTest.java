package io.sitehook.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.sitehook.core.SitehookEnvironment;
import io.sitehook.core.SitehookFactory;
import io.sitehook.core.dispatch.DispatchResult;
import io.sitehook.core.dispatch.DispatchStatus;
import io.sitehook.core.event.Event;
import io.sitehook.core.event.HandlerBucket;
import io.sitehook.core.output.CollectingEventOutput;
import io.sitehook.core.output.EventOutput;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/// Runs events through discovered components: the classpath JSON registry and the
/// ServiceLoader-registered {@link DemoHandlerProvider}.
@DisplayName("JSON registry integration")
class SitehookJsonRegistryIntegrationTest {

    @Test
    @DisplayName("runs the demo event from sitehook-registry.json")
    void shouldRunDemoEventFromClasspathRegistry() throws Exception {
        SitehookEnvironment environment = SitehookFactory.createEnvironment();
        CollectingEventOutput output = EventOutput.collecting();

        Event event = environment.newEvent("demo", new HashMap<>(), output);
        DispatchResult result = event.run();

        assertThat(DemoHandlerProvider.order(event)).containsExactly("A", "B", "C");
        assertThat(result.status()).isEqualTo(DispatchStatus.PARTIAL);
        assertThat(event.size(HandlerBucket.COMPLETE)).isEqualTo(2);
        assertThat(event.size(HandlerBucket.FAILED)).isEqualTo(1);
        assertThat(output.lines())
                .contains(
                        "Running handler HandlerA",
                        "Handler HandlerB failed: B broke",
                        "Handler HandlerC completed: C done");

        JsonNode debug =
                SitehookObjectMapper.create().readTree(new DebugSnapshotWriter().toJson(event));
        assertThat(debug.at("/handlers/complete/0/class").asText())
                .isEqualTo(DemoHandlerProvider.HandlerA.class.getName());
        assertThat(debug.at("/handlers/complete/1/class").asText())
                .isEqualTo(DemoHandlerProvider.HandlerC.class.getName());
        assertThat(debug.at("/handlers/failed/0/message").asText()).isEqualTo("B broke");
        assertThat(debug.at("/handlers/incomplete").size()).isZero();
    }

    @Test
    @DisplayName("exposes registry data to the event")
    void shouldExposeRegistryData() {
        Event event = SitehookFactory.create("site_install", Map.of());

        assertThat(event.registry().data()).containsEntry("environment", "test");
        assertThat(event.registry().descriptorsFor("demo")).hasSize(2);
    }
}
