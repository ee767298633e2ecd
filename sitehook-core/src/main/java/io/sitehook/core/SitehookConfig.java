package io.sitehook.core;

import io.sitehook.core.dispatch.DispatchPolicy;
import java.util.Objects;
import java.util.Properties;

/// Configuration options for the Sitehook event environment.
///
/// Controls the dispatcher's failure policy, its execution bound, and where the
/// default registry source looks for its document.
///
/// ### Default Values
/// - `stopOnFirstFailure`: `false` (failed handlers do not halt the run)
/// - `maxHandlerExecutions`: `10000`
/// - `registryResource`: `"sitehook-registry.json"`
///
/// ### Property Keys
/// - `sitehook.dispatch.stop-on-first-failure`
/// - `sitehook.dispatch.max-handler-executions`
/// - `sitehook.registry.resource`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link SitehookFactory};
/// do not modify afterwards.
///
/// @see SitehookFactory.Builder#config(SitehookConfig)
public class SitehookConfig {

    public static final String STOP_ON_FIRST_FAILURE_KEY = "sitehook.dispatch.stop-on-first-failure";
    public static final String MAX_HANDLER_EXECUTIONS_KEY =
            "sitehook.dispatch.max-handler-executions";
    public static final String REGISTRY_RESOURCE_KEY = "sitehook.registry.resource";

    public static final String DEFAULT_REGISTRY_RESOURCE = "sitehook-registry.json";

    private boolean stopOnFirstFailure = false;
    private int maxHandlerExecutions = DispatchPolicy.DEFAULT_MAX_HANDLER_EXECUTIONS;
    private String registryResource = DEFAULT_REGISTRY_RESOURCE;

    /// Creates a configuration with default values.
    public SitehookConfig() {}

    /// Reads a configuration from properties; absent keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if `max-handler-executions` is not a positive integer
    public static SitehookConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        SitehookConfig config = new SitehookConfig();

        String stop = properties.getProperty(STOP_ON_FIRST_FAILURE_KEY);
        if (stop != null && !stop.isBlank()) {
            config.setStopOnFirstFailure(Boolean.parseBoolean(stop.strip()));
        }

        String max = properties.getProperty(MAX_HANDLER_EXECUTIONS_KEY);
        if (max != null && !max.isBlank()) {
            try {
                config.setMaxHandlerExecutions(Integer.parseInt(max.strip()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        MAX_HANDLER_EXECUTIONS_KEY + " must be an integer, got '" + max + "'", e);
            }
        }

        String resource = properties.getProperty(REGISTRY_RESOURCE_KEY);
        if (resource != null && !resource.isBlank()) {
            config.setRegistryResource(resource.strip());
        }
        return config;
    }

    public boolean isStopOnFirstFailure() {
        return stopOnFirstFailure;
    }

    /// Makes the dispatcher stop after the first failed handler.
    ///
    /// @param stopOnFirstFailure `true` to halt on failure, `false` to keep draining
    public void setStopOnFirstFailure(boolean stopOnFirstFailure) {
        this.stopOnFirstFailure = stopOnFirstFailure;
    }

    public int getMaxHandlerExecutions() {
        return maxHandlerExecutions;
    }

    /// Sets the upper bound on handler invocations per dispatch.
    ///
    /// @param maxHandlerExecutions the bound, must be positive
    /// @throws IllegalArgumentException if not positive
    public void setMaxHandlerExecutions(int maxHandlerExecutions) {
        if (maxHandlerExecutions <= 0) {
            throw new IllegalArgumentException(
                    "maxHandlerExecutions must be positive, got " + maxHandlerExecutions);
        }
        this.maxHandlerExecutions = maxHandlerExecutions;
    }

    /// Returns the classpath resource the default registry source reads.
    ///
    /// @return resource name, never null
    public String getRegistryResource() {
        return registryResource;
    }

    public void setRegistryResource(String registryResource) {
        this.registryResource =
                Objects.requireNonNull(registryResource, "registryResource must not be null");
    }

    /// Returns the dispatcher policy described by this configuration.
    ///
    /// @return dispatch policy, never null
    public DispatchPolicy toDispatchPolicy() {
        return new DispatchPolicy(stopOnFirstFailure, maxHandlerExecutions);
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link SitehookConfig}.
    public static class Builder {
        private final SitehookConfig config = new SitehookConfig();

        public Builder stopOnFirstFailure(boolean stopOnFirstFailure) {
            config.setStopOnFirstFailure(stopOnFirstFailure);
            return this;
        }

        public Builder maxHandlerExecutions(int maxHandlerExecutions) {
            config.setMaxHandlerExecutions(maxHandlerExecutions);
            return this;
        }

        public Builder registryResource(String registryResource) {
            config.setRegistryResource(registryResource);
            return this;
        }

        /// Returns the configured instance.
        ///
        /// @return the configuration, never null
        public SitehookConfig build() {
            return config;
        }
    }
}
