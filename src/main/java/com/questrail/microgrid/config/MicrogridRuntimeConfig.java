package com.questrail.microgrid.config;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for a microgrid control session.
 *
 * <p>The inventory lists components known at startup; more may be registered
 * later as the external inventory discovers them.</p>
 */
public record MicrogridRuntimeConfig(
    Map<ComponentId, ComponentCategory> inventory,
    WatchdogPolicy watchdogPolicy,
    BoundsPolicy boundsPolicy
) {
    public MicrogridRuntimeConfig {
        Objects.requireNonNull(inventory, "inventory");
        Objects.requireNonNull(watchdogPolicy, "watchdogPolicy");
        Objects.requireNonNull(boundsPolicy, "boundsPolicy");
        inventory = Collections.unmodifiableMap(new LinkedHashMap<>(inventory));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<ComponentId, ComponentCategory> inventory = new LinkedHashMap<>();
        private WatchdogPolicy watchdogPolicy = WatchdogPolicy.defaults();
        private BoundsPolicy boundsPolicy = BoundsPolicy.defaults();

        public Builder addComponent(ComponentId id, ComponentCategory category) {
            inventory.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(category, "category"));
            return this;
        }

        public Builder withWatchdogPolicy(WatchdogPolicy policy) {
            this.watchdogPolicy = policy;
            return this;
        }

        public Builder withBoundsPolicy(BoundsPolicy policy) {
            this.boundsPolicy = policy;
            return this;
        }

        public MicrogridRuntimeConfig build() {
            return new MicrogridRuntimeConfig(inventory, watchdogPolicy, boundsPolicy);
        }
    }
}
