package com.questrail.microgrid.driver;

import com.questrail.microgrid.api.Metric;
import com.questrail.microgrid.api.PowerKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ComponentFeatures
 * -----------------------------------------------------------------------------
 * Capability flags reported once by a component's driver.
 *
 * <p>Resolutions are the smallest power increment the component can apply per
 * {@link PowerKind}; setpoints are floored to multiples of them. A kind without
 * an explicit resolution uses 1 W / 1 VAr.</p>
 */
public final class ComponentFeatures
{
    public static final double DEFAULT_RESOLUTION = 1.0;

    private final boolean dcRelay;
    private final boolean acRelay;
    private final boolean precharge;
    private final Map<PowerKind, Double> resolutions;
    private final Set<Metric> supportedMetrics;

    private ComponentFeatures(Builder b) {
        this.dcRelay = b.dcRelay;
        this.acRelay = b.acRelay;
        this.precharge = b.precharge;
        this.resolutions = Collections.unmodifiableMap(new EnumMap<>(b.resolutions));
        this.supportedMetrics = Collections.unmodifiableSet(EnumSet.copyOf(b.supportedMetrics));
    }

    public boolean hasDcRelay() {
        return dcRelay;
    }

    public boolean hasAcRelay() {
        return acRelay;
    }

    public boolean hasRelay(RelayKind kind) {
        return kind == RelayKind.AC ? acRelay : dcRelay;
    }

    public boolean supportsPrecharge() {
        return precharge;
    }

    public double resolution(PowerKind kind) {
        return resolutions.getOrDefault(kind, DEFAULT_RESOLUTION);
    }

    public boolean supportsMetric(Metric metric) {
        return supportedMetrics.contains(metric);
    }

    public Set<Metric> supportedMetrics() {
        return supportedMetrics;
    }

    @Override
    public String toString() {
        return "ComponentFeatures{dcRelay=" + dcRelay
                + ", acRelay=" + acRelay
                + ", precharge=" + precharge
                + ", resolutions=" + resolutions + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean dcRelay;
        private boolean acRelay;
        private boolean precharge;
        private final Map<PowerKind, Double> resolutions = new EnumMap<>(PowerKind.class);
        private Set<Metric> supportedMetrics = EnumSet.allOf(Metric.class);

        public Builder withDcRelay(boolean present) {
            this.dcRelay = present;
            return this;
        }

        public Builder withAcRelay(boolean present) {
            this.acRelay = present;
            return this;
        }

        public Builder withPrecharge(boolean supported) {
            this.precharge = supported;
            return this;
        }

        public Builder withResolution(PowerKind kind, double resolution) {
            Objects.requireNonNull(kind, "kind");
            if (!(resolution > 0) || !Double.isFinite(resolution)) {
                throw new IllegalArgumentException("resolution must be a positive finite number");
            }
            resolutions.put(kind, resolution);
            return this;
        }

        public Builder withSupportedMetrics(Set<Metric> metrics) {
            Objects.requireNonNull(metrics, "metrics");
            this.supportedMetrics = metrics.isEmpty() ? EnumSet.noneOf(Metric.class) : EnumSet.copyOf(metrics);
            return this;
        }

        public ComponentFeatures build() {
            return new ComponentFeatures(this);
        }
    }
}
