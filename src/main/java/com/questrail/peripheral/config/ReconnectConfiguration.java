package com.questrail.peripheral.config;

import com.questrail.peripheral.api.ConnectionRoute;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.ServiceId;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration for reconnecting to a peripheral seen in an earlier session.
 * <p>
 * The identifier is first looked up among the peripherals the radio layer
 * remembers; failing that, among the peripherals already connected to the
 * system that expose {@link #serviceIdentifiers()}.
 *
 * @param peripheral          identifier retained from an earlier session
 * @param serviceIdentifiers  services used for the connected-peripheral lookup
 * @param route               services/characteristics to resolve once connected
 * @param options             options handed to the radio layer
 */
public record ReconnectConfiguration(
    PeripheralId peripheral,
    Set<ServiceId> serviceIdentifiers,
    ConnectionRoute route,
    ConnectionOptions options
) {
    public ReconnectConfiguration {
        Objects.requireNonNull(peripheral, "peripheral");
        serviceIdentifiers = Set.copyOf(Objects.requireNonNull(serviceIdentifiers, "serviceIdentifiers"));
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(options, "options");
    }

    /**
     * Connect configuration for the identifier the lookup resolved to.
     */
    public ConnectionConfiguration toConnectionConfiguration(PeripheralId resolved) {
        return new ConnectionConfiguration(resolved, route, options);
    }

    public static Builder builder(PeripheralId peripheral) {
        return new Builder(peripheral);
    }

    public static final class Builder {
        private final PeripheralId peripheral;
        private final Set<ServiceId> serviceIdentifiers = new LinkedHashSet<>();
        private ConnectionRoute route = ConnectionRoute.allServices();
        private ConnectionOptions options = ConnectionOptions.defaults();

        private Builder(PeripheralId peripheral) {
            this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
        }

        public Builder withService(ServiceId service) {
            serviceIdentifiers.add(Objects.requireNonNull(service, "service"));
            return this;
        }

        public Builder withRoute(ConnectionRoute route) {
            this.route = route;
            return this;
        }

        public Builder withOptions(ConnectionOptions options) {
            this.options = options;
            return this;
        }

        public ReconnectConfiguration build() {
            return new ReconnectConfiguration(peripheral, serviceIdentifiers, route, options);
        }
    }
}
