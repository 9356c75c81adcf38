package com.questrail.peripheral.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ConnectionRoute
 * -----------------------------------------------------------------------------
 * The subset of a peripheral's services and characteristics a caller wants
 * resolved after connecting.
 *
 * <p>A route is either:</p>
 * <ul>
 *   <li><b>all services</b>: every service the peripheral exposes, with all of
 *       its characteristics</li>
 *   <li><b>selective</b>: a mapping from service to the characteristics of
 *       interest; an empty characteristic set means "all characteristics of that
 *       service"</li>
 * </ul>
 */
public final class ConnectionRoute
{
    private static final ConnectionRoute ALL = new ConnectionRoute(null);

    private final Map<ServiceId, Set<CharacteristicId>> services;

    private ConnectionRoute(Map<ServiceId, Set<CharacteristicId>> services) {
        this.services = services;
    }

    public static ConnectionRoute allServices() {
        return ALL;
    }

    public static ConnectionRoute of(Map<ServiceId, Set<CharacteristicId>> services) {
        Objects.requireNonNull(services, "services");
        Map<ServiceId, Set<CharacteristicId>> copy = new LinkedHashMap<>();
        services.forEach((service, characteristics) -> copy.put(
                Objects.requireNonNull(service, "service"),
                characteristics == null ? Set.of() : Set.copyOf(characteristics)));
        return new ConnectionRoute(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean requestsAllServices() {
        return services == null;
    }

    /**
     * Service filter to hand to service discovery; empty means "no filter".
     */
    public Optional<Set<ServiceId>> serviceFilter() {
        return services == null ? Optional.empty() : Optional.of(services.keySet());
    }

    /**
     * Returns true if characteristics of {@code service} should be discovered.
     */
    public boolean includes(ServiceId service) {
        return services == null || services.containsKey(service);
    }

    /**
     * Characteristic filter for one service; empty means "all characteristics".
     */
    public Optional<Set<CharacteristicId>> characteristicFilter(ServiceId service) {
        if (services == null) {
            return Optional.empty();
        }
        Set<CharacteristicId> characteristics = services.get(service);
        if (characteristics == null || characteristics.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(characteristics);
    }

    public Map<ServiceId, Set<CharacteristicId>> services() {
        return services == null ? Map.of() : services;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionRoute that)) return false;
        return Objects.equals(services, that.services);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(services);
    }

    @Override
    public String toString() {
        return services == null ? "ConnectionRoute[all]" : "ConnectionRoute" + services;
    }

    public static final class Builder {
        private final Map<ServiceId, Set<CharacteristicId>> services = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Requests the given characteristics of {@code service}; none means all.
         */
        public Builder withService(ServiceId service, CharacteristicId... characteristics) {
            Objects.requireNonNull(service, "service");
            services.put(service, Set.copyOf(Arrays.asList(characteristics)));
            return this;
        }

        public ConnectionRoute build() {
            return ConnectionRoute.of(services);
        }
    }
}
