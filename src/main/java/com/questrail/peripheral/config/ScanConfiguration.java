package com.questrail.peripheral.config;

import com.questrail.peripheral.api.ServiceId;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a scan.
 * <p>
 * Scanning only for peripherals that advertise known services is strongly
 * preferred; an empty filter reports every advertiser. Reporting duplicates
 * delivers every advertisement packet instead of one per peripheral and is
 * expensive.
 *
 * @param serviceFilter           services a peripheral must advertise; empty
 *                                means no filter
 * @param reportDuplicatePackets  deliver repeated advertisements of the same
 *                                peripheral
 */
public record ScanConfiguration(
    Set<ServiceId> serviceFilter,
    boolean reportDuplicatePackets
) {
    public ScanConfiguration {
        serviceFilter = Set.copyOf(Objects.requireNonNull(serviceFilter, "serviceFilter"));
    }

    public static ScanConfiguration allPeripherals() {
        return new ScanConfiguration(Set.of(), false);
    }

    public static ScanConfiguration forServices(ServiceId... services) {
        return new ScanConfiguration(Set.copyOf(Arrays.asList(services)), false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<ServiceId> serviceFilter = new LinkedHashSet<>();
        private boolean reportDuplicatePackets;

        public Builder withService(ServiceId service) {
            serviceFilter.add(Objects.requireNonNull(service, "service"));
            return this;
        }

        public Builder withReportDuplicatePackets(boolean report) {
            this.reportDuplicatePackets = report;
            return this;
        }

        public ScanConfiguration build() {
            return new ScanConfiguration(serviceFilter, reportDuplicatePackets);
        }
    }
}
