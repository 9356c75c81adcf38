package com.questrail.peripheral.internal.events;

import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.radio.DiscoveredCharacteristic;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Results of structural discovery on a connected peripheral. These are consumed
 * by the path discoverer running for that peripheral.
 */
public sealed interface DiscoveryEvent extends RadioEvent
        permits DiscoveryEvent.ServicesDiscovered, DiscoveryEvent.CharacteristicsDiscovered
{
    PeripheralId peripheral();

    Optional<Throwable> error();

    final class ServicesDiscovered extends RadioEvent.Base implements DiscoveryEvent {
        private final PeripheralId peripheral;
        private final List<ServiceId> services;
        private final Optional<Throwable> error;

        public ServicesDiscovered(Instant timestamp, long sessionEpoch, PeripheralId peripheral,
                                  List<ServiceId> services, Throwable error) {
            super(timestamp, sessionEpoch);
            this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
            this.services = services == null ? List.of() : List.copyOf(services);
            this.error = Optional.ofNullable(error);
        }

        @Override
        public PeripheralId peripheral() {
            return peripheral;
        }

        public List<ServiceId> services() {
            return services;
        }

        @Override
        public Optional<Throwable> error() {
            return error;
        }

        @Override
        public String toString() {
            return "ServicesDiscovered[" + peripheral + ", " + error.map(Throwable::toString).orElse(services.toString()) + "]";
        }
    }

    final class CharacteristicsDiscovered extends RadioEvent.Base implements DiscoveryEvent {
        private final PeripheralId peripheral;
        private final ServiceId service;
        private final List<DiscoveredCharacteristic> characteristics;
        private final Optional<Throwable> error;

        public CharacteristicsDiscovered(Instant timestamp, long sessionEpoch, PeripheralId peripheral,
                                         ServiceId service, List<DiscoveredCharacteristic> characteristics,
                                         Throwable error) {
            super(timestamp, sessionEpoch);
            this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
            this.service = Objects.requireNonNull(service, "service");
            this.characteristics = characteristics == null ? List.of() : List.copyOf(characteristics);
            this.error = Optional.ofNullable(error);
        }

        @Override
        public PeripheralId peripheral() {
            return peripheral;
        }

        public ServiceId service() {
            return service;
        }

        public List<DiscoveredCharacteristic> characteristics() {
            return characteristics;
        }

        @Override
        public Optional<Throwable> error() {
            return error;
        }

        @Override
        public String toString() {
            return "CharacteristicsDiscovered[" + peripheral + "/" + service + ", "
                    + error.map(Throwable::toString).orElse(characteristics.size() + " characteristics") + "]";
        }
    }
}
