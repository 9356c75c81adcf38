package com.questrail.peripheral.config;

import com.questrail.peripheral.api.ConnectionRoute;
import com.questrail.peripheral.api.PeripheralId;

import java.util.Objects;

/**
 * Everything needed for one connect attempt.
 *
 * @param peripheral the device to connect to
 * @param route      services/characteristics to resolve once connected
 * @param options    options handed to the radio layer
 */
public record ConnectionConfiguration(
    PeripheralId peripheral,
    ConnectionRoute route,
    ConnectionOptions options
) {
    public ConnectionConfiguration {
        Objects.requireNonNull(peripheral, "peripheral");
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(options, "options");
    }

    public static ConnectionConfiguration standard(PeripheralId peripheral, ConnectionRoute route) {
        return new ConnectionConfiguration(peripheral, route, ConnectionOptions.defaults());
    }
}
