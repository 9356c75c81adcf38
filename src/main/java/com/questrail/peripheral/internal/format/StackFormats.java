package com.questrail.peripheral.internal.format;

import com.questrail.peripheral.api.DiscoveredPeripheral;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.RadioState;
import com.questrail.peripheral.internal.registry.PendingOperation;
import com.questrail.peripheral.internal.registry.RegistrySnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure derivations from raw container values to the simplified values the
 * application sees.
 */
public final class StackFormats
{
    private StackFormats() {}

    /**
     * Ready only when a session has reported {@link RadioState#POWERED_ON}.
     */
    public static boolean systemReady(Optional<RadioState> state) {
        return state.map(RadioState::isReady).orElse(false);
    }

    public static boolean scanning(RegistrySnapshot registry) {
        return registry.contains(PendingOperation.Instruction.SCANNING);
    }

    /**
     * Discovered peripherals, strongest signal first.
     */
    public static List<DiscoveredPeripheral> availablePeripherals(Map<PeripheralId, DiscoveredPeripheral> discovered) {
        List<DiscoveredPeripheral> sorted = new ArrayList<>(discovered.values());
        sorted.sort(DiscoveredPeripheral.STRONGEST_FIRST);
        return List.copyOf(sorted);
    }
}
