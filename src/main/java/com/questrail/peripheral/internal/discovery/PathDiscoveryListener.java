package com.questrail.peripheral.internal.discovery;

import com.questrail.peripheral.api.KnownPath;

import java.util.List;

/**
 * Receives the single outcome of a {@link PathDiscoverer} run.
 */
public interface PathDiscoveryListener
{
    void onPathsResolved(PathDiscoverer discoverer, List<KnownPath> paths);

    void onDiscoveryFailed(PathDiscoverer discoverer, Throwable cause);
}
