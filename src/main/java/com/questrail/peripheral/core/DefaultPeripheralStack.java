package com.questrail.peripheral.core;

import com.questrail.peripheral.api.CharacteristicId;
import com.questrail.peripheral.api.ConnectionRoute;
import com.questrail.peripheral.api.DiscoveredPeripheral;
import com.questrail.peripheral.api.ErrorHandler;
import com.questrail.peripheral.api.KnownPath;
import com.questrail.peripheral.api.Outcome;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.PeripheralStack;
import com.questrail.peripheral.api.RadioState;
import com.questrail.peripheral.api.ReadinessDiagnostics;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.api.SessionReplacedException;
import com.questrail.peripheral.api.StackError;
import com.questrail.peripheral.api.StateView;
import com.questrail.peripheral.config.ConnectionConfiguration;
import com.questrail.peripheral.config.ReconnectConfiguration;
import com.questrail.peripheral.config.ScanConfiguration;
import com.questrail.peripheral.config.SessionConfiguration;
import com.questrail.peripheral.internal.discovery.PathDiscoverer;
import com.questrail.peripheral.internal.discovery.PathDiscoveryListener;
import com.questrail.peripheral.internal.events.ConnectionEvent;
import com.questrail.peripheral.internal.events.DiscoveryEvent;
import com.questrail.peripheral.internal.events.RadioEvent;
import com.questrail.peripheral.internal.events.RadioLifecycleEvent;
import com.questrail.peripheral.internal.exec.RadioEventDispatcher;
import com.questrail.peripheral.internal.exec.ThreadedRadioEventDispatcher;
import com.questrail.peripheral.internal.format.FormattedView;
import com.questrail.peripheral.internal.format.StackFormats;
import com.questrail.peripheral.internal.registry.OperationRegistry;
import com.questrail.peripheral.internal.registry.PendingOperation;
import com.questrail.peripheral.internal.registry.PendingOperation.Instruction;
import com.questrail.peripheral.internal.registry.RegistrySnapshot;
import com.questrail.peripheral.internal.state.StateContainer;
import com.questrail.peripheral.internal.time.SystemWallClock;
import com.questrail.peripheral.internal.time.WallClock;
import com.questrail.peripheral.observability.AnomalyKind;
import com.questrail.peripheral.observability.NullObservabilitySink;
import com.questrail.peripheral.observability.PeripheralErrorEvent;
import com.questrail.peripheral.observability.PeripheralObservabilitySink;
import com.questrail.peripheral.observability.RegistryTransitionEvent;
import com.questrail.peripheral.observability.SessionAnomalyEvent;
import com.questrail.peripheral.radio.RadioAdapter;
import com.questrail.peripheral.radio.RadioSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;

/**
 * DefaultPeripheralStack
 * =============================================================================
 * Default {@link PeripheralStack}: owns the operation registry, the state
 * containers and the path discoverers, and is the only writer of all of them.
 *
 * <h2>Threading model</h2>
 * Every mutation runs while holding one re-entrant monitor owned by this
 * object. Commands take it on the caller's thread; radio events are first
 * serialized by a {@link RadioEventDispatcher} and then applied under it.
 * Error handlers and view subscribers therefore run with the monitor held and
 * may call back into the stack.
 *
 * <h2>Event flow</h2>
 * <pre>
 *   radio thread → SessionEventAdapter → dispatcher queue
 *                → dispatcher lane → apply(event) [monitor held]
 * </pre>
 * Events carry the epoch of the session that produced them. Events from a
 * replaced session are dropped and counted as
 * {@link AnomalyKind#STALE_SESSION_EVENT}.
 *
 * <h2>Connect lifecycle</h2>
 * <pre>
 *   connectPeripheral   → CONNECTING entry, id in connecting set, radio connect
 *   Connected           → PathDiscoverer started with the entry's route
 *   paths resolved      → paths recorded, entry removed, id connecting → connected
 *   discovery failed    → entry removed, caller told, link torn down
 *   ConnectFailed       → entry removed, caller told
 *   cancelConnection    → id leaves its set, DISCONNECTING entry, radio cancel
 *   Disconnected        → both entries removed (callers told only on error),
 *                         id leaves both sets, paths pruned
 * </pre>
 */
public final class DefaultPeripheralStack implements PeripheralStack {

    private final Object monitor = new Object();

    private final RadioAdapter radioAdapter;
    private final RadioEventDispatcher dispatcher;
    private final PeripheralObservabilitySink observabilitySink;
    private final WallClock clock;

    private final OperationRegistry registry = new OperationRegistry(monitor);

    private final StateContainer<Optional<RadioState>> radioState =
            new StateContainer<>("radioState", Optional.empty(), monitor);
    private final StateContainer<Map<PeripheralId, DiscoveredPeripheral>> discovered =
            new StateContainer<>("discovered", Map.of(), monitor);
    private final StateContainer<Set<PeripheralId>> connecting =
            new StateContainer<>("connecting", Set.of(), monitor);
    private final StateContainer<Set<PeripheralId>> connected =
            new StateContainer<>("connected", Set.of(), monitor);
    private final StateContainer<Set<KnownPath>> paths =
            new StateContainer<>("knownPaths", Set.of(), monitor);

    private final StateView<Boolean> systemReady;
    private final StateView<Boolean> scanning;
    private final StateView<List<DiscoveredPeripheral>> availablePeripherals;

    private final Map<PeripheralId, PathDiscoverer> discoverers = new HashMap<>();
    private final PathDiscoveryListener discoveryListener = new DiscoveryOutcomes();

    private final Map<AnomalyKind, LongAdder> anomalies = new EnumMap<>(AnomalyKind.class);

    // Guarded by monitor; read without it only through the volatile.
    private volatile RadioSession session;
    private long epoch;
    // Set by the first initializeSession; close() leaves it set.
    private boolean initialized;
    private RegistrySnapshot lastPublishedRegistry;

    private DefaultPeripheralStack(RadioAdapter radioAdapter,
                                   RadioEventDispatcher dispatcher,
                                   PeripheralObservabilitySink observabilitySink,
                                   WallClock clock) {
        this.radioAdapter = radioAdapter;
        this.dispatcher = dispatcher;
        this.observabilitySink = observabilitySink;
        this.clock = clock;

        for (AnomalyKind kind : AnomalyKind.values()) {
            anomalies.put(kind, new LongAdder());
        }

        this.systemReady = new FormattedView<>("systemReady", radioState, StackFormats::systemReady, monitor);
        this.scanning = new FormattedView<>("scanning", registry.view(), StackFormats::scanning, monitor);
        this.availablePeripherals = new FormattedView<>(
                "availablePeripherals", discovered, StackFormats::availablePeripherals, monitor);

        registry.view().subscribe(this::publishRegistryTransition);
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================================================================
    // Commands
    // =========================================================================

    @Override
    public void initializeSession(SessionConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        List<PendingOperation> interrupted;
        synchronized (monitor) {
            RadioSession previous = session;
            interrupted = initialized ? resetState() : List.of();
            initialized = true;
            if (previous != null) {
                previous.close();
            }

            long sessionEpoch = ++epoch;
            dispatcher.start(this::apply);
            session = radioAdapter.open(configuration,
                    new SessionEventAdapter(sessionEpoch, clock, observabilitySink, dispatcher::submit));

            for (PendingOperation operation : interrupted) {
                operation.addressee().ifPresent(addressee -> addressee.onError().onError(
                        new StackError.RadioError(addressee.peripheral(), new SessionReplacedException())));
            }
        }
    }

    @Override
    public void startScanning(ScanConfiguration configuration, ErrorHandler onError) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(onError, "onError");
        synchronized (monitor) {
            if (!isReady()) {
                onError.onError(StackError.systemNotReady());
                return;
            }
            Outcome<PendingOperation> inserted = registry.insert(PendingOperation.scanning());
            if (inserted instanceof Outcome.Failure<PendingOperation> failure) {
                onError.onError(failure.error());
                return;
            }
            discovered.set(Map.of());
            session.startScan(configuration);
        }
    }

    @Override
    public void stopScanning(ErrorHandler onError) {
        Objects.requireNonNull(onError, "onError");
        synchronized (monitor) {
            if (!registry.contains(Instruction.SCANNING)) {
                onError.onError(StackError.invalidInstruction("STOP_SCANNING"));
                return;
            }
            RadioSession current = session;
            if (current != null) {
                current.stopScan();
            }
            registry.remove(PendingOperation.scanning());
        }
    }

    @Override
    public void connectPeripheral(ConnectionConfiguration configuration, ErrorHandler onError) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(onError, "onError");
        PeripheralId id = configuration.peripheral();
        synchronized (monitor) {
            if (!isReady()) {
                onError.onError(StackError.systemNotReady());
                return;
            }
            if (connected.current().contains(id)) {
                onError.onError(StackError.invalidInstruction(Instruction.CONNECTING.name(), id));
                return;
            }
            Outcome<PendingOperation> inserted =
                    registry.insert(PendingOperation.connecting(id, configuration.route(), onError));
            if (inserted instanceof Outcome.Failure<PendingOperation> failure) {
                onError.onError(failure.error());
                return;
            }
            connecting.update(ids -> with(ids, id));
            session.connect(id, configuration.options());
        }
    }

    @Override
    public void cancelConnection(PeripheralId peripheral, ErrorHandler onError) {
        Objects.requireNonNull(peripheral, "peripheral");
        Objects.requireNonNull(onError, "onError");
        synchronized (monitor) {
            if (!isReady()) {
                onError.onError(StackError.systemNotReady());
                return;
            }
            if (registry.contains(Instruction.DISCONNECTING, peripheral)) {
                onError.onError(StackError.invalidInstruction(Instruction.DISCONNECTING.name(), peripheral));
                return;
            }
            if (connecting.current().contains(peripheral)) {
                connecting.update(ids -> without(ids, peripheral));
            } else if (connected.current().contains(peripheral)) {
                connected.update(ids -> without(ids, peripheral));
            } else {
                onError.onError(StackError.unknownDevice(peripheral));
                return;
            }
            registry.insert(PendingOperation.disconnecting(peripheral, onError));
            session.cancelOrDisconnect(peripheral);
        }
    }

    @Override
    public void reconnectToPeripheral(ReconnectConfiguration configuration, ErrorHandler onError) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(onError, "onError");
        PeripheralId requested = configuration.peripheral();
        synchronized (monitor) {
            RadioSession current = session;
            if (current == null) {
                onError.onError(StackError.unknownDevice(requested));
                return;
            }
            Optional<PeripheralId> resolved = current.lookupKnownIdentifier(requested);
            if (resolved.isEmpty()
                    && current.lookupConnectedMatchingServices(configuration.serviceIdentifiers()).contains(requested)) {
                resolved = Optional.of(requested);
            }
            if (resolved.isEmpty()) {
                onError.onError(StackError.unknownDevice(requested));
                return;
            }
            connectPeripheral(configuration.toConnectionConfiguration(resolved.get()), onError);
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    @Override
    public Outcome<KnownPath> lookupPath(PeripheralId peripheral, ServiceId service, CharacteristicId characteristic) {
        Objects.requireNonNull(peripheral, "peripheral");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(characteristic, "characteristic");
        for (KnownPath path : paths.current()) {
            if (path.matches(peripheral, service, characteristic)) {
                return Outcome.success(path);
            }
        }
        return Outcome.failure(new StackError.UnknownPath(peripheral, service, characteristic));
    }

    @Override
    public ReadinessDiagnostics troubleshootReadiness() {
        return new ReadinessDiagnostics(radioState.current(), radioAdapter.authorization());
    }

    @Override
    public long anomalyCount() {
        long total = 0;
        for (LongAdder count : anomalies.values()) {
            total += count.sum();
        }
        return total;
    }

    @Override
    public long anomalyCount(AnomalyKind kind) {
        return anomalies.get(Objects.requireNonNull(kind, "kind")).sum();
    }

    @Override
    public StateView<Boolean> systemReady() {
        return systemReady;
    }

    @Override
    public StateView<Boolean> scanning() {
        return scanning;
    }

    @Override
    public StateView<List<DiscoveredPeripheral>> availablePeripherals() {
        return availablePeripherals;
    }

    @Override
    public StateView<Set<PeripheralId>> connectingPeripherals() {
        return connecting;
    }

    @Override
    public StateView<Set<PeripheralId>> connectedPeripherals() {
        return connected;
    }

    @Override
    public StateView<Set<KnownPath>> knownPaths() {
        return paths;
    }

    /**
     * Stops event delivery and closes the radio session. Pending operations are
     * left as they are; the next {@link #initializeSession} fails them with
     * {@link SessionReplacedException} and starts over from a clean state.
     */
    @Override
    public void close() {
        synchronized (monitor) {
            RadioSession current = session;
            session = null;
            epoch++;
            for (PathDiscoverer discoverer : discoverers.values()) {
                discoverer.abandon();
            }
            discoverers.clear();
            radioState.set(Optional.empty());
            if (current != null) {
                current.close();
            }
        }
        // Outside the monitor: the event thread may be waiting for it.
        dispatcher.stop();
    }

    // =========================================================================
    // Event handling (dispatcher lane)
    // =========================================================================

    /**
     * Applies one radio event. Called by the dispatcher, one event at a time.
     */
    void apply(RadioEvent event) {
        Objects.requireNonNull(event, "event");
        synchronized (monitor) {
            observabilitySink.onRadioEvent(event);
            if (event.sessionEpoch() != epoch) {
                reportAnomaly(AnomalyKind.STALE_SESSION_EVENT, peripheralOf(event),
                        "event from session " + event.sessionEpoch() + " while session " + epoch + " is current: " + event);
                return;
            }

            // Explicit dispatch; each handler is written for one event type.
            if (event instanceof RadioLifecycleEvent.StateChanged e) {
                onStateChanged(e);
            } else if (event instanceof RadioLifecycleEvent.PeripheralDiscovered e) {
                onPeripheralDiscovered(e);
            } else if (event instanceof ConnectionEvent.Connected e) {
                onConnected(e);
            } else if (event instanceof ConnectionEvent.ConnectFailed e) {
                onConnectFailed(e);
            } else if (event instanceof ConnectionEvent.Disconnected e) {
                onDisconnected(e);
            } else if (event instanceof DiscoveryEvent.ServicesDiscovered e) {
                onServicesDiscovered(e);
            } else if (event instanceof DiscoveryEvent.CharacteristicsDiscovered e) {
                onCharacteristicsDiscovered(e);
            }
        }
    }

    private void onStateChanged(RadioLifecycleEvent.StateChanged e) {
        radioState.set(Optional.of(e.state()));
    }

    private void onPeripheralDiscovered(RadioLifecycleEvent.PeripheralDiscovered e) {
        DiscoveredPeripheral peripheral = e.peripheral();
        discovered.update(current -> {
            Map<PeripheralId, DiscoveredPeripheral> next = new LinkedHashMap<>(current);
            next.put(peripheral.id(), peripheral);
            return Collections.unmodifiableMap(next);
        });
    }

    private void onConnected(ConnectionEvent.Connected e) {
        PeripheralId id = e.peripheral();
        Optional<PendingOperation> pending = registry.findAddressee(id, Instruction.CONNECTING);
        if (pending.isEmpty()) {
            reportAnomaly(AnomalyKind.UNSOLICITED_CONNECT, Optional.of(id), "connected without a pending connect");
            return;
        }
        if (discoverers.containsKey(id)) {
            reportAnomaly(AnomalyKind.DUPLICATE_CONNECT, Optional.of(id), "connected again while resolving paths");
            return;
        }

        ConnectionRoute route = pending.get().addressee()
                .flatMap(PendingOperation.Addressee::route)
                .orElseGet(ConnectionRoute::allServices);
        PathDiscoverer discoverer = new PathDiscoverer(id, route, session, discoveryListener);
        discoverers.put(id, discoverer);
        discoverer.start();
    }

    private void onConnectFailed(ConnectionEvent.ConnectFailed e) {
        PeripheralId id = e.peripheral();
        abandonDiscoverer(id);
        Optional<PendingOperation> pending = registry.take(id, Instruction.CONNECTING);
        connecting.update(ids -> without(ids, id));
        if (pending.isEmpty()) {
            reportAnomaly(AnomalyKind.UNSOLICITED_CONNECT_FAILURE, Optional.of(id),
                    "connect failed without a pending connect: " + e.cause().map(Throwable::toString).orElse("no cause"));
            return;
        }
        reportTo(pending.get(), StackError.RadioError.wrap(id, e.cause()));
    }

    private void onDisconnected(ConnectionEvent.Disconnected e) {
        PeripheralId id = e.peripheral();
        abandonDiscoverer(id);

        List<PendingOperation> settled = new ArrayList<>(2);
        registry.take(id, Instruction.CONNECTING).ifPresent(settled::add);
        registry.take(id, Instruction.DISCONNECTING).ifPresent(settled::add);

        connecting.update(ids -> without(ids, id));
        connected.update(ids -> without(ids, id));
        paths.update(current -> retain(current, path -> !path.peripheral().equals(id)));

        if (e.cause().isPresent()) {
            StackError error = StackError.RadioError.wrap(id, e.cause());
            for (PendingOperation operation : settled) {
                reportTo(operation, error);
            }
        }
    }

    private void onServicesDiscovered(DiscoveryEvent.ServicesDiscovered e) {
        PathDiscoverer discoverer = discoverers.get(e.peripheral());
        if (discoverer == null || !discoverer.onServicesDiscovered(e)) {
            reportAnomaly(AnomalyKind.UNSOLICITED_DISCOVERY_RESULT, Optional.of(e.peripheral()), e.toString());
        }
    }

    private void onCharacteristicsDiscovered(DiscoveryEvent.CharacteristicsDiscovered e) {
        PathDiscoverer discoverer = discoverers.get(e.peripheral());
        if (discoverer == null || !discoverer.onCharacteristicsDiscovered(e)) {
            reportAnomaly(AnomalyKind.UNSOLICITED_DISCOVERY_RESULT, Optional.of(e.peripheral()), e.toString());
        }
    }

    /**
     * Outcomes of the path discoverers; always called on the event lane.
     */
    private final class DiscoveryOutcomes implements PathDiscoveryListener {

        @Override
        public void onPathsResolved(PathDiscoverer discoverer, List<KnownPath> resolved) {
            PeripheralId id = discoverer.peripheral();
            discoverers.remove(id, discoverer);
            registry.take(id, Instruction.CONNECTING);

            if (registry.contains(Instruction.DISCONNECTING, id)) {
                // Cancelled while resolving; the pending Disconnected settles it.
                return;
            }
            paths.update(current -> {
                Set<KnownPath> next = new LinkedHashSet<>(current);
                next.addAll(resolved);
                return Collections.unmodifiableSet(next);
            });
            connecting.update(ids -> without(ids, id));
            connected.update(ids -> with(ids, id));
        }

        @Override
        public void onDiscoveryFailed(PathDiscoverer discoverer, Throwable cause) {
            PeripheralId id = discoverer.peripheral();
            discoverers.remove(id, discoverer);
            Optional<PendingOperation> pending = registry.take(id, Instruction.CONNECTING);
            connecting.update(ids -> without(ids, id));

            pending.ifPresent(operation -> reportTo(
                    operation, new StackError.RadioError(id, cause)));
            tearDown(id);
        }
    }

    /**
     * Disconnects a peripheral on the stack's own behalf. Skips the readiness
     * check; failures go to the observability sink since no caller asked.
     */
    private void tearDown(PeripheralId id) {
        RadioSession current = session;
        if (current == null || registry.contains(Instruction.DISCONNECTING, id)) {
            return;
        }
        registry.insert(PendingOperation.disconnecting(id, error -> observabilitySink.onError(
                new PeripheralErrorEvent(clock.now(), "Teardown of " + id + " failed: " + error.describe(),
                        error instanceof StackError.RadioError radioError ? radioError.cause() : null))));
        current.cancelOrDisconnect(id);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private boolean isReady() {
        return session != null && StackFormats.systemReady(radioState.current());
    }

    /**
     * Returns every container to its initial value and empties the registry.
     *
     * @return the connect and disconnect operations that were pending
     */
    private List<PendingOperation> resetState() {
        for (PathDiscoverer discoverer : discoverers.values()) {
            discoverer.abandon();
        }
        discoverers.clear();

        List<PendingOperation> interrupted = new ArrayList<>();
        for (PendingOperation operation : registry.clear()) {
            if (operation.addressee().isPresent()) {
                interrupted.add(operation);
            }
        }
        radioState.set(Optional.empty());
        discovered.set(Map.of());
        connecting.set(Set.of());
        connected.set(Set.of());
        paths.set(Set.of());
        return interrupted;
    }

    private void reportTo(PendingOperation operation, StackError error) {
        operation.addressee().ifPresent(addressee -> addressee.onError().onError(error));
    }

    private void abandonDiscoverer(PeripheralId id) {
        PathDiscoverer discoverer = discoverers.remove(id);
        if (discoverer != null) {
            discoverer.abandon();
        }
    }

    private void reportAnomaly(AnomalyKind kind, Optional<PeripheralId> peripheral, String detail) {
        anomalies.get(kind).increment();
        observabilitySink.onAnomaly(new SessionAnomalyEvent(clock.now(), kind, peripheral, detail));
    }

    private void publishRegistryTransition(RegistrySnapshot snapshot) {
        RegistrySnapshot before = lastPublishedRegistry;
        lastPublishedRegistry = snapshot;
        if (before != null) {
            observabilitySink.onRegistryTransition(new RegistryTransitionEvent(clock.now(), before, snapshot));
        }
    }

    private static Optional<PeripheralId> peripheralOf(RadioEvent event) {
        if (event instanceof ConnectionEvent e) {
            return Optional.of(e.peripheral());
        }
        if (event instanceof DiscoveryEvent e) {
            return Optional.of(e.peripheral());
        }
        if (event instanceof RadioLifecycleEvent.PeripheralDiscovered e) {
            return Optional.of(e.peripheral().id());
        }
        return Optional.empty();
    }

    private static <T> Set<T> with(Set<T> set, T element) {
        Set<T> next = new LinkedHashSet<>(set);
        next.add(element);
        return Collections.unmodifiableSet(next);
    }

    private static <T> Set<T> without(Set<T> set, T element) {
        Set<T> next = new LinkedHashSet<>(set);
        next.remove(element);
        return Collections.unmodifiableSet(next);
    }

    private static <T> Set<T> retain(Set<T> set, Predicate<? super T> keep) {
        Set<T> next = new LinkedHashSet<>();
        for (T element : set) {
            if (keep.test(element)) {
                next.add(element);
            }
        }
        return Collections.unmodifiableSet(next);
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private RadioAdapter radioAdapter;
        private RadioEventDispatcher dispatcher;
        private PeripheralObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;

        private Builder() {}

        public Builder withRadioAdapter(RadioAdapter adapter) {
            this.radioAdapter = adapter;
            return this;
        }

        /**
         * Event dispatcher; defaults to a {@link ThreadedRadioEventDispatcher}.
         */
        public Builder withDispatcher(RadioEventDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder withObservabilitySink(PeripheralObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public DefaultPeripheralStack build() {
            Objects.requireNonNull(radioAdapter, "radioAdapter");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            RadioEventDispatcher effectiveDispatcher = dispatcher != null
                    ? dispatcher
                    : new ThreadedRadioEventDispatcher("peripheral-event-dispatcher", clock, observabilitySink);

            return new DefaultPeripheralStack(radioAdapter, effectiveDispatcher, observabilitySink, clock);
        }
    }
}
