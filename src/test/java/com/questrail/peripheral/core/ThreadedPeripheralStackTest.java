package com.questrail.peripheral.core;

import com.questrail.peripheral.api.ConnectionRoute;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.PeripheralStack;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.api.CharacteristicId;
import com.questrail.peripheral.api.StackError;
import com.questrail.peripheral.config.ConnectionConfiguration;
import com.questrail.peripheral.config.SessionConfiguration;
import com.questrail.peripheral.observability.Slf4jPeripheralObservabilitySink;
import com.questrail.peripheral.radio.FakeRadioAdapter;
import com.questrail.peripheral.radio.FakeRadioSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ThreadedPeripheralStackTest
 * -----------------------------------------------------------------------------
 * Runs the stack with its default threaded dispatcher and radio callbacks
 * delivered from a foreign thread.
 */
class ThreadedPeripheralStackTest {

    private static final PeripheralId P = PeripheralId.of("9e8d7c6b-5a49-4382-9170-6f5e4d3c2b1a");
    private static final ServiceId SERVICE = ServiceId.of("6E400001-B5A3-F393-E0A9-E50E24DCCA9E");
    private static final CharacteristicId RX = CharacteristicId.of("6E400002-B5A3-F393-E0A9-E50E24DCCA9E");

    private FakeRadioAdapter adapter;
    private PeripheralStack stack;

    @BeforeEach
    void setUp() {
        adapter = new FakeRadioAdapter();
        stack = DefaultPeripheralStack.builder()
                .withRadioAdapter(adapter)
                .withObservabilitySink(new Slf4jPeripheralObservabilitySink())
                .build();
    }

    @AfterEach
    void tearDown() {
        stack.close();
    }

    @Test
    void connectsWithCallbacksFromRadioThread() throws InterruptedException {
        CountDownLatch ready = new CountDownLatch(1);
        CountDownLatch connected = new CountDownLatch(1);
        stack.systemReady().subscribe(r -> {
            if (r) {
                ready.countDown();
            }
        });
        stack.connectedPeripherals().subscribe(ids -> {
            if (ids.contains(P)) {
                connected.countDown();
            }
        });

        stack.initializeSession(SessionConfiguration.standard());
        FakeRadioSession session = adapter.session();
        runOnRadioThread(session::emitPoweredOn);
        assertTrue(ready.await(2, TimeUnit.SECONDS), "radio should become ready");

        List<StackError> errors = new CopyOnWriteArrayList<>();
        stack.connectPeripheral(
                ConnectionConfiguration.standard(P, ConnectionRoute.builder().withService(SERVICE, RX).build()),
                errors::add);

        runOnRadioThread(() -> {
            session.emitConnected(P);
            session.emitServices(P, SERVICE);
            session.emitCharacteristics(P, SERVICE, RX);
        });

        assertTrue(connected.await(2, TimeUnit.SECONDS), "peripheral should connect");
        assertTrue(errors.isEmpty());
        assertEquals(Set.of(P), stack.connectedPeripherals().current());
        assertTrue(stack.lookupPath(P, SERVICE, RX).isSuccess());
    }

    @Test
    void closeStopsDelivery() throws InterruptedException {
        stack.initializeSession(SessionConfiguration.standard());
        FakeRadioSession session = adapter.session();

        stack.close();
        runOnRadioThread(session::emitPoweredOn);
        Thread.sleep(100);

        assertFalse(stack.systemReady().current());
        assertTrue(session.isClosed());
    }

    private static void runOnRadioThread(Runnable callbacks) throws InterruptedException {
        Thread radio = new Thread(callbacks, "fake-radio");
        radio.start();
        radio.join();
    }
}
