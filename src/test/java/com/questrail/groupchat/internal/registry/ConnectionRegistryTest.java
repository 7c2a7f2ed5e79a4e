package com.questrail.groupchat.internal.registry;

import com.questrail.groupchat.transport.FakePeerLink;
import com.questrail.groupchat.transport.PeerLink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionRegistryTest
 * -----------------------------------------------------------------------------
 * One link per remote port; removal by id releases the port.
 */
class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    void registerClaimsPort() {
        FakePeerLink link = outbound(1, 54322);

        assertTrue(registry.register(link));
        assertTrue(registry.isPortConnected(54322));
        assertTrue(registry.contains(1));
        assertEquals(1, registry.size());
    }

    @Test
    void secondLinkToSamePortIsRefused() {
        assertTrue(registry.register(outbound(1, 54322)));
        assertFalse(registry.register(new FakePeerLink(2, PeerLink.Direction.INBOUND, 54322)));

        assertEquals(1, registry.size());
        assertFalse(registry.contains(2));
    }

    @Test
    void duplicateIdIsRefused() {
        assertTrue(registry.register(outbound(1, 54322)));
        assertFalse(registry.register(outbound(1, 54323)));

        assertFalse(registry.isPortConnected(54323));
    }

    @Test
    void linkWithoutPortIsAccepted() {
        assertTrue(registry.register(outbound(1, 0)));
        assertTrue(registry.register(outbound(2, 0)));

        assertEquals(2, registry.size());
        assertTrue(registry.connectedPorts().isEmpty());
    }

    @Test
    void removeReleasesPort() {
        registry.register(outbound(1, 54322));

        assertTrue(registry.remove(1).isPresent());
        assertFalse(registry.isPortConnected(54322));
        assertTrue(registry.isEmpty());

        assertTrue(registry.register(outbound(2, 54322)), "port can be claimed again");
    }

    @Test
    void removingUnknownIdIsNoOp() {
        registry.register(outbound(1, 54322));

        assertTrue(registry.remove(99).isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void snapshotIsStableWhileRegistryChanges() {
        registry.register(outbound(2, 54323));
        registry.register(outbound(1, 54322));

        List<PeerLink> snapshot = registry.snapshot();
        registry.remove(1);

        assertEquals(2, snapshot.size());
        assertEquals(1, snapshot.get(0).id(), "snapshot is in id order");
        assertEquals(1, registry.size());
    }

    @Test
    void clearRemovesEverything() {
        registry.register(outbound(1, 54322));
        registry.register(outbound(2, 54323));

        assertEquals(2, registry.clear().size());
        assertTrue(registry.isEmpty());
        assertEquals(Set.of(), registry.connectedPorts());
    }

    @Test
    void connectedPortsIsSortedCopy() {
        registry.register(outbound(1, 54325));
        registry.register(outbound(2, 54322));

        Set<Integer> ports = registry.connectedPorts();
        assertEquals(List.of(54322, 54325), List.copyOf(ports));
        assertThrows(UnsupportedOperationException.class, () -> ports.add(1));
    }

    private static FakePeerLink outbound(long id, int port) {
        return new FakePeerLink(id, PeerLink.Direction.OUTBOUND, port);
    }
}
