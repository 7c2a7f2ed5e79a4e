package com.questrail.groupchat.internal.registry;

import com.questrail.groupchat.transport.PeerLink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * ConnectionRegistry
 * =============================================================================
 * A node's authoritative record of its live links and of the remote ports
 * those links are attached to.
 *
 * <h2>Invariant</h2>
 * A remote port is never held by two links at once. {@link #register(PeerLink)}
 * refuses a link whose port is already present; the caller closes it.
 *
 * <h2>Keys</h2>
 * Links are stored by their transport-assigned id and removed by id, never by
 * equality.
 *
 * <h2>Threading</h2>
 * All mutation happens on the node's event loop. The backing maps are
 * concurrent so that the synchronous broadcast bridge and status queries may
 * take snapshots from other threads without touching loop state.
 */
public final class ConnectionRegistry
{
    private final Map<Long, PeerLink> links = new ConcurrentSkipListMap<>();
    private final Set<Integer> connectedPorts = ConcurrentHashMap.newKeySet();

    /**
     * Add a link and claim its remote port.
     *
     * @return {@code false} if the link's port is already claimed, or the id
     *         is already registered; the registry is unchanged in that case
     */
    public boolean register(PeerLink link)
    {
        Objects.requireNonNull(link, "link");

        if (links.containsKey(link.id())) {
            return false;
        }

        OptionalInt port = link.remotePort();
        if (port.isPresent() && !connectedPorts.add(port.getAsInt())) {
            return false;
        }

        links.put(link.id(), link);
        return true;
    }

    /**
     * Remove a link and release its port. Removing an unknown id is a no-op.
     */
    public Optional<PeerLink> remove(long linkId)
    {
        PeerLink removed = links.remove(linkId);
        if (removed == null) {
            return Optional.empty();
        }
        removed.remotePort().ifPresent(connectedPorts::remove);
        return Optional.of(removed);
    }

    /**
     * Remove every link and release every port.
     *
     * @return the removed links
     */
    public List<PeerLink> clear()
    {
        List<PeerLink> removed = new ArrayList<>();
        for (Long id : new ArrayList<>(links.keySet())) {
            remove(id).ifPresent(removed::add);
        }
        return removed;
    }

    public boolean isPortConnected(int port)
    {
        return connectedPorts.contains(port);
    }

    public boolean contains(long linkId)
    {
        return links.containsKey(linkId);
    }

    /**
     * @return links in id order; safe to iterate while the
     *         registry changes
     */
    public List<PeerLink> snapshot()
    {
        return List.copyOf(links.values());
    }

    public Set<Integer> connectedPorts()
    {
        return Collections.unmodifiableSet(new TreeSet<>(connectedPorts));
    }

    public int size()
    {
        return links.size();
    }

    public boolean isEmpty()
    {
        return links.isEmpty();
    }
}
