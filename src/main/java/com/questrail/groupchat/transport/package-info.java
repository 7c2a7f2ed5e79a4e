/**
 * Group Chat Transport Ports
 * =============================================================================
 *
 * <p>These interfaces are the framework-agnostic boundary between the mesh
 * logic (registry, discovery, reader, broadcaster) and a concrete stream
 * transport.</p>
 *
 * <p>Everything above this package sees only:</p>
 * <ul>
 *   <li>links as {@link com.questrail.groupchat.transport.PeerLink}</li>
 *   <li>inbound data as complete lines of text</li>
 *   <li>the event loop as a {@link java.util.concurrent.ScheduledExecutorService}</li>
 * </ul>
 *
 * <p>Implementations perform I/O and line framing only. They do not decode
 * messages, keep a registry, or decide which peers to dial.</p>
 */
package com.questrail.groupchat.transport;
