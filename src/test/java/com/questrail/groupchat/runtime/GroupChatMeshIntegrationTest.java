package com.questrail.groupchat.runtime;

import com.questrail.groupchat.config.GroupChatConfig;
import com.questrail.groupchat.config.GroupChatTimingPolicy;
import com.questrail.groupchat.observability.RecordingObservabilitySink;
import com.questrail.groupchat.observability.Slf4jGroupChatObservabilitySink;
import com.questrail.groupchat.observability.TransportEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GroupChatMeshIntegrationTest
 * -----------------------------------------------------------------------------
 * Real nodes over loopback TCP with the Netty transport.
 */
class GroupChatMeshIntegrationTest {

    private final List<GroupChatRuntime> nodes = new ArrayList<>();
    private int basePort;

    @BeforeEach
    void setUp() throws IOException {
        basePort = freePortPair();
    }

    @AfterEach
    void tearDown() {
        nodes.forEach(GroupChatRuntime::cleanup);
    }

    @Test
    void twoNodesFindEachOtherAndChat() throws Exception {
        GroupChatRuntime anna = start("Anna", basePort);
        Thread.sleep(300);
        GroupChatRuntime miku = start("Miku", basePort + 1);

        BlockingQueue<String> annaThoughts = new LinkedBlockingQueue<>();
        BlockingQueue<String> mikuThoughts = new LinkedBlockingQueue<>();
        anna.startContextLoop((content, source) -> annaThoughts.add(content));
        miku.startContextLoop((content, source) -> mikuThoughts.add(content));

        awaitTrue(() -> anna.connectedPeerCount() >= 1, "Anna sees Miku's link");
        assertTrue(anna.isAvailable());
        assertTrue(miku.isAvailable());
        assertTrue(miku.connectedPorts().contains(basePort), "Miku dialled Anna's port");

        // Anna's recurring discovery dials Miku's listening port too: one link
        // per direction, one registry entry per remote port.
        awaitTrue(() -> anna.connectedPorts().contains(basePort + 1), "Anna dialled Miku's port");
        Thread.sleep(1_200);
        int annaLinks = anna.connectedPeerCount();
        int mikuLinks = miku.connectedPeerCount();
        assertEquals(2, annaLinks);
        assertEquals(2, mikuLinks);
        assertEquals(annaLinks, anna.connectedPorts().size());
        assertEquals(mikuLinks, miku.connectedPorts().size());

        Thread.sleep(1_200);
        assertEquals(annaLinks, anna.connectedPeerCount(), "another discovery cycle adds nothing");
        assertEquals(mikuLinks, miku.connectedPeerCount(), "another discovery cycle adds nothing");

        assertTrue(anna.broadcast("hello"));
        assertEquals("Anna said: hello", mikuThoughts.poll(5, TimeUnit.SECONDS));

        assertTrue(miku.broadcast("hi Anna"));
        assertEquals("Miku said: hi Anna", annaThoughts.poll(5, TimeUnit.SECONDS));

        // A second link between the pair may deliver duplicates; never Anna's own words.
        Thread.sleep(300);
        assertTrue(annaThoughts.stream().noneMatch(t -> t.startsWith("Anna said")), "Anna never hears herself");
    }

    @Test
    void messagesClaimingOwnNameAreNotInjected() throws Exception {
        GroupChatRuntime anna = start("Anna", basePort);
        BlockingQueue<String> thoughts = new LinkedBlockingQueue<>();
        anna.startContextLoop((content, source) -> thoughts.add(content));

        try (Socket raw = new Socket("127.0.0.1", basePort)) {
            OutputStream out = raw.getOutputStream();
            out.write(line("Anna", "spoofed"));
            out.write("not json at all\n".getBytes(StandardCharsets.UTF_8));
            out.write(line("Bob", "genuine"));
            out.flush();

            assertEquals("Bob said: genuine", thoughts.poll(5, TimeUnit.SECONDS));
            assertTrue(thoughts.isEmpty());
        }
    }

    @Test
    void abruptDisconnectPrunesLinkAndBroadcastDegrades() throws Exception {
        GroupChatRuntime anna = start("Anna", basePort);

        Socket raw = new Socket("127.0.0.1", basePort);
        awaitTrue(() -> anna.connectedPeerCount() == 1, "raw client registered");

        raw.setSoLinger(true, 0);
        raw.close();

        awaitTrue(() -> anna.connectedPeerCount() == 0, "link pruned after reset");
        assertFalse(anna.broadcast("anyone left?"));
        assertTrue(anna.isAvailable(), "listener is still bound");
    }

    @Test
    void secondNodeOnSamePortRunsClientOnly() {
        start("Anna", basePort);
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        GroupChatRuntime twin = GroupChatRuntime.builder()
                .withConfig(config("Twin", basePort))
                .withObservabilitySink(sink)
                .build();
        nodes.add(twin);

        assertTrue(twin.initialize());
        assertTrue(sink.transportKinds().contains(TransportEvent.Kind.CLIENT_ONLY));
    }

    private GroupChatRuntime start(String agent, int port) {
        GroupChatRuntime node = GroupChatRuntime.builder()
                .withConfig(config(agent, port))
                .withObservabilitySink(new Slf4jGroupChatObservabilitySink())
                .build();
        nodes.add(node);
        assertTrue(node.initialize(), agent + " should initialize");
        return node;
    }

    private static GroupChatConfig config(String agent, int port) {
        GroupChatTimingPolicy timing = new GroupChatTimingPolicy(
                Duration.ofMillis(200),
                Duration.ofMillis(50),
                Duration.ofSeconds(30),
                Duration.ofSeconds(1),
                Duration.ofSeconds(30),
                Duration.ofMillis(50),
                Duration.ofSeconds(2));
        return GroupChatConfig.builder()
                .withAgentName(agent)
                .withPort(port)
                .withDiscoveryRange(1)
                .withTimingPolicy(timing)
                .build();
    }

    private static byte[] line(String agent, String message) {
        return ("{\"agent\":\"" + agent + "\",\"message\":\"" + message + "\",\"timestamp\":1.0}\n")
                .getBytes(StandardCharsets.UTF_8);
    }

    private static void awaitTrue(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for: " + what);
            }
            Thread.sleep(20);
        }
    }

    /**
     * Two adjacent free ports, so one node's discovery window covers the other.
     * The neighbours on either side are free too, so nothing else is dialled.
     */
    private static int freePortPair() throws IOException {
        for (int attempt = 0; attempt < 20; attempt++) {
            int candidate;
            try (ServerSocket probe = new ServerSocket(0)) {
                candidate = probe.getLocalPort();
            }
            if (candidate > 1 && candidate < 65534
                    && isFree(candidate - 1) && isFree(candidate)
                    && isFree(candidate + 1) && isFree(candidate + 2)) {
                return candidate;
            }
        }
        throw new IOException("No adjacent free ports found");
    }

    private static boolean isFree(int port) {
        try (ServerSocket probe = new ServerSocket()) {
            probe.bind(new InetSocketAddress("127.0.0.1", port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
