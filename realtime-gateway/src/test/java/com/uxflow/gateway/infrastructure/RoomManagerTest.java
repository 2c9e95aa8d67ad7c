package com.uxflow.gateway.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.OutboundFrame;
import com.uxflow.gateway.domain.RelayEnvelope;
import com.uxflow.gateway.domain.Tier;
import com.uxflow.gateway.support.GatewayFixture;
import com.uxflow.gateway.support.RecordingClientChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RoomManagerTest {

    private GatewayFixture gateway;
    private RoomManager rooms;

    @BeforeEach
    void setUp() {
        gateway = GatewayFixture.single();
        rooms = gateway.roomManager;
    }

    @Test
    void joinThenLeaveRestoresMembership() {
        Connection a = member("a", "user-a");
        rooms.join("proj-1", a);
        Set<String> before = rooms.getLocalMemberIds("proj-1");

        Connection b = member("b", "user-b");
        rooms.join("proj-1", b);
        assertThat(rooms.leave("proj-1", "b")).isTrue();

        assertThat(rooms.getLocalMemberIds("proj-1")).isEqualTo(before);
        assertThat(gateway.store.rawMembers(gateway.keys.roomMembers("proj-1")))
                .containsExactly("user-a:a:gw-test");
    }

    @Test
    void joinNotifiesExistingMembersOnly() {
        RecordingClientChannel channelA = new RecordingClientChannel();
        RecordingClientChannel channelB = new RecordingClientChannel();
        rooms.join("proj-1", member("a", "user-a", channelA));
        rooms.join("proj-1", member("b", "user-b", channelB));

        List<JsonNode> joined = channelA.framesOfType("member_joined");
        assertThat(joined).hasSize(1);
        assertThat(joined.get(0).get("userId").asText()).isEqualTo("user-b");
        assertThat(joined.get(0).get("memberCount").asInt()).isEqualTo(2);
        assertThat(channelB.framesOfType("member_joined")).isEmpty();
    }

    @Test
    void leaveIsIdempotentAndDropsEmptyRoom() {
        rooms.join("proj-1", member("a", "user-a"));

        assertThat(rooms.leave("proj-1", "a")).isTrue();
        assertThat(rooms.leave("proj-1", "a")).isFalse();
        assertThat(rooms.leave("unknown-room", "a")).isFalse();
        assertThat(rooms.getRoomCount()).isZero();
        assertThat(rooms.getRoomOf("a")).isEmpty();
    }

    @Test
    void connectionIsInAtMostOneRoom() {
        Connection a = member("a", "user-a");
        rooms.join("proj-1", a);
        rooms.join("proj-2", a);

        assertThat(rooms.getLocalMemberIds("proj-1")).isEmpty();
        assertThat(rooms.getLocalMemberIds("proj-2")).containsExactly("a");
        assertThat(rooms.getRoomOf("a")).contains("proj-2");
        assertThat(a.getRoomId()).isEqualTo("proj-2");
    }

    @Test
    void broadcastSkipsExcludedMember() {
        RecordingClientChannel channelA = new RecordingClientChannel();
        RecordingClientChannel channelB = new RecordingClientChannel();
        RecordingClientChannel channelC = new RecordingClientChannel();
        rooms.join("proj-1", member("a", "user-a", channelA));
        rooms.join("proj-1", member("b", "user-b", channelB));
        rooms.join("proj-1", member("c", "user-c", channelC));

        int delivered = rooms.broadcastToRoom("proj-1", OutboundFrame.of("flow_updated"), "a");

        assertThat(delivered).isEqualTo(2);
        assertThat(channelA.framesOfType("flow_updated")).isEmpty();
        assertThat(channelB.framesOfType("flow_updated")).hasSize(1);
        assertThat(channelC.framesOfType("flow_updated")).hasSize(1);
    }

    @Test
    void failedMembersArePrunedWithoutAbortingBroadcast() {
        RecordingClientChannel channelA = new RecordingClientChannel();
        RecordingClientChannel channelB = new RecordingClientChannel();
        RecordingClientChannel channelC = new RecordingClientChannel();
        rooms.join("proj-1", member("a", "user-a", channelA));
        rooms.join("proj-1", member("b", "user-b", channelB));
        rooms.join("proj-1", member("c", "user-c", channelC));
        channelB.breakConnection();

        int delivered = rooms.broadcastToRoom("proj-1", OutboundFrame.of("flow_updated"), null);

        assertThat(delivered).isEqualTo(2);
        assertThat(rooms.getLocalMemberIds("proj-1")).containsExactlyInAnyOrder("a", "c");
        assertThat(channelC.framesOfType("member_left"))
                .extracting(frame -> frame.get("userId").asText())
                .containsExactly("user-b");
        assertThat(gateway.metrics.count("gateway.broadcast.pruned")).isEqualTo(1.0);
    }

    @Test
    void closedMemberIsNotCountedAsDelivered() {
        Connection a = member("a", "user-a");
        Connection b = member("b", "user-b");
        rooms.join("proj-1", a);
        rooms.join("proj-1", b);
        b.markClosed();

        assertThat(rooms.broadcastToRoom("proj-1", OutboundFrame.of("flow_updated"), "a")).isZero();
        assertThat(rooms.getLocalMemberIds("proj-1")).containsExactly("a");
    }

    @Test
    void broadcastIsRelayedWithOrigin() {
        rooms.join("proj-1", member("a", "user-a"));
        gateway.hub.published().clear();

        rooms.broadcastToRoom("proj-1", OutboundFrame.of("flow_updated"), "a");

        assertThat(gateway.hub.published()).hasSize(1);
        RelayEnvelope envelope = gateway.hub.published().get(0);
        assertThat(envelope.getRoomId()).isEqualTo("proj-1");
        assertThat(envelope.getOriginGatewayId()).isEqualTo("gw-test");
        assertThat(envelope.getExcludeConnectionId()).isEqualTo("a");
        assertThat(envelope.getMessage()).contains("\"type\":\"flow_updated\"");
    }

    @Test
    void broadcastFramesAndRelayCarryClockTime() {
        RecordingClientChannel channelA = new RecordingClientChannel();
        rooms.join("proj-1", member("a", "user-a", channelA));
        gateway.clock.advance(Duration.ofMinutes(7));
        gateway.hub.published().clear();

        rooms.broadcastToRoom("proj-1", OutboundFrame.of("flow_updated"), null);

        Instant now = gateway.clock.instant();
        JsonNode delivered = channelA.framesOfType("flow_updated").get(0);
        assertThat(Instant.parse(delivered.get("timestamp").asText())).isEqualTo(now);
        assertThat(gateway.hub.published().get(0).getTimestamp()).isEqualTo(now);
    }

    @Test
    void ownRelayIsDiscarded() {
        RecordingClientChannel channelA = new RecordingClientChannel();
        rooms.join("proj-1", member("a", "user-a", channelA));
        double ownBefore = gateway.metrics.count("gateway.relay.received", "own", "true");

        rooms.broadcastToRoom("proj-1", OutboundFrame.of("flow_updated"), null);

        // delivered locally once, own relay echo ignored
        assertThat(channelA.framesOfType("flow_updated")).hasSize(1);
        assertThat(gateway.metrics.count("gateway.relay.received", "own", "true")).isEqualTo(ownBefore + 1);
        assertThat(gateway.metrics.count("gateway.relay.received", "own", "false")).isZero();
    }

    @Test
    void relayFromPeerIsDeliveredLocallyWithoutRepublishing() {
        RecordingClientChannel channelA = new RecordingClientChannel();
        RecordingClientChannel channelB = new RecordingClientChannel();
        rooms.join("proj-1", member("a", "user-a", channelA));
        rooms.join("proj-1", member("b", "user-b", channelB));
        gateway.hub.published().clear();

        rooms.onRelay(RelayEnvelope.builder()
                .roomId("proj-1")
                .message("{\"type\":\"cursor_update\",\"userId\":\"remote\"}")
                .excludeConnectionId("b")
                .originGatewayId("gw-other")
                .timestamp(gateway.clock.instant())
                .build());

        assertThat(channelA.framesOfType("cursor_update")).hasSize(1);
        assertThat(channelB.framesOfType("cursor_update")).isEmpty();
        assertThat(gateway.hub.published()).isEmpty();
    }

    @Test
    void globalMembersComeFromSharedSetOrLocalFallback() {
        rooms.join("proj-1", member("a", "user-a"));
        gateway.store.addMember(gateway.keys.roomMembers("proj-1"), "user-z:z:gw-other", null).join();

        List<Map<String, String>> members = rooms.getGlobalMembers("proj-1").join();
        assertThat(members).extracting(member -> member.get("gatewayId"))
                .containsExactlyInAnyOrder("gw-test", "gw-other");

        gateway.store.setReachable(false);
        assertThat(rooms.getGlobalMembers("proj-1").join())
                .extracting(member -> member.get("connectionId"))
                .containsExactly("a");
    }

    @Test
    void refreshKeepsLiveEntryWhileUnrefreshedOneExpires() {
        Connection a = member("a", "user-a");
        rooms.join("proj-1", a);
        String key = gateway.keys.roomMembers("proj-1");
        gateway.store.addMember(key, "user-z:z:gw-gone", Duration.ofHours(1)).join();

        gateway.clock.advance(Duration.ofMinutes(50));
        rooms.refresh(a).join();
        gateway.clock.advance(Duration.ofMinutes(50));

        assertThat(gateway.store.rawMembers(key)).containsExactly("user-a:a:gw-test");
    }

    @Test
    void refreshOutsideARoomIsANoop() {
        assertThat(rooms.refresh(member("a", "user-a")).join().isOk()).isTrue();
        assertThat(gateway.store.containsKey(gateway.keys.roomMembers("proj-1"))).isFalse();
    }

    @Test
    void membershipWorksLocallyWhenCacheIsDown() {
        gateway.store.setReachable(false);
        RecordingClientChannel channelA = new RecordingClientChannel();
        rooms.join("proj-1", member("a", "user-a", channelA));
        rooms.join("proj-1", member("b", "user-b"));

        assertThat(rooms.join("proj-1", member("c", "user-c")).join().isDegraded()).isTrue();
        assertThat(rooms.getLocalMemberIds("proj-1")).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(rooms.broadcastToRoom("proj-1", OutboundFrame.of("flow_updated"), "c")).isEqualTo(2);
    }

    private Connection member(String connectionId, String userId) {
        return member(connectionId, userId, new RecordingClientChannel());
    }

    private Connection member(String connectionId, String userId, RecordingClientChannel channel) {
        return new Connection(connectionId, userId, null, "workspace-1", Tier.PRO, channel, gateway.clock.instant());
    }
}
