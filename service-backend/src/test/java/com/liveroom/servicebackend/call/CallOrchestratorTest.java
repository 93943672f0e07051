package com.liveroom.servicebackend.call;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liveroom.servicebackend.admission.AdmissionDeniedException;
import com.liveroom.servicebackend.admission.AdmissionGateway;
import com.liveroom.servicebackend.admission.DirectAdmissionGateway;
import com.liveroom.servicebackend.config.CallProperties;
import com.liveroom.servicebackend.ice.IceConfigProvider;
import com.liveroom.servicebackend.ice.IceServer;
import com.liveroom.servicebackend.media.FakeMediaDevices;
import com.liveroom.servicebackend.media.FakeTransportFactory;
import com.liveroom.servicebackend.media.TrackSource;
import com.liveroom.servicebackend.room.Participant;
import com.liveroom.servicebackend.room.ParticipantRole;
import com.liveroom.servicebackend.room.RoomRegistry;
import com.liveroom.servicebackend.room.RoomStatus;
import com.liveroom.servicebackend.session.CloseReason;
import com.liveroom.servicebackend.session.PeerState;
import com.liveroom.servicebackend.signaling.SignalingMessage;
import com.liveroom.servicebackend.signaling.SignalingSubscription;
import com.liveroom.servicebackend.signaling.SignalingType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class CallOrchestratorTest {

    @Mock
    private AdmissionGateway deniedGateway;

    private RoomRegistry registry;
    private FakeMediaDevices devices;
    private FakeTransportFactory transports;
    private CallOrchestrator orchestrator;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        devices = new FakeMediaDevices();
        transports = new FakeTransportFactory(true);
        orchestrator = orchestrator(properties(Duration.ofSeconds(5)), new DirectAdmissionGateway());
    }

    @AfterEach
    void tearDown() throws Exception {
        orchestrator.shutdown();
        registry.shutdown();
        mocks.close();
    }

    @Test
    @DisplayName("Should connect a tutor and a student joining the same session")
    void testTwoPartyJoin() throws Exception {
        CallResult<SessionHandle> tutor = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS);
        CallResult<SessionHandle> student = orchestrator.join("r1", "B").get(5, TimeUnit.SECONDS);

        assertThat(tutor.isSuccess()).isTrue();
        assertThat(student.isSuccess()).isTrue();
        assertThat(registry.roster("r1")).extracting(Participant::id).containsExactly("A", "B");
        eventually(() -> tutor.value().state() == PeerState.CONNECTED
                && student.value().state() == PeerState.CONNECTED, "both participants connected");
        assertThat(transports.transport("B").offers()).containsExactly(false);
        assertThat(transports.iceServers("A")).extracting(IceServer::urls)
                .containsExactly(List.of("stun:stun.example.org:3478"));
        assertThat(orchestrator.activeSessionCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should end the room for everyone and tolerate a repeated end")
    void testEndCallTwice() throws Exception {
        SessionHandle tutor = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS).value();
        SessionHandle student = orchestrator.join("r1", "B").get(5, TimeUnit.SECONDS).value();
        eventually(() -> student.state() == PeerState.CONNECTED, "student connected");

        CallResult<Void> first = orchestrator.endCall(tutor).get(5, TimeUnit.SECONDS);
        CallResult<Void> second = orchestrator.endCall(tutor).get(5, TimeUnit.SECONDS);

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.isSuccess()).isTrue();
        assertThat(student.terminated().get(5, TimeUnit.SECONDS).cause()).isEqualTo(CloseReason.Cause.ROOM_ENDED);
        assertThat(tutor.state()).isEqualTo(PeerState.CLOSED);
        assertThat(registry.roster("r1")).isEmpty();
        assertThat(registry.roomStatus("r1")).contains(RoomStatus.ENDED);
        eventually(() -> orchestrator.activeSessionCount() == 0, "sessions released");
        assertThat(transports.transport("A").closeCount()).isEqualTo(1);
        assertThat(transports.transport("B").closeCount()).isEqualTo(1);
        assertThat(devices.allStopped()).isTrue();
    }

    @Test
    @DisplayName("Should give up the seat when local media never becomes ready")
    void testDeviceTimeoutCompensates() throws Exception {
        orchestrator.shutdown();
        registry.shutdown();
        orchestrator = orchestrator(properties(Duration.ofMillis(300)), new DirectAdmissionGateway());
        devices.set(TrackSource.CAMERA, FakeMediaDevices.Behavior.HOLD);

        CallResult<SessionHandle> result = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isEqualTo(CallError.DEVICE_UNAVAILABLE);
        eventually(() -> registry.roster("r1").isEmpty(), "roster emptied");
        eventually(() -> transports.transport("A").closeCount() == 1, "transport closed");
        assertThat(devices.held()).allMatch(CompletableFuture::isCancelled);
    }

    @Test
    @DisplayName("Should reject a third participant and release its transport")
    void testRoomFull() throws Exception {
        orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS);
        orchestrator.join("r1", "B").get(5, TimeUnit.SECONDS);

        CallResult<SessionHandle> third = orchestrator.join("r1", "C").get(5, TimeUnit.SECONDS);

        assertThat(third.error()).isEqualTo(CallError.ROOM_FULL);
        assertThat(third.message()).contains("r1");
        assertThat(transports.transport("C").closeCount()).isEqualTo(1);
        assertThat(registry.roster("r1")).hasSize(2);
    }

    @Test
    @DisplayName("Should report a refused admission without touching the registry")
    void testAdmissionDenied() throws Exception {
        when(deniedGateway.requestJoin(anyString(), anyString()))
                .thenThrow(new AdmissionDeniedException("Session r1 is not scheduled"));
        orchestrator.shutdown();
        registry.shutdown();
        orchestrator = orchestrator(properties(Duration.ofSeconds(5)), deniedGateway);

        CallResult<SessionHandle> result = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS);

        assertThat(result.error()).isEqualTo(CallError.ADMISSION_DENIED);
        assertThat(result.message()).isEqualTo("Session r1 is not scheduled");
        assertThat(registry.roomStatus("r1")).isEmpty();
        assertThat(transports.transport("A")).isNull();
        verify(deniedGateway).requestJoin("r1", "A");
    }

    @Test
    @DisplayName("Should toggle media while joined and report an ended session afterwards")
    void testTogglesAndLeave() throws Exception {
        SessionHandle handle = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS).value();

        assertThat(orchestrator.toggleVideo(handle).get(5, TimeUnit.SECONDS).value()).isFalse();
        assertThat(orchestrator.toggleAudio(handle).get(5, TimeUnit.SECONDS).value()).isFalse();
        assertThat(orchestrator.toggleScreenShare(handle).get(5, TimeUnit.SECONDS).value()).isTrue();
        assertThat(orchestrator.toggleScreenShare(handle).get(5, TimeUnit.SECONDS).value()).isFalse();

        assertThat(orchestrator.leave(handle).get(5, TimeUnit.SECONDS).isSuccess()).isTrue();

        assertThat(orchestrator.toggleVideo(handle).get(5, TimeUnit.SECONDS).error()).isEqualTo(CallError.SESSION_ENDED);
        assertThat(orchestrator.leave(handle).get(5, TimeUnit.SECONDS).error()).isEqualTo(CallError.SESSION_ENDED);
        assertThat(registry.isMember("r1", "A")).isFalse();
        assertThat(handle.terminated().get(5, TimeUnit.SECONDS).cause()).isEqualTo(CloseReason.Cause.LOCAL_HANGUP);
    }

    @Test
    @DisplayName("Should close the remaining participant's session when the other leaves")
    void testPeerLeaves() throws Exception {
        SessionHandle tutor = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS).value();
        SessionHandle student = orchestrator.join("r1", "B").get(5, TimeUnit.SECONDS).value();
        eventually(() -> tutor.state() == PeerState.CONNECTED && student.state() == PeerState.CONNECTED,
                "both participants connected");

        orchestrator.leave(student).get(5, TimeUnit.SECONDS);
        CloseReason reason = tutor.terminated().get(5, TimeUnit.SECONDS);

        assertThat(reason.cause()).isIn(CloseReason.Cause.PEER_BYE, CloseReason.Cause.PEER_DISCONNECTED);
        eventually(() -> registry.roomStatus("r1").orElse(null) == RoomStatus.ENDED, "room ended");
    }

    @Test
    @DisplayName("Should leave no roster entry behind when a join is cancelled")
    void testCancelledJoinCompensates() throws Exception {
        devices.set(TrackSource.CAMERA, FakeMediaDevices.Behavior.HOLD);

        CompletableFuture<CallResult<SessionHandle>> join = orchestrator.join("r1", "A");
        eventually(() -> registry.isMember("r1", "A"), "participant admitted");
        join.cancel(true);

        eventually(() -> registry.roster("r1").isEmpty(), "roster emptied");
        eventually(() -> transports.transport("A").closeCount() == 1, "transport closed");
        eventually(() -> orchestrator.activeSessionCount() == 0, "session released");
    }

    @Test
    @DisplayName("Should deliver a fresh offer from a participant who left and joined again")
    void testRejoinOffersAgain() throws Exception {
        registry.admit("r1", new Participant("Z", ParticipantRole.TUTOR));
        SignalingSubscription remaining = registry.channel("r1").orElseThrow().subscribe("Z");

        SessionHandle first = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS).value();
        assertThat(nextOfType(remaining, SignalingType.OFFER)).isNotNull();
        orchestrator.leave(first).get(5, TimeUnit.SECONDS);
        assertThat(nextOfType(remaining, SignalingType.BYE)).isNotNull();

        CallResult<SessionHandle> again = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS);

        assertThat(again.isSuccess()).isTrue();
        SignalingMessage offer = nextOfType(remaining, SignalingType.OFFER);
        assertThat(offer).isNotNull();
        assertThat(offer.from()).isEqualTo("A");
        assertThat(offer.seq()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep a rejoined participant when the earlier session finishes tearing down")
    void testLateTeardownKeepsRejoinedMember() throws Exception {
        SessionHandle tutor = orchestrator.join("r1", "A").get(5, TimeUnit.SECONDS).value();
        SessionHandle student = orchestrator.join("r1", "B").get(5, TimeUnit.SECONDS).value();
        eventually(() -> student.state() == PeerState.CONNECTED, "student connected");
        CountDownLatch release = new CountDownLatch(1);
        // holds the old session's teardown until its hook would run after the rejoin
        student.addListener(event -> {
            if (event.isStateChange(PeerState.CLOSED)) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        orchestrator.endCall(tutor).get(5, TimeUnit.SECONDS);
        CallResult<SessionHandle> rejoined = orchestrator.join("r1", "B").get(5, TimeUnit.SECONDS);
        release.countDown();
        student.terminated().get(5, TimeUnit.SECONDS);

        assertThat(rejoined.isSuccess()).isTrue();
        assertThat(registry.isMember("r1", "B")).isTrue();
        assertThat(registry.roomStatus("r1")).contains(RoomStatus.LIVE);
        assertThat(rejoined.value().state()).isNotEqualTo(PeerState.CLOSED);
    }

    private CallOrchestrator orchestrator(CallProperties properties, AdmissionGateway gateway) {
        registry = new RoomRegistry(properties.rooms());
        IceConfigProvider iceConfigProvider = new IceConfigProvider(properties.ice(), RestClient.builder(),
                new ObjectMapper());
        return new CallOrchestrator(registry, gateway, iceConfigProvider, transports, devices, properties);
    }

    private static CallProperties properties(Duration deviceTimeout) {
        return new CallProperties(
                new CallProperties.Rooms(2, true, Duration.ofMinutes(10)),
                new CallProperties.Negotiation(Duration.ofSeconds(5), Duration.ofMillis(50), 1),
                new CallProperties.Ice(null, List.of("stun:stun.example.org:3478")),
                new CallProperties.Admission(null, Duration.ofSeconds(5)),
                new CallProperties.Signaling(Duration.ofSeconds(1), Duration.ofMillis(50)),
                deviceTimeout);
    }

    private static SignalingMessage nextOfType(SignalingSubscription subscription, SignalingType type)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            SignalingMessage message = subscription.poll(Duration.ofMillis(100));
            if (message == null) {
                continue;
            }
            subscription.acknowledge(message);
            if (message.type() == type) {
                return message;
            }
        }
        return null;
    }

    private static void eventually(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(20);
        }
    }
}
