package ch.netplay.netplaybackend.application.service;

import ch.netplay.netplaybackend.domain.NetplayRoom;
import ch.netplay.netplaybackend.domain.OpenRoomSummary;
import ch.netplay.netplaybackend.repository.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static ch.netplay.netplaybackend.testutil.NetplayTestData.player;
import static ch.netplay.netplaybackend.testutil.NetplayTestData.room;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RoomRegistry}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Unique session ids (no overwrite on create)</li>
 *   <li>Idempotent removal</li>
 *   <li>Open-room listing filters and password masking</li>
 *   <li>Empty-room sweep, including races with joins</li>
 * </ul>
 */
class RoomRegistryTest {

    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry();
    }

    // ------------------------------------------------------------------------------------
    // create / get / remove
    // ------------------------------------------------------------------------------------

    @Test
    void create_shouldRejectDuplicateSessionId_andKeepFirstRoom() {
        NetplayRoom first = room("S1", "game-1", player("p1", "conn-1", "Alice"), null, 4);
        NetplayRoom second = room("S1", "game-2", player("p2", "conn-2", "Bob"), null, 2);

        assertThat(registry.create(first)).isTrue();
        assertThat(registry.create(second)).isFalse();

        NetplayRoom stored = registry.get("S1").orElseThrow();
        assertThat(stored).isSameAs(first);
        assertThat(stored.getGameId()).isEqualTo("game-1");
        assertThat(stored.getOwnerConnectionId()).isEqualTo("conn-1");
    }

    @Test
    void get_shouldReturnEmpty_whenRoomUnknown() {
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void remove_shouldBeIdempotent_andCloseRoom() {
        NetplayRoom room = room("S1", "game-1", player("p1", "conn-1", "Alice"), null, 4);
        registry.create(room);

        registry.remove("S1");
        registry.remove("S1");
        registry.remove("never-existed");

        assertThat(registry.get("S1")).isEmpty();
        assertThat(room.isClosed()).isTrue();
        assertThat(registry.count()).isZero();
    }

    // ------------------------------------------------------------------------------------
    // listOpen
    // ------------------------------------------------------------------------------------

    @Test
    void listOpen_shouldOnlyReturnRoomsOfGameWithFreeSeats() {
        NetplayRoom open = room("open", "mario", player("p1", "conn-1", "Alice"), null, 4);
        NetplayRoom otherGame = room("other", "zelda", player("p2", "conn-2", "Bob"), null, 4);
        NetplayRoom full = room("full", "mario", player("p3", "conn-3", "Carol"), null, 2);
        full.seat(player("p4", "conn-4", "Dave"));

        registry.create(open);
        registry.create(otherGame);
        registry.create(full);

        List<OpenRoomSummary> result = registry.listOpen("mario");

        assertThat(result).extracting(OpenRoomSummary::sessionId).containsExactly("open");
        OpenRoomSummary summary = result.get(0);
        assertThat(summary.roomName()).isEqualTo("Room open");
        assertThat(summary.currentCount()).isEqualTo(1);
        assertThat(summary.maxPlayers()).isEqualTo(4);
        assertThat(summary.ownerDisplayName()).isEqualTo("Alice");
        assertThat(summary.hasPassword()).isFalse();
    }

    @Test
    void listOpen_shouldReportPasswordFlag_withoutExposingPassword() {
        registry.create(room("locked", "mario", player("p1", "conn-1", "Alice"), "secret", 4));

        List<OpenRoomSummary> result = registry.listOpen("mario");

        assertThat(result).hasSize(1);
        assertThat(result.get(0).hasPassword()).isTrue();
        assertThat(result.get(0).toString()).doesNotContain("secret");
    }

    @Test
    void listOpen_shouldFallBackToUnknownOwnerName_whenOwnerHasNoDisplayName() {
        registry.create(room("S1", "mario", player("p1", "conn-1", null), null, 4));

        assertThat(registry.listOpen("mario").get(0).ownerDisplayName())
                .isEqualTo(OpenRoomSummary.UNKNOWN_OWNER);
    }

    // ------------------------------------------------------------------------------------
    // sweepEmpty
    // ------------------------------------------------------------------------------------

    @Test
    void sweepEmpty_shouldRemoveOnlyEmptyRooms() {
        NetplayRoom empty = room("empty", "mario", player("p1", "conn-1", "Alice"), null, 4);
        empty.unseat("p1", "conn-1");
        NetplayRoom occupied = room("occupied", "mario", player("p2", "conn-2", "Bob"), null, 4);

        registry.create(empty);
        registry.create(occupied);

        int removed = registry.sweepEmpty();

        assertThat(removed).isEqualTo(1);
        assertThat(registry.get("empty")).isEmpty();
        assertThat(empty.isClosed()).isTrue();
        assertThat(registry.get("occupied")).containsSame(occupied);
    }

    @Test
    void sweepEmpty_shouldBeIdempotent() {
        NetplayRoom empty = room("empty", "mario", player("p1", "conn-1", "Alice"), null, 4);
        empty.unseat("p1", "conn-1");
        registry.create(empty);
        registry.create(room("occupied", "mario", player("p2", "conn-2", "Bob"), null, 4));

        int first = registry.sweepEmpty();
        List<NetplayRoom> afterFirst = registry.findAll();
        int second = registry.sweepEmpty();

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(registry.findAll()).containsExactlyInAnyOrderElementsOf(afterFirst);
    }

    @Test
    void sweepEmpty_shouldNeverRemoveRoomThatIsRefilledConcurrently() throws Exception {
        int rounds = 200;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        AtomicInteger lostSeats = new AtomicInteger();

        try {
            for (int i = 0; i < rounds; i++) {
                NetplayRoom room = room("race-" + i, "mario", player("p1", "conn-1", "Alice"), null, 4);
                registry.create(room);
                room.unseat("p1", "conn-1");

                CountDownLatch start = new CountDownLatch(1);
                Future<?> join = pool.submit(() -> {
                    start.await();
                    synchronized (room) {
                        if (!room.isClosed()) {
                            room.seat(player("p2", "conn-2", "Bob"));
                        }
                    }
                    return null;
                });
                Future<?> sweep = pool.submit(() -> {
                    start.await();
                    registry.sweepEmpty();
                    return null;
                });
                start.countDown();

                join.get(5, TimeUnit.SECONDS);
                sweep.get(5, TimeUnit.SECONDS);

                synchronized (room) {
                    boolean seated = !room.isEmpty();
                    boolean registered = registry.get(room.getSessionId()).isPresent();
                    if (seated && !registered) {
                        lostSeats.incrementAndGet();
                    }
                }
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(lostSeats.get()).isZero();
    }
}
