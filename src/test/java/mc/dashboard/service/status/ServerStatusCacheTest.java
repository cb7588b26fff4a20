package mc.dashboard.service.status;

import mc.dashboard.config.DashboardConfig;
import mc.dashboard.model.ServerStatus;
import mc.dashboard.service.ServerNotFoundException;
import mc.dashboard.service.rcon.RconCommandDispatcher;
import mc.dashboard.service.rcon.RconConnectionException;
import mc.dashboard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class ServerStatusCacheTest {
    private static final Long SERVER_ID = 5L;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private ServerStatusResolver resolver;
    private ServerStatusCache cache;

    @BeforeEach
    void setUp() {
        resolver = mock(ServerStatusResolver.class);
        when(resolver.resolve(SERVER_ID)).thenAnswer(invocation -> ServerStatus.builder()
                .online(true)
                .players(List.of("Steve"))
                .playerCount(1)
                .maxPlayers(20)
                .tps(20.0)
                .build());
        cache = new ServerStatusCache(resolver, new DashboardConfig(), clock);
    }

    @Test
    void reusesStatusWithinTtl() {
        ServerStatus first = cache.getStatus(SERVER_ID);
        clock.advance(Duration.ofMillis(4999));
        ServerStatus second = cache.getStatus(SERVER_ID);

        assertThat(second).isSameAs(first);
        verify(resolver, times(1)).resolve(SERVER_ID);
    }

    @Test
    void resolvesAgainOnceTtlElapsed() {
        cache.getStatus(SERVER_ID);
        clock.advance(Duration.ofSeconds(2));
        cache.getStatus(SERVER_ID);
        clock.advance(Duration.ofSeconds(3));
        cache.getStatus(SERVER_ID);

        verify(resolver, times(2)).resolve(SERVER_ID);
    }

    @Test
    void invalidateForcesFreshResolution() {
        cache.getStatus(SERVER_ID);
        cache.invalidate(SERVER_ID);
        cache.getStatus(SERVER_ID);

        verify(resolver, times(2)).resolve(SERVER_ID);
    }

    @Test
    void sharedStatusCannotBeAlteredByOneReader() {
        ServerStatus first = cache.getStatus(SERVER_ID);

        assertThatThrownBy(() -> first.getPlayers().add("Intruder"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(cache.getStatus(SERVER_ID).getPlayers()).containsExactly("Steve");
        assertThat(cache.getStatus(SERVER_ID).isOnline()).isTrue();
    }

    @Test
    void statusKeepsItsOwnCopyOfPlayers() {
        List<String> players = new ArrayList<>(List.of("Steve", "Alex"));
        ServerStatus status = ServerStatus.builder().online(true).players(players).playerCount(2).maxPlayers(20).build();

        players.add("Intruder");

        assertThat(status.getPlayers()).containsExactly("Steve", "Alex");
    }

    @Test
    void lookupsOfUnknownServersLeaveNoState() {
        when(resolver.resolve(anyLong())).thenAnswer(invocation -> {
            throw new ServerNotFoundException(invocation.getArgument(0));
        });

        for (long id = 1000; id < 11000; id++) {
            long unknown = id;
            assertThatThrownBy(() -> cache.getStatus(unknown)).isInstanceOf(ServerNotFoundException.class);
        }

        assertThat(cache.size()).isZero();
        assertThat(cache.pendingRefillCount()).isZero();
    }

    @Test
    void offlineStatusIsCachedAndSampled() {
        RconCommandDispatcher dispatcher = mock(RconCommandDispatcher.class);
        when(dispatcher.send(SERVER_ID, "list"))
                .thenThrow(new RconConnectionException(SERVER_ID, "refused", new ConnectException("refused")));
        DashboardConfig config = new DashboardConfig();
        SampleHistory history = new SampleHistory(config, clock);
        ServerStatusResolver realResolver = new ServerStatusResolver(dispatcher, new MinecraftStatusParser(config),
                history, (id, step, e) -> { });
        ServerStatusCache offlineCache = new ServerStatusCache(realResolver, config, clock);

        assertThat(offlineCache.getStatus(SERVER_ID).isOnline()).isFalse();
        assertThat(offlineCache.getStatus(SERVER_ID).isOnline()).isFalse();

        verify(dispatcher, times(1)).send(SERVER_ID, "list");
        assertThat(history.history(SERVER_ID)).hasSize(1);
    }
}
