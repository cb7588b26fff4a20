package mc.dashboard.service.status;

import mc.dashboard.config.DashboardConfig;
import mc.dashboard.model.ServerStatus;
import mc.dashboard.model.StatusSample;
import mc.dashboard.service.ServerNotFoundException;
import mc.dashboard.service.rcon.RconCommandDispatcher;
import mc.dashboard.service.rcon.RconCommandException;
import mc.dashboard.service.rcon.RconConnectionException;
import mc.dashboard.service.rcon.RconDiagnostics;
import mc.dashboard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ServerStatusResolverTest {
    private static final Long SERVER_ID = 3L;

    @Mock
    private RconCommandDispatcher dispatcher;
    @Mock
    private RconDiagnostics diagnostics;

    private SampleHistory history;
    private ServerStatusResolver resolver;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        DashboardConfig config = new DashboardConfig();
        history = new SampleHistory(config, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        resolver = new ServerStatusResolver(dispatcher, new MinecraftStatusParser(config), history, diagnostics);
    }

    @Test
    void paperServerReportsPlayersAndTps() {
        when(dispatcher.send(SERVER_ID, "list")).thenReturn("There are 2 of a max of 30 players online: Steve, Alex");
        when(dispatcher.send(SERVER_ID, "tps")).thenReturn("§6TPS from last 1m, 5m, 15m: §a19.5, §a19.8, §a20.0");

        ServerStatus status = resolver.resolve(SERVER_ID);

        assertThat(status.isOnline()).isTrue();
        assertThat(status.getPlayers()).containsExactly("Steve", "Alex");
        assertThat(status.getPlayerCount()).isEqualTo(2);
        assertThat(status.getMaxPlayers()).isEqualTo(30);
        assertThat(status.getTps()).isEqualTo(19.5);
        assertThat(history.history(SERVER_ID)).singleElement()
                .satisfies(sample -> {
                    assertThat(sample.getTps()).isEqualTo(19.5);
                    assertThat(sample.getPlayers()).isEqualTo(2);
                });
    }

    @Test
    void failingTpsCommandLeavesTpsUnknown() {
        RconCommandException tpsFailure = new RconCommandException(SERVER_ID, "tps", new IOException("timeout"));
        when(dispatcher.send(SERVER_ID, "list")).thenReturn("There are 1 of a max of 20 players online: Notch");
        when(dispatcher.send(SERVER_ID, "tps")).thenThrow(tpsFailure);

        ServerStatus status = resolver.resolve(SERVER_ID);

        assertThat(status.isOnline()).isTrue();
        assertThat(status.getTps()).isNull();
        assertThat(status.getPlayers()).containsExactly("Notch");
        assertThat(status.getPlayerCount()).isEqualTo(1);
        assertThat(status.getMaxPlayers()).isEqualTo(20);
        verify(diagnostics).suppressed(SERVER_ID, "tps", tpsFailure);
    }

    @Test
    void vanillaUnknownCommandLeavesTpsUnknown() {
        when(dispatcher.send(SERVER_ID, "list")).thenReturn("There are 0 of a max of 20 players online: ");
        when(dispatcher.send(SERVER_ID, "tps")).thenReturn("Unknown or incomplete command, see below for error");

        ServerStatus status = resolver.resolve(SERVER_ID);

        assertThat(status.isOnline()).isTrue();
        assertThat(status.getTps()).isNull();
        verify(diagnostics, never()).suppressed(any(), any(), any());
    }

    @Test
    void unreachableServerIsReportedOfflineAndSampled() {
        when(dispatcher.send(SERVER_ID, "list"))
                .thenThrow(new RconConnectionException(SERVER_ID, "refused", new ConnectException("refused")));

        ServerStatus status = resolver.resolve(SERVER_ID);

        assertThat(status.isOnline()).isFalse();
        assertThat(status.getPlayers()).isEmpty();
        assertThat(status.getPlayerCount()).isZero();
        assertThat(status.getMaxPlayers()).isZero();
        assertThat(status.getTps()).isNull();
        verify(dispatcher, never()).send(eq(SERVER_ID), eq("tps"));

        StatusSample sample = history.history(SERVER_ID).get(0);
        assertThat(sample.getTps()).isNull();
        assertThat(sample.getPlayers()).isZero();
    }

    @Test
    void unknownServerIsNotReportedOffline() {
        when(dispatcher.send(99L, "list")).thenThrow(new ServerNotFoundException(99L));

        assertThatThrownBy(() -> resolver.resolve(99L)).isInstanceOf(ServerNotFoundException.class);
        assertThat(history.history(99L)).isEmpty();
    }
}
