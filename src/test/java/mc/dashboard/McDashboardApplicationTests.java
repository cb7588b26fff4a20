package mc.dashboard;

import mc.dashboard.dto.RconCredentialsRequest;
import mc.dashboard.dto.ServerRegistrationRequest;
import mc.dashboard.model.ManagedServer;
import mc.dashboard.model.ServerStatus;
import mc.dashboard.service.ManagedServerService;
import mc.dashboard.service.PlayerCommandService;
import mc.dashboard.service.RconService;
import mc.dashboard.service.ServerNotFoundException;
import mc.dashboard.service.rcon.RconConnectionPool;
import mc.dashboard.support.FakeRconServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class McDashboardApplicationTests {

    @Autowired
    private ManagedServerService managedServerService;
    @Autowired
    private RconService rconService;
    @Autowired
    private PlayerCommandService playerCommandService;
    @Autowired
    private RconConnectionPool connectionPool;

    private FakeRconServer minecraft;
    private ManagedServer server;

    @BeforeEach
    void setUp() throws Exception {
        minecraft = new FakeRconServer("hunter2", command -> {
            switch (command) {
                case "list":
                    return "There are 2 of a max of 20 players online: Steve, Alex";
                case "tps":
                    return "§6TPS from last 1m, 5m, 15m: §a19.8, §a19.9, §a20.0";
                default:
                    return "Done: " + command;
            }
        });
        server = managedServerService.register(new ServerRegistrationRequest("survival", minecraft.getHost(), minecraft.getPort(), "hunter2"));
    }

    @AfterEach
    void tearDown() throws Exception {
        managedServerService.delete(server.getId());
        minecraft.close();
    }

    @Test
    void resolvesStatusOverPooledConnection() {
        ServerStatus status = rconService.getServerStatus(server.getId());

        assertThat(status.isOnline()).isTrue();
        assertThat(status.getPlayers()).containsExactly("Steve", "Alex");
        assertThat(status.getTps()).isEqualTo(19.8);
        assertThat(rconService.getServerStatus(server.getId())).isSameAs(status);
        assertThat(rconService.getHistory(server.getId())).hasSize(1);
        assertThat(minecraft.getConnectionCount()).isEqualTo(1);
    }

    @Test
    void playerCommandInvalidatesStatus() {
        rconService.getServerStatus(server.getId());

        assertThat(playerCommandService.kickPlayer(server.getId(), "Steve", "afk")).isEqualTo("Done: kick Steve afk");
        rconService.getServerStatus(server.getId());

        assertThat(minecraft.getCommands()).containsExactly("list", "tps", "kick Steve afk", "list", "tps");
        assertThat(rconService.getHistory(server.getId())).hasSize(2);
    }

    @Test
    void reconnectsAfterServerDropsConnection() throws Exception {
        assertThat(rconService.sendCommand(server.getId(), "say hi")).isEqualTo("Done: say hi");

        minecraft.dropClients();

        assertThat(rconService.sendCommand(server.getId(), "say again")).isEqualTo("Done: say again");
        assertThat(minecraft.getConnectionCount()).isEqualTo(2);
    }

    @Test
    void unreachableServerReportsOffline() throws Exception {
        managedServerService.updateRconCredentials(server.getId(), new RconCredentialsRequest(null, null, "wrong"));

        ServerStatus status = rconService.getServerStatus(server.getId());

        assertThat(status.isOnline()).isFalse();
        assertThat(connectionPool.contains(server.getId())).isFalse();
        assertThat(rconService.testConnection(server.getId())).isFalse();
    }

    @Test
    void unknownServerIsNotFound() {
        assertThatThrownBy(() -> rconService.sendCommand(-1L, "list")).isInstanceOf(ServerNotFoundException.class);
    }
}
