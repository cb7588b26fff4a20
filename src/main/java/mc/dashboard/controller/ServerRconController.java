package mc.dashboard.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.dto.ApiResponse;
import mc.dashboard.dto.CommandRequest;
import mc.dashboard.dto.StatusAnalytics;
import mc.dashboard.model.ServerStatus;
import mc.dashboard.model.StatusAlert;
import mc.dashboard.service.*;
import mc.dashboard.service.rcon.RconException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

@Slf4j
@RestController
@RequestMapping("/api/servers/{serverId}")
@RequiredArgsConstructor
@Validated
public class ServerRconController {
    private final RconService rconService;
    private final PlayerCommandService playerCommandService;
    private final ServerActionService serverActionService;
    private final StatusAnalyticsService statusAnalyticsService;

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<ServerStatus>> getServerStatus(@PathVariable Long serverId) {
        try {
            return ResponseEntity.ok(ApiResponse.success(rconService.getServerStatus(serverId)));
        } catch (ServerNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Error getting server status for server {}", serverId, e);
            return ResponseEntity.internalServerError()
                    .body(ApiResponse.error("Failed to get server status"));
        }
    }

    @PostMapping("/status/invalidate")
    public ResponseEntity<ApiResponse<Void>> invalidateStatus(@PathVariable Long serverId) {
        rconService.invalidateStatus(serverId);
        return ResponseEntity.ok(ApiResponse.success("Status cache cleared", null));
    }

    @PostMapping("/command")
    public CompletableFuture<ResponseEntity<ApiResponse<String>>> sendCommand(@PathVariable Long serverId,
                                                                              @Valid @RequestBody CommandRequest request) {
        String command = request.getCommand().trim();
        log.info("Received command for server {}: {}", serverId, command);

        return rconService.sendCommandAsync(serverId, command)
                .thenApply(response -> ResponseEntity.ok(ApiResponse.success("Command sent successfully", response)))
                .exceptionally(throwable -> {
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                            ? throwable.getCause() : throwable;
                    log.warn("Command '{}' failed for server {}: {}", command, serverId, cause.getMessage());
                    return failure(cause);
                });
    }

    @GetMapping("/players")
    public ResponseEntity<ApiResponse<List<String>>> getOnlinePlayers(@PathVariable Long serverId) {
        return execute(serverId, "list players", () -> rconService.getOnlinePlayers(serverId));
    }

    @PostMapping("/players/{playerName}/kick")
    public ResponseEntity<ApiResponse<String>> kickPlayer(@PathVariable Long serverId,
                                                          @PathVariable String playerName,
                                                          @RequestParam(required = false) String reason) {
        return execute(serverId, "kick " + playerName, () -> playerCommandService.kickPlayer(serverId, playerName, reason));
    }

    @PostMapping("/players/{playerName}/ban")
    public ResponseEntity<ApiResponse<String>> banPlayer(@PathVariable Long serverId,
                                                         @PathVariable String playerName,
                                                         @RequestParam(required = false) String reason) {
        return execute(serverId, "ban " + playerName, () -> playerCommandService.banPlayer(serverId, playerName, reason));
    }

    @PostMapping("/players/{playerName}/pardon")
    public ResponseEntity<ApiResponse<String>> pardonPlayer(@PathVariable Long serverId, @PathVariable String playerName) {
        return execute(serverId, "pardon " + playerName, () -> playerCommandService.pardonPlayer(serverId, playerName));
    }

    @PostMapping("/players/{playerName}/op")
    public ResponseEntity<ApiResponse<String>> opPlayer(@PathVariable Long serverId, @PathVariable String playerName) {
        return execute(serverId, "op " + playerName, () -> playerCommandService.opPlayer(serverId, playerName));
    }

    @PostMapping("/players/{playerName}/deop")
    public ResponseEntity<ApiResponse<String>> deopPlayer(@PathVariable Long serverId, @PathVariable String playerName) {
        return execute(serverId, "deop " + playerName, () -> playerCommandService.deopPlayer(serverId, playerName));
    }

    @PostMapping("/whitelist/{playerName}")
    public ResponseEntity<ApiResponse<String>> addToWhitelist(@PathVariable Long serverId, @PathVariable String playerName) {
        return execute(serverId, "whitelist add " + playerName, () -> playerCommandService.addToWhitelist(serverId, playerName));
    }

    @DeleteMapping("/whitelist/{playerName}")
    public ResponseEntity<ApiResponse<String>> removeFromWhitelist(@PathVariable Long serverId, @PathVariable String playerName) {
        return execute(serverId, "whitelist remove " + playerName, () -> playerCommandService.removeFromWhitelist(serverId, playerName));
    }

    @PostMapping("/action/{action}")
    public ResponseEntity<ApiResponse<String>> performAction(@PathVariable Long serverId, @PathVariable String action) {
        return execute(serverId, action, () -> serverActionService.perform(serverId, ServerAction.fromName(action)));
    }

    @GetMapping("/analytics")
    public ResponseEntity<ApiResponse<StatusAnalytics>> getAnalytics(@PathVariable Long serverId) {
        return ResponseEntity.ok(ApiResponse.success(statusAnalyticsService.getAnalytics(serverId)));
    }

    @GetMapping("/alerts")
    public ResponseEntity<ApiResponse<List<StatusAlert>>> getAlerts(@PathVariable Long serverId) {
        return execute(serverId, "alerts", () -> statusAnalyticsService.getStatusAlerts(serverId));
    }

    @GetMapping("/rcon/test")
    public ResponseEntity<ApiResponse<Map<String, Object>>> testRconConnection(@PathVariable Long serverId) {
        return execute(serverId, "rcon test", () -> Map.of("connected", rconService.testConnection(serverId)));
    }

    private <T> ResponseEntity<ApiResponse<T>> execute(Long serverId, String action, Supplier<T> call) {
        try {
            return ResponseEntity.ok(ApiResponse.success(call.get()));
        } catch (ServerNotFoundException | IllegalArgumentException | RconException e) {
            log.debug("'{}' failed for server {}: {}", action, serverId, e.getMessage());
            return failure(e);
        } catch (Exception e) {
            log.error("Error during '{}' for server {}", action, serverId, e);
            return ResponseEntity.internalServerError()
                    .body(ApiResponse.error("Failed to perform " + action));
        }
    }

    private static <T> ResponseEntity<ApiResponse<T>> failure(Throwable e) {
        HttpStatus status;
        if (e instanceof ServerNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof IllegalArgumentException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof RconException) {
            status = HttpStatus.BAD_GATEWAY;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status).body(ApiResponse.error(e.getMessage()));
    }
}
