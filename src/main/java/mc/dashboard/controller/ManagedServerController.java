package mc.dashboard.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.dto.ApiResponse;
import mc.dashboard.dto.RconCredentialsRequest;
import mc.dashboard.dto.ServerRegistrationRequest;
import mc.dashboard.model.ManagedServer;
import mc.dashboard.service.ManagedServerService;
import mc.dashboard.service.ServerNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/servers")
@RequiredArgsConstructor
public class ManagedServerController {

    private final ManagedServerService managedServerService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<ManagedServer>>> getServers() {
        return ResponseEntity.ok(ApiResponse.success(managedServerService.getServers()));
    }

    @GetMapping("/{serverId}")
    public ResponseEntity<ApiResponse<ManagedServer>> getServer(@PathVariable Long serverId) {
        try {
            return ResponseEntity.ok(ApiResponse.success(managedServerService.getServer(serverId)));
        } catch (ServerNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ManagedServer>> registerServer(@Valid @RequestBody ServerRegistrationRequest request) {
        try {
            ManagedServer server = managedServerService.register(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(server));
        } catch (Exception e) {
            log.error("Failed to register server {}", request.getName(), e);
            return ResponseEntity.internalServerError()
                    .body(ApiResponse.error("Failed to register server: " + e.getMessage()));
        }
    }

    @PutMapping("/{serverId}/rcon")
    public ResponseEntity<ApiResponse<ManagedServer>> updateRconCredentials(@PathVariable Long serverId,
                                                                            @Valid @RequestBody RconCredentialsRequest request) {
        try {
            return ResponseEntity.ok(ApiResponse.success(managedServerService.updateRconCredentials(serverId, request)));
        } catch (ServerNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to update RCON credentials for server {}", serverId, e);
            return ResponseEntity.internalServerError()
                    .body(ApiResponse.error("Failed to update RCON credentials"));
        }
    }

    @DeleteMapping("/{serverId}")
    public ResponseEntity<ApiResponse<Void>> deleteServer(@PathVariable Long serverId) {
        try {
            managedServerService.delete(serverId);
            return ResponseEntity.ok(ApiResponse.success("Server deleted successfully", null));
        } catch (ServerNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(e.getMessage()));
        }
    }
}
