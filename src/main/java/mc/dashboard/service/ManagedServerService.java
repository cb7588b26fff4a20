package mc.dashboard.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.dto.RconCredentialsRequest;
import mc.dashboard.dto.ServerRegistrationRequest;
import mc.dashboard.model.ManagedServer;
import mc.dashboard.repository.ManagedServerRepository;
import mc.dashboard.service.security.CredentialCipher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Stores the RCON endpoint of each managed server. Passwords are encrypted before they reach the
 * database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManagedServerService {
    private final ManagedServerRepository managedServerRepository;
    private final CredentialCipher credentialCipher;
    private final RconService rconService;

    public List<ManagedServer> getServers() {
        return managedServerRepository.findAll();
    }

    public ManagedServer getServer(Long serverId) {
        return managedServerRepository.findById(serverId)
                .orElseThrow(() -> new ServerNotFoundException(serverId));
    }

    @Transactional
    public ManagedServer register(ServerRegistrationRequest request) {
        ManagedServer server = ManagedServer.builder()
                .name(request.getName())
                .host(request.getHost())
                .rconPort(request.getRconPort())
                .rconPasswordEncrypted(credentialCipher.encrypt(request.getRconPassword()))
                .build();
        ManagedServer saved = managedServerRepository.save(server);
        log.info("Registered server {} ({}) at {}:{}", saved.getId(), saved.getName(), saved.getHost(), saved.getRconPort());
        return saved;
    }

    @Transactional
    public ManagedServer updateRconCredentials(Long serverId, RconCredentialsRequest request) {
        ManagedServer server = getServer(serverId);
        if (request.getHost() != null && !request.getHost().trim().isEmpty()) {
            server.setHost(request.getHost().trim());
        }
        if (request.getRconPort() != null) {
            server.setRconPort(request.getRconPort());
        }
        if (request.getRconPassword() != null && !request.getRconPassword().isEmpty()) {
            server.setRconPasswordEncrypted(credentialCipher.encrypt(request.getRconPassword()));
        }
        ManagedServer saved = managedServerRepository.save(server);
        // the pooled session still authenticates with the old credentials
        forgetAfterCommit(serverId, false);
        log.info("Updated RCON credentials for server {}", serverId);
        return saved;
    }

    @Transactional
    public void delete(Long serverId) {
        ManagedServer server = getServer(serverId);
        managedServerRepository.delete(server);
        forgetAfterCommit(serverId, true);
        log.info("Deleted server {} ({})", serverId, server.getName());
    }

    // an acquire racing the update must not re-read and re-pool the old endpoint
    private void forgetAfterCommit(Long serverId, boolean clearHistory) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            rconService.forget(serverId, clearHistory);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                rconService.forget(serverId, clearHistory);
            }
        });
    }
}
