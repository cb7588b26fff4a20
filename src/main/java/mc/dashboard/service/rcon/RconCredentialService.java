package mc.dashboard.service.rcon;

import lombok.RequiredArgsConstructor;
import mc.dashboard.model.ManagedServer;
import mc.dashboard.repository.ManagedServerRepository;
import mc.dashboard.service.ServerNotFoundException;
import mc.dashboard.service.security.CredentialCipher;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RconCredentialService {
    private final ManagedServerRepository managedServerRepository;
    private final CredentialCipher credentialCipher;

    /**
     * Looks up the stored RCON endpoint and decrypts its password.
     *
     * @throws ServerNotFoundException  if no server has this id
     * @throws RconConnectionException if the stored password cannot be decrypted
     */
    public RconEndpoint resolve(Long serverId) {
        ManagedServer server = managedServerRepository.findById(serverId)
                .orElseThrow(() -> new ServerNotFoundException(serverId));
        String password;
        try {
            password = credentialCipher.decrypt(server.getRconPasswordEncrypted());
        } catch (IllegalStateException e) {
            throw new RconConnectionException(serverId, "Stored RCON password for server " + serverId + " cannot be decrypted", e);
        }
        return new RconEndpoint(server.getHost(), server.getRconPort(), password);
    }
}
