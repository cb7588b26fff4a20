package mc.dashboard.service.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.config.DashboardConfig;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Supplies the credential encryption key. An explicitly configured key always wins; otherwise the key is
 * kept in a JSON secrets file next to the data directory and generated on first start.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecretsService {
    static final String ENCRYPTION_KEY = "ENCRYPTION_KEY";

    private final DashboardConfig config;
    private final ObjectMapper objectMapper;

    public synchronized String encryptionKey() {
        DashboardConfig.Security security = config.getSecurity();
        if (security.hasEncryptionKey()) {
            return security.getEncryptionKey().trim();
        }

        Path secretsFile = Paths.get(security.getSecretsFile());
        ObjectNode stored = readSecrets(secretsFile);
        String key = stored.path(ENCRYPTION_KEY).asText("");
        if (isValidKey(key)) {
            return key;
        }

        key = new String(Hex.encode(KeyGenerators.secureRandom(32).generateKey()));
        stored.put(ENCRYPTION_KEY, key);
        try {
            Path parent = secretsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(secretsFile.toFile(), stored);
            log.info("Generated {} (stored in {})", ENCRYPTION_KEY, secretsFile);
        } catch (IOException e) {
            log.error("Failed to persist secrets to {}; set dashboard.security.encryption-key manually", secretsFile, e);
        }
        return key;
    }

    private ObjectNode readSecrets(Path secretsFile) {
        if (Files.exists(secretsFile)) {
            try {
                JsonNode node = objectMapper.readTree(secretsFile.toFile());
                if (node.isObject()) {
                    return (ObjectNode) node;
                }
            } catch (IOException e) {
                log.warn("Secrets file {} unreadable, regenerating: {}", secretsFile, e.getMessage());
            }
        }
        return objectMapper.createObjectNode();
    }

    static boolean isValidKey(String key) {
        return key != null && key.matches("[0-9a-fA-F]{64}");
    }
}
