package mc.dashboard.service.security;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.encrypt.AesBytesEncryptor;
import org.springframework.security.crypto.encrypt.BytesEncryptor;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Component;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * AES-256-GCM for stored RCON passwords. The 12-byte IV is prepended to the ciphertext.
 */
@Component
public class CredentialCipher {
    private static final int IV_BYTES = 12;

    private final BytesEncryptor encryptor;

    @Autowired
    public CredentialCipher(SecretsService secretsService) {
        this(secretsService.encryptionKey());
    }

    CredentialCipher(String hexKey) {
        if (!SecretsService.isValidKey(hexKey)) {
            throw new IllegalArgumentException("Encryption key must be a 64-char hex string (32 bytes)");
        }
        SecretKeySpec key = new SecretKeySpec(Hex.decode(hexKey), "AES");
        this.encryptor = new AesBytesEncryptor(key, KeyGenerators.secureRandom(IV_BYTES),
                AesBytesEncryptor.CipherAlgorithm.GCM);
    }

    public byte[] encrypt(String plaintext) {
        return encryptor.encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalStateException if the data was not produced with the current key
     */
    public String decrypt(byte[] data) {
        return new String(encryptor.decrypt(data), StandardCharsets.UTF_8);
    }
}
