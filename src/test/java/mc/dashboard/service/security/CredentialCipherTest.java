package mc.dashboard.service.security;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialCipherTest {
    private static final String KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
    private static final String OTHER_KEY = "ffeeddccbbaa99887766554433221100ffeeddccbbaa99887766554433221100";

    private final CredentialCipher cipher = new CredentialCipher(KEY);

    @Test
    void decryptsWhatItEncrypted() {
        byte[] encrypted = cipher.encrypt("hunter2");

        assertThat(cipher.decrypt(encrypted)).isEqualTo("hunter2");
    }

    @Test
    void prependsIvAndAuthTag() {
        byte[] encrypted = cipher.encrypt("hunter2");

        // 12-byte IV + ciphertext + 16-byte GCM tag
        assertThat(encrypted).hasSize(12 + "hunter2".getBytes(StandardCharsets.UTF_8).length + 16);
        assertThat(cipher.encrypt("hunter2")).isNotEqualTo(encrypted);
    }

    @Test
    void rejectsDataEncryptedWithAnotherKey() {
        byte[] encrypted = new CredentialCipher(OTHER_KEY).encrypt("hunter2");

        assertThatThrownBy(() -> cipher.decrypt(encrypted)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsMalformedKey() {
        assertThatThrownBy(() -> new CredentialCipher("abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("64-char hex");
    }
}
