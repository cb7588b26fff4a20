package mc.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
public class ManagedServer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    private String name;

    @Column(nullable = false)
    private String host;
    private int rconPort;

    // iv || ciphertext, see CredentialCipher
    @JsonIgnore
    @ToString.Exclude
    @Column(nullable = false, length = 512)
    private byte[] rconPasswordEncrypted;
}
