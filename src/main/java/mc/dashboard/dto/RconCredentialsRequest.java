package mc.dashboard.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Partial update: {@code null} fields keep their stored value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RconCredentialsRequest {
    private String host;

    @Min(1)
    @Max(65535)
    private Integer rconPort;

    @ToString.Exclude
    private String rconPassword;
}
