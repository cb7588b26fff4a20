package mc.dashboard.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServerRegistrationRequest {

    @NotBlank(message = "Name cannot be empty")
    private String name;

    @NotBlank(message = "Host cannot be empty")
    private String host;

    @Min(1)
    @Max(65535)
    private int rconPort = 25575;

    @ToString.Exclude
    @NotBlank(message = "RCON password cannot be empty")
    private String rconPassword;
}
