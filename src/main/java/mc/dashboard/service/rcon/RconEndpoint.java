package mc.dashboard.service.rcon;

import lombok.ToString;
import lombok.Value;

@Value
public class RconEndpoint {
    String host;
    int port;
    @ToString.Exclude
    String password;

    public String address() {
        return host + ":" + port;
    }
}
