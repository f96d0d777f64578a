package dao.metatx.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    /**
     * Address the gateway is deployed at (0x-prefixed, 20 bytes).
     * Part of the signing domain.
     */
    private String address;

    /**
     * Initial owner: authorizes relayers, pauses, rescues.
     */
    private String owner;

    private String domainName = "MetaTxGateway";

    private String domainVersion = "2";
}
