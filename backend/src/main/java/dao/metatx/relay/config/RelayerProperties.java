package dao.metatx.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

@Configuration
@ConfigurationProperties(prefix = "relayer")
@Data
public class RelayerProperties {

    /**
     * Relayer private key (hex, 64 characters). The relayer address is derived from it.
     */
    private String privateKey;

    /**
     * Charge the signer's gas credits for every relayed batch.
     * Default: false
     */
    private boolean chargeCredits = false;

    /**
     * Credits charged per batch item, in credit base units (18 decimals).
     */
    private BigInteger feeCreditsPerItem = BigInteger.ZERO;
}
