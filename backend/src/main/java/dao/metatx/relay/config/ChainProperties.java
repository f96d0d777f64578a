package dao.metatx.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Data
public class ChainProperties {

    /**
     * Chain ID bound into every batch digest.
     * Devnet default: 31337
     */
    private Long id = 31337L;

    /**
     * Native balances credited at startup (address -> amount in wei).
     */
    private Map<String, BigInteger> genesisBalances = new LinkedHashMap<>();
}
