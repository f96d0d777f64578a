package dao.metatx.relay.config;

import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.repository.ExecutionRecordRepository;
import dao.metatx.relay.service.GasCreditVault;
import dao.metatx.relay.service.MetaTxGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;

import java.time.Clock;

/**
 * Wires the local chain and the two contracts that live on it.
 */
@Slf4j
@Configuration
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalChain localChain(ChainProperties chainProps, Clock ledgerClock) {
        log.info("Local chain id={}", chainProps.getId());
        return new LocalChain(chainProps.getId(), ledgerClock);
    }

    @Bean
    public MetaTxGateway metaTxGateway(LocalChain chain,
                                       GatewayProperties props,
                                       ExecutionRecordRepository records) {
        MetaTxGateway gateway = new MetaTxGateway(chain, props.getAddress(), props.getOwner(),
                props.getDomainName(), props.getDomainVersion(), records);
        chain.deploy(gateway.getAddress(), gateway);
        return gateway;
    }

    @Bean
    public GasCreditVault gasCreditVault(LocalChain chain, VaultProperties props) {
        GasCreditVault vault = new GasCreditVault(chain, props.getAddress(), props.getOwner(),
                props.getMaxStalenessSeconds());
        chain.deploy(vault.getAddress(), vault);
        return vault;
    }

    @Bean
    public Credentials relayerCredentials(RelayerProperties props) {
        if (props.getPrivateKey() == null || props.getPrivateKey().isBlank()) {
            throw new IllegalStateException("relayer.private-key is not configured");
        }
        Credentials credentials = Credentials.create(props.getPrivateKey());
        log.info("Relayer address: {}", credentials.getAddress());
        return credentials;
    }
}
