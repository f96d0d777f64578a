package dao.metatx.relay.config;

import dao.metatx.relay.asset.Erc20Token;
import dao.metatx.relay.asset.ManualPriceFeed;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.service.GasCreditVault;
import dao.metatx.relay.service.MetaTxGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Brings the local chain to a usable state on startup: genesis balances, configured assets and
 * feeds, asset whitelist, relayer authorization on both contracts.
 */
@Slf4j
@Component
public class DevnetBootstrap {

    private final LocalChain chain;
    private final MetaTxGateway gateway;
    private final GasCreditVault vault;
    private final Credentials relayerCredentials;
    private final ChainProperties chainProps;
    private final VaultProperties vaultProps;
    private final List<ManualPriceFeed> feeds = new CopyOnWriteArrayList<>();

    public DevnetBootstrap(LocalChain chain,
                           MetaTxGateway gateway,
                           GasCreditVault vault,
                           Credentials relayerCredentials,
                           ChainProperties chainProps,
                           VaultProperties vaultProps) {
        this.chain = chain;
        this.gateway = gateway;
        this.vault = vault;
        this.relayerCredentials = relayerCredentials;
        this.chainProps = chainProps;
        this.vaultProps = vaultProps;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void bootstrap() {
        for (Map.Entry<String, BigInteger> e : chainProps.getGenesisBalances().entrySet()) {
            chain.fund(e.getKey(), e.getValue());
            log.info("Genesis balance: {} = {}", e.getKey(), e.getValue());
        }

        String vaultOwner = vault.getAdmin().owner();
        for (VaultProperties.AssetConfig asset : vaultProps.getAssets()) {
            try {
                deployAsset(asset, vaultOwner);
            } catch (RuntimeException e) {
                log.warn("Asset {} not bootstrapped: {}", asset.getSymbol(), e.getMessage());
            }
        }

        String relayer = relayerCredentials.getAddress();
        String gatewayOwner = gateway.getAdmin().owner();
        if (!gateway.getRelayers().isAuthorized(relayer)) {
            gateway.setRelayerAuthorization(gatewayOwner, relayer, true);
        }
        if (!vault.getRelayers().isAuthorized(relayer)) {
            vault.addWhitelistedRelayer(vaultOwner, relayer);
        }
        log.info("Devnet ready: gateway={}, vault={}, relayer={}, assets={}",
                gateway.getAddress(), vault.getAddress(), relayer, vault.getWhitelist().entries().size());
    }

    /**
     * Re-stamp every devnet feed at the current block time. Returns the number of feeds touched.
     */
    public int refreshFeeds() {
        long now = chain.now();
        for (ManualPriceFeed feed : feeds) {
            feed.restamp(now);
        }
        return feeds.size();
    }

    private void deployAsset(VaultProperties.AssetConfig asset, String vaultOwner) {
        Erc20Token token = new Erc20Token(chain, asset.getAddress(), asset.getSymbol(), asset.getDecimals(),
                gateway.getAddress());
        chain.deploy(token.address(), token);
        asset.getMint().forEach(token::mint);

        String feedAddress = null;
        if (asset.getFeedAddress() != null && !asset.getFeedAddress().isBlank()) {
            ManualPriceFeed feed = new ManualPriceFeed(asset.getFeedDecimals(), asset.getFeedPrice(), chain.now());
            chain.deploy(asset.getFeedAddress(), feed);
            feeds.add(feed);
            feedAddress = asset.getFeedAddress();
        }
        vault.whitelistAsset(vaultOwner, token.address(), feedAddress, asset.isFixedUnit());
    }
}
