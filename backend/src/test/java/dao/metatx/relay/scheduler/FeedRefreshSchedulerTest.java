package dao.metatx.relay.scheduler;

import dao.metatx.relay.asset.Erc20Token;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.config.ChainProperties;
import dao.metatx.relay.config.DevnetBootstrap;
import dao.metatx.relay.config.VaultProperties;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.LedgerException;
import dao.metatx.relay.repository.InMemoryExecutionRecordRepository;
import dao.metatx.relay.service.GasCreditVault;
import dao.metatx.relay.service.MetaTxGateway;
import dao.metatx.relay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static dao.metatx.relay.support.TestAccounts.*;
import static org.junit.jupiter.api.Assertions.*;

class FeedRefreshSchedulerTest {

    private MutableClock clock;
    private GasCreditVault vault;
    private DevnetBootstrap bootstrap;
    private String user;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(GENESIS_TIME);
        LocalChain chain = new LocalChain(CHAIN_ID, clock);
        String owner = OWNER.getAddress();
        user = SIGNER.getAddress();

        MetaTxGateway gateway = new MetaTxGateway(chain, GATEWAY, owner, "MetaTxGateway", "2",
                new InMemoryExecutionRecordRepository());
        chain.deploy(GATEWAY, gateway);
        vault = new GasCreditVault(chain, VAULT, owner, 3600);
        chain.deploy(VAULT, vault);

        VaultProperties.AssetConfig weth = new VaultProperties.AssetConfig();
        weth.setAddress(TOKEN);
        weth.setSymbol("WETH");
        weth.setFeedAddress(FEED);
        weth.setFeedPrice(BigInteger.valueOf(200_00000000L));
        weth.getMint().put(user, ether(10));
        VaultProperties vaultProps = new VaultProperties();
        vaultProps.getAssets().add(weth);

        bootstrap = new DevnetBootstrap(chain, gateway, vault, RELAYER, new ChainProperties(), vaultProps);
        bootstrap.bootstrap();
        chain.codeAt(TOKEN, Erc20Token.class).orElseThrow().approve(user, VAULT, ether(10));
    }

    @Test
    @DisplayName("Devnet feed goes stale without a refresh")
    void feedGoesStale() {
        clock.advanceSeconds(3601);

        LedgerException e = assertThrows(LedgerException.class, () -> vault.deposit(user, TOKEN, ether(1)));
        assertEquals(ErrorCode.STALE_PRICE, e.getCode());
    }

    @Test
    @DisplayName("Refresh re-stamps devnet feeds at the current time, keeping their price")
    void refreshKeepsFeedFresh() {
        FeedRefreshScheduler scheduler = new FeedRefreshScheduler(bootstrap);
        clock.advanceSeconds(3601);

        scheduler.refreshFeeds();

        assertEquals(ether(200), vault.deposit(user, TOKEN, ether(1)));
        assertEquals(1, bootstrap.refreshFeeds());
    }
}
