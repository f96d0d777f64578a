package dao.metatx.relay.service;

import dao.metatx.relay.asset.Erc20Token;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.config.RelayerProperties;
import dao.metatx.relay.crypto.BatchSigner;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.model.BatchAuthorization;
import dao.metatx.relay.model.BatchAuthorizationRequest;
import dao.metatx.relay.model.BatchItemRequest;
import dao.metatx.relay.model.RelayOutcome;
import dao.metatx.relay.model.RelayRequest;
import dao.metatx.relay.repository.InMemoryExecutionRecordRepository;
import dao.metatx.relay.support.MutableClock;
import dao.metatx.relay.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static dao.metatx.relay.service.MetaTxGatewayTest.assertCode;
import static dao.metatx.relay.support.TestAccounts.*;
import static org.junit.jupiter.api.Assertions.*;

class RelayServiceTest {

    private static final BigInteger FEE_PER_ITEM = ether(1).divide(BigInteger.valueOf(100));

    private LocalChain chain;
    private MetaTxGateway gateway;
    private GasCreditVault vault;
    private RelayerProperties relayerProps;
    private RelayService relayService;
    private String signer;

    @BeforeEach
    void setUp() {
        chain = new LocalChain(CHAIN_ID, new MutableClock(GENESIS_TIME));
        String owner = OWNER.getAddress();
        String relayer = RELAYER.getAddress();
        signer = SIGNER.getAddress();

        gateway = new MetaTxGateway(chain, GATEWAY, owner, "MetaTxGateway", "2", new InMemoryExecutionRecordRepository());
        vault = new GasCreditVault(chain, VAULT, owner, 3600);
        chain.deploy(GATEWAY, gateway);
        chain.deploy(VAULT, vault);
        gateway.setRelayerAuthorization(owner, relayer, true);
        vault.addWhitelistedRelayer(owner, relayer);

        Erc20Token stable = new Erc20Token(chain, STABLE, "USDS", 18, GATEWAY);
        chain.deploy(STABLE, stable);
        vault.whitelistAsset(owner, STABLE, null, true);
        stable.mint(signer, ether(10));
        stable.approve(signer, VAULT, ether(10));

        chain.fund(relayer, ether(5));

        relayerProps = new RelayerProperties();
        relayerProps.setFeeCreditsPerItem(FEE_PER_ITEM);
        relayService = new RelayService(chain, gateway, vault, RELAYER, relayerProps);
    }

    @Test
    @DisplayName("Relayer attaches exactly the required value")
    void relayAttachesRequiredValue() {
        RelayRequest req = signed(request(BigInteger.ZERO, item(RECIPIENT, "700"), item(RECIPIENT_2, "300")));

        RelayOutcome outcome = relayService.relay(req);

        assertEquals(List.of(true, true), outcome.record().perItemSuccess());
        assertEquals(BigInteger.valueOf(1000), outcome.record().totalValueRequired());
        assertEquals(ether(5).subtract(BigInteger.valueOf(1000)), chain.balanceOf(RELAYER.getAddress()));
        assertEquals(BigInteger.ZERO, outcome.creditsCharged());
    }

    @Test
    @DisplayName("With charging on, the signer pays per item in gas credits")
    void chargesCredits() {
        relayerProps.setChargeCredits(true);
        vault.deposit(signer, STABLE, ether(1));

        RelayOutcome outcome = relayService.relay(
                signed(request(BigInteger.ZERO, item(RECIPIENT, "1"), item(RECIPIENT_2, "2"))));

        assertEquals(FEE_PER_ITEM.multiply(BigInteger.TWO), outcome.creditsCharged());
        assertEquals(ether(1).subtract(FEE_PER_ITEM.multiply(BigInteger.TWO)), vault.creditsOf(signer));
        assertEquals(FEE_PER_ITEM.multiply(BigInteger.TWO), vault.totalConsumedCredits());
    }

    @Test
    @DisplayName("Signer without enough credits is turned away before anything executes")
    void insufficientCredits() {
        relayerProps.setChargeCredits(true);

        assertCode(ErrorCode.INSUFFICIENT_CREDITS,
                () -> relayService.relay(signed(request(BigInteger.ZERO, item(RECIPIENT, "1")))));
        assertEquals(BigInteger.ZERO, gateway.nonceOf(signer));
        assertEquals(BigInteger.ZERO, chain.balanceOf(RECIPIENT));
    }

    @Test
    @DisplayName("Digest and required value match the gateway")
    void digestAndRequiredValue() {
        BatchAuthorizationRequest req = request(BigInteger.valueOf(4), item(RECIPIENT, "5"), item(TOKEN, "6"));
        BatchAuthorization auth = relayService.toAuthorization(req);

        assertArrayEquals(gateway.digestOf(auth), relayService.digest(req));
        assertEquals(BigInteger.valueOf(11), relayService.requiredValue(req));
    }

    private RelayRequest signed(BatchAuthorizationRequest authReq) {
        BatchAuthorization auth = relayService.toAuthorization(authReq);
        RelayRequest req = new RelayRequest();
        req.setAuthorization(authReq);
        req.setSignature(CryptoUtil.toHex0x(BatchSigner.sign(SIGNER, gateway.getDomain(), auth)));
        return req;
    }

    private BatchAuthorizationRequest request(BigInteger nonce, BatchItemRequest... items) {
        BatchAuthorizationRequest req = new BatchAuthorizationRequest();
        req.setSigner(signer);
        req.setItems(List.of(items));
        req.setNonce(nonce.toString());
        req.setDeadline(GENESIS_TIME + 600);
        return req;
    }

    private static BatchItemRequest item(String target, String value) {
        BatchItemRequest item = new BatchItemRequest();
        item.setTarget(target);
        item.setValue(value);
        return item;
    }
}
