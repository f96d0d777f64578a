package dao.metatx.relay.service;

import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.config.RelayerProperties;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.PreconditionException;
import dao.metatx.relay.model.BatchAuthorization;
import dao.metatx.relay.model.BatchAuthorizationRequest;
import dao.metatx.relay.model.BatchExecutionRecord;
import dao.metatx.relay.model.BatchItem;
import dao.metatx.relay.model.BatchItemRequest;
import dao.metatx.relay.model.RelayOutcome;
import dao.metatx.relay.model.RelayRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * The relayer: takes user-signed batches, attaches exactly the value they need and submits them to
 * the gateway under its own identity. When credit charging is on, the signer pays for the relay in
 * gas credits within the same atomic operation.
 */
@Slf4j
@Service
public class RelayService {

    private final LocalChain chain;
    private final MetaTxGateway gateway;
    private final GasCreditVault vault;
    private final Credentials relayerCredentials;
    private final RelayerProperties relayerProps;

    public RelayService(LocalChain chain,
                        MetaTxGateway gateway,
                        GasCreditVault vault,
                        Credentials relayerCredentials,
                        RelayerProperties relayerProps) {
        this.chain = chain;
        this.gateway = gateway;
        this.vault = vault;
        this.relayerCredentials = relayerCredentials;
        this.relayerProps = relayerProps;
    }

    public String relayerAddress() {
        return relayerCredentials.getAddress();
    }

    public RelayOutcome relay(RelayRequest req) {
        BatchAuthorization authorization = toAuthorization(req.getAuthorization());
        byte[] signature = decodeHex(req.getSignature());
        BigInteger required = MetaTxGateway.calculateRequiredValue(authorization.items());
        BigInteger fee = feeFor(authorization);
        String relayer = relayerAddress();

        if (fee.signum() > 0) {
            BigInteger available = vault.creditsOf(authorization.signer());
            if (available.compareTo(fee) < 0) {
                log.warn("Rejecting batch from {}: {} credits available, relay fee is {}",
                        authorization.signer(), available, fee);
                throw new PreconditionException(ErrorCode.INSUFFICIENT_CREDITS,
                        "signer " + authorization.signer() + " has " + available + " credits, relay fee is " + fee);
            }
        }

        log.info("Relaying batch: signer={}, nonce={}, items={}, value={}",
                authorization.signer(), authorization.nonce(), authorization.items().size(), required);

        return chain.transact(() -> {
            BatchExecutionRecord record = gateway.executeBatch(relayer, authorization, signature, required);
            if (fee.signum() > 0) {
                vault.consumeCredit(relayer, authorization.signer(), fee);
            }
            return new RelayOutcome(record, fee);
        });
    }

    public BigInteger requiredValue(BatchAuthorizationRequest req) {
        return MetaTxGateway.calculateRequiredValue(toItems(req.getItems()));
    }

    public byte[] digest(BatchAuthorizationRequest req) {
        return gateway.digestOf(toAuthorization(req));
    }

    public BatchAuthorization toAuthorization(BatchAuthorizationRequest req) {
        return new BatchAuthorization(
                req.getSigner(),
                toItems(req.getItems()),
                new BigInteger(req.getNonce()),
                req.getDeadline());
    }

    private BigInteger feeFor(BatchAuthorization authorization) {
        if (!relayerProps.isChargeCredits() || relayerProps.getFeeCreditsPerItem() == null) {
            return BigInteger.ZERO;
        }
        return relayerProps.getFeeCreditsPerItem().multiply(BigInteger.valueOf(authorization.items().size()));
    }

    private static List<BatchItem> toItems(List<BatchItemRequest> requests) {
        List<BatchItem> items = new ArrayList<>(requests.size());
        for (BatchItemRequest r : requests) {
            items.add(new BatchItem(r.getTarget(), new BigInteger(r.getValue()), decodeHex(r.getData())));
        }
        return items;
    }

    private static byte[] decodeHex(String hex) {
        if (hex == null || hex.isBlank() || hex.equals("0x")) {
            return new byte[0];
        }
        return Numeric.hexStringToByteArray(hex);
    }
}
