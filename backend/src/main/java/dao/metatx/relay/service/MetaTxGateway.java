package dao.metatx.relay.service;

import dao.metatx.relay.asset.FungibleAsset;
import dao.metatx.relay.chain.AdminConfig;
import dao.metatx.relay.chain.CallOutcome;
import dao.metatx.relay.chain.JournaledCell;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.chain.ReentrancyGuard;
import dao.metatx.relay.crypto.BatchDigestBuilder;
import dao.metatx.relay.crypto.DomainContext;
import dao.metatx.relay.crypto.SignatureVerifier;
import dao.metatx.relay.event.AssetRescued;
import dao.metatx.relay.event.BatchSettled;
import dao.metatx.relay.event.MetaTransactionExecuted;
import dao.metatx.relay.exception.AuthorizationException;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.PreconditionException;
import dao.metatx.relay.exception.ValueAccountingException;
import dao.metatx.relay.model.BatchAuthorization;
import dao.metatx.relay.model.BatchExecutionRecord;
import dao.metatx.relay.model.BatchItem;
import dao.metatx.relay.repository.ExecutionRecordRepository;
import dao.metatx.relay.util.Addresses;
import dao.metatx.relay.util.CryptoUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch transaction executor. A whitelisted relayer submits a user-signed batch; the gateway checks
 * signature, nonce and deadline, dispatches every item as an isolated call, and returns whatever
 * native value the failed items did not use to the signer.
 * <p>
 * Authorization and value accounting are all-or-nothing; items are not. One failing item never
 * aborts the rest of the batch.
 */
@Slf4j
public class MetaTxGateway {

    private final LocalChain chain;
    @Getter
    private final String address;
    @Getter
    private final DomainContext domain;
    @Getter
    private final AdminConfig admin;
    @Getter
    private final RelayerRegistry relayers;
    private final NonceRegistry nonces;
    private final ExecutionRecordRepository records;
    private final ReentrancyGuard guard = new ReentrancyGuard("MetaTxGateway");
    private final JournaledCell<Long> batchCounter;

    public MetaTxGateway(LocalChain chain,
                         String address,
                         String owner,
                         String domainName,
                         String domainVersion,
                         ExecutionRecordRepository records) {
        this.chain = chain;
        this.address = Addresses.normalize(address);
        this.domain = new DomainContext(domainName, domainVersion, chain.getChainId(), this.address);
        this.admin = new AdminConfig(chain, this.address, owner);
        this.relayers = new RelayerRegistry(chain, this.address, admin);
        this.nonces = new NonceRegistry(chain);
        this.records = records;
        this.batchCounter = chain.newCell(0L);
    }

    public BatchExecutionRecord executeBatch(String relayer,
                                             BatchAuthorization authorization,
                                             byte[] signature,
                                             BigInteger attachedValue) {
        return chain.transact(() -> {
            guard.enter();
            try {
                return doExecuteBatch(Addresses.normalize(relayer), authorization, signature, attachedValue);
            } finally {
                guard.exit();
            }
        });
    }

    private BatchExecutionRecord doExecuteBatch(String relayer,
                                                BatchAuthorization auth,
                                                byte[] signature,
                                                BigInteger attachedValue) {
        String signer = auth.signer();
        List<BatchItem> items = auth.items();

        // preconditions
        admin.requireNotPaused();
        relayers.requireAuthorized(relayer);
        if (items.isEmpty()) {
            throw new PreconditionException(ErrorCode.EMPTY_BATCH, "batch has no items");
        }
        for (int i = 0; i < items.size(); i++) {
            if (!items.get(i).hasValidTarget()) {
                throw new PreconditionException(ErrorCode.INVALID_TARGET,
                        "item " + i + " sends value or data to the zero address");
            }
        }
        long now = chain.now();
        if (auth.deadline() < now) {
            throw new AuthorizationException(ErrorCode.EXPIRED,
                    "deadline " + auth.deadline() + " is before " + now);
        }
        nonces.requireCurrent(signer, auth.nonce());

        // authorization
        byte[] digest = BatchDigestBuilder.buildDigest(domain, signer, items, auth.nonce(), auth.deadline());
        String recovered = SignatureVerifier.recoverSigner(digest, signature);
        if (!recovered.equals(signer)) {
            throw new AuthorizationException(ErrorCode.INVALID_SIGNATURE,
                    "signature recovers " + recovered + ", not " + signer);
        }
        nonces.consume(signer, auth.nonce());

        // value precheck
        BigInteger totalRequired = calculateRequiredValue(items);
        if (attachedValue == null || attachedValue.compareTo(totalRequired) != 0) {
            throw new ValueAccountingException(ErrorCode.INCORRECT_VALUE_SUPPLIED,
                    "attached " + attachedValue + ", batch requires exactly " + totalRequired);
        }
        chain.transferNative(relayer, address, attachedValue);

        // dispatch
        List<Boolean> perItemSuccess = new ArrayList<>(items.size());
        BigInteger totalUsed = BigInteger.ZERO;
        for (int i = 0; i < items.size(); i++) {
            BatchItem item = items.get(i);
            CallOutcome outcome = chain.call(address, item.target(), item.value(), item.payload(), signer);
            perItemSuccess.add(outcome.success());
            if (outcome.success()) {
                totalUsed = totalUsed.add(item.value());
            } else {
                log.warn("Batch item {} for signer {} failed: target={}, reason={}",
                        i, signer, item.target(), outcome.failureReason());
            }
            chain.getEvents().emit(new MetaTransactionExecuted(address, relayer, signer, item.target(),
                    item.value(), CryptoUtil.toHex0x(item.payload()), outcome.success()));
        }

        // settlement
        BigInteger refunded = totalRequired.subtract(totalUsed);
        if (refunded.signum() > 0) {
            CallOutcome refund = chain.call(address, signer, refunded, new byte[0], null);
            if (!refund.success()) {
                throw new ValueAccountingException(ErrorCode.REFUND_FAILED,
                        "refund of " + refunded + " to " + signer + " failed: " + refund.failureReason());
            }
        }

        long batchId = batchCounter.get() + 1;
        batchCounter.set(batchId);
        chain.getEvents().emit(new BatchSettled(address, batchId, signer, relayer, totalRequired, totalUsed, refunded));

        BatchExecutionRecord record = new BatchExecutionRecord(batchId, signer, relayer, items.size(),
                totalRequired, totalUsed, refunded, perItemSuccess, now);
        records.save(record);
        chain.getJournal().record(() -> records.delete(batchId));

        log.info("Batch {} settled: signer={}, relayer={}, items={}, succeeded={}, required={}, used={}, refunded={}",
                batchId, signer, relayer, items.size(), record.successCount(), totalRequired, totalUsed, refunded);
        return record;
    }

    /**
     * Exact native value a relayer must attach to {@link #executeBatch}.
     */
    public static BigInteger calculateRequiredValue(List<BatchItem> items) {
        BigInteger total = BigInteger.ZERO;
        for (BatchItem item : items) {
            total = total.add(item.value());
        }
        return total;
    }

    public byte[] digestOf(BatchAuthorization authorization) {
        return BatchDigestBuilder.buildDigest(domain, authorization.signer(), authorization.items(),
                authorization.nonce(), authorization.deadline());
    }

    public BigInteger nonceOf(String signer) {
        return nonces.nonceOf(signer);
    }

    public long batchCount() {
        return batchCounter.get();
    }

    public void setRelayerAuthorization(String caller, String relayer, boolean authorized) {
        relayers.setAuthorization(caller, relayer, authorized);
    }

    public List<String> getAuthorizedRelayers() {
        return relayers.authorizedRelayers();
    }

    public void pause(String caller, String reason) {
        admin.pause(caller, reason);
    }

    public void unpause(String caller) {
        admin.unpause(caller);
    }

    public void transferOwnership(String caller, String newOwner) {
        admin.transferOwnership(caller, newOwner);
    }

    /**
     * Native value only reaches the gateway by mistake: batches settle within a single call.
     */
    public void rescueNative(String caller, String to, BigInteger amount) {
        chain.transact(() -> {
            admin.requireOwner(caller);
            guard.enter();
            try {
                String dst = requireNonZero(to);
                requirePositive(amount);
                if (chain.balanceOf(address).compareTo(amount) < 0) {
                    throw new ValueAccountingException(ErrorCode.INSUFFICIENT_NATIVE_BALANCE,
                            "gateway holds " + chain.balanceOf(address));
                }
                CallOutcome outcome = chain.call(address, dst, amount, new byte[0], null);
                if (!outcome.success()) {
                    throw new ValueAccountingException(ErrorCode.TRANSFER_FAILED,
                            "native rescue failed: " + outcome.failureReason());
                }
                chain.getEvents().emit(new AssetRescued(address, null, dst, amount));
                log.warn("Rescued {} native to {}", amount, dst);
            } finally {
                guard.exit();
            }
        });
    }

    public void rescueAsset(String caller, String asset, String to, BigInteger amount) {
        chain.transact(() -> {
            admin.requireOwner(caller);
            guard.enter();
            try {
                String dst = requireNonZero(to);
                requirePositive(amount);
                FungibleAsset token = chain.codeAt(asset, FungibleAsset.class)
                        .orElseThrow(() -> new PreconditionException(ErrorCode.INVALID_ASSET,
                                asset + " is not a fungible asset"));
                boolean ok;
                try {
                    ok = token.transfer(address, dst, amount);
                } catch (RuntimeException e) {
                    throw new ValueAccountingException(ErrorCode.TRANSFER_FAILED, "asset rescue reverted", e);
                }
                if (!ok) {
                    throw new ValueAccountingException(ErrorCode.TRANSFER_FAILED, "asset rescue returned false");
                }
                chain.getEvents().emit(new AssetRescued(address, token.address(), dst, amount));
                log.warn("Rescued {} of {} to {}", amount, token.symbol(), dst);
            } finally {
                guard.exit();
            }
        });
    }

    private static String requireNonZero(String to) {
        String dst = Addresses.normalize(to);
        if (Addresses.isZero(dst)) {
            throw new PreconditionException(ErrorCode.ZERO_ADDRESS, "recipient is the zero address");
        }
        return dst;
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new PreconditionException(ErrorCode.INVALID_AMOUNT, "amount must be positive");
        }
    }
}
