package dao.metatx.relay.service;

import dao.metatx.relay.asset.FungibleAsset;
import dao.metatx.relay.chain.AdminConfig;
import dao.metatx.relay.chain.JournaledCell;
import dao.metatx.relay.chain.JournaledMap;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.chain.ReentrancyGuard;
import dao.metatx.relay.event.AssetDeposited;
import dao.metatx.relay.event.AssetRescued;
import dao.metatx.relay.event.AssetWhitelisted;
import dao.metatx.relay.event.AssetWithdrawn;
import dao.metatx.relay.event.ConsumedCreditsWithdrawn;
import dao.metatx.relay.event.CreditConsumed;
import dao.metatx.relay.event.CreditTransferred;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.PreconditionException;
import dao.metatx.relay.exception.ValueAccountingException;
import dao.metatx.relay.model.AssetWhitelistEntry;
import dao.metatx.relay.util.Addresses;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Gas credit ledger. Accounts buy credits with whitelisted assets at the feed price (or 1:1 for
 * fixed-unit assets); whitelisted relayers consume credits to pay for relaying; the owner claims
 * the assets backing consumed credits.
 * <p>
 * Every asset tracks its held balance and its credit backing (credits minted from it, less credits
 * burned by withdrawals of it). Consumption is attributed to assets in proportion to their backing;
 * see {@link #consumeCredit}.
 */
@Slf4j
public class GasCreditVault {

    private final LocalChain chain;
    @Getter
    private final String address;
    @Getter
    private final AdminConfig admin;
    @Getter
    private final RelayerRegistry relayers;
    @Getter
    private final AssetWhitelist whitelist;
    @Getter
    private final PriceConversionService prices;
    private final ReentrancyGuard guard = new ReentrancyGuard("GasCreditVault");

    private final JournaledMap<String, BigInteger> credits;
    private final JournaledMap<String, BigInteger> held;
    private final JournaledMap<String, BigInteger> backing;
    private final JournaledMap<String, BigInteger> consumedPool;
    private final JournaledCell<BigInteger> unclaimedConsumedCredits;

    public GasCreditVault(LocalChain chain, String address, String owner, long maxStalenessSeconds) {
        this.chain = chain;
        this.address = Addresses.normalize(address);
        this.admin = new AdminConfig(chain, this.address, owner);
        this.relayers = new RelayerRegistry(chain, this.address, admin);
        this.whitelist = new AssetWhitelist(chain);
        this.prices = new PriceConversionService(chain, maxStalenessSeconds);
        this.credits = chain.newMap();
        this.held = chain.newMap();
        this.backing = chain.newMap();
        this.consumedPool = chain.newMap();
        this.unclaimedConsumedCredits = chain.newCell(BigInteger.ZERO);
    }

    // ---------------------------------------------------------------- admin

    public AssetWhitelistEntry whitelistAsset(String caller, String asset, String priceFeed, boolean fixedUnit) {
        return chain.transact(() -> {
            admin.requireOwner(caller);
            AssetWhitelistEntry entry = whitelist.put(asset, priceFeed, fixedUnit);
            chain.getEvents().emit(new AssetWhitelisted(address, entry.asset(), entry.priceFeed(), entry.fixedUnit()));
            log.info("Asset whitelisted: asset={}, feed={}, fixedUnit={}, decimals={}",
                    entry.asset(), entry.priceFeed(), entry.fixedUnit(), entry.decimals());
            return entry;
        });
    }

    public void addWhitelistedRelayer(String caller, String relayer) {
        relayers.setAuthorization(caller, relayer, true);
    }

    public void removeWhitelistedRelayer(String caller, String relayer) {
        relayers.setAuthorization(caller, relayer, false);
    }

    public List<String> getWhitelistedRelayers() {
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

    // ---------------------------------------------------------------- account operations

    public BigInteger deposit(String caller, String asset, BigInteger amount) {
        return guarded(() -> {
            admin.requireNotPaused();
            String account = Addresses.normalize(caller);
            AssetWhitelistEntry entry = whitelist.entry(asset);
            requirePositive(amount);
            BigInteger minted = prices.toCredits(entry, amount);
            if (minted.signum() == 0) {
                throw new PreconditionException(ErrorCode.ZERO_CREDITS, "deposit of " + amount + " is worth no credits");
            }

            FungibleAsset token = assetOf(entry);
            pull(token, account, amount);

            add(held, entry.asset(), amount);
            add(backing, entry.asset(), minted);
            add(credits, account, minted);
            chain.getEvents().emit(new AssetDeposited(address, account, entry.asset(), amount, minted));
            log.info("Deposit: account={}, asset={}, amount={}, creditsMinted={}", account, token.symbol(), amount, minted);
            return minted;
        });
    }

    public BigInteger withdraw(String caller, String asset, BigInteger amount) {
        return guarded(() -> {
            admin.requireNotPaused();
            String account = Addresses.normalize(caller);
            AssetWhitelistEntry entry = whitelist.entry(asset);
            requirePositive(amount);

            BigInteger heldBalance = heldBalance(entry.asset());
            if (heldBalance.compareTo(amount) < 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_ASSET_BALANCE,
                        "vault holds " + heldBalance + " of " + entry.asset() + ", requested " + amount);
            }
            BigInteger burned = prices.toCredits(entry, amount);
            if (burned.signum() == 0) {
                throw new PreconditionException(ErrorCode.ZERO_CREDITS, "withdrawal of " + amount + " is worth no credits");
            }
            BigInteger balance = creditsOf(account);
            if (balance.compareTo(burned) < 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_CREDITS,
                        "account " + account + " has " + balance + " credits, needs " + burned);
            }

            credits.put(account, balance.subtract(burned));
            held.put(entry.asset(), heldBalance.subtract(amount));
            BigInteger assetBacking = creditBacking(entry.asset());
            backing.put(entry.asset(), assetBacking.subtract(assetBacking.min(burned)));

            push(assetOf(entry), account, amount);
            chain.getEvents().emit(new AssetWithdrawn(address, account, entry.asset(), amount, burned));
            log.info("Withdraw: account={}, asset={}, amount={}, creditsBurned={}", account, entry.asset(), amount, burned);
            return burned;
        });
    }

    public void transferCredit(String caller, String to, BigInteger amount) {
        chain.transact(() -> {
            admin.requireNotPaused();
            String from = Addresses.normalize(caller);
            String dst = Addresses.normalize(to);
            if (Addresses.isZero(dst)) {
                throw new PreconditionException(ErrorCode.ZERO_ADDRESS, "cannot transfer credits to the zero address");
            }
            requirePositive(amount);
            BigInteger balance = creditsOf(from);
            if (balance.compareTo(amount) < 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_CREDITS,
                        "account " + from + " has " + balance + " credits, needs " + amount);
            }
            credits.put(from, balance.subtract(amount));
            add(credits, dst, amount);
            chain.getEvents().emit(new CreditTransferred(address, from, dst, amount));
        });
    }

    /**
     * Moves {@code amount} credits from {@code account} into the consumed pool.
     * <p>
     * Attribution: the amount is split over whitelisted assets in whitelist order, in proportion to
     * each asset's credit backing (rounded down, remainder to the last backed asset). Each asset
     * then moves {@code held * share / backing} units from its held balance into its consumed pool.
     */
    public void consumeCredit(String caller, String account, BigInteger amount) {
        guarded(() -> {
            admin.requireNotPaused();
            String relayer = Addresses.normalize(caller);
            relayers.requireAuthorized(relayer);
            String acct = Addresses.normalize(account);
            requirePositive(amount);
            BigInteger balance = creditsOf(acct);
            if (balance.compareTo(amount) < 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_CREDITS,
                        "account " + acct + " has " + balance + " credits, needs " + amount);
            }
            credits.put(acct, balance.subtract(amount));
            attributeConsumption(amount);
            unclaimedConsumedCredits.set(unclaimedConsumedCredits.get().add(amount));
            chain.getEvents().emit(new CreditConsumed(address, relayer, acct, amount));
            log.info("Credits consumed: relayer={}, account={}, amount={}", relayer, acct, amount);
            return null;
        });
    }

    public void withdrawConsumedCredits(String caller) {
        guarded(() -> {
            admin.requireOwner(caller);
            String owner = admin.owner();
            for (Map.Entry<String, BigInteger> e : consumedPool.snapshot().entrySet()) {
                BigInteger amount = e.getValue();
                if (amount.signum() == 0) continue;
                AssetWhitelistEntry entry = whitelist.entry(e.getKey());
                push(assetOf(entry), owner, amount);
                consumedPool.put(e.getKey(), BigInteger.ZERO);
                chain.getEvents().emit(new ConsumedCreditsWithdrawn(address, owner, e.getKey(), amount));
                log.info("Consumed pool paid out: asset={}, amount={}, owner={}", e.getKey(), amount, owner);
            }
            unclaimedConsumedCredits.set(BigInteger.ZERO);
            return null;
        });
    }

    /**
     * Only the surplus above what backs credits and the consumed pool can leave this way.
     */
    public void emergencyWithdraw(String caller, String asset, String to, BigInteger amount) {
        guarded(() -> {
            admin.requireOwner(caller);
            String dst = Addresses.normalize(to);
            if (Addresses.isZero(dst)) {
                throw new PreconditionException(ErrorCode.ZERO_ADDRESS, "recipient is the zero address");
            }
            requirePositive(amount);
            FungibleAsset token = chain.codeAt(asset, FungibleAsset.class)
                    .orElseThrow(() -> new PreconditionException(ErrorCode.INVALID_ASSET,
                            asset + " is not a fungible asset"));
            BigInteger surplus = token.balanceOf(address)
                    .subtract(heldBalance(token.address()))
                    .subtract(consumedBalance(token.address()));
            if (surplus.compareTo(amount) < 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_ASSET_BALANCE,
                        "only " + surplus.max(BigInteger.ZERO) + " of " + token.address() + " is unaccounted");
            }
            push(token, dst, amount);
            chain.getEvents().emit(new AssetRescued(address, token.address(), dst, amount));
            log.warn("Emergency withdraw: asset={}, amount={}, to={}", token.address(), amount, dst);
            return null;
        });
    }

    // ---------------------------------------------------------------- queries

    public BigInteger creditsOf(String account) {
        return credits.getOrDefault(Addresses.normalize(account), BigInteger.ZERO);
    }

    public BigInteger heldBalance(String asset) {
        return held.getOrDefault(Addresses.normalize(asset), BigInteger.ZERO);
    }

    public BigInteger creditBacking(String asset) {
        return backing.getOrDefault(Addresses.normalize(asset), BigInteger.ZERO);
    }

    public BigInteger consumedBalance(String asset) {
        return consumedPool.getOrDefault(Addresses.normalize(asset), BigInteger.ZERO);
    }

    public BigInteger totalConsumedCredits() {
        return unclaimedConsumedCredits.get();
    }

    public BigInteger totalCredits() {
        BigInteger sum = BigInteger.ZERO;
        for (BigInteger v : credits.snapshot().values()) {
            sum = sum.add(v);
        }
        return sum;
    }

    public boolean isPaused() {
        return admin.isPaused();
    }

    // ---------------------------------------------------------------- internals

    private void attributeConsumption(BigInteger amount) {
        List<String> backed = new ArrayList<>();
        BigInteger totalBacking = BigInteger.ZERO;
        for (AssetWhitelistEntry entry : whitelist.entries()) {
            BigInteger b = creditBacking(entry.asset());
            if (b.signum() > 0) {
                backed.add(entry.asset());
                totalBacking = totalBacking.add(b);
            }
        }
        if (totalBacking.signum() == 0) {
            log.warn("Consumed {} credits with no asset backing left; nothing moves to the pool", amount);
            return;
        }

        BigInteger remaining = amount;
        for (int i = 0; i < backed.size(); i++) {
            String asset = backed.get(i);
            BigInteger assetBacking = creditBacking(asset);
            BigInteger share = (i == backed.size() - 1)
                    ? remaining
                    : amount.multiply(assetBacking).divide(totalBacking);
            share = share.min(assetBacking);
            remaining = remaining.subtract(share);
            if (share.signum() == 0) continue;

            BigInteger assetHeld = heldBalance(asset);
            BigInteger assetOut = assetHeld.multiply(share).divide(assetBacking);
            backing.put(asset, assetBacking.subtract(share));
            held.put(asset, assetHeld.subtract(assetOut));
            add(consumedPool, asset, assetOut);
        }
    }

    private <T> T guarded(Supplier<T> operation) {
        return chain.transact(() -> {
            guard.enter();
            try {
                return operation.get();
            } finally {
                guard.exit();
            }
        });
    }

    private FungibleAsset assetOf(AssetWhitelistEntry entry) {
        return chain.codeAt(entry.asset(), FungibleAsset.class)
                .orElseThrow(() -> new PreconditionException(ErrorCode.INVALID_ASSET,
                        entry.asset() + " has no asset code"));
    }

    private void pull(FungibleAsset token, String from, BigInteger amount) {
        boolean ok;
        try {
            ok = token.transferFrom(address, from, address, amount);
        } catch (RuntimeException e) {
            throw new ValueAccountingException(ErrorCode.TRANSFER_FAILED,
                    "transferFrom " + from + " reverted: " + e.getMessage(), e);
        }
        if (!ok) {
            throw new ValueAccountingException(ErrorCode.TRANSFER_FAILED, "transferFrom " + from + " returned false");
        }
    }

    private void push(FungibleAsset token, String to, BigInteger amount) {
        boolean ok;
        try {
            ok = token.transfer(address, to, amount);
        } catch (RuntimeException e) {
            throw new ValueAccountingException(ErrorCode.TRANSFER_FAILED,
                    "transfer to " + to + " reverted: " + e.getMessage(), e);
        }
        if (!ok) {
            throw new ValueAccountingException(ErrorCode.TRANSFER_FAILED, "transfer to " + to + " returned false");
        }
    }

    private static void add(JournaledMap<String, BigInteger> map, String key, BigInteger delta) {
        map.put(key, map.getOrDefault(key, BigInteger.ZERO).add(delta));
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new PreconditionException(ErrorCode.INVALID_AMOUNT, "amount must be greater than 0");
        }
    }
}
