package dao.metatx.relay.service;

import dao.metatx.relay.asset.FungibleAsset;
import dao.metatx.relay.asset.PriceFeed;
import dao.metatx.relay.chain.JournaledMap;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.PreconditionException;
import dao.metatx.relay.model.AssetWhitelistEntry;
import dao.metatx.relay.util.Addresses;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Assets the vault accepts, each bound to an optional price feed and a fixed-unit flag.
 * Re-whitelisting an asset replaces its entry.
 */
public class AssetWhitelist {

    private final LocalChain chain;
    private final JournaledMap<String, AssetWhitelistEntry> entries;

    public AssetWhitelist(LocalChain chain) {
        this.chain = chain;
        this.entries = chain.newMap();
    }

    /**
     * Caller must have checked ownership; runs inside the owner's transaction.
     */
    public AssetWhitelistEntry put(String asset, String priceFeed, boolean fixedUnit) {
        String assetAddr = Addresses.normalize(asset);
        if (Addresses.isZero(assetAddr)) {
            throw new PreconditionException(ErrorCode.ZERO_ADDRESS, "asset is the zero address");
        }
        FungibleAsset token = chain.codeAt(assetAddr, FungibleAsset.class)
                .orElseThrow(() -> new PreconditionException(ErrorCode.INVALID_ASSET,
                        assetAddr + " is not a fungible asset"));

        String feedAddr = null;
        if (priceFeed != null && !priceFeed.isBlank() && !Addresses.isZero(priceFeed)) {
            feedAddr = Addresses.normalize(priceFeed);
            if (chain.codeAt(feedAddr, PriceFeed.class).isEmpty()) {
                throw new PreconditionException(ErrorCode.MISSING_PRICE_FEED, feedAddr + " is not a price feed");
            }
        }
        if (!fixedUnit && feedAddr == null) {
            throw new PreconditionException(ErrorCode.MISSING_PRICE_FEED,
                    "volatile asset " + assetAddr + " needs a price feed");
        }
        AssetWhitelistEntry entry = new AssetWhitelistEntry(assetAddr, feedAddr, fixedUnit, token.decimals());
        entries.put(assetAddr, entry);
        return entry;
    }

    public AssetWhitelistEntry entry(String asset) {
        return find(asset).orElseThrow(() -> new PreconditionException(ErrorCode.UNSUPPORTED_ASSET,
                "token not whitelisted: " + asset));
    }

    public Optional<AssetWhitelistEntry> find(String asset) {
        if (!Addresses.isValid(asset)) return Optional.empty();
        return Optional.ofNullable(entries.get(Addresses.normalize(asset)));
    }

    public boolean isWhitelisted(String asset) {
        return find(asset).isPresent();
    }

    public List<AssetWhitelistEntry> entries() {
        return new ArrayList<>(entries.snapshot().values());
    }
}
