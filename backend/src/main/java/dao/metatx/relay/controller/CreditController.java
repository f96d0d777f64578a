package dao.metatx.relay.controller;

import dao.metatx.relay.model.AssetWhitelistEntry;
import dao.metatx.relay.model.PriceQuote;
import dao.metatx.relay.service.GasCreditVault;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the gas credit vault.
 */
@RestController
@RequestMapping("/api/credits")
public class CreditController {

    private final GasCreditVault vault;

    public CreditController(GasCreditVault vault) {
        this.vault = vault;
    }

    @GetMapping("/accounts/{account}")
    public ResponseEntity<Map<String, Object>> credits(@PathVariable String account) {
        return ResponseEntity.ok(Map.of(
                "account", account,
                "credits", vault.creditsOf(account).toString()));
    }

    /**
     * GET /api/credits/assets
     * Whitelisted assets with held, backing and consumed balances.
     */
    @GetMapping("/assets")
    public ResponseEntity<Map<String, Object>> assets() {
        List<Map<String, Object>> assets = new ArrayList<>();
        for (AssetWhitelistEntry entry : vault.getWhitelist().entries()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("asset", entry.asset());
            info.put("priceFeed", entry.priceFeed());
            info.put("fixedUnit", entry.fixedUnit());
            info.put("decimals", entry.decimals());
            info.put("held", vault.heldBalance(entry.asset()).toString());
            info.put("creditBacking", vault.creditBacking(entry.asset()).toString());
            info.put("consumed", vault.consumedBalance(entry.asset()).toString());
            assets.add(info);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalAssets", assets.size());
        response.put("assets", assets);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/assets/{asset}/price")
    public ResponseEntity<Map<String, Object>> price(@PathVariable String asset) {
        AssetWhitelistEntry entry = vault.getWhitelist().entry(asset);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("asset", entry.asset());
        if (entry.fixedUnit()) {
            response.put("fixedUnit", true);
            return ResponseEntity.ok(response);
        }
        PriceQuote quote = vault.getPrices().getPrice(entry);
        response.put("price", quote.price().toString());
        response.put("feedDecimals", quote.feedDecimals());
        response.put("updatedAt", quote.updatedAt());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/summary")
    public ResponseEntity<Map<String, Object>> summary() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("vault", vault.getAddress());
        response.put("owner", vault.getAdmin().owner());
        response.put("paused", vault.isPaused());
        response.put("totalCredits", vault.totalCredits().toString());
        response.put("totalConsumedCredits", vault.totalConsumedCredits().toString());
        response.put("relayers", vault.getWhitelistedRelayers());
        return ResponseEntity.ok(response);
    }
}
