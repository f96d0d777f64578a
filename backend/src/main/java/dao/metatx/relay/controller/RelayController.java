package dao.metatx.relay.controller;

import dao.metatx.relay.model.BatchAuthorizationRequest;
import dao.metatx.relay.model.BatchExecutionRecord;
import dao.metatx.relay.model.RelayOutcome;
import dao.metatx.relay.model.RelayRequest;
import dao.metatx.relay.service.MetaTxGateway;
import dao.metatx.relay.service.RelayService;
import dao.metatx.relay.util.CryptoUtil;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/relay")
public class RelayController {

    private final RelayService relayService;
    private final MetaTxGateway gateway;

    public RelayController(RelayService relayService, MetaTxGateway gateway) {
        this.relayService = relayService;
        this.gateway = gateway;
    }

    /**
     * POST /api/relay/batches
     * Submit a signed batch; the relayer attaches the required value.
     */
    @PostMapping("/batches")
    public ResponseEntity<Map<String, Object>> relay(@Valid @RequestBody RelayRequest req) {
        RelayOutcome outcome = relayService.relay(req);
        BatchExecutionRecord record = outcome.record();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("batchId", record.batchId());
        response.put("signer", record.signer());
        response.put("relayer", record.relayer());
        response.put("perItemSuccess", record.perItemSuccess());
        response.put("totalValueRequired", record.totalValueRequired().toString());
        response.put("totalValueUsed", record.totalValueUsed().toString());
        response.put("refunded", record.refunded().toString());
        response.put("creditsCharged", outcome.creditsCharged().toString());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/required-value")
    public ResponseEntity<Map<String, Object>> requiredValue(@Valid @RequestBody BatchAuthorizationRequest req) {
        return ResponseEntity.ok(Map.of("requiredValue", relayService.requiredValue(req).toString()));
    }

    /**
     * POST /api/relay/digest
     * The 32-byte digest the signer has to sign for this batch.
     */
    @PostMapping("/digest")
    public ResponseEntity<Map<String, Object>> digest(@Valid @RequestBody BatchAuthorizationRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("digest", CryptoUtil.toHex0x(relayService.digest(req)));
        response.put("domainName", gateway.getDomain().name());
        response.put("domainVersion", gateway.getDomain().version());
        response.put("chainId", gateway.getDomain().chainId());
        response.put("verifyingContract", gateway.getDomain().verifyingContract());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/nonces/{signer}")
    public ResponseEntity<Map<String, Object>> nonce(@PathVariable String signer) {
        return ResponseEntity.ok(Map.of(
                "signer", signer,
                "nonce", gateway.nonceOf(signer).toString()));
    }

    @GetMapping("/relayer")
    public ResponseEntity<Map<String, Object>> relayer() {
        String relayer = relayService.relayerAddress();
        return ResponseEntity.ok(Map.of(
                "relayer", relayer,
                "authorized", gateway.getRelayers().isAuthorized(relayer)));
    }
}
