package dao.metatx.relay.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.config.RelayerProperties;
import dao.metatx.relay.crypto.BatchSigner;
import dao.metatx.relay.model.BatchAuthorization;
import dao.metatx.relay.model.BatchAuthorizationRequest;
import dao.metatx.relay.model.BatchItemRequest;
import dao.metatx.relay.model.RelayRequest;
import dao.metatx.relay.repository.InMemoryExecutionRecordRepository;
import dao.metatx.relay.service.GasCreditVault;
import dao.metatx.relay.service.MetaTxGateway;
import dao.metatx.relay.service.RelayService;
import dao.metatx.relay.support.MutableClock;
import dao.metatx.relay.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static dao.metatx.relay.support.TestAccounts.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RelayControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private MetaTxGateway gateway;
    private RelayService relayService;
    private MockMvc mockMvc;
    private String signer;

    @BeforeEach
    void setUp() {
        LocalChain chain = new LocalChain(CHAIN_ID, new MutableClock(GENESIS_TIME));
        String owner = OWNER.getAddress();
        signer = SIGNER.getAddress();
        InMemoryExecutionRecordRepository records = new InMemoryExecutionRecordRepository();

        gateway = new MetaTxGateway(chain, GATEWAY, owner, "MetaTxGateway", "2", records);
        GasCreditVault vault = new GasCreditVault(chain, VAULT, owner, 3600);
        gateway.setRelayerAuthorization(owner, RELAYER.getAddress(), true);
        chain.fund(RELAYER.getAddress(), ether(1));

        relayService = new RelayService(chain, gateway, vault, RELAYER, new RelayerProperties());
        mockMvc = MockMvcBuilders
                .standaloneSetup(new RelayController(relayService, gateway), new MonitoringController(records, gateway, chain))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Signed batch is relayed and shows up in monitoring")
    void relayAndMonitor() throws Exception {
        String body = mapper.writeValueAsString(signed(authorization("0")));

        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.batchId").value(1))
                .andExpect(jsonPath("$.perItemSuccess[0]").value(true))
                .andExpect(jsonPath("$.refunded").value("0"));

        mockMvc.perform(get("/api/monitor/batch/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batch.signer").value(signer));

        mockMvc.perform(get("/api/relay/nonces/" + signer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nonce").value("1"));
    }

    @Test
    @DisplayName("Replayed batch is rejected as an authorization error")
    void replayIsForbidden() throws Exception {
        String body = mapper.writeValueAsString(signed(authorization("0")));
        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INVALID_NONCE"))
                .andExpect(jsonPath("$.category").value("AUTHORIZATION"));
    }

    @Test
    @DisplayName("Empty batch is a precondition error")
    void emptyBatchIsBadRequest() throws Exception {
        BatchAuthorizationRequest auth = authorization("0");
        auth.setItems(List.of());

        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(signed(auth))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("EMPTY_BATCH"));
    }

    @Test
    @DisplayName("Missing fields fail bean validation")
    void validation() throws Exception {
        RelayRequest req = new RelayRequest();
        req.setAuthorization(authorization("0"));

        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("Item without call data is relayed as a plain transfer")
    void missingDataIsPlainTransfer() throws Exception {
        BatchAuthorizationRequest auth = authorization("0");
        auth.getItems().get(0).setData(null);

        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(signed(auth))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.perItemSuccess[0]").value(true));
    }

    @Test
    @DisplayName("Call data or signature that is not hex fails bean validation")
    void malformedHexIsBadRequest() throws Exception {
        RelayRequest req = signed(authorization("0"));
        req.getAuthorization().getItems().get(0).setData("0xzz");

        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("INVALID_REQUEST"));

        RelayRequest badSignature = signed(authorization("0"));
        badSignature.setSignature("0x123");

        mockMvc.perform(post("/api/relay/batches").contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(badSignature)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("Digest endpoint returns the digest the gateway verifies")
    void digest() throws Exception {
        BatchAuthorizationRequest auth = authorization("0");
        String expected = CryptoUtil.toHex0x(gateway.digestOf(relayService.toAuthorization(auth)));

        mockMvc.perform(post("/api/relay/digest").contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(auth)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.digest").value(expected))
                .andExpect(jsonPath("$.chainId").value((int) CHAIN_ID));
    }

    @Test
    @DisplayName("Unknown batch id is 404")
    void unknownBatch() throws Exception {
        mockMvc.perform(get("/api/monitor/batch/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("NOT_FOUND"));
    }

    private BatchAuthorizationRequest authorization(String nonce) {
        BatchItemRequest item = new BatchItemRequest();
        item.setTarget(RECIPIENT);
        item.setValue("1000");
        item.setData("0x");

        BatchAuthorizationRequest req = new BatchAuthorizationRequest();
        req.setSigner(signer);
        req.setItems(List.of(item));
        req.setNonce(nonce);
        req.setDeadline(GENESIS_TIME + 600);
        return req;
    }

    private RelayRequest signed(BatchAuthorizationRequest authReq) {
        BatchAuthorization auth = relayService.toAuthorization(authReq);
        RelayRequest req = new RelayRequest();
        req.setAuthorization(authReq);
        req.setSignature(CryptoUtil.toHex0x(BatchSigner.sign(SIGNER, gateway.getDomain(), auth)));
        return req;
    }
}
