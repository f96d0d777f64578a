package dao.metatx.relay.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.List;

@Data
public class BatchAuthorizationRequest {

    @NotBlank
    private String signer;

    @NotNull
    private List<@Valid BatchItemRequest> items;

    @NotBlank
    @Pattern(regexp = "\\d+")
    private String nonce;

    @NotNull
    private Long deadline;          // unix seconds
}
