package dao.metatx.relay.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class RelayRequest {

    @NotNull
    @Valid
    private BatchAuthorizationRequest authorization;

    @NotBlank
    @Pattern(regexp = "^(0x)?([0-9a-fA-F]{2})*$")
    private String signature;       // 65-byte r ‖ s ‖ v, 0x-hex
}
