package dao.metatx.relay.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class BatchItemRequest {

    @NotBlank
    private String target;

    @NotBlank
    @Pattern(regexp = "\\d+")
    private String value;           // wei, string decimal

    @Pattern(regexp = "^(0x)?([0-9a-fA-F]{2})*$")
    private String data;            // 0x-hex call data, empty for plain value transfers
}
