package dao.metatx.relay.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ApiError {
    String status;
    String code;
    String category;
    String error;
}
