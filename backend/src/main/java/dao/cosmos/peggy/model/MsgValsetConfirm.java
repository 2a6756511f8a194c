package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MsgValsetConfirm {

    @NotNull
    private Long nonce;

    @NotBlank
    private String orchestrator;

    @NotBlank
    private String ethAddress;

    @NotBlank
    private String signature;       // hex
}
