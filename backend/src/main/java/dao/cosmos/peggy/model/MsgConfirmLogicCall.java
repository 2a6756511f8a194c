package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MsgConfirmLogicCall {

    @NotBlank
    private String invalidationId;  // hex

    @NotNull
    private Long invalidationNonce;

    @NotBlank
    private String ethSigner;

    @NotBlank
    private String orchestrator;

    @NotBlank
    private String signature;       // hex
}
