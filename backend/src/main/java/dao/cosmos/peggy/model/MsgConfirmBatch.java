package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MsgConfirmBatch {

    @NotNull
    private Long nonce;

    @NotBlank
    private String tokenContract;

    @NotBlank
    private String ethSigner;

    @NotBlank
    private String orchestrator;

    @NotBlank
    private String signature;       // hex
}
