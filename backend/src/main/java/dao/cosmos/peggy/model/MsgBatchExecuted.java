package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Applies the observed execution of a batch on Ethereum.
 */
@Data
public class MsgBatchExecuted {

    @NotBlank
    private String tokenContract;

    @NotNull
    private Long batchNonce;
}
