package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Applies the observed execution of a logic call on Ethereum.
 */
@Data
public class MsgLogicCallExecuted {

    @NotBlank
    private String invalidationId;  // hex

    @NotNull
    private Long invalidationNonce;
}
