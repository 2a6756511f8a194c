package dao.cosmos.peggy.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MsgSubmitLogicCall {

    @Valid
    private List<TokenAmount> transfers = new ArrayList<>();

    @Valid
    private List<TokenAmount> fees = new ArrayList<>();

    @NotBlank
    private String logicContractAddress;

    private String payload = "0x";  // hex

    @NotNull
    private Long timeout;           // Ethereum block height, checked by the contract

    @NotBlank
    private String invalidationId;  // hex

    @NotNull
    private Long invalidationNonce;
}
