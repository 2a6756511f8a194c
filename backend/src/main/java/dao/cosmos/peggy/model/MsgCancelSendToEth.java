package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MsgCancelSendToEth {

    @NotBlank
    private String sender;

    @NotNull
    private Long transactionId;
}
