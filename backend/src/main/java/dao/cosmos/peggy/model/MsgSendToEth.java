package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MsgSendToEth {

    @NotBlank
    private String sender;

    @NotBlank
    private String ethDest;

    @NotBlank
    private String tokenContract;

    @NotBlank
    private String amount;          // string decimal

    @NotBlank
    private String bridgeFee;       // string decimal, same contract as amount
}
