package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MsgSetEthAddress {

    @NotBlank
    private String validator;       // bech32 operator address

    @NotBlank
    private String ethAddress;
}
