package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MsgSetAssetMapping {

    @NotBlank
    private String denom;

    @NotBlank
    private String erc20;

    private boolean cosmosOriginated;
}
