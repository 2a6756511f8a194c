package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenAmount {

    @NotBlank
    private String contract;

    @NotBlank
    private String amount;          // string decimal
}
