package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MsgValsetRequest {

    @NotBlank
    private String requester;
}
