package dao.cosmos.peggy.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MsgRequestBatch {

    @NotBlank
    private String requester;

    @NotBlank
    private String tokenContract;

    /**
     * Upper bound on transfers in the batch; falls back to
     * {@code peggy.batch.max-size} when absent.
     */
    private Integer maxSize;
}
