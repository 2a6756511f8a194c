package dao.cosmos.peggy.repository;

import dao.cosmos.peggy.model.BatchConfirm;
import dao.cosmos.peggy.model.BatchKey;
import org.springframework.stereotype.Repository;

@Repository
public class BatchConfirmStore extends ConfirmationStore<BatchKey, BatchConfirm> {

    public BatchConfirmStore(StoreCodec codec) {
        super(codec, BatchConfirm.class);
    }

    @Override
    protected byte[] subjectPrefix(BatchKey key) {
        return StoreKeys.batchConfirmPrefix(key.nonce(), key.tokenContract());
    }
}
