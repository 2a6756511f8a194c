package dao.cosmos.peggy.repository;

import dao.cosmos.peggy.model.ValsetConfirm;
import org.springframework.stereotype.Repository;

@Repository
public class ValsetConfirmStore extends ConfirmationStore<Long, ValsetConfirm> {

    public ValsetConfirmStore(StoreCodec codec) {
        super(codec, ValsetConfirm.class);
    }

    @Override
    protected byte[] subjectPrefix(Long nonce) {
        return StoreKeys.valsetConfirmPrefix(nonce);
    }
}
