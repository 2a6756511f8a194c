package dao.cosmos.peggy.repository;

import dao.cosmos.peggy.model.LogicCallConfirm;
import dao.cosmos.peggy.model.LogicCallKey;
import org.springframework.stereotype.Repository;

@Repository
public class LogicCallConfirmStore extends ConfirmationStore<LogicCallKey, LogicCallConfirm> {

    public LogicCallConfirmStore(StoreCodec codec) {
        super(codec, LogicCallConfirm.class);
    }

    @Override
    protected byte[] subjectPrefix(LogicCallKey key) {
        return StoreKeys.logicCallConfirmPrefix(key.invalidationId(), key.invalidationNonce());
    }
}
