package dao.cosmos.peggy.service;

import dao.cosmos.peggy.model.ValidatorPower;
import dao.cosmos.peggy.repository.StoreContext;

import java.util.List;

/**
 * Read-only view of the staking module.
 */
public interface StakingKeeper {

    /**
     * Currently bonded validators with their voting power, in an order that
     * is identical on every replica.
     */
    List<ValidatorPower> getBondedValidators(StoreContext ctx);
}
