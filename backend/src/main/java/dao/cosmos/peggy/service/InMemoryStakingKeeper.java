package dao.cosmos.peggy.service;

import dao.cosmos.peggy.model.ValidatorPower;
import dao.cosmos.peggy.repository.StoreContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Staking table held in memory, used when the service runs without a host
 * chain and in tests. Validators are reported by power descending, then
 * operator address ascending.
 */
@Slf4j
@Component
public class InMemoryStakingKeeper implements StakingKeeper {

    private final Map<String, Long> powers = new TreeMap<>();

    public synchronized void setValidatorPower(String validator, long power) {
        if (power < 0) {
            throw new IllegalArgumentException("power must not be negative");
        }
        if (power == 0) {
            powers.remove(validator);
        } else {
            powers.put(validator, power);
        }
        log.debug("Staking power set: validator={}, power={}", validator, power);
    }

    public synchronized void clear() {
        powers.clear();
    }

    @Override
    public synchronized List<ValidatorPower> getBondedValidators(StoreContext ctx) {
        List<ValidatorPower> res = new ArrayList<>();
        powers.forEach((validator, power) -> res.add(new ValidatorPower(validator, power)));
        res.sort(Comparator.comparingLong(ValidatorPower::power).reversed()
                .thenComparing(ValidatorPower::validator));
        return res;
    }
}
