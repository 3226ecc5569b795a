package name.monarchy.mechanics;

import name.monarchy.InvalidInputException;
import name.monarchy.kingdom.UnitStack;

import java.util.List;

/**
 * Input to one combat resolution. For the attacker only {@code units} matter;
 * the defender also brings holdings that can be taken.
 */
public record CombatSide(List<UnitStack> units, double land, double gold, boolean ambushActive) {

    public CombatSide {
        InvalidInputException.requirePresent("units", units);
        units = List.copyOf(units);
        InvalidInputException.requireNonNegative("land", land);
        InvalidInputException.requireNonNegative("gold", gold);
    }

    public static CombatSide attacker(List<UnitStack> units) {
        return new CombatSide(units, 0, 0, false);
    }

    public double offensePower() {
        double sum = 0;
        for (UnitStack u : units) sum += u.offensePower();
        return sum;
    }

    public double defensePower() {
        double sum = 0;
        for (UnitStack u : units) sum += u.defensePower();
        return sum;
    }
}
