package name.monarchy.strategy;

import name.monarchy.kingdom.Kingdom;
import name.monarchy.mechanics.CombatMechanics;

/**
 * Quick networth-based outlook for attacking one target.
 */
public record CombatForecast(
        String targetId,
        double networthRatio,   // attacker / defender
        int turnCost,
        double landPct,
        double successProbability,
        int expectedLand,
        double efficiency       // land per turn
) {

    public static CombatForecast of(Kingdom attacker, Kingdom target) {
        double anw = attacker.networth();
        double tnw = target.networth();
        double ratio = anw / Math.max(1.0, tnw);

        int turns = CombatMechanics.turnCost(anw, tnw);

        double landPct;
        if (ratio >= 1.5) landPct = 0.0735;
        else if (ratio >= 1.2) landPct = 0.070;
        else landPct = 0.0679;

        double success;
        if (ratio >= 1.5) success = 0.95;
        else if (ratio >= 1.2) success = 0.85;
        else if (ratio >= 0.8) success = 0.65;
        else success = 0.5;

        int land = (int) Math.floor(target.land * landPct);
        return new CombatForecast(target.id, ratio, turns, landPct, success, land, (double) land / turns);
    }
}
