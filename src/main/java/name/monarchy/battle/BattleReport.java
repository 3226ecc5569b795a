package name.monarchy.battle;

import name.monarchy.mechanics.AttackType;
import name.monarchy.mechanics.CombatResult;
import name.monarchy.mechanics.Formation;
import name.monarchy.mechanics.RestorationMechanics;
import name.monarchy.mechanics.Terrain;
import name.monarchy.war.WarStatus;

/**
 * What happened when one kingdom attacked another. A rejected report carries only the reason;
 * nothing was resolved and nothing was mutated.
 */
public record BattleReport(
        boolean accepted,
        String reason,
        long tick,
        String attackerId,
        String defenderId,
        AttackType attackType,
        Formation formation,
        Terrain terrain,
        int turnsSpent,
        CombatResult result,
        WarStatus warStatus,                          // pair status after the attack
        RestorationMechanics.Assessment restoration   // defender, after the attack
) {

    public static BattleReport rejected(long tick, String attackerId, String defenderId,
                                        AttackType attackType, String reason) {
        return new BattleReport(false, reason, tick, attackerId, defenderId, attackType,
                null, null, 0, null, null, null);
    }

    public boolean victory() {
        return accepted && result.outcome().isVictory();
    }
}
