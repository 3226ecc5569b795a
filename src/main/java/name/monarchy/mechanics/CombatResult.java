package name.monarchy.mechanics;

import java.util.List;
import java.util.Map;

public record CombatResult(
        CombatOutcome outcome,
        double offenseRatio,
        double attackerPower,       // after ambush, terrain and formation
        double defenderPower,       // after terrain
        Map<String, Integer> attackerCasualties,  // unit id -> losses
        Map<String, Integer> defenderCasualties,
        int landGained,
        long goldLooted,
        int structuresDestroyed,
        List<String> formationTags
) {
    public CombatResult {
        attackerCasualties = Map.copyOf(attackerCasualties);
        defenderCasualties = Map.copyOf(defenderCasualties);
        formationTags = List.copyOf(formationTags);
    }

    public int totalAttackerCasualties() {
        int sum = 0;
        for (int c : attackerCasualties.values()) sum += c;
        return sum;
    }

    public int totalDefenderCasualties() {
        int sum = 0;
        for (int c : defenderCasualties.values()) sum += c;
        return sum;
    }
}
