package name.monarchy.mechanics;

import name.monarchy.InvalidInputException;
import name.monarchy.RandomSource;
import name.monarchy.kingdom.Race;
import name.monarchy.kingdom.UnitStack;
import name.monarchy.kingdom.UnitType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combat formulas. Stateless; every call is independent and safe from any thread.
 */
public final class CombatMechanics {
    private CombatMechanics() {}

    // -------------------------
    // Policy knobs
    // -------------------------

    public static final int BASE_TURN_COST = 4;
    public static final int WAR_DECLARATION_THRESHOLD = 3;

    public static final double WITH_EASE_RATIO = 2.0;
    public static final double GOOD_FIGHT_RATIO = 1.2;

    /** Returned instead of a division by zero when the defender has no power at all. */
    public static final double OVERWHELMING_RATIO = 999.0;

    public static final double AMBUSH_REDUCTION = 0.95;       // attacker keeps 5%
    public static final double GOLD_PER_ACRE = 1000.0;
    public static final double STRUCTURES_PER_ACRE = 0.1;
    public static final double CONTROLLED_STRIKE_LAND = 0.01;  // 1% at full intensity
    public static final double WITH_EASE_ARMY_REDUCTION = 0.25;

    // tougher units lose fewer men, but never less than half the base rate
    private static final double CASUALTY_DEFENSE_WEIGHT = 0.05;
    private static final double CASUALTY_FLOOR = 0.5;

    private static final EnumMap<Race, Double> SUMMON_RATE = new EnumMap<>(Race.class);
    private static final EnumMap<Race, Integer> FORT_DEFENSE = new EnumMap<>(Race.class);

    static {
        SUMMON_RATE.put(Race.DROBEN, 0.0304);
        SUMMON_RATE.put(Race.ELEMENTAL, 0.0284);
        SUMMON_RATE.put(Race.GOBLIN, 0.0275);
        SUMMON_RATE.put(Race.DWARVEN, 0.0275);
        SUMMON_RATE.put(Race.HUMAN, 0.025);

        FORT_DEFENSE.put(Race.GOBLIN, 285);
        FORT_DEFENSE.put(Race.HUMAN, 250);
        FORT_DEFENSE.put(Race.DWARVEN, 300);
    }

    // =========================
    // Turn cost / war threshold
    // =========================

    /**
     * Turns needed to attack. Both a much weaker and a much stronger target cost extra:
     * ratio = defender / attacker below 0.5 costs 6, above 2.0 costs 8, otherwise 4.
     */
    public static int turnCost(double attackerNetworth, double defenderNetworth) {
        InvalidInputException.requireFinite("attackerNetworth", attackerNetworth);
        InvalidInputException.requireFinite("defenderNetworth", defenderNetworth);

        double ratio = defenderNetworth / Math.max(1.0, attackerNetworth);
        if (ratio < 0.5) return (int) Math.floor(BASE_TURN_COST * 1.5);
        if (ratio > 2.0) return BASE_TURN_COST * 2;
        return BASE_TURN_COST;
    }

    public static boolean requiresWarDeclaration(int attackCount) {
        return attackCount >= WAR_DECLARATION_THRESHOLD;
    }

    // =========================
    // Resolution
    // =========================

    public static CombatOutcome outcomeFor(double offenseRatio) {
        if (offenseRatio >= WITH_EASE_RATIO) return CombatOutcome.WITH_EASE;
        if (offenseRatio >= GOOD_FIGHT_RATIO) return CombatOutcome.GOOD_FIGHT;
        return CombatOutcome.FAILED;
    }

    public static CombatResult resolveCombat(CombatSide attacker, CombatSide defender, RandomSource rng) {
        return resolveCombat(attacker, defender, null, null, AttackType.STANDARD, rng);
    }

    public static CombatResult resolveCombat(CombatSide attacker, CombatSide defender,
                                             Formation formation, Terrain terrain, RandomSource rng) {
        return resolveCombat(attacker, defender, formation, terrain, AttackType.STANDARD, rng);
    }

    /**
     * Resolve one attack. Formation and terrain may be null (standard / plains).
     * Nothing is mutated; the caller applies the result.
     */
    public static CombatResult resolveCombat(CombatSide attacker, CombatSide defender,
                                             Formation formation, Terrain terrain,
                                             AttackType attackType, RandomSource rng) {
        InvalidInputException.requirePresent("attacker", attacker);
        InvalidInputException.requirePresent("defender", defender);
        InvalidInputException.requirePresent("rng", rng);
        if (formation == null) formation = Formation.STANDARD;
        if (terrain == null) terrain = Terrain.PLAINS;
        if (attackType == null) attackType = AttackType.STANDARD;

        Formation.CompositionBonus comp = Formation.compositionBonus(attacker.units());

        double attackPower = attacker.offensePower();
        if (defender.ambushActive()) {
            attackPower *= (1.0 - AMBUSH_REDUCTION);
        }
        attackPower *= terrainOffenseRatio(attacker.units(), terrain);
        attackPower *= Math.max(0.0, 1.0 + formation.offense + comp.attackPct() / 100.0);

        double defensePower = defender.defensePower() * Math.max(0.0, 1.0 + terrain.defense);

        double ratio = defensePower <= 0 ? OVERWHELMING_RATIO : attackPower / defensePower;
        CombatOutcome outcome = outcomeFor(ratio);

        double defenseBonus = Math.max(0.0, formation.defense + comp.defensePct() / 100.0);
        double attackerRate = outcome.attackerCasualtyRate * Math.max(0.0, 1.0 - defenseBonus);

        Map<String, Integer> attackerLosses = casualties(attacker.units(), attackerRate);
        Map<String, Integer> defenderLosses = casualties(defender.units(), outcome.defenderCasualtyRate);

        int land = 0;
        if (outcome.isVictory()) {
            if (attackType == AttackType.CONTROLLED_STRIKE) {
                land = controlledStrikeLand(defender.land(), 100);
            } else {
                double pct = rng.range(outcome.landMin, outcome.landMax);
                land = (int) Math.floor(defender.land() * pct * attackType.landShare);
            }
            land = (int) Math.min(land, Math.floor(defender.land()));
            land = Math.max(0, land);
        }

        long gold = (long) Math.min(land * GOLD_PER_ACRE, Math.floor(defender.gold()));
        int structures = (int) Math.floor(land * STRUCTURES_PER_ACRE);

        return new CombatResult(outcome, ratio, attackPower, defensePower,
                attackerLosses, defenderLosses, land, gold, structures, comp.tags());
    }

    /**
     * Per-stack losses: floor(count x rate x max(0.5, 1 - defense x 0.05)), clamped to [0, count].
     */
    public static Map<String, Integer> casualties(List<UnitStack> units, double rate) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (UnitStack u : units) {
            double toughness = Math.max(CASUALTY_FLOOR, 1.0 - u.defense() * CASUALTY_DEFENSE_WEIGHT);
            int lost = (int) Math.floor(u.count() * rate * toughness);
            lost = Math.max(0, Math.min(u.count(), lost));
            out.merge(u.id(), lost, Integer::sum);
        }
        return out;
    }

    /**
     * Weighted ratio of terrain-adjusted to raw offense. 1.0 on plains or for an empty army.
     */
    public static double terrainOffenseRatio(List<UnitStack> units, Terrain terrain) {
        if (terrain == null) return 1.0;
        double raw = 0, adjusted = 0;
        for (UnitStack u : units) {
            double p = u.offensePower();
            raw += p;
            adjusted += p * Math.max(0.0, 1.0 + terrain.offense + terrain.classModifier(u.type().unitClass));
        }
        return raw <= 0 ? 1.0 : adjusted / raw;
    }

    // =========================
    // Attack variants
    // =========================

    /** csPercentage 1..100 maps linearly onto 0.01%..1% of the target's land. */
    public static int controlledStrikeLand(double targetLand, double csPercentage) {
        double pct = Math.max(0.0, Math.min(100.0, csPercentage)) / 100.0;
        return (int) Math.floor(Math.max(0.0, targetLand) * CONTROLLED_STRIKE_LAND * pct);
    }

    public record AttackValidation(boolean valid, String reason) {
        public static AttackValidation ok() { return new AttackValidation(true, ""); }
        public static AttackValidation reject(String reason) { return new AttackValidation(false, reason); }
    }

    public static AttackValidation validateAttackType(AttackType type, List<UnitStack> attackerUnits) {
        if (type == null) return AttackValidation.reject("missing attack type");
        if (attackerUnits == null || attackerUnits.isEmpty()) return AttackValidation.reject("no units");

        if (type == AttackType.MOB_ASSAULT) {
            boolean hasPeasants = false;
            for (UnitStack u : attackerUnits) {
                if (u.type() == UnitType.PEASANT && u.count() > 0) { hasPeasants = true; break; }
            }
            if (!hasPeasants) return AttackValidation.reject("mob assault requires peasants");
        }
        return AttackValidation.ok();
    }

    /** Army left standing after a with-ease win leaves troops garrisoning the new land. */
    public static List<UnitStack> reduceAfterWithEase(List<UnitStack> units) {
        List<UnitStack> out = new ArrayList<>(units.size());
        for (UnitStack u : units) {
            out.add(u.withCount((int) Math.floor(u.count() * (1.0 - WITH_EASE_ARMY_REDUCTION))));
        }
        return out;
    }

    public static double summonRate(Race race) {
        if (race == null) return 0.0;
        return SUMMON_RATE.getOrDefault(race, 0.025);
    }

    public static int fortDefense(Race race) {
        if (race == null) return 250;
        return FORT_DEFENSE.getOrDefault(race, 250);
    }

    public static long goldLooted(int landGained) {
        return (long) Math.floor(Math.max(0, landGained) * GOLD_PER_ACRE);
    }
}
