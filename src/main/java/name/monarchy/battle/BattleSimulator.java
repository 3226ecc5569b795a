package name.monarchy.battle;

import name.monarchy.InvalidInputException;
import name.monarchy.Monarchy;
import name.monarchy.RandomSource;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.UnitStack;
import name.monarchy.kingdom.UnitType;
import name.monarchy.mechanics.AttackType;
import name.monarchy.mechanics.CombatMechanics;
import name.monarchy.mechanics.CombatResult;
import name.monarchy.mechanics.CombatSide;
import name.monarchy.mechanics.Formation;
import name.monarchy.mechanics.RestorationMechanics;
import name.monarchy.mechanics.Terrain;
import name.monarchy.war.WarState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves attacks between live kingdoms and applies the results.
 *
 * <p>Validation happens up front; a refused attack returns {@link BattleReport#rejected} and leaves both
 * kingdoms, the war state and the history untouched. Restoration windows are measured in ticks.
 */
public final class BattleSimulator {

    private final WarState wars;
    private final BattleHistory history;
    private final RandomSource rng;

    public BattleSimulator(WarState wars, BattleHistory history, RandomSource rng) {
        this.wars = InvalidInputException.requirePresent("wars", wars);
        this.history = InvalidInputException.requirePresent("history", history);
        this.rng = InvalidInputException.requirePresent("rng", rng);
    }

    public BattleHistory history() {
        return history;
    }

    // =========================
    // Boundary
    // =========================

    /**
     * Resolve a battle without touching any state. Unknown formation or terrain ids fall back to
     * standard and plains; null ids mean "not specified".
     */
    public CombatResult resolveCombat(List<UnitStack> attackerUnits, Kingdom defenderSnapshot,
                                      String formationId, String terrainId) {
        InvalidInputException.requirePresent("attackerUnits", attackerUnits);
        InvalidInputException.requirePresent("defender", defenderSnapshot).validate();
        return CombatMechanics.resolveCombat(
                CombatSide.attacker(attackerUnits),
                defenderSide(defenderSnapshot),
                parseFormation(formationId),
                parseTerrain(terrainId),
                AttackType.STANDARD,
                rng);
    }

    public static Formation parseFormation(String id) {
        if (id == null || id.isBlank()) return Formation.STANDARD;
        Formation f = Formation.byId(id);
        if (f == null) {
            Monarchy.LOGGER.warn("[Battle] unknown formation '{}', using {}", id, Formation.STANDARD.id);
            return Formation.STANDARD;
        }
        return f;
    }

    public static Terrain parseTerrain(String id) {
        if (id == null || id.isBlank()) return Terrain.PLAINS;
        Terrain t = Terrain.byId(id);
        if (t == null) {
            Monarchy.LOGGER.warn("[Battle] unknown terrain '{}', using {}", id, Terrain.PLAINS.id());
            return Terrain.PLAINS;
        }
        return t;
    }

    // =========================
    // Attacks
    // =========================

    /** Attack with the attacker's whole army. */
    public BattleReport attack(Kingdom attacker, Kingdom defender, AttackType type,
                               Formation formation, Terrain terrain, long tick) {
        InvalidInputException.requirePresent("attacker", attacker);
        return attack(attacker, defender, attacker.unitStacks(), type, formation, terrain, tick);
    }

    /**
     * Attack with {@code committed}, which must not exceed what the attacker owns per unit type.
     */
    public BattleReport attack(Kingdom attacker, Kingdom defender, List<UnitStack> committed,
                               AttackType type, Formation formation, Terrain terrain, long tick) {
        InvalidInputException.requirePresent("attacker", attacker).validate();
        InvalidInputException.requirePresent("defender", defender).validate();
        InvalidInputException.requirePresent("committed", committed);
        if (type == null) type = AttackType.STANDARD;
        if (formation == null) formation = Formation.STANDARD;
        if (terrain == null) terrain = Terrain.PLAINS;

        if (attacker.isInRestoration(tick)) {
            return reject(tick, attacker, defender, type, "attacker is under restoration protection");
        }
        if (defender.isInRestoration(tick)) {
            return reject(tick, attacker, defender, type, "defender is under restoration protection");
        }

        WarState.AttackPermission perm = wars.canAttack(attacker.id, defender.id);
        if (!perm.allowed()) {
            return reject(tick, attacker, defender, type, perm.reason());
        }

        int cost = CombatMechanics.turnCost(attacker.networth(), defender.networth());
        if (attacker.turns < cost) {
            return reject(tick, attacker, defender, type,
                    "needs " + cost + " turns, has " + attacker.turns);
        }

        // stats always come from the attacker's race, never from the caller
        List<UnitStack> army = new ArrayList<>(committed.size());
        Map<String, UnitType> committedTypes = new HashMap<>();
        Map<UnitType, Integer> committedCounts = new HashMap<>();
        for (UnitStack u : committed) {
            InvalidInputException.requirePresent("committed unit", u);
            army.add(UnitStack.forRace(u.id(), u.type(), u.count(), attacker.race));
            committedTypes.put(u.id(), u.type());
            committedCounts.merge(u.type(), u.count(), Integer::sum);
        }
        for (Map.Entry<UnitType, Integer> e : committedCounts.entrySet()) {
            if (e.getValue() > attacker.unitCount(e.getKey())) {
                throw new InvalidInputException("committed " + e.getValue() + " " + e.getKey().id()
                        + " but " + attacker.id + " owns " + attacker.unitCount(e.getKey()));
            }
        }

        CombatMechanics.AttackValidation v = CombatMechanics.validateAttackType(type, army);
        if (!v.valid()) {
            return reject(tick, attacker, defender, type, v.reason());
        }

        // counted before either kingdom changes; the pair may have reached WAR_REQUIRED since canAttack
        WarState.PairState pair;
        try {
            pair = wars.recordAttack(attacker.id, defender.id);
        } catch (IllegalStateException e) {
            return reject(tick, attacker, defender, type, "war declaration required");
        }

        RestorationMechanics.DamageSnapshot before = snapshot(defender);
        double landBefore = defender.land;

        CombatResult result = CombatMechanics.resolveCombat(
                CombatSide.attacker(army), defenderSide(defender), formation, terrain, type, rng);

        // ---- apply ----
        for (Map.Entry<String, Integer> e : result.attackerCasualties().entrySet()) {
            attacker.addUnits(committedTypes.get(e.getKey()), -e.getValue());
        }
        for (Map.Entry<String, Integer> e : result.defenderCasualties().entrySet()) {
            defender.addUnits(UnitType.byId(e.getKey()), -e.getValue());
        }

        int land = result.landGained();
        long gold = (long) Math.min(result.goldLooted(), Math.floor(defender.gold));
        defender.land = Math.max(0.0, defender.land - land);
        attacker.land += land;
        defender.gold = Math.max(0.0, defender.gold - gold);
        attacker.gold += gold;
        defender.structures = Math.max(0, defender.structures - result.structuresDestroyed());
        if (landBefore > 0 && land > 0) {
            defender.population = Math.max(0.0, defender.population * (1.0 - land / landBefore));
        }
        defender.ambushActive = false;
        attacker.turns -= cost;

        wars.logAttack(new WarState.AttackRecord(attacker.id, defender.id, tick, result.outcome().id, land));

        RestorationMechanics.Assessment restoration =
                RestorationMechanics.restorationQualifies(before, snapshot(defender));
        if (restoration.qualifies()) {
            defender.restorationUntil = tick + restoration.protectionHours();
            Monarchy.LOGGER.info("[Battle] {} enters {} restoration until tick {}",
                    defender.id, restoration.type(), defender.restorationUntil);
        }

        BattleReport report = new BattleReport(true, "", tick, attacker.id, defender.id, type,
                formation, terrain, cost, result, pair.status(), restoration);
        history.add(report);

        Monarchy.LOGGER.debug("[Battle] {} -> {} type={} outcome={} ratio={} land={} gold={} war={}",
                attacker.id, defender.id, type, result.outcome().id,
                String.format(Locale.US, "%.2f", result.offenseRatio()), land, gold, pair.status());
        return report;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static CombatSide defenderSide(Kingdom k) {
        return new CombatSide(k.unitStacks(), k.land, k.gold, k.ambushActive);
    }

    private static RestorationMechanics.DamageSnapshot snapshot(Kingdom k) {
        return new RestorationMechanics.DamageSnapshot(k.structures, k.population, k.criticalBuildings);
    }

    private static BattleReport reject(long tick, Kingdom attacker, Kingdom defender, AttackType type, String why) {
        Monarchy.LOGGER.debug("[Battle] refused {} -> {}: {}", attacker.id, defender.id, why);
        return BattleReport.rejected(tick, attacker.id, defender.id, type, why);
    }
}
