package name.monarchy.mechanics;

import name.monarchy.kingdom.Race;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

public final class SorceryMechanics {
    private SorceryMechanics() {}

    // -------------------------
    // Temple thresholds (fraction of structures)
    // -------------------------
    public static final double TIER_1_THRESHOLD = 0.02;
    public static final double TIER_2_THRESHOLD = 0.04;
    public static final double TIER_3_THRESHOLD = 0.08;
    public static final double TIER_4_THRESHOLD = 0.12;
    public static final double OPTIMAL_DEFENSE = 0.16;
    public static final double MAX_TEMPLE_RECOMMENDATION = 0.20;

    public static final double ATTACKER_ADVANTAGE = 1.15;

    private static final double ELAN_RATE_MAGIC_RACE = 0.005;   // Sidhe, Vampire
    private static final double ELAN_RATE_STANDARD = 0.003;
    private static final double TRAIN_RATE_PER_STRUCTURE = 0.15;
    private static final int KILL_PROGRESSION_LIMIT = 100;

    public record SpellEffect(
            int structuresDestroyed,
            int fortsDestroyed,
            int populationKilled,
            double backlashChance,
            int elanCost
    ) {
        public static final SpellEffect NONE = new SpellEffect(0, 0, 0, 0.0, 0);
    }

    /** Fractions of the target destroyed per cast, plus the chance the spell rebounds. */
    private record Effectiveness(double structures, double forts, double kill, double backlash) {}

    private static final EnumMap<Race, EnumMap<Spell, Effectiveness>> EFFECTIVENESS = new EnumMap<>(Race.class);

    static {
        EnumMap<Spell, Effectiveness> sidhe = new EnumMap<>(Spell.class);
        sidhe.put(Spell.HURRICANE,       new Effectiveness(0.0563, 0.075, 0, 0.09));
        sidhe.put(Spell.LIGHTNING_LANCE, new Effectiveness(0,      0.10,  0, 0.07));
        sidhe.put(Spell.BANSHEE_DELUGE,  new Effectiveness(0.0625, 0,     0, 0.07));
        sidhe.put(Spell.FOUL_LIGHT,      new Effectiveness(0,      0,  0.08, 0.07));
        EFFECTIVENESS.put(Race.SIDHE, sidhe);

        // second-tier casters share damage, backlash differs
        EFFECTIVENESS.put(Race.ELEMENTAL, secondTier(0.13, 0.11, 0.11));
        EFFECTIVENESS.put(Race.VAMPIRE,   secondTier(0.13, 0.11, 0.11));
        EFFECTIVENESS.put(Race.ELVEN,     secondTier(0.10, 0.08, 0.08));
        EFFECTIVENESS.put(Race.FAE,       secondTier(0.10, 0.08, 0.08));

        EnumMap<Spell, Effectiveness> human = new EnumMap<>(Spell.class);
        human.put(Spell.HURRICANE,       new Effectiveness(0.0313, 0.05,  0, 0.11));
        human.put(Spell.LIGHTNING_LANCE, new Effectiveness(0,      0.075, 0, 0.09));
        human.put(Spell.BANSHEE_DELUGE,  new Effectiveness(0.0375, 0,     0, 0.09));
        EFFECTIVENESS.put(Race.HUMAN, human);
    }

    private static EnumMap<Spell, Effectiveness> secondTier(double hurricaneBacklash,
                                                           double lanceBacklash,
                                                           double delugeBacklash) {
        EnumMap<Spell, Effectiveness> m = new EnumMap<>(Spell.class);
        m.put(Spell.HURRICANE,       new Effectiveness(0.0438, 0.0625, 0, hurricaneBacklash));
        m.put(Spell.LIGHTNING_LANCE, new Effectiveness(0,      0.0875, 0, lanceBacklash));
        m.put(Spell.BANSHEE_DELUGE,  new Effectiveness(0.05,   0,      0, delugeBacklash));
        return m;
    }

    // =========================
    // Casting
    // =========================

    public static double tierThreshold(int tier) {
        return switch (tier) {
            case 1 -> TIER_1_THRESHOLD;
            case 2 -> TIER_2_THRESHOLD;
            case 3 -> TIER_3_THRESHOLD;
            case 4 -> TIER_4_THRESHOLD;
            default -> Double.POSITIVE_INFINITY;
        };
    }

    /**
     * Temple percentages are fractions (0.05 = 5%). The caster must meet the tier threshold
     * and, with the attacker advantage, out-weigh the target's temples.
     */
    public static boolean spellSuccess(double casterTemplePct, double targetTemplePct, int tier) {
        if (Double.isNaN(casterTemplePct) || Double.isNaN(targetTemplePct)) return false;
        if (casterTemplePct < tierThreshold(tier)) return false;
        return casterTemplePct * ATTACKER_ADVANTAGE > targetTemplePct;
    }

    /** Unknown race or spell (null) or a race without that spell yields {@link SpellEffect#NONE}. */
    public static SpellEffect spellDamage(Spell spell, Race race,
                                          double targetStructures, double targetForts, double targetPopulation) {
        if (spell == null || race == null) return SpellEffect.NONE;
        EnumMap<Spell, Effectiveness> table = EFFECTIVENESS.get(race);
        if (table == null) return SpellEffect.NONE;
        Effectiveness e = table.get(spell);
        if (e == null) return SpellEffect.NONE;

        int structures = (int) Math.floor(Math.max(0, targetStructures) * e.structures());
        int forts = (int) Math.floor(Math.max(0, targetForts) * e.forts());
        int killed = spell.targetsPopulation
                ? (int) Math.floor(Math.max(0, targetPopulation) * e.kill())
                : 0;
        return new SpellEffect(structures, forts, killed, e.backlash(), spell.elanCost);
    }

    public static SpellEffect spellDamage(String spellName, String raceName,
                                          double targetStructures, double targetForts, double targetPopulation) {
        return spellDamage(Spell.byName(spellName), Race.byName(raceName),
                targetStructures, targetForts, targetPopulation);
    }

    public static boolean canCast(Race race, Spell spell) {
        if (race == null || spell == null) return false;
        EnumMap<Spell, Effectiveness> table = EFFECTIVENESS.get(race);
        return table != null && table.containsKey(spell);
    }

    // =========================
    // Economy and planning
    // =========================

    public static int elanGeneration(Race race, int temples) {
        double rate = (race == Race.SIDHE || race == Race.VAMPIRE) ? ELAN_RATE_MAGIC_RACE : ELAN_RATE_STANDARD;
        return (int) Math.ceil(Math.max(0, temples) * rate);
    }

    public record ParkingLotStep(int turn, int structures, int forts, int trainRate) {}

    /** Structures and forts left after each cast in a sequence. */
    public static List<ParkingLotStep> parkingLotProgression(int initialStructures, int initialForts,
                                                             Race casterRace, List<Spell> sequence) {
        List<ParkingLotStep> out = new ArrayList<>();
        int structures = Math.max(0, initialStructures);
        int forts = Math.max(0, initialForts);
        int turn = 0;
        for (Spell s : sequence) {
            SpellEffect e = spellDamage(s, casterRace, structures, forts, 0);
            structures = Math.max(0, structures - e.structuresDestroyed());
            forts = Math.max(0, forts - e.fortsDestroyed());
            out.add(new ParkingLotStep(++turn, structures, forts,
                    (int) Math.floor(structures * TRAIN_RATE_PER_STRUCTURE)));
        }
        return out;
    }

    public record KillStep(int cast, int peasantsRemaining, double percentageKilled) {}

    /**
     * Repeated Foul Light casts until the peasants are gone or 100 casts have been made.
     * A positive kill fraction always kills at least one peasant.
     */
    public static List<KillStep> sorceryKillProgression(int initialPeasants, Race casterRace) {
        List<KillStep> out = new ArrayList<>();
        int peasants = Math.max(0, initialPeasants);
        if (peasants == 0) return out;

        boolean lethal = canCast(casterRace, Spell.FOUL_LIGHT);
        for (int cast = 1; cast <= KILL_PROGRESSION_LIMIT && peasants > 0; cast++) {
            int killed = spellDamage(Spell.FOUL_LIGHT, casterRace, 0, 0, peasants).populationKilled();
            if (lethal) killed = Math.max(1, killed);
            peasants -= Math.min(killed, peasants);
            double pct = (initialPeasants - peasants) * 100.0 / initialPeasants;
            out.add(new KillStep(cast, peasants, pct));
        }
        return out;
    }

    public enum TempleRole { OFFENSIVE_SORCERER, DEFENSIVE_TARGET, BALANCED }

    public static double optimalTemplePercentage(TempleRole role, ThreatLevel threat) {
        double base = switch (role) {
            case OFFENSIVE_SORCERER -> TIER_3_THRESHOLD;
            case DEFENSIVE_TARGET -> OPTIMAL_DEFENSE;
            case BALANCED -> TIER_2_THRESHOLD;
        };
        double mult = switch (threat) {
            case LOW -> 1.0;
            case MEDIUM -> 1.5;
            case HIGH -> 2.0;
        };
        return Math.min(MAX_TEMPLE_RECOMMENDATION, base * mult);
    }
}
