package name.monarchy.personality;

import name.monarchy.InvalidInputException;
import name.monarchy.Monarchy;
import name.monarchy.RandomSource;
import name.monarchy.kingdom.Race;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds AI personalities from race, persona and playstyle. Each kingdom id is generated once;
 * later calls return the cached instance. Persona, playstyle and name picks are seeded from
 * the kingdom id so the same id always yields the same personality.
 */
public final class PersonalityGenerator {

    private static final EnumMap<Race, Traits> BASE = new EnumMap<>(Race.class);
    private static final EnumMap<Race, List<Persona>> PERSONAS = new EnumMap<>(Race.class);
    private static final EnumMap<Race, List<Playstyle>> PLAYSTYLES = new EnumMap<>(Race.class);
    private static final EnumMap<Race, List<String>> NAMES = new EnumMap<>(Race.class);

    static {
        //                                   agg  eco  mag  dip  risk pat  ada  loy
        BASE.put(Race.HUMAN,     new Traits(1.0, 1.3, 0.8, 1.2, 1.0, 1.1, 1.3, 1.1));
        BASE.put(Race.DROBEN,    new Traits(1.6, 0.7, 0.6, 0.8, 1.4, 0.8, 1.0, 1.2));
        BASE.put(Race.SIDHE,     new Traits(0.8, 0.9, 1.7, 1.0, 1.1, 1.4, 1.2, 0.9));
        BASE.put(Race.ELVEN,     new Traits(0.7, 1.0, 1.2, 1.3, 0.8, 1.3, 1.0, 1.4));
        BASE.put(Race.GOBLIN,    new Traits(1.5, 0.8, 0.6, 0.7, 1.5, 0.7, 1.1, 0.8));
        BASE.put(Race.ELEMENTAL, new Traits(1.2, 1.0, 1.3, 0.9, 1.0, 1.2, 1.3, 1.0));
        BASE.put(Race.VAMPIRE,   new Traits(1.1, 0.6, 1.4, 0.8, 1.3, 1.5, 1.1, 0.7));
        BASE.put(Race.FAE,       new Traits(1.0, 1.1, 1.3, 1.1, 1.2, 1.0, 1.4, 1.0));
        BASE.put(Race.CENTAUR,   new Traits(0.8, 0.9, 0.7, 1.0, 0.9, 1.3, 1.2, 1.1));
        BASE.put(Race.DWARVEN,   new Traits(0.9, 1.1, 0.6, 1.0, 0.7, 1.4, 0.9, 1.5));

        PERSONAS.put(Race.HUMAN, List.of(Persona.MERCHANT, Persona.NOBLE, Persona.DIPLOMAT,
                Persona.BUILDER, Persona.OPPORTUNIST, Persona.EXPLORER));
        PERSONAS.put(Race.DROBEN, List.of(Persona.WARLORD, Persona.BERSERKER, Persona.TACTICIAN,
                Persona.ASSASSIN, Persona.SURVIVOR));
        PERSONAS.put(Race.SIDHE, List.of(Persona.ARCHMAGE, Persona.TRICKSTER, Persona.SCHOLAR,
                Persona.CULTIST, Persona.SPY));
        PERSONAS.put(Race.ELVEN, List.of(Persona.GUARDIAN, Persona.DIPLOMAT, Persona.SCHOLAR,
                Persona.BUILDER, Persona.SURVIVOR));
        PERSONAS.put(Race.GOBLIN, List.of(Persona.BERSERKER, Persona.WARLORD, Persona.THIEF,
                Persona.SCOUT, Persona.OPPORTUNIST));
        PERSONAS.put(Race.ELEMENTAL, List.of(Persona.TACTICIAN, Persona.ARCHMAGE, Persona.GUARDIAN,
                Persona.SURVIVOR, Persona.SCHOLAR));
        PERSONAS.put(Race.VAMPIRE, List.of(Persona.CULTIST, Persona.ASSASSIN, Persona.NOBLE,
                Persona.TRICKSTER, Persona.SPY));
        PERSONAS.put(Race.FAE, List.of(Persona.TRICKSTER, Persona.DIPLOMAT, Persona.SCHOLAR,
                Persona.SPY, Persona.OPPORTUNIST));
        PERSONAS.put(Race.CENTAUR, List.of(Persona.SCOUT, Persona.SPY, Persona.EXPLORER,
                Persona.GUARDIAN, Persona.SURVIVOR));
        PERSONAS.put(Race.DWARVEN, List.of(Persona.GUARDIAN, Persona.BUILDER, Persona.TACTICIAN,
                Persona.MERCHANT, Persona.SURVIVOR));

        PLAYSTYLES.put(Race.HUMAN, List.of(Playstyle.BALANCED, Playstyle.DIPLOMATIC,
                Playstyle.OPPORTUNISTIC, Playstyle.CALCULATED, Playstyle.EXPANSIONIST));
        PLAYSTYLES.put(Race.DROBEN, List.of(Playstyle.AGGRESSIVE, Playstyle.RECKLESS,
                Playstyle.CALCULATED, Playstyle.EXPANSIONIST));
        PLAYSTYLES.put(Race.SIDHE, List.of(Playstyle.PATIENT, Playstyle.CALCULATED,
                Playstyle.UNPREDICTABLE, Playstyle.ISOLATIONIST));
        PLAYSTYLES.put(Race.ELVEN, List.of(Playstyle.DEFENSIVE, Playstyle.PATIENT,
                Playstyle.DIPLOMATIC, Playstyle.TURTLE));
        PLAYSTYLES.put(Race.GOBLIN, List.of(Playstyle.AGGRESSIVE, Playstyle.RECKLESS,
                Playstyle.OPPORTUNISTIC, Playstyle.EXPANSIONIST));
        PLAYSTYLES.put(Race.ELEMENTAL, List.of(Playstyle.BALANCED, Playstyle.CALCULATED,
                Playstyle.PATIENT, Playstyle.DEFENSIVE));
        PLAYSTYLES.put(Race.VAMPIRE, List.of(Playstyle.PATIENT, Playstyle.CALCULATED,
                Playstyle.ISOLATIONIST, Playstyle.OPPORTUNISTIC));
        PLAYSTYLES.put(Race.FAE, List.of(Playstyle.UNPREDICTABLE, Playstyle.OPPORTUNISTIC,
                Playstyle.DIPLOMATIC, Playstyle.BALANCED));
        PLAYSTYLES.put(Race.CENTAUR, List.of(Playstyle.PATIENT, Playstyle.CALCULATED,
                Playstyle.DEFENSIVE, Playstyle.ISOLATIONIST));
        PLAYSTYLES.put(Race.DWARVEN, List.of(Playstyle.DEFENSIVE, Playstyle.TURTLE,
                Playstyle.PATIENT, Playstyle.CALCULATED));

        NAMES.put(Race.HUMAN, List.of("Marcus", "Elena", "Thomas", "Isabella", "William", "Catherine"));
        NAMES.put(Race.DROBEN, List.of("Grimjaw", "Bloodfang", "Ironhide", "Skullcrusher", "Darkbane"));
        NAMES.put(Race.SIDHE, List.of("Silvermoon", "Starweaver", "Moonwhisper", "Dawnbringer", "Nightfall"));
        NAMES.put(Race.ELVEN, List.of("Aelindra", "Thalorin", "Silvanus", "Elenion", "Galadwen"));
        NAMES.put(Race.GOBLIN, List.of("Snaggletooth", "Rustblade", "Quickstab", "Grimbolt", "Sneakfang"));
    }

    private final Map<String, Personality> cache = new ConcurrentHashMap<>();

    public PersonalityGenerator() {}

    /**
     * Personality for a kingdom, generated on first reference. The race of the first call wins
     * for the lifetime of this generator.
     */
    public Personality generate(String kingdomId, Race race) {
        InvalidInputException.requirePresent("kingdomId", kingdomId);
        InvalidInputException.requirePresent("race", race);
        return cache.computeIfAbsent(kingdomId, id -> {
            RandomSource rng = RandomSource.create(seedFor(id, race));
            Persona persona = rng.pick(PERSONAS.get(race));
            Playstyle playstyle = rng.pick(PLAYSTYLES.get(race));
            Personality p = build(id, race, persona, playstyle, rng);
            Monarchy.LOGGER.debug("[AI] personality {} -> {} {} {}", id, race, persona.id(), playstyle.id());
            return p;
        });
    }

    /** Explicit combination, bypassing the race pools. Cached like {@link #generate}. */
    public Personality createSpecific(String kingdomId, Race race, Persona persona, Playstyle playstyle) {
        InvalidInputException.requirePresent("kingdomId", kingdomId);
        InvalidInputException.requirePresent("race", race);
        InvalidInputException.requirePresent("persona", persona);
        InvalidInputException.requirePresent("playstyle", playstyle);
        return cache.computeIfAbsent(kingdomId,
                id -> build(id, race, persona, playstyle, RandomSource.create(seedFor(id, race))));
    }

    public Personality cached(String kingdomId) {
        return cache.get(kingdomId);
    }

    public int size() {
        return cache.size();
    }

    // -------------------------
    // Synthesis
    // -------------------------

    public static Traits synthesize(Race race, Persona persona, Playstyle playstyle) {
        return BASE.get(race)
                .times(persona.multipliers)
                .times(playstyle.multipliers)
                .clamped();
    }

    private static Personality build(String id, Race race, Persona persona, Playstyle playstyle, RandomSource rng) {
        Traits traits = synthesize(race, persona, playstyle);
        String name = rng.pick(NAMES.getOrDefault(race, NAMES.get(Race.HUMAN)));
        String title = title(persona, rng);
        String description = "A " + playstyle.id() + " " + race.displayName() + " " + persona.id()
                + " known for " + persona.id() + " tactics and " + playstyle.id() + " approach";
        return new Personality(id, name, title, description, race, persona, playstyle, traits,
                behavior(race, persona, playstyle, traits));
    }

    private static String title(Persona persona, RandomSource rng) {
        List<String> pool = switch (persona) {
            case WARLORD -> List.of("the Conqueror", "the Destroyer", "the Warlord");
            case MERCHANT -> List.of("the Wealthy", "the Trader", "the Merchant Prince");
            case ARCHMAGE -> List.of("the Wise", "the Arcane", "the Spellweaver");
            default -> List.of("the Bold");
        };
        return rng.pick(pool);
    }

    static Personality.Behavior behavior(Race race, Persona persona, Playstyle playstyle, Traits t) {
        List<String> preferred = switch (persona) {
            case BERSERKER -> List.of("weak", "isolated");
            case OPPORTUNIST -> List.of("distracted", "weakened");
            case TACTICIAN -> List.of("strategic", "valuable");
            default -> List.of("suitable");
        };

        List<String> avoided;
        if (playstyle == Playstyle.DEFENSIVE) avoided = List.of("strong", "allied");
        else if (persona == Persona.DIPLOMAT) avoided = List.of("allied", "friendly");
        else avoided = List.of("overwhelming");

        String alliance;
        if (t.diplomacy() > 1.3 && t.loyalty() > 1.2) alliance = "loyal_ally";
        else if (t.diplomacy() > 1.2) alliance = "active_diplomat";
        else if (t.loyalty() < 0.8) alliance = "opportunistic_betrayer";
        else alliance = "neutral";

        String economic;
        if (t.economy() > 1.3 && t.risk() < 0.9) economic = "conservative_growth";
        else if (t.economy() > 1.2) economic = "economic_focus";
        else if (t.risk() > 1.3) economic = "high_risk_high_reward";
        else economic = "balanced_economy";

        String military;
        if (t.aggression() > 1.4 && t.patience() < 0.8) military = "blitz_warfare";
        else if (t.aggression() > 1.2) military = "aggressive_expansion";
        else if (t.patience() > 1.3) military = "calculated_strikes";
        else military = "defensive_military";

        String endgame = switch (persona) {
            case WARLORD -> "military_domination";
            case MERCHANT -> "economic_victory";
            case ARCHMAGE -> "magical_supremacy";
            default -> "balanced_victory";
        };

        List<String> quirks = new ArrayList<>();
        if (race == Race.DROBEN && persona == Persona.BERSERKER) {
            quirks.add("attacks_when_wounded");
            quirks.add("ignores_weak_targets");
        }
        if (persona == Persona.TRICKSTER) {
            quirks.add("unpredictable_alliances");
            quirks.add("surprise_attacks");
        }
        if (playstyle == Playstyle.TURTLE && persona == Persona.GUARDIAN) {
            quirks.add("extreme_defensive");
            quirks.add("alliance_protector");
        }

        return new Personality.Behavior(preferred, avoided, alliance, economic, military, endgame, quirks);
    }

    private static long seedFor(String kingdomId, Race race) {
        long h = kingdomId.hashCode();
        return (h * 0x9E3779B97F4A7C15L) ^ race.ordinal();
    }
}
