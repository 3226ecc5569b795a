package name.monarchy.sim;

import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.kingdom.UnitType;
import name.monarchy.personality.Personality;

import java.util.EnumMap;
import java.util.Map;

/** Frozen copy of a kingdom plus the personality driving it. */
public record KingdomSnapshot(
        String id,
        String name,
        Race race,
        String persona,
        String playstyle,
        double aggression,
        double economy,
        double risk,
        double land,
        double gold,
        double population,
        int turns,
        int structures,
        int forts,
        int temples,
        Map<UnitType, Integer> units,
        double networth,
        boolean eliminated
) {
    public KingdomSnapshot {
        units = Map.copyOf(units);
    }

    public static KingdomSnapshot of(Kingdom k, Personality p, boolean eliminated) {
        return new KingdomSnapshot(k.id, k.name, k.race,
                p.persona().id(), p.playstyle().id(),
                p.traits().aggression(), p.traits().economy(), p.traits().risk(),
                k.land, k.gold, k.population, k.turns,
                k.structures, k.forts, k.temples,
                new EnumMap<>(k.units), k.networth(), eliminated);
    }

    public int totalUnits() {
        int sum = 0;
        for (int c : units.values()) sum += c;
        return sum;
    }
}
