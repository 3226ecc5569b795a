package name.monarchy.kingdom;

import name.monarchy.InvalidInputException;

/**
 * One unit instance in an army: a stack of identical soldiers with its own stats.
 * Casualties are applied per stack id, not per type.
 */
public record UnitStack(String id, UnitType type, int count, double attack, double defense) {

    public UnitStack {
        InvalidInputException.requirePresent("unit.id", id);
        InvalidInputException.requirePresent("unit.type", type);
        if (count < 0) throw new InvalidInputException("unit " + id + " count must be >= 0, got " + count);
        InvalidInputException.requireNonNegative("unit " + id + " attack", attack);
        InvalidInputException.requireNonNegative("unit " + id + " defense", defense);
    }

    public static UnitStack of(String id, UnitType type, int count) {
        return new UnitStack(id, type, count, type.attack, type.defense);
    }

    /** Stats scaled by the owning race's war offense and defense. */
    public static UnitStack forRace(String id, UnitType type, int count, Race race) {
        double off = race == null ? 1.0 : race.offenseScale();
        double def = race == null ? 1.0 : race.defenseScale();
        return new UnitStack(id, type, count, type.attack * off, type.defense * def);
    }

    public double offensePower() {
        return count * attack;
    }

    public double defensePower() {
        return count * defense;
    }

    public UnitStack withCount(int newCount) {
        return new UnitStack(id, type, Math.max(0, newCount), attack, defense);
    }
}
