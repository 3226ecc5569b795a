package name.monarchy.kingdom;

import name.monarchy.InvalidInputException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable kingdom state. One worker owns a kingdom at a time; the engine never shares
 * a Kingdom between threads without handing it off.
 */
public class Kingdom {

    public static final double LAND_NETWORTH = 1000.0;
    public static final double POPULATION_NETWORTH = 100.0;

    public final String id;
    public String name;
    public final Race race;

    // resources
    public double gold;
    public double land;
    public double population;
    public double magicEnergy;
    public int turns;

    // infrastructure
    public int structures;
    public int forts;
    public int temples;
    public int scum;
    public final Set<String> criticalBuildings = new LinkedHashSet<>();

    // military
    public final EnumMap<UnitType, Integer> units = new EnumMap<>(UnitType.class);
    public boolean ambushActive;

    public final Set<String> allies = new LinkedHashSet<>();

    // restoration window, in simulation ticks; -1 = none
    public long restorationUntil = -1;

    public Kingdom(String id, String name, Race race) {
        this.id = InvalidInputException.requirePresent("kingdom.id", id);
        this.name = name == null ? id : name;
        this.race = InvalidInputException.requirePresent("kingdom.race", race);
    }

    public int unitCount(UnitType t) {
        return units.getOrDefault(t, 0);
    }

    public void setUnits(UnitType t, int count) {
        if (count <= 0) units.remove(t);
        else units.put(t, count);
    }

    public void addUnits(UnitType t, int delta) {
        setUnits(t, unitCount(t) + delta);
    }

    public int totalUnits() {
        int sum = 0;
        for (int c : units.values()) sum += c;
        return sum;
    }

    public double networth() {
        return land * LAND_NETWORTH + gold + population * POPULATION_NETWORTH;
    }

    public double templePercentage() {
        return structures <= 0 ? 0.0 : (double) temples / structures;
    }

    public boolean isInRestoration(long now) {
        return restorationUntil >= 0 && now < restorationUntil;
    }

    /** One stack per unit type, id = type id, stats scaled by race. */
    public List<UnitStack> unitStacks() {
        List<UnitStack> out = new ArrayList<>();
        for (Map.Entry<UnitType, Integer> e : units.entrySet()) {
            if (e.getValue() <= 0) continue;
            out.add(UnitStack.forRace(e.getKey().id(), e.getKey(), e.getValue(), race));
        }
        return out;
    }

    /**
     * Rejects snapshots with NaN, infinite or negative fields.
     */
    public Kingdom validate() {
        String p = "kingdom " + id + ".";
        InvalidInputException.requireNonNegative(p + "gold", gold);
        InvalidInputException.requireNonNegative(p + "land", land);
        InvalidInputException.requireNonNegative(p + "population", population);
        InvalidInputException.requireNonNegative(p + "magicEnergy", magicEnergy);
        if (turns < 0) throw new InvalidInputException(p + "turns must be >= 0");
        if (structures < 0 || forts < 0 || temples < 0 || scum < 0) {
            throw new InvalidInputException(p + "infrastructure counts must be >= 0");
        }
        for (Map.Entry<UnitType, Integer> e : units.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new InvalidInputException(p + "units." + e.getKey().id() + " must be >= 0");
            }
        }
        return this;
    }

    public Kingdom copy() {
        Kingdom k = new Kingdom(id, name, race);
        k.gold = gold;
        k.land = land;
        k.population = population;
        k.magicEnergy = magicEnergy;
        k.turns = turns;
        k.structures = structures;
        k.forts = forts;
        k.temples = temples;
        k.scum = scum;
        k.criticalBuildings.addAll(criticalBuildings);
        k.units.putAll(units);
        k.ambushActive = ambushActive;
        k.allies.addAll(allies);
        k.restorationUntil = restorationUntil;
        return k;
    }

    @Override
    public String toString() {
        return "Kingdom{" + id + " " + race + " land=" + (long) land + " gold=" + (long) gold + "}";
    }
}
