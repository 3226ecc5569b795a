package name.monarchy.sim;

import name.monarchy.EngineConfig;
import name.monarchy.InvalidInputException;
import name.monarchy.RandomSource;
import name.monarchy.ai.ComprehensiveCoordinator;
import name.monarchy.ai.DecisionHistory;
import name.monarchy.battle.BattleHistory;
import name.monarchy.battle.BattleSimulator;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.personality.PersonalityGenerator;
import name.monarchy.war.WarState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One simulation's worth of mutable state. Every cache, counter and history a game touches hangs off
 * this handle, so two worlds never see each other's personalities or attack counts.
 */
public final class World {

    public final EngineConfig config;
    public final long seed;
    public final RandomSource rng;

    public final PersonalityGenerator personalities;
    public final WarState wars;
    public final BattleHistory battles;
    public final DecisionHistory decisions;

    public final BattleSimulator battleSimulator;
    public final ComprehensiveCoordinator coordinator;

    private final Map<String, Kingdom> kingdoms = Collections.synchronizedMap(new LinkedHashMap<>());

    public World(EngineConfig config, long seed) {
        this(config, seed, RandomSource.create(seed));
    }

    public World(EngineConfig config, long seed, RandomSource rng) {
        this.config = InvalidInputException.requirePresent("config", config);
        config.validate();
        this.seed = seed;
        this.rng = InvalidInputException.requirePresent("rng", rng);

        this.personalities = new PersonalityGenerator();
        this.wars = new WarState(config.allowAttacksWhenWarRequired, config.attackHistorySize);
        this.battles = new BattleHistory(config.battleHistorySize);
        this.decisions = new DecisionHistory(config.decisionHistorySize, config.metricsHistorySize);

        this.battleSimulator = new BattleSimulator(wars, battles, rng);
        this.coordinator = new ComprehensiveCoordinator(personalities, wars, decisions, config.aiAutoDeclareWar);
    }

    public Kingdom addKingdom(Kingdom k) {
        InvalidInputException.requirePresent("kingdom", k).validate();
        synchronized (kingdoms) {
            if (kingdoms.containsKey(k.id)) {
                throw new InvalidInputException("duplicate kingdom id " + k.id);
            }
            kingdoms.put(k.id, k);
        }
        return k;
    }

    public Kingdom kingdom(String id) {
        return kingdoms.get(id);
    }

    /** Insertion order. */
    public List<Kingdom> kingdoms() {
        synchronized (kingdoms) {
            return new ArrayList<>(kingdoms.values());
        }
    }

    /** Take a kingdom out of play along with its war pairs and decision log. */
    public Kingdom remove(String id) {
        Kingdom k = kingdoms.remove(id);
        if (k != null) {
            wars.forget(id);
            decisions.forget(id);
        }
        return k;
    }

    public int size() {
        return kingdoms.size();
    }
}
