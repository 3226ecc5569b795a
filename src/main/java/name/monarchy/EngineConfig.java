package name.monarchy;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables for a simulation run. Loaded from {@code monarchy-engine.json} on the classpath,
 * or from a file passed on the command line. Missing keys keep the defaults below.
 */
public class EngineConfig {

    public static final String RESOURCE = "/monarchy-engine.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    // -------------------------
    // Randomness
    // -------------------------
    public long seed = 42L;

    // -------------------------
    // History sizes
    // -------------------------
    public int battleHistorySize = 50;
    public int decisionHistorySize = 50;
    public int metricsHistorySize = 100;
    public int attackHistorySize = 10;

    // -------------------------
    // War policy
    // -------------------------

    /** May an attacker keep attacking a pair that is WAR_REQUIRED but not yet declared? */
    public boolean allowAttacksWhenWarRequired = false;

    /** AI coordinators declare war themselves when they pick a WAR_REQUIRED target. */
    public boolean aiAutoDeclareWar = true;

    /** Turns after a declaration before the simulator signs peace; 0 keeps wars open until elimination. */
    public int warDurationTurns = 30;

    // -------------------------
    // Game simulation
    // -------------------------
    public int maxTurns = 200;
    public int turnsPerTick = 2;
    public int maxStoredTurns = 100;
    public int kingdomsPerGame = 4;
    public double eliminationLand = 50;

    public double startingGold = 50_000;
    public double startingLand = 1_000;
    public double startingPopulation = 500;
    public int startingTurns = 40;
    public int startingStructures = 800;
    public int startingTemples = 40;
    public int startingForts = 20;
    public int startingScum = 150;
    public int startingPeasants = 400;
    public int startingMilitia = 300;
    public int startingKnights = 120;
    public int startingCavalry = 60;

    // -------------------------
    // Batch
    // -------------------------
    public int threads = 1;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /** Classpath config, or defaults when the resource is absent. */
    public static EngineConfig load() {
        try (InputStream in = EngineConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                Monarchy.LOGGER.info("[Config] {} not found on classpath, using defaults", RESOURCE);
                return defaults();
            }
            return read(new InputStreamReader(in, StandardCharsets.UTF_8), RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    public static EngineConfig load(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r, file.toString());
        }
    }

    public static EngineConfig parse(String json) {
        return read(new StringReader(json), "<inline>");
    }

    private static EngineConfig read(Reader reader, String source) {
        EngineConfig cfg;
        try {
            cfg = GSON.fromJson(reader, EngineConfig.class);
        } catch (JsonParseException e) {
            throw new InvalidInputException("Malformed engine config " + source + ": " + e.getMessage());
        }
        if (cfg == null) cfg = defaults();
        cfg.validate();
        return cfg;
    }

    public void validate() {
        if (battleHistorySize < 1) throw new InvalidInputException("battleHistorySize must be >= 1");
        if (decisionHistorySize < 1) throw new InvalidInputException("decisionHistorySize must be >= 1");
        if (metricsHistorySize < 1) throw new InvalidInputException("metricsHistorySize must be >= 1");
        if (attackHistorySize < 1) throw new InvalidInputException("attackHistorySize must be >= 1");
        if (maxTurns < 1) throw new InvalidInputException("maxTurns must be >= 1");
        if (kingdomsPerGame < 2) throw new InvalidInputException("kingdomsPerGame must be >= 2");
        if (threads < 1) throw new InvalidInputException("threads must be >= 1");
        if (warDurationTurns < 0) throw new InvalidInputException("warDurationTurns must be >= 0");
        if (turnsPerTick < 0 || maxStoredTurns < 0) throw new InvalidInputException("turn regeneration must be >= 0");
        InvalidInputException.requireNonNegative("startingGold", startingGold);
        InvalidInputException.requireNonNegative("startingLand", startingLand);
        InvalidInputException.requireNonNegative("startingPopulation", startingPopulation);
    }

    public EngineConfig copy() {
        return GSON.fromJson(GSON.toJson(this), EngineConfig.class);
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
