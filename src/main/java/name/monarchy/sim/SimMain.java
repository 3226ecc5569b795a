package name.monarchy.sim;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import name.monarchy.EngineConfig;
import name.monarchy.InvalidInputException;
import name.monarchy.Monarchy;
import name.monarchy.kingdom.Race;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line batch runner.
 *
 * <pre>
 *   SimMain [--games N] [--seed S] [--turns T] [--threads K] [--out DIR]
 *           [--config FILE] [--label NAME] [--allow-war-required]
 * </pre>
 */
public final class SimMain {
    private SimMain() {}

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    /** Parsed command line. Unset numeric options fall back to the config. */
    public static final class Options {
        public int games = 10;
        public Long seed;
        public Integer turns;
        public Integer threads;
        public Path out = Path.of("sims");
        public Path config;
        public String label;
        public boolean allowWarRequired;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        Options opts;
        EngineConfig config;
        try {
            opts = parse(args);
        } catch (InvalidInputException e) {
            return usage(e);
        }
        try {
            config = opts.config == null ? EngineConfig.load() : EngineConfig.load(opts.config);
            apply(opts, config);
            config.validate();
        } catch (InvalidInputException e) {
            return usage(e);
        } catch (IOException e) {
            Monarchy.LOGGER.error("[Sim] cannot read config {}: {}", opts.config, e.toString());
            return EXIT_IO;
        }

        Monarchy.LOGGER.info("[Sim] running {} games seed={} turns={} threads={}",
                opts.games, config.seed, config.maxTurns, config.threads);
        BatchResult batch = new BatchSimulator(config).run(opts.games, config.seed);

        try (SimRunWriter writer = SimRunWriter.create(opts.out, opts.label)) {
            writer.writeRunMeta(meta(config, batch));
            for (GameResult g : batch.results()) writer.writeGame(g);
            writer.flush();
            Monarchy.LOGGER.info("[Sim] wrote {}", writer.runDir);
        } catch (IOException e) {
            Monarchy.LOGGER.error("[Sim] failed writing run logs under {}: {}", opts.out, e.toString());
            return EXIT_IO;
        }

        for (Map.Entry<Race, BatchResult.RaceStats> e : batch.raceStats().entrySet()) {
            Monarchy.LOGGER.info("[Sim] {} won {}/{} ({})", e.getKey().displayName(),
                    e.getValue().wins(), e.getValue().games(),
                    String.format(Locale.US, "%.1f%%", e.getValue().winRate() * 100));
        }
        return EXIT_OK;
    }

    private static int usage(InvalidInputException e) {
        Monarchy.LOGGER.error("[Sim] {}", e.getMessage());
        Monarchy.LOGGER.error("[Sim] usage: SimMain [--games N] [--seed S] [--turns T] [--threads K] "
                + "[--out DIR] [--config FILE] [--label NAME] [--allow-war-required]");
        return EXIT_USAGE;
    }

    public static Options parse(String[] args) {
        Options o = new Options();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--games" -> o.games = intArg(a, value(args, ++i, a), 0);
                case "--seed" -> o.seed = longArg(a, value(args, ++i, a));
                case "--turns" -> o.turns = intArg(a, value(args, ++i, a), 1);
                case "--threads" -> o.threads = intArg(a, value(args, ++i, a), 1);
                case "--out" -> o.out = Path.of(value(args, ++i, a));
                case "--config" -> o.config = Path.of(value(args, ++i, a));
                case "--label" -> o.label = value(args, ++i, a);
                case "--allow-war-required" -> o.allowWarRequired = true;
                default -> throw new InvalidInputException("unknown option " + a);
            }
        }
        return o;
    }

    static void apply(Options o, EngineConfig config) {
        if (o.seed != null) config.seed = o.seed;
        if (o.turns != null) config.maxTurns = o.turns;
        if (o.threads != null) config.threads = o.threads;
        if (o.allowWarRequired) config.allowAttacksWhenWarRequired = true;
    }

    static JsonObject meta(EngineConfig config, BatchResult batch) {
        JsonObject meta = new JsonObject();
        meta.addProperty("engine", Monarchy.ENGINE_ID);
        meta.addProperty("seed", batch.seed());
        meta.addProperty("gamesRequested", batch.requested());
        meta.addProperty("gamesCompleted", batch.completed());
        meta.addProperty("gamesCancelled", batch.cancelled());
        meta.add("config", JsonParser.parseString(config.toJson()));

        JsonArray failures = new JsonArray();
        for (GameFailure f : batch.failures()) {
            JsonObject fo = new JsonObject();
            fo.addProperty("game", f.gameIndex());
            fo.addProperty("seed", f.seed());
            fo.addProperty("error", f.errorType());
            fo.addProperty("message", f.message());
            failures.add(fo);
        }
        meta.add("failures", failures);

        JsonObject races = new JsonObject();
        for (Map.Entry<Race, BatchResult.RaceStats> e : batch.raceStats().entrySet()) {
            JsonObject r = new JsonObject();
            r.addProperty("games", e.getValue().games());
            r.addProperty("wins", e.getValue().wins());
            r.addProperty("winRate", e.getValue().winRate());
            races.add(e.getKey().displayName(), r);
        }
        meta.add("races", races);
        return meta;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new InvalidInputException(flag + " needs a value");
        return args[i];
    }

    private static int intArg(String flag, String v, int min) {
        try {
            int n = Integer.parseInt(v.trim());
            if (n < min) throw new InvalidInputException(flag + " must be >= " + min + ", got " + n);
            return n;
        } catch (NumberFormatException e) {
            throw new InvalidInputException(flag + " expects a whole number, got '" + v + "'");
        }
    }

    private static long longArg(String flag, String v) {
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(flag + " expects a whole number, got '" + v + "'");
        }
    }
}
