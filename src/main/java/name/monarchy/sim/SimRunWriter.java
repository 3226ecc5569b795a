package name.monarchy.sim;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import name.monarchy.Monarchy;
import name.monarchy.ai.ComprehensiveDecision;
import name.monarchy.battle.BattleReport;
import name.monarchy.kingdom.UnitType;
import name.monarchy.mechanics.CombatResult;
import name.monarchy.war.WarDeclaration;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Writes one run directory of CSV and JSONL logs for a batch. Not thread-safe; write results
 * after the batch has finished.
 */
public final class SimRunWriter implements Closeable {
    private static final Gson GSON = new Gson();
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    public final String runId;
    public final Path runDir;

    private final BufferedWriter stepCsv;
    private final BufferedWriter battlesJsonl;
    private final BufferedWriter kingdomSnapshotsCsv;
    private final BufferedWriter warSnapshotsCsv;
    private final BufferedWriter decisionJsonl;

    private final Path metaPath;

    public static SimRunWriter create(Path baseDir, String label) throws IOException {
        String ts = LocalDateTime.now().format(TS);
        String runId = ts + (label == null || label.isBlank() ? "" : ("_" + sanitize(label)));
        Path runDir = baseDir.resolve(runId);
        Files.createDirectories(runDir);

        BufferedWriter stepCsv = open(runDir.resolve("steps.csv"));
        BufferedWriter battlesJsonl = open(runDir.resolve("battles.jsonl"));
        BufferedWriter kingdomSnapshotsCsv = open(runDir.resolve("kingdom_snapshots.csv"));
        BufferedWriter warSnapshotsCsv = open(runDir.resolve("war_snapshots.csv"));
        BufferedWriter decisionJsonl = open(runDir.resolve("decision_snapshots.jsonl"));

        // headers
        stepCsv.write("runId,game,tick,builds,trains,attacks,defends,waits," +
                "battles,victories,rejected,warDeclarations,peaceTreaties,eliminations,alive\n");

        // phase is START or END
        kingdomSnapshotsCsv.write(
                "runId,game,phase,kingdomId,name,race,persona,playstyle," +
                "aggression,economy,risk," +
                "land,gold,population,turns,structures,forts,temples,units,networth,eliminated\n"
        );

        warSnapshotsCsv.write("runId,game,attackerId,defenderId,attackCount,active\n");

        return new SimRunWriter(runId, runDir, runDir.resolve("run_meta.json"),
                stepCsv, battlesJsonl, kingdomSnapshotsCsv, warSnapshotsCsv, decisionJsonl);
    }

    private static BufferedWriter open(Path p) throws IOException {
        return Files.newBufferedWriter(p, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    }

    private SimRunWriter(
            String runId,
            Path runDir,
            Path metaPath,
            BufferedWriter stepCsv,
            BufferedWriter battlesJsonl,
            BufferedWriter kingdomSnapshotsCsv,
            BufferedWriter warSnapshotsCsv,
            BufferedWriter decisionJsonl
    ) {
        this.runId = runId;
        this.runDir = runDir;
        this.metaPath = metaPath;
        this.stepCsv = stepCsv;
        this.battlesJsonl = battlesJsonl;
        this.kingdomSnapshotsCsv = kingdomSnapshotsCsv;
        this.warSnapshotsCsv = warSnapshotsCsv;
        this.decisionJsonl = decisionJsonl;
    }

    // -------------------------
    // Meta
    // -------------------------

    public void writeRunMeta(JsonObject meta) throws IOException {
        if (meta == null) meta = new JsonObject();
        meta.addProperty("runId", runId);

        Files.writeString(
                metaPath,
                GSON.toJson(meta),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING
        );
    }

    /** Everything a batch produced, in game order. */
    public void writeGame(GameResult g) throws IOException {
        for (TurnSummary t : g.turns()) logStep(g.gameIndex(), t);
        for (KingdomSnapshot k : g.start()) logKingdomSnapshot(g.gameIndex(), "START", k);
        for (KingdomSnapshot k : g.end()) logKingdomSnapshot(g.gameIndex(), "END", k);
        for (WarDeclaration w : g.activeWars()) logWarSnapshot(g.gameIndex(), w);
        for (BattleReport b : g.battles()) logBattle(g.gameIndex(), b);
        for (ComprehensiveDecision d : g.decisions()) logDecision(g.gameIndex(), d);
    }

    // -------------------------
    // Step + battle logs
    // -------------------------

    public void logStep(int game, TurnSummary t) throws IOException {
        stepCsv.write(runId); stepCsv.write(",");
        stepCsv.write(Integer.toString(game)); stepCsv.write(",");
        stepCsv.write(Long.toString(t.tick())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.builds())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.trains())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.attacks())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.defends())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.waits())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.battles())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.victories())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.rejected())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.warDeclarations())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.peaceTreaties())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.eliminations())); stepCsv.write(",");
        stepCsv.write(Integer.toString(t.alive()));
        stepCsv.write("\n");
    }

    public void logBattle(int game, BattleReport b) throws IOException {
        JsonObject obj = new JsonObject();
        obj.addProperty("runId", runId);
        obj.addProperty("game", game);
        obj.addProperty("tick", b.tick());
        obj.addProperty("attackerId", b.attackerId());
        obj.addProperty("defenderId", b.defenderId());
        obj.addProperty("accepted", b.accepted());
        obj.addProperty("attackType", b.attackType() == null ? "" : b.attackType().name());
        if (!b.accepted()) {
            obj.addProperty("reason", b.reason());
        } else {
            CombatResult r = b.result();
            obj.addProperty("formation", b.formation().id);
            obj.addProperty("terrain", b.terrain().id());
            obj.addProperty("turnsSpent", b.turnsSpent());
            obj.addProperty("outcome", r.outcome().id);
            obj.addProperty("offenseRatio", r.offenseRatio());
            obj.addProperty("landGained", r.landGained());
            obj.addProperty("goldLooted", r.goldLooted());
            obj.addProperty("structuresDestroyed", r.structuresDestroyed());
            obj.add("attackerCasualties", GSON.toJsonTree(r.attackerCasualties()));
            obj.add("defenderCasualties", GSON.toJsonTree(r.defenderCasualties()));
            obj.addProperty("warStatus", b.warStatus().name());
            obj.addProperty("restoration", b.restoration().type().name());
        }
        battlesJsonl.write(GSON.toJson(obj));
        battlesJsonl.write("\n");
    }

    // -------------------------
    // Snapshots
    // -------------------------

    public void logKingdomSnapshot(int game, String phase, KingdomSnapshot k) throws IOException {
        kingdomSnapshotsCsv.write(runId); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(Integer.toString(game)); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(esc(phase)); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(esc(k.id())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(esc(k.name())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(k.race().displayName()); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(esc(k.persona())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(esc(k.playstyle())); kingdomSnapshotsCsv.write(",");

        kingdomSnapshotsCsv.write(fmt(k.aggression())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(fmt(k.economy())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(fmt(k.risk())); kingdomSnapshotsCsv.write(",");

        kingdomSnapshotsCsv.write(fmt1(k.land())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(fmt1(k.gold())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(fmt1(k.population())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(Integer.toString(k.turns())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(Integer.toString(k.structures())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(Integer.toString(k.forts())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(Integer.toString(k.temples())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(esc(units(k.units()))); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(fmt1(k.networth())); kingdomSnapshotsCsv.write(",");
        kingdomSnapshotsCsv.write(Boolean.toString(k.eliminated()));

        kingdomSnapshotsCsv.write("\n");
    }

    public void logWarSnapshot(int game, WarDeclaration w) throws IOException {
        warSnapshotsCsv.write(runId); warSnapshotsCsv.write(",");
        warSnapshotsCsv.write(Integer.toString(game)); warSnapshotsCsv.write(",");
        warSnapshotsCsv.write(esc(w.attackerId())); warSnapshotsCsv.write(",");
        warSnapshotsCsv.write(esc(w.defenderId())); warSnapshotsCsv.write(",");
        warSnapshotsCsv.write(Integer.toString(w.attackCount())); warSnapshotsCsv.write(",");
        warSnapshotsCsv.write(Boolean.toString(w.active()));
        warSnapshotsCsv.write("\n");
    }

    public void logDecision(int game, ComprehensiveDecision d) throws IOException {
        JsonObject obj = new JsonObject();
        obj.addProperty("runId", runId);
        obj.addProperty("game", game);
        obj.addProperty("tick", d.tick());
        obj.addProperty("kingdomId", d.kingdomId());
        obj.addProperty("action", d.primary().action().id());
        obj.addProperty("priority", d.primary().priority());
        obj.addProperty("targetId", d.primary().targetId() == null ? "" : d.primary().targetId());
        obj.addProperty("risk", d.primary().risk().name());
        obj.addProperty("confidence", d.confidence());
        obj.addProperty("phase", d.analysis().phase().name());
        obj.addProperty("position", d.analysis().position().name());
        obj.addProperty("market", d.analysis().market().name());
        obj.addProperty("buildStep", d.nextBuildStep() == null ? "" : d.nextBuildStep().description());
        obj.addProperty("plannedAttacks", d.attackPlan() == null ? 0 : d.attackPlan().sequence().size());

        JsonArray reasoning = new JsonArray();
        for (String r : d.reasoning()) reasoning.add(r);
        obj.add("reasoning", reasoning);

        decisionJsonl.write(GSON.toJson(obj));
        decisionJsonl.write("\n");
    }

    // -------------------------
    // Flush/close
    // -------------------------

    public void flush() throws IOException {
        stepCsv.flush();
        battlesJsonl.flush();
        kingdomSnapshotsCsv.flush();
        warSnapshotsCsv.flush();
        decisionJsonl.flush();
    }

    /** Closes every log; a failure on one writer is logged and the rest are still closed. */
    @Override
    public void close() {
        closeQuietly("steps.csv", stepCsv);
        closeQuietly("battles.jsonl", battlesJsonl);
        closeQuietly("kingdom_snapshots.csv", kingdomSnapshotsCsv);
        closeQuietly("war_snapshots.csv", warSnapshotsCsv);
        closeQuietly("decision_snapshots.jsonl", decisionJsonl);
    }

    private void closeQuietly(String name, BufferedWriter w) {
        try {
            w.close();
        } catch (IOException e) {
            Monarchy.LOGGER.warn("[Sim] failed to close {} in {}: {}", name, runDir, e.toString());
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static String sanitize(String s) {
        return s.replaceAll("[^a-zA-Z0-9._-]+", "_");
    }

    private static String esc(String s) {
        if (s == null) return "";
        boolean needs = s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r");
        if (!needs) return s;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    private static String units(Map<UnitType, Integer> units) {
        StringBuilder sb = new StringBuilder();
        for (UnitType t : UnitType.values()) {
            Integer c = units.get(t);
            if (c == null || c <= 0) continue;
            if (sb.length() > 0) sb.append(';');
            sb.append(t.id()).append('=').append(c);
        }
        return sb.toString();
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.2f", v);
    }

    private static String fmt1(double v) {
        return String.format(Locale.US, "%.1f", v);
    }
}
