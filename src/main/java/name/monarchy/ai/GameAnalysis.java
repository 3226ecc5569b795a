package name.monarchy.ai;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Kingdom;

import java.util.ArrayList;
import java.util.List;

/**
 * Where one kingdom stands relative to everyone else this tick.
 */
public record GameAnalysis(
        GamePhase phase,
        List<String> threats,         // rival ids above 1.2x our networth
        List<String> opportunities,   // rival ids in [0.3x, 0.8x) of our networth
        int rank,                     // 1 = richest
        int kingdomCount,
        Position position,
        Market market,
        String recommendation
) {
    public GameAnalysis {
        threats = List.copyOf(threats);
        opportunities = List.copyOf(opportunities);
    }

    public enum Position { DOMINANT, COMPETITIVE, STRUGGLING, CRITICAL }

    public enum Market { FAVORABLE, NEUTRAL, HOSTILE }

    // -------------------------
    // Thresholds
    // -------------------------
    public static final double THREAT_RATIO = 1.2;
    public static final double OPPORTUNITY_MAX = 0.8;
    public static final double OPPORTUNITY_MIN = 0.3;

    private static final double COMPETITIVE_RANK_SHARE = 0.3;
    private static final double STRUGGLING_RANK_SHARE = 0.7;

    /**
     * {@code world} may or may not contain {@code self}; it is counted exactly once either way.
     */
    public static GameAnalysis of(Kingdom self, List<Kingdom> world, int turn) {
        double nw = self.networth();
        List<String> threats = new ArrayList<>();
        List<String> opportunities = new ArrayList<>();
        int richer = 0;
        int total = 1;

        for (Kingdom k : world) {
            if (k.id.equals(self.id)) continue;
            total++;
            double other = k.networth();
            if (other > nw) richer++;
            if (other > nw * THREAT_RATIO) threats.add(k.id);
            else if (other < nw * OPPORTUNITY_MAX && other >= nw * OPPORTUNITY_MIN) opportunities.add(k.id);
        }

        int rank = richer + 1;
        Position position = positionFor(rank, total);
        Market market = marketFor(threats.size(), opportunities.size());
        return new GameAnalysis(GamePhase.ofTurn(turn), threats, opportunities, rank, total,
                position, market, recommend(position, market, threats.size(), opportunities.size()));
    }

    public static Position positionFor(int rank, int total) {
        if (rank == 1) return Position.DOMINANT;
        if (rank <= total * COMPETITIVE_RANK_SHARE) return Position.COMPETITIVE;
        if (rank <= total * STRUGGLING_RANK_SHARE) return Position.STRUGGLING;
        return Position.CRITICAL;
    }

    public static Market marketFor(int threats, int opportunities) {
        if (threats <= 1 && opportunities >= 2) return Market.FAVORABLE;
        if (threats >= 3 || opportunities == 0) return Market.HOSTILE;
        return Market.NEUTRAL;
    }

    private static String recommend(Position position, Market market, int threats, int opportunities) {
        if (position == Position.DOMINANT && market == Market.FAVORABLE) {
            return "Aggressive expansion to maintain dominance";
        }
        if (position == Position.CRITICAL) return "Defensive consolidation and recovery";
        if (threats > opportunities) return "Defensive posture with selective strikes";
        return "Balanced growth with opportunistic expansion";
    }
}
