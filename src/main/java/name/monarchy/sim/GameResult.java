package name.monarchy.sim;

import name.monarchy.ai.ComprehensiveDecision;
import name.monarchy.battle.BattleReport;
import name.monarchy.kingdom.Race;
import name.monarchy.war.WarDeclaration;

import java.util.List;

public record GameResult(
        int gameIndex,
        long seed,
        String winnerId,
        Race winnerRace,
        WinCondition condition,
        int turnsPlayed,
        List<KingdomSnapshot> start,
        List<KingdomSnapshot> end,
        List<TurnSummary> turns,
        List<BattleReport> battles,             // most recent, bounded by the battle history
        List<ComprehensiveDecision> decisions,  // most recent per kingdom
        List<WarDeclaration> activeWars
) {
    public GameResult {
        start = List.copyOf(start);
        end = List.copyOf(end);
        turns = List.copyOf(turns);
        battles = List.copyOf(battles);
        decisions = List.copyOf(decisions);
        activeWars = List.copyOf(activeWars);
    }

    public enum WinCondition {
        LAST_STANDING,  // every rival eliminated
        DOMINANCE,      // 3:1 land over every surviving rival
        TIMEOUT         // highest networth when the turn limit ran out
    }
}
