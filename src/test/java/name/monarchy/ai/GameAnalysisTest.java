package name.monarchy.ai;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import org.junit.Test;

import java.util.List;

import static name.monarchy.ai.GameAnalysis.Market;
import static name.monarchy.ai.GameAnalysis.Position;
import static org.junit.Assert.*;

public class GameAnalysisTest {

    private static Kingdom kingdom(String id, double land) {
        Kingdom k = new Kingdom(id, id, Race.HUMAN);
        k.land = land;
        return k;
    }

    @Test
    public void classifiesRivalsByNetworth() {
        Kingdom me = kingdom("me", 1000);
        List<Kingdom> world = List.of(me,
                kingdom("big", 2000), kingdom("small", 500), kingdom("peer", 1100), kingdom("tiny", 100));

        GameAnalysis a = GameAnalysis.of(me, world, 30);
        assertEquals(GamePhase.MID, a.phase());
        assertEquals(List.of("big"), a.threats());
        assertEquals(List.of("small"), a.opportunities());
        assertEquals(3, a.rank());
        assertEquals(5, a.kingdomCount());
        assertEquals(Position.STRUGGLING, a.position());
        assertEquals(Market.NEUTRAL, a.market());
    }

    @Test
    public void selfIsCountedOnceWhetherListedOrNot() {
        Kingdom me = kingdom("me", 1000);
        Kingdom other = kingdom("other", 400);
        assertEquals(2, GameAnalysis.of(me, List.of(me, other), 1).kingdomCount());
        assertEquals(2, GameAnalysis.of(me, List.of(other), 1).kingdomCount());
        assertEquals(1, GameAnalysis.of(me, List.of(me), 1).rank());
    }

    @Test
    public void positionByRankShare() {
        assertEquals(Position.DOMINANT, GameAnalysis.positionFor(1, 10));
        assertEquals(Position.COMPETITIVE, GameAnalysis.positionFor(3, 10));
        assertEquals(Position.STRUGGLING, GameAnalysis.positionFor(7, 10));
        assertEquals(Position.CRITICAL, GameAnalysis.positionFor(8, 10));
    }

    @Test
    public void marketConditions() {
        assertEquals(Market.FAVORABLE, GameAnalysis.marketFor(1, 2));
        assertEquals(Market.HOSTILE, GameAnalysis.marketFor(3, 5));
        assertEquals(Market.HOSTILE, GameAnalysis.marketFor(0, 0));
        assertEquals(Market.NEUTRAL, GameAnalysis.marketFor(2, 1));
    }

    @Test
    public void dominantInFavorableMarketExpands() {
        Kingdom me = kingdom("me", 1000);
        GameAnalysis a = GameAnalysis.of(me, List.of(me, kingdom("a", 500), kingdom("b", 600)), 1);
        assertEquals(Position.DOMINANT, a.position());
        assertEquals(Market.FAVORABLE, a.market());
        assertTrue(a.recommendation().startsWith("Aggressive expansion"));
    }
}
