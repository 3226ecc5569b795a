package name.monarchy.battle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** The most recent battles in a world, oldest dropped first. */
public final class BattleHistory {

    private final int capacity;
    private final Deque<BattleReport> reports = new ArrayDeque<>();
    private long total;

    public BattleHistory(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void add(BattleReport r) {
        reports.addLast(r);
        total++;
        while (reports.size() > capacity) reports.removeFirst();
    }

    public synchronized List<BattleReport> recent() {
        return List.copyOf(reports);
    }

    public synchronized List<BattleReport> involving(String kingdomId) {
        List<BattleReport> out = new ArrayList<>();
        for (BattleReport r : reports) {
            if (kingdomId.equals(r.attackerId()) || kingdomId.equals(r.defenderId())) out.add(r);
        }
        return out;
    }

    public synchronized int size() {
        return reports.size();
    }

    /** Battles ever added, including those already evicted. */
    public synchronized long total() {
        return total;
    }

    public int capacity() {
        return capacity;
    }
}
