package name.monarchy.ai;

import name.monarchy.strategy.ActionType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-kingdom decision log plus a shared ring of performance samples.
 * Each deque is guarded by its own monitor so kingdoms can be coordinated in parallel.
 */
public final class DecisionHistory {

    private final int decisionsPerKingdom;
    private final int metricsCapacity;

    private final Map<String, Deque<ComprehensiveDecision>> decisions = new ConcurrentHashMap<>();
    private final Deque<PerformanceMetrics> metrics = new ArrayDeque<>();

    public DecisionHistory(int decisionsPerKingdom, int metricsCapacity) {
        this.decisionsPerKingdom = Math.max(1, decisionsPerKingdom);
        this.metricsCapacity = Math.max(1, metricsCapacity);
    }

    public void record(ComprehensiveDecision d) {
        Deque<ComprehensiveDecision> q = decisions.computeIfAbsent(d.kingdomId(), k -> new ArrayDeque<>());
        synchronized (q) {
            q.addLast(d);
            while (q.size() > decisionsPerKingdom) q.removeFirst();
        }
    }

    public List<ComprehensiveDecision> decisions(String kingdomId) {
        Deque<ComprehensiveDecision> q = decisions.get(kingdomId);
        if (q == null) return List.of();
        synchronized (q) {
            return List.copyOf(q);
        }
    }

    /** Every kingdom's retained decisions, oldest first within each kingdom. */
    public List<ComprehensiveDecision> allDecisions() {
        List<ComprehensiveDecision> out = new ArrayList<>();
        for (String id : decisions.keySet()) out.addAll(decisions(id));
        return out;
    }

    public Map<ActionType, Integer> actionDistribution(String kingdomId) {
        EnumMap<ActionType, Integer> out = new EnumMap<>(ActionType.class);
        for (ComprehensiveDecision d : decisions(kingdomId)) {
            out.merge(d.primary().action(), 1, Integer::sum);
        }
        return out;
    }

    public double averageConfidence(String kingdomId) {
        List<ComprehensiveDecision> list = decisions(kingdomId);
        if (list.isEmpty()) return 0.0;
        double sum = 0;
        for (ComprehensiveDecision d : list) sum += d.confidence();
        return sum / list.size();
    }

    // -------------------------
    // Metrics
    // -------------------------

    public void recordMetrics(PerformanceMetrics m) {
        synchronized (metrics) {
            metrics.addLast(m);
            while (metrics.size() > metricsCapacity) metrics.removeFirst();
        }
    }

    public List<PerformanceMetrics> metrics() {
        synchronized (metrics) {
            return List.copyOf(metrics);
        }
    }

    /** The newest {@code n} samples, oldest first. */
    public List<PerformanceMetrics> recentMetrics(int n) {
        List<PerformanceMetrics> all = metrics();
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    public void forget(String kingdomId) {
        decisions.remove(kingdomId);
    }
}
