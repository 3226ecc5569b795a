package name.monarchy.war;

import name.monarchy.InvalidInputException;
import name.monarchy.Monarchy;
import name.monarchy.mechanics.CombatMechanics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attack counts and war declarations per directed attacker-defender pair.
 *
 * <p>Counts only grow until war is declared (frozen while at war) or peace resets them.
 * A pair reaching the declaration threshold always passes through WAR_REQUIRED; whether
 * further attacks are allowed before the attacker declares is a policy flag.
 */
public final class WarState {

    public enum WarEndReason { PEACE_TREATY, ELIMINATION, RESET }

    public record PairState(WarStatus status, int attackCount, WarDeclaration declaration) {
        static final PairState NEUTRAL = new PairState(WarStatus.NEUTRAL, 0, null);
    }

    public record AttackPermission(boolean allowed, WarStatus status, String reason) {
        static AttackPermission allow(WarStatus s) { return new AttackPermission(true, s, ""); }
        static AttackPermission deny(WarStatus s, String reason) { return new AttackPermission(false, s, reason); }
    }

    public record AttackRecord(String attackerId, String defenderId, long tick, String outcome, int landGained) {}

    private record PairKey(String attackerId, String defenderId) {}

    // direction matters: a->b and b->a are tracked separately
    private final Map<PairKey, PairState> pairs = new ConcurrentHashMap<>();
    private final Map<String, Deque<AttackRecord>> recent = new ConcurrentHashMap<>();

    private final boolean allowAttacksWhenWarRequired;
    private final int attackHistorySize;

    public WarState(boolean allowAttacksWhenWarRequired, int attackHistorySize) {
        this.allowAttacksWhenWarRequired = allowAttacksWhenWarRequired;
        this.attackHistorySize = Math.max(1, attackHistorySize);
    }

    public boolean allowsAttacksWhenWarRequired() {
        return allowAttacksWhenWarRequired;
    }

    // -------------------------
    // Queries
    // -------------------------

    public PairState pair(String attackerId, String defenderId) {
        return pairs.getOrDefault(key(attackerId, defenderId), PairState.NEUTRAL);
    }

    public WarStatus status(String attackerId, String defenderId) {
        return pair(attackerId, defenderId).status();
    }

    public int attackCount(String attackerId, String defenderId) {
        return pair(attackerId, defenderId).attackCount();
    }

    public boolean isAtWar(String attackerId, String defenderId) {
        return status(attackerId, defenderId) == WarStatus.AT_WAR;
    }

    public AttackPermission canAttack(String attackerId, String defenderId) {
        if (attackerId == null || defenderId == null) {
            return AttackPermission.deny(WarStatus.NEUTRAL, "missing kingdom id");
        }
        if (attackerId.equals(defenderId)) {
            return AttackPermission.deny(WarStatus.NEUTRAL, "cannot attack self");
        }
        WarStatus s = status(attackerId, defenderId);
        if (s == WarStatus.WAR_REQUIRED && !allowAttacksWhenWarRequired) {
            return AttackPermission.deny(s, "war declaration required");
        }
        return AttackPermission.allow(s);
    }

    public List<WarDeclaration> activeWars() {
        List<WarDeclaration> out = new ArrayList<>();
        for (PairState p : pairs.values()) {
            if (p.status() == WarStatus.AT_WAR && p.declaration() != null) out.add(p.declaration());
        }
        return out;
    }

    public List<AttackRecord> recentAttacks(String attackerId) {
        Deque<AttackRecord> q = recent.get(attackerId);
        if (q == null) return List.of();
        synchronized (q) {
            return List.copyOf(q);
        }
    }

    // -------------------------
    // Transitions
    // -------------------------

    /**
     * Count one attack. Throws if the policy forbids attacking this pair right now;
     * callers should check {@link #canAttack} first.
     */
    public PairState recordAttack(String attackerId, String defenderId) {
        AttackPermission perm = canAttack(attackerId, defenderId);
        if (!perm.allowed()) {
            throw refused(attackerId, defenderId, perm.reason());
        }
        // the policy check is repeated under the map's lock so concurrent attacks cannot overshoot
        PairState next = pairs.compute(key(attackerId, defenderId), (k, cur) -> {
            if (cur == null) cur = PairState.NEUTRAL;
            if (cur.status() == WarStatus.AT_WAR) return cur;
            if (cur.status() == WarStatus.WAR_REQUIRED && !allowAttacksWhenWarRequired) {
                throw refused(attackerId, defenderId, "war declaration required");
            }
            int count = cur.attackCount() + 1;
            return new PairState(WarStatus.forCount(count), count, null);
        });
        if (next.attackCount() == CombatMechanics.WAR_DECLARATION_THRESHOLD) {
            Monarchy.LOGGER.info("[War] declaration required attacker={} defender={} attacks={}",
                    attackerId, defenderId, next.attackCount());
        }
        return next;
    }

    private static IllegalStateException refused(String attackerId, String defenderId, String reason) {
        return new IllegalStateException("Attack " + attackerId + " -> " + defenderId + " refused: " + reason);
    }

    public void logAttack(AttackRecord record) {
        Deque<AttackRecord> q = recent.computeIfAbsent(record.attackerId(), k -> new ArrayDeque<>());
        synchronized (q) {
            q.addLast(record);
            while (q.size() > attackHistorySize) q.removeFirst();
        }
    }

    /** Only legal from WAR_REQUIRED. */
    public WarDeclaration declareWar(String attackerId, String defenderId) {
        InvalidInputException.requirePresent("attackerId", attackerId);
        InvalidInputException.requirePresent("defenderId", defenderId);
        PairState next = pairs.compute(key(attackerId, defenderId), (k, cur) -> {
            WarStatus s = cur == null ? WarStatus.NEUTRAL : cur.status();
            if (s != WarStatus.WAR_REQUIRED) {
                throw new IllegalStateException("Cannot declare war " + attackerId + " -> " + defenderId + " from " + s);
            }
            WarDeclaration d = new WarDeclaration(attackerId, defenderId, cur.attackCount(), true);
            return new PairState(WarStatus.AT_WAR, cur.attackCount(), d);
        });
        Monarchy.LOGGER.info("[War] declareWar attacker={} defender={} attacks={}",
                attackerId, defenderId, next.attackCount());
        return next.declaration();
    }

    /**
     * Return the pair to NEUTRAL with a zero count. Returns the ended declaration, or null if the
     * pair was not at war.
     */
    public WarDeclaration makePeace(String attackerId, String defenderId, WarEndReason reason) {
        PairState prev = pairs.remove(key(attackerId, defenderId));
        if (prev == null) return null;
        if (prev.status() != WarStatus.AT_WAR) {
            Monarchy.LOGGER.debug("[War] reset {} -> {} from {} ({})", attackerId, defenderId, prev.status(), reason);
            return null;
        }
        Monarchy.LOGGER.info("[War] makePeace attacker={} defender={} reason={}", attackerId, defenderId, reason);
        return prev.declaration().ended();
    }

    public WarDeclaration makePeace(String attackerId, String defenderId) {
        return makePeace(attackerId, defenderId, WarEndReason.PEACE_TREATY);
    }

    /** Drop every pair that involves this kingdom (e.g. it was eliminated). */
    public int forget(String kingdomId) {
        int removed = 0;
        for (PairKey k : new ArrayList<>(pairs.keySet())) {
            if (k.attackerId().equals(kingdomId) || k.defenderId().equals(kingdomId)) {
                if (pairs.remove(k) != null) removed++;
            }
        }
        recent.remove(kingdomId);
        return removed;
    }

    private static PairKey key(String attackerId, String defenderId) {
        return new PairKey(attackerId, defenderId);
    }
}
