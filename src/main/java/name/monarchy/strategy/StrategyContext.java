package name.monarchy.strategy;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.personality.Personality;
import name.monarchy.war.WarState;
import name.monarchy.war.WarStatus;

import java.util.List;

/**
 * Everything a rule may look at. {@code warState} may be null when no attack policy applies.
 * With {@code declareIfRequired} set, a WAR_REQUIRED target still counts as attackable because
 * the caller will declare before striking.
 */
public record StrategyContext(
        Kingdom self,
        Personality personality,
        List<Kingdom> rivals,
        GamePhase phase,
        WarState warState,
        boolean declareIfRequired
) {
    public StrategyContext {
        rivals = List.copyOf(rivals);
    }

    public StrategyContext(Kingdom self, Personality personality, List<Kingdom> rivals,
                           GamePhase phase, WarState warState) {
        this(self, personality, rivals, phase, warState, false);
    }

    public boolean mayAttack(Kingdom target) {
        if (target.id.equals(self.id)) return false;
        if (self.allies.contains(target.id)) return false;
        if (warState == null) return true;

        WarState.AttackPermission perm = warState.canAttack(self.id, target.id);
        if (perm.allowed()) return true;
        return declareIfRequired && perm.status() == WarStatus.WAR_REQUIRED;
    }
}
