package name.monarchy.strategy;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One candidate action: a guard and a scorer. The scorer may still return null when a
 * finer check (e.g. no viable target) rules the action out.
 */
public record StrategyRule(
        ActionType action,
        Predicate<StrategyContext> applies,
        Function<StrategyContext, StrategicDecision> scorer
) {
    public StrategicDecision evaluate(StrategyContext ctx) {
        if (!applies.test(ctx)) return null;
        return scorer.apply(ctx);
    }
}
