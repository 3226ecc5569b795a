package name.monarchy.strategy;

import java.util.Locale;

/**
 * Declaration order is the tie-break order for equal priorities: BUILD beats TRAIN beats
 * ATTACK beats DEFEND. WAIT is only ever the fallback.
 */
public enum ActionType {
    BUILD, TRAIN, ATTACK, DEFEND, WAIT;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
