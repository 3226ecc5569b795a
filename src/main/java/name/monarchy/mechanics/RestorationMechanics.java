package name.monarchy.mechanics;

import java.util.EnumSet;
import java.util.Set;

/**
 * Protection granted after a kingdom is wiped out or crippled. While it lasts the kingdom
 * can rebuild but cannot be the source or target of hostile actions.
 */
public final class RestorationMechanics {
    private RestorationMechanics() {}

    public static final int DAMAGE_BASED_HOURS = 48;
    public static final int DEATH_BASED_HOURS = 72;

    public static final double STRUCTURE_LOSS_MINIMUM = 0.70;
    public static final double POPULATION_LOSS_MINIMUM = 0.80;

    public static final Set<String> CRITICAL_BUILDINGS = Set.of("palace", "fortress", "major_temples");

    public enum RestorationType {
        NONE(0), DAMAGE_BASED(DAMAGE_BASED_HOURS), DEATH_BASED(DEATH_BASED_HOURS);

        public final int hours;

        RestorationType(int hours) {
            this.hours = hours;
        }
    }

    public enum ProhibitedAction {
        COMBAT_ATTACKS,
        COMBAT_DEFENSE,
        SORCERY_CASTING,
        SORCERY_TARGETING,
        ESPIONAGE_OPERATIONS,
        ESPIONAGE_TARGETING,
        DIPLOMATIC_ACTIONS,
        ALLIANCE_CHANGES
    }

    private static final Set<ProhibitedAction> PROHIBITED = EnumSet.allOf(ProhibitedAction.class);

    /** State of a kingdom before or after an attack. */
    public record DamageSnapshot(double structures, double population, Set<String> criticalBuildings) {
        public DamageSnapshot {
            criticalBuildings = criticalBuildings == null ? Set.of() : Set.copyOf(criticalBuildings);
        }
    }

    public record Assessment(
            RestorationType type,
            double structureLoss,
            double populationLoss,
            boolean criticalInfrastructureDestroyed
    ) {
        public boolean qualifies() {
            return type != RestorationType.NONE;
        }

        public int protectionHours() {
            return type.hours;
        }
    }

    public static Assessment restorationQualifies(DamageSnapshot pre, DamageSnapshot post) {
        double structureLoss = lossFraction(pre.structures(), post.structures());
        double populationLoss = lossFraction(pre.population(), post.population());

        boolean criticalLost = false;
        for (String b : pre.criticalBuildings()) {
            if (CRITICAL_BUILDINGS.contains(b) && !post.criticalBuildings().contains(b)) {
                criticalLost = true;
                break;
            }
        }

        RestorationType type = RestorationType.NONE;
        if (post.structures() <= 0 || post.population() <= 0) {
            type = RestorationType.DEATH_BASED;
        } else if (structureLoss >= STRUCTURE_LOSS_MINIMUM
                || populationLoss >= POPULATION_LOSS_MINIMUM
                || criticalLost) {
            type = RestorationType.DAMAGE_BASED;
        }
        return new Assessment(type, structureLoss, populationLoss, criticalLost);
    }

    public static boolean isProhibited(ProhibitedAction action) {
        return action != null && PROHIBITED.contains(action);
    }

    private static double lossFraction(double before, double after) {
        if (before <= 0) return 0.0;
        return Math.max(0.0, Math.min(1.0, 1.0 - after / before));
    }
}
