package name.monarchy.personality;

import name.monarchy.kingdom.Race;

import java.util.List;

/**
 * A generated AI personality. Decision modifiers are derived from the traits on every call.
 */
public record Personality(
        String kingdomId,
        String name,
        String title,
        String description,
        Race race,
        Persona persona,
        Playstyle playstyle,
        Traits traits,
        Behavior behavior
) {

    public record Modifiers(
            double attackThreshold,
            double buildPriority,
            double militaryFocus,
            double magicFocus,
            double defensiveFocus,
            double allianceValue,
            double tradeFrequency,
            double warDeclarationCost
    ) {}

    public record Behavior(
            List<String> preferredTargets,
            List<String> avoidedTargets,
            String allianceStrategy,
            String economicStrategy,
            String militaryStrategy,
            String endgameStrategy,
            List<String> quirks
    ) {
        public Behavior {
            preferredTargets = List.copyOf(preferredTargets);
            avoidedTargets = List.copyOf(avoidedTargets);
            quirks = List.copyOf(quirks);
        }
    }

    public Modifiers modifiers() {
        Traits t = traits;
        return new Modifiers(
                2.0 - t.aggression(),
                t.economy() * 10,
                t.aggression() * 10,
                t.magic() * 10,
                (2.0 - t.risk()) * 10,
                t.diplomacy() * 10,
                t.diplomacy() * t.economy(),
                (2.0 - t.aggression()) * t.patience()
        );
    }

    public String fullName() {
        return name + " " + title;
    }
}
