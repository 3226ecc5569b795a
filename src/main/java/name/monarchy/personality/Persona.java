package name.monarchy.personality;

import java.util.Locale;

public enum Persona {
    //              agg  eco  mag  dip  risk pat  ada  loy
    WARLORD    (1.4, 1.0, 1.0, 1.0, 1.2, 0.8, 1.0, 1.3),
    TACTICIAN  (1.1, 1.0, 1.0, 1.0, 0.8, 1.3, 1.2, 1.0),
    BERSERKER  (1.8, 1.0, 1.0, 1.0, 1.6, 0.5, 0.7, 1.0),
    GUARDIAN   (0.6, 1.0, 1.0, 1.0, 0.7, 1.4, 1.0, 1.5),
    MERCHANT   (1.0, 1.4, 1.0, 1.3, 0.9, 1.0, 1.2, 1.0),
    NOBLE      (1.0, 1.2, 1.0, 1.4, 1.0, 1.1, 1.0, 1.2),
    PEASANT    (1.0, 1.1, 1.0, 1.0, 0.8, 1.2, 1.0, 1.3),
    DIPLOMAT   (0.4, 1.0, 1.0, 2.0, 1.0, 1.5, 1.2, 1.0),
    ARCHMAGE   (1.0, 1.0, 1.6, 1.0, 0.9, 1.4, 1.1, 1.0),
    TRICKSTER  (1.0, 1.0, 1.3, 1.0, 1.4, 1.0, 1.5, 0.8),
    SCHOLAR    (1.0, 1.0, 1.2, 1.0, 0.7, 1.5, 1.1, 1.0),
    CULTIST    (1.0, 1.0, 1.4, 1.0, 1.3, 1.2, 1.0, 0.6),
    ASSASSIN   (1.3, 1.0, 1.0, 1.0, 1.2, 1.2, 1.0, 0.8),
    SPY        (1.0, 1.0, 1.0, 1.0, 1.1, 1.4, 1.3, 0.9),
    THIEF      (1.0, 1.1, 1.0, 1.0, 1.3, 1.0, 1.2, 0.7),
    SCOUT      (1.0, 1.0, 1.0, 1.0, 1.0, 1.2, 1.3, 1.1),
    BUILDER    (1.0, 1.3, 1.0, 1.0, 0.8, 1.4, 1.0, 1.2),
    EXPLORER   (1.0, 1.0, 1.0, 1.0, 1.2, 0.9, 1.4, 1.0),
    SURVIVOR   (1.0, 1.0, 1.0, 1.0, 0.6, 1.3, 1.2, 1.1),
    OPPORTUNIST(1.0, 1.0, 1.0, 1.0, 1.3, 0.9, 1.4, 0.8);

    public final Traits multipliers;

    Persona(double agg, double eco, double mag, double dip,
            double risk, double pat, double ada, double loy) {
        this.multipliers = new Traits(agg, eco, mag, dip, risk, pat, ada, loy);
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
