package name.monarchy.personality;

import java.util.Locale;

public enum Playstyle {
    //                agg  eco  mag  dip  risk pat  ada  loy
    AGGRESSIVE    (1.3, 1.0, 1.0, 1.0, 1.2, 0.8, 1.0, 1.0),
    DEFENSIVE     (0.7, 1.0, 1.0, 1.0, 0.8, 1.3, 1.0, 1.0),
    BALANCED      (1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.2, 1.1),
    OPPORTUNISTIC (1.0, 1.0, 1.0, 1.0, 1.2, 1.0, 1.3, 0.9),
    CALCULATED    (1.0, 1.0, 1.0, 1.0, 0.8, 1.3, 1.1, 1.0),
    UNPREDICTABLE (1.0, 1.0, 1.0, 1.0, 1.4, 1.0, 1.4, 0.8),
    PATIENT       (0.8, 1.0, 1.0, 1.0, 0.8, 1.5, 1.0, 1.0),
    RECKLESS      (1.3, 1.0, 1.0, 1.0, 1.6, 0.6, 1.0, 1.0),
    DIPLOMATIC    (0.8, 1.0, 1.0, 1.4, 1.0, 1.0, 1.0, 1.2),
    ISOLATIONIST  (1.0, 1.0, 1.0, 0.6, 1.0, 1.2, 1.0, 0.7),
    EXPANSIONIST  (1.2, 1.1, 1.0, 1.0, 1.1, 1.0, 1.0, 1.0),
    TURTLE        (0.6, 1.0, 1.0, 1.0, 0.7, 1.4, 1.0, 1.0);

    public final Traits multipliers;

    Playstyle(double agg, double eco, double mag, double dip,
              double risk, double pat, double ada, double loy) {
        this.multipliers = new Traits(agg, eco, mag, dip, risk, pat, ada, loy);
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
