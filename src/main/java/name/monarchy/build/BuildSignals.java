package name.monarchy.build;

/** External pressure on a build order. */
public record BuildSignals(int threats, int opportunities, ResourcePressure resourcePressure) {

    public enum ResourcePressure { LOW, MEDIUM, HIGH }

    public static final BuildSignals CALM = new BuildSignals(0, 0, ResourcePressure.LOW);
}
