package name.monarchy.mechanics;

/** Attack variants; land share is applied on top of the outcome's land gain. */
public enum AttackType {
    STANDARD(1.0),
    CONTROLLED_STRIKE(1.0),
    AMBUSH(1.0),
    GUERILLA_RAID(0.0),
    MOB_ASSAULT(0.8);

    public final double landShare;

    AttackType(double landShare) {
        this.landShare = landShare;
    }
}
