package name.monarchy.ai;

public record ResourcePlan(
        GoldAllocation gold,
        TurnAllocation turns,
        Reserves reserves,
        Growth growth
) {

    public record Share(long amount, int percentage) {}

    public record GoldAllocation(Share economic, Share military, Share defensive, Share emergency, Share opportunity) {
        public long total() {
            return economic.amount() + military.amount() + defensive.amount()
                    + emergency.amount() + opportunity.amount();
        }
    }

    public record TurnAllocation(int attacks, int building, int defense, int scouting, int reserve) {
        public int total() {
            return attacks + building + defense + scouting + reserve;
        }
    }

    public record Reserves(long gold, int turns) {}

    /** Projected networth after 10, 25 and 50 turns. */
    public record Growth(double ratePerTurn, long shortTerm, long mediumTerm, long longTerm) {}
}
