package name.monarchy.war;

public record WarDeclaration(String attackerId, String defenderId, int attackCount, boolean active) {

    public WarDeclaration ended() {
        return new WarDeclaration(attackerId, defenderId, attackCount, false);
    }
}
