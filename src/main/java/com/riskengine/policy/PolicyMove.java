package com.riskengine.policy;

/**
 * A move proposed by a decision policy. Regions are referred to by name; the engine resolves
 * and validates them before anything is applied.
 */
public class PolicyMove {

    private final MoveType type;
    private final String fromRegion;
    private final String toRegion;
    private final int troops;

    public PolicyMove(MoveType type, String fromRegion, String toRegion, int troops) {
        this.type = type;
        this.fromRegion = fromRegion;
        this.toRegion = toRegion;
        this.troops = troops;
    }

    public MoveType getType() { return type; }
    public String getFromRegion() { return fromRegion; }
    public String getToRegion() { return toRegion; }
    public int getTroops() { return troops; }

    public enum MoveType {
        DRAFT,
        ATTACK,
        FORTIFY,
        END_ATTACK,
        SKIP_FORTIFY
    }

    public static PolicyMove draft(String region, int troops) {
        return new PolicyMove(MoveType.DRAFT, null, region, troops);
    }

    public static PolicyMove attack(String from, String to, int troops) {
        return new PolicyMove(MoveType.ATTACK, from, to, troops);
    }

    public static PolicyMove fortify(String from, String to, int troops) {
        return new PolicyMove(MoveType.FORTIFY, from, to, troops);
    }

    public static PolicyMove endAttack() {
        return new PolicyMove(MoveType.END_ATTACK, null, null, 0);
    }

    public static PolicyMove skipFortify() {
        return new PolicyMove(MoveType.SKIP_FORTIFY, null, null, 0);
    }

    @Override
    public String toString() {
        return switch (type) {
            case DRAFT -> "DRAFT " + troops + " -> " + toRegion;
            case ATTACK, FORTIFY -> type + " " + fromRegion + " -> " + toRegion + " (" + troops + ")";
            case END_ATTACK, SKIP_FORTIFY -> type.name();
        };
    }
}
