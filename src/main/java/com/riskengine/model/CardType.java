package com.riskengine.model;

/**
 * Card types. Three of a kind of a matched type is worth {@link #getSetBonus()};
 * the wildcard stands in for any type.
 */
public enum CardType {
    INFANTRY(4),
    CAVALRY(6),
    ARTILLERY(8),
    WILD(0);

    /** Bonus for a set holding one card of each matched type. */
    public static final int MIXED_SET_BONUS = 10;

    private static final CardType[] MATCHED = {INFANTRY, CAVALRY, ARTILLERY};

    private final int setBonus;

    CardType(int setBonus) {
        this.setBonus = setBonus;
    }

    public int getSetBonus() {
        return setBonus;
    }

    public boolean isWild() {
        return this == WILD;
    }

    /**
     * The three types a region card can be dealt as.
     */
    public static CardType[] matchedTypes() {
        return MATCHED.clone();
    }
}
