package com.riskengine.model;

import lombok.Getter;

/**
 * A card traded in sets of three for bonus troops. Region cards are bound to the region
 * they were dealt for; wildcards are bound to none.
 * <p>
 * Equality is identity: two cards of the same type are still distinct cards in a hand.
 */
@Getter
public final class Card {

    private final CardType type;
    private final Region region;

    public Card(CardType type, Region region) {
        this.type = type;
        this.region = region;
    }

    public static Card wild() {
        return new Card(CardType.WILD, null);
    }

    public boolean isWild() {
        return type.isWild();
    }

    @Override
    public String toString() {
        return region == null ? type.name() : type.name() + "(" + region.getName() + ")";
    }
}
