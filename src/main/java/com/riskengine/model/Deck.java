package com.riskengine.model;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Draw pile and discard pile. Drawing from an empty pile first reshuffles the discards
 * back in together with two fresh wildcards.
 */
@Slf4j
public class Deck {

    static final int WILDS_PER_RESHUFFLE = 2;

    private final List<Card> drawPile;
    private final List<Card> discardPile = new ArrayList<>();
    private final Random random;

    public Deck(List<Card> drawPile, Random random) {
        this.drawPile = new ArrayList<>(drawPile);
        this.random = random;
    }

    /**
     * One card per region, each of a matched type picked uniformly at random.
     */
    public static Deck forRegions(List<Region> regions, Random random) {
        CardType[] types = CardType.matchedTypes();
        List<Card> cards = new ArrayList<>(regions.size());
        for (Region region : regions) {
            cards.add(new Card(types[random.nextInt(types.length)], region));
        }
        return new Deck(cards, random);
    }

    public Card draw() {
        if (drawPile.isEmpty()) {
            reshuffle();
        }
        return drawPile.remove(drawPile.size() - 1);
    }

    public void discard(Collection<Card> cards) {
        discardPile.addAll(cards);
    }

    void reshuffle() {
        drawPile.addAll(discardPile);
        discardPile.clear();
        for (int i = 0; i < WILDS_PER_RESHUFFLE; i++) {
            drawPile.add(Card.wild());
        }
        Collections.shuffle(drawPile, random);
        log.debug("Deck reshuffled: {} cards in draw pile", drawPile.size());
    }

    public List<Card> getDrawPile() {
        return Collections.unmodifiableList(drawPile);
    }

    public List<Card> getDiscardPile() {
        return Collections.unmodifiableList(discardPile);
    }
}
