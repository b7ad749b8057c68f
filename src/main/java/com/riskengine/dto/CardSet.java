package com.riskengine.dto;

import com.riskengine.model.Card;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A valid three-card combination, in the order the cards were selected, with its table value.
 */
@Data
@Builder
public class CardSet {

    public enum Kind {
        THREE_OF_A_KIND,
        ONE_OF_EACH
    }

    private List<Card> cards;
    private Kind kind;
    private int bonus;
}
