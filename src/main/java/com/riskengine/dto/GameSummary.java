package com.riskengine.dto;

import com.riskengine.model.GameStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary of a game once the round loop stops.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameSummary {

    private GameStatus status;
    private String winner;
    private int rounds;
    private List<String> eliminationOrder;
    private int eventCount;
}
