package com.riskengine.model;

import java.util.List;

/**
 * What a decision policy may see of a game in progress.
 */
public interface GameView {

    MapView getMap();

    List<PlayerAccount> getRoster();

    PlayerAccount getActivePlayer();

    int getRound();

    GamePhase getPhase();
}
