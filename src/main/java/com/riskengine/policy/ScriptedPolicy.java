package com.riskengine.policy;

import com.riskengine.model.Card;
import com.riskengine.model.GameView;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Replays answers queued by a host (a terminal, a network session or a test). Each kind of
 * decision has its own queue; when a queue runs dry the fallback policy answers instead.
 * <p>
 * Queued moves are handed over as given, so a host can also queue moves the engine will reject.
 */
public class ScriptedPolicy implements DecisionPolicy {

    private final DecisionPolicy fallback;

    private final Deque<PolicyMove> drafts = new ArrayDeque<>();
    private final Deque<PolicyMove> attacks = new ArrayDeque<>();
    private final Deque<PolicyMove> fortifies = new ArrayDeque<>();
    private final Deque<Integer> captureMoves = new ArrayDeque<>();
    private final Deque<Optional<List<Card>>> trades = new ArrayDeque<>();

    public ScriptedPolicy(DecisionPolicy fallback) {
        this.fallback = fallback;
    }

    @Override
    public PolicyType getType() {
        return PolicyType.SCRIPTED;
    }

    public ScriptedPolicy queueDraft(String region, int troops) {
        drafts.add(PolicyMove.draft(region, troops));
        return this;
    }

    public ScriptedPolicy queueAttack(PolicyMove move) {
        attacks.add(move);
        return this;
    }

    public ScriptedPolicy queueAttack(String from, String to, int troops) {
        return queueAttack(PolicyMove.attack(from, to, troops));
    }

    public ScriptedPolicy queueFortify(PolicyMove move) {
        fortifies.add(move);
        return this;
    }

    public ScriptedPolicy queueCaptureMove(int troops) {
        captureMoves.add(troops);
        return this;
    }

    public ScriptedPolicy queueTrade(List<Card> cards) {
        trades.add(Optional.of(cards));
        return this;
    }

    public ScriptedPolicy queueDecline() {
        trades.add(Optional.empty());
        return this;
    }

    public boolean isExhausted() {
        return drafts.isEmpty() && attacks.isEmpty() && fortifies.isEmpty()
                && captureMoves.isEmpty() && trades.isEmpty();
    }

    @Override
    public PolicyMove decideDraft(GameView game, PlayerAccount self, int allowance) {
        PolicyMove move = drafts.poll();
        return move != null ? move : fallback.decideDraft(game, self, allowance);
    }

    @Override
    public PolicyMove decideAttack(GameView game, PlayerAccount self) {
        PolicyMove move = attacks.poll();
        return move != null ? move : fallback.decideAttack(game, self);
    }

    @Override
    public PolicyMove decideFortify(GameView game, PlayerAccount self) {
        PolicyMove move = fortifies.poll();
        return move != null ? move : fallback.decideFortify(game, self);
    }

    @Override
    public int decideCaptureMove(GameView game, PlayerAccount self, Region from, Region to, int minimum, int maximum) {
        Integer troops = captureMoves.poll();
        return troops != null ? troops : fallback.decideCaptureMove(game, self, from, to, minimum, maximum);
    }

    @Override
    public Optional<List<Card>> decideTrade(GameView game, PlayerAccount self, boolean forced) {
        Optional<List<Card>> trade = trades.poll();
        return trade != null ? trade : fallback.decideTrade(game, self, forced);
    }
}
