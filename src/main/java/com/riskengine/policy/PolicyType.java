package com.riskengine.policy;

/**
 * Decision policy variants a player can be created with.
 */
public enum PolicyType {
    PASSIVE,
    RANDOM,
    GREEDY,
    SCRIPTED
}
