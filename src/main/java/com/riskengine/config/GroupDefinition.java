package com.riskengine.config;

import java.util.List;

/**
 * A group of regions that pays {@code bonus} troops per turn to a player holding all of them.
 */
public record GroupDefinition(
        int bonus,
        List<String> territories
) {}
