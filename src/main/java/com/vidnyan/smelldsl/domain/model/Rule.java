package com.vidnyan.smelldsl.domain.model;

/**
 * Detection rule as written in the source.
 *
 * @param name      rule name, unique among rules
 * @param condition condition text rebuilt from its tokens, e.g. {@code Bloater.size > HIGH}
 * @param action    suggested action surfaced when the rule triggers
 */
public record Rule(
    String name,
    String condition,
    String action
) {}
