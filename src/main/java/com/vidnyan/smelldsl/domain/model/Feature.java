package com.vidnyan.smelldsl.domain.model;

import java.util.List;

/**
 * A measurable property of a smell together with the tier names it is
 * classified into. Tier names keep their declaration order.
 */
public record Feature(
    String name,
    List<String> thresholds
) {

    public Feature {
        thresholds = List.copyOf(thresholds);
    }
}
