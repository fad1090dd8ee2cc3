package com.syntegra.assessment.modules.scoring.key;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Response value to points lookup. Unlisted values earn nothing. */
public record PointsScoringKey(Map<String, BigDecimal> points) implements ScoringKey {

    public PointsScoringKey {
        points = Collections.unmodifiableMap(new LinkedHashMap<>(points));
    }
}
