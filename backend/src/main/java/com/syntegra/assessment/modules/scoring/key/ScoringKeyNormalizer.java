package com.syntegra.assessment.modules.scoring.key;

import com.syntegra.assessment.modules.catalog.QuestionType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns an authored scoring key into a {@link ScoringKey}.
 * <p>
 * Authored keys come in two shapes: {@code {"trait": "dominance"}} for
 * personality items, or a map scoring open responses. Open response types
 * accept {@code {"expected": value, "score": n}} or a map whose values are
 * all numeric. Choice and rating types only honour the trait form; their
 * points come from the options. Anything else normalizes to
 * {@link NoScoringKey}.
 */
@Slf4j
public final class ScoringKeyNormalizer {

    private ScoringKeyNormalizer() {
    }

    public static ScoringKey normalize(QuestionType type, Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return NoScoringKey.INSTANCE;
        }

        Object trait = raw.get("trait");
        if (trait instanceof String name && !name.isBlank()) {
            return new TraitScoringKey(name.trim().toLowerCase(Locale.ROOT));
        }

        if (!acceptsValueKeys(type)) {
            log.debug("Ignoring non-trait scoring key for {} question: {}", type, raw.keySet());
            return NoScoringKey.INSTANCE;
        }

        if (raw.containsKey("expected")) {
            BigDecimal points = raw.get("score") instanceof Number n
                    ? new BigDecimal(n.toString())
                    : BigDecimal.ONE;
            return new ExpectedValueScoringKey(raw.get("expected"), points);
        }

        Map<String, BigDecimal> points = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof Number n)) {
                log.warn("Unrecognised scoring key shape for {} question: {}", type, raw.keySet());
                return NoScoringKey.INSTANCE;
            }
            points.put(entry.getKey(), new BigDecimal(n.toString()));
        }
        return new PointsScoringKey(points);
    }

    private static boolean acceptsValueKeys(QuestionType type) {
        return switch (type) {
            case TEXT, DRAWING, SEQUENCE, MATRIX -> true;
            case MULTIPLE_CHOICE, TRUE_FALSE, RATING_SCALE -> false;
        };
    }
}
