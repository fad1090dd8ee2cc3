package com.syntegra.assessment.modules.result;

import com.syntegra.assessment.modules.catalog.TestCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed trait sets of the personality inventories. Categories without an
 * entry produce no trait profile.
 */
public final class TraitTaxonomy {

    public record TraitDefinition(String key, String name, String description) {
    }

    private static final Map<TestCategory, List<TraitDefinition>> TRAITS = new EnumMap<>(TestCategory.class);

    static {
        TRAITS.put(TestCategory.DISC, List.of(
                new TraitDefinition("dominance", "Dominance",
                        "Assertive, results-oriented, strong-willed, and forceful"),
                new TraitDefinition("influence", "Influence",
                        "Enthusiastic, optimistic, open, trusting, and energetic"),
                new TraitDefinition("steadiness", "Steadiness",
                        "Even-tempered, accommodating, patient, humble, and tactful"),
                new TraitDefinition("compliance", "Compliance",
                        "Private, analytical, logical, critical, and reserved")));

        TRAITS.put(TestCategory.MBTI, List.of(
                new TraitDefinition("extraversion", "Extraversion",
                        "Outgoing, energetic, assertive, and sociable"),
                new TraitDefinition("sensing", "Sensing",
                        "Practical, realistic, detailed, and factual"),
                new TraitDefinition("thinking", "Thinking",
                        "Logical, analytical, objective, and critical"),
                new TraitDefinition("judging", "Judging",
                        "Organized, decisive, scheduled, and structured")));

        TRAITS.put(TestCategory.BIG_FIVE, List.of(
                new TraitDefinition("openness", "Openness",
                        "Creative, curious, open to new experiences and ideas"),
                new TraitDefinition("conscientiousness", "Conscientiousness",
                        "Organized, responsible, dependable, and achievement-oriented"),
                new TraitDefinition("extraversion", "Extraversion",
                        "Sociable, assertive, energetic, and outgoing"),
                new TraitDefinition("agreeableness", "Agreeableness",
                        "Cooperative, trusting, helpful, and good-natured"),
                new TraitDefinition("neuroticism", "Neuroticism",
                        "Anxious, emotionally reactive, and prone to negative emotions")));

        TRAITS.put(TestCategory.EPPS, List.of(
                new TraitDefinition("achievement", "Achievement",
                        "Driven to accomplish difficult tasks and excel"),
                new TraitDefinition("deference", "Deference",
                        "Respectful to authority and willing to follow others"),
                new TraitDefinition("order", "Order",
                        "Organized, neat, and values structure and planning"),
                new TraitDefinition("exhibition", "Exhibition",
                        "Enjoys being the center of attention and impressing others"),
                new TraitDefinition("autonomy", "Autonomy",
                        "Independent, self-reliant, and values freedom"),
                new TraitDefinition("affiliation", "Affiliation",
                        "Enjoys close relationships and being part of groups"),
                new TraitDefinition("intraception", "Intraception",
                        "Analytical, introspective, and interested in understanding motives"),
                new TraitDefinition("succorance", "Succorance",
                        "Seeks help and support from others when needed"),
                new TraitDefinition("dominance", "Dominance",
                        "Assertive, influential, and enjoys leading others"),
                new TraitDefinition("abasement", "Abasement",
                        "Self-critical, accepts blame, and feels inferior at times"),
                new TraitDefinition("nurturance", "Nurturance",
                        "Caring, helpful, and enjoys taking care of others"),
                new TraitDefinition("change", "Change",
                        "Enjoys variety, novelty, and new experiences"),
                new TraitDefinition("endurance", "Endurance",
                        "Persistent, determined, and works hard to completion"),
                new TraitDefinition("heterosexuality", "Heterosexuality",
                        "Interested in and attracted to the opposite sex"),
                new TraitDefinition("aggression", "Aggression",
                        "Competitive, argumentative, and easily angered")));
    }

    private TraitTaxonomy() {
    }

    public static List<TraitDefinition> traitsOf(TestCategory category) {
        if (category == null) {
            return List.of();
        }
        return TRAITS.getOrDefault(category, List.of());
    }
}
