package com.shadows.core.generator;

/**
 * Values substituted into {@code {placeholder}} tokens of mission text.
 * Numeric fields are nullable and fall back to fixed defaults when interpolated.
 */
public record TemplateContext(
    String location,
    String target,
    String victim,
    String mystery,
    String item,
    String items,
    String enemies,
    Integer count,
    Integer half,
    Integer total,
    Integer rounds
) {

    public TemplateContext withAmounts(Integer newCount, Integer newHalf, Integer newTotal, Integer newRounds) {
        return new TemplateContext(location, target, victim, mystery, item, items, enemies,
                newCount, newHalf, newTotal, newRounds);
    }

    public String interpolate(String template) {
        if (template == null) {
            return null;
        }
        return template
                .replace("{location}", location)
                .replace("{target}", target)
                .replace("{victim}", victim)
                .replace("{mystery}", mystery)
                .replace("{items}", items)
                .replace("{item}", item)
                .replace("{enemies}", enemies != null ? enemies : "enemies")
                .replace("{count}", String.valueOf(count != null ? count : 1))
                .replace("{half}", String.valueOf(half != null ? half : 5))
                .replace("{total}", String.valueOf(total != null ? total : 10))
                .replace("{rounds}", String.valueOf(rounds != null ? rounds : 10));
    }
}
