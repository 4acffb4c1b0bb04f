package com.poc.tradedata.engine;

import com.poc.tradedata.model.CategoryClass;
import com.poc.tradedata.model.CategoryRules;
import com.poc.tradedata.model.ClassifiedCategory;
import com.poc.tradedata.model.TradeDirection;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies customs item labels ("1. 경공업품", "가. 식료품") and strips their numbering.
 * Export reports keep major and sub headings, import reports keep sub headings only.
 */
public class CategoryNormalizer {

    static final Pattern MAJOR_HEADING = Pattern.compile("^(1|2)\\.\\s*");
    static final Pattern SUB_HEADING = Pattern.compile("^[가-하]\\.\\s*");

    private final CategoryRules rules;

    public CategoryNormalizer(CategoryRules rules) {
        this.rules = rules;
    }

    public CategoryClass classify(String label) {
        if (label == null) return CategoryClass.UNCLASSIFIED;
        if (MAJOR_HEADING.matcher(label).lookingAt()) return CategoryClass.MAJOR_HEADING;
        if (SUB_HEADING.matcher(label).lookingAt()) return CategoryClass.SUB_HEADING;
        return CategoryClass.UNCLASSIFIED;
    }

    public boolean retains(CategoryClass categoryClass, TradeDirection direction) {
        switch (categoryClass) {
            case MAJOR_HEADING:
                return direction == TradeDirection.EXPORT;
            case SUB_HEADING:
                return true;
            default:
                return false;
        }
    }

    /**
     * @return the normalized label, or empty when the direction does not keep this row
     */
    public Optional<ClassifiedCategory> normalize(String label, TradeDirection direction) {
        CategoryClass categoryClass = classify(label);
        if (!retains(categoryClass, direction)) return Optional.empty();

        String relabelled = relabel(label, direction);
        String stripped = MAJOR_HEADING.matcher(relabelled).replaceFirst("");
        stripped = SUB_HEADING.matcher(stripped).replaceFirst("").trim();
        return Optional.of(new ClassifiedCategory(categoryClass, label, stripped));
    }

    String relabel(String label, TradeDirection direction) {
        String trimmed = label.trim();
        for (Map.Entry<String, String> rule : rules.relabels(direction).entrySet()) {
            if (trimmed.startsWith(rule.getKey())) {
                return rule.getValue();
            }
        }
        return label;
    }
}
