package com.rcatrail.service;

import com.rcatrail.model.ErrorCategory;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies a free-text log message into an {@link ErrorCategory}.
 *
 * Rules are evaluated top to bottom, case-insensitively; the first match wins and
 * no match yields UNCATEGORIZED. The default order is:
 *
 *   1. timeout      timeout | timed out | deadline exceeded
 *   2. validation   validation | invalid | missing required | constraint
 *   3. database     database | sql | deadlock | transaction | connection
 *   4. calculation  calculation | compute | division by zero | nan | infinity
 *
 * Order matters: "calculation exceeded timeout" is a timeout, and
 * "transaction failed validation" is a validation error.
 *
 * New rules are only ever appended ({@link #withRule}), so a message already
 * matched by an existing rule keeps its category.
 */
@Component
public class ErrorCategorizer {

    private static final List<CategoryRule> DEFAULT_RULES = List.of(
            CategoryRule.of(ErrorCategory.TIMEOUT, "timeout|timed out|deadline exceeded"),
            CategoryRule.of(ErrorCategory.VALIDATION, "validation|invalid|missing required|constraint"),
            CategoryRule.of(ErrorCategory.DATABASE, "database|sql|deadlock|transaction|connection"),
            CategoryRule.of(ErrorCategory.CALCULATION, "calculation|compute|division by zero|\\bnan\\b|infinity")
    );

    @Getter
    private final List<CategoryRule> rules;

    public ErrorCategorizer() {
        this(DEFAULT_RULES);
    }

    public ErrorCategorizer(List<CategoryRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public ErrorCategory categorize(String message) {
        if (message == null || message.isBlank()) {
            return ErrorCategory.UNCATEGORIZED;
        }
        for (CategoryRule rule : rules) {
            if (rule.matches(message)) {
                return rule.getCategory();
            }
        }
        return ErrorCategory.UNCATEGORIZED;
    }

    /**
     * Returns a categorizer with the rule appended at the lowest priority.
     */
    public ErrorCategorizer withRule(CategoryRule rule) {
        List<CategoryRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new ErrorCategorizer(extended);
    }

    @Getter
    public static final class CategoryRule {

        private final ErrorCategory category;
        private final Pattern pattern;

        private CategoryRule(ErrorCategory category, Pattern pattern) {
            this.category = category;
            this.pattern = pattern;
        }

        public static CategoryRule of(ErrorCategory category, String regex) {
            return new CategoryRule(category, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }

        boolean matches(String message) {
            return pattern.matcher(message).find();
        }
    }
}
