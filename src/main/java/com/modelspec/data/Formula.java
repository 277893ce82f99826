package com.modelspec.data;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.Value;

/**
 * Model formula of the form {@code outcome ~ a + b} or {@code outcome ~ .}.
 *
 * Only the textual structure is kept here; expanding it against data is the job of a
 * {@link FormulaExpander}.
 */
@Value
public class Formula {

    private static final Pattern FORMULA_PATTERN = Pattern.compile("^\\s*([^~]+?)\\s*~\\s*(.+?)\\s*$");

    @NonNull
    String outcome;

    @NonNull
    List<String> terms;

    public static Formula parse(String text) {
        Matcher matcher = FORMULA_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid formula (expected 'outcome ~ terms'): " + text);
        }
        List<String> terms = new ArrayList<>();
        for (String part : matcher.group(2).split("\\+")) {
            String term = part.trim();
            if (term.isEmpty()) {
                throw new IllegalArgumentException("Empty term in formula: " + text);
            }
            terms.add(term);
        }
        return new Formula(matcher.group(1), List.copyOf(terms));
    }

    /**
     * Formula using every column other than the outcome as a predictor.
     */
    public static Formula allPredictors(String outcome) {
        return new Formula(outcome, List.of("."));
    }

    public boolean usesAllPredictors() {
        return terms.contains(".");
    }

    @Override
    public String toString() {
        return outcome + " ~ " + String.join(" + ", terms);
    }
}
