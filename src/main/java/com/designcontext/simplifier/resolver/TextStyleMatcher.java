package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.mapping.TextStyleMapping;
import com.designcontext.simplifier.util.NamingUtil;

import java.util.List;
import java.util.Optional;

/**
 * Finds the named text style closest to a set of font properties.
 *
 * A candidate qualifies when its family matches (case and whitespace insensitive), its
 * size is within {@link #SIZE_TOLERANCE} and its weight within {@link #WEIGHT_TOLERANCE}.
 * Among qualifying candidates the lowest {@code |dSize| + |dWeight| / 100} wins; ties go
 * to the earlier candidate.
 */
public class TextStyleMatcher {

    public static final double SIZE_TOLERANCE = 1.0;
    public static final double WEIGHT_TOLERANCE = 100.0;

    public Optional<TextStyleMapping> nearest(String fontFamily, Double fontSize, Double fontWeight,
                                              List<TextStyleMapping> candidates) {
        if (fontFamily == null || fontSize == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        String family = NamingUtil.normalizeFamily(fontFamily);
        TextStyleMapping best = null;
        double bestScore = Double.MAX_VALUE;
        for (TextStyleMapping candidate : candidates) {
            if (candidate.getFontFamily() == null || candidate.getFontSize() == null) {
                continue;
            }
            if (!family.equals(NamingUtil.normalizeFamily(candidate.getFontFamily()))) {
                continue;
            }
            double sizeDelta = Math.abs(candidate.getFontSize() - fontSize);
            if (sizeDelta > SIZE_TOLERANCE) {
                continue;
            }
            double weightDelta = 0;
            if (fontWeight != null && candidate.getFontWeight() != null) {
                weightDelta = Math.abs(candidate.getFontWeight() - fontWeight);
                if (weightDelta > WEIGHT_TOLERANCE) {
                    continue;
                }
            }
            double score = sizeDelta + weightDelta / 100.0;
            if (score < bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }
}
