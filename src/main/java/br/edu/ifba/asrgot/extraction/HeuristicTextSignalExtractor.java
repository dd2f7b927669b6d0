package br.edu.ifba.asrgot.extraction;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.EvidenceDetails;
import br.edu.ifba.asrgot.core.EvidenceQuality;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and marker based {@link TextSignalExtractor}.
 *
 * <p>Markers are matched case-insensitively. Numeric scores start from a base of 0.5,
 * are shifted by the keywords found, and are clamped to [0.0, 1.0].</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class HeuristicTextSignalExtractor implements TextSignalExtractor {

    private static final Logger logger = LoggerFactory.getLogger(HeuristicTextSignalExtractor.class);

    private static final double BASE_SCORE = 0.5;

    private static final Pattern FIELD = Pattern.compile("field[s]?[:\\-]\\s*([^\\n\\r,.]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern OBJECTIVES = Pattern.compile(
        "(?:objective[s]?|obj|goals?)[:\\-][ \\t]*([^\\n\\r]*(?:\\r?\\n[ \\t]*[-•*][^\\n\\r]*)*)",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern BULLET = Pattern.compile("^[-•*]\\s*");

    /** A decimal number; a trailing sentence period is not part of it. */
    private static final String DECIMAL = "(\\d+(?:\\.\\d+)?|\\.\\d+)";

    private static final Pattern STATISTICAL_POWER = Pattern.compile("statistical power[^:]*:\\s*" + DECIMAL, Pattern.CASE_INSENSITIVE);
    private static final Pattern SAMPLE_SIZE = Pattern.compile("sample size[^:]*:\\s*(\\d{1,3}(?:,\\d{3})+|\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EFFECT_SIZE = Pattern.compile("effect size[^:]*:\\s*" + DECIMAL, Pattern.CASE_INSENSITIVE);
    private static final Pattern P_VALUE_LABELLED = Pattern.compile("p[- ]value[^:]*:\\s*" + DECIMAL, Pattern.CASE_INSENSITIVE);
    private static final Pattern P_VALUE_INEQUALITY = Pattern.compile("p\\s*[<>]\\s*" + DECIMAL, Pattern.CASE_INSENSITIVE);

    private static final Pattern RCT = Pattern.compile("\\brct\\b");

    private static final Pattern HEADING_LINE = Pattern.compile(
        "^\\s*(?:#{1,6}\\s+.+|\\*\\*[^*]+\\*\\*\\s*:?\\s*|[A-Za-z][A-Za-z _/-]{0,40}:\\s*"
            + "|(?:\\*\\*)?[A-Za-z][A-Za-z ]{0,30}\\s\\d+(?:\\*\\*)?\\s*:.*)$");

    // =========================================================================
    // Research context
    // =========================================================================

    @Override
    @NotNull
    public String extractField(@Nullable String text) {
        if (isBlank(text)) {
            return DEFAULT_FIELD;
        }
        Matcher matcher = FIELD.matcher(text);
        if (matcher.find()) {
            String field = stripMarkdown(matcher.group(1)).trim();
            if (!field.isEmpty()) {
                return field;
            }
        }
        logger.debug("No field marker found, using default field");
        return DEFAULT_FIELD;
    }

    @Override
    @NotNull
    public List<String> extractObjectives(@Nullable String text) {
        if (isBlank(text)) {
            return DEFAULT_OBJECTIVES;
        }
        Matcher matcher = OBJECTIVES.matcher(text);
        List<String> objectives = new ArrayList<>();
        while (matcher.find()) {
            objectives.addAll(splitItems(matcher.group(1)));
        }
        if (objectives.isEmpty()) {
            logger.debug("No objectives marker found, using default objectives");
            return DEFAULT_OBJECTIVES;
        }
        return objectives;
    }

    @Override
    @NotNull
    public String extractDimensionContent(@Nullable String text, @NotNull String category, @NotNull String field) {
        String fallback = category + " analysis for " + field + " research context";
        if (isBlank(text)) {
            return fallback;
        }
        Pattern pattern = Pattern.compile(
            Pattern.quote(category) + "[:\\s]*([^\\n]+)(?=\\n\\n|\\n[a-zA-Z_]+:|$)",
            Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(stripMarkdown(text));
        if (matcher.find()) {
            String content = matcher.group(1).trim();
            if (!content.isEmpty()) {
                return content;
            }
        }
        return fallback;
    }

    @Override
    @NotNull
    public String extractHypothesisContent(@Nullable String text, int index, @NotNull String field) {
        String fallback = "Hypothesis " + index + " for " + field + " research context";
        return firstMatch(text, List.of(
            "hypothesis_" + index + "[:\\s]*([^\\n\\r]+)",
            "\\bh" + index + "\\b[:\\s]*([^\\n\\r]+)",
            "hypothesis\\s*" + index + "\\b[:\\s]*([^\\n\\r]+)"
        )).orElse(fallback);
    }

    @Override
    @NotNull
    public String extractFalsificationCriteria(@Nullable String text, int index, @NotNull String field) {
        String fallback = "Specific testable criteria for Hypothesis " + index + " in " + field + " research context";
        return firstMatch(text, List.of(
            "falsification_" + index + "[:\\s]*([^\\n\\r]+)",
            "\\bf" + index + "\\b[:\\s]*([^\\n\\r]+)",
            "falsification(?:\\s+criteria)?\\s*" + index + "\\b[:\\s]*([^\\n\\r]+)"
        )).orElse(fallback);
    }

    // =========================================================================
    // Statistical power and confidence dimensions
    // =========================================================================

    @Override
    public double extractStatisticalPower(@Nullable String text) {
        if (isBlank(text)) {
            return DEFAULT_STATISTICAL_POWER;
        }

        Double explicitPower = parseNumber(STATISTICAL_POWER, text);
        if (explicitPower != null) {
            return ConfidenceVector.clamp(explicitPower);
        }

        double power = BASE_SCORE;

        Double sampleSize = parseNumber(SAMPLE_SIZE, text);
        if (sampleSize != null) {
            if (sampleSize > 1000) power += 0.2;
            else if (sampleSize > 300) power += 0.15;
            else if (sampleSize > 100) power += 0.1;
            else if (sampleSize < 30) power -= 0.2;
        }

        Double effectSize = parseNumber(EFFECT_SIZE, text);
        if (effectSize != null) {
            if (effectSize > 0.8) power += 0.15;
            else if (effectSize > 0.5) power += 0.1;
            else if (effectSize > 0.2) power += 0.05;
            else power -= 0.1;
        }

        Double pValue = parseNumber(P_VALUE_LABELLED, text);
        if (pValue == null) {
            pValue = parseNumber(P_VALUE_INEQUALITY, text);
        }
        if (pValue != null) {
            if (pValue < 0.01) power += 0.15;
            else if (pValue < 0.05) power += 0.1;
            else if (pValue < 0.1) power += 0.05;
            else power -= 0.1;
        }

        String lower = lower(text);
        if (lower.contains("randomized controlled trial") || RCT.matcher(lower).find()) {
            power += 0.15;
        } else if (lower.contains("meta-analysis")) {
            power += 0.2;
        } else if (lower.contains("case study") || lower.contains("anecdotal")) {
            power -= 0.2;
        }

        if (lower.contains("peer-reviewed") || lower.contains("published")) {
            power += 0.1;
        }

        return ConfidenceVector.clamp(power);
    }

    @Override
    public double extractEmpiricalSupport(@Nullable String text) {
        if (isBlank(text)) {
            return ConfidenceVector.DEFAULT.empiricalSupport();
        }
        String lower = lower(text);
        double score = BASE_SCORE;

        if (lower.contains("meta-analysis")) score += 0.3;
        else if (lower.contains("randomized controlled trial") || RCT.matcher(lower).find()) score += 0.25;
        else if (lower.contains("cohort study")) score += 0.2;
        else if (lower.contains("case study")) score -= 0.2;

        if (lower.contains("large sample") || lower.contains("n > 1000")) score += 0.15;
        else if (lower.contains("small sample") || lower.contains("n < 30")) score -= 0.15;

        if (lower.contains("p < 0.001")) score += 0.15;
        else if (lower.contains("p < 0.01")) score += 0.1;
        else if (lower.contains("p < 0.05")) score += 0.05;
        else if (lower.contains("not significant")) score -= 0.2;

        return ConfidenceVector.clamp(score);
    }

    @Override
    public double extractTheoreticalBasis(@Nullable String text) {
        if (isBlank(text)) {
            return ConfidenceVector.DEFAULT.theoreticalBasis();
        }
        String lower = lower(text);
        double score = BASE_SCORE;

        if (containsAny(lower, "well-established theory", "theoretical framework")) score += 0.2;
        if (containsAny(lower, "novel approach", "innovative")) score += 0.15;
        if (lower.contains("established principles")) score += 0.1;
        if (containsAny(lower, "theoretical gap", "lacks theory")) score -= 0.2;

        if (containsAny(lower, "extensively cited", "foundational work")) score += 0.15;
        if (containsAny(lower, "limited citations", "few references")) score -= 0.1;

        return ConfidenceVector.clamp(score);
    }

    @Override
    public double extractMethodologicalRigor(@Nullable String text) {
        if (isBlank(text)) {
            return ConfidenceVector.DEFAULT.methodologicalRigor();
        }
        String lower = lower(text);
        double score = BASE_SCORE;

        if (containsAny(lower, "rigorous methodology", "well-designed")) score += 0.2;
        if (containsAny(lower, "controlled for confounders", "adjusted for")) score += 0.15;
        if (containsAny(lower, "blinded", "double-blind")) score += 0.15;
        if (containsAny(lower, "validated measures", "standardized")) score += 0.1;

        if (containsAny(lower, "methodological limitations", "potential bias")) score -= 0.15;
        if (containsAny(lower, "selection bias", "confounding")) score -= 0.1;
        if (containsAny(lower, "poor methodology", "flawed design")) score -= 0.25;

        return ConfidenceVector.clamp(score);
    }

    @Override
    public double extractConsensusAlignment(@Nullable String text) {
        if (isBlank(text)) {
            return ConfidenceVector.DEFAULT.consensusAlignment();
        }
        String lower = lower(text);
        double score = BASE_SCORE;

        if (containsAny(lower, "scientific consensus", "widely accepted")) score += 0.25;
        if (containsAny(lower, "expert agreement", "professional consensus")) score += 0.2;
        if (containsAny(lower, "replicated findings", "consistent results")) score += 0.15;
        if (lower.contains("multiple studies confirm")) score += 0.1;

        if (containsAny(lower, "controversial", "disputed")) score -= 0.2;
        if (containsAny(lower, "conflicting evidence", "mixed results")) score -= 0.15;
        if (containsAny(lower, "preliminary findings", "needs replication")) score -= 0.1;

        return ConfidenceVector.clamp(score);
    }

    @Override
    @NotNull
    public ConfidenceVector parseConfidenceVector(@Nullable String text) {
        if (isBlank(text)) {
            return ConfidenceVector.DEFAULT;
        }
        return new ConfidenceVector(
            extractEmpiricalSupport(text),
            extractTheoreticalBasis(text),
            extractMethodologicalRigor(text),
            extractConsensusAlignment(text)
        );
    }

    // =========================================================================
    // Evidence classification
    // =========================================================================

    @Override
    @NotNull
    public EvidenceQuality assessEvidenceQuality(@Nullable String text) {
        return EvidenceQuality.fromPower(extractStatisticalPower(text));
    }

    @Override
    @NotNull
    public String detectPeerReviewStatus(@Nullable String text) {
        if (isBlank(text)) {
            return EvidenceDetails.UNKNOWN;
        }
        String lower = lower(text);
        if (containsAny(lower, "peer-reviewed", "peer reviewed", "published in")) {
            return EvidenceDetails.PEER_REVIEWED;
        }
        if (containsAny(lower, "preprint", "arxiv", "biorxiv", "medrxiv")) {
            return EvidenceDetails.PREPRINT;
        }
        return EvidenceDetails.UNKNOWN;
    }

    @Override
    @NotNull
    public Optional<EdgeType> detectRelationType(@Nullable String text) {
        if (isBlank(text)) {
            return Optional.empty();
        }
        String lower = lower(text);
        if (containsAny(lower, "causal_direct", "direct causal", "causal_counterfactual", "counterfactual",
                "causal_confounded", "confounded")) {
            return Optional.of(EdgeType.CAUSAL);
        }
        if (containsAny(lower, "contradictory", "contradicts")) {
            return Optional.of(EdgeType.CONTRADICTORY);
        }
        if (containsAny(lower, "correlative", "correlation")) {
            return Optional.of(EdgeType.CORRELATIVE);
        }
        if (containsAny(lower, "temporal precedence", "temporal order", "precedes")) {
            return Optional.of(EdgeType.TEMPORAL);
        }
        return Optional.empty();
    }

    @Override
    @NotNull
    public Optional<String> extractSection(@Nullable String text, @NotNull String heading) {
        if (isBlank(text)) {
            return Optional.empty();
        }
        String wanted = normalizeHeading(heading);
        String[] lines = text.split("\\r?\\n");
        StringBuilder body = new StringBuilder();
        boolean inSection = false;

        for (String line : lines) {
            String normalized = normalizeHeading(line);
            if (!inSection) {
                if (!normalized.startsWith(wanted)) {
                    continue;
                }
                inSection = true;
                int colon = line.indexOf(':');
                if (colon >= 0 && colon < line.length() - 1) {
                    String rest = stripMarkdown(line.substring(colon + 1)).trim();
                    if (!rest.isEmpty()) {
                        body.append(rest).append('\n');
                    }
                }
                continue;
            }
            if (HEADING_LINE.matcher(line).matches()) {
                break;
            }
            body.append(line).append('\n');
        }

        String section = body.toString().trim();
        return section.isEmpty() ? Optional.empty() : Optional.of(section);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static Optional<String> firstMatch(@Nullable String text, List<String> regexes) {
        if (isBlank(text)) {
            return Optional.empty();
        }
        String cleaned = stripMarkdown(text);
        for (String regex : regexes) {
            Matcher matcher = Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(cleaned);
            if (matcher.find()) {
                String value = matcher.group(1).trim();
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> splitItems(String raw) {
        String separator;
        if (raw.contains(",")) {
            separator = ",";
        } else if (raw.contains(";")) {
            separator = ";";
        } else {
            separator = "\\r?\\n";
        }
        List<String> items = new ArrayList<>();
        for (String item : raw.split(separator)) {
            String cleaned = BULLET.matcher(item.trim()).replaceFirst("").trim();
            if (!cleaned.isEmpty()) {
                items.add(cleaned);
            }
        }
        return items;
    }

    @Nullable
    private static Double parseNumber(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return Double.parseDouble(matcher.group(1).replace(",", ""));
    }

    private static String normalizeHeading(String line) {
        return line.replaceAll("[#*:_]", " ").trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String stripMarkdown(String text) {
        return text.replace("**", "").replace("__", "");
    }

    private static boolean containsAny(String lower, String... needles) {
        for (String needle : needles) {
            if (lower.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(@Nullable String text) {
        return text == null || text.isBlank();
    }
}
