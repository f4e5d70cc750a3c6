package dev.flows.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in evaluation criteria and the named sets gates usually pick from.
 */
public final class CriteriaLibrary {

    private static final Logger log = LoggerFactory.getLogger(CriteriaLibrary.class);

    /** Minimum score a required criterion needs on its own. */
    public static final double REQUIRED_FLOOR = 0.7;

    // Code quality
    public static final EvaluationCriterion CODE_CORRECTNESS = new EvaluationCriterion("code_correctness",
        "Code is syntactically correct and would compile/run without errors. Check for syntax errors, "
            + "type mismatches, and logical correctness.",
        2.0, true, CriterionCategory.CORRECTNESS);
    public static final EvaluationCriterion CODE_COMPLETENESS = new EvaluationCriterion("code_completeness",
        "All requirements from the prompt are addressed. Implementation covers all requested functionality "
            + "without missing features.",
        1.5, true, CriterionCategory.COMPLETENESS);
    public static final EvaluationCriterion HAS_TESTS = new EvaluationCriterion("has_tests",
        "Implementation includes appropriate test coverage. Tests cover main functionality, edge cases, "
            + "and error scenarios.",
        1.0, false, CriterionCategory.QUALITY);
    public static final EvaluationCriterion FOLLOWS_CONVENTIONS = new EvaluationCriterion("follows_conventions",
        "Code follows project style and naming conventions. Consistent formatting, meaningful variable names, "
            + "and idiomatic patterns.",
        0.8, false, CriterionCategory.STYLE);
    public static final EvaluationCriterion NO_SECURITY_ISSUES = new EvaluationCriterion("no_security_issues",
        "No obvious security vulnerabilities. Checks for injection risks, exposed secrets, insecure patterns, "
            + "and unsafe operations.",
        2.0, true, CriterionCategory.SECURITY);
    public static final EvaluationCriterion ERROR_HANDLING = new EvaluationCriterion("error_handling",
        "Proper error handling is implemented. Errors are caught, logged appropriately, and meaningful "
            + "messages are provided.",
        1.0, false, CriterionCategory.QUALITY);

    // Content quality
    public static final EvaluationCriterion CLARITY = new EvaluationCriterion("clarity",
        "Output is clear, well-organized, and understandable. Logical structure, good formatting, "
            + "and easy to follow.",
        1.0, false, CriterionCategory.QUALITY);
    public static final EvaluationCriterion ACCURACY = new EvaluationCriterion("accuracy",
        "Information provided is factually correct and accurate. No hallucinations or incorrect statements.",
        2.0, true, CriterionCategory.CORRECTNESS);
    public static final EvaluationCriterion RELEVANCE = new EvaluationCriterion("relevance",
        "Response is relevant to the original request. Directly addresses the question without "
            + "unnecessary tangents.",
        1.2, false, CriterionCategory.COMPLETENESS);
    public static final EvaluationCriterion CONCISENESS = new EvaluationCriterion("conciseness",
        "Response is appropriately concise without unnecessary verbosity. Information is presented efficiently.",
        0.5, false, CriterionCategory.STYLE);

    // Technical documentation
    public static final EvaluationCriterion DOCUMENTATION_QUALITY = new EvaluationCriterion("documentation_quality",
        "Documentation is clear, comprehensive, and follows best practices. Includes examples where appropriate.",
        1.0, false, CriterionCategory.QUALITY);
    public static final EvaluationCriterion API_CONSISTENCY = new EvaluationCriterion("api_consistency",
        "API design is consistent with existing patterns. Follows established conventions and naming schemes.",
        0.8, false, CriterionCategory.STYLE);

    // Performance
    public static final EvaluationCriterion PERFORMANCE_CONSIDERATIONS = new EvaluationCriterion(
        "performance_considerations",
        "Implementation considers performance implications. Avoids obvious inefficiencies and uses "
            + "appropriate algorithms.",
        0.7, false, CriterionCategory.PERFORMANCE);
    public static final EvaluationCriterion SCALABILITY = new EvaluationCriterion("scalability",
        "Solution can scale appropriately. Handles edge cases like empty inputs and large datasets.",
        0.5, false, CriterionCategory.PERFORMANCE);

    private static final Map<String, EvaluationCriterion> BY_NAME = index(List.of(
        CODE_CORRECTNESS, CODE_COMPLETENESS, HAS_TESTS, FOLLOWS_CONVENTIONS, NO_SECURITY_ISSUES, ERROR_HANDLING,
        CLARITY, ACCURACY, RELEVANCE, CONCISENESS, DOCUMENTATION_QUALITY, API_CONSISTENCY,
        PERFORMANCE_CONSIDERATIONS, SCALABILITY));

    private static final Map<String, List<EvaluationCriterion>> SETS = sets();

    private CriteriaLibrary() {}

    public static Collection<EvaluationCriterion> all() {
        return BY_NAME.values();
    }

    /**
     * Look up a built-in criterion. Case and dashes are ignored: {@code Code-Correctness}
     * finds {@code code_correctness}.
     */
    public static Optional<EvaluationCriterion> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(normalize(name)));
    }

    /**
     * Resolve criterion names in order. Unknown names are dropped with a warning.
     */
    public static List<EvaluationCriterion> byNames(List<String> names) {
        List<EvaluationCriterion> resolved = new ArrayList<>();
        for (String name : names) {
            byName(name).ifPresentOrElse(resolved::add, () -> log.warn("Unknown criterion: {}", name));
        }
        return resolved;
    }

    /** Names of the predefined criterion sets ({@code CODE_REVIEW}, {@code MINIMAL_GATE}, ...). */
    public static Collection<String> setNames() {
        return SETS.keySet();
    }

    public static Optional<List<EvaluationCriterion>> criterionSet(String setName) {
        return Optional.ofNullable(SETS.get(setName.toUpperCase(Locale.ROOT).replace('-', '_')));
    }

    /**
     * Weighted mean of the scores the judge returned, over the criteria it scored. Zero when
     * it scored none of them.
     */
    public static double weightedScore(Map<String, CriterionResult> results, List<EvaluationCriterion> criteria) {
        double totalWeight = 0;
        double weightedSum = 0;
        for (EvaluationCriterion criterion : criteria) {
            CriterionResult result = results.get(criterion.name());
            if (result != null) {
                weightedSum += result.score() * criterion.weight();
                totalWeight += criterion.weight();
            }
        }
        return totalWeight > 0 ? weightedSum / totalWeight : 0;
    }

    /**
     * True when every required criterion was scored at least {@code floor}. A required
     * criterion the judge did not score fails.
     */
    public static boolean requiredCriteriaPassed(Map<String, CriterionResult> results,
                                                 List<EvaluationCriterion> criteria,
                                                 double floor) {
        for (EvaluationCriterion criterion : criteria) {
            if (criterion.required()) {
                CriterionResult result = results.get(criterion.name());
                if (result == null || result.score() < floor) {
                    return false;
                }
            }
        }
        return true;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static Map<String, EvaluationCriterion> index(List<EvaluationCriterion> criteria) {
        var map = new LinkedHashMap<String, EvaluationCriterion>();
        criteria.forEach(c -> map.put(c.name(), c));
        return map;
    }

    private static Map<String, List<EvaluationCriterion>> sets() {
        var sets = new LinkedHashMap<String, List<EvaluationCriterion>>();
        sets.put("CODE_REVIEW", List.of(
            CODE_CORRECTNESS, CODE_COMPLETENESS, FOLLOWS_CONVENTIONS, ERROR_HANDLING, NO_SECURITY_ISSUES));
        sets.put("CODE_REVIEW_FULL", List.of(
            CODE_CORRECTNESS, CODE_COMPLETENESS, HAS_TESTS, FOLLOWS_CONVENTIONS, ERROR_HANDLING,
            NO_SECURITY_ISSUES, DOCUMENTATION_QUALITY, PERFORMANCE_CONSIDERATIONS));
        sets.put("SECURITY_REVIEW", List.of(NO_SECURITY_ISSUES, ERROR_HANDLING, CODE_CORRECTNESS));
        sets.put("CONTENT_QUALITY", List.of(CLARITY, ACCURACY, RELEVANCE, CONCISENESS, DOCUMENTATION_QUALITY));
        sets.put("MINIMAL_GATE", List.of(CODE_CORRECTNESS, ACCURACY, RELEVANCE));
        sets.put("API_REVIEW", List.of(CODE_CORRECTNESS, API_CONSISTENCY, DOCUMENTATION_QUALITY, ERROR_HANDLING));
        return sets;
    }
}
