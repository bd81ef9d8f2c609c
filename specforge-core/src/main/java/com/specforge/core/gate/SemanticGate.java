package com.specforge.core.gate;

import com.specforge.core.model.Complexity;
import com.specforge.core.model.FunctionalRequirement;
import com.specforge.core.model.Specification;
import com.specforge.core.parser.SectionKeys;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * G2: content quality. Placeholder vocabulary, validation criteria, Given/When/Then
 * acceptance criteria, a quantifiable success metric and security coverage.
 */
public final class SemanticGate implements Gate {

    public static final String VAGUE_TERM = "G2_VAGUE_TERM";
    public static final String MISSING_VALIDATION = "G2_MISSING_VALIDATION_CRITERIA";
    public static final String AC_FORMAT = "G2_AC_NOT_GIVEN_WHEN_THEN";
    public static final String NO_METRIC = "G2_NO_QUANTIFIABLE_METRIC";
    public static final String SECURITY_INCOMPLETE = "G2_SECURITY_INCOMPLETE";
    public static final String SECURITY_MISSING = "G2_SECURITY_MISSING";

    /** Placeholder vocabulary; matched case-insensitively on word boundaries. */
    static final List<String> VAGUE_TERMS = List.of(
        "TBD", "TODO", "FIXME", "[FILL IN]", "[TBD]", "ASAP", "as soon as possible", "nice to have");

    private static final Pattern FENCED_BLOCK = Pattern.compile("```.*?```", Pattern.DOTALL);

    private static final Pattern GIVEN = word("given");
    private static final Pattern WHEN = word("when");
    private static final Pattern THEN = word("then");

    private static final Pattern METRIC_WITH_UNIT = Pattern.compile(
        "\\d+(?:\\.\\d+)?\\s*(?:%|ms\\b|milliseconds?\\b|s\\b|secs?\\b|seconds?\\b|minutes?\\b|mins?\\b|hours?\\b|days?\\b"
            + "|users?\\b|requests?\\b|rps\\b|qps\\b|tps\\b|x\\b|times\\b|items?\\b|records?\\b)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern METRIC_LINE = Pattern.compile(
        "(?im)^.*\\b(?:metric|target|success|goal|kpi|sla|slo)\\w*\\b.*\\d.*$");

    private static final Pattern AUTHENTICATION = Pattern.compile(
        "authenticat|\\bauthn\\b|\\boauth|\\bsso\\b|single sign-on|\\blogin\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AUTHORIZATION = Pattern.compile(
        "authoriz|authoris|\\bauthz\\b|access control|\\brbac\\b|\\babac\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROLE = word("roles?");
    private static final Pattern PERMISSION = word("permissions?");

    @Override
    public GateId id() {
        return GateId.G2;
    }

    @Override
    public GateResult evaluate(Specification spec) {
        GateReport report = new GateReport(GateId.G2);
        checkVagueTerms(spec, report);
        checkValidationCriteria(spec, report);
        checkAcceptanceCriteria(spec, report);
        checkMetric(spec, report);
        checkSecurity(spec, report);
        return report.result();
    }

    private static void checkVagueTerms(Specification spec, GateReport report) {
        String text = blankFences(spec.raw());
        int found = 0;
        for (String term : VAGUE_TERMS) {
            Matcher matcher = termPattern(term).matcher(text);
            if (matcher.find()) {
                found++;
                report.violation(VAGUE_TERM, "Vague or placeholder term found: '" + term + "'",
                    "line " + lineOf(text, matcher.start()));
            }
        }
        report.summary("No vague or placeholder terms", found == 0,
            found == 0 ? "No vague terms found" : found + " vague term(s) found");
    }

    private static void checkValidationCriteria(Specification spec, GateReport report) {
        List<FunctionalRequirement> missing = spec.functionalRequirements().stream()
            .filter(fr -> fr.validationCriteria().isEmpty())
            .toList();
        missing.forEach(fr -> report.violation(MISSING_VALIDATION,
            fr.id() + " has no validation criteria", fr.id()));
        report.summary("All functional requirements have validation criteria", missing.isEmpty(),
            missing.isEmpty()
                ? "All " + spec.functionalRequirements().size() + " requirements have validation criteria"
                : missing.size() + " requirement(s) lack validation criteria");
    }

    private static void checkAcceptanceCriteria(Specification spec, GateReport report) {
        List<String> criteria = spec.acceptanceCriteria();
        int malformed = 0;
        for (int i = 0; i < criteria.size(); i++) {
            String criterion = criteria.get(i);
            if (!(GIVEN.matcher(criterion).find() && WHEN.matcher(criterion).find() && THEN.matcher(criterion).find())) {
                malformed++;
                report.violation(AC_FORMAT, "Acceptance criterion is not in Given/When/Then form: " + abbreviate(criterion),
                    TraceabilityGate.criterionId(criterion, i));
            }
        }
        report.summary("Acceptance criteria use Given/When/Then", malformed == 0,
            malformed == 0
                ? "All " + criteria.size() + " acceptance criteria are well formed"
                : malformed + " acceptance criteria are not in Given/When/Then form");
    }

    private static void checkMetric(Specification spec, GateReport report) {
        String overview = spec.sectionText(SectionKeys.OVERVIEW);
        boolean hasMetric = METRIC_WITH_UNIT.matcher(overview).find() || METRIC_LINE.matcher(overview).find();
        report.check("Overview has a quantifiable success metric", hasMetric, "Quantifiable metric found",
            NO_METRIC, "Overview has no quantifiable (numeric) success metric", SectionKeys.OVERVIEW);
    }

    private static void checkSecurity(Specification spec, GateReport report) {
        Optional<Complexity> complexity = spec.complexity();
        if (complexity.isEmpty()) {
            return;
        }
        String security = securityText(spec);

        if (complexity.get() == Complexity.EASY) {
            OptionalInt maturity = spec.maturity();
            if (maturity.isPresent() && maturity.getAsInt() >= 3) {
                boolean mentioned = !security.isBlank() || spec.raw().toLowerCase(Locale.ROOT).contains("security");
                report.check("Security considerations documented", mentioned, "Security considerations documented",
                    SECURITY_MISSING, "No security considerations found", SectionKeys.SECURITY);
            }
            return;
        }

        boolean authentication = AUTHENTICATION.matcher(security).find();
        boolean authorization = AUTHORIZATION.matcher(security).find()
            || (ROLE.matcher(security).find() && PERMISSION.matcher(security).find());
        if (authentication && authorization) {
            report.summary("Security addresses authentication and authorization", true,
                "Security covers authentication and authorization");
            return;
        }

        String missing = !authentication && !authorization
            ? "authentication and authorization"
            : (authentication ? "authorization" : "authentication");
        report.check("Security addresses authentication and authorization", false, "",
            security.isBlank() ? SECURITY_MISSING : SECURITY_INCOMPLETE,
            complexity.get() + " complexity requires security to address " + missing,
            SectionKeys.SECURITY);
    }

    private static String securityText(Specification spec) {
        StringBuilder text = new StringBuilder(spec.sectionText(SectionKeys.SECURITY));
        for (int level : new int[] {3, 4}) {
            String key = SectionKeys.findLevelKey(spec.sections().keySet(), level);
            if (key != null) {
                text.append('\n').append(spec.sectionText(key));
            }
        }
        return text.toString();
    }

    private static Pattern termPattern(String term) {
        String quoted = Pattern.quote(term);
        boolean wordStart = Character.isLetterOrDigit(term.charAt(0));
        boolean wordEnd = Character.isLetterOrDigit(term.charAt(term.length() - 1));
        return Pattern.compile((wordStart ? "\\b" : "") + quoted + (wordEnd ? "\\b" : ""), Pattern.CASE_INSENSITIVE);
    }

    private static Pattern word(String word) {
        return Pattern.compile("\\b" + word + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static String blankFences(String text) {
        Matcher matcher = FENCED_BLOCK.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group().replaceAll("[^\\n]", " ")));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
