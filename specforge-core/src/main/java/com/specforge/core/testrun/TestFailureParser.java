package com.specforge.core.testrun;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes failing tests in the console output of common runners.
 *
 * <p>Understood formats:
 * <ul>
 *   <li>Maven Surefire: {@code [ERROR] com.acme.FooTest.bar  Time elapsed: 0.01 s  <<< FAILURE!}</li>
 *   <li>Gradle: {@code FooTest > bar() FAILED}</li>
 *   <li>Jest: {@code ● Suite › does something}</li>
 * </ul>
 * Each failure keeps up to five following lines as detail. A test reported twice is listed once.
 */
public final class TestFailureParser {

    private static final int MAX_DETAIL_LINES = 5;

    private static final Pattern SUREFIRE = Pattern.compile(
        "^\\[ERROR]\\s+(\\S+?)(?:\\s+Time elapsed:.*)?\\s+<<<\\s+(?:FAILURE|ERROR)!.*$");

    private static final Pattern GRADLE = Pattern.compile("^(\\S.*? > .+?) FAILED$");

    private static final String JEST_MARKER = "● ";

    private TestFailureParser() {
        // Utility class
    }

    /**
     * Extracts failures from runner output.
     *
     * @param output combined console output, may be null
     * @return failures in order of first appearance
     */
    public static List<TestFailure> parse(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        String[] lines = output.replace("\r\n", "\n").split("\n");
        Map<String, TestFailure> failures = new LinkedHashMap<>();

        for (int i = 0; i < lines.length; i++) {
            String name = failureName(lines[i]);
            if (name != null && !failures.containsKey(name)) {
                failures.put(name, new TestFailure(name, detail(lines, i + 1)));
            }
        }
        return List.copyOf(failures.values());
    }

    private static String failureName(String line) {
        if (line.contains("Tests run:")) {
            return null;
        }
        Matcher surefire = SUREFIRE.matcher(line);
        if (surefire.matches()) {
            return surefire.group(1);
        }
        Matcher gradle = GRADLE.matcher(line.trim());
        if (gradle.matches()) {
            return gradle.group(1);
        }
        String trimmed = line.trim();
        if (trimmed.startsWith(JEST_MARKER)) {
            String name = trimmed.substring(JEST_MARKER.length()).trim();
            return name.isEmpty() ? null : name;
        }
        return null;
    }

    private static String detail(String[] lines, int start) {
        List<String> detail = new ArrayList<>();
        for (int i = start; i < lines.length && detail.size() < MAX_DETAIL_LINES; i++) {
            String line = lines[i];
            if (failureName(line) != null || line.startsWith("FAIL ")) {
                break;
            }
            if (line.isBlank()) {
                if (!detail.isEmpty()) {
                    break;
                }
                continue;
            }
            detail.add(line.strip());
        }
        return String.join("\n", detail);
    }
}
