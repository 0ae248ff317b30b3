package io.huskytests.core.model;

import java.time.Duration;

/**
 * Outcome of one executed test case, as reported by the engine or read back from
 * a result file.
 *
 * @param id             engine id of the test, may be empty
 * @param name           short test name
 * @param fullName       fully qualified test name
 * @param result         raw engine result, e.g. {@code Passed}, {@code Failed}, {@code Skipped}
 * @param label          optional result label, e.g. {@code Ignored}
 * @param duration       execution time
 * @param output         captured output, empty when none
 * @param failureMessage failure or skip reason, empty when none
 * @param stackTrace     failure stack trace, empty when none
 */
public record TestCaseOutcome(
        String id,
        String name,
        String fullName,
        String result,
        String label,
        Duration duration,
        String output,
        String failureMessage,
        String stackTrace
) {

    public TestCaseOutcome {
        id = id == null ? "" : id;
        name = name == null ? "" : name;
        fullName = fullName == null || fullName.isBlank() ? name : fullName;
        result = result == null || result.isBlank() ? "Unknown" : result;
        label = label == null ? "" : label;
        duration = duration == null ? Duration.ZERO : duration;
        output = output == null ? "" : output;
        failureMessage = failureMessage == null ? "" : failureMessage;
        stackTrace = stackTrace == null ? "" : stackTrace;
    }

    public static TestCaseOutcome passed(String fullName, Duration duration) {
        return new TestCaseOutcome("", simpleName(fullName), fullName, "Passed", "", duration, "", "", "");
    }

    public static TestCaseOutcome failed(String fullName, Duration duration, String message) {
        return new TestCaseOutcome("", simpleName(fullName), fullName, "Failed", "", duration, "", message, "");
    }

    private static String simpleName(String fullName) {
        int paren = fullName.indexOf('(');
        String head = paren < 0 ? fullName : fullName.substring(0, paren);
        int dot = head.lastIndexOf('.');
        return dot < 0 ? fullName : fullName.substring(dot + 1);
    }
}
