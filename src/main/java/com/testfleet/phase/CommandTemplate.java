package com.testfleet.phase;

/**
 * Expands the placeholders a phase command may contain.
 *
 * <ul>
 *   <li>{@code ${filter}}: the phase filter expression, single-quoted for the shell.
 *       The phase plan only admits it in phases that declare a filter.</li>
 *   <li>{@code ${jobs}}: parallelism degree for tools such as the linter</li>
 * </ul>
 */
final class CommandTemplate {

    static final String FILTER = "${filter}";
    static final String JOBS = "${jobs}";

    private CommandTemplate() {}

    static String expand(String command, String filter, int jobs) {
        return command
                .replace(FILTER, filter != null ? shellQuote(filter) : "")
                .replace(JOBS, String.valueOf(jobs));
    }

    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
