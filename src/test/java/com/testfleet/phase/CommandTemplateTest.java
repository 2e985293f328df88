package com.testfleet.phase;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandTemplateTest {

    @Test
    void expandsFilterQuotedAndJobs() {
        assertEquals("pytest -k 'integration_tests' -n 4",
                CommandTemplate.expand("pytest -k ${filter} -n ${jobs}", "integration_tests", 4));
    }

    @Test
    void absentFilterExpandsToNothing() {
        assertEquals("pytest -k  -vvv", CommandTemplate.expand("pytest -k ${filter} -vvv", null, 2));
    }

    @Test
    void filterIsNeverInterpretedByTheShell() {
        assertEquals("'not slow and $(rm -rf /)'", CommandTemplate.shellQuote("not slow and $(rm -rf /)"));
        assertEquals("'it'\"'\"'s'", CommandTemplate.shellQuote("it's"));
    }

    @Test
    void commandWithoutPlaceholdersIsUnchanged() {
        assertEquals("coveralls --service=unit_tests",
                CommandTemplate.expand("coveralls --service=unit_tests", "x", 8));
    }
}
