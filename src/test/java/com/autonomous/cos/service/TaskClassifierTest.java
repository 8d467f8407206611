package com.autonomous.cos.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskClassifierTest {

    private final TaskClassifier classifier = new TaskClassifier();

    @Test
    void shouldClassifyBugFixes() {
        assertEquals("bug-fix", classifier.classify("Fix login bug on mobile"));
        assertEquals("bug-fix", classifier.classify("Checkout page crashes on submit"));
    }

    @Test
    void shouldPreferMarkersOverKeywords() {
        assertEquals("self-improve:security", classifier.classify("[Self-Improvement] security fix sweep"));
        assertEquals("task:performance", classifier.classify("[Improvement: portal] performance review"));
        assertEquals("idle-review", classifier.classify("[Idle Review] look around for bugs"));
    }

    @Test
    void shouldFallBackToGeneral() {
        assertEquals("general", classifier.classify("Think about next quarter"));
        assertEquals("general", classifier.classify(""));
        assertEquals("general", classifier.classify(null));
    }

    @Test
    void shouldMatchBroadCategories() {
        assertEquals("refactor", classifier.classify("Refactor the billing module"));
        assertEquals("testing", classifier.classify("Increase coverage of parser"));
        assertEquals("documentation", classifier.classify("Update README"));
        assertEquals("feature", classifier.classify("Add dark mode toggle"));
    }
}
