package com.enterprise.taskrouting.classify;

import com.enterprise.taskrouting.core.Domain;
import com.enterprise.taskrouting.core.Priority;
import com.enterprise.taskrouting.core.Source;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DomainClassifierTest {

    private DomainClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new DomainClassifier(ClassifierRules.loadDefault());
    }

    @Test
    void testBusinessPostFromAmbiguousSource() {
        String content = "Launch post\nPlease share the launch post for our new product";

        Classification classification = classifier.classify(Source.GMAIL, content);

        assertEquals(Domain.BUSINESS, classification.getDomain());
        assertEquals("post", classification.getIntent());
        assertEquals(Priority.MEDIUM, classification.getPriority());
        assertEquals("social_post(business)", classifier.route(classification, content));
    }

    @Test
    void testPersonalSourceDecidesDomain() {
        Classification classification = classifier.classify(Source.WHATSAPP, "Can you call the client back");

        assertEquals(Domain.PERSONAL, classification.getDomain());
        assertEquals("request", classification.getIntent());
    }

    @Test
    void testBusinessSourceDecidesDomain() {
        Classification classification = classifier.classify(Source.LINKEDIN, "birthday dinner with family");

        assertEquals(Domain.BUSINESS, classification.getDomain());
    }

    @Test
    void testUrgentKeywordRaisesPriority() {
        Classification classification = classifier.classify(Source.INBOX, "URGENT: update the client");

        assertEquals(Domain.BUSINESS, classification.getDomain());
        assertEquals("update", classification.getIntent());
        assertEquals(Priority.HIGH, classification.getPriority());
    }

    @Test
    void testFallbackWithoutKeywordHits() {
        Classification classification = classifier.classify(Source.INBOX, "hello there");

        assertEquals(Domain.PERSONAL, classification.getDomain());
        assertEquals("update", classification.getIntent());
        assertEquals(Priority.LOW, classification.getPriority());
        assertEquals("default(personal)", classifier.route(classification, "hello there"));
    }

    @Test
    void testClassificationIsDeterministic() {
        String content = "Quick question: when is the proposal meeting?";

        assertEquals(classifier.classify(Source.GMAIL, content), classifier.classify(Source.GMAIL, content));
    }

    @Test
    void testNullContentUsesDefaults() {
        Classification classification = classifier.classify(Source.UNKNOWN, null);

        assertEquals(Domain.PERSONAL, classification.getDomain());
        assertEquals("update", classification.getIntent());
    }

    @Test
    void testCustomRulesTable() {
        ClassifierRules rules = new ClassifierRules(
            List.of(), List.of("gmail"), List.of(), List.of(), "business",
            List.of(new ClassifierRules.IntentRule("invoice", List.of("Invoice"), "high")),
            "note", "low", List.of(), List.of(), "inbox");
        DomainClassifier custom = new DomainClassifier(rules);

        Classification classification = custom.classify(Source.GMAIL, "invoice #42 attached");

        assertEquals(Domain.BUSINESS, classification.getDomain());
        assertEquals("invoice", classification.getIntent());
        assertEquals(Priority.HIGH, classification.getPriority());
        assertEquals("inbox(business)", custom.route(classification, "invoice #42 attached"));
        assertEquals("note", custom.classify(Source.INBOX, "nothing").getIntent());
    }

    @Test
    void testSourceCannotBelongToBothDomains() {
        assertThrows(IllegalArgumentException.class, () -> new ClassifierRules(
            List.of("gmail"), List.of("gmail"), null, null, null, null, null, null, null, null, null));
    }
}
