package com.enterprise.taskrouting.classify;

import com.enterprise.taskrouting.core.Domain;
import com.enterprise.taskrouting.core.Priority;
import com.enterprise.taskrouting.core.Source;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic, side-effect free classifier driven by a {@link ClassifierRules} table.
 * <p>
 * Domain comes from the source when the source belongs to one of the two
 * configured sets. Otherwise content keywords break the tie, and with no
 * decisive hits the fallback domain applies.
 */
public class DomainClassifier {

    private final ClassifierRules rules;

    public DomainClassifier(ClassifierRules rules) {
        this.rules = rules;
    }

    public Classification classify(Source source, String content) {
        String text = content != null ? content.toLowerCase(Locale.ROOT) : "";
        Domain domain = domainOf(source, text);

        String intent = rules.getDefaultIntent();
        Priority priority = rules.getDefaultPriority();
        for (ClassifierRules.IntentRule rule : rules.getIntents()) {
            if (countHits(text, rule.getKeywords()) > 0) {
                intent = rule.getName();
                priority = rule.getPriority();
                break;
            }
        }
        if (countHits(text, rules.getUrgentKeywords()) > 0) {
            priority = Priority.HIGH;
        }
        return new Classification(domain, intent, priority);
    }

    /**
     * Handler route for classified content, qualified by domain, e.g. {@code social_post(business)}
     */
    public String route(Classification classification, String content) {
        String text = content != null ? content.toLowerCase(Locale.ROOT) : "";
        String route = rules.getDefaultRoute();
        for (ClassifierRules.RouteRule rule : rules.getRoutes()) {
            if (countHits(text, rule.getKeywords()) > 0) {
                route = rule.getRoute();
                break;
            }
        }
        return route + "(" + classification.getDomain().wireName() + ")";
    }

    public ClassifierRules getRules() {
        return rules;
    }

    private Domain domainOf(Source source, String text) {
        if (rules.getPersonalSources().contains(source)) {
            return Domain.PERSONAL;
        }
        if (rules.getBusinessSources().contains(source)) {
            return Domain.BUSINESS;
        }
        int business = countHits(text, rules.getBusinessKeywords());
        int personal = countHits(text, rules.getPersonalKeywords());
        if (business > personal) {
            return Domain.BUSINESS;
        }
        if (personal > business) {
            return Domain.PERSONAL;
        }
        return rules.getFallbackDomain();
    }

    private static int countHits(String text, List<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }
}
