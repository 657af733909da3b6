package com.enterprise.taskrouting.classify;

import com.enterprise.taskrouting.core.Domain;
import com.enterprise.taskrouting.core.Priority;
import com.enterprise.taskrouting.core.Source;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Table of classification rules. Loaded from {@code classifier-rules.yml};
 * every list is matched case-insensitively as substrings of the task content.
 */
public final class ClassifierRules {

    public static final String DEFAULT_RESOURCE = "classifier-rules.yml";

    private final Set<Source> personalSources;
    private final Set<Source> businessSources;
    private final List<String> personalKeywords;
    private final List<String> businessKeywords;
    private final Domain fallbackDomain;
    private final List<IntentRule> intents;
    private final String defaultIntent;
    private final Priority defaultPriority;
    private final List<String> urgentKeywords;
    private final List<RouteRule> routes;
    private final String defaultRoute;

    @JsonCreator
    public ClassifierRules(
            @JsonProperty("personal_sources") List<String> personalSources,
            @JsonProperty("business_sources") List<String> businessSources,
            @JsonProperty("personal_keywords") List<String> personalKeywords,
            @JsonProperty("business_keywords") List<String> businessKeywords,
            @JsonProperty("fallback_domain") String fallbackDomain,
            @JsonProperty("intents") List<IntentRule> intents,
            @JsonProperty("default_intent") String defaultIntent,
            @JsonProperty("default_priority") String defaultPriority,
            @JsonProperty("urgent_keywords") List<String> urgentKeywords,
            @JsonProperty("routes") List<RouteRule> routes,
            @JsonProperty("default_route") String defaultRoute) {
        this.personalSources = sources(personalSources);
        this.businessSources = sources(businessSources);
        if (this.personalSources.stream().anyMatch(this.businessSources::contains)) {
            throw new IllegalArgumentException("A source cannot be both personal and business");
        }
        this.personalKeywords = lowercase(personalKeywords);
        this.businessKeywords = lowercase(businessKeywords);
        this.fallbackDomain = fallbackDomain != null ? Domain.fromWire(fallbackDomain) : Domain.PERSONAL;
        this.intents = intents != null ? List.copyOf(intents) : List.of();
        this.defaultIntent = defaultIntent != null ? defaultIntent : "update";
        this.defaultPriority = defaultPriority != null ? Priority.fromWire(defaultPriority) : Priority.LOW;
        this.urgentKeywords = lowercase(urgentKeywords);
        this.routes = routes != null ? List.copyOf(routes) : List.of();
        this.defaultRoute = defaultRoute != null ? defaultRoute : "default";
    }

    /**
     * Loads the rules bundled on the classpath
     */
    public static ClassifierRules loadDefault() {
        try (InputStream in = ClassifierRules.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Classifier rules resource not found: " + DEFAULT_RESOURCE);
            }
            return mapper().readValue(in, ClassifierRules.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load classifier rules from classpath", e);
        }
    }

    public static ClassifierRules load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return mapper().readValue(in, ClassifierRules.class);
        }
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    public Set<Source> getPersonalSources() {
        return personalSources;
    }

    public Set<Source> getBusinessSources() {
        return businessSources;
    }

    public List<String> getPersonalKeywords() {
        return personalKeywords;
    }

    public List<String> getBusinessKeywords() {
        return businessKeywords;
    }

    public Domain getFallbackDomain() {
        return fallbackDomain;
    }

    public List<IntentRule> getIntents() {
        return intents;
    }

    public String getDefaultIntent() {
        return defaultIntent;
    }

    public Priority getDefaultPriority() {
        return defaultPriority;
    }

    public List<String> getUrgentKeywords() {
        return urgentKeywords;
    }

    public List<RouteRule> getRoutes() {
        return routes;
    }

    public String getDefaultRoute() {
        return defaultRoute;
    }

    private static Set<Source> sources(List<String> names) {
        if (names == null || names.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(names.stream()
            .map(Source::fromWire)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Source.class))));
    }

    static List<String> lowercase(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                result.add(keyword.toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(result);
    }

    /**
     * An intent and the keywords that select it. Intents are tried in table order.
     */
    public static final class IntentRule {
        private final String name;
        private final List<String> keywords;
        private final Priority priority;

        @JsonCreator
        public IntentRule(@JsonProperty("name") String name,
                          @JsonProperty("keywords") List<String> keywords,
                          @JsonProperty("priority") String priority) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Intent rule requires a name");
            }
            this.name = name;
            this.keywords = lowercase(keywords);
            this.priority = priority != null ? Priority.fromWire(priority) : Priority.MEDIUM;
        }

        public String getName() {
            return name;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public Priority getPriority() {
            return priority;
        }
    }

    /**
     * A handler route and the keywords that select it
     */
    public static final class RouteRule {
        private final String route;
        private final List<String> keywords;

        @JsonCreator
        public RouteRule(@JsonProperty("route") String route,
                         @JsonProperty("keywords") List<String> keywords) {
            if (route == null || route.isBlank()) {
                throw new IllegalArgumentException("Route rule requires a route name");
            }
            this.route = route;
            this.keywords = lowercase(keywords);
        }

        public String getRoute() {
            return route;
        }

        public List<String> getKeywords() {
            return keywords;
        }
    }
}
