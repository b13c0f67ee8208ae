package com.architecture.memory.specaudit.service.graph.analyzer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Expected relationship patterns per layer, taken from the reference standards the layers cite
 * (ArchiMate 3.2, NIST SP 800-53, OpenAPI 3.0, component and router patterns).
 */
@Component
public class RelationshipTemplateCatalog {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Template {
        private String sourceType;      // matched as a substring of the node type name
        private String destinationType;
        private String predicate;
        private String reason;
        private String standardReference;
    }

    private static Template t(String source, String destination, String predicate, String reason, String reference) {
        return new Template(source, destination, predicate, reason, reference);
    }

    private static final Map<String, List<Template>> TEMPLATES = Map.of(
            "motivation", List.of(
                    t("goal", "principle", "supports", "Goals should support guiding principles", "ArchiMate 3.2 §5.2"),
                    t("requirement", "goal", "realizes", "Requirements realize goals", "ArchiMate 3.2 §5.2"),
                    t("assessment", "goal", "influence", "Assessments influence goals", "ArchiMate 3.2 §5.2")),
            "business", List.of(
                    t("process", "process", "triggers", "Business processes trigger other processes", "ArchiMate 3.2 §6.2"),
                    t("role", "process", "performs", "Roles perform business processes", "ArchiMate 3.2 §6.2"),
                    t("actor", "role", "assigned-to", "Actors are assigned to roles", "ArchiMate 3.2 §6.2")),
            "security", List.of(
                    t("countermeasure", "threat", "mitigates", "Countermeasures mitigate threats", "NIST SP 800-53 §3.1"),
                    t("role", "permission", "authorizes", "Roles authorize permissions", "NIST SP 800-53 §3.2"),
                    t("policy", "constraint", "enforces", "Policies enforce security constraints", "NIST SP 800-53 §3.3")),
            "application", List.of(
                    t("component", "service", "realizes", "Components realize application services", "ArchiMate 3.2 §7.2"),
                    t("component", "component", "uses", "Components use other components", "ArchiMate 3.2 §7.2")),
            "technology", List.of(
                    t("node", "device", "composes", "Nodes compose devices", "ArchiMate 3.2 §8.2"),
                    t("artifact", "component", "realizes", "Artifacts realize application components", "ArchiMate 3.2 §8.2")),
            "api", List.of(
                    t("operation", "schema", "references", "API operations reference schemas", "OpenAPI 3.0 §4.7"),
                    t("securityscheme", "operation", "serves", "Security schemes serve operations", "OpenAPI 3.0 §4.8")),
            "ux", List.of(
                    t("screen", "component", "renders", "Screens render UX components", "React/Component patterns"),
                    t("component", "entity", "binds-to", "Components bind to data entities", "React/Component patterns")),
            "navigation", List.of(
                    t("route", "screen", "navigates-to", "Routes navigate to screens", "Router patterns"),
                    t("menuitem", "route", "references", "Menu items reference routes", "Router patterns"))
    );

    public List<Template> templatesFor(String layerId) {
        return TEMPLATES.getOrDefault(layerId, List.of());
    }
}
