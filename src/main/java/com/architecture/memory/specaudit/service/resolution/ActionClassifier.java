package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.ActionKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Maps free-text suggestions to an {@link ActionKind}. Rules are checked in order and the
 * first match wins.
 */
@Component
public class ActionClassifier {

    private record Rule(Pattern pattern, ActionKind kind) {
    }

    private static final List<Rule> RULES = List.of(
            rule("\\bremove\\s+duplicate\\s+relationship\\b|\\b(merge|consolidate)\\b.*\\brelationships?\\b",
                    ActionKind.REMOVE_DUPLICATE),
            rule("\\b(move|relocate)\\b", ActionKind.MOVE),
            rule("\\bcollapse\\b|\\benum\\s+value\\b", ActionKind.ENUM_COLLAPSE),
            rule("\\b(create|add)\\b.*\\brelationship", ActionKind.CREATE_RELATIONSHIP),
            rule("\\badd\\b.*\\battribute\\b", ActionKind.ADD_ATTRIBUTE),
            rule("\\b(remove|delete|drop)\\b", ActionKind.REMOVE),
            rule("\\bclarify\\b|\\bdescription\\b|\\bdocument", ActionKind.CLARIFY));

    private static Rule rule(String regex, ActionKind kind) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), kind);
    }

    public ActionKind classify(String suggestion) {
        if (suggestion == null || suggestion.isBlank()) {
            return ActionKind.OTHER;
        }
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(suggestion).find()) {
                return rule.kind();
            }
        }
        return ActionKind.OTHER;
    }
}
