package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Informational differences against a prior edition: messages and fields added or removed.
 * Messages are matched by label, fields by name.
 */
@Component
@Order(6)
public class VersionDiffChecker implements ModelChecker {

    @Override
    public String name() {
        return "version-diff";
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        SemanticModel prior = context.priorModel();
        if (prior == null) {
            return List.of();
        }
        SemanticModel current = context.model();
        List<ValidationIssue> issues = new ArrayList<>();
        String priorEdition = edition(prior);

        Map<String, Integer> priorIndex = indexByLabel(prior.messages());
        Map<String, Integer> currentIndex = indexByLabel(current.messages());

        for (int m = 0; m < current.messages().size(); m++) {
            Message message = current.messages().get(m);
            Integer p = priorIndex.get(message.label());
            if (p == null) {
                issues.add(ValidationIssue.info(ValidationRule.VERSION_DIFF, TargetPaths.message(m),
                        "Message " + message.label() + " added since edition " + priorEdition));
                continue;
            }
            diffFields(prior.messages().get(p), message, m, priorEdition, issues);
        }

        for (Message old : prior.messages()) {
            if (!currentIndex.containsKey(old.label())) {
                issues.add(ValidationIssue.info(ValidationRule.VERSION_DIFF, TargetPaths.messages(),
                        "Message " + old.label() + " removed since edition " + priorEdition));
            }
        }
        return issues;
    }

    private static void diffFields(Message prior, Message current, int m, String priorEdition,
                                   List<ValidationIssue> issues) {
        Map<String, String> priorFields = fieldPaths(prior, m);
        Map<String, String> currentFields = fieldPaths(current, m);

        currentFields.forEach((name, path) -> {
            if (!priorFields.containsKey(name)) {
                issues.add(ValidationIssue.info(ValidationRule.VERSION_DIFF, path,
                        "Field '" + name + "' added to " + current.label() + " since edition " + priorEdition));
            }
        });
        priorFields.keySet().forEach(name -> {
            if (!currentFields.containsKey(name)) {
                issues.add(ValidationIssue.info(ValidationRule.VERSION_DIFF, TargetPaths.message(m),
                        "Field '" + name + "' removed from " + current.label() + " since edition " + priorEdition));
            }
        });
    }

    private static Map<String, String> fieldPaths(Message message, int m) {
        Map<String, String> paths = new LinkedHashMap<>();
        for (int s = 0; s < message.segments().size(); s++) {
            Segment segment = message.segments().get(s);
            for (int f = 0; f < segment.fields().size(); f++) {
                FieldRecord field = segment.fields().get(f);
                paths.putIfAbsent(field.name(), TargetPaths.field(m, s, f));
            }
        }
        return paths;
    }

    private static Map<String, Integer> indexByLabel(List<Message> messages) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < messages.size(); i++) {
            index.putIfAbsent(messages.get(i).label(), i);
        }
        return index;
    }

    private static String edition(SemanticModel model) {
        String edition = model.document() == null ? null : model.document().edition();
        return edition == null || edition.isBlank() ? "(unknown)" : edition;
    }
}
