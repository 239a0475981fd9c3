package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.DictionaryEntry;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Referential integrity of the dictionary forest: duplicates, dangling parents and cycles.
 */
@Component
@Order(2)
public class DictionaryTreeChecker implements ModelChecker {

    @Override
    public String name() {
        return "dictionary-tree";
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<DictionaryEntry> entries = context.model().dictionary();
        List<ValidationIssue> issues = new ArrayList<>();

        Map<String, Integer> firstIndexByKey = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            DictionaryEntry entry = entries.get(i);
            Integer first = firstIndexByKey.putIfAbsent(entry.key(), i);
            if (first != null) {
                issues.add(ValidationIssue.error(ValidationRule.DICTIONARY_DUPLICATE,
                        TargetPaths.dictionary(i),
                        String.format("Dictionary key %s ('%s') duplicates %s ('%s')",
                                entry.key(), entry.name(), TargetPaths.dictionary(first), entries.get(first).name()),
                        "Remove or renumber one of the entries"));
            }
        }

        for (int i = 0; i < entries.size(); i++) {
            DictionaryEntry entry = entries.get(i);
            if (entry.parentKey() != null && !firstIndexByKey.containsKey(entry.parentKey())) {
                issues.add(ValidationIssue.error(ValidationRule.DICTIONARY_DANGLING_PARENT,
                        TargetPaths.dictionary(i),
                        String.format("Parent %s of %s ('%s') does not exist",
                                entry.parentKey(), entry.key(), entry.name()),
                        "Add the missing " + entry.parentKey() + " entry"));
            }
        }

        Set<String> reported = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            DictionaryEntry entry = entries.get(i);
            if (!reported.contains(entry.key()) && isOnCycle(entry, entries, firstIndexByKey)) {
                reported.add(entry.key());
                issues.add(ValidationIssue.error(ValidationRule.DICTIONARY_CYCLE,
                        TargetPaths.dictionary(i),
                        String.format("Entry %s ('%s') is its own ancestor", entry.key(), entry.name()),
                        "Correct the parent reference of " + entry.key()));
            }
        }
        return issues;
    }

    private static boolean isOnCycle(DictionaryEntry start, List<DictionaryEntry> entries,
                                     Map<String, Integer> indexByKey) {
        Set<String> seen = new HashSet<>();
        String parent = start.parentKey();
        while (parent != null && seen.add(parent)) {
            if (parent.equals(start.key())) {
                return true;
            }
            Integer index = indexByKey.get(parent);
            if (index == null) {
                return false;
            }
            parent = entries.get(index).parentKey();
        }
        return false;
    }
}
