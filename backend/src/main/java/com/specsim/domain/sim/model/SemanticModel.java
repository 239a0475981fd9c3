package com.specsim.domain.sim.model;

import java.util.List;
import java.util.Optional;

/**
 * Root of the Semantic Intermediate Model. Read-only once assembled.
 */
public record SemanticModel(
        Document document,
        List<Message> messages,
        List<DictionaryEntry> dictionary,
        List<EnumDefinition> enums,
        List<UnitDefinition> units
) {
    public SemanticModel {
        messages = List.copyOf(messages);
        dictionary = List.copyOf(dictionary);
        enums = List.copyOf(enums);
        units = List.copyOf(units);
    }

    public static SemanticModel empty(Document document) {
        return new SemanticModel(document, List.of(), List.of(), List.of(), List.of());
    }

    public int fieldCount() {
        return messages.stream().mapToInt(Message::fieldCount).sum();
    }

    public boolean isEmpty() {
        return fieldCount() == 0 && dictionary.isEmpty();
    }

    public Optional<EnumDefinition> findEnum(String key) {
        return enums.stream().filter(e -> e.key().equals(key)).findFirst();
    }

    public Optional<UnitDefinition> findUnit(String symbol) {
        return units.stream().filter(u -> u.symbol().equals(symbol)).findFirst();
    }
}
