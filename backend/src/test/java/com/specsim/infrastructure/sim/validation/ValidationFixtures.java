package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.BitRange;
import com.specsim.domain.sim.model.DictionaryEntry;
import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.FieldEncoding;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.TransportUnit;
import com.specsim.domain.sim.model.UnitDefinition;

import java.util.List;

/**
 * Small model builders shared by the checker tests.
 */
final class ValidationFixtures {

    static final Document DOCUMENT = new Document("MIL-STD-6016", "E", 10, TransportUnit.BIT, null);

    private ValidationFixtures() {
    }

    static FieldRecord field(String name, int start, int end) {
        return FieldRecord.builder()
                .name(name)
                .range(new BitRange(start, end))
                .encoding(FieldEncoding.INTEGER)
                .description("")
                .confidence(1.0)
                .sourcePage(1)
                .build();
    }

    static Segment segment(int bitLength, FieldRecord... fields) {
        return new Segment("General", 0, bitLength, List.of(fields));
    }

    static Message message(String label, Segment... segments) {
        return new Message(label, "", 1, 1, List.of(segments));
    }

    static SemanticModel model(Message... messages) {
        return new SemanticModel(DOCUMENT, List.of(messages), List.of(), List.of(), List.of());
    }

    static SemanticModel model(List<Message> messages, List<DictionaryEntry> dictionary,
                               List<EnumDefinition> enums, List<UnitDefinition> units) {
        return new SemanticModel(DOCUMENT, messages, dictionary, enums, units);
    }
}
