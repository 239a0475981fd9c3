package com.specsim.infrastructure.sim.serialization;

import com.specsim.domain.sim.model.BitRange;
import com.specsim.domain.sim.model.DictionaryEntry;
import com.specsim.domain.sim.model.DictionaryLevel;
import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.EnumValue;
import com.specsim.domain.sim.model.FieldEncoding;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.TransportUnit;
import com.specsim.domain.sim.model.UnitDefinition;
import com.specsim.infrastructure.sim.serialization.SimDocument.DictionaryDoc;
import com.specsim.infrastructure.sim.serialization.SimDocument.EnumDoc;
import com.specsim.infrastructure.sim.serialization.SimDocument.EnumValueDoc;
import com.specsim.infrastructure.sim.serialization.SimDocument.FieldDoc;
import com.specsim.infrastructure.sim.serialization.SimDocument.MessageDoc;
import com.specsim.infrastructure.sim.serialization.SimDocument.SegmentDoc;
import com.specsim.infrastructure.sim.serialization.SimDocument.UnitDoc;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts between the semantic model and its wire document. {@code toModel(toDocument(m))}
 * reproduces {@code m} exactly.
 */
@Component
public class SimDocumentMapper {

    public SimDocument toDocument(SemanticModel model) {
        Document doc = model.document();
        return new SimDocument(
                doc.standard(),
                doc.edition(),
                doc.pageCount(),
                doc.transportUnit().wireName(),
                doc.containerBits(),
                model.messages().stream().map(this::toDoc).toList(),
                model.dictionary().stream().map(this::toDoc).toList(),
                model.enums().stream().map(this::toDoc).toList(),
                model.units().stream().map(this::toDoc).toList()
        );
    }

    public SemanticModel toModel(SimDocument document) {
        if (document == null) {
            throw new SimSerializationException("SIM document is empty");
        }
        try {
            Document doc = new Document(
                    document.standard(),
                    document.edition(),
                    orZero(document.pageCount()),
                    TransportUnit.fromWire(document.transportUnit()),
                    document.containerBits());
            return new SemanticModel(
                    doc,
                    mapAll(document.messages(), this::toMessage),
                    mapAll(document.dictionary(), this::toEntry),
                    mapAll(document.enums(), this::toEnum),
                    mapAll(document.units(), this::toUnit));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SimSerializationException("Malformed SIM document: " + e.getMessage(), e);
        }
    }

    // ===== model → document =====

    private MessageDoc toDoc(Message message) {
        return new MessageDoc(message.label(), message.title(), message.startPage(), message.endPage(),
                message.segments().stream().map(this::toDoc).toList());
    }

    private SegmentDoc toDoc(Segment segment) {
        return new SegmentDoc(segment.type(), segment.index(), segment.bitLength(),
                segment.fields().stream().map(this::toDoc).toList());
    }

    private FieldDoc toDoc(FieldRecord field) {
        return new FieldDoc(
                field.name(),
                field.range().start(),
                field.range().end(),
                field.encoding().wireName(),
                field.unit(),
                field.rawUnit(),
                field.unitResolved(),
                field.description(),
                field.confidence(),
                field.segmentMarker(),
                field.enumKey(),
                field.resolution(),
                field.sourcePage(),
                field.sourceRow());
    }

    private DictionaryDoc toDoc(DictionaryEntry entry) {
        return new DictionaryDoc(entry.key(), entry.level().prefix(), entry.categoryId(), entry.subCategoryId(),
                entry.itemId(), entry.name(), entry.parentKey());
    }

    private EnumDoc toDoc(EnumDefinition definition) {
        return new EnumDoc(definition.key(),
                definition.values().stream().map(v -> new EnumValueDoc(v.code(), v.label())).toList());
    }

    private UnitDoc toDoc(UnitDefinition unit) {
        return new UnitDoc(unit.symbol(), unit.baseSi(), unit.factor(), unit.offset(), unit.description());
    }

    // ===== document → model =====

    private Message toMessage(MessageDoc doc) {
        return new Message(doc.label(), doc.title(), orZero(doc.startPage()), orZero(doc.endPage()),
                mapAll(doc.segments(), this::toSegment));
    }

    private Segment toSegment(SegmentDoc doc) {
        return new Segment(doc.type(), orZero(doc.index()), orZero(doc.bitLength()),
                mapAll(doc.fields(), this::toField));
    }

    private FieldRecord toField(FieldDoc doc) {
        if (doc.start() == null) {
            throw new IllegalArgumentException("field '" + doc.name() + "' has no start");
        }
        int end = doc.end() == null ? doc.start() : doc.end();
        return FieldRecord.builder()
                .name(doc.name())
                .range(new BitRange(doc.start(), end))
                .encoding(doc.encoding() == null ? FieldEncoding.INTEGER : FieldEncoding.fromWire(doc.encoding()))
                .unit(doc.units())
                .rawUnit(doc.rawUnits())
                .unitResolved(Boolean.TRUE.equals(doc.unitResolved()))
                .description(doc.description() == null ? "" : doc.description())
                .confidence(doc.confidence() == null ? 1.0 : doc.confidence())
                .segmentMarker(doc.segmentMarker())
                .enumKey(doc.enumKey())
                .resolution(doc.resolution())
                .sourcePage(orZero(doc.sourcePage()))
                .sourceRow(orZero(doc.sourceRow()))
                .build();
    }

    private DictionaryEntry toEntry(DictionaryDoc doc) {
        if (doc.categoryId() == null) {
            throw new IllegalArgumentException("dictionary entry '" + doc.name() + "' has no category_id");
        }
        return new DictionaryEntry(levelOf(doc.level()), doc.categoryId(), doc.subCategoryId(), doc.itemId(),
                doc.name(), doc.parentKey());
    }

    private EnumDefinition toEnum(EnumDoc doc) {
        return new EnumDefinition(doc.key(), mapAll(doc.values(), v -> new EnumValue(v.code(), v.label())));
    }

    private UnitDefinition toUnit(UnitDoc doc) {
        return new UnitDefinition(doc.symbol(), doc.baseSi(),
                doc.factor() == null ? 1.0 : doc.factor(),
                doc.offset() == null ? 0.0 : doc.offset(),
                doc.description());
    }

    private static DictionaryLevel levelOf(String wire) {
        for (DictionaryLevel level : DictionaryLevel.values()) {
            if (level.prefix().equalsIgnoreCase(wire) || level.name().equalsIgnoreCase(wire)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown dictionary level: " + wire);
    }

    private static <D, M> List<M> mapAll(List<D> docs, Function<D, M> mapper) {
        if (docs == null) {
            return List.of();
        }
        List<M> out = new ArrayList<>(docs.size());
        for (D doc : docs) {
            if (doc == null) {
                throw new IllegalArgumentException("null element in SIM document");
            }
            out.add(mapper.apply(doc));
        }
        return out;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
