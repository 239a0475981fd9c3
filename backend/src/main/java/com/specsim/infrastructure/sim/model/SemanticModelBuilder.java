package com.specsim.infrastructure.sim.model;

import com.specsim.domain.sim.model.DictionaryEntry;
import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SectionKind;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.UnattributedFields;
import com.specsim.domain.sim.model.UnitDefinition;
import com.specsim.infrastructure.sim.CancellationToken;
import com.specsim.infrastructure.sim.InvalidPipelineInputException;
import com.specsim.infrastructure.sim.normalize.UnitTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-writer assembly of the semantic model from normalized section contents.
 * <p>
 * Message sections become messages (in input order), dictionary sections feed the dictionary
 * forest, appendix/other sections with fields are reported as unattributed. Nothing is reordered or deduplicated,
 * except enum definitions, which are keyed (first definition of a key wins).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticModelBuilder {

    private final SegmentAssembler segmentAssembler;
    private final DictionaryForestBuilder dictionaryForestBuilder;
    private final UnitTable unitTable;
    private final EnumCatalog enumCatalog;

    public BuildOutcome build(Document document, List<SectionContent> contents,
                              List<EnumDefinition> discoveredEnums, CancellationToken token) {
        if (document == null) {
            throw new InvalidPipelineInputException("Document must not be null");
        }
        if (contents == null || discoveredEnums == null) {
            throw new InvalidPipelineInputException("Section contents and enum list must not be null");
        }

        List<Message> messages = new ArrayList<>();
        List<Section> emptySections = new ArrayList<>();
        List<SectionContent> dictionarySections = new ArrayList<>();
        List<UnattributedFields> unattributed = new ArrayList<>();

        for (SectionContent content : contents) {
            token.throwIfCancelled();
            Section section = content.section();
            switch (section.kind()) {
                case MESSAGE -> {
                    if (content.fields().isEmpty()) {
                        emptySections.add(section);
                    } else {
                        List<Segment> segments = segmentAssembler.assemble(content.fields(), document);
                        messages.add(new Message(section.label(), section.title(),
                                section.startPage(), section.endPage(), segments));
                    }
                }
                case DICTIONARY -> dictionarySections.add(content);
                default -> {
                    if (!content.fields().isEmpty()) {
                        unattributed.add(new UnattributedFields(section, content.fields().size()));
                    }
                }
            }
        }

        List<DictionaryEntry> dictionary = dictionaryForestBuilder.build(dictionarySections);
        List<EnumDefinition> enums = mergeEnums(discoveredEnums, enumCatalog.seedsFor(document));
        List<UnitDefinition> units = referencedUnits(messages);

        SemanticModel model = new SemanticModel(document, messages, dictionary, enums, units);
        log.info("[Builder] {} messages, {} fields, {} dictionary entries, {} enums, {} units ({} empty sections)",
                messages.size(), model.fieldCount(), dictionary.size(), enums.size(), units.size(),
                emptySections.size());
        return new BuildOutcome(model, emptySections, unattributed);
    }

    private static List<EnumDefinition> mergeEnums(List<EnumDefinition> discovered, List<EnumDefinition> seeds) {
        Map<String, EnumDefinition> byKey = new LinkedHashMap<>();
        for (EnumDefinition definition : discovered) {
            byKey.putIfAbsent(definition.key(), definition);
        }
        for (EnumDefinition seed : seeds) {
            byKey.putIfAbsent(seed.key(), seed);
        }
        return new ArrayList<>(byKey.values());
    }

    /**
     * Resolved units referenced by some field, in first-reference order, followed by their SI bases.
     */
    private List<UnitDefinition> referencedUnits(List<Message> messages) {
        Map<String, UnitDefinition> bySymbol = new LinkedHashMap<>();
        for (Message message : messages) {
            for (Segment segment : message.segments()) {
                for (FieldRecord field : segment.fields()) {
                    if (field.unitResolved() && field.hasUnit()) {
                        unitTable.lookup(field.unit()).ifPresent(def -> bySymbol.putIfAbsent(def.symbol(), def));
                    }
                }
            }
        }
        for (UnitDefinition def : List.copyOf(bySymbol.values())) {
            Optional<UnitDefinition> base = unitTable.lookup(def.baseSi());
            base.ifPresent(b -> bySymbol.putIfAbsent(b.symbol(), b));
        }
        return new ArrayList<>(bySymbol.values());
    }
}
