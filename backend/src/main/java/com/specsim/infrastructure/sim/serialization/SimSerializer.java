package com.specsim.infrastructure.sim.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.specsim.domain.sim.model.SemanticModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes and reads SIM documents as JSON or YAML.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimSerializer {

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final SimDocumentMapper documentMapper;

    public String write(SemanticModel model, SimFormat format) {
        SimDocument document = documentMapper.toDocument(model);
        try {
            String out = mapperFor(format).writeValueAsString(document);
            log.debug("[Serializer] wrote {} messages as {} ({} chars)", model.messages().size(), format, out.length());
            return out;
        } catch (JsonProcessingException e) {
            throw new SimSerializationException("Failed to write SIM as " + format, e);
        }
    }

    public SemanticModel read(String content, SimFormat format) {
        if (content == null || content.isBlank()) {
            throw new SimSerializationException("SIM content is empty");
        }
        try {
            SimDocument document = mapperFor(format).readValue(content, SimDocument.class);
            return documentMapper.toModel(document);
        } catch (JsonProcessingException e) {
            throw new SimSerializationException("Failed to parse SIM " + format + ": " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(SemanticModel model) {
        return write(model, SimFormat.JSON);
    }

    public String toYaml(SemanticModel model) {
        return write(model, SimFormat.YAML);
    }

    public SemanticModel fromJson(String json) {
        return read(json, SimFormat.JSON);
    }

    public SemanticModel fromYaml(String yaml) {
        return read(yaml, SimFormat.YAML);
    }

    private static ObjectMapper mapperFor(SimFormat format) {
        return format == SimFormat.YAML ? YAML : JSON;
    }
}
