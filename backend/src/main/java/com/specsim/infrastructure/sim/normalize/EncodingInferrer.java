package com.specsim.infrastructure.sim.normalize;

import com.specsim.domain.sim.model.BitRange;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.EnumValue;
import com.specsim.domain.sim.model.FieldEncoding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers a field's data encoding from its description, name, length cell and width.
 * <p>
 * Order: enum listing, textual content, variable-length token, then binary for one-bit and
 * spare/reserved/flag fields, integer otherwise.
 */
@Component
public class EncodingInferrer {

    // "0 = No", "1: Yes", separated by ';' ',' or just the next "n =" pair
    private static final Pattern ENUM_VALUE = Pattern.compile(
            "(?<code>\\d+)\\s*[=:]\\s*(?<label>[^;,=:]+?)(?=\\s*[;,]|\\s+\\d+\\s*[=:]|$)"
    );

    private static final int MIN_ENUM_VALUES = 2;

    private static final Pattern TEXTUAL = Pattern.compile(
            "\\b(?:utf-?8|utf-?16|ascii|string|text|characters?|chars?)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern BINARY_NAME = Pattern.compile(
            "\\b(?:spare|reserved|flag|indicator|bit ?mask)\\b",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Inferred encoding plus the enum values found in the description, if any.
     */
    public record Inference(FieldEncoding encoding, EnumDefinition enumDefinition) {

        public boolean hasEnum() {
            return enumDefinition != null;
        }
    }

    /**
     * @param name        cleaned field name
     * @param description cleaned description cell
     * @param lengthCell  cleaned length cell, may be empty
     * @param range       parsed range, null for variable-length placeholders
     * @param enumKey     key to register an enum definition under
     */
    public Inference infer(String name, String description, String lengthCell, BitRange range,
                           boolean variableLength, String enumKey) {
        List<EnumValue> values = enumValues(description);
        if (values.size() >= MIN_ENUM_VALUES) {
            return new Inference(FieldEncoding.ENUM, new EnumDefinition(enumKey, values));
        }
        if (TEXTUAL.matcher(description).find() || TEXTUAL.matcher(lengthCell).find()
                || TEXTUAL.matcher(name).find()) {
            return new Inference(FieldEncoding.STRING, null);
        }
        if (variableLength) {
            return new Inference(FieldEncoding.VARIABLE_LENGTH, null);
        }
        if ((range != null && range.length() == 1) || BINARY_NAME.matcher(name).find()) {
            return new Inference(FieldEncoding.BINARY, null);
        }
        return new Inference(FieldEncoding.INTEGER, null);
    }

    /**
     * Coded values listed in a description. Later duplicates of a code are ignored.
     */
    public List<EnumValue> enumValues(String description) {
        if (description == null || description.isBlank()) {
            return List.of();
        }
        Map<String, EnumValue> byCode = new LinkedHashMap<>();
        Matcher m = ENUM_VALUE.matcher(description);
        while (m.find()) {
            String code = m.group("code");
            String label = m.group("label").strip();
            if (!label.isEmpty()) {
                byCode.putIfAbsent(code, new EnumValue(code, label));
            }
        }
        return new ArrayList<>(byCode.values());
    }
}
