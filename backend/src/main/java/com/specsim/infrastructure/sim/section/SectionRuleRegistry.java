package com.specsim.infrastructure.sim.section;

import com.specsim.domain.sim.model.SectionKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ordered heading rules. Registration order is priority order.
 */
@Component
public class SectionRuleRegistry {

    private static final String MQTT_PACKETS =
            "CONNECT|CONNACK|PUBLISH|PUBACK|PUBREC|PUBREL|PUBCOMP|SUBSCRIBE|SUBACK"
                    + "|UNSUBSCRIBE|UNSUBACK|PINGREQ|PINGRESP|DISCONNECT|AUTH";

    private final List<SectionRule> rules = new ArrayList<>();

    public SectionRuleRegistry() {
        List<SectionRule> labeling = List.of(
                new PatternSectionRule("j-series-message", Pattern.compile(
                        "^(?:(?:message|msg)\\s+)?(J\\d{1,2}(?:\\.\\d{1,3})*)(?!\\d|\\.\\d)\\s*[:：\\-]?\\s*(?<title>.*)$",
                        Pattern.CASE_INSENSITIVE),
                        SectionKind.MESSAGE, label -> label.toUpperCase(Locale.ROOT)),

                new PatternSectionRule("control-packet", Pattern.compile(
                        "^(?:\\d+(?:\\.\\d+)*\\s+)?(" + MQTT_PACKETS + ")\\b\\s*[:：\\-]?\\s*(?<title>.*)$"),
                        SectionKind.MESSAGE, label -> label),

                new PatternSectionRule("dotted-message", Pattern.compile(
                        "^([A-Z]{1,3}\\d{1,3}\\.\\d{1,3}(?:\\.\\d{1,3})*)(?!\\d|\\.\\d)\\s*[:：\\-]?\\s*(?<title>.*)$"),
                        SectionKind.MESSAGE, label -> label),

                new PatternSectionRule("dictionary-block", Pattern.compile(
                        "^((?:DFI|DUI)\\s*[-#:]?\\s*\\d{1,9})\\b\\s*[:：\\-.]?\\s*(?<title>.*)$",
                        Pattern.CASE_INSENSITIVE),
                        SectionKind.DICTIONARY, SectionRuleRegistry::dictionaryLabel),

                new PatternSectionRule("data-dictionary-appendix", Pattern.compile(
                        "^(Appendix\\s+B)\\b\\s*[:：\\-.]?\\s*(?<title>.*)$",
                        Pattern.CASE_INSENSITIVE),
                        SectionKind.DICTIONARY, label -> "Appendix B"),

                new PatternSectionRule("appendix", Pattern.compile(
                        "^Appendix\\s+([A-Z])\\b\\s*[:：\\-.]?\\s*(?<title>.*)$",
                        Pattern.CASE_INSENSITIVE),
                        SectionKind.APPENDIX, letter -> "Appendix " + letter.toUpperCase(Locale.ROOT)),

                new PatternSectionRule("numbered-section", Pattern.compile(
                        "^Section\\s+(\\d{1,3}(?:\\.\\d{1,3})*)\\s*[:：\\-.]?\\s*(?<title>.*)$",
                        Pattern.CASE_INSENSITIVE),
                        SectionKind.OTHER, number -> "Section " + number)
        );

        register(new ContinuationRule(labeling));
        labeling.forEach(this::register);
    }

    private void register(SectionRule rule) {
        rules.add(rule);
    }

    public List<SectionRule> rules() {
        return Collections.unmodifiableList(rules);
    }

    // "DFI 281", "dfi-281" and "DFI#281" all label as "DFI-281"
    static String dictionaryLabel(String raw) {
        String prefix = raw.substring(0, 3).toUpperCase(Locale.ROOT);
        String digits = raw.replaceAll("\\D", "");
        return prefix + "-" + Integer.parseInt(digits);
    }
}
