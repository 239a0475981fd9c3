package com.specsim.infrastructure.sim.model;

import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.EnumValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Seed enum tables, keyed by the standard they belong to. Immutable.
 */
public final class EnumCatalog {

    private final Map<String, List<EnumDefinition>> seedsByStandard;

    private EnumCatalog(Map<String, List<EnumDefinition>> seedsByStandard) {
        Map<String, List<EnumDefinition>> copy = new LinkedHashMap<>();
        seedsByStandard.forEach((standard, defs) -> copy.put(standard.toUpperCase(Locale.ROOT), List.copyOf(defs)));
        this.seedsByStandard = Collections.unmodifiableMap(copy);
    }

    /**
     * Seeds whose standard name occurs in the document's standard, e.g. "MQTT" for "MQTT 5.0".
     */
    public List<EnumDefinition> seedsFor(Document document) {
        if (document.standard() == null) {
            return List.of();
        }
        String standard = document.standard().toUpperCase(Locale.ROOT);
        List<EnumDefinition> seeds = new ArrayList<>();
        seedsByStandard.forEach((key, defs) -> {
            if (standard.contains(key)) {
                seeds.addAll(defs);
            }
        });
        return seeds;
    }

    public static EnumCatalog standard() {
        EnumDefinition qos = new EnumDefinition("MQTT.QoS", List.of(
                new EnumValue("0", "At most once delivery"),
                new EnumValue("1", "At least once delivery"),
                new EnumValue("2", "Exactly once delivery")));

        String[] packets = {"Reserved", "CONNECT", "CONNACK", "PUBLISH", "PUBACK", "PUBREC", "PUBREL", "PUBCOMP",
                "SUBSCRIBE", "SUBACK", "UNSUBSCRIBE", "UNSUBACK", "PINGREQ", "PINGRESP", "DISCONNECT", "AUTH"};
        List<EnumValue> packetValues = new ArrayList<>();
        for (int code = 0; code < packets.length; code++) {
            packetValues.add(new EnumValue(Integer.toString(code), packets[code]));
        }
        EnumDefinition packetType = new EnumDefinition("MQTT.PacketType", packetValues);

        return new EnumCatalog(Map.of("MQTT", List.of(qos, packetType)));
    }
}
