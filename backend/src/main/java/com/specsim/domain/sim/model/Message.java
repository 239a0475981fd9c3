package com.specsim.domain.sim.model;

import java.util.List;

public record Message(String label, String title, int startPage, int endPage, List<Segment> segments) {

    public Message {
        segments = List.copyOf(segments);
    }

    public int fieldCount() {
        return segments.stream().mapToInt(s -> s.fields().size()).sum();
    }
}
