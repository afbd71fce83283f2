package io.github.riemr.cpe.domain.model;

import java.util.List;

/** Raw lines of one section of a concatenated attendance export. */
public record RawTableGroup(String title, List<String> lines) {

    public RawTableGroup {
        lines = List.copyOf(lines);
    }
}
