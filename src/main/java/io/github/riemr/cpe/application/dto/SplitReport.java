package io.github.riemr.cpe.application.dto;

import io.github.riemr.cpe.domain.model.RawTableGroup;

import java.time.LocalDateTime;
import java.util.List;

public record SplitReport(List<RawTableGroup> groups, LocalDateTime generatedAt) {
}
