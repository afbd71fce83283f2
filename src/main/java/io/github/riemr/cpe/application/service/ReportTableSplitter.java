package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.dto.SplitReport;
import io.github.riemr.cpe.application.util.ReportDateParser;
import io.github.riemr.cpe.domain.model.RawTableGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Divides a webinar export into its CSV tables. The platform concatenates several reports into
 * one file, each introduced by a {@code Title,} line, which CSV readers cannot handle directly.
 */
@Service
@Slf4j
public class ReportTableSplitter {

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final Pattern TITLE_LINE = Pattern.compile("^([^,]+),$");
    private static final Pattern GENERATED_LINE = Pattern.compile("^Report Generated:,\"([^\"]*)\"$");

    public SplitReport split(List<String> lines) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        String current = null;
        LocalDateTime generatedAt = null;
        int discarded = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i == 0 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                line = line.substring(1);
            }
            if (line.isBlank()) continue;

            Matcher title = TITLE_LINE.matcher(line);
            if (title.matches()) {
                current = title.group(1).trim().toLowerCase(Locale.ROOT);
                sections.computeIfAbsent(current, k -> new ArrayList<>());
                continue;
            }
            Matcher generated = GENERATED_LINE.matcher(line);
            if (generated.matches()) {
                generatedAt = ReportDateParser.parse(generated.group(1));
                continue;
            }
            if (current == null) {
                discarded++;
                continue;
            }
            sections.get(current).add(line);
        }

        if (discarded > 0) {
            log.debug("Discarded {} line(s) before the first table title", discarded);
        }
        List<RawTableGroup> groups = new ArrayList<>();
        sections.forEach((name, raw) -> {
            log.debug("table '{}': {} line(s)", name, raw.size());
            groups.add(new RawTableGroup(name, raw));
        });
        return new SplitReport(groups, generatedAt);
    }
}
