package com.example.userimport.ingestion.service;

import com.example.userimport.ingestion.config.IngestionProperties;
import com.example.userimport.ingestion.model.PipelineErrorRecord;
import com.example.userimport.ingestion.model.SkippedUser;
import com.example.userimport.ingestion.model.User;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ImportReportBuilder {

    private static final String LINE_SEPARATOR = "\n";

    private final int topDomainLimit;

    @Autowired
    public ImportReportBuilder(IngestionProperties properties) {
        this(properties.reportTopDomains());
    }

    public ImportReportBuilder(int topDomainLimit) {
        this.topDomainLimit = Math.max(1, topDomainLimit);
    }

    public String build(long total, List<User> persisted, List<SkippedUser> skipped,
            List<PipelineErrorRecord> failures) {
        List<String> lines = new ArrayList<>();
        lines.add("Import Summary");
        lines.add("--------------");
        lines.add("Total records processed: " + total);
        lines.add("Persisted successfully: " + persisted.size());
        lines.add("Skipped by policy: " + skipped.size());
        lines.add("Failed validations/persists: " + failures.size());
        lines.add("");
        lines.add("Average age of persisted users: " + formatAge(averageAge(persisted)));
        lines.add("");
        lines.add("Domain distribution (top %d):".formatted(topDomainLimit));

        List<DomainCount> domains = topDomains(persisted);
        if (domains.isEmpty()) {
            lines.add("  (no persisted users)");
        }
        domains.forEach(entry -> lines.add("  - %s: %d".formatted(entry.domain(), entry.count())));

        if (!failures.isEmpty()) {
            lines.add("");
            lines.add("Failures overview:");
            failures.forEach(failure -> lines.add("  - [%s] %s: %s".formatted(
                    failure.stage().label(), failure.error().code(), failure.error().message())));
        }

        if (!skipped.isEmpty()) {
            lines.add("");
            lines.add("Policy skips overview:");
            skipped.forEach(skip -> lines.add("  - %s (%s): %s - %s".formatted(
                    skip.user().id(), skip.user().email(), skip.error().code(), skip.error().message())));
        }
        return String.join(LINE_SEPARATOR, lines);
    }

    public static double averageAge(List<User> users) {
        if (users.isEmpty()) {
            return 0;
        }
        double sum = users.stream().mapToInt(User::age).sum();
        return Math.round(sum / users.size() * 10) / 10.0;
    }

    /**
     * Domains by descending count; ties keep the order in which the domain first appeared.
     */
    public List<DomainCount> topDomains(List<User> users) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        users.forEach(user -> counts.merge(user.emailDomain(), 1, Integer::sum));
        return counts.entrySet().stream()
                .map(entry -> new DomainCount(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingInt(DomainCount::count).reversed())
                .limit(topDomainLimit)
                .toList();
    }

    private static String formatAge(double age) {
        return new DecimalFormat("0.#", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(age);
    }

    public record DomainCount(String domain, int count) {
    }
}
