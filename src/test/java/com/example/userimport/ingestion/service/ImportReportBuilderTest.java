package com.example.userimport.ingestion.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.userimport.ingestion.model.BulkUpsertFailure;
import com.example.userimport.ingestion.model.PipelineErrorRecord;
import com.example.userimport.ingestion.model.PolicySkipReason;
import com.example.userimport.ingestion.model.SkippedUser;
import com.example.userimport.ingestion.model.User;
import com.example.userimport.ingestion.service.ImportReportBuilder.DomainCount;
import com.example.userimport.ingestion.support.ImportError;
import com.example.userimport.ingestion.support.ImportErrorCode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ImportReportBuilderTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final ImportReportBuilder builder = new ImportReportBuilder(5);

    @Test
    void reportsCountsAverageAgeAndDomains() {
        List<User> persisted = List.of(
                user("1", "a@x.com", 30),
                user("2", "b@y.com", 41),
                user("3", "c@x.com", 20));

        String report = builder.build(3, persisted, List.of(), List.of());

        assertThat(report).isEqualTo(String.join("\n",
                "Import Summary",
                "--------------",
                "Total records processed: 3",
                "Persisted successfully: 3",
                "Skipped by policy: 0",
                "Failed validations/persists: 0",
                "",
                "Average age of persisted users: 30.3",
                "",
                "Domain distribution (top 5):",
                "  - x.com: 2",
                "  - y.com: 1"));
    }

    @Test
    void emptyRunSaysNoPersistedUsers() {
        String report = builder.build(0, List.of(), List.of(), List.of());

        assertThat(report)
                .contains("Average age of persisted users: 0")
                .endsWith("Domain distribution (top 5):\n  (no persisted users)")
                .doesNotContain("Failures overview:")
                .doesNotContain("Policy skips overview:");
    }

    @Test
    void listsFailuresAndSkips() {
        User alan = user("2", "alan@example.com", 40);
        ImportError validation = ImportError.validation("User validation failed", Map.of());
        ImportError repo = ImportError.repo(ImportErrorCode.REPO_WRITE_FAILED, "Failed to persist user",
                Map.of("id", "3"), null);
        ImportError stale = ImportError.policy(PolicySkipReason.STALE_UPDATE.code(),
                "Incoming record is older than the stored version", Map.of());

        String report = builder.build(4, List.of(user("1", "ada@example.com", 36)),
                List.of(new SkippedUser(alan, stale)),
                List.of(PipelineErrorRecord.validation(validation, Map.of("id", "")),
                        PipelineErrorRecord.persistence(new BulkUpsertFailure(user("3", "g@example.com", 50), repo))));

        assertThat(report).contains(
                "Failed validations/persists: 2",
                "Failures overview:\n"
                        + "  - [validation] VALIDATION_FAILED: User validation failed\n"
                        + "  - [persistence] REPO_WRITE_FAILED: Failed to persist user",
                "Policy skips overview:\n"
                        + "  - 2 (alan@example.com): POLICY_STALE_UPDATE - Incoming record is older than the stored version");
    }

    @Test
    void topDomainsBreaksTiesByFirstAppearanceAndHonoursLimit() {
        ImportReportBuilder topTwo = new ImportReportBuilder(2);
        List<User> users = List.of(
                user("1", "a@b.com", 30),
                user("2", "a@c.com", 30),
                user("3", "a@d.com", 30),
                user("4", "b@d.com", 30));

        assertThat(topTwo.topDomains(users)).containsExactly(
                new DomainCount("d.com", 2),
                new DomainCount("b.com", 1));
    }

    @Test
    void averageAgeRoundsToOneDecimal() {
        assertThat(ImportReportBuilder.averageAge(List.of())).isZero();
        assertThat(ImportReportBuilder.averageAge(List.of(
                user("1", "a@x.com", 1), user("2", "b@x.com", 2), user("3", "c@x.com", 2)))).isEqualTo(1.7);
    }

    private static User user(String id, String email, int age) {
        return new User(id, "User " + id, email, age, T0);
    }
}
