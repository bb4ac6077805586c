package secretscanapp;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class ScanJobTest {

    private static ScanJob running() {
        return ScanJob.pending("abc123def456", "https://github.com/octo/repo", ScanMode.REMOTE,
            "2024-05-01T10:00:00Z").start("Starting scan...");
    }

    @Test
    void newJobIsPendingAtZero() {
        ScanJob job = ScanJob.pending("abc123def456", "https://github.com/octo/repo", ScanMode.LOCAL,
            "2024-05-01T10:00:00Z");

        assertEquals(ScanStatus.PENDING, job.getStatus());
        assertEquals(0, job.getProgress());
        assertNull(job.getResult());
    }

    @Test
    void transitionsReturnNewSnapshots() {
        ScanJob job = running();
        ScanJob next = job.withProgress(40, "Scanning file: app.py");

        assertEquals(0, job.getProgress());
        assertEquals(40, next.getProgress());
        assertEquals("Scanning file: app.py", next.getMessage());
        assertEquals(ScanStatus.RUNNING, next.getStatus());
    }

    @Test
    void progressNeverDecreasesAndIsClamped() {
        ScanJob job = running().withProgress(60, "later").withProgress(30, "earlier");
        assertEquals(60, job.getProgress());
        assertEquals("earlier", job.getMessage());

        assertEquals(100, running().withProgress(250, "over").getProgress());
        assertEquals(0, running().withProgress(-5, "under").getProgress());
    }

    @Test
    void completionSetsResultAndFullProgress() {
        ScanResult result = new ScanResult(ScanSummary.from(Collections.emptyList(), 3, 1, 2),
            Collections.emptyList(), "https://github.com/octo/repo");

        ScanJob job = running().withProgress(20, "x").complete(result, "Scan completed! Found 0 secrets in 3 commits");

        assertEquals(ScanStatus.COMPLETED, job.getStatus());
        assertEquals(100, job.getProgress());
        assertSame(result, job.getResult());
    }

    @Test
    void terminalJobsDoNotChange() {
        ScanJob failed = running().fail("Repository not found: https://github.com/octo/repo");

        assertSame(failed, failed.withProgress(80, "late update"));
        assertSame(failed, failed.complete(new ScanResult(), "late"));
        assertSame(failed, failed.fail("another error"));
        assertEquals(ScanStatus.FAILED, failed.getStatus());
        assertEquals("Repository not found: https://github.com/octo/repo", failed.getMessage());
        assertEquals(failed.getMessage(), failed.getError());
    }
}
