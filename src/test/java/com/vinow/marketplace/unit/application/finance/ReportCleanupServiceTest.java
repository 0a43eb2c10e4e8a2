package com.vinow.marketplace.unit.application.finance;

import com.vinow.marketplace.application.finance.job.TaskStatus;
import com.vinow.marketplace.common.exception.ExternalIOException;
import com.vinow.marketplace.config.InMemoryMarketplaceFixture;
import com.vinow.marketplace.config.TestDataFactory;
import com.vinow.marketplace.domain.finance.ReportExport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReportCleanupService 테스트")
class ReportCleanupServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 15, 4, 0);

    @TempDir
    Path tempDir;

    private InMemoryMarketplaceFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryMarketplaceFixture(NOW);
    }

    @Test
    @DisplayName("만료된 로컬 파일 - 파일과 행 모두 삭제")
    void testCleanup_LocalFile() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("settlement-2025-01.xlsx"), "report");
        ReportExport export = saveExport(file.toString(), null, NOW.minusDays(1));

        // When
        TaskStatus status = fixture.reportCleanupService.cleanup(export);

        // Then
        assertEquals(TaskStatus.SUCCESS, status);
        assertFalse(Files.exists(file));
        assertTrue(fixture.reportExportRepository.findById(export.getExportId()).isEmpty());
    }

    @Test
    @DisplayName("파일이 이미 없음 - 행 삭제")
    void testCleanup_MissingFile() {
        // Given
        ReportExport export = saveExport(tempDir.resolve("gone.csv").toString(), null, NOW.minusDays(1));

        // When
        TaskStatus status = fixture.reportCleanupService.cleanup(export);

        // Then
        assertEquals(TaskStatus.SUCCESS, status);
        assertTrue(fixture.reportExportRepository.findById(export.getExportId()).isEmpty());
    }

    @Test
    @DisplayName("원격 URL - 파일은 건드리지 않고 행 삭제")
    void testCleanup_RemoteUrl() {
        // Given
        ReportExport export = saveExport(null, "https://cdn.vinow.vn/reports/abc.pdf", NOW.minusDays(1));

        // When
        TaskStatus status = fixture.reportCleanupService.cleanup(export);

        // Then
        assertEquals(TaskStatus.SUCCESS, status);
        assertTrue(fixture.reportExportRepository.findById(export.getExportId()).isEmpty());
    }

    @Test
    @DisplayName("파일 삭제 I/O 실패 - ExternalIOException, 행 유지")
    void testCleanup_IoFailureKeepsRow() throws IOException {
        // Given: 비어 있지 않은 디렉터리는 삭제할 수 없다
        Path directory = Files.createDirectory(tempDir.resolve("locked"));
        Files.writeString(directory.resolve("inner.txt"), "x");
        ReportExport export = saveExport(directory.toString(), null, NOW.minusDays(1));

        // When & Then
        assertThrows(ExternalIOException.class, () -> fixture.reportCleanupService.cleanup(export));
        assertTrue(fixture.reportExportRepository.findById(export.getExportId()).isPresent());
    }

    @Test
    @DisplayName("만료 대상 조회 - expiresAt < now 만 포함")
    void testFindExpiredExports() {
        // Given
        ReportExport expired = saveExport(null, "https://cdn/a.pdf", NOW.minusSeconds(1));
        saveExport(null, "https://cdn/b.pdf", NOW);
        saveExport(null, "https://cdn/c.pdf", NOW.plusDays(1));

        // When
        List<ReportExport> result = fixture.reportCleanupService.findExpiredExports();

        // Then
        assertEquals(1, result.size());
        assertEquals(expired.getExportId(), result.get(0).getExportId());
    }

    private ReportExport saveExport(String filePath, String fileUrl, LocalDateTime expiresAt) {
        return fixture.reportExportRepository.save(ReportExport.builder()
                .merchantId(TestDataFactory.MERCHANT_ID)
                .reportType("SETTLEMENT")
                .filePath(filePath)
                .fileUrl(fileUrl)
                .expiresAt(expiresAt)
                .createdAt(expiresAt.minusDays(30))
                .build());
    }
}
