package com.vinow.marketplace.domain.finance;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * ReportExport - 재무 리포트 내보내기 결과 (만료 후 정리 대상)
 *
 * 파일 참조는 로컬 경로(filePath) 또는 원격 URL(fileUrl) 중 하나.
 */
@Entity
@Table(name = "finance_report_exports",
        indexes = @Index(name = "idx_finance_report_exports_expires", columnList = "expires_at"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReportExport {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "export_id")
    private Long exportId;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "report_type", nullable = false, length = 50)
    private String reportType;

    @Column(name = "file_path", length = 500)
    private String filePath;

    @Column(name = "file_url", length = 1000)
    private String fileUrl;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 삭제 대상 파일 참조 (로컬 경로 우선)
     */
    public String fileReference() {
        if (filePath != null && !filePath.isBlank()) {
            return filePath;
        }
        return fileUrl;
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt.isBefore(now);
    }

    public void assignId(Long exportId) {
        this.exportId = exportId;
    }
}
