package com.vinow.marketplace.infrastructure.file;

import com.vinow.marketplace.common.exception.ExternalIOException;
import com.vinow.marketplace.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * 리포트 내보내기 파일 삭제
 *
 * - http/https URL: 원격 저장소 소유 → 건드리지 않음 (REMOTE_SKIPPED)
 * - 로컬 파일 없음: 이미 삭제된 것으로 간주 (ALREADY_MISSING)
 * - 권한/I/O 오류: ExternalIOException
 */
@Slf4j
@Component
public class ReportFileStore {

    public FileDeletionResult delete(String fileReference) {
        if (fileReference == null || fileReference.isBlank()) {
            throw new ValidationException("파일 참조가 비어 있습니다");
        }
        if (isRemote(fileReference)) {
            log.debug("[ReportFileStore] 원격 파일 건너뜀 - ref={}", fileReference);
            return FileDeletionResult.REMOTE_SKIPPED;
        }

        Path path = toPath(fileReference);
        try {
            boolean deleted = Files.deleteIfExists(path);
            return deleted ? FileDeletionResult.DELETED : FileDeletionResult.ALREADY_MISSING;
        } catch (IOException | SecurityException e) {
            throw ExternalIOException.file("리포트 파일 삭제 실패 - path=" + path, e);
        }
    }

    private boolean isRemote(String fileReference) {
        String lower = fileReference.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private Path toPath(String fileReference) {
        try {
            if (fileReference.startsWith("file:")) {
                return Paths.get(URI.create(fileReference));
            }
            return Paths.get(fileReference);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("잘못된 파일 경로 - ref=" + fileReference, e);
        }
    }
}
