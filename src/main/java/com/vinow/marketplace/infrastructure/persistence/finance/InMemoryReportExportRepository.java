package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.ReportExport;
import com.vinow.marketplace.domain.finance.ReportExportRepository;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
@InMemoryDatastore
public class InMemoryReportExportRepository implements ReportExportRepository {

    private final ConcurrentHashMap<Long, ReportExport> exports = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public ReportExport save(ReportExport export) {
        if (export.getExportId() == null) {
            export.assignId(idSequence.incrementAndGet());
        }
        exports.put(export.getExportId(), export);
        return export;
    }

    @Override
    public List<ReportExport> findExpired(LocalDateTime now) {
        return exports.values().stream()
                .filter(export -> export.isExpired(now))
                .sorted(Comparator.comparing(ReportExport::getExportId))
                .collect(Collectors.toList());
    }

    @Override
    public void deleteById(Long exportId) {
        exports.remove(exportId);
    }

    public Optional<ReportExport> findById(Long exportId) {
        return Optional.ofNullable(exports.get(exportId));
    }
}
