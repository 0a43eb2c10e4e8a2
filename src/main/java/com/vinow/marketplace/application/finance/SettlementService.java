package com.vinow.marketplace.application.finance;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.common.id.BusinessIdGenerator;
import com.vinow.marketplace.common.id.IdPrefix;
import com.vinow.marketplace.domain.finance.FinanceDailySummary;
import com.vinow.marketplace.domain.finance.FinanceDailySummaryRepository;
import com.vinow.marketplace.domain.finance.SettlementNotFoundException;
import com.vinow.marketplace.domain.finance.SettlementRecord;
import com.vinow.marketplace.domain.finance.SettlementRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * SettlementService - 가맹점 주간 정산
 *
 * 비즈니스 규칙:
 * - (merchantId, periodStart, periodEnd)당 정산 기록은 하나이며 생성 후 금액은 바뀌지 않는다
 * - 같은 기간 재실행 시 기존 기록을 그대로 반환 (이중 정산 방지)
 * - 기간 총매출(gross)이 0 이하이면 기록하지 않는다
 *
 * 상태 전환:
 * PROCESSING → COMPLETED (지급 완료 통지)
 * PROCESSING → FAILED → COMPLETED (재시도 성공)
 */
@Slf4j
@Service
public class SettlementService {

    private final FinanceDailySummaryRepository financeDailySummaryRepository;
    private final SettlementRecordRepository settlementRecordRepository;
    private final BusinessIdGenerator idGenerator;
    private final Clock clock;

    public SettlementService(FinanceDailySummaryRepository financeDailySummaryRepository,
                             SettlementRecordRepository settlementRecordRepository,
                             BusinessIdGenerator idGenerator,
                             Clock clock) {
        this.financeDailySummaryRepository = financeDailySummaryRepository;
        this.settlementRecordRepository = settlementRecordRepository;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * @return 정산할 매출이 없으면 empty
     */
    @Transactional
    public Optional<SettlementRecord> generateSettlement(Long merchantId, LocalDate periodStart, LocalDate periodEnd) {
        if (periodStart.isAfter(periodEnd)) {
            throw new ValidationException("정산 시작일이 종료일보다 늦습니다");
        }

        Optional<SettlementRecord> existing =
                settlementRecordRepository.findByMerchantIdAndPeriod(merchantId, periodStart, periodEnd);
        if (existing.isPresent()) {
            log.info("[SettlementService] 이미 정산된 기간 - merchantId={}, period={}~{}, settlementNo={}",
                    merchantId, periodStart, periodEnd, existing.get().getSettlementNo());
            return existing;
        }

        List<FinanceDailySummary> summaries = financeDailySummaryRepository
                .findByMerchantIdAndSummaryDateBetween(merchantId, periodStart, periodEnd);
        long gross = summaries.stream().mapToLong(FinanceDailySummary::getTotalIncome).sum();
        if (gross <= 0) {
            log.info("[SettlementService] 정산 대상 매출 없음, 건너뜀 - merchantId={}, period={}~{}",
                    merchantId, periodStart, periodEnd);
            return Optional.empty();
        }

        SettlementRecord record = SettlementRecord.open(idGenerator.next(IdPrefix.SETTLEMENT), merchantId,
                periodStart, periodEnd, summaries, LocalDateTime.now(clock));
        SettlementRecord saved = settlementRecordRepository.save(record);

        log.info("[SettlementService] 정산 기록 생성 - merchantId={}, settlementNo={}, gross={}, commission={}, netPayable={}",
                merchantId, saved.getSettlementNo(), saved.getGrossAmount(), saved.getCommission(), saved.getNetPayable());
        return Optional.of(saved);
    }

    /**
     * 지급 완료 통지 (정산 지급 협력 시스템)
     */
    @Transactional
    public SettlementRecord completeSettlement(Long settlementId) {
        SettlementRecord record = getSettlement(settlementId);
        record.complete(LocalDateTime.now(clock));
        log.info("[SettlementService] 정산 완료 - settlementNo={}", record.getSettlementNo());
        return settlementRecordRepository.save(record);
    }

    @Transactional
    public SettlementRecord failSettlement(Long settlementId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("정산 실패 사유는 필수입니다");
        }
        SettlementRecord record = getSettlement(settlementId);
        record.fail(reason);
        log.warn("[SettlementService] 정산 실패 - settlementNo={}, reason={}", record.getSettlementNo(), reason);
        return settlementRecordRepository.save(record);
    }

    @Transactional(readOnly = true)
    public SettlementRecord getSettlement(Long settlementId) {
        return settlementRecordRepository.findById(settlementId)
                .orElseThrow(() -> new SettlementNotFoundException(settlementId));
    }

    @Transactional(readOnly = true)
    public List<SettlementRecord> getSettlements(Long merchantId, int page, int size) {
        if (page < 0 || size < 1 || size > 100) {
            throw new ValidationException("page는 0 이상, size는 1~100 사이여야 합니다");
        }
        return settlementRecordRepository.findByMerchantId(merchantId, page, size);
    }
}
