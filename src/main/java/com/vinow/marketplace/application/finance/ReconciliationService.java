package com.vinow.marketplace.application.finance;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.domain.finance.DisputeRecord;
import com.vinow.marketplace.domain.finance.DisputeRecordRepository;
import com.vinow.marketplace.domain.finance.ReconciliationLog;
import com.vinow.marketplace.domain.finance.ReconciliationLogRepository;
import com.vinow.marketplace.domain.finance.ReconciliationNotFoundException;
import com.vinow.marketplace.domain.finance.ReconciliationStatus;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.verification.VerificationRecord;
import com.vinow.marketplace.domain.verification.VerificationRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ReconciliationService - 가맹점 일별 대사
 *
 * 비교 대상 (영업일 [date 00:00, date+1 00:00)):
 * - 기대값(expected): 해당일 verifiedAt이 찍힌 주문의 finalAmount 합
 * - 실제값(actual): 해당일 작성된 VerificationRecord의 주문 finalAmount 합
 *
 * 불일치 주문:
 * - 사용 처리되었지만 검증 기록이 없는 주문
 * - 검증 기록은 있지만 해당일 사용 처리 주문이 아닌 주문
 * - 검증 기록이 2건 이상인 주문
 *
 * 같은 (merchantId, date) 재실행은 기존 기록을 반환한다. force=true면 같은 행을 다시 계산한다.
 */
@Slf4j
@Service
public class ReconciliationService {

    private final OrderRepository orderRepository;
    private final VerificationRecordRepository verificationRecordRepository;
    private final ReconciliationLogRepository reconciliationLogRepository;
    private final DisputeRecordRepository disputeRecordRepository;
    private final Clock clock;

    public ReconciliationService(OrderRepository orderRepository,
                                 VerificationRecordRepository verificationRecordRepository,
                                 ReconciliationLogRepository reconciliationLogRepository,
                                 DisputeRecordRepository disputeRecordRepository,
                                 Clock clock) {
        this.orderRepository = orderRepository;
        this.verificationRecordRepository = verificationRecordRepository;
        this.reconciliationLogRepository = reconciliationLogRepository;
        this.disputeRecordRepository = disputeRecordRepository;
        this.clock = clock;
    }

    /**
     * @return 사용 처리 주문과 검증 기록이 모두 없고 기존 기록도 없으면 empty
     */
    @Transactional
    public Optional<ReconciliationLog> reconcile(Long merchantId, LocalDate businessDate, boolean force) {
        Optional<ReconciliationLog> existing =
                reconciliationLogRepository.findByMerchantIdAndBusinessDate(merchantId, businessDate);
        if (existing.isPresent() && !force) {
            log.info("[ReconciliationService] 이미 대사된 영업일 - merchantId={}, date={}, status={}",
                    merchantId, businessDate, existing.get().getStatus());
            return existing;
        }

        LocalDateTime from = businessDate.atStartOfDay();
        LocalDateTime to = businessDate.plusDays(1).atStartOfDay();

        // STEP 1: 기대값 (사용 처리 주문)
        Map<Long, Long> expectedAmounts = orderRepository.findByMerchantIdAndVerifiedAtBetween(merchantId, from, to)
                .stream()
                .collect(Collectors.toMap(Order::getOrderId, Order::getFinalAmount, (a, b) -> a, LinkedHashMap::new));

        // STEP 2: 실제값 (검증 기록)
        List<Long> recordedOrderIds = verificationRecordRepository
                .findByMerchantIdAndCreatedAtBetween(merchantId, from, to)
                .stream()
                .map(VerificationRecord::getOrderId)
                .collect(Collectors.toList());

        if (existing.isEmpty() && expectedAmounts.isEmpty() && recordedOrderIds.isEmpty()) {
            log.info("[ReconciliationService] 대사 대상 없음, 건너뜀 - merchantId={}, date={}", merchantId, businessDate);
            return Optional.empty();
        }

        Map<Long, Long> orderAmounts = orderRepository.findAllByIds(recordedOrderIds.stream()
                        .distinct()
                        .collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Order::getOrderId, Order::getFinalAmount));

        // STEP 3: 계산 및 upsert
        ReconciliationLog calculated = ReconciliationLog.compute(merchantId, businessDate, expectedAmounts,
                recordedOrderIds, orderAmounts, LocalDateTime.now(clock));

        ReconciliationLog saved;
        if (existing.isPresent()) {
            ReconciliationLog current = existing.get();
            current.recomputeFrom(calculated);
            saved = reconciliationLogRepository.save(current);
        } else {
            saved = reconciliationLogRepository.save(calculated);
        }

        if (saved.getStatus() == ReconciliationStatus.MISMATCHED) {
            log.warn("[ReconciliationService] 대사 불일치 - merchantId={}, date={}, expected={}, actual={}, mismatched={}",
                    merchantId, businessDate, saved.getExpectedTotal(), saved.getActualTotal(),
                    saved.getMismatchedOrderIds());
        } else {
            log.info("[ReconciliationService] 대사 완료 - merchantId={}, date={}, status={}, total={}",
                    merchantId, businessDate, saved.getStatus(), saved.getExpectedTotal());
        }
        return Optional.of(saved);
    }

    /**
     * 불일치 주문 이의 제기
     *
     * 불일치 주문 전체가 이의 제기되면 대사 상태는 RESOLVED가 된다.
     */
    @Transactional
    public ReconciliationLog submitDispute(Long reconciliationId, List<Long> orderIds, String reason,
                                          String submittedBy) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("이의 제기 사유는 필수입니다");
        }
        ReconciliationLog reconciliationLog = getReconciliation(reconciliationId);

        reconciliationLog.registerDispute(orderIds);
        ReconciliationLog saved = reconciliationLogRepository.save(reconciliationLog);
        disputeRecordRepository.save(DisputeRecord.submit(saved, orderIds, reason, submittedBy,
                LocalDateTime.now(clock)));

        log.info("[ReconciliationService] 이의 제기 접수 - reconciliationId={}, orderIds={}, status={}",
                reconciliationId, orderIds, saved.getStatus());
        return saved;
    }

    @Transactional(readOnly = true)
    public ReconciliationLog getReconciliation(Long reconciliationId) {
        return reconciliationLogRepository.findById(reconciliationId)
                .orElseThrow(() -> new ReconciliationNotFoundException(reconciliationId));
    }

    @Transactional(readOnly = true)
    public List<ReconciliationLog> getReconciliations(Long merchantId, int page, int size) {
        if (page < 0 || size < 1 || size > 100) {
            throw new ValidationException("page는 0 이상, size는 1~100 사이여야 합니다");
        }
        return reconciliationLogRepository.findByMerchantId(merchantId, page, size);
    }

    @Transactional(readOnly = true)
    public List<DisputeRecord> getDisputes(Long reconciliationId) {
        return disputeRecordRepository.findByReconciliationId(reconciliationId);
    }
}
