package com.vinow.marketplace.application.verification;

import com.vinow.marketplace.application.verification.dto.BatchVerificationResult;
import com.vinow.marketplace.application.verification.dto.StaffVerificationStats;
import com.vinow.marketplace.application.verification.dto.VerificationFailure;
import com.vinow.marketplace.application.verification.dto.VerificationRecordPageResult;
import com.vinow.marketplace.common.exception.BizException;
import com.vinow.marketplace.common.exception.ErrorCode;
import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderNotFoundException;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.VerificationCodeNotFoundException;
import com.vinow.marketplace.domain.verification.VerificationMethod;
import com.vinow.marketplace.domain.verification.VerificationRecord;
import com.vinow.marketplace.domain.verification.VerificationRecordRepository;
import com.vinow.marketplace.infrastructure.lock.LockKeyGenerator;
import com.vinow.marketplace.infrastructure.lock.OrderLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * VerificationService - 주문 사용(검증) 처리
 *
 * 역할:
 * - 코드 / QR / 일괄 사용 처리
 * - 검증 기록 조회 및 직원별 통계
 *
 * 동시성 제어:
 * - 코드로 주문 ID를 찾은 뒤 주문 락 안에서 상태를 다시 읽는다
 * - 같은 코드로 동시에 두 번 요청하면 하나만 성공하고,
 *   나머지는 VERIFIED 상태를 보고 InvalidOrderStatusException을 받는다
 *
 * 일괄 처리:
 * - 주문마다 독립된 락 + 트랜잭션 (배치 전체를 묶지 않음)
 * - 한 주문의 실패는 나머지 처리를 중단시키지 않는다
 */
@Slf4j
@Service
public class VerificationService {

    private final OrderRepository orderRepository;
    private final VerificationRecordRepository verificationRecordRepository;
    private final VerificationTransactionService verificationTransactionService;
    private final OrderLockManager orderLockManager;
    private final QrPayloadDecoder qrPayloadDecoder;
    private final Clock clock;

    public VerificationService(OrderRepository orderRepository,
                               VerificationRecordRepository verificationRecordRepository,
                               VerificationTransactionService verificationTransactionService,
                               OrderLockManager orderLockManager,
                               QrPayloadDecoder qrPayloadDecoder,
                               Clock clock) {
        this.orderRepository = orderRepository;
        this.verificationRecordRepository = verificationRecordRepository;
        this.verificationTransactionService = verificationTransactionService;
        this.orderLockManager = orderLockManager;
        this.qrPayloadDecoder = qrPayloadDecoder;
        this.clock = clock;
    }

    // ========== 사용 처리 ==========

    public Order verifyByCode(String code, String staffId, String staffName) {
        validateStaff(staffId);
        if (code == null || code.isBlank()) {
            throw new ValidationException("검증 코드는 필수입니다");
        }
        Long orderId = findOrderIdByCode(code.trim().toUpperCase(Locale.ROOT));
        return verifyGuarded(orderId, staffId, staffName, VerificationMethod.CODE);
    }

    public Order verifyByQR(String payload, String staffId, String staffName) {
        validateStaff(staffId);
        QrPayload decoded = qrPayloadDecoder.decode(payload);

        Long orderId;
        if (decoded.hasCode()) {
            orderId = findOrderIdByCode(decoded.getVerificationCode());
        } else {
            orderId = orderRepository.findById(decoded.getOrderId())
                    .map(Order::getOrderId)
                    .orElseThrow(() -> new OrderNotFoundException(decoded.getOrderId()));
        }
        return verifyGuarded(orderId, staffId, staffName, VerificationMethod.QR);
    }

    /**
     * 일괄 사용 처리
     *
     * @return 입력 ID마다 성공 또는 실패 1건
     */
    public BatchVerificationResult batchVerify(List<Long> orderIds, String staffId, String staffName) {
        validateStaff(staffId);
        if (orderIds == null || orderIds.isEmpty()) {
            throw new ValidationException("일괄 사용 대상 주문은 최소 1건 이상이어야 합니다");
        }

        BatchVerificationResult result = new BatchVerificationResult();
        for (Long orderId : orderIds) {
            try {
                if (orderId == null) {
                    throw new ValidationException("주문 ID가 비어 있습니다");
                }
                verifyGuarded(orderId, staffId, staffName, VerificationMethod.BATCH);
                result.addSuccess(orderId);
            } catch (BizException e) {
                log.warn("[VerificationService] 일괄 사용 실패 - orderId={}, code={}, message={}",
                        orderId, e.getErrorCodeValue(), e.getMessage());
                result.addFailure(new VerificationFailure(orderId, e.getErrorCodeValue(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("[VerificationService] 일괄 사용 중 예기치 않은 오류 - orderId={}", orderId, e);
                result.addFailure(new VerificationFailure(orderId,
                        ErrorCode.INTERNAL_SERVER_ERROR.getCode(), e.getMessage()));
            }
        }

        log.info("[VerificationService] 일괄 사용 완료 - total={}, succeeded={}, failed={}",
                result.getTotalProcessed(), result.getSucceeded().size(), result.getFailed().size());
        return result;
    }

    // ========== 조회 ==========

    /**
     * 가맹점 검증 기록, 최신순
     *
     * @param staffId null이면 전체 직원
     */
    @Transactional(readOnly = true)
    public VerificationRecordPageResult getVerificationRecords(Long merchantId, String staffId,
                                                               LocalDateTime from, LocalDateTime to,
                                                               int page, int size) {
        if (page < 0 || size < 1 || size > 100) {
            throw new ValidationException("page는 0 이상, size는 1~100 사이여야 합니다");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("조회 시작 시각이 종료 시각보다 늦습니다");
        }
        List<VerificationRecord> records =
                verificationRecordRepository.findByMerchant(merchantId, staffId, from, to, page, size);
        long totalCount = verificationRecordRepository.countByMerchant(merchantId, staffId, from, to);
        return new VerificationRecordPageResult(records, page, size, totalCount);
    }

    /**
     * 직원별 사용 처리 건수와 금액 (오늘 포함 최근 days일)
     */
    @Transactional(readOnly = true)
    public List<StaffVerificationStats> getStaffVerificationStats(Long merchantId, int days) {
        if (days < 1 || days > 365) {
            throw new ValidationException("조회 기간은 1~365일 사이여야 합니다");
        }
        LocalDate today = LocalDate.now(clock);
        LocalDateTime from = today.minusDays(days - 1L).atStartOfDay();
        LocalDateTime to = today.plusDays(1).atStartOfDay();

        List<VerificationRecord> records =
                verificationRecordRepository.findByMerchantIdAndCreatedAtBetween(merchantId, from, to);
        if (records.isEmpty()) {
            return List.of();
        }

        Map<Long, Long> amountByOrderId = orderRepository.findAllByIds(records.stream()
                        .map(VerificationRecord::getOrderId)
                        .distinct()
                        .collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Order::getOrderId, Order::getFinalAmount));

        Map<String, List<VerificationRecord>> byStaff = records.stream()
                .collect(Collectors.groupingBy(VerificationRecord::getStaffId, LinkedHashMap::new,
                        Collectors.toList()));

        return byStaff.entrySet().stream()
                .map(entry -> toStats(entry.getKey(), entry.getValue(), amountByOrderId))
                .sorted(Comparator.comparingLong(StaffVerificationStats::getVerificationCount).reversed()
                        .thenComparing(StaffVerificationStats::getStaffId))
                .collect(Collectors.toList());
    }

    // ========== 내부 ==========

    private Order verifyGuarded(Long orderId, String staffId, String staffName, VerificationMethod method) {
        return orderLockManager.executeWithLock(LockKeyGenerator.order(orderId),
                () -> verificationTransactionService.verify(orderId, staffId, staffName, method));
    }

    private Long findOrderIdByCode(String code) {
        return orderRepository.findByVerificationCode(code)
                .map(Order::getOrderId)
                .orElseThrow(() -> new VerificationCodeNotFoundException(code));
    }

    private void validateStaff(String staffId) {
        if (staffId == null || staffId.isBlank()) {
            throw new ValidationException("처리 직원 ID는 필수입니다");
        }
    }

    private StaffVerificationStats toStats(String staffId, List<VerificationRecord> records,
                                           Map<Long, Long> amountByOrderId) {
        long totalAmount = records.stream()
                .map(VerificationRecord::getOrderId)
                .map(orderId -> amountByOrderId.getOrDefault(orderId, 0L))
                .mapToLong(Long::longValue)
                .sum();
        String staffName = records.stream()
                .map(VerificationRecord::getStaffName)
                .filter(name -> name != null && !name.isBlank())
                .findFirst()
                .orElse(staffId);
        return new StaffVerificationStats(staffId, staffName, records.size(), totalAmount);
    }
}
