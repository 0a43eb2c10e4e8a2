package com.vinow.marketplace.unit.application.verification;

import com.vinow.marketplace.application.verification.dto.BatchVerificationResult;
import com.vinow.marketplace.application.verification.dto.StaffVerificationStats;
import com.vinow.marketplace.application.verification.dto.VerificationFailure;
import com.vinow.marketplace.common.exception.ErrorCode;
import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.config.InMemoryMarketplaceFixture;
import com.vinow.marketplace.config.TestDataFactory;
import com.vinow.marketplace.domain.order.InvalidOrderStatusException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.VerificationCodeNotFoundException;
import com.vinow.marketplace.domain.verification.VerificationMethod;
import com.vinow.marketplace.domain.verification.VerificationRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VerificationService 테스트
 *
 * - 코드/QR 사용 처리
 * - 이중 사용 방지 (동시 요청 포함)
 * - 일괄 사용 처리 결과 분리
 * - 직원별 통계
 */
@DisplayName("VerificationService 테스트")
class VerificationServiceTest {

    private InMemoryMarketplaceFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryMarketplaceFixture(LocalDateTime.of(2025, 1, 15, 10, 0));
    }

    // ========== 코드 사용 ==========

    @Test
    @DisplayName("코드 사용 - 공백/소문자 정규화 후 VERIFIED, 검증 기록 1건")
    void testVerifyByCode_Success() {
        // Given
        Order order = fixture.saveOrder("ABC123", 150000L);

        // When
        Order verified = fixture.verificationService.verifyByCode("  abc123 ", "staff-1", "Lan");

        // Then
        assertEquals(OrderStatus.VERIFIED, verified.getOrderStatus());
        assertEquals(fixture.now(), verified.getVerifiedAt());
        List<VerificationRecord> records = fixture.verificationRecordRepository.findByOrderId(order.getOrderId());
        assertEquals(1, records.size());
        assertEquals(VerificationMethod.CODE, records.get(0).getVerificationMethod());
        assertEquals("staff-1", records.get(0).getStaffId());
    }

    @Test
    @DisplayName("없는 코드 - VerificationCodeNotFoundException")
    void testVerifyByCode_UnknownCode() {
        assertThrows(VerificationCodeNotFoundException.class,
                () -> fixture.verificationService.verifyByCode("NOPE99", "staff-1", "Lan"));
    }

    @Test
    @DisplayName("직원 ID 누락 - ValidationException")
    void testVerifyByCode_MissingStaff() {
        fixture.saveOrder("STAF0001", 10000L);
        assertThrows(ValidationException.class,
                () -> fixture.verificationService.verifyByCode("STAF0001", " ", "Lan"));
    }

    @Test
    @DisplayName("같은 코드 두 번 사용 - 두 번째는 InvalidOrderStatusException, 기록 1건 유지")
    void testVerifyByCode_DoubleRedemption() {
        // Given
        Order order = fixture.saveOrder("TWICE001", 20000L);
        fixture.verificationService.verifyByCode("TWICE001", "staff-1", "Lan");

        // When & Then
        assertThrows(InvalidOrderStatusException.class,
                () -> fixture.verificationService.verifyByCode("TWICE001", "staff-2", "Minh"));
        assertEquals(1, fixture.verificationRecordRepository.countByOrderId(order.getOrderId()));
    }

    @Test
    @DisplayName("동시 사용 요청 10건 - 정확히 1건만 성공")
    void testVerifyByCode_ConcurrentRedemption() throws Exception {
        // Given
        Order order = fixture.saveOrder("RACE0001", 80000L);
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successCount = new AtomicInteger();
        List<Exception> failures = new CopyOnWriteArrayList<>();

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String staffId = "staff-" + i;
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    fixture.verificationService.verifyByCode("RACE0001", staffId, staffId);
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    failures.add(e);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertEquals(1, successCount.get());
        assertEquals(threads - 1, failures.size());
        for (Exception failure : failures) {
            assertInstanceOf(InvalidOrderStatusException.class, failure);
        }
        assertEquals(1, fixture.verificationRecordRepository.countByOrderId(order.getOrderId()));
        assertEquals(OrderStatus.VERIFIED, order.getOrderStatus());
    }

    // ========== QR 사용 ==========

    @Test
    @DisplayName("QR 사용 - order_<id> 형식")
    void testVerifyByQR_OrderIdPayload() {
        // Given
        Order order = fixture.saveOrder("QRID0001", 30000L);

        // When
        Order verified = fixture.verificationService.verifyByQR("order_" + order.getOrderId(), "staff-1", "Lan");

        // Then
        assertEquals(OrderStatus.VERIFIED, verified.getOrderStatus());
        assertEquals(VerificationMethod.QR, fixture.verificationRecordRepository
                .findByOrderId(order.getOrderId()).get(0).getVerificationMethod());
    }

    @Test
    @DisplayName("QR 사용 - JSON code 형식")
    void testVerifyByQR_JsonCodePayload() {
        // Given
        fixture.saveOrder("QRJS0001", 30000L);

        // When
        Order verified = fixture.verificationService.verifyByQR("{\"code\":\"qrjs0001\"}", "staff-1", "Lan");

        // Then
        assertEquals(OrderStatus.VERIFIED, verified.getOrderStatus());
    }

    // ========== 일괄 사용 ==========

    @Test
    @DisplayName("일괄 사용 - 성공/실패 분리, 입력 ID마다 결과 1건")
    void testBatchVerify_MixedResults() {
        // Given
        Order redeemable = fixture.saveOrder("BTCH0001", 10000L);
        Order alreadyVerified = fixture.saveOrder("BTCH0002", 20000L);
        fixture.verificationService.verifyByCode("BTCH0002", "staff-0", "Hoa");
        Order cancelled = fixture.saveOrder("BTCH0003", 30000L);
        fixture.orderTransitionService.transition(cancelled.getOrderId(), OrderStatus.CANCELLED, "user:100", "변심");
        List<Long> orderIds = Arrays.asList(redeemable.getOrderId(), alreadyVerified.getOrderId(),
                99999L, null, cancelled.getOrderId());

        // When
        BatchVerificationResult result = fixture.verificationService.batchVerify(orderIds, "staff-1", "Lan");

        // Then
        assertEquals(5, result.getTotalProcessed());
        assertEquals(List.of(redeemable.getOrderId()), result.getSucceeded());
        assertEquals(4, result.getFailed().size());
        assertEquals(ErrorCode.INVALID_ORDER_STATUS.getCode(), failureOf(result, alreadyVerified.getOrderId()).getErrorCode());
        assertEquals(ErrorCode.ORDER_NOT_FOUND.getCode(), failureOf(result, 99999L).getErrorCode());
        assertEquals(ErrorCode.VALIDATION_FAILED.getCode(), failureOf(result, null).getErrorCode());
        assertEquals(ErrorCode.INVALID_ORDER_STATUS.getCode(), failureOf(result, cancelled.getOrderId()).getErrorCode());
        assertEquals(OrderStatus.CANCELLED, cancelled.getOrderStatus());
        assertEquals(VerificationMethod.BATCH, fixture.verificationRecordRepository
                .findByOrderId(redeemable.getOrderId()).get(0).getVerificationMethod());
    }

    @Test
    @DisplayName("일괄 사용 - 빈 목록 ValidationException")
    void testBatchVerify_EmptyInput() {
        assertThrows(ValidationException.class,
                () -> fixture.verificationService.batchVerify(List.of(), "staff-1", "Lan"));
    }

    // ========== 통계 ==========

    @Test
    @DisplayName("직원별 통계 - 건수 내림차순, 금액 합계")
    void testGetStaffVerificationStats() {
        // Given
        fixture.saveOrder("STAT0001", 10000L);
        fixture.saveOrder("STAT0002", 15000L);
        fixture.saveOrder("STAT0003", 40000L);
        fixture.verificationService.verifyByCode("STAT0001", "staff-a", "An");
        fixture.verificationService.verifyByCode("STAT0002", "staff-a", "An");
        fixture.verificationService.verifyByCode("STAT0003", "staff-b", "Binh");

        // When
        List<StaffVerificationStats> stats = fixture.verificationService
                .getStaffVerificationStats(TestDataFactory.MERCHANT_ID, 7);

        // Then
        assertEquals(2, stats.size());
        assertEquals("staff-a", stats.get(0).getStaffId());
        assertEquals(2, stats.get(0).getVerificationCount());
        assertEquals(25000L, stats.get(0).getTotalAmount());
        assertEquals("staff-b", stats.get(1).getStaffId());
        assertEquals(40000L, stats.get(1).getTotalAmount());
    }

    @Test
    @DisplayName("통계 기간 범위 초과 - ValidationException")
    void testGetStaffVerificationStats_InvalidDays() {
        assertThrows(ValidationException.class,
                () -> fixture.verificationService.getStaffVerificationStats(10L, 0));
    }

    private static VerificationFailure failureOf(BatchVerificationResult result, Long orderId) {
        return result.getFailed().stream()
                .filter(failure -> Objects.equals(failure.getOrderId(), orderId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("실패 결과 없음 - orderId=" + orderId));
    }
}
