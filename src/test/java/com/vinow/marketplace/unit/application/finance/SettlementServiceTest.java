package com.vinow.marketplace.unit.application.finance;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.config.InMemoryMarketplaceFixture;
import com.vinow.marketplace.config.TestDataFactory;
import com.vinow.marketplace.domain.finance.FinanceDailySummary;
import com.vinow.marketplace.domain.finance.InvalidSettlementStatusException;
import com.vinow.marketplace.domain.finance.SettlementNotFoundException;
import com.vinow.marketplace.domain.finance.SettlementRecord;
import com.vinow.marketplace.domain.finance.SettlementStatus;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SettlementService 테스트
 *
 * 정산 기간: 2025-01-06(월) ~ 2025-01-12(일)
 */
@DisplayName("SettlementService 테스트")
class SettlementServiceTest {

    private static final LocalDate PERIOD_START = LocalDate.of(2025, 1, 6);
    private static final LocalDate PERIOD_END = LocalDate.of(2025, 1, 12);
    private static final Long QUIET_MERCHANT_ID = 11L;

    private InMemoryMarketplaceFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryMarketplaceFixture(PERIOD_START.atTime(10, 0));

        // 월요일: 200,000 사용 처리
        fixture.saveOrder("SETL0001", 200000L);
        fixture.verificationService.verifyByCode("SETL0001", "staff-1", "Lan");
        fixture.dailySummaryService.generateDailySummary(TestDataFactory.MERCHANT_ID, PERIOD_START);

        // 목요일: 50,000 사용 처리 + 10,000 환불
        fixture.clock.setTo(PERIOD_START.plusDays(3).atTime(12, 0));
        fixture.saveOrder("SETL0002", 50000L);
        fixture.verificationService.verifyByCode("SETL0002", "staff-1", "Lan");
        Order refunded = fixture.saveOrder("SETL0003", 10000L);
        fixture.refundService.requestRefund(refunded.getOrderId(), "변심", null, null);
        fixture.refundService.approveRefund(refunded.getOrderId(), "admin-1");
        fixture.dailySummaryService.generateDailySummary(TestDataFactory.MERCHANT_ID, PERIOD_START.plusDays(3));

        // 매출 없는 가맹점: 취소 주문만 존재
        Order cancelled = fixture.saveOrder(QUIET_MERCHANT_ID, "SETL0004", 30000L);
        fixture.orderTransitionService.transition(cancelled.getOrderId(), OrderStatus.CANCELLED, "user:100", "변심");
        fixture.dailySummaryService.generateDailySummary(QUIET_MERCHANT_ID, PERIOD_START.plusDays(3));

        fixture.clock.setTo(PERIOD_END.plusDays(1).atTime(2, 0));
    }

    @Test
    @DisplayName("주간 정산 생성 - 총매출, 수수료, 환불, 지급액")
    void testGenerateSettlement_Amounts() {
        // When
        SettlementRecord record = fixture.settlementService
                .generateSettlement(TestDataFactory.MERCHANT_ID, PERIOD_START, PERIOD_END)
                .orElseThrow();

        // Then
        assertTrue(record.getSettlementNo().startsWith("SET"));
        assertEquals(250000L, record.getGrossAmount());
        assertEquals(5000L, record.getCommission());
        assertEquals(10000L, record.getRefundAmount());
        assertEquals(235000L, record.getNetPayable());
        assertEquals(SettlementStatus.PROCESSING, record.getStatus());
        assertEquals(LocalDate.of(2025, 1, 13), record.nextSettlementDate());
    }

    @Test
    @DisplayName("같은 기간 재실행 - 기존 기록 반환, 이중 정산 없음")
    void testGenerateSettlement_Idempotent() {
        // Given
        SettlementRecord first = fixture.settlementService
                .generateSettlement(TestDataFactory.MERCHANT_ID, PERIOD_START, PERIOD_END).orElseThrow();

        // When
        SettlementRecord second = fixture.settlementService
                .generateSettlement(TestDataFactory.MERCHANT_ID, PERIOD_START, PERIOD_END).orElseThrow();

        // Then
        assertEquals(first.getSettlementId(), second.getSettlementId());
        assertEquals(first.getSettlementNo(), second.getSettlementNo());
        assertEquals(1, fixture.settlementRecordRepository.count());
    }

    @Test
    @DisplayName("총매출 0 이하 - 기록하지 않음")
    void testGenerateSettlement_NoIncome() {
        // When
        Optional<SettlementRecord> record = fixture.settlementService
                .generateSettlement(QUIET_MERCHANT_ID, PERIOD_START, PERIOD_END);

        // Then
        assertTrue(record.isEmpty());
        assertEquals(0, fixture.settlementRecordRepository.count());
    }

    @Test
    @DisplayName("시작일이 종료일보다 늦음 - ValidationException")
    void testGenerateSettlement_InvalidPeriod() {
        assertThrows(ValidationException.class, () -> fixture.settlementService
                .generateSettlement(TestDataFactory.MERCHANT_ID, PERIOD_END, PERIOD_START));
    }

    @Test
    @DisplayName("지급 실패 후 재시도 완료 - COMPLETED, 완료 후 재완료 불가")
    void testFailThenComplete() {
        // Given
        SettlementRecord record = fixture.settlementService
                .generateSettlement(TestDataFactory.MERCHANT_ID, PERIOD_START, PERIOD_END).orElseThrow();

        // When
        SettlementRecord failed = fixture.settlementService.failSettlement(record.getSettlementId(), "은행 점검");
        assertEquals(SettlementStatus.FAILED, failed.getStatus());
        SettlementRecord completed = fixture.settlementService.completeSettlement(record.getSettlementId());

        // Then
        assertEquals(SettlementStatus.COMPLETED, completed.getStatus());
        assertEquals(fixture.now(), completed.getSettledAt());
        assertThrows(InvalidSettlementStatusException.class,
                () -> fixture.settlementService.completeSettlement(record.getSettlementId()));
    }

    @Test
    @DisplayName("없는 정산 조회 - SettlementNotFoundException")
    void testGetSettlement_NotFound() {
        assertThrows(SettlementNotFoundException.class, () -> fixture.settlementService.getSettlement(999L));
    }

    @Test
    @DisplayName("정산 목록 조회 - 기간 최신순, 잘못된 페이지 크기 ValidationException")
    void testGetSettlements() {
        // Given
        fixture.settlementService.generateSettlement(TestDataFactory.MERCHANT_ID, PERIOD_START, PERIOD_END);
        fixture.settlementService.generateSettlement(TestDataFactory.MERCHANT_ID,
                PERIOD_START.minusWeeks(1), PERIOD_END.minusWeeks(1));

        // When
        List<SettlementRecord> records = fixture.settlementService.getSettlements(TestDataFactory.MERCHANT_ID, 0, 10);

        // Then
        assertEquals(1, records.size());
        assertEquals(PERIOD_START, records.get(0).getPeriodStart());
        assertTrue(fixture.settlementService.getSettlements(TestDataFactory.MERCHANT_ID, 1, 10).isEmpty());
        assertThrows(ValidationException.class,
                () -> fixture.settlementService.getSettlements(TestDataFactory.MERCHANT_ID, 0, 0));
    }

    @Test
    @DisplayName("일별 요약 조회 - 기간 내 영업일 오름차순")
    void testGetDailySummaries() {
        // When
        List<FinanceDailySummary> summaries = fixture.dailySummaryService
                .getDailySummaries(TestDataFactory.MERCHANT_ID, PERIOD_START, PERIOD_END);

        // Then
        assertEquals(2, summaries.size());
        assertEquals(PERIOD_START, summaries.get(0).getSummaryDate());
        assertEquals(PERIOD_START.plusDays(3), summaries.get(1).getSummaryDate());
        assertThrows(ValidationException.class, () -> fixture.dailySummaryService
                .getDailySummaries(TestDataFactory.MERCHANT_ID, PERIOD_END, PERIOD_START));
    }
}
