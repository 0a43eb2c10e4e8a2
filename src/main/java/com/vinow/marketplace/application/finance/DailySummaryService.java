package com.vinow.marketplace.application.finance;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.domain.finance.FinanceDailySummary;
import com.vinow.marketplace.domain.finance.FinanceDailySummaryRepository;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.infrastructure.config.MarketplaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * DailySummaryService - 가맹점 일별 매출 요약
 *
 * 비즈니스 규칙:
 * - 입력: 해당 영업일에 생성된 주문 [date 00:00, date+1 00:00)
 * - (merchantId, date) 기준 upsert → 재실행해도 행은 하나
 * - 주문이 없는 날은 행을 만들지 않는다
 */
@Slf4j
@Service
public class DailySummaryService {

    private final OrderRepository orderRepository;
    private final FinanceDailySummaryRepository financeDailySummaryRepository;
    private final BigDecimal platformFeeRate;
    private final Clock clock;

    public DailySummaryService(OrderRepository orderRepository,
                               FinanceDailySummaryRepository financeDailySummaryRepository,
                               MarketplaceProperties properties,
                               Clock clock) {
        this.orderRepository = orderRepository;
        this.financeDailySummaryRepository = financeDailySummaryRepository;
        this.platformFeeRate = properties.getFinance().getPlatformFeeRate();
        this.clock = clock;
    }

    /**
     * @return 주문이 없으면 empty
     */
    @Transactional
    public Optional<FinanceDailySummary> generateDailySummary(Long merchantId, LocalDate summaryDate) {
        List<Order> orders = orderRepository.findByMerchantIdAndCreatedAtBetween(merchantId,
                summaryDate.atStartOfDay(), summaryDate.plusDays(1).atStartOfDay());
        if (orders.isEmpty()) {
            log.info("[DailySummaryService] 주문 없음, 건너뜀 - merchantId={}, date={}", merchantId, summaryDate);
            return Optional.empty();
        }

        FinanceDailySummary calculated = FinanceDailySummary.calculate(merchantId, summaryDate, orders,
                platformFeeRate, LocalDateTime.now(clock));

        FinanceDailySummary saved = financeDailySummaryRepository
                .findByMerchantIdAndSummaryDate(merchantId, summaryDate)
                .map(existing -> {
                    existing.refreshFrom(calculated);
                    return financeDailySummaryRepository.save(existing);
                })
                .orElseGet(() -> financeDailySummaryRepository.save(calculated));

        log.info("[DailySummaryService] 일별 요약 저장 - merchantId={}, date={}, orders={}, totalIncome={}, settlementAmount={}",
                merchantId, summaryDate, saved.getOrderCount(), saved.getTotalIncome(), saved.getSettlementAmount());
        return Optional.of(saved);
    }

    @Transactional(readOnly = true)
    public List<FinanceDailySummary> getDailySummaries(Long merchantId, LocalDate startDate, LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            throw new ValidationException("시작일이 종료일보다 늦습니다");
        }
        return financeDailySummaryRepository.findByMerchantIdAndSummaryDateBetween(merchantId, startDate, endDate);
    }
}
