package com.vinow.marketplace.application.order;

import com.vinow.marketplace.application.order.dto.CreateOrderCommand;
import com.vinow.marketplace.application.order.dto.OrderItemCommand;
import com.vinow.marketplace.application.order.dto.OrderPageResult;
import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.common.id.BusinessIdGenerator;
import com.vinow.marketplace.common.id.IdPrefix;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderItem;
import com.vinow.marketplace.domain.order.OrderNotFoundException;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.PaymentStatus;
import com.vinow.marketplace.infrastructure.lock.LockKeyGenerator;
import com.vinow.marketplace.infrastructure.lock.OrderLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 생성/조회 및 결제 상태 통지 처리
 *
 * 역할:
 * - 주문 생성 협력 시스템: createOrder (PENDING, 주문번호 + 검증 코드 할당)
 * - 결제 협력 시스템: updatePaymentStatus
 * - 조회: 단건 / 주문번호 / 가맹점 목록
 */
@Slf4j
@Service
public class OrderService {

    private static final int MAX_PAGE_SIZE = 100;

    private final OrderRepository orderRepository;
    private final BusinessIdGenerator idGenerator;
    private final VerificationCodeGenerator verificationCodeGenerator;
    private final OrderLockManager orderLockManager;
    private final OrderTransactionService orderTransactionService;
    private final Clock clock;

    public OrderService(OrderRepository orderRepository,
                        BusinessIdGenerator idGenerator,
                        VerificationCodeGenerator verificationCodeGenerator,
                        OrderLockManager orderLockManager,
                        OrderTransactionService orderTransactionService,
                        Clock clock) {
        this.orderRepository = orderRepository;
        this.idGenerator = idGenerator;
        this.verificationCodeGenerator = verificationCodeGenerator;
        this.orderLockManager = orderLockManager;
        this.orderTransactionService = orderTransactionService;
        this.clock = clock;
    }

    /**
     * 주문 생성
     *
     * 처리 흐름:
     * 1. 항목 스냅샷 생성 (수량/단가 검증, subtotal 계산)
     * 2. 주문번호(ORD...) 및 검증 코드 할당
     * 3. PENDING 상태로 저장
     */
    @Transactional
    public Order createOrder(CreateOrderCommand command) {
        if (command == null || command.getItems() == null || command.getItems().isEmpty()) {
            throw new ValidationException("주문 항목은 최소 1개 이상이어야 합니다");
        }

        // STEP 1: 항목 스냅샷
        List<OrderItem> items = command.getItems().stream()
                .map(this::toOrderItem)
                .collect(Collectors.toList());

        // STEP 2: 식별자 할당
        String orderNumber = idGenerator.next(IdPrefix.ORDER);
        String verificationCode = verificationCodeGenerator.generate();

        // STEP 3: 저장
        Order order = Order.createOrder(orderNumber, command.getMerchantId(), command.getStoreId(),
                command.getUserId(), items, command.getDiscountAmount(), command.getPaymentMethod(),
                command.getCurrency(), verificationCode, LocalDateTime.now(clock));
        Order savedOrder = orderRepository.save(order);

        log.info("[OrderService] 주문 생성 - orderId={}, orderNumber={}, merchantId={}, finalAmount={}",
                savedOrder.getOrderId(), orderNumber, savedOrder.getMerchantId(), savedOrder.getFinalAmount());
        return savedOrder;
    }

    /**
     * 결제 상태 통지 (결제/에스크로 협력 시스템)
     */
    public Order updatePaymentStatus(Long orderId, PaymentStatus paymentStatus) {
        if (orderId == null) {
            throw new ValidationException("주문 ID는 필수입니다");
        }
        return orderLockManager.executeWithLock(LockKeyGenerator.order(orderId),
                () -> orderTransactionService.applyPaymentStatus(orderId, paymentStatus));
    }

    @Transactional(readOnly = true)
    public Order getOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Transactional(readOnly = true)
    public Order getOrderByNumber(String orderNumber) {
        return orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> new OrderNotFoundException(orderNumber));
    }

    /**
     * 가맹점 주문 목록 (최신 생성순)
     *
     * @param status null이면 전체 상태
     */
    @Transactional(readOnly = true)
    public OrderPageResult getMerchantOrders(Long merchantId, OrderStatus status, int page, int size) {
        validatePaging(page, size);
        List<Order> orders = orderRepository.findByMerchantId(merchantId, status, page, size);
        long totalCount = orderRepository.countByMerchantId(merchantId, status);
        return OrderPageResult.builder()
                .orders(orders)
                .page(page)
                .size(size)
                .totalCount(totalCount)
                .build();
    }

    private OrderItem toOrderItem(OrderItemCommand item) {
        return OrderItem.createOrderItem(item.getProductId(), item.getProductName(),
                item.getUnitPrice(), item.getQuantity());
    }

    static void validatePaging(int page, int size) {
        if (page < 0) {
            throw new ValidationException("page는 0 이상이어야 합니다");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("size는 1~" + MAX_PAGE_SIZE + " 사이여야 합니다");
        }
    }
}
