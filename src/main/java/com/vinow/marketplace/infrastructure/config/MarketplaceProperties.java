package com.vinow.marketplace.infrastructure.config;

import com.vinow.marketplace.domain.order.OrderStatus;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * marketplace.* 설정 (application.yml)
 *
 * 모든 컴포넌트는 이 객체를 주입받아 사용한다.
 * 컴포넌트 내부에서 설정값을 따로 읽지 않는다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    private Datastore datastore = new Datastore();
    private Order order = new Order();
    private Lock lock = new Lock();
    private Finance finance = new Finance();
    private Batch batch = new Batch();
    private Events events = new Events();

    @Getter
    @Setter
    public static class Datastore {
        /**
         * memory | jpa
         */
        private String type = "jpa";
    }

    @Getter
    @Setter
    public static class Order {
        private List<OrderStatus> redeemableStatuses = new ArrayList<>(List.of(
                OrderStatus.PENDING, OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY));
        private int verificationCodeLength = 8;
    }

    @Getter
    @Setter
    public static class Lock {
        private LockType type = LockType.LOCAL;
        private Duration waitTime = Duration.ofSeconds(3);
        private Duration leaseTime = Duration.ofSeconds(10);
    }

    public enum LockType {
        LOCAL, REDIS
    }

    @Getter
    @Setter
    public static class Finance {
        private BigDecimal platformFeeRate = new BigDecimal("0.02");
        private ZoneId zone = ZoneId.of("Asia/Ho_Chi_Minh");
    }

    @Getter
    @Setter
    public static class Batch {
        private boolean schedulerEnabled = true;
        private int poolSize = 8;
        private Duration merchantTimeout = Duration.ofMinutes(2);
        private String dailySummaryCron = "0 0 1 * * *";
        private String settlementCron = "0 0 2 * * MON";
        private String reconciliationCron = "0 0 3 * * *";
        private String reportCleanupCron = "0 0 4 * * *";
    }

    @Getter
    @Setter
    public static class Events {
        private boolean kafkaEnabled = false;
        private String orderTopic = "marketplace.order-events";
    }
}
