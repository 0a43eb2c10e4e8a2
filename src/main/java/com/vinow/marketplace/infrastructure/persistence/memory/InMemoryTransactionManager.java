package com.vinow.marketplace.infrastructure.persistence.memory;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

/**
 * InMemoryTransactionManager - 메모리 저장소용 트랜잭션 매니저
 *
 * 실제 자원은 없지만 @Transactional 경계와 TransactionSynchronization
 * (커밋 후 이벤트 발행, 커밋 후 락 해제)을 JPA 모드와 동일하게 동작시킨다.
 * 롤백 시 메모리 상태는 되돌리지 않으므로, 도메인 메서드는 검증을 모두 통과한 뒤에만 상태를 바꾼다.
 */
public class InMemoryTransactionManager extends AbstractPlatformTransactionManager {

    @Override
    protected Object doGetTransaction() {
        return new Object();
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        // 메모리 저장소는 시작할 자원이 없음
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        // 저장 시점에 이미 반영됨
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        // 되돌릴 자원 없음
    }
}
