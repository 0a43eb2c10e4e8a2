package com.vinow.marketplace.infrastructure.persistence;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * marketplace.datastore.type=jpa (기본값) 일 때 등록되는 MySQL 저장소 구현
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@ConditionalOnProperty(prefix = "marketplace.datastore", name = "type", havingValue = "jpa", matchIfMissing = true)
public @interface JpaDatastore {
}
