package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.domain.common.repository.KeyedRepository;

/**
 * UserRepository - 사용자 저장소 인터페이스 (Domain 계층)
 *
 * 키는 이메일 (대소문자 무시).
 */
public interface UserRepository extends KeyedRepository<String, User> {

    boolean isEmpty();
}
