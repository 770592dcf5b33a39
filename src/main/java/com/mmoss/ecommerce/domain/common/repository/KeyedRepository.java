package com.mmoss.ecommerce.domain.common.repository;

import java.util.List;
import java.util.Optional;

/**
 * KeyedRepository - 키 기반 레코드 저장소 공통 인터페이스 (Domain 계층)
 *
 * 역할:
 * - 결제 엔진과 서비스가 파일 I/O 대신 의존하는 최소 계약
 * - CSV, 메모리 등 어떤 저장 매체로도 구현 가능
 *
 * 동작 규칙:
 * - loadAll(): 저장 매체에서 전체 레코드를 다시 읽어 캐시를 교체하고 목록 반환
 * - findByKey(): 캐시에서 조회 (반환된 객체는 캐시의 실제 인스턴스)
 * - upsert(): 캐시에 추가 또는 교체 (저장 매체 반영은 saveAll 호출 시)
 * - saveAll(): 캐시 전체를 저장 매체에 기록
 *
 * @param <K> 키 타입
 * @param <T> 레코드 타입
 */
public interface KeyedRepository<K, T> {

    List<T> loadAll();

    Optional<T> findByKey(K key);

    void upsert(T record);

    /**
     * @throws com.mmoss.ecommerce.common.exception.PersistenceException 기록 실패
     */
    void saveAll();
}
