package com.mmoss.ecommerce.domain.user;

import java.util.List;

/**
 * 회원권 이력 저장소 (추가 전용 로그)
 */
public interface MembershipHistoryRepository {

    void append(MembershipHistoryEntry entry);

    List<MembershipHistoryEntry> findByEmail(String email);
}
