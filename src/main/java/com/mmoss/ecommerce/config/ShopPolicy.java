package com.mmoss.ecommerce.config;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;

/**
 * ShopPolicy - 설정 파일(application.yml, prefix "mmoss")에서 읽은 운영 정책 값
 *
 * 항목:
 * - dataDir: CSV 데이터 디렉터리
 * - deliveryFee: 배송비 (학생 면제)
 * - studentPickupDiscountPercent: 학생 픽업 할인율
 * - vipCostPerYear: VIP 연회비
 * - maxTopUp: 1회 충전 한도
 * - staffEmailDomain: 교직원 이메일 도메인
 * - maxCategories: 카탈로그 카테고리 수 상한
 */
@Getter
@Builder
public class ShopPolicy {

    private final String dataDir;
    private final Money deliveryFee;
    private final int studentPickupDiscountPercent;
    private final Money vipCostPerYear;
    private final Money maxTopUp;
    private final String staffEmailDomain;
    private final int maxCategories;

    /**
     * 기본 정책 (테스트 및 설정 누락 시 참고값)
     */
    public static ShopPolicy defaults(String dataDir) {
        return ShopPolicy.builder()
                .dataDir(dataDir)
                .deliveryFee(Money.of("20.00"))
                .studentPickupDiscountPercent(5)
                .vipCostPerYear(Money.of("20.00"))
                .maxTopUp(Money.of("1000.00"))
                .staffEmailDomain("monash.edu")
                .maxCategories(10)
                .build();
    }
}
