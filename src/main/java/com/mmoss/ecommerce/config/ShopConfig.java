package com.mmoss.ecommerce.config;

import com.mmoss.ecommerce.domain.common.vo.Money;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 쇼핑몰 운영 정책 설정
 *
 * application.yml의 mmoss.* 값을 읽어 ShopPolicy Bean을 구성합니다.
 * 날짜 계산(VIP 만료, 유통기한, 주문 시각)은 Clock Bean을 통해 수행합니다.
 */
@Configuration
public class ShopConfig {

    @Value("${mmoss.data-dir:./data}")
    private String dataDir;

    @Value("${mmoss.delivery-fee:20.00}")
    private String deliveryFee;

    @Value("${mmoss.student-pickup-discount-percent:5}")
    private int studentPickupDiscountPercent;

    @Value("${mmoss.vip-cost-per-year:20.00}")
    private String vipCostPerYear;

    @Value("${mmoss.max-top-up:1000.00}")
    private String maxTopUp;

    @Value("${mmoss.staff-email-domain:monash.edu}")
    private String staffEmailDomain;

    @Value("${mmoss.max-categories:10}")
    private int maxCategories;

    @Bean
    public ShopPolicy shopPolicy() {
        return ShopPolicy.builder()
                .dataDir(dataDir)
                .deliveryFee(Money.of(deliveryFee))
                .studentPickupDiscountPercent(studentPickupDiscountPercent)
                .vipCostPerYear(Money.of(vipCostPerYear))
                .maxTopUp(Money.of(maxTopUp))
                .staffEmailDomain(staffEmailDomain)
                .maxCategories(maxCategories)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
