package com.mmoss.ecommerce.infrastructure.persistence.order;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * orders.csv 행 (항목 목록은 lines_json 컬럼에 JSON 배열로 저장)
 */
@Getter
@Setter
@NoArgsConstructor
@JsonPropertyOrder({"order_id", "email", "datetime", "fulfilment", "delivery_address", "store_id", "promo_code",
        "promo_discount", "student_discount", "delivery_fee", "subtotal", "total", "vip_pricing", "lines_json"})
public class OrderRow {

    @JsonProperty("order_id")
    private String orderId;

    private String email;
    private String datetime;
    private String fulfilment;

    @JsonProperty("delivery_address")
    private String deliveryAddress;

    @JsonProperty("store_id")
    private String storeId;

    @JsonProperty("promo_code")
    private String promoCode;

    @JsonProperty("promo_discount")
    private String promoDiscount;

    @JsonProperty("student_discount")
    private String studentDiscount;

    @JsonProperty("delivery_fee")
    private String deliveryFee;

    private String subtotal;
    private String total;

    @JsonProperty("vip_pricing")
    private String vipPricing;

    @JsonProperty("lines_json")
    private String linesJson;
}
