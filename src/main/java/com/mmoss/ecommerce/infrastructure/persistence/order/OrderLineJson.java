package com.mmoss.ecommerce.infrastructure.persistence.order;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * lines_json 배열 원소
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineJson {

    private String sku;
    private String name;
    private int quantity;

    @JsonProperty("regular_price")
    private BigDecimal regularPrice;

    @JsonProperty("member_price")
    private BigDecimal memberPrice;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;
}
