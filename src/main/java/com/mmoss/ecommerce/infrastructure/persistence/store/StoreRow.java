package com.mmoss.ecommerce.infrastructure.persistence.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * stores.csv 행
 */
@Getter
@Setter
@NoArgsConstructor
@JsonPropertyOrder({"store_id", "name", "address", "phone", "hours"})
public class StoreRow {

    @JsonProperty("store_id")
    private String storeId;

    private String name;
    private String address;
    private String phone;
    private String hours;
}
