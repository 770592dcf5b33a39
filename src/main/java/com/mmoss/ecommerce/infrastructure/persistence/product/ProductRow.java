package com.mmoss.ecommerce.infrastructure.persistence.product;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * products.csv 행
 */
@Getter
@Setter
@NoArgsConstructor
@JsonPropertyOrder({"sku", "name", "brand", "description", "category", "subcategory", "price", "member_price",
        "quantity", "is_food", "expiry_date", "ingredients", "storage", "allergens"})
public class ProductRow {

    private String sku;
    private String name;
    private String brand;
    private String description;
    private String category;
    private String subcategory;
    private String price;

    @JsonProperty("member_price")
    private String memberPrice;

    private String quantity;

    @JsonProperty("is_food")
    private String food;

    @JsonProperty("expiry_date")
    private String expiryDate;

    private String ingredients;
    private String storage;
    private String allergens;
}
