package com.mmoss.ecommerce.infrastructure.persistence.membership;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * membership.csv 행
 */
@Getter
@Setter
@NoArgsConstructor
@JsonPropertyOrder({"email", "action", "years", "amount", "datetime", "notes"})
public class MembershipRow {

    private String email;
    private String action;
    private String years;
    private String amount;
    private String datetime;
    private String notes;
}
