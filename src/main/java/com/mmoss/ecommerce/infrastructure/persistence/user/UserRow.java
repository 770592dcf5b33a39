package com.mmoss.ecommerce.infrastructure.persistence.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * users.csv 행
 */
@Getter
@Setter
@NoArgsConstructor
@JsonPropertyOrder({"email", "password_hash", "role", "first_name", "last_name", "mobile", "address",
        "is_student", "vip_years", "vip_expires", "vip_cancelled", "funds"})
public class UserRow {

    private String email;

    @JsonProperty("password_hash")
    private String passwordHash;

    private String role;

    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    private String mobile;
    private String address;

    @JsonProperty("is_student")
    private String student;

    @JsonProperty("vip_years")
    private String vipYears;

    @JsonProperty("vip_expires")
    private String vipExpires;

    @JsonProperty("vip_cancelled")
    private String vipCancelled;

    private String funds;
}
