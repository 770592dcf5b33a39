package com.mmoss.ecommerce.infrastructure.persistence.user;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.user.Role;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.domain.user.UserRepository;
import com.mmoss.ecommerce.domain.user.VipMembership;
import com.mmoss.ecommerce.infrastructure.persistence.common.AbstractCsvRepository;
import com.mmoss.ecommerce.infrastructure.persistence.common.CsvFileStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * CsvUserRepository - users.csv 기반 사용자 저장소
 */
@Repository
public class CsvUserRepository extends AbstractCsvRepository<User, UserRow> implements UserRepository {

    public static final String FILE_NAME = "users.csv";

    @Autowired
    public CsvUserRepository(ShopPolicy shopPolicy, CsvMapper csvMapper) {
        this(Path.of(shopPolicy.getDataDir(), FILE_NAME), csvMapper);
    }

    public CsvUserRepository(Path file, CsvMapper csvMapper) {
        super(new CsvFileStore<>(file, UserRow.class, csvMapper));
    }

    @Override
    public boolean isEmpty() {
        return cachedValues().isEmpty();
    }

    @Override
    protected String normalizeKey(String key) {
        return User.normalizeEmail(key);
    }

    @Override
    protected String keyOf(User user) {
        return user.getEmail();
    }

    @Override
    protected User toDomain(UserRow row) {
        String email = User.normalizeEmail(row.getEmail());
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일이 비어 있습니다");
        }
        String expires = blankToNull(row.getVipExpires());
        String years = blankToNull(row.getVipYears());
        VipMembership membership = new VipMembership(
                expires == null ? null : LocalDate.parse(expires),
                years == null ? 0 : Integer.parseInt(years),
                Boolean.parseBoolean(blankToNull(row.getVipCancelled())));
        String funds = blankToNull(row.getFunds());

        return User.builder()
                .email(email)
                .passwordHash(row.getPasswordHash())
                .role(Role.fromString(row.getRole()))
                .firstName(blankToNull(row.getFirstName()))
                .lastName(blankToNull(row.getLastName()))
                .mobile(blankToNull(row.getMobile()))
                .address(blankToNull(row.getAddress()))
                .student(Boolean.parseBoolean(blankToNull(row.getStudent())))
                .funds(funds == null ? Money.ZERO : Money.of(funds))
                .vipMembership(membership)
                .build();
    }

    @Override
    protected UserRow toRow(User user) {
        VipMembership membership = user.getVipMembership();
        UserRow row = new UserRow();
        row.setEmail(user.getEmail());
        row.setPasswordHash(user.getPasswordHash());
        row.setRole(user.getRole().name());
        row.setFirstName(nullToEmpty(user.getFirstName()));
        row.setLastName(nullToEmpty(user.getLastName()));
        row.setMobile(nullToEmpty(user.getMobile()));
        row.setAddress(nullToEmpty(user.getAddress()));
        row.setStudent(String.valueOf(user.isStudent()));
        row.setVipYears(String.valueOf(membership.getYears()));
        row.setVipExpires(membership.getExpiryDate() == null ? "" : membership.getExpiryDate().toString());
        row.setVipCancelled(String.valueOf(membership.isCancelled()));
        row.setFunds(user.getFunds().toPlainString());
        return row;
    }
}
