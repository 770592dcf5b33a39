package com.mmoss.ecommerce.infrastructure.persistence.membership;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.user.MembershipAction;
import com.mmoss.ecommerce.domain.user.MembershipHistoryEntry;
import com.mmoss.ecommerce.domain.user.MembershipHistoryRepository;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.infrastructure.persistence.common.CsvFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CsvMembershipHistoryRepository - membership.csv 추가 전용 로그
 *
 * 조회 시마다 파일을 읽는다 (프로필 화면에서만 사용).
 */
@Repository
public class CsvMembershipHistoryRepository implements MembershipHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(CsvMembershipHistoryRepository.class);

    public static final String FILE_NAME = "membership.csv";

    private final CsvFileStore<MembershipRow> fileStore;

    @Autowired
    public CsvMembershipHistoryRepository(ShopPolicy shopPolicy, CsvMapper csvMapper) {
        this(Path.of(shopPolicy.getDataDir(), FILE_NAME), csvMapper);
    }

    public CsvMembershipHistoryRepository(Path file, CsvMapper csvMapper) {
        this.fileStore = new CsvFileStore<>(file, MembershipRow.class, csvMapper);
    }

    @Override
    public void append(MembershipHistoryEntry entry) {
        MembershipRow row = new MembershipRow();
        row.setEmail(entry.getEmail());
        row.setAction(entry.getAction().name());
        row.setYears(String.valueOf(entry.getYears()));
        row.setAmount(entry.getAmount().toPlainString());
        row.setDatetime(entry.getOccurredAt().truncatedTo(ChronoUnit.SECONDS).toString());
        row.setNotes(entry.getNotes() == null ? "" : entry.getNotes());
        fileStore.append(row);
    }

    @Override
    public List<MembershipHistoryEntry> findByEmail(String email) {
        String normalized = User.normalizeEmail(email);
        List<MembershipHistoryEntry> entries = new ArrayList<>();
        for (MembershipRow row : fileStore.readAll()) {
            if (row.getEmail() == null || !normalized.equals(User.normalizeEmail(row.getEmail()))) {
                continue;
            }
            try {
                entries.add(MembershipHistoryEntry.builder()
                        .email(normalized)
                        .action(MembershipAction.valueOf(row.getAction().trim().toUpperCase(Locale.ROOT)))
                        .years(Integer.parseInt(row.getYears().trim()))
                        .amount(Money.of(row.getAmount()))
                        .occurredAt(LocalDateTime.parse(row.getDatetime().trim()))
                        .notes(row.getNotes())
                        .build());
            } catch (RuntimeException e) {
                log.warn("[CsvMembershipHistoryRepository] 잘못된 행 건너뜀: email={}, reason={}", email, e.getMessage());
            }
        }
        return entries;
    }
}
