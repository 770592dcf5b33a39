package com.mmoss.ecommerce.infrastructure.persistence.common;

import com.mmoss.ecommerce.domain.common.repository.KeyedRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * AbstractCsvRepository - CSV 파일 기반 KeyedRepository 공통 구현
 *
 * 책임:
 * - 파일 내용을 메모리 캐시(LinkedHashMap, 파일 순서 유지)에 적재
 * - 첫 조회 시 지연 적재
 * - 변환 실패 행은 경고 로그를 남기고 건너뜀
 *
 * 하위 클래스는 키 정규화와 행 ↔ 도메인 변환만 구현한다.
 *
 * @param <T> 도메인 타입
 * @param <R> CSV 행 타입
 */
public abstract class AbstractCsvRepository<T, R> implements KeyedRepository<String, T> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final CsvFileStore<R> fileStore;
    private final Map<String, T> cache = new LinkedHashMap<>();
    private boolean loaded;

    protected AbstractCsvRepository(CsvFileStore<R> fileStore) {
        this.fileStore = fileStore;
    }

    protected abstract String normalizeKey(String key);

    protected abstract String keyOf(T record);

    /**
     * @throws IllegalArgumentException 행 값이 도메인 규칙을 위반하는 경우
     */
    protected abstract T toDomain(R row);

    protected abstract R toRow(T record);

    @Override
    public List<T> loadAll() {
        List<R> rows = fileStore.readAll();
        cache.clear();
        int skipped = 0;
        for (R row : rows) {
            try {
                T record = toDomain(row);
                cache.put(keyOf(record), record);
            } catch (RuntimeException e) {
                skipped++;
                log.warn("[{}] 잘못된 행 건너뜀: file={}, reason={}",
                        getClass().getSimpleName(), fileStore.getFile().getFileName(), e.getMessage());
            }
        }
        loaded = true;
        log.info("[{}] 로드 완료: count={}, skipped={}", getClass().getSimpleName(), cache.size(), skipped);
        return new ArrayList<>(cache.values());
    }

    @Override
    public Optional<T> findByKey(String key) {
        ensureLoaded();
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(normalizeKey(key)));
    }

    @Override
    public void upsert(T record) {
        ensureLoaded();
        cache.put(keyOf(record), record);
    }

    @Override
    public void saveAll() {
        ensureLoaded();
        fileStore.writeAll(cache.values().stream().map(this::toRow).collect(Collectors.toList()));
    }

    public boolean fileExists() {
        return fileStore.exists();
    }

    protected Collection<T> cachedValues() {
        ensureLoaded();
        return cache.values();
    }

    protected boolean containsKey(String key) {
        ensureLoaded();
        return cache.containsKey(normalizeKey(key));
    }

    protected T removeFromCache(String key) {
        ensureLoaded();
        return cache.remove(normalizeKey(key));
    }

    protected void putInCache(T record) {
        ensureLoaded();
        cache.put(keyOf(record), record);
    }

    private void ensureLoaded() {
        if (!loaded) {
            loadAll();
        }
    }

    // ========== 행 변환 헬퍼 ==========

    protected static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    protected static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
