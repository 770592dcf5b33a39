package com.mmoss.ecommerce.infrastructure.persistence.common;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.mmoss.ecommerce.common.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * CsvFileStore - 헤더가 있는 UTF-8 CSV 파일 하나를 행 타입 R로 읽고 쓴다
 *
 * 책임:
 * - 전체 읽기 (파일이 없으면 빈 목록)
 * - 전체 쓰기 (임시 파일 작성 후 원자적 교체)
 * - 한 행 추가 (빈 파일이면 헤더 먼저 기록)
 *
 * 컬럼 순서는 행 타입의 @JsonPropertyOrder를 따르며,
 * 읽을 때는 파일 헤더 기준으로 컬럼을 매핑한다.
 *
 * @param <R> CSV 행 타입
 */
public class CsvFileStore<R> {

    private static final Logger log = LoggerFactory.getLogger(CsvFileStore.class);

    private final Path file;
    private final Class<R> rowType;
    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public CsvFileStore(Path file, Class<R> rowType, CsvMapper csvMapper) {
        this.file = file;
        this.rowType = rowType;
        this.csvMapper = csvMapper;
        this.schema = csvMapper.schemaFor(rowType).withHeader().withColumnReordering(true);
    }

    public Path getFile() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    /**
     * @throws PersistenceException 파일을 읽을 수 없거나 형식이 깨진 경우
     */
    public List<R> readAll() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<R> rows = csvMapper.readerFor(rowType).with(schema).readValues(reader)) {
            return rows.readAll();
        } catch (IOException | RuntimeJsonMappingException e) {
            log.error("[CsvFileStore] CSV 읽기 실패: file={}", file, e);
            throw new PersistenceException("read " + file.getFileName(), e);
        }
    }

    /**
     * 전체 행을 임시 파일에 쓴 뒤 원본과 교체한다.
     *
     * @throws PersistenceException 쓰기 또는 교체 실패
     */
    public void writeAll(List<R> rows) {
        Path tempFile = null;
        try {
            Path directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");

            try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                if (rows.isEmpty()) {
                    writer.write(headerLine());
                } else {
                    try (SequenceWriter sequenceWriter = csvMapper.writerFor(rowType).with(schema).writeValues(writer)) {
                        sequenceWriter.writeAll(rows);
                    }
                }
            }
            moveIntoPlace(tempFile);
            log.debug("[CsvFileStore] CSV 저장 완료: file={}, rows={}", file, rows.size());
        } catch (IOException e) {
            deleteQuietly(tempFile);
            log.error("[CsvFileStore] CSV 저장 실패: file={}", file, e);
            throw new PersistenceException("write " + file.getFileName(), e);
        }
    }

    /**
     * 파일 끝에 한 행을 추가한다.
     *
     * @throws PersistenceException 쓰기 실패
     */
    public void append(R row) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            boolean needsHeader = !Files.exists(file) || Files.size(file) == 0;
            CsvSchema appendSchema = needsHeader ? schema : schema.withoutHeader();
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                csvMapper.writerFor(rowType).with(appendSchema).writeValue(writer, row);
            }
        } catch (IOException e) {
            log.error("[CsvFileStore] CSV 행 추가 실패: file={}", file, e);
            throw new PersistenceException("append " + file.getFileName(), e);
        }
    }

    private String headerLine() {
        List<String> names = new ArrayList<>();
        for (CsvSchema.Column column : schema) {
            names.add(column.getName());
        }
        return String.join(",", names) + "\n";
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("[CsvFileStore] 임시 파일 삭제 실패: file={}", tempFile, e);
        }
    }
}
