package com.mmoss.ecommerce.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Jackson 설정
 *
 * 목적:
 * - ObjectMapper: orders.csv의 lines_json 컬럼 직렬화
 * - CsvMapper: 모든 CSV 파일 읽기/쓰기
 *
 * 설정 내용:
 * - JavaTimeModule 등록, 날짜는 ISO-8601 문자열
 * - 알 수 없는 속성/컬럼 무시 (이전 버전 파일 호환)
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }

    @Bean
    public CsvMapper csvMapper() {
        return createCsvMapper();
    }

    /**
     * Spring 컨텍스트 밖(테스트)에서도 같은 설정으로 생성할 수 있도록 분리
     */
    public static CsvMapper createCsvMapper() {
        CsvMapper csvMapper = new CsvMapper();
        csvMapper.registerModule(new JavaTimeModule());
        csvMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        return csvMapper;
    }
}
