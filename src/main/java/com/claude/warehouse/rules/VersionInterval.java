package com.claude.warehouse.rules;

import lombok.Value;

import java.time.LocalDate;

/**
 * 유효기간 종료일이 계산된 버전 레코드
 */
@Value
public class VersionInterval<T> {
    T version;
    LocalDate endDate;
}
