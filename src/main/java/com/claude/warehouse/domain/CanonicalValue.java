package com.claude.warehouse.domain;

/**
 * Silver 레이어 표준 어휘(canonical vocabulary)의 공통 계약
 *
 * 정규화된 컬럼은 원본 코드를 그대로 저장하지 않고
 * 항상 닫힌 집합의 라벨 중 하나로만 저장된다.
 */
public interface CanonicalValue {

    String getLabel();
}
