package com.claude.warehouse.rules;

import lombok.Value;

import java.math.BigDecimal;

/**
 * 보정이 끝난 판매 금액/수량/단가 묶음
 */
@Value
public class SalesFigures {
    BigDecimal amount;
    Integer quantity;
    BigDecimal price;
}
