package com.claude.warehouse.rules;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * 숫자/날짜 컬럼 보정 규칙
 *
 * 모든 규칙은 레코드 자신의 컬럼만 사용하는 순수 함수이며
 * 잘못된 값은 예외 대신 null 또는 파생값으로 대체한다.
 */
@Component
public class ValueRepairRules {

    static final int MONEY_SCALE = 2;
    static final int CATEGORY_PREFIX_LENGTH = 5;
    static final int PRODUCT_KEY_SUFFIX_OFFSET = 6;

    private static final BigDecimal ZERO_MONEY = BigDecimal.ZERO.setScale(MONEY_SCALE);
    private static final DateTimeFormatter PACKED_DATE = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * 판매 금액 = 수량 x 단가 관계를 기준으로 손상된 값을 보정
     *
     * 1. 금액이 null 이거나 0 이하: 수량과 단가가 모두 있으면 수량 x |단가|, 아니면 0
     * 2. 수량이 null 이거나 음수: 0
     * 3. 단가가 null 이거나 0: 수량이 0이 아니면 금액 / 수량, 아니면 0
     *    단가가 음수: 절댓값 (3번의 null/0 규칙과 배타적)
     */
    public SalesFigures reconcileSales(BigDecimal rawAmount, Integer rawQuantity, BigDecimal rawPrice) {
        int quantity = rawQuantity == null || rawQuantity < 0 ? 0 : rawQuantity;

        BigDecimal amount;
        if (rawAmount == null || rawAmount.signum() <= 0) {
            amount = rawQuantity != null && rawPrice != null
                    ? BigDecimal.valueOf(quantity).multiply(rawPrice.abs())
                    : BigDecimal.ZERO;
        } else {
            amount = rawAmount;
        }
        amount = money(amount);

        BigDecimal price;
        if (rawPrice == null || rawPrice.signum() == 0) {
            price = quantity != 0
                    ? amount.divide(BigDecimal.valueOf(quantity), MONEY_SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
        } else if (rawPrice.signum() < 0) {
            price = rawPrice.abs();
        } else {
            price = rawPrice;
        }

        return new SalesFigures(amount, quantity, money(price));
    }

    /**
     * 제품 키 앞 5자리를 카테고리 ID 로 사용 ('-' 를 '_' 로 치환)
     */
    public String categoryId(String productKey) {
        if (productKey == null) {
            return null;
        }
        String prefix = productKey.substring(0, Math.min(CATEGORY_PREFIX_LENGTH, productKey.length()));
        return prefix.replace('-', '_');
    }

    /**
     * 카테고리 접두어와 구분자를 제외한 나머지 제품 키
     */
    public String productKeySuffix(String productKey) {
        if (productKey == null) {
            return null;
        }
        if (productKey.length() <= PRODUCT_KEY_SUFFIX_OFFSET) {
            return "";
        }
        return productKey.substring(PRODUCT_KEY_SUFFIX_OFFSET);
    }

    public BigDecimal costOrZero(BigDecimal cost) {
        return cost == null ? ZERO_MONEY : money(cost);
    }

    /**
     * 처리 기준일보다 미래인 생년월일은 무효로 보고 null 처리
     */
    public LocalDate birthDateOrNull(LocalDate birthDate, LocalDate processingDate) {
        if (birthDate == null || birthDate.isAfter(processingDate)) {
            return null;
        }
        return birthDate;
    }

    /**
     * YYYYMMDD 정수 날짜 변환. 정확히 8자리이고 실제 달력 날짜인 경우만 변환, 그 외는 null
     */
    public LocalDate packedDate(Integer packed) {
        if (packed == null || packed < 10_000_000 || packed > 99_999_999) {
            return null;
        }
        try {
            return LocalDate.parse(String.valueOf(packed), PACKED_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
