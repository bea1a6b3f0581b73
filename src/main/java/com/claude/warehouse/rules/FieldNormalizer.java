package com.claude.warehouse.rules;

import com.claude.warehouse.domain.Gender;
import com.claude.warehouse.domain.MaintenanceFlag;
import com.claude.warehouse.domain.MaritalStatus;
import com.claude.warehouse.domain.ProductLine;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 코드/자유 텍스트 컬럼을 표준 어휘로 매핑
 *
 * 매핑 규칙:
 * - 비교 전 모든 제어 문자 제거, 앞뒤 공백 제거, 대문자 변환
 * - 알 수 없는 값은 원본을 통과시키지 않고 항상 Unknown/Other 로 매핑
 * - 어떤 입력에도 예외를 던지지 않음
 */
@Component
public class FieldNormalizer {

    static final String DEMOGRAPHIC_TAG = "NAS";
    static final int DEMOGRAPHIC_TAG_PREFIX_LENGTH = 3;

    public MaritalStatus maritalStatus(String raw) {
        switch (comparable(raw)) {
            case "S": return MaritalStatus.SINGLE;
            case "M": return MaritalStatus.MARRIED;
            default: return MaritalStatus.UNKNOWN;
        }
    }

    public Gender gender(String raw) {
        switch (comparable(raw)) {
            case "F":
            case "FEMALE":
                return Gender.FEMALE;
            case "M":
            case "MALE":
                return Gender.MALE;
            default:
                return Gender.UNKNOWN;
        }
    }

    public ProductLine productLine(String raw) {
        switch (comparable(raw)) {
            case "M": return ProductLine.MOUNTAIN;
            case "R": return ProductLine.ROAD;
            case "T": return ProductLine.TOURING;
            default: return ProductLine.OTHER;
        }
    }

    public MaintenanceFlag maintenanceFlag(String raw) {
        switch (comparable(raw)) {
            case "YES":
            case "Y":
            case "1":
            case "TRUE":
                return MaintenanceFlag.YES;
            case "NO":
            case "N":
            case "0":
            case "FALSE":
                return MaintenanceFlag.NO;
            default:
                return MaintenanceFlag.UNKNOWN;
        }
    }

    /**
     * 국가 코드 표준화. 코드가 아닌 값은 정리된 텍스트 그대로 사용
     */
    public String country(String raw) {
        String cleaned = TextCleaner.clean(raw);
        if (cleaned == null) {
            return null;
        }
        switch (cleaned.toUpperCase(Locale.ROOT)) {
            case "DE": return "Germany";
            case "US":
            case "USA":
                return "United States";
            case "": return "n/a";
            default: return cleaned;
        }
    }

    /**
     * ERP 인구통계 키 정리
     *
     * 'NAS' 로 끝나는 키는 앞의 3자리 태그를 잘라낸 나머지를 고객 키로 사용한다.
     * 예) AB-123-NAS -> 123-NAS
     */
    public String demographicCustomerKey(String raw) {
        String key = TextCleaner.cleanKey(raw);
        if (key == null) {
            return null;
        }
        if (key.toUpperCase(Locale.ROOT).endsWith(DEMOGRAPHIC_TAG)) {
            return TextCleaner.cleanKey(key.substring(Math.min(DEMOGRAPHIC_TAG_PREFIX_LENGTH, key.length())));
        }
        return key;
    }

    private String comparable(String raw) {
        String cleaned = TextCleaner.cleanCode(raw);
        return cleaned == null ? "" : cleaned.toUpperCase(Locale.ROOT);
    }
}
