package com.claude.warehouse.rules;

/**
 * 자유 텍스트 컬럼 정리 유틸리티
 *
 * 원천 추출 파일에는 LF(CHAR(10)), CR(CHAR(13)) 문자가 섞여 들어오는 경우가 있어
 * 비교/저장 전에 반드시 제거한 뒤 앞뒤 공백을 잘라낸다.
 */
public final class TextCleaner {

    private TextCleaner() {
    }

    /**
     * LF/CR 제거 후 앞뒤 공백 제거. null 은 null 그대로 반환
     */
    public static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.replace("\n", "").replace("\r", "").strip();
    }

    /**
     * 코드 컬럼 비교용 정리. 모든 제어 문자를 제거한 뒤 앞뒤 공백 제거
     */
    public static String cleanCode(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.codePoints()
                .filter(codePoint -> !Character.isISOControl(codePoint))
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                .toString()
                .strip();
    }

    /**
     * 키 컬럼용 정리. 정리 후 빈 문자열이면 키가 없는 것으로 보고 null 반환
     */
    public static String cleanKey(String raw) {
        String cleaned = clean(raw);
        return cleaned == null || cleaned.isEmpty() ? null : cleaned;
    }
}
