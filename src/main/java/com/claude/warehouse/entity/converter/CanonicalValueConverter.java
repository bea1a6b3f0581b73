package com.claude.warehouse.entity.converter;

import com.claude.warehouse.domain.CanonicalValue;
import jakarta.persistence.AttributeConverter;

import java.util.function.Function;

/**
 * 표준 어휘 enum 을 라벨 문자열(Single, Male, Mountain, Yes ...)로 저장
 */
public abstract class CanonicalValueConverter<E extends Enum<E> & CanonicalValue>
        implements AttributeConverter<E, String> {

    private final Function<String, E> fromLabel;

    protected CanonicalValueConverter(Function<String, E> fromLabel) {
        this.fromLabel = fromLabel;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.getLabel();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        return dbData == null ? null : fromLabel.apply(dbData);
    }
}
