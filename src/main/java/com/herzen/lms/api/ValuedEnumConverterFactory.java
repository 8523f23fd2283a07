package com.herzen.lms.api;

import com.herzen.lms.common.BadRequestException;
import com.herzen.lms.domain.DomainModels.Valued;
import org.springframework.core.convert.converter.Converter;
import org.springframework.core.convert.converter.ConverterFactory;

/**
 * Binds query and path parameters to enums by their wire value ("not-started") instead of the constant name.
 */
final class ValuedEnumConverterFactory implements ConverterFactory<String, Valued> {

    @Override
    public <T extends Valued> Converter<String, T> getConverter(Class<T> targetType) {
        return source -> {
            if (source.isBlank()) return null;
            T[] constants = targetType.getEnumConstants();
            if (constants != null) {
                for (T constant : constants) {
                    if (constant.value().equals(source.trim())) return constant;
                }
            }
            throw new BadRequestException("Invalid value: " + source);
        };
    }
}
