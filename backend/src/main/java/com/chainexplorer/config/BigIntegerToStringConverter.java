package com.chainexplorer.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigInteger;

/**
 * Writes base-unit amounts as decimal strings so values beyond 64 bits keep every digit.
 */
@WritingConverter
public class BigIntegerToStringConverter implements Converter<BigInteger, String> {

    @Override
    public String convert(BigInteger source) {
        return source == null ? null : source.toString();
    }
}
