package com.chainexplorer.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigInteger;

/**
 * Reads decimal-string amounts back as BigInteger.
 */
@ReadingConverter
public class StringToBigIntegerConverter implements Converter<String, BigInteger> {

    @Override
    public BigInteger convert(String source) {
        return source == null || source.isEmpty() ? null : new BigInteger(source);
    }
}
