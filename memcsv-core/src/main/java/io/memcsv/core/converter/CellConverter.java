package io.memcsv.core.converter;

import io.memcsv.core.ConversionException;
import io.memcsv.core.MemcsvConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts string cells to typed values using a {@link TypeConverterRegistry}
 * and a {@link ConversionPolicy}.
 * <p>
 * Empty cells always map to the converter's empty value, so an empty numeric
 * cell reads as zero.
 */
public final class CellConverter {
    private static final Logger log = LoggerFactory.getLogger(CellConverter.class);

    private final TypeConverterRegistry registry;
    private final ConversionPolicy policy;

    public CellConverter(TypeConverterRegistry registry, ConversionPolicy policy) {
        if (registry == null) {
            throw new IllegalArgumentException("registry required");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy required");
        }
        this.registry = registry;
        this.policy = policy;
    }

    public static CellConverter from(MemcsvConfiguration configuration) {
        return new CellConverter(configuration.converterRegistry(), configuration.conversionPolicy());
    }

    public ConversionPolicy policy() {
        return policy;
    }

    public <T> T convert(String cell, Class<T> type) {
        return convert(cell, registry.requireConverter(type));
    }

    public <T> List<T> convertAll(List<String> cells, Class<T> type) {
        TypeConverter<T> converter = registry.requireConverter(type);
        List<T> values = new ArrayList<>(cells.size());
        for (String cell : cells) {
            values.add(convert(cell, converter));
        }
        return values;
    }

    /**
     * Resolve the converter once for repeated conversions to the same type.
     */
    public <T> TypeConverter<T> converterFor(Class<T> type) {
        return registry.requireConverter(type);
    }

    public <T> T convert(String cell, TypeConverter<T> converter) {
        if (cell == null || cell.isEmpty()) {
            return converter.emptyValue();
        }
        try {
            return converter.fromCell(cell);
        } catch (IllegalArgumentException | DateTimeException e) {
            if (policy == ConversionPolicy.LENIENT) {
                log.trace("Substituting empty value for unparseable {} cell '{}'",
                        converter.javaType().getSimpleName(), cell);
                return converter.emptyValue();
            }
            throw new ConversionException(cell, converter.javaType(), e);
        }
    }
}
