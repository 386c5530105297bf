package io.memcsv.core.converter;

import io.memcsv.core.ConversionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry for TypeConverters with support for client-registered custom
 * converters.
 * Provides default converters for primitives, their boxes, strings, big numbers,
 * java.time values and UUIDs.
 */
public final class TypeConverterRegistry {
    private static final TypeConverterRegistry INSTANCE = new TypeConverterRegistry();

    private final Map<Class<?>, TypeConverter<?>> converters = new ConcurrentHashMap<>();

    private TypeConverterRegistry() {
        registerDefaults();
    }

    public static TypeConverterRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * Create an independent registry holding only the default converters.
     */
    public static TypeConverterRegistry newRegistry() {
        return new TypeConverterRegistry();
    }

    private void registerDefaults() {
        // Numeric types - empty cells become zero
        register(new ParsingConverter<>(Integer.class, Integer::valueOf, 0));
        register(new ParsingConverter<>(Long.class, Long::valueOf, 0L));
        register(new ParsingConverter<>(Short.class, Short::valueOf, (short) 0));
        register(new ParsingConverter<>(Byte.class, Byte::valueOf, (byte) 0));
        register(new ParsingConverter<>(Float.class, Float::valueOf, 0.0f));
        register(new ParsingConverter<>(Double.class, Double::valueOf, 0.0d));
        register(new ParsingConverter<>(BigDecimal.class, BigDecimal::new, BigDecimal.ZERO));
        register(new ParsingConverter<>(BigInteger.class, BigInteger::new, BigInteger.ZERO));

        register(new BooleanConverter());
        register(new CharacterConverter());

        // String type
        register(new ParsingConverter<>(String.class, Function.identity(), ""));

        // Structured types - empty cells become null
        register(new ParsingConverter<>(UUID.class, UUID::fromString, null));
        register(new ParsingConverter<>(LocalDate.class, LocalDate::parse, null));
        register(new ParsingConverter<>(LocalDateTime.class, LocalDateTime::parse, null));
        register(new ParsingConverter<>(LocalTime.class, LocalTime::parse, null));
    }

    public <T> void register(TypeConverter<T> converter) {
        if (converter == null) {
            throw new IllegalArgumentException("converter required");
        }
        converters.put(converter.javaType(), converter);
    }

    @SuppressWarnings("unchecked")
    public <T> TypeConverter<T> getConverter(Class<T> javaType) {
        // Try exact match first
        TypeConverter<?> converter = converters.get(javaType);
        if (converter != null) {
            return (TypeConverter<T>) converter;
        }

        // Try primitive to boxed lookup
        if (javaType == int.class) {
            return (TypeConverter<T>) converters.get(Integer.class);
        }
        if (javaType == long.class) {
            return (TypeConverter<T>) converters.get(Long.class);
        }
        if (javaType == boolean.class) {
            return (TypeConverter<T>) converters.get(Boolean.class);
        }
        if (javaType == byte.class) {
            return (TypeConverter<T>) converters.get(Byte.class);
        }
        if (javaType == short.class) {
            return (TypeConverter<T>) converters.get(Short.class);
        }
        if (javaType == float.class) {
            return (TypeConverter<T>) converters.get(Float.class);
        }
        if (javaType == double.class) {
            return (TypeConverter<T>) converters.get(Double.class);
        }
        if (javaType == char.class) {
            return (TypeConverter<T>) converters.get(Character.class);
        }

        return null;
    }

    /**
     * Like {@link #getConverter(Class)} but fails for unregistered types.
     */
    public <T> TypeConverter<T> requireConverter(Class<T> javaType) {
        if (javaType == null) {
            throw new IllegalArgumentException("javaType required");
        }
        TypeConverter<T> converter = getConverter(javaType);
        if (converter == null) {
            throw new ConversionException("No converter registered for " + javaType.getName(), javaType);
        }
        return converter;
    }

    public boolean hasConverter(Class<?> javaType) {
        return getConverter(javaType) != null;
    }

    // Default converters

    private record ParsingConverter<T>(Class<T> javaType, Function<String, T> parser, T emptyValue)
            implements TypeConverter<T> {

        @Override
        public T fromCell(String cell) {
            return parser.apply(cell);
        }
    }

    private static final class BooleanConverter implements TypeConverter<Boolean> {
        @Override
        public Class<Boolean> javaType() {
            return Boolean.class;
        }

        @Override
        public Boolean fromCell(String cell) {
            switch (cell.toLowerCase(Locale.ROOT)) {
                case "true":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "0":
                    return Boolean.FALSE;
                default:
                    throw new IllegalArgumentException("not a boolean: " + cell);
            }
        }

        @Override
        public Boolean emptyValue() {
            return Boolean.FALSE;
        }
    }

    private static final class CharacterConverter implements TypeConverter<Character> {
        @Override
        public Class<Character> javaType() {
            return Character.class;
        }

        @Override
        public Character fromCell(String cell) {
            if (cell.length() != 1) {
                throw new IllegalArgumentException("not a single character: " + cell);
            }
            return cell.charAt(0);
        }

        @Override
        public Character emptyValue() {
            return '\0';
        }
    }
}
