package de.caluga.pipeline;

import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Settings for building aggregation pipelines.
 * <p>
 * Can be read from properties, every setting uses the field name as key, optionally prefixed,
 * e.g. <code>pipeline.camelCaseConversion=true</code>.
 */
public class PipelineConfig {
    private boolean camelCaseConversion = false;
    private boolean strictOperators = false;
    private String fieldNameMapperClass;

    private transient FieldNameMapper fieldNameMapper;

    public PipelineConfig() {
    }

    public PipelineConfig(final Properties prop) {
        this(null, prop);
    }

    public PipelineConfig(String prefix, final Properties prop) {
        this(prefix, prop::get);
    }

    public PipelineConfig(String prefix, PipelineConfigResolver resolver) {
        if (prefix != null) {
            prefix += ".";
        } else {
            prefix = "";
        }

        for (Field f : getSettingFields()) {
            Object setting = resolver.resolveSetting(prefix + f.getName());

            if (setting == null) {
                continue;
            }

            f.setAccessible(true);

            try {
                if (f.getType().equals(boolean.class) || f.getType().equals(Boolean.class)) {
                    f.set(this, setting.toString().trim().equalsIgnoreCase("true"));
                } else if (f.getType().equals(String.class)) {
                    f.set(this, setting.toString().trim());
                }
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        }

        if (fieldNameMapperClass != null && !fieldNameMapperClass.isEmpty()) {
            fieldNameMapper = instantiateMapper(fieldNameMapperClass);
        }
    }

    public static PipelineConfig fromProperties(String prefix, Properties p) {
        return new PipelineConfig(prefix, p);
    }

    public static PipelineConfig fromProperties(Properties p) {
        return new PipelineConfig(p);
    }

    /**
     * reads a properties file from the classpath
     *
     * @param resource name of the resource, e.g. <code>pipeline.properties</code>
     * @param prefix   key prefix or null
     */
    public static PipelineConfig load(String resource, String prefix) throws IOException {
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("config resource not found: " + resource);
            }

            Properties p = new Properties();
            p.load(in);
            return fromProperties(prefix, p);
        }
    }

    public static List<String> getPropertyNames(String prefix) {
        List<String> ret = new ArrayList<>();

        for (Field f : getSettingFields()) {
            ret.add(prefix == null ? f.getName() : prefix + "." + f.getName());
        }

        return ret;
    }

    private static List<Field> getSettingFields() {
        List<Field> ret = new ArrayList<>();

        for (Field f : PipelineConfig.class.getDeclaredFields()) {
            int mod = f.getModifiers();

            if (Modifier.isStatic(mod) || Modifier.isTransient(mod)) {
                continue;
            }

            ret.add(f);
        }

        return ret;
    }

    private static FieldNameMapper instantiateMapper(String className) {
        try {
            Class<?> cls = Class.forName(className);
            return (FieldNameMapper) cls.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException | ClassCastException | NoSuchMethodException | InstantiationException | IllegalAccessException | InvocationTargetException e) {
            LoggerFactory.getLogger(PipelineConfig.class).error("Cannot create field name mapper {}", className, e);
            throw new IllegalArgumentException("invalid fieldNameMapperClass " + className, e);
        }
    }

    public Properties asProperties() {
        return asProperties(null);
    }

    public Properties asProperties(String prefix) {
        if (prefix == null) {
            prefix = "";
        } else {
            prefix = prefix + ".";
        }

        Properties p = new Properties();

        for (Field f : getSettingFields()) {
            f.setAccessible(true);

            try {
                Object v = f.get(this);

                if (v != null) {
                    p.put(prefix + f.getName(), v.toString());
                }
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        }

        return p;
    }

    public boolean isCamelCaseConversion() {
        return camelCaseConversion;
    }

    public PipelineConfig setCamelCaseConversion(boolean camelCaseConversion) {
        this.camelCaseConversion = camelCaseConversion;
        return this;
    }

    public boolean isStrictOperators() {
        return strictOperators;
    }

    public PipelineConfig setStrictOperators(boolean strictOperators) {
        this.strictOperators = strictOperators;
        return this;
    }

    public String getFieldNameMapperClass() {
        return fieldNameMapperClass;
    }

    /**
     * the mapper used for <code>field()</code> names and <code>$field</code> references. Falls back
     * to a {@link DefaultFieldNameMapper} following {@link #isCamelCaseConversion()}.
     */
    public FieldNameMapper getFieldNameMapper() {
        if (fieldNameMapper == null) {
            return new DefaultFieldNameMapper(camelCaseConversion);
        }

        return fieldNameMapper;
    }

    /**
     * A {@link DefaultFieldNameMapper} is kept as <code>camelCaseConversion</code>, only other
     * mappers are recorded in <code>fieldNameMapperClass</code> and need a no-arg constructor to be
     * read back from properties.
     */
    public PipelineConfig setFieldNameMapper(FieldNameMapper fieldNameMapper) {
        this.fieldNameMapper = fieldNameMapper;

        if (fieldNameMapper instanceof DefaultFieldNameMapper) {
            camelCaseConversion = ((DefaultFieldNameMapper) fieldNameMapper).isConvertCamelCase();
            fieldNameMapperClass = null;
        } else {
            fieldNameMapperClass = fieldNameMapper == null ? null : fieldNameMapper.getClass().getName();
        }

        return this;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
               "camelCaseConversion=" + camelCaseConversion +
               ", strictOperators=" + strictOperators +
               ", fieldNameMapperClass='" + fieldNameMapperClass + '\'' +
               '}';
    }
}
