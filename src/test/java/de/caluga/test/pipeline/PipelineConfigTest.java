package de.caluga.test.pipeline;

import de.caluga.pipeline.DefaultFieldNameMapper;
import de.caluga.pipeline.FieldNameMapper;
import de.caluga.pipeline.PipelineConfig;
import de.caluga.pipeline.aggregation.Expr;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("core")
public class PipelineConfigTest {

    public static class UpperCaseMapper implements FieldNameMapper {
        @Override
        public String getMongoFieldName(String javaName) {
            return javaName.toUpperCase();
        }
    }

    @Test
    public void testDefaults() {
        PipelineConfig cfg = new PipelineConfig();
        assertThat(cfg.isCamelCaseConversion()).isFalse();
        assertThat(cfg.isStrictOperators()).isFalse();
        assertThat(cfg.getFieldNameMapper()).isInstanceOf(DefaultFieldNameMapper.class);
        assertThat(cfg.getFieldNameMapper().getMongoFieldName("someField")).isEqualTo("someField");
    }

    @Test
    public void testFromPropertiesWithPrefix() {
        Properties p = new Properties();
        p.put("pipeline.camelCaseConversion", "true");
        p.put("pipeline.strictOperators", "TRUE");
        p.put("strictOperators", "false");

        PipelineConfig cfg = PipelineConfig.fromProperties("pipeline", p);
        assertThat(cfg.isCamelCaseConversion()).isTrue();
        assertThat(cfg.isStrictOperators()).isTrue();
        assertThat(cfg.getFieldNameMapper().getMongoFieldName("someField")).isEqualTo("some_field");
    }

    @Test
    public void testAsPropertiesRoundTrip() {
        PipelineConfig cfg = new PipelineConfig().setCamelCaseConversion(true).setFieldNameMapper(new UpperCaseMapper());
        Properties p = cfg.asProperties("x");

        assertThat(p.getProperty("x.camelCaseConversion")).isEqualTo("true");
        assertThat(p.getProperty("x.strictOperators")).isEqualTo("false");
        assertThat(p.getProperty("x.fieldNameMapperClass")).isEqualTo(UpperCaseMapper.class.getName());

        PipelineConfig read = PipelineConfig.fromProperties("x", p);
        assertThat(read.isCamelCaseConversion()).isTrue();
        assertThat(read.getFieldNameMapper()).isInstanceOf(UpperCaseMapper.class);
        assertThat(new Expr(read).field("name").getCurrentField()).isEqualTo("NAME");
    }

    @Test
    public void testDefaultMapperRoundTrip() {
        PipelineConfig cfg = new PipelineConfig().setFieldNameMapper(new DefaultFieldNameMapper(true));
        assertThat(cfg.isCamelCaseConversion()).isTrue();

        Properties p = cfg.asProperties("pipeline");
        assertThat(p.getProperty("pipeline.camelCaseConversion")).isEqualTo("true");
        assertThat(p.containsKey("pipeline.fieldNameMapperClass")).isFalse();

        PipelineConfig read = PipelineConfig.fromProperties("pipeline", p);
        assertThat(read.getFieldNameMapper()).isInstanceOf(DefaultFieldNameMapper.class);
        assertThat(new Expr(read).field("unitPrice").getCurrentField()).isEqualTo("unit_price");
    }

    @Test
    public void testLoadFromClasspath() throws Exception {
        PipelineConfig cfg = PipelineConfig.load("pipeline-test.properties", "pipeline");
        assertThat(cfg.isStrictOperators()).isTrue();
        assertThat(cfg.isCamelCaseConversion()).isTrue();

        assertThatThrownBy(() -> PipelineConfig.load("does-not-exist.properties", null))
        .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testInvalidMapperClass() {
        Properties p = new Properties();
        p.put("fieldNameMapperClass", "de.caluga.nowhere.Mapper");

        assertThatThrownBy(() -> PipelineConfig.fromProperties(p))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("de.caluga.nowhere.Mapper");
    }

    @Test
    public void testPropertyNames() {
        assertThat(PipelineConfig.getPropertyNames("pipeline"))
        .containsExactlyInAnyOrder("pipeline.camelCaseConversion", "pipeline.strictOperators", "pipeline.fieldNameMapperClass");
    }
}
