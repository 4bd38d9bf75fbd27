package de.caluga.test.pipeline;

import de.caluga.pipeline.DefaultFieldNameMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("core")
public class DefaultFieldNameMapperTest {

    @Test
    public void testConvertCamelCase() {
        DefaultFieldNameMapper m = new DefaultFieldNameMapper(true);
        assertThat(m.getMongoFieldName("documentId")).isEqualTo("document_id");
        assertThat(m.getMongoFieldName("_id")).isEqualTo("_id");
        assertThat(m.getMongoFieldName("address.zipCode")).isEqualTo("address.zip_code");
        assertThat(m.getMongoFieldName("orderLines.0.unitPrice")).isEqualTo("order_lines.0.unit_price");
    }

    @Test
    public void testDisabled() {
        DefaultFieldNameMapper m = new DefaultFieldNameMapper(false);
        assertThat(m.getMongoFieldName("documentId")).isEqualTo("documentId");

        m.enableConvertCamelCase();
        assertThat(m.isConvertCamelCase()).isTrue();
        assertThat(m.getMongoFieldName("documentId")).isEqualTo("document_id");

        m.disableConvertCamelCase();
        assertThat(m.getMongoFieldName("documentId")).isEqualTo("documentId");
    }
}
