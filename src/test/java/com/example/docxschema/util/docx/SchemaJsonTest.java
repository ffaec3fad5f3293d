package com.example.docxschema.util.docx;

import com.example.docxschema.util.schema.SchemaConfig;
import com.example.docxschema.util.schema.SchemaBuilder;
import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.detect.DetectorRegistry;
import com.example.docxschema.util.schema.domain.DomainPackRegistry;
import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.feature.StyleMeta;
import com.example.docxschema.util.schema.feature.TableRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaJsonTest {

    private Schema reportSchema() {
        StyleMeta title = StyleMeta.builder().styleId("Title").styleName("Title").fontName("Arial")
                .fontSize(24.0).bold(true).alignment("center").build();
        StyleMeta heading = StyleMeta.builder().styleId("Heading1").styleName("heading 1").bold(true).fontSize(14.0).build();
        StyleMeta body = StyleMeta.builder().styleId("Normal").fontName("Calibri").fontSize(11.0).build();
        StyleMeta cell = body.toBuilder().table(new TableRef("t001", 0, 0, 1, 2)).build();
        List<StructuralUnit> units = Arrays.asList(
                StructuralUnit.paragraph(0, "Annual Report 2024", title),
                StructuralUnit.paragraph(1, "Overview", heading),
                StructuralUnit.paragraph(2, "Revenue grew by twelve percent over the year. Costs were stable.", body),
                new StructuralUnit(3, StructuralUnit.Kind.TABLE_CELL, "Revenue", cell));
        SchemaBuilder builder = new SchemaBuilder(DomainPackRegistry.loadDefault(DetectorRegistry.defaults()),
                SchemaConfig.loadDefault());
        return builder.build(units, "REPORT").getSchema();
    }

    @Test
    @DisplayName("Schema 序列化后重新加载与原对象相等，字段名为 snake_case")
    void roundTrip() throws Exception {
        Schema schema = reportSchema();

        String json = SchemaJson.toJson(schema);
        Schema reloaded = SchemaJson.fromJson(json);

        assertThat(reloaded).isEqualTo(schema);
        assertThat(json).contains("\"slot_id\"", "\"pattern_type\"", "\"source_indices\"", "\"realized_count\"");
    }

    @Test
    @DisplayName("写入文件后可直接读回")
    void fileRoundTrip(@TempDir File dir) throws Exception {
        Schema schema = reportSchema();
        File file = new File(dir, "report.schema.json");

        SchemaJson.write(schema, file);

        assertThat(SchemaJson.read(file)).isEqualTo(schema);
    }

    @Test
    @DisplayName("忽略未知字段")
    void ignoresUnknownFields() throws Exception {
        Schema schema = SchemaJson.fromJson("{\"domain\":\"LETTER\",\"confidence\":0.7,\"slots\":[],"
                + "\"diagnostics\":[],\"generator\":\"v2\"}");

        assertThat(schema.getDomain()).isEqualTo("LETTER");
        assertThat(schema.getSlots()).isEmpty();
    }
}
