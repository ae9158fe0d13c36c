package org.ecschema.rdf.tool.rdf;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.Map;

import org.ecschema.rdf.common.instance.Point2d;
import org.ecschema.rdf.common.instance.Point3d;
import org.ecschema.rdf.tool.MapperUtils;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;

public class TurtleLiteralsUnitTest {
    private final ObjectMapper mapper = MapperUtils.getObjectMapper();

    @Test
    public void quote() {
        assertThat(TurtleLiterals.quote("Acme")).isEqualTo("\"Acme\"");
        assertThat(TurtleLiterals.quote("")).isEqualTo("\"\"");
    }

    @Test
    public void quoteEscapes() {
        assertThat(TurtleLiterals.quote("a \"b\" c\\d\ne\tf")).isEqualTo("\"a \\\"b\\\" c\\\\d\\ne\\tf\"");
    }

    @Test
    public void quotedStringsDecodeAsJson() throws IOException {
        String value = "line one\nline \"two\" \\ é";
        assertThat(mapper.readValue(TurtleLiterals.quote(value), String.class)).isEqualTo(value);
    }

    @Test
    public void pointsAreEncodedTwice() throws IOException {
        String literal = TurtleLiterals.quoteJson(new Point3d(1.5, -2, 3));
        String json = mapper.readValue(literal, String.class);
        JsonNode point = mapper.readTree(json);
        assertThat(point.get("x").asDouble()).isEqualTo(1.5);
        assertThat(point.get("y").asDouble()).isEqualTo(-2);
        assertThat(point.get("z").asDouble()).isEqualTo(3);
    }

    @Test
    public void mapsAreEncodedTwice() throws IOException {
        Map<String, Object> value = ImmutableMap.of("name", "a \"quoted\" name", "count", 2);
        String json = mapper.readValue(TurtleLiterals.quoteJson(value), String.class);
        assertThat(mapper.readValue(json, Map.class)).isEqualTo(value);
    }

    @Test
    public void point2dKeepsItsFieldOrder() {
        assertThat(TurtleLiterals.quoteJson(new Point2d(1, 2))).isEqualTo("\"{\\\"x\\\":1.0,\\\"y\\\":2.0}\"");
    }
}
