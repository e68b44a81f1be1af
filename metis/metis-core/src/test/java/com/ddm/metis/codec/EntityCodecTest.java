package com.ddm.metis.codec;

import com.ddm.metis.defined.Kpi;
import com.ddm.metis.provider.KpiProvider;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link EntityCodec} 类的单元测试。
 *
 * @author metis
 */
class EntityCodecTest {

    private final EntityCodec<Kpi> codec = KpiProvider.CODEC;

    @Test
    void testPromote_OnlyDeclaredNonNullFields() {
        Kpi kpi = Kpi.fromLegacyLabel("GROSS_MARGIN", "Finance");
        Map<String, Object> promoted = codec.promote(kpi);
        assertEquals("gross_margin", promoted.get("id"));
        assertEquals("Gross Margin", promoted.get("name"));
        assertEquals("Finance", promoted.get("domain"));
        assertFalse(promoted.containsKey("owner_role"));
        assertFalse(promoted.containsKey("unit"));
    }

    @Test
    void testDecode_PromotedColumnsOverridePayload() {
        String payload = "{\"id\":\"k1\",\"name\":\"Old Name\",\"domain\":\"Finance\",\"metadata\":{\"altitude\":7}}";
        Map<String, Object> promoted = new HashMap<>();
        promoted.put("id", "k1");
        promoted.put("name", "New Name");
        promoted.put("domain", null);

        Kpi kpi = codec.decode(payload, promoted);
        assertEquals("New Name", kpi.name());
        assertEquals("Finance", kpi.domain());
        assertEquals(7, kpi.metadata().get("altitude"));
    }

    @Test
    void testDecode_PromotedColumnsOnly() {
        Kpi kpi = codec.decode(null, Map.of("id", "k2", "name", "Cash Ratio"));
        assertEquals("k2", kpi.id());
        assertEquals("Cash Ratio", kpi.name());
    }

    @Test
    void testDecode_Malformed() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode("[1,2]", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{not json", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"name\":\"no id\"}", Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> codec.decode(EntityCodecs.JSON.getNodeFactory().textNode("x")));
    }

    @Test
    void testDecode_UnknownFieldsIgnored() throws Exception {
        JsonNode node = EntityCodecs.JSON.readTree("{\"id\":\"k3\",\"legacy_column\":1}");
        assertEquals("k3", codec.decode(node).id());
    }

    @Test
    void testDecode_DefaultId() throws Exception {
        JsonNode node = EntityCodecs.JSON.readTree("{\"name\":\"Net Income\"}");
        assertEquals("net_income", codec.decode(node, "net_income").id());
        JsonNode withId = EntityCodecs.JSON.readTree("{\"id\":\"own\",\"name\":\"Net Income\"}");
        assertEquals("own", codec.decode(withId, "net_income").id());
    }

    @Test
    void testEncodeDecode_PreservesThresholds() {
        String payload = "{\"id\":\"gm\",\"thresholds\":[{\"comparison_type\":\"vs_budget\",\"green_threshold\":1.0}]}";
        Kpi kpi = codec.decode(payload, Map.of());
        Kpi again = codec.decode(codec.encodeToString(kpi), codec.promote(kpi));
        assertEquals(kpi, again);
    }
}
