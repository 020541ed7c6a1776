package uk.gegc.planconfigurator.features.backend.application;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import uk.gegc.planconfigurator.features.backend.domain.exception.ShapeMismatchException;
import uk.gegc.planconfigurator.features.backend.domain.model.FieldMapping;
import uk.gegc.planconfigurator.features.backend.domain.model.ShapeMapping;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendShapeCatalog;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DataTransformer")
class DataTransformerTest {

    private ObjectMapper objectMapper;
    private DataTransformer transformer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        transformer = new DataTransformer(BackendShapeCatalog.shapes(), objectMapper);
    }

    private JsonNode json(String content) throws Exception {
        return objectMapper.readTree(content);
    }

    static Stream<Arguments> mappings() {
        return BackendShapeCatalog.shapes().stream().flatMap(shape -> Stream.of(
                        Arguments.of(shape.operation() + " request", shape.request()),
                        Arguments.of(shape.operation() + " response", shape.response()))
                .filter(arguments -> arguments.get()[1] != null));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("mappings")
    @DisplayName("every mapping table reads back what it writes, nested lists included")
    void mappingTablesRoundTrip(String label, ShapeMapping mapping) {
        Map<String, Object> full = sample(mapping, true);
        Map<String, Object> minimal = sample(mapping, false);

        assertThat(transformer.fromWire(label, mapping, transformer.toWire(label, mapping, full))).isEqualTo(full);
        assertThat(transformer.fromWire(label, mapping, transformer.toWire(label, mapping, minimal))).isEqualTo(minimal);
    }

    private static Map<String, Object> sample(ShapeMapping mapping, boolean includeOptional) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        for (FieldMapping field : mapping.fields()) {
            if (field.required() || includeOptional) {
                canonical.put(field.canonicalPath(), sampleValue(field, includeOptional));
            }
        }
        return canonical;
    }

    private static Object sampleValue(FieldMapping field, boolean includeOptional) {
        return switch (field.type()) {
            case STRING -> field.canonicalPath() + "-value";
            case INTEGER -> 42L;
            case DECIMAL -> new BigDecimal("1234.50");
            case BOOLEAN -> Boolean.TRUE;
            case LIST -> field.element() == null
                    ? List.of("first", "second")
                    : List.of(sample(field.element(), includeOptional), sample(field.element(), includeOptional));
            case ANY -> Map.of("nested", "value");
        };
    }

    @Nested
    @DisplayName("fromWire")
    class FromWire {

        @Test
        @DisplayName("maps nested wire paths onto flat canonical names")
        void mapsNestedPaths() throws Exception {
            Map<String, Object> account = transformer.fromWire(BackendEndpointCatalog.ACCOUNT, json("""
                    {"id": "acc_1", "display_name": "Acme", "state": "open",
                     "billing": {"currency": "EUR"}, "contact": {"email_address": "ops@acme.test"}}
                    """));

            assertThat(account).containsExactly(
                    Map.entry("accountId", "acc_1"),
                    Map.entry("name", "Acme"),
                    Map.entry("status", "open"),
                    Map.entry("currency", "EUR"),
                    Map.entry("email", "ops@acme.test"));
        }

        @Test
        @DisplayName("omits absent optional fields")
        void omitsOptionalFields() throws Exception {
            Map<String, Object> account = transformer.fromWire(BackendEndpointCatalog.ACCOUNT,
                    json("{\"id\": \"acc_1\", \"display_name\": \"Acme\", \"state\": \"open\"}"));

            assertThat(account).doesNotContainKeys("currency", "email");
        }

        @Test
        @DisplayName("keeps decimal amounts exact")
        void keepsDecimalsExact() throws Exception {
            Map<String, Object> page = transformer.fromWire(BackendEndpointCatalog.CATALOG_COMPONENTS, json("""
                    {"data": [{"sku": "pro", "title": "Pro", "billing_type": "recurring",
                               "pricing": {"unit_amount": 49.10, "prorate": true}}]}
                    """));

            @SuppressWarnings("unchecked")
            Map<String, Object> item = ((List<Map<String, Object>>) page.get("items")).get(0);
            assertThat(item.get("unitPrice")).isEqualTo(new BigDecimal("49.10"));
            assertThat(item.get("prorationEligible")).isEqualTo(true);
        }

        @Test
        @DisplayName("reports the wire path of a missing field inside a list")
        void reportsListElementPath() throws Exception {
            JsonNode payload = json("""
                    {"results": [
                        {"id": "p1", "status": "active"},
                        {"id": "p2", "status": "active"},
                        {"status": "draft"}
                    ]}
                    """);

            assertThatThrownBy(() -> transformer.fromWire(BackendEndpointCatalog.PLANS, payload))
                    .isInstanceOfSatisfying(ShapeMismatchException.class, e -> {
                        assertThat(e.getFieldPath()).isEqualTo("results[2].id");
                        assertThat(e.getOperation()).isEqualTo(BackendEndpointCatalog.PLANS);
                    });
        }

        @Test
        @DisplayName("rejects a value of the wrong type")
        void rejectsWrongType() throws Exception {
            JsonNode payload = json("{\"available\": \"yes\"}");

            assertThatThrownBy(() -> transformer.fromWire(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY, payload))
                    .isInstanceOfSatisfying(ShapeMismatchException.class,
                            e -> assertThat(e.getFieldPath()).isEqualTo("available"));
        }

        @Test
        @DisplayName("rejects a non-object payload at the root")
        void rejectsNonObjectRoot() throws Exception {
            JsonNode payload = json("[1, 2]");

            assertThatThrownBy(() -> transformer.fromWire(BackendEndpointCatalog.PLAN, payload))
                    .isInstanceOfSatisfying(ShapeMismatchException.class,
                            e -> assertThat(e.getFieldPath()).isEqualTo("$"));
        }
    }

    @Nested
    @DisplayName("toWire")
    class ToWire {

        @Test
        @DisplayName("builds nested wire bodies including list elements")
        void buildsWireBody() {
            Map<String, Object> lineItem = new LinkedHashMap<>();
            lineItem.put("code", "pro");
            lineItem.put("kind", "recurring");
            lineItem.put("quantity", 3L);
            lineItem.put("unitPrice", new BigDecimal("49.00"));
            Map<String, Object> canonical = new LinkedHashMap<>();
            canonical.put("accountId", "acc_1");
            canonical.put("planName", "Production");
            canonical.put("currency", "USD");
            canonical.put("lineItems", List.of(lineItem));
            canonical.put("promotions", List.of(Map.of("code", "WELCOME10")));

            ObjectNode wire = transformer.toWire(BackendEndpointCatalog.CREATE_PLAN, canonical);

            assertThat(wire.path("account_id").asText()).isEqualTo("acc_1");
            assertThat(wire.path("plan_name").asText()).isEqualTo("Production");
            assertThat(wire.path("line_items").get(0).path("sku").asText()).isEqualTo("pro");
            assertThat(wire.path("line_items").get(0).path("qty").longValue()).isEqualTo(3L);
            assertThat(wire.path("line_items").get(0).path("unit_amount").decimalValue()).isEqualTo(new BigDecimal("49.00"));
            assertThat(wire.path("promotions").get(0).path("promo_code").asText()).isEqualTo("WELCOME10");
        }

        @Test
        @DisplayName("round-trips the quote response shape")
        void quoteResponse() throws Exception {
            Map<String, Object> quote = transformer.fromWire(BackendEndpointCatalog.PRICE_QUOTE,
                    json("{\"currency\": \"USD\", \"totals\": {\"recurring\": 118.80, \"one_time\": 0}}"));

            assertThat(quote.get("recurringTotal")).isEqualTo(new BigDecimal("118.80"));
            assertThat(quote.get("oneTimeTotal")).isEqualTo(BigDecimal.ZERO);
        }

        @Test
        @DisplayName("reports the canonical path of a missing required field")
        void missingRequiredField() {
            Map<String, Object> canonical = Map.of("accountId", "acc_1", "currency", "USD", "lineItems", List.of());

            assertThatThrownBy(() -> transformer.toWire(BackendEndpointCatalog.CREATE_PLAN, canonical))
                    .isInstanceOfSatisfying(ShapeMismatchException.class,
                            e -> assertThat(e.getFieldPath()).isEqualTo("planName"));
        }

        @Test
        @DisplayName("rejects canonical fields without a wire mapping")
        void rejectsUnmappedField() {
            Map<String, Object> canonical = Map.of("planName", "Renamed", "colour", "blue");

            assertThatThrownBy(() -> transformer.toWire(BackendEndpointCatalog.UPDATE_PLAN, canonical))
                    .isInstanceOfSatisfying(ShapeMismatchException.class,
                            e -> assertThat(e.getFieldPath()).isEqualTo("colour"));
        }

        @Test
        @DisplayName("reports the element path of a bad list element")
        void badListElement() {
            Map<String, Object> lineItem = new LinkedHashMap<>();
            lineItem.put("code", "pro");
            lineItem.put("kind", "recurring");
            lineItem.put("quantity", "three");
            lineItem.put("unitPrice", new BigDecimal("49.00"));
            Map<String, Object> canonical = Map.of("currency", "USD", "lineItems", List.of(lineItem));

            assertThatThrownBy(() -> transformer.toWire(BackendEndpointCatalog.PRICE_QUOTE, canonical))
                    .isInstanceOfSatisfying(ShapeMismatchException.class,
                            e -> assertThat(e.getFieldPath()).isEqualTo("line_items[0].qty"));
        }
    }
}
