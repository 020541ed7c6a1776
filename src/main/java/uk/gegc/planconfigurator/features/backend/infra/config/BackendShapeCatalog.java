package uk.gegc.planconfigurator.features.backend.infra.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.planconfigurator.features.backend.application.DataTransformer;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationShape;
import uk.gegc.planconfigurator.features.backend.domain.model.ShapeMapping;

import java.util.List;

import static uk.gegc.planconfigurator.features.backend.domain.model.FieldMapping.list;
import static uk.gegc.planconfigurator.features.backend.domain.model.FieldMapping.optional;
import static uk.gegc.planconfigurator.features.backend.domain.model.FieldMapping.required;
import static uk.gegc.planconfigurator.features.backend.domain.model.FieldType.BOOLEAN;
import static uk.gegc.planconfigurator.features.backend.domain.model.FieldType.DECIMAL;
import static uk.gegc.planconfigurator.features.backend.domain.model.FieldType.INTEGER;
import static uk.gegc.planconfigurator.features.backend.domain.model.FieldType.STRING;
import static uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog.*;

/**
 * Canonical ↔ wire mapping tables, one entry per operation. A backend schema change is an
 * edit to the affected table only.
 */
@Configuration
public class BackendShapeCatalog {

    static final ShapeMapping ACCOUNT_SHAPE = ShapeMapping.of(
            required("accountId", "id", STRING),
            required("name", "display_name", STRING),
            required("status", "state", STRING),
            optional("currency", "billing.currency", STRING),
            optional("email", "contact.email_address", STRING)
    );

    static final ShapeMapping ADDRESS_SHAPE = ShapeMapping.of(
            required("addressId", "id", STRING),
            required("line1", "street.line_1", STRING),
            optional("line2", "street.line_2", STRING),
            required("city", "city", STRING),
            optional("postalCode", "zip", STRING),
            required("country", "country_code", STRING)
    );

    static final ShapeMapping CATALOG_COMPONENT_SHAPE = ShapeMapping.of(
            required("code", "sku", STRING),
            required("name", "title", STRING),
            required("kind", "billing_type", STRING),
            required("unitPrice", "pricing.unit_amount", DECIMAL),
            optional("currency", "pricing.currency", STRING),
            optional("prorationEligible", "pricing.prorate", BOOLEAN)
    );

    static final ShapeMapping PLAN_SHAPE = ShapeMapping.of(
            required("planId", "id", STRING),
            required("status", "status", STRING),
            optional("accountId", "account_id", STRING),
            optional("planName", "plan_name", STRING),
            optional("createdAt", "created_at", STRING)
    );

    static final ShapeMapping LINE_ITEM_SHAPE = ShapeMapping.of(
            required("code", "sku", STRING),
            required("kind", "billing_type", STRING),
            required("quantity", "qty", INTEGER),
            required("unitPrice", "unit_amount", DECIMAL)
    );

    static final ShapeMapping PROMOTION_SHAPE = ShapeMapping.of(
            required("code", "promo_code", STRING)
    );

    static final ShapeMapping CREATE_PLAN_REQUEST = ShapeMapping.of(
            required("accountId", "account_id", STRING),
            required("planName", "plan_name", STRING),
            required("currency", "currency", STRING),
            list("lineItems", "line_items", true, LINE_ITEM_SHAPE),
            list("promotions", "promotions", false, PROMOTION_SHAPE)
    );

    static final ShapeMapping UPDATE_PLAN_REQUEST = ShapeMapping.of(
            optional("planName", "plan_name", STRING),
            list("lineItems", "line_items", false, LINE_ITEM_SHAPE),
            list("promotions", "promotions", false, PROMOTION_SHAPE)
    );

    static final ShapeMapping PRICE_QUOTE_REQUEST = ShapeMapping.of(
            required("currency", "currency", STRING),
            list("lineItems", "line_items", true, LINE_ITEM_SHAPE),
            list("promotions", "promotions", false, PROMOTION_SHAPE)
    );

    static final ShapeMapping PRICE_QUOTE_RESPONSE = ShapeMapping.of(
            required("currency", "currency", STRING),
            required("recurringTotal", "totals.recurring", DECIMAL),
            required("oneTimeTotal", "totals.one_time", DECIMAL)
    );

    @Bean
    public DataTransformer dataTransformer(ObjectMapper objectMapper) {
        return new DataTransformer(shapes(), objectMapper);
    }

    public static List<OperationShape> shapes() {
        return List.of(
                OperationShape.response(SERVICE_STATUS, ShapeMapping.of(
                        required("status", "status", STRING),
                        optional("version", "version", STRING))),

                OperationShape.response(ACCOUNT, ACCOUNT_SHAPE),
                OperationShape.response(ACCOUNTS, page(ACCOUNT_SHAPE, "results")),
                OperationShape.response(ADDRESS, ADDRESS_SHAPE),
                OperationShape.response(ADDRESSES, page(ADDRESS_SHAPE, "results")),

                OperationShape.response(CATALOG_COMPONENTS, ShapeMapping.of(
                        list("items", "data", true, CATALOG_COMPONENT_SHAPE))),
                OperationShape.response(CATALOG_COMPONENT, CATALOG_COMPONENT_SHAPE),

                OperationShape.response(PLAN_NAME_AVAILABILITY, ShapeMapping.of(
                        required("available", "available", BOOLEAN),
                        optional("suggestion", "suggested_name", STRING))),
                OperationShape.response(PLANS, page(PLAN_SHAPE, "results")),
                OperationShape.response(PLAN, PLAN_SHAPE),
                new OperationShape(CREATE_PLAN, CREATE_PLAN_REQUEST, PLAN_SHAPE),
                new OperationShape(UPDATE_PLAN, UPDATE_PLAN_REQUEST, PLAN_SHAPE),
                OperationShape.response(PLAN_ATTACHMENT, ShapeMapping.of(
                        required("attachmentId", "id", STRING),
                        required("fileName", "file_name", STRING),
                        optional("size", "size_bytes", INTEGER))),
                new OperationShape(PRICE_QUOTE, PRICE_QUOTE_REQUEST, PRICE_QUOTE_RESPONSE)
        );
    }

    private static ShapeMapping page(ShapeMapping item, String wireList) {
        return ShapeMapping.of(
                list("items", wireList, true, item),
                optional("totalCount", "total_count", INTEGER)
        );
    }
}
