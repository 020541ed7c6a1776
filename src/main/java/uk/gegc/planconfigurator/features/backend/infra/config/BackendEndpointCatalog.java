package uk.gegc.planconfigurator.features.backend.infra.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.planconfigurator.features.backend.application.EndpointRegistry;
import uk.gegc.planconfigurator.features.backend.domain.model.EndpointDefinition;

import java.util.List;

import static uk.gegc.planconfigurator.features.backend.domain.model.OperationParams.Param.LIMIT;
import static uk.gegc.planconfigurator.features.backend.domain.model.OperationParams.Param.SORT;

/**
 * Route table of the billing backend. Query parameter names, path positions and
 * per-endpoint defaults live here and nowhere else.
 */
@Configuration
public class BackendEndpointCatalog {

    public static final String SERVICE_STATUS = "service-status";
    public static final String ACCOUNT = "account";
    public static final String ACCOUNTS = "accounts";
    public static final String ADDRESS = "address";
    public static final String ADDRESSES = "addresses";
    public static final String CATALOG_COMPONENTS = "catalog-components";
    public static final String CATALOG_COMPONENT = "catalog-component";
    public static final String PLAN_NAME_AVAILABILITY = "plan-name-availability";
    public static final String PLANS = "plans";
    public static final String PLAN = "plan";
    public static final String CREATE_PLAN = "create-plan";
    public static final String UPDATE_PLAN = "update-plan";
    public static final String DELETE_PLAN = "delete-plan";
    public static final String PLAN_ATTACHMENT = "plan-attachment";
    public static final String PRICE_QUOTE = "price-quote";

    @Bean
    public EndpointRegistry endpointRegistry() {
        return new EndpointRegistry(endpoints());
    }

    public static List<EndpointDefinition> endpoints() {
        return List.of(
                EndpointDefinition.get(SERVICE_STATUS, "/v1/status").publicAccess().build(),

                EndpointDefinition.get(ACCOUNT, "/v1/accounts/{id}").build(),
                EndpointDefinition.get(ACCOUNTS, "/v1/accounts")
                        .query(LIMIT, "limit", 10)
                        .query(SORT, "sort")
                        .filters()
                        .build(),
                EndpointDefinition.get(ADDRESS, "/v1/accounts/{id}/addresses/{secondaryId}").build(),
                EndpointDefinition.get(ADDRESSES, "/v1/accounts/{id}/addresses")
                        .query(LIMIT, "limit", 25)
                        .build(),

                EndpointDefinition.get(CATALOG_COMPONENTS, "/v1/catalog/components")
                        .query(LIMIT, "limit", 50)
                        .query(SORT, "sort", "name")
                        .filters()
                        .build(),
                EndpointDefinition.get(CATALOG_COMPONENT, "/v1/catalog/components/{id}").build(),

                EndpointDefinition.get(PLAN_NAME_AVAILABILITY, "/v1/plans/availability")
                        .requiredFilter("name")
                        .build(),
                EndpointDefinition.get(PLANS, "/v1/accounts/{id}/plans")
                        .query(LIMIT, "per_page", 20)
                        .query(SORT, "order_by", "-created_at")
                        .filters()
                        .build(),
                EndpointDefinition.get(PLAN, "/v1/plans/{id}").build(),
                EndpointDefinition.post(CREATE_PLAN, "/v1/accounts/{id}/plans").build(),
                EndpointDefinition.put(UPDATE_PLAN, "/v1/plans/{id}").build(),
                EndpointDefinition.delete(DELETE_PLAN, "/v1/plans/{id}").build(),
                EndpointDefinition.post(PLAN_ATTACHMENT, "/v1/plans/{id}/attachments").build(),
                EndpointDefinition.post(PRICE_QUOTE, "/v1/quotes").build()
        );
    }
}
