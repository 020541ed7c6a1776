package uk.gegc.planconfigurator.features.backend.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import uk.gegc.planconfigurator.features.backend.domain.exception.MissingParameterException;
import uk.gegc.planconfigurator.features.backend.domain.exception.UnknownOperationException;
import uk.gegc.planconfigurator.features.backend.domain.model.EndpointDefinition;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestDescriptor;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EndpointRegistry")
class EndpointRegistryTest {

    private EndpointRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EndpointRegistry(BackendEndpointCatalog.endpoints());
    }

    @Nested
    @DisplayName("Path resolution")
    class PathResolution {

        @Test
        @DisplayName("substitutes the id into the path")
        void substitutesId() {
            RequestDescriptor descriptor = registry.resolve(BackendEndpointCatalog.ACCOUNT, OperationParams.ofId("acc_42"));

            assertThat(descriptor.method()).isEqualTo(HttpMethod.GET);
            assertThat(descriptor.path()).isEqualTo("/v1/accounts/acc_42");
            assertThat(descriptor.query()).isEmpty();
        }

        @Test
        @DisplayName("percent-encodes path segments")
        void encodesPathSegments() {
            RequestDescriptor descriptor = registry.resolve(BackendEndpointCatalog.PLAN, OperationParams.ofId("a/b c"));

            assertThat(descriptor.path()).isEqualTo("/v1/plans/a%2Fb%20c");
        }

        @Test
        @DisplayName("uses both id and secondary id")
        void substitutesSecondaryId() {
            RequestDescriptor descriptor = registry.resolve(BackendEndpointCatalog.ADDRESS,
                    OperationParams.builder().id("acc_1").secondaryId("adr_9").build());

            assertThat(descriptor.path()).isEqualTo("/v1/accounts/acc_1/addresses/adr_9");
        }

        @Test
        @DisplayName("fails with MissingParameterException when the id is absent")
        void missingId() {
            assertThatThrownBy(() -> registry.resolve(BackendEndpointCatalog.ACCOUNT, OperationParams.none()))
                    .isInstanceOf(MissingParameterException.class)
                    .extracting("parameter")
                    .isEqualTo("id");
        }

        @Test
        @DisplayName("treats a blank id as missing")
        void blankId() {
            assertThatThrownBy(() -> registry.resolve(BackendEndpointCatalog.PLAN, OperationParams.ofId("  ")))
                    .isInstanceOf(MissingParameterException.class);
        }
    }

    @Nested
    @DisplayName("Query resolution")
    class QueryResolution {

        @Test
        @DisplayName("applies endpoint-specific defaults")
        void appliesDefaults() {
            RequestDescriptor accounts = registry.resolve(BackendEndpointCatalog.ACCOUNTS, OperationParams.none());
            RequestDescriptor plans = registry.resolve(BackendEndpointCatalog.PLANS, OperationParams.ofId("acc_1"));

            assertThat(accounts.query()).containsExactly(Map.entry("limit", List.of("10")));
            assertThat(plans.query()).containsExactly(
                    Map.entry("per_page", List.of("20")),
                    Map.entry("order_by", List.of("-created_at")));
        }

        @Test
        @DisplayName("explicit values override defaults and keep backend parameter names")
        void explicitValuesOverrideDefaults() {
            RequestDescriptor descriptor = registry.resolve(BackendEndpointCatalog.PLANS,
                    OperationParams.builder().id("acc_1").limit(5).sort("plan_name").build());

            assertThat(descriptor.query())
                    .containsEntry("per_page", List.of("5"))
                    .containsEntry("order_by", List.of("plan_name"));
        }

        @Test
        @DisplayName("appends filters in sorted order after declared parameters")
        void appendsFiltersSorted() {
            RequestDescriptor descriptor = registry.resolve(BackendEndpointCatalog.ACCOUNTS,
                    OperationParams.builder().filter("status", "open").filter("q", "acme co").build());

            assertThat(descriptor.relativeUri()).isEqualTo("/v1/accounts?limit=10&q=acme%20co&status=open");
        }

        @Test
        @DisplayName("filters never replace a declared parameter")
        void filtersDoNotOverrideDeclared() {
            RequestDescriptor descriptor = registry.resolve(BackendEndpointCatalog.ACCOUNTS,
                    OperationParams.builder().limit(3).filter("limit", "999").build());

            assertThat(descriptor.query()).containsEntry("limit", List.of("3"));
        }

        @Test
        @DisplayName("fails when a required filter is absent")
        void missingRequiredFilter() {
            assertThatThrownBy(() -> registry.resolve(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY, OperationParams.none()))
                    .isInstanceOf(MissingParameterException.class)
                    .extracting("parameter")
                    .isEqualTo("filters.name");
        }

        @Test
        @DisplayName("equal params resolve to equal descriptors")
        void resolutionIsPure() {
            OperationParams first = OperationParams.builder().filter("b", "2").filter("a", "1").build();
            OperationParams second = OperationParams.builder().filter("a", "1").filter("b", "2").build();

            assertThat(registry.resolve(BackendEndpointCatalog.CATALOG_COMPONENTS, first))
                    .isEqualTo(registry.resolve(BackendEndpointCatalog.CATALOG_COMPONENTS, second));
        }
    }

    @Test
    @DisplayName("unknown operations fail with UnknownOperationException")
    void unknownOperation() {
        assertThatThrownBy(() -> registry.resolve("no-such-operation", OperationParams.none()))
                .isInstanceOf(UnknownOperationException.class)
                .hasMessageContaining("no-such-operation");
    }

    @Test
    @DisplayName("only GET endpoints are idempotent")
    void idempotency() {
        assertThat(registry.resolve(BackendEndpointCatalog.PLAN, OperationParams.ofId("p1")).idempotent()).isTrue();
        assertThat(registry.resolve(BackendEndpointCatalog.UPDATE_PLAN, OperationParams.ofId("p1")).idempotent()).isFalse();
        assertThat(registry.resolve(BackendEndpointCatalog.DELETE_PLAN, OperationParams.ofId("p1")).idempotent()).isFalse();
    }

    @Test
    @DisplayName("service status is the only public operation")
    void publicAccess() {
        assertThat(registry.operations())
                .filteredOn(operation -> !operation.equals(BackendEndpointCatalog.SERVICE_STATUS))
                .allSatisfy(operation -> assertThat(BackendEndpointCatalog.endpoints().stream()
                        .filter(endpoint -> endpoint.operation().equals(operation))
                        .findFirst().orElseThrow().publicAccess()).isFalse());
        assertThat(registry.resolve(BackendEndpointCatalog.SERVICE_STATUS, null).publicAccess()).isTrue();
    }

    @Test
    @DisplayName("rejects duplicate operations in the table")
    void rejectsDuplicates() {
        List<EndpointDefinition> table = List.of(
                EndpointDefinition.get("x", "/x").build(),
                EndpointDefinition.post("x", "/y").build());

        assertThatThrownBy(() -> new EndpointRegistry(table))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }
}
