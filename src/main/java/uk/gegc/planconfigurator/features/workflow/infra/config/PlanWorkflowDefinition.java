package uk.gegc.planconfigurator.features.workflow.infra.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.planconfigurator.features.catalog.application.ComponentCatalog;
import uk.gegc.planconfigurator.features.pricing.application.PricingProperties;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;
import uk.gegc.planconfigurator.features.validation.application.FieldRules;
import uk.gegc.planconfigurator.features.validation.application.checks.AccountExistsCheck;
import uk.gegc.planconfigurator.features.validation.application.checks.PlanNameUniquenessCheck;
import uk.gegc.planconfigurator.features.workflow.application.SelectionBindings;
import uk.gegc.planconfigurator.features.workflow.domain.model.FieldDefinition;
import uk.gegc.planconfigurator.features.workflow.domain.model.NextStep;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepCatalog;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepDefinition;

import java.util.List;
import java.util.Set;

/**
 * Steps of the plan configuration workflow.
 */
@Configuration
public class PlanWorkflowDefinition {

    public static final String ACCOUNT_STEP = "account";
    public static final String BASE_PLAN_STEP = "base-plan";
    public static final String SUPPORT_STEP = "enterprise-support";
    public static final String ADD_ONS_STEP = "add-ons";
    public static final String ONBOARDING_STEP = "onboarding";
    public static final String PROMOTIONS_STEP = "promotions";
    public static final String REVIEW_STEP = "review";

    public static final String ENTERPRISE_TIER = "enterprise";
    public static final String MIGRATION_HOUR = "migration-hour";

    @Bean
    public StepCatalog planStepCatalog(ComponentCatalog componentCatalog,
                                       PricingProperties pricingProperties,
                                       PlanNameUniquenessCheck planNameUniquenessCheck,
                                       AccountExistsCheck accountExistsCheck) {
        return new StepCatalog(List.of(
                StepDefinition.builder()
                        .id(ACCOUNT_STEP)
                        .title("Account")
                        .ordinal(1)
                        .field(FieldDefinition.builder()
                                .id("accountId")
                                .label("Billing account")
                                .required(true)
                                .rule(FieldRules.pattern("acc_[A-Za-z0-9]{4,32}", "Must look like acc_XXXX"))
                                .serverCheck(accountExistsCheck)
                                .build())
                        .field(FieldDefinition.builder()
                                .id("planName")
                                .label("Plan name")
                                .required(true)
                                .rule(FieldRules.maxLength(80))
                                .serverCheck(planNameUniquenessCheck)
                                .build())
                        .next(context -> NextStep.to(BASE_PLAN_STEP))
                        .build(),

                StepDefinition.builder()
                        .id(BASE_PLAN_STEP)
                        .title("Base plan")
                        .ordinal(2)
                        .field(FieldDefinition.builder()
                                .id("tier")
                                .label("Tier")
                                .required(true)
                                .rule(FieldRules.knownOffer(componentCatalog, "", ComponentKind.RECURRING))
                                .rule(FieldRules.oneOf(Set.of("basic", "pro", ENTERPRISE_TIER)))
                                .binding(SelectionBindings.offer(componentCatalog, "seats"))
                                .build())
                        .field(FieldDefinition.builder()
                                .id("seats")
                                .label("Seats")
                                .required(true)
                                .rule(FieldRules.integral())
                                .rule(FieldRules.range(1, 500))
                                .build())
                        .next(context -> NextStep.to(SUPPORT_STEP))
                        .build(),

                StepDefinition.builder()
                        .id(SUPPORT_STEP)
                        .title("Enterprise support")
                        .ordinal(3)
                        .visibility(context -> context.selection().containsCode(ENTERPRISE_TIER))
                        .field(FieldDefinition.builder()
                                .id("supportLevel")
                                .label("Support level")
                                .required(true)
                                .rule(FieldRules.oneOf(Set.of("support-standard", "support-premium")))
                                .binding(SelectionBindings.offer(componentCatalog, null))
                                .build())
                        .next(context -> NextStep.to(ADD_ONS_STEP))
                        .build(),

                StepDefinition.builder()
                        .id(ADD_ONS_STEP)
                        .title("Add-ons")
                        .ordinal(4)
                        .field(FieldDefinition.builder()
                                .id("addOns")
                                .label("Add-ons and quantities")
                                .rule(FieldRules.knownOfferQuantities(componentCatalog, "addon-", 1000))
                                .binding(SelectionBindings.offerQuantities(componentCatalog))
                                .build())
                        .next(context -> NextStep.to(ONBOARDING_STEP))
                        .build(),

                StepDefinition.builder()
                        .id(ONBOARDING_STEP)
                        .title("Onboarding")
                        .ordinal(5)
                        .field(FieldDefinition.builder()
                                .id("setupPackage")
                                .label("Setup package")
                                .rule(FieldRules.oneOf(Set.of("setup-standard", "setup-premium")))
                                .binding(SelectionBindings.offer(componentCatalog, null))
                                .build())
                        .field(FieldDefinition.builder()
                                .id("migrationHours")
                                .label("Data migration hours")
                                .visibility(context -> context.has("setupPackage"))
                                .rule(FieldRules.integral())
                                .rule(FieldRules.range(0, 200))
                                .binding(SelectionBindings.quantityOf(componentCatalog, MIGRATION_HOUR))
                                .build())
                        .next(context -> NextStep.to(PROMOTIONS_STEP))
                        .build(),

                StepDefinition.builder()
                        .id(PROMOTIONS_STEP)
                        .title("Promotions")
                        .ordinal(6)
                        .field(FieldDefinition.builder()
                                .id("promoCode")
                                .label("Promotion code")
                                .rule(FieldRules.knownPromotion(pricingProperties))
                                .binding(SelectionBindings.promotion(pricingProperties))
                                .build())
                        .next(context -> NextStep.to(REVIEW_STEP))
                        .build(),

                StepDefinition.builder()
                        .id(REVIEW_STEP)
                        .title("Review")
                        .ordinal(7)
                        .field(FieldDefinition.builder()
                                .id("confirm")
                                .label("I confirm the plan configuration")
                                .required(true)
                                .rule(FieldRules.isTrue("Confirm the configuration to continue"))
                                .build())
                        .next(context -> NextStep.finished())
                        .build()
        ));
    }
}
