package uk.gegc.planconfigurator.features.workflow.application.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Interner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.planconfigurator.features.backend.application.SlotSequencer;
import uk.gegc.planconfigurator.features.backend.domain.model.SlotTicket;
import uk.gegc.planconfigurator.features.pricing.application.PricingCalculator;
import uk.gegc.planconfigurator.features.pricing.domain.model.Selection;
import uk.gegc.planconfigurator.features.validation.application.ValidationEngine;
import uk.gegc.planconfigurator.features.validation.domain.model.StepValidationReport;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.application.AdvanceResult;
import uk.gegc.planconfigurator.features.workflow.application.AdvanceResult.Outcome;
import uk.gegc.planconfigurator.features.workflow.application.FieldValues;
import uk.gegc.planconfigurator.features.workflow.application.SelectionAssembler;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowEngine;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowProperties;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowStructuredLogger;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowView;
import uk.gegc.planconfigurator.features.workflow.domain.exception.WorkflowSessionNotFoundException;
import uk.gegc.planconfigurator.features.workflow.domain.model.FieldDefinition;
import uk.gegc.planconfigurator.features.workflow.domain.model.NextStep;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepCatalog;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepDefinition;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepEvaluation;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepStatus;
import uk.gegc.planconfigurator.features.workflow.domain.model.WorkflowState;
import uk.gegc.planconfigurator.features.workflow.infra.persistence.WorkflowStateStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Default {@link WorkflowEngine}.
 * <p>
 * Sessions live in memory and are written through to the {@link WorkflowStateStore} on every
 * change; a session missing from memory is resumed from the store. Each session's state is
 * replaced under a per-session lock. An advance validates outside the lock and applies its
 * result only if its ticket is still the latest for the session and the state revision has
 * not moved in the meantime.
 */
@Slf4j
@Service
public class WorkflowEngineImpl implements WorkflowEngine {

    private static final String ADVANCE_SLOT_PREFIX = "advance:";

    private final StepCatalog stepCatalog;
    private final ValidationEngine validationEngine;
    private final PricingCalculator pricingCalculator;
    private final SelectionAssembler selectionAssembler;
    private final WorkflowStateStore stateStore;
    private final SlotSequencer slotSequencer;
    private final Clock clock;

    private final Cache<String, WorkflowState> sessions;
    private final Interner<String> sessionLocks = Interner.newWeakInterner();

    public WorkflowEngineImpl(StepCatalog stepCatalog,
                              ValidationEngine validationEngine,
                              PricingCalculator pricingCalculator,
                              SelectionAssembler selectionAssembler,
                              WorkflowStateStore stateStore,
                              SlotSequencer slotSequencer,
                              WorkflowProperties properties,
                              Clock clock) {
        this.stepCatalog = stepCatalog;
        this.validationEngine = validationEngine;
        this.pricingCalculator = pricingCalculator;
        this.selectionAssembler = selectionAssembler;
        this.stateStore = stateStore;
        this.slotSequencer = slotSequencer;
        this.clock = clock;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(properties.getStateTtl())
                .maximumSize(properties.getMaxSessions())
                .build();
    }

    @Override
    public WorkflowView start(String sessionId) {
        synchronized (lockFor(sessionId)) {
            Optional<WorkflowState> existing = find(sessionId);
            WorkflowState state = existing.orElseGet(() -> WorkflowState.initial(
                    sessionId, pricingCalculator.computeTotal(Selection.empty()), 0L, clock.instant()));

            if (state.isNotStarted()) {
                state = touch(enterStep(state, stepCatalog.first().id(), state.history()));
                commit(state);
                WorkflowStructuredLogger.logTransition(log, "info", "Workflow started at step {}",
                        sessionId, state.currentStepId(), state.revision(), state.currentStepId());
            } else if (existing.isEmpty()) {
                commit(state);
            }
            return toView(state);
        }
    }

    @Override
    public CompletableFuture<AdvanceResult> advance(String sessionId, String authToken) {
        WorkflowState snapshot;
        SlotTicket ticket;
        synchronized (lockFor(sessionId)) {
            WorkflowState state = load(sessionId);
            if (state.isNotStarted()) {
                WorkflowState entered = touch(enterStep(state, stepCatalog.first().id(), state.history()));
                commit(entered);
                return CompletableFuture.completedFuture(new AdvanceResult(
                        entered.isCompleted() ? Outcome.COMPLETED : Outcome.ADVANCED, toView(entered), null));
            }
            if (state.isCompleted()) {
                return CompletableFuture.completedFuture(new AdvanceResult(Outcome.COMPLETED, toView(state), null));
            }

            ticket = slotSequencer.issue(ADVANCE_SLOT_PREFIX + sessionId);
            // marking the pending advance is not a revision change
            snapshot = state.withPendingRequestToken(ticket.sequence());
            commit(snapshot);
        }

        String stepId = snapshot.currentStepId();
        long revision = snapshot.revision();
        WorkflowStructuredLogger.logTransition(log, "debug", "Validating step before advance (ticket {})",
                sessionId, stepId, revision, ticket.sequence());

        CompletableFuture<StepValidationReport> validation;
        try {
            validation = validationEngine.validateStep(stepId, snapshot.context(), authToken);
        } catch (RuntimeException e) {
            clearPendingToken(sessionId, ticket);
            throw e;
        }

        return validation.handle((report, error) -> {
            if (error != null) {
                clearPendingToken(sessionId, ticket);
                throw error instanceof CompletionException completion ? completion : new CompletionException(error);
            }
            return applyAdvance(sessionId, ticket, stepId, revision, report);
        });
    }

    private AdvanceResult applyAdvance(String sessionId, SlotTicket ticket, String stepId, long revision,
                                       StepValidationReport report) {
        synchronized (lockFor(sessionId)) {
            WorkflowState current = load(sessionId);
            boolean stale = !slotSequencer.isCurrent(ticket)
                    || current.revision() != revision
                    || !stepId.equals(current.currentStepId());
            if (stale) {
                WorkflowStructuredLogger.logTransition(log, "debug", "Dropping superseded advance result (ticket {})",
                        sessionId, stepId, current.revision(), ticket.sequence());
                if (Objects.equals(current.pendingRequestToken(), ticket.sequence())) {
                    current = current.withPendingRequestToken(null);
                    commit(current);
                }
                return new AdvanceResult(Outcome.SUPERSEDED, toView(current), report);
            }

            Map<String, ValidationResult> fieldResults = new LinkedHashMap<>(current.fieldResults());
            fieldResults.putAll(report.fieldResults());
            Map<String, StepStatus> statuses = new LinkedHashMap<>(current.stepStatuses());

            if (!report.advanceable()) {
                statuses.put(stepId, StepStatus.INVALID);
                WorkflowState blocked = touch(current
                        .withFieldResults(fieldResults)
                        .withStepStatuses(statuses)
                        .withPendingRequestToken(null));
                commit(blocked);
                WorkflowStructuredLogger.logTransition(log, "debug", "Advance blocked by field {}",
                        sessionId, stepId, blocked.revision(),
                        report.firstFailure().map(Map.Entry::getKey).orElse("?"));
                return new AdvanceResult(Outcome.BLOCKED, toView(blocked), report);
            }

            statuses.put(stepId, StepStatus.VALID);
            List<StepEvaluation> evaluations = new ArrayList<>(current.evaluatedSteps());
            evaluations.add(new StepEvaluation(stepId, StepStatus.VALID, clock.instant()));
            List<String> history = new ArrayList<>(current.history());
            history.add(stepId);

            WorkflowState validated = current
                    .withFieldResults(fieldResults)
                    .withStepStatuses(statuses)
                    .withEvaluatedSteps(evaluations)
                    .withPendingRequestToken(null);

            NextStep next = stepCatalog.step(stepId).resolveNext(validated.context());
            WorkflowState moved = next.done()
                    ? validated.withCurrentStepId(WorkflowState.COMPLETED).withHistory(history)
                    : enterStep(validated, next.stepId(), history);
            moved = touch(moved);
            commit(moved);

            WorkflowStructuredLogger.logTransition(log, "info", "Advanced from {} to {}",
                    sessionId, stepId, moved.revision(), stepId, moved.currentStepId());
            return new AdvanceResult(moved.isCompleted() ? Outcome.COMPLETED : Outcome.ADVANCED, toView(moved), report);
        }
    }

    @Override
    public WorkflowView back(String sessionId) {
        synchronized (lockFor(sessionId)) {
            WorkflowState state = load(sessionId);
            if (state.history().isEmpty()) {
                return toView(state);
            }
            List<String> history = new ArrayList<>(state.history());
            String previous = history.remove(history.size() - 1);

            WorkflowState moved = touch(state
                    .withCurrentStepId(previous)
                    .withHistory(history)
                    .withPendingRequestToken(null));
            commit(moved);
            WorkflowStructuredLogger.logTransition(log, "info", "Moved back from {} to {}",
                    sessionId, previous, moved.revision(), state.currentStepId(), previous);
            return toView(moved);
        }
    }

    @Override
    public WorkflowView updateField(String sessionId, String stepId, String fieldId, Object value) {
        // unknown step or field fails before any state is touched
        stepCatalog.step(stepId).field(fieldId);
        Object normalized = FieldValues.normalize(value);

        synchronized (lockFor(sessionId)) {
            WorkflowState state = load(sessionId);
            ValidationResult result = validationEngine.validateField(stepId, fieldId, normalized);

            Map<String, Object> fieldValues = new LinkedHashMap<>(state.fieldValues());
            if (normalized == null) {
                fieldValues.remove(fieldId);
            } else {
                fieldValues.put(fieldId, normalized);
            }
            Map<String, ValidationResult> fieldResults = new LinkedHashMap<>(state.fieldResults());
            fieldResults.put(fieldId, result);
            Map<String, StepStatus> statuses = new LinkedHashMap<>(state.stepStatuses());
            StepStatus status = state.statusOf(stepId);
            if (status == StepStatus.VALID || status == StepStatus.INVALID) {
                statuses.put(stepId, StepStatus.IN_PROGRESS);
            }

            Selection selection = selectionAssembler.assemble(fieldValues);
            WorkflowState updated = touch(state
                    .withFieldValues(fieldValues)
                    .withFieldResults(fieldResults)
                    .withStepStatuses(statuses)
                    .withSelection(selection)
                    .withPriceSummary(pricingCalculator.computeTotal(selection)));
            commit(updated);

            WorkflowStructuredLogger.logTransition(log, "debug", "Field {} updated ({})",
                    sessionId, stepId, updated.revision(), fieldId, result.status());
            return toView(updated);
        }
    }

    @Override
    public WorkflowView reset(String sessionId) {
        synchronized (lockFor(sessionId)) {
            WorkflowState state = load(sessionId);
            slotSequencer.supersede(ADVANCE_SLOT_PREFIX + sessionId);
            WorkflowState fresh = WorkflowState.initial(sessionId,
                    pricingCalculator.computeTotal(Selection.empty()), state.revision() + 1, clock.instant());
            commit(fresh);
            WorkflowStructuredLogger.logTransition(log, "info", "Workflow reset",
                    sessionId, fresh.currentStepId(), fresh.revision());
            return toView(fresh);
        }
    }

    @Override
    public WorkflowView resetStep(String sessionId, String stepId) {
        StepDefinition step = stepCatalog.step(stepId);

        synchronized (lockFor(sessionId)) {
            WorkflowState state = load(sessionId);
            Map<String, Object> fieldValues = new LinkedHashMap<>(state.fieldValues());
            Map<String, ValidationResult> fieldResults = new LinkedHashMap<>(state.fieldResults());
            for (FieldDefinition field : step.fields()) {
                fieldValues.remove(field.id());
                fieldResults.remove(field.id());
            }
            Map<String, StepStatus> statuses = new LinkedHashMap<>(state.stepStatuses());
            statuses.remove(stepId);
            if (stepId.equals(state.currentStepId())) {
                statuses.put(stepId, StepStatus.IN_PROGRESS);
            }

            Selection selection = selectionAssembler.assemble(fieldValues);
            WorkflowState cleared = touch(state
                    .withFieldValues(fieldValues)
                    .withFieldResults(fieldResults)
                    .withStepStatuses(statuses)
                    .withSelection(selection)
                    .withPriceSummary(pricingCalculator.computeTotal(selection)));
            commit(cleared);
            WorkflowStructuredLogger.logTransition(log, "info", "Step reset",
                    sessionId, stepId, cleared.revision());
            return toView(cleared);
        }
    }

    @Override
    public WorkflowView view(String sessionId) {
        synchronized (lockFor(sessionId)) {
            return toView(load(sessionId));
        }
    }

    @Override
    public WorkflowState state(String sessionId) {
        synchronized (lockFor(sessionId)) {
            return load(sessionId);
        }
    }

    /**
     * Enters {@code candidateStepId}, passing over steps without visible fields. Skipped steps
     * are marked {@link StepStatus#SKIPPED} and recorded as evaluated.
     */
    private WorkflowState enterStep(WorkflowState state, String candidateStepId, List<String> history) {
        StepContext context = state.context();
        Map<String, StepStatus> statuses = new LinkedHashMap<>(state.stepStatuses());
        List<StepEvaluation> evaluations = new ArrayList<>(state.evaluatedSteps());

        String target = candidateStepId;
        for (int hops = 0; hops <= stepCatalog.size(); hops++) {
            StepDefinition step = stepCatalog.step(target);
            if (!step.visibleFields(context).isEmpty()) {
                StepStatus existing = statuses.getOrDefault(target, StepStatus.NOT_VISITED);
                if (existing == StepStatus.NOT_VISITED || existing == StepStatus.SKIPPED) {
                    statuses.put(target, StepStatus.IN_PROGRESS);
                }
                return state.withCurrentStepId(target)
                        .withStepStatuses(statuses)
                        .withEvaluatedSteps(evaluations)
                        .withHistory(history);
            }

            statuses.put(target, StepStatus.SKIPPED);
            evaluations.add(new StepEvaluation(target, StepStatus.SKIPPED, clock.instant()));
            log.debug("Skipping step '{}' with no visible fields in session {}", target, state.sessionId());

            NextStep next = step.resolveNext(context);
            if (next.done()) {
                return state.withCurrentStepId(WorkflowState.COMPLETED)
                        .withStepStatuses(statuses)
                        .withEvaluatedSteps(evaluations)
                        .withHistory(history);
            }
            target = next.stepId();
        }
        throw new IllegalStateException("Next-step resolvers loop through skipped steps starting at " + candidateStepId);
    }

    private void clearPendingToken(String sessionId, SlotTicket ticket) {
        synchronized (lockFor(sessionId)) {
            WorkflowState current = sessions.getIfPresent(sessionId);
            if (current != null && Objects.equals(current.pendingRequestToken(), ticket.sequence())) {
                commit(current.withPendingRequestToken(null));
            }
        }
    }

    private WorkflowState touch(WorkflowState state) {
        return state.withRevision(state.revision() + 1).withUpdatedAt(clock.instant());
    }

    private WorkflowState load(String sessionId) {
        return find(sessionId).orElseThrow(() -> new WorkflowSessionNotFoundException(sessionId));
    }

    private Optional<WorkflowState> find(String sessionId) {
        WorkflowState inMemory = sessions.getIfPresent(sessionId);
        if (inMemory != null) {
            return Optional.of(inMemory);
        }
        Optional<WorkflowState> stored;
        try {
            stored = stateStore.load(sessionId);
        } catch (RuntimeException e) {
            log.warn("Failed to load persisted workflow state for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
        stored.ifPresent(state -> {
            sessions.put(sessionId, state);
            WorkflowStructuredLogger.logTransition(log, "info", "Resumed workflow session from store",
                    sessionId, state.currentStepId(), state.revision());
        });
        return stored;
    }

    /**
     * In-memory state is authoritative; a failed persist is logged and otherwise ignored.
     */
    private void commit(WorkflowState state) {
        sessions.put(state.sessionId(), state);
        try {
            stateStore.save(state.sessionId(), state);
        } catch (RuntimeException e) {
            WorkflowStructuredLogger.logTransition(log, "warn", "Failed to persist workflow state: {}",
                    state.sessionId(), state.currentStepId(), state.revision(), e.getMessage());
        }
    }

    private Object lockFor(String sessionId) {
        return sessionLocks.intern(sessionId);
    }

    private WorkflowView toView(WorkflowState state) {
        StepContext context = state.context();
        List<WorkflowView.FieldView> fields = new ArrayList<>();
        String title = null;
        if (state.isOnStep()) {
            StepDefinition step = stepCatalog.step(state.currentStepId());
            title = step.title();
            for (FieldDefinition field : step.visibleFields(context)) {
                fields.add(new WorkflowView.FieldView(field.id(), field.label(), field.required(),
                        state.fieldValues().get(field.id()), state.fieldResults().get(field.id())));
            }
        }
        List<WorkflowView.StepView> steps = stepCatalog.steps().stream()
                .map(step -> new WorkflowView.StepView(step.id(), step.title(), state.statusOf(step.id())))
                .toList();

        WorkflowView.Phase phase = state.isNotStarted()
                ? WorkflowView.Phase.NOT_STARTED
                : state.isCompleted() ? WorkflowView.Phase.COMPLETED : WorkflowView.Phase.IN_PROGRESS;

        return new WorkflowView(
                state.sessionId(),
                phase,
                state.currentStepId(),
                title,
                fields,
                steps,
                state.selection().components(),
                state.priceSummary(),
                state.pendingRequestToken() != null,
                !state.history().isEmpty(),
                state.revision()
        );
    }
}
