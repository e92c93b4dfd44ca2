package com.switchboard.core.outreach;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.config.OutreachProperties;
import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.model.DelegationRule;
import com.switchboard.core.model.MessageType;
import com.switchboard.core.model.MutationDirective;
import com.switchboard.core.model.MutationResult;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.ReportStatus;
import com.switchboard.core.model.ReviewResult;
import com.switchboard.core.model.ReviewSeverity;
import com.switchboard.core.model.Signal;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.Urgency;
import com.switchboard.core.registry.UnitId;
import com.switchboard.core.store.StoreCategory;
import com.switchboard.core.store.StoreEntry;
import com.switchboard.core.store.StorePriority;
import com.switchboard.core.store.StoreQuery;
import com.switchboard.core.store.WriteOptions;
import com.switchboard.core.supervisor.Supervisor;
import com.switchboard.core.supervisor.SupervisorContext;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Outreach supervisor running multi-step, multi-channel contact sequences against single leads.
 * <p>
 * Before the first step the lead's sentiment and compliance are checked; a HOSTILE lead is
 * flagged for human review and nothing is sent. Before every later step sentiment, do-not-contact
 * and unsubscribe are checked again, and in deferred mode a step that comes due inside quiet hours
 * waits for the window to close. Steps run in order through the channel units. A FAILED step falls
 * back to its fallback channel if it has one and does not stop the sequence; a BLOCKED step halts
 * it. An exception escaping a step ends the run FAILED. Every attempt is written to contact
 * history, the execution state to {@code WORKFLOW/sequence_exec_<sequence>_<lead>} and the
 * terminal outcome to
 * {@code INSIGHT/sequence_outcome_<sequence>_<lead>}.
 * <p>
 * {@link #executeSequence} treats every delay as already elapsed. {@link #startSequence} honours
 * delays: a step that is not yet due is handed to the {@link StepTrigger} and the call returns
 * PENDING; {@link #resumeDue} picks such steps up later.
 */
@Service
public class SequenceEngine extends Supervisor {

    public static final String HUMAN_REVIEW_REQUIRED = "HUMAN_REVIEW_REQUIRED";
    public static final String COMPLIANCE_BLOCKED = "COMPLIANCE_BLOCKED";
    public static final String STEP_BLOCKED = "STEP_BLOCKED";
    public static final String SEQUENCE_TERMINAL = "SEQUENCE_TERMINAL";
    public static final String SEQUENCE_ERROR = "SEQUENCE_ERROR";
    public static final String QUIET_HOURS = "QUIET_HOURS";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final List<DelegationRule> RULES = List.of(
            DelegationRule.of(UnitId.EMAIL_CHANNEL.name(), 10, "email"),
            DelegationRule.of(UnitId.SMS_CHANNEL.name(), 10, "sms", "text message"),
            DelegationRule.of(UnitId.LINKEDIN_CHANNEL.name(), 5, "linkedin"),
            DelegationRule.of(UnitId.PHONE_CHANNEL.name(), 5, "phone call", "voicemail"));

    private final SentimentAnalyzer sentimentAnalyzer;
    private final ComplianceChecker complianceChecker;
    private final SuppressionList suppressionList;
    private final TemplatePersonalizer personalizer;
    private final ContactHistory contactHistory;
    private final SequenceValidator validator;
    private final StepTrigger stepTrigger;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicReference<OutreachParameters> parameters;

    public SequenceEngine(SupervisorContext context,
                          SentimentAnalyzer sentimentAnalyzer,
                          ComplianceChecker complianceChecker,
                          SuppressionList suppressionList,
                          TemplatePersonalizer personalizer,
                          ContactHistory contactHistory,
                          SequenceValidator validator,
                          StepTrigger stepTrigger,
                          OutreachProperties outreachProperties,
                          ObjectMapper objectMapper,
                          Clock clock) {
        super(UnitId.OUTREACH_MANAGER.identity(), context);
        this.sentimentAnalyzer = sentimentAnalyzer;
        this.complianceChecker = complianceChecker;
        this.suppressionList = suppressionList;
        this.personalizer = personalizer;
        this.contactHistory = contactHistory;
        this.validator = validator;
        this.stepTrigger = stepTrigger;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.parameters = new AtomicReference<>(OutreachParameters.from(outreachProperties));
    }

    /**
     * Runs every step now, ignoring delays.
     */
    public Report executeSequence(SequenceDefinition definition, Lead lead) {
        return begin(definition, lead, false);
    }

    /**
     * Runs the steps that are already due and schedules the next one.
     */
    public Report startSequence(SequenceDefinition definition, Lead lead) {
        return begin(definition, lead, true);
    }

    public Report resume(String sequenceId, String leadId) {
        String taskId = taskId(sequenceId, leadId);
        return guarded(sequenceId, leadId, () -> {
            Optional<SequenceRun> run = loadRun(sequenceId, leadId);
            if (run.isEmpty()) {
                return Report.failed(taskId, id(), "No execution for sequence " + sequenceId + " and lead " + leadId);
            }
            if (run.get().execution().hasEnded()) {
                return terminalReport(run.get());
            }
            Optional<Report> paused = checkPaused(taskId);
            if (paused.isPresent()) {
                return paused.get();
            }
            return advance(run.get(), true);
        });
    }

    /**
     * Resumes every scheduled step whose delay has elapsed. While paused nothing is taken from the
     * trigger, so due steps wait for the resume.
     */
    public List<Report> resumeDue() {
        Optional<Report> paused = checkPaused("resume_due");
        if (paused.isPresent()) {
            return List.of(paused.get());
        }
        return stepTrigger.takeDue(clock.instant()).stream()
                .map(step -> resume(step.sequenceId(), step.leadId()))
                .toList();
    }

    public Optional<SequenceExecution> execution(String sequenceId, String leadId) {
        return loadRun(sequenceId, leadId).map(SequenceRun::execution);
    }

    public OutreachParameters parameters() {
        return parameters.get();
    }

    @Override
    protected List<DelegationRule> delegationRules() {
        return RULES;
    }

    /**
     * Handles {@code {"sequence": {...}, "lead": {...}, "mode": "deferred"?}} payloads directly.
     */
    @Override
    protected Optional<Report> handleDirect(UnitMessage message) {
        Map<String, Object> payload = message.payload();
        if (!payload.containsKey("sequence")) {
            return Optional.empty();
        }
        SequenceDefinition definition = objectMapper.convertValue(payload.get("sequence"), SequenceDefinition.class);
        Lead lead = objectMapper.convertValue(payload.get("lead"), Lead.class);
        boolean deferred = "deferred".equals(payload.get("mode"));
        return Optional.of(deferred ? startSequence(definition, lead) : executeSequence(definition, lead));
    }

    @Override
    protected ReviewResult reviewOutput(Report report) {
        Object body = report.data().get("body");
        if (body == null || body.toString().isBlank()) {
            return ReviewResult.reject(ReviewSeverity.MAJOR, List.of("Channel output has an empty body"));
        }
        List<String> unresolved = personalizer.unresolved(body.toString());
        if (!unresolved.isEmpty()) {
            return ReviewResult.reject(ReviewSeverity.MAJOR, List.of("Unresolved placeholders: " + unresolved));
        }
        return ReviewResult.pass();
    }

    @Override
    protected Report doHandleSignal(Signal signal) {
        Object leadId = signal.payload().get("leadId");
        if (leadId != null && "lead.unsubscribed".equals(signal.type())) {
            suppressionList.markUnsubscribed(leadId.toString(), "signal from " + signal.origin());
            int stopped = stopActiveRuns(leadId.toString(), false);
            return Report.completed(signal.id(), id(),
                    Map.of("leadId", leadId, "unsubscribed", true, "sequencesStopped", stopped));
        }
        if (leadId != null && "lead.do_not_contact".equals(signal.type())) {
            suppressionList.markDoNotContact(leadId.toString(), "signal from " + signal.origin());
            int stopped = stopActiveRuns(leadId.toString(), true);
            return Report.completed(signal.id(), id(),
                    Map.of("leadId", leadId, "doNotContact", true, "sequencesStopped", stopped));
        }
        return super.doHandleSignal(signal);
    }

    @Override
    public Set<String> managedMutationTypes() {
        return Set.of(OutreachParameters.SEND_TIME_OPTIMIZATION,
                OutreachParameters.FREQUENCY_CAP,
                OutreachParameters.CHANNEL_PREFERENCE);
    }

    @Override
    public MutationResult applyMutation(MutationDirective directive) {
        OutreachParameters before = parameters.get();
        try {
            OutreachParameters after = before.apply(directive);
            parameters.set(after);
            log.info("Applied {} directive {}: {}", directive.type(), directive.id(), after.toMap());
            return new MutationResult(directive.id(), directive.type(), true, before.toMap(), after.toMap(), null);
        } catch (IllegalArgumentException e) {
            return new MutationResult(directive.id(), directive.type(), false, before.toMap(), before.toMap(),
                    e.getMessage());
        }
    }

    private Report begin(SequenceDefinition definition, Lead lead, boolean honourDelays) {
        String taskId = definition != null && lead != null
                ? taskId(definition.sequenceId(), lead.id())
                : "sequence_invalid";
        try {
            validator.validate(definition, lead);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected sequence: {}", e.getMessage());
            return Report.failed(taskId, id(), e.getMessage());
        }
        return guarded(definition.sequenceId(), lead.id(), () -> {
            Optional<Report> paused = checkPaused(taskId);
            if (paused.isPresent()) {
                return paused.get();
            }
            Optional<SequenceRun> existing = loadRun(definition.sequenceId(), lead.id());
            if (existing.isPresent()) {
                return existing.get().execution().hasEnded()
                        ? terminalReport(existing.get())
                        : advance(existing.get(), honourDelays);
            }

            SequenceRun run = new SequenceRun(definition, lead, SequenceExecution.start(
                    definition.sequenceId(), lead.id(), definition.steps().size(), clock.instant()));

            Sentiment sentiment = sentimentAnalyzer.analyze(lead);
            if (sentiment == Sentiment.HOSTILE) {
                flagForHumanReview(run, sentiment);
                return finish(run, SequenceStatus.BLOCKED, HUMAN_REVIEW_REQUIRED,
                        List.of("HOSTILE sentiment detected for lead " + lead.id() + "; flagged for human review"));
            }

            ComplianceDecision decision = complianceChecker.canContact(lead, definition.complianceSettings(),
                    parameters.get());
            if (!decision.allowed()) {
                return finish(run, SequenceStatus.BLOCKED, COMPLIANCE_BLOCKED, decision.reasons());
            }

            saveRun(run);
            log.info("Starting sequence {} for lead {} ({} steps)", definition.sequenceId(), lead.id(),
                    definition.steps().size());
            return advance(run, honourDelays);
        });
    }

    private Report advance(SequenceRun start, boolean honourDelays) {
        SequenceRun run = start;
        List<SequenceStep> steps = run.definition().steps();
        while (run.execution().currentStep() < steps.size()) {
            SequenceExecution execution = run.execution();
            SequenceStep step = steps.get(execution.currentStep());

            if (honourDelays) {
                Instant due = execution.updatedAt().plus(Duration.ofHours(step.delayHours()));
                if (due.isAfter(clock.instant())) {
                    return defer(run, step, due, null);
                }
            }

            if (execution.currentStep() > 0) {
                Optional<Report> stopped = recheckLead(run, step);
                if (stopped.isPresent()) {
                    return stopped.get();
                }
                if (honourDelays) {
                    Optional<Instant> quietEnd = complianceChecker.quietWindowEnd(
                            run.definition().complianceSettings(), parameters.get());
                    if (quietEnd.isPresent()) {
                        log.info("Step {} of {} for {} falls in quiet hours", step.stepNumber(),
                                run.definition().sequenceId(), run.lead().id());
                        return defer(run, step, quietEnd.get(), QUIET_HOURS);
                    }
                }
            }

            StepResult result;
            try {
                result = executeStep(run, step);
                run = run.withExecution(execution.recordStep(result, clock.instant()));
                saveRun(run);
            } catch (RuntimeException e) {
                log.error("Step {} of {} for {} failed: {}", step.stepNumber(), run.definition().sequenceId(),
                        run.lead().id(), e.getMessage(), e);
                return finish(run, SequenceStatus.FAILED, SEQUENCE_ERROR, List.of("Step " + step.stepNumber()
                        + " failed: " + e.getClass().getSimpleName() + ": " + e.getMessage()));
            }

            if (result.status() == ReportStatus.BLOCKED) {
                List<String> reasons = result.errors().isEmpty()
                        ? List.of("Step " + step.stepNumber() + " was blocked on " + result.channel())
                        : result.errors();
                return finish(run, SequenceStatus.BLOCKED, STEP_BLOCKED, reasons);
            }
        }
        return finish(run, SequenceStatus.COMPLETED, null, List.of());
    }

    private StepResult executeStep(SequenceRun run, SequenceStep step) {
        Lead lead = run.lead();
        String body = personalizer.personalize(step.template(), lead, step.variables());
        Object rawSubject = step.variables().get("subject");
        String subject = rawSubject != null
                ? personalizer.personalize(rawSubject.toString(), lead, step.variables())
                : null;

        Report primary = attempt(run, step, step.channel(), body, subject, false);

        Channel fallback = step.fallbackChannel() != null
                ? step.fallbackChannel()
                : parameters.get().defaultFallbackChannel();
        if (primary.status() == ReportStatus.FAILED && fallback != null && fallback != step.channel()) {
            log.info("Step {} failed on {}; trying fallback {}", step.stepNumber(), step.channel(), fallback);
            Report secondary = attempt(run, step, fallback, body, subject, true);
            if (secondary.status() == ReportStatus.BLOCKED) {
                // A fallback the lead or unit cannot take leaves the step as the primary left it.
                List<String> errors = new ArrayList<>(primary.errors());
                secondary.errors().forEach(e -> errors.add("Fallback " + fallback + " unavailable: " + e));
                return new StepResult(step.stepNumber(), step.channel(), primary.status(), true,
                        errors, clock.instant());
            }
            return new StepResult(step.stepNumber(), fallback, secondary.status(), true,
                    secondary.errors(), clock.instant());
        }
        return new StepResult(step.stepNumber(), step.channel(), primary.status(), false,
                primary.errors(), clock.instant());
    }

    private Report attempt(SequenceRun run, SequenceStep step, Channel channel, String body, String subject,
                           boolean fallback) {
        Lead lead = run.lead();
        String sequenceId = run.definition().sequenceId();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sequenceId", sequenceId);
        payload.put("leadId", lead.id());
        payload.put("stepNumber", step.stepNumber());
        payload.put("channel", channel.name());
        payload.put("body", body);
        if (subject != null) {
            payload.put("subject", subject);
        }
        payload.put("name", lead.name());
        payload.put("email", lead.email());
        payload.put("phone", lead.phone());

        String messageId = "step_" + sequenceId + "_" + lead.id() + "_" + step.stepNumber() + "_" + channel.name();
        UnitMessage message = new UnitMessage(messageId, MessageType.COMMAND, id(), channel.unitId(), payload,
                Urgency.NORMAL, true, taskId(sequenceId, lead.id()), clock.instant());

        Report report = delegateToUnit(channel.unitId(), message);
        context.metrics().recordStepAttempt(channel.name(), report.status().name());
        contactHistory.record(sequenceId, lead.id(), step.stepNumber(), channel, fallback, report);
        return report;
    }

    /**
     * Sentiment and suppression as they stand now, for a run that has already sent something.
     */
    private Optional<Report> recheckLead(SequenceRun run, SequenceStep step) {
        Lead lead = run.lead();
        if (sentimentAnalyzer.analyze(lead) == Sentiment.HOSTILE) {
            flagForHumanReview(run, Sentiment.HOSTILE);
            return Optional.of(finish(run, SequenceStatus.BLOCKED, HUMAN_REVIEW_REQUIRED,
                    List.of("HOSTILE sentiment detected for lead " + lead.id() + " before step "
                            + step.stepNumber() + "; flagged for human review")));
        }
        List<String> reasons = complianceChecker.suppressionReasons(lead, run.definition().complianceSettings());
        if (!reasons.isEmpty()) {
            log.info("Lead {} opted out before step {} of {}", lead.id(), step.stepNumber(),
                    run.definition().sequenceId());
            return Optional.of(finish(run, SequenceStatus.BLOCKED, COMPLIANCE_BLOCKED, reasons));
        }
        return Optional.empty();
    }

    /**
     * Ends every unfinished run for the lead and drops its scheduled step.
     *
     * @param doNotContact whether the cause is a do-not-contact flag, which runs that opted out of
     *                     DNC ignore
     */
    private int stopActiveRuns(String leadId, boolean doNotContact) {
        StoreQuery query = StoreQuery.builder()
                .category(StoreCategory.WORKFLOW)
                .tags("lead:" + leadId)
                .build();
        int stopped = 0;
        for (StoreEntry entry : context.store().query(id(), query)) {
            if (!entry.hasTag("sequence-execution")) {
                continue;
            }
            SequenceRun run = objectMapper.convertValue(entry.value(), SequenceRun.class);
            if (run.execution().hasEnded()) {
                continue;
            }
            ComplianceSettings settings = run.definition().complianceSettings();
            if (doNotContact && settings != null && !settings.respectsDnc()) {
                continue;
            }
            String sequenceId = run.definition().sequenceId();
            stepTrigger.cancel(sequenceId, leadId);
            MdcContext.setSequence(sequenceId, leadId);
            try {
                finish(run, SequenceStatus.BLOCKED, COMPLIANCE_BLOCKED, List.of("Lead " + leadId
                        + (doNotContact ? " was placed on the do-not-contact list" : " unsubscribed")
                        + " during the sequence"));
            } finally {
                MdcContext.clearSequence();
            }
            stopped++;
        }
        return stopped;
    }

    private Report defer(SequenceRun run, SequenceStep step, Instant due, String reasonCode) {
        String sequenceId = run.definition().sequenceId();
        String leadId = run.lead().id();
        saveRun(run);
        stepTrigger.schedule(new ScheduledStep(sequenceId, leadId, step.stepNumber(), due));
        log.info("Step {} of {} for {} deferred until {}", step.stepNumber(), sequenceId, leadId, due);

        Map<String, Object> data = progress(run.execution());
        data.put("nextStep", step.stepNumber());
        data.put("dueAt", due.toString());
        if (reasonCode != null) {
            data.put("reason", reasonCode);
        }
        return Report.pending(taskId(sequenceId, leadId), id(), data);
    }

    private Report finish(SequenceRun run, SequenceStatus status, String reasonCode, List<String> reasons) {
        SequenceExecution execution = run.execution().finish(status, reasons, clock.instant());
        SequenceRun finished = run.withExecution(execution);
        saveRun(finished);
        writeOutcome(finished);
        context.metrics().recordSequenceResult(status.name());
        log.info("Sequence {} for lead {} ended {} after {}/{} steps", execution.sequenceId(), execution.leadId(),
                status, execution.currentStep(), execution.totalSteps());

        String taskId = taskId(execution.sequenceId(), execution.leadId());
        Map<String, Object> data = progress(execution);
        if (reasonCode != null) {
            data.put("reason", reasonCode);
        }
        return switch (status) {
            case COMPLETED -> Report.completed(taskId, id(), data);
            case BLOCKED -> Report.blocked(taskId, id(), data, reasons);
            default -> Report.failed(taskId, id(), data, reasons);
        };
    }

    private Report terminalReport(SequenceRun run) {
        SequenceExecution execution = run.execution();
        Map<String, Object> data = progress(execution);
        data.put("reason", SEQUENCE_TERMINAL);
        return Report.blocked(taskId(execution.sequenceId(), execution.leadId()), id(), data,
                List.of("Sequence " + execution.sequenceId() + " for lead " + execution.leadId()
                        + " is already " + execution.status()));
    }

    private Report guarded(String sequenceId, String leadId, Supplier<Report> work) {
        String taskId = taskId(sequenceId, leadId);
        MdcContext.setSequence(sequenceId, leadId);
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.error("Sequence task {} failed: {}", taskId, e.getMessage(), e);
            return Report.failed(taskId, id(), e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MdcContext.clearSequence();
        }
    }

    private void flagForHumanReview(SequenceRun run, Sentiment sentiment) {
        String leadId = run.lead().id();
        String sequenceId = run.definition().sequenceId();
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("leadId", leadId);
        value.put("sequenceId", sequenceId);
        value.put("sentiment", sentiment.name());
        value.put("reason", "Sequence withheld: " + sentiment + " sentiment");
        value.put("flaggedBy", id());
        value.put("flaggedAt", clock.instant().toString());
        context.store().write(StoreCategory.SIGNAL, "human_review_" + leadId + "_" + sequenceId, value, id(),
                WriteOptions.of(StorePriority.HIGH, "human-review", "sentiment"));
        log.warn("Lead {} flagged for human review ({} sentiment)", leadId, sentiment);
    }

    private void writeOutcome(SequenceRun run) {
        SequenceExecution execution = run.execution();
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("sequenceId", execution.sequenceId());
        value.put("leadId", execution.leadId());
        value.put("status", execution.status().name());
        value.put("stepsExecuted", execution.currentStep());
        value.put("totalSteps", execution.totalSteps());
        value.put("reasons", execution.reasons());
        value.put("steps", execution.stepResults().stream()
                .map(r -> Map.<String, Object>of("stepNumber", r.stepNumber(), "channel", r.channel().name(),
                        "status", r.status().name(), "fallbackUsed", r.fallbackUsed()))
                .toList());
        value.put("completedAt", String.valueOf(execution.completedAt()));
        StorePriority priority = execution.status() == SequenceStatus.COMPLETED ? StorePriority.MEDIUM : StorePriority.HIGH;
        context.store().write(StoreCategory.INSIGHT,
                "sequence_outcome_" + execution.sequenceId() + "_" + execution.leadId(), value, id(),
                WriteOptions.of(priority, "sequence-outcome", "lead:" + execution.leadId()));
    }

    private Optional<SequenceRun> loadRun(String sequenceId, String leadId) {
        return context.store().read(StoreCategory.WORKFLOW, executionKey(sequenceId, leadId), id())
                .map(entry -> objectMapper.convertValue(entry.value(), SequenceRun.class));
    }

    private void saveRun(SequenceRun run) {
        String leadId = run.lead().id();
        context.store().write(StoreCategory.WORKFLOW, executionKey(run.definition().sequenceId(), leadId),
                objectMapper.convertValue(run, MAP_TYPE), id(),
                WriteOptions.of(StorePriority.MEDIUM, "sequence-execution", "lead:" + leadId));
    }

    private static Map<String, Object> progress(SequenceExecution execution) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sequenceId", execution.sequenceId());
        data.put("leadId", execution.leadId());
        data.put("status", execution.status().name());
        data.put("stepsExecuted", execution.currentStep());
        data.put("totalSteps", execution.totalSteps());
        data.put("stepResults", execution.stepResults());
        return data;
    }

    private static String executionKey(String sequenceId, String leadId) {
        return "sequence_exec_" + sequenceId + "_" + leadId;
    }

    private static String taskId(String sequenceId, String leadId) {
        return "sequence_" + sequenceId + "_" + leadId;
    }
}
