package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.calendar.SlotGenerator;
import com.example.dutyroster.calendar.SlotPlan;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.constraint.Elimination;
import com.example.dutyroster.constraint.EliminationReason;
import com.example.dutyroster.constraint.ExclusionRules;
import com.example.dutyroster.exception.ConfigInconsistencyException;
import com.example.dutyroster.history.EligibilityModel;
import com.example.dutyroster.history.HistoryWindow;
import com.example.dutyroster.member.IndexGroup;
import com.example.dutyroster.member.Member;
import com.example.dutyroster.member.MemberRoster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;

/**
 * Single-pass greedy assignment over the slots of one rotation.
 * <p>
 * Each slot is settled before the next is looked at: the fixed-pattern override
 * first, then exclusion, index eligibility and the interval filter, then the
 * selector. A forced member must pass the same hard rules as any candidate,
 * otherwise the slot falls back to normal selection. Committed assignments are never revisited. A builder holds the
 * state of exactly one pass; call {@link #prepare} again for another.
 */
public class ScheduleBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleBuilder.class);

    private final SlotPlan plan;
    private final MemberRoster roster;
    private final EligibilityModel eligibility;
    private final ExclusionRules exclusions;
    private final PriorityScorer scorer;
    private final CandidateSelector selector;
    private final FixedPatternOverride fixedPattern;
    private final FairnessState state;
    private boolean consumed;

    private ScheduleBuilder(SlotPlan plan, MemberRoster roster, EligibilityModel eligibility,
                            ExclusionRules exclusions, PriorityScorer scorer, CandidateSelector selector,
                            FixedPatternOverride fixedPattern, FairnessState state) {
        this.plan = plan;
        this.roster = roster;
        this.eligibility = eligibility;
        this.exclusions = exclusions;
        this.scorer = scorer;
        this.selector = selector;
        this.fixedPattern = fixedPattern;
        this.state = state;
    }

    public static ScheduleBuilder prepare(RotationInput input) {
        return prepare(input, null);
    }

    /**
     * Validates the input and precomputes everything the pass needs.
     *
     * @param selector selection strategy, {@code null} for the fairness ordering
     * @throws com.example.dutyroster.exception.InvalidPeriodException when the period is malformed
     * @throws ConfigInconsistencyException when NG rules or the fixed pattern name unknown members
     */
    public static ScheduleBuilder prepare(RotationInput input, CandidateSelector selector) {
        RotationRules rules = input.rules();
        SlotPlan plan = new SlotGenerator(rules).generate(input.period(), input.ngRules().globalDates());
        MemberRoster roster = MemberRoster.of(input.members());

        List<String> problems = new ArrayList<>();
        for (String name : input.ngRules().referencedMembers()) {
            if (!roster.contains(name)) {
                problems.add("NG rule refers to unknown member " + name);
            }
        }
        HistoryWindow history = HistoryWindow.before(input.period().start(), rules.lookbackMonths(), input.history());
        Set<String> unknown = new TreeSet<>(history.memberNames());
        unknown.removeIf(roster::contains);
        if (!unknown.isEmpty()) {
            logger.warn("Ignoring history rows for members not on the roster: {}", unknown);
            history = HistoryWindow.before(input.period().start(), rules.lookbackMonths(),
                    input.history().stream().filter(r -> roster.contains(r.memberName())).toList());
        }
        String fixedName = input.fixedPattern().enabled() ? input.fixedPattern().memberName() : null;
        if (fixedName != null && !fixedName.isBlank()) {
            int target = input.fixedPattern().targetIndex();
            Optional<Member> designated = roster.find(fixedName);
            if (designated.isEmpty()) {
                problems.add("fixed pattern refers to unknown member " + fixedName);
            } else if (!designated.get().groupFor(ShiftType.NIGHT).map(g -> g.indices().contains(target)).orElse(false)) {
                problems.add("fixed pattern member " + fixedName + " is not in the night index " + target + " group");
            }
        }
        FixedPatternOverride override = problems.isEmpty()
                ? FixedPatternOverride.resolve(input.fixedPattern(), history, rules, problems)
                : FixedPatternOverride.none();
        if (!problems.isEmpty()) {
            throw new ConfigInconsistencyException(problems);
        }

        PriorityScorer scorer = new PriorityScorer(rules);
        return new ScheduleBuilder(plan, roster,
                EligibilityModel.build(roster, history),
                new ExclusionRules(rules, history, input.ngRules()),
                scorer,
                selector == null ? scorer : selector,
                override,
                FairnessState.seed(roster, history));
    }

    public SlotPlan plan() {
        return plan;
    }

    public MemberRoster roster() {
        return roster;
    }

    public ScheduleResult build() {
        return build(() -> false);
    }

    /**
     * Runs the pass. {@code stopRequested} is polled between slots only; when it
     * returns true the run ends as {@link ScheduleResult.Status#ABORTED}.
     */
    public ScheduleResult build(BooleanSupplier stopRequested) {
        if (consumed) {
            throw new IllegalStateException("ScheduleBuilder has already run; prepare a new one");
        }
        consumed = true;
        logger.info("Building rotation {}: {} slots, {} members (D12={}, D3={}, N1={}, N2={})",
                plan.period(), plan.slots().size(), roster.size(),
                roster.countActive(IndexGroup.DAY_INDEX_1_2), roster.countActive(IndexGroup.DAY_INDEX_3),
                roster.countActive(IndexGroup.NIGHT_INDEX_1), roster.countActive(IndexGroup.NIGHT_INDEX_2));

        List<Assignment> assignments = new ArrayList<>();
        List<ScheduleNote> notes = holidayNotes();

        for (DutySlot slot : plan.slots()) {
            if (stopRequested.getAsBoolean()) {
                logger.info("Rotation {} stopped before {} after {} assignments", plan.period(), slot, assignments.size());
                return new ScheduleResult(ScheduleResult.Status.ABORTED, plan.period(), assignments, notes, null, slot);
            }
            Optional<Assignment> forced = tryFixedPattern(slot, notes);
            if (forced.isPresent()) {
                commit(forced.get(), assignments);
                continue;
            }

            List<Member> pool = new ArrayList<>();
            Map<String, List<Elimination>> eliminated = new LinkedHashMap<>();
            for (Member member : roster.members()) {
                List<Elimination> reasons = evaluate(member, slot);
                if (reasons.isEmpty()) {
                    pool.add(member);
                } else {
                    eliminated.put(member.name(), reasons);
                }
            }

            if (pool.isEmpty()) {
                UnfilledSlot failure = new UnfilledSlot(slot, eliminated);
                logger.error("No candidate for {}: {}", slot, failure.digest());
                return new ScheduleResult(ScheduleResult.Status.FAILED, plan.period(), assignments, notes, failure, null);
            }
            if (logger.isDebugEnabled()) {
                logger.debug("{} candidates: {}", slot, pool.stream().map(m -> scorer.score(m, slot, state)).sorted().toList());
            }
            Member chosen = selector.select(slot, pool, state);
            commit(new Assignment(slot, chosen.name(), false), assignments);
        }

        logger.info("Rotation {} completed: {} assignments, {} notes", plan.period(), assignments.size(), notes.size());
        return new ScheduleResult(ScheduleResult.Status.COMPLETED, plan.period(), assignments, notes, null, null);
    }

    /**
     * All reasons the member cannot take the slot, in a stable order.
     */
    List<Elimination> evaluate(Member member, DutySlot slot) {
        List<Elimination> reasons = new ArrayList<>(exclusions.check(member, slot, state.committedSlots(member.name())));
        if (!eligibility.isEligible(member, slot)) {
            reasons.add(Elimination.of(EliminationReason.INDEX_INELIGIBLE,
                    "eligible " + slot.shiftType() + " indices " + eligibility.eligibleIndices(member, slot.shiftType())));
        }
        scorer.checkInterval(member, slot, state).ifPresent(reasons::add);
        if (fixedPattern.isOffWeekFor(member, slot)) {
            reasons.add(Elimination.of(EliminationReason.FIXED_PATTERN_OFF_WEEK, null));
        }
        return reasons;
    }

    private Optional<Assignment> tryFixedPattern(DutySlot slot, List<ScheduleNote> notes) {
        Optional<String> forcedName = fixedPattern.forcedMember(slot);
        if (forcedName.isEmpty()) {
            return Optional.empty();
        }
        Member member = roster.find(forcedName.get()).orElseThrow();
        List<Elimination> blocked = evaluate(member, slot);
        if (blocked.isEmpty()) {
            return Optional.of(new Assignment(slot, member.name(), true));
        }
        String message = "Fixed-pattern member " + member.name() + " excluded from " + slot.label() + ": " + blocked;
        logger.warn(message);
        notes.add(ScheduleNote.fixedPatternFallback(slot, message));
        return Optional.empty();
    }

    private void commit(Assignment assignment, List<Assignment> assignments) {
        state.commit(assignment);
        assignments.add(assignment);
        logger.debug("Assigned {} -> {}{}", assignment.slot(), assignment.memberName(), assignment.fixed() ? " (fixed)" : "");
    }

    private List<ScheduleNote> holidayNotes() {
        List<ScheduleNote> notes = new ArrayList<>();
        for (LocalDate day : plan.skippedDayDates()) {
            notes.add(ScheduleNote.skippedHoliday(day, "No day shift on global holiday " + day));
        }
        for (LocalDate week : plan.skippedNightWeeks()) {
            notes.add(ScheduleNote.skippedHoliday(week, "No night shift for holiday week starting " + week));
        }
        notes.sort((a, b) -> a.date().compareTo(b.date()));
        return notes;
    }
}
