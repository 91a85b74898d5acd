package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.RotationPeriod;
import com.example.dutyroster.calendar.SlotGenerator;
import com.example.dutyroster.calendar.SlotPlan;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.config.RotationRulesSettings;
import com.example.dutyroster.history.HistoryWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Set;

/**
 * Runs rotation generation with the configured rule defaults. Stateless: every
 * call builds its own engine pass, so concurrent requests never share state.
 */
@Service
public class ScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final RotationRulesSettings settings;
    private final ScheduleAnalyzer analyzer = new ScheduleAnalyzer();

    public ScheduleService(RotationRulesSettings settings) {
        this.settings = settings;
    }

    public RotationRules defaultRules() {
        return settings.toRules();
    }

    /**
     * @throws com.example.dutyroster.exception.NoCandidateException when a slot cannot be filled
     */
    public GeneratedRotation generate(GenerateRotationRequest request) {
        return generate(request.toInput(defaultRules()));
    }

    public GeneratedRotation generate(RotationInput input) {
        long started = System.currentTimeMillis();
        ScheduleBuilder builder = ScheduleBuilder.prepare(input);
        ScheduleResult result = builder.build().orElseThrow();
        ScheduleAnalysis analysis = analyzer.analyze(result, HistoryWindow.before(input.period().start(),
                input.rules().lookbackMonths(),
                input.history().stream().filter(r -> builder.roster().contains(r.memberName())).toList()));
        logger.info("Generated rotation {} with {} assignments in {} ms ({} close intervals flagged)",
                result.period(), result.assignments().size(), System.currentTimeMillis() - started,
                analysis.closeIntervals().size());
        return new GeneratedRotation(result, analysis);
    }

    /**
     * Slot layout of the conventional rotation starting on {@code start}.
     */
    public SlotPlan describePeriod(LocalDate start, Set<LocalDate> holidays) {
        return new SlotGenerator(defaultRules()).generate(RotationPeriod.implied(start), holidays);
    }

    public record GeneratedRotation(ScheduleResult result, ScheduleAnalysis analysis) {
    }
}
