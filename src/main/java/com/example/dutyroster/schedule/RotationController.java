package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.calendar.SlotPlan;
import com.example.dutyroster.common.ApiResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/rotations")
public class RotationController {

    private static final Logger logger = LoggerFactory.getLogger(RotationController.class);

    private final ScheduleService scheduleService;

    public RotationController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<RotationScheduleDto>> generate(@Valid @RequestBody GenerateRotationRequest request) {
        logger.info("Rotation generation requested: start={}, end={}, members={}",
                request.startDate(), request.endDate(), request.members().size());
        ScheduleService.GeneratedRotation generated = scheduleService.generate(request);
        ScheduleResult result = generated.result();

        Map<String, Object> meta = new HashMap<>();
        meta.put("assignmentCount", result.assignments().size());
        meta.put("dayCount", result.count(ShiftType.DAY));
        meta.put("nightCount", result.count(ShiftType.NIGHT));
        meta.put("noteCount", result.notes().size());
        meta.put("analysis", generated.analysis());
        return ResponseEntity.ok(ApiResponse.success("ローテーションを生成しました", RotationScheduleDto.from(result), meta));
    }

    // Implied bounds and slot counts for a start date, optionally with holidays removed
    @GetMapping("/period")
    public ResponseEntity<ApiResponse<Map<String, Object>>> period(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(name = "holiday", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) List<LocalDate> holidays) {
        SlotPlan plan = scheduleService.describePeriod(start, holidays == null ? Set.of() : Set.copyOf(holidays));
        Map<String, Object> data = new HashMap<>();
        data.put("startDate", plan.period().start());
        data.put("endDate", plan.period().end());
        data.put("lengthInDays", plan.period().lengthInDays());
        data.put("daySlots", plan.count(ShiftType.DAY));
        data.put("nightSlots", plan.count(ShiftType.NIGHT));
        data.put("skippedDayDates", plan.skippedDayDates());
        data.put("skippedNightWeeks", plan.skippedNightWeeks());
        return ResponseEntity.ok(ApiResponse.success(data));
    }
}
