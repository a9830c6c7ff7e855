package com.example.shiftsync.schedule;

import com.example.shiftsync.common.ApiResponse;
import com.example.shiftsync.common.WeekCalendar;
import com.example.shiftsync.schedule.generator.GeneratedSchedule;
import com.example.shiftsync.schedule.generator.ScheduleGenerator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleGenerator scheduleGenerator;
    private final SchedulePublishService publishService;

    public ScheduleController(ScheduleGenerator scheduleGenerator, SchedulePublishService publishService) {
        this.scheduleGenerator = scheduleGenerator;
        this.publishService = publishService;
    }

    // Generates a draft only; nothing is stored until /publish
    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<GeneratedSchedule>> generate(@Valid @RequestBody ScheduleGenerateRequest request) {
        if (!WeekCalendar.isMonday(request.weekStartDate())) {
            return ResponseEntity.badRequest()
                    .body(ApiResponse.failure("Week start date must be a Monday: " + request.weekStartDate()));
        }
        GeneratedSchedule schedule = scheduleGenerator.generateSchedule(
                request.restaurantId(), request.weekStartDate(), request.toOptions());
        Map<String, Object> meta = new HashMap<>();
        meta.put("weekStartDate", request.weekStartDate().toString());
        meta.put("weekEndDate", WeekCalendar.weekEnd(request.weekStartDate()).toString());
        meta.put("warningCount", schedule.warnings().size());
        String message = schedule.hasShifts() ? "Schedule generated" : "No shifts could be generated";
        logger.info("{} for restaurant {}: {} shifts", message, request.restaurantId(), schedule.shifts().size());
        return ResponseEntity.ok(ApiResponse.success(message, schedule, meta));
    }

    @PostMapping("/publish")
    public ResponseEntity<ApiResponse<ScheduleRunDto>> publish(@Valid @RequestBody SchedulePublishRequest request) {
        if (!WeekCalendar.isMonday(request.weekStartDate())) {
            return ResponseEntity.badRequest()
                    .body(ApiResponse.failure("Week start date must be a Monday: " + request.weekStartDate()));
        }
        ScheduleRunDto run = publishService.publish(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Schedule published", run));
    }

    @GetMapping("/runs")
    public ResponseEntity<ApiResponse<List<ScheduleRunDto>>> runs(@RequestParam("restaurantId") Long restaurantId) {
        List<ScheduleRunDto> runs = publishService.listRuns(restaurantId);
        return ResponseEntity.ok(ApiResponse.success(runs));
    }
}
