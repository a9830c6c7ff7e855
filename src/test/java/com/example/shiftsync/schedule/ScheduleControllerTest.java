package com.example.shiftsync.schedule;

import com.example.shiftsync.employee.Employee;
import com.example.shiftsync.employee.EmployeeRepository;
import com.example.shiftsync.restaurant.BusinessHours;
import com.example.shiftsync.restaurant.BusinessHoursRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class ScheduleControllerTest {

    private static final long RESTAURANT = 7L;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EmployeeRepository employeeRepository;

    @Autowired
    private BusinessHoursRepository businessHoursRepository;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private ScheduleGenerationRunRepository runRepository;

    private Employee ana;
    private Employee ben;

    @BeforeEach
    void setUp() {
        shiftRepository.deleteAll();
        runRepository.deleteAll();
        ana = employeeRepository.save(new Employee(RESTAURANT, "Ana", "Lopez", Employee.ROLE_EMPLOYEE));
        ben = employeeRepository.save(new Employee(RESTAURANT, "Ben", "Ortiz", Employee.ROLE_EMPLOYEE));
        employeeRepository.save(new Employee(RESTAURANT, "Max", "Stone", Employee.ROLE_MANAGER));
        for (int day = 0; day < 5; day++) {
            businessHoursRepository.save(new BusinessHours(RESTAURANT, day, LocalTime.of(9, 0), LocalTime.of(17, 0), false));
        }
    }

    @Test
    void generate_defaultCoverageForWeekdays() throws Exception {
        String payload = """
            {
              "restaurantId": 7,
              "weekStartDate": "2024-07-01",
              "prioritizeFairness": true,
              "prioritizeCost": false,
              "allowOvertime": false
            }
            """;

        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.shifts.length()").value(10))
            .andExpect(jsonPath("$.data.stats.totalShifts").value(10))
            .andExpect(jsonPath("$.data.stats.totalHours").value(80.0))
            .andExpect(jsonPath("$.data.stats.employeesScheduled").value(2))
            .andExpect(jsonPath("$.data.warnings.length()").value(0))
            .andExpect(jsonPath("$.meta.weekEndDate").value("2024-07-07"));

        assertThat(shiftRepository.count()).isZero();
    }

    @Test
    void generate_unknownRestaurantReturnsWarningsNotError() throws Exception {
        String payload = """
            {"restaurantId": 999, "weekStartDate": "2024-07-01"}
            """;

        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shifts.length()").value(0))
            .andExpect(jsonPath("$.data.warnings[0]").value("No active employees found (excluding managers)"))
            .andExpect(jsonPath("$.message").value("No shifts could be generated"));
    }

    @Test
    void generate_rejectsWeekStartThatIsNotMonday() throws Exception {
        String payload = """
            {"restaurantId": 7, "weekStartDate": "2024-07-03"}
            """;

        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void generate_missingRestaurantIsValidationError() throws Exception {
        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"weekStartDate\": \"2024-07-01\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.restaurantId").exists());
    }

    @Test
    void publish_storesShiftsAndRun() throws Exception {
        String payload = publishPayload(
                shiftJson(ana.getId(), "2024-07-01", "09:00", "17:00"),
                shiftJson(ben.getId(), "2024-07-01", "09:00", "17:00"));

        mockMvc.perform(post("/api/schedule/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.totalShifts").value(2))
            .andExpect(jsonPath("$.data.totalHours").value(16.0))
            .andExpect(jsonPath("$.data.estimatedLaborCost").value(320.0))
            .andExpect(jsonPath("$.data.status").value("PUBLISHED"))
            .andExpect(jsonPath("$.data.warnings[0]").value("Reviewed by manager"));

        List<Shift> stored = shiftRepository.findWithEmployeeBetween(RESTAURANT,
                LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 7));
        assertThat(stored).hasSize(2);
        assertThat(stored).extracting(s -> s.getEmployee().getId())
                .containsExactlyInAnyOrder(ana.getId(), ben.getId());

        mockMvc.perform(get("/api/schedule/runs").param("restaurantId", String.valueOf(RESTAURANT)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].generatedBy").value("ana.manager"))
            .andExpect(jsonPath("$.data[0].warnings[0]").value("Reviewed by manager"));
    }

    @Test
    void publish_rejectsShiftOverlappingStoredShift() throws Exception {
        shiftRepository.save(new Shift(RESTAURANT, ana, LocalDate.of(2024, 7, 1), LocalTime.of(12, 0), LocalTime.of(20, 0)));

        mockMvc.perform(post("/api/schedule/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content(publishPayload(shiftJson(ana.getId(), "2024-07-01", "09:00", "17:00"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("PUBLISH_CONFLICT"));

        assertThat(runRepository.count()).isZero();
    }

    @Test
    void publish_rejectsOverlapWithinSubmittedShifts() throws Exception {
        mockMvc.perform(post("/api/schedule/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content(publishPayload(
                        shiftJson(ana.getId(), "2024-07-02", "09:00", "17:00"),
                        shiftJson(ana.getId(), "2024-07-02", "16:00", "22:00"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("PUBLISH_CONFLICT"));
    }

    @Test
    void publish_rejectsShiftWithoutDuration() throws Exception {
        mockMvc.perform(post("/api/schedule/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content(publishPayload(shiftJson(ana.getId(), "2024-07-02", "09:00", "09:00"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INVALID_SHIFT"));

        assertThat(runRepository.count()).isZero();
    }

    @Test
    void publish_rejectsUnknownEmployee() throws Exception {
        mockMvc.perform(post("/api/schedule/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content(publishPayload(shiftJson(987654L, "2024-07-02", "09:00", "17:00"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("EMPLOYEE_NOT_FOUND"));
    }

    @Test
    void publish_requiresShifts() throws Exception {
        mockMvc.perform(post("/api/schedule/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content(publishPayload()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    private static String shiftJson(long employeeId, String date, String start, String end) {
        return """
            {"employeeId": %d, "shiftDate": "%s", "startTime": "%s", "endTime": "%s"}
            """.formatted(employeeId, date, start, end);
    }

    private static String publishPayload(String... shifts) {
        return """
            {
              "restaurantId": 7,
              "weekStartDate": "2024-07-01",
              "options": {"prioritizeFairness": true, "prioritizeCost": false, "allowOvertime": false},
              "shifts": [%s],
              "warnings": ["Reviewed by manager"],
              "generatedBy": "ana.manager"
            }
            """.formatted(String.join(",", shifts));
    }
}
