package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.TimeRanges;
import com.example.shiftsync.config.SchedulerSettings;
import com.example.shiftsync.conflict.ConflictDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleGeneratorTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 7, 1);
    private static final GenerationOptions DEFAULT = new GenerationOptions(true, false, false);
    private static final GenerationOptions OVERTIME = new GenerationOptions(true, false, true);

    private InMemorySchedulingDataSource source;
    private ScheduleGenerator generator;

    private static LocalTime t(String value) {
        return LocalTime.parse(value);
    }

    @BeforeEach
    void setUp() {
        source = new InMemorySchedulingDataSource();
        SchedulerSettings settings = SchedulerSettings.defaults();
        generator = new ScheduleGenerator(
                new SchedulerContextLoader(source),
                new ConstraintChecker(settings, new ConflictDetector()),
                new CandidateScorer(settings),
                new ScheduleValidator(settings),
                settings);
    }

    private GeneratedSchedule generate(GenerationOptions options) {
        return generator.generateSchedule(1L, MONDAY, options);
    }

    @Test
    void generateSchedule_noEmployeesReturnsEmptyScheduleWithWarnings() {
        source.openWeekdays("09:00", "17:00");

        GeneratedSchedule first = generate(DEFAULT);
        GeneratedSchedule second = generate(DEFAULT);

        assertThat(first.shifts()).isEmpty();
        assertThat(first.stats()).isEqualTo(ScheduleStats.empty());
        assertThat(first.warnings()).containsExactly(
                "No active employees found (excluding managers)",
                "Please add employees with role=\"employee\" to your restaurant");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void generateSchedule_onlyManagersCountsAsNoEmployees() {
        source.employees.add(new StaffMember(1L, "Max", "Stone", "manager", null, null, true));
        source.openWeekdays("09:00", "17:00");

        assertThat(generate(DEFAULT).warnings()).contains("No active employees found (excluding managers)");
    }

    @Test
    void generateSchedule_missingOrClosedBusinessHoursStopsEarly() {
        source.employee(1L, "Ana", "Lopez");

        GeneratedSchedule noHours = generate(DEFAULT);
        assertThat(noHours.shifts()).isEmpty();
        assertThat(noHours.warnings()).containsExactly(
                "No business hours configured",
                "Please configure your business hours in Settings → Business Hours section");

        for (int day = 0; day < 7; day++) {
            source.businessHours.add(new OpeningHours(day, t("09:00"), t("17:00"), true));
        }
        GeneratedSchedule allClosed = generate(DEFAULT);
        assertThat(allClosed.shifts()).isEmpty();
        assertThat(allClosed.warnings()).containsExactly(
                "All days are marked as closed",
                "Please mark at least one day as open in Settings → Business Hours");
    }

    @Test
    void generateSchedule_skipsDaysAndSlotsWithoutDuration() {
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz")
                .open(0, "00:00", "00:00")
                .open(1, "09:00", "17:00");
        source.staffing.add(new StaffingSlot(1, t("09:00"), t("09:00"), 1, 3));
        source.staffing.add(new StaffingSlot(1, t("10:00"), t("14:00"), 1, 3));

        GeneratedSchedule schedule = generate(DEFAULT);

        assertThat(schedule.shifts()).hasSize(2);
        assertThat(schedule.shifts()).extracting(ScheduleShift::employeeId).containsExactlyInAnyOrder(1L, 2L);
        assertThat(schedule.shifts()).allSatisfy(s -> {
            assertThat(s.shiftDate()).isEqualTo(MONDAY.plusDays(1));
            assertThat(s.startTime()).isEqualTo(t("10:00"));
            assertThat(new ConflictDetector().isShiftValid(s.employeeId(), s.shiftDate(), s.startTime(),
                    s.endTime(), List.of(), null).valid()).isTrue();
        });
        assertThat(schedule.warnings()).contains(
                "Business hours for 2024-07-01 open and close at the same time; day skipped",
                "Staffing slot 2024-07-02 09:00-09:00 has no duration; slot skipped");
        assertThat(schedule.stats().totalHours()).isEqualTo(8.0);
    }

    @Test
    void assignBestEmployee_neverRepeatsHolderOfSameSlot() {
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz").openWeekdays("09:00", "17:00");
        SchedulerContext context = new SchedulerContextLoader(source).load(1L, MONDAY);
        ScheduleShift anaHolds = new ScheduleShift(1L, MONDAY, t("09:00"), t("09:00"), null, null);
        ScheduleShift benHolds = new ScheduleShift(2L, MONDAY, t("09:00"), t("09:00"), null, null);

        assertThat(generator.assignBestEmployee(context, MONDAY, t("09:00"), t("09:00"), List.of(anaHolds), DEFAULT))
                .map(ScheduleShift::employeeId)
                .contains(2L);
        assertThat(generator.assignBestEmployee(context, MONDAY, t("09:00"), t("09:00"),
                List.of(anaHolds, benHolds), DEFAULT)).isEmpty();
    }

    @Test
    void generateSchedule_fullyBlockedEmployeeGetsNoShifts() {
        source.employee(1L, "Ana", "Lopez").openWeekdays("09:00", "17:00");
        for (int day = 0; day < 5; day++) {
            source.availability.add(AvailabilityBlock.weeklyAllDay(1L, day));
        }

        GeneratedSchedule schedule = generate(DEFAULT);

        assertThat(schedule.shifts()).isEmpty();
        for (int day = 0; day < 5; day++) {
            assertThat(schedule.warnings()).contains("Could not find available staff for " + MONDAY.plusDays(day));
        }
        assertThat(schedule.warnings()).contains("No shifts could be generated for this week", "Possible reasons:");
        assertThat(schedule.warnings()).doesNotHaveDuplicates();
        assertThat(schedule.stats()).isEqualTo(ScheduleStats.empty());
    }

    @Test
    void generateSchedule_defaultCoverageAssignsTwoPerOpenDay() {
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz").openWeekdays("09:00", "17:00");

        GeneratedSchedule schedule = generate(DEFAULT);

        assertThat(schedule.shifts()).hasSize(10);
        Map<LocalDate, List<ScheduleShift>> byDate = schedule.shifts().stream()
                .collect(Collectors.groupingBy(ScheduleShift::shiftDate));
        assertThat(byDate).hasSize(5);
        byDate.values().forEach(day -> {
            assertThat(day).extracting(ScheduleShift::employeeId).containsExactlyInAnyOrder(1L, 2L);
            assertThat(day).allSatisfy(s -> {
                assertThat(s.startTime()).isEqualTo(t("09:00"));
                assertThat(s.endTime()).isEqualTo(t("17:00"));
                assertThat(s.position()).isEqualTo("server");
            });
        });
        assertThat(schedule.stats().totalHours()).isEqualTo(80.0);
        assertThat(schedule.stats().employeesScheduled()).isEqualTo(2);
        assertThat(schedule.stats().fairnessScore()).isEqualTo(100.0);
        assertThat(schedule.stats().estimatedLaborCost()).isEqualTo(80 * 20.0);
        assertThat(schedule.warnings()).isEmpty();
    }

    @Test
    void generateSchedule_defaultCoverageHeadcountIsConfigurable() {
        SchedulerSettings three = new SchedulerSettings(8, 40, 48, 3, 20, 15, 15, 4.33, 0.7);
        generator = new ScheduleGenerator(new SchedulerContextLoader(source),
                new ConstraintChecker(three, new ConflictDetector()), new CandidateScorer(three),
                new ScheduleValidator(three), three);
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz").employee(3L, "Cara", "Diaz")
                .open(0, "09:00", "17:00");

        assertThat(generate(DEFAULT).shifts()).hasSize(3);
    }

    @Test
    void generateSchedule_reportsMinimumStaffingShortfall() {
        source.employee(1L, "Ana", "Lopez").open(0, "08:00", "22:00");
        source.staffing.add(new StaffingSlot(0, t("09:00"), t("17:00"), 2, 3));

        GeneratedSchedule schedule = generate(DEFAULT);

        assertThat(schedule.shifts()).hasSize(1);
        assertThat(schedule.shifts().get(0).shiftDate()).isEqualTo(MONDAY);
        assertThat(schedule.warnings())
                .contains("Could not meet minimum staffing (2) for 2024-07-01 09:00-17:00")
                .contains("Ana Lopez has only 8.0 hours (below target)");
    }

    @Test
    void generateSchedule_skipsClosedAndUnconfiguredDays() {
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz");
        source.open(0, "09:00", "17:00");
        source.businessHours.add(new OpeningHours(1, t("09:00"), t("17:00"), true));

        GeneratedSchedule schedule = generate(DEFAULT);

        assertThat(schedule.shifts()).extracting(ScheduleShift::shiftDate).containsOnly(MONDAY);
    }

    @Test
    void generateSchedule_weeklyCapDependsOnOvertime() {
        source.employee(1L, "Ana", "Lopez");
        for (int day = 0; day < 7; day++) {
            source.open(day, "09:00", "18:00");
        }

        GeneratedSchedule standard = generate(DEFAULT);
        assertThat(standard.shifts()).hasSize(4);
        assertThat(standard.stats().totalHours()).isEqualTo(36.0);

        GeneratedSchedule overtime = generate(OVERTIME);
        assertThat(overtime.shifts()).hasSize(5);
        assertThat(overtime.stats().totalHours()).isEqualTo(45.0);
    }

    @Test
    void generateSchedule_enforcesRestBetweenDays() {
        source.employee(1L, "Ana", "Lopez").open(0, "06:00", "23:59").open(1, "06:00", "23:59");
        source.staffing.add(new StaffingSlot(0, t("15:00"), t("23:00"), 1, 1));
        source.staffing.add(new StaffingSlot(1, t("06:00"), t("12:00"), 1, 1));
        source.staffing.add(new StaffingSlot(1, t("12:00"), t("20:00"), 1, 1));

        GeneratedSchedule schedule = generate(DEFAULT);

        assertThat(schedule.shifts()).extracting(ScheduleShift::startTime)
                .containsExactly(t("15:00"), t("12:00"));
        assertThat(schedule.warnings()).contains("Could not meet minimum staffing (1) for 2024-07-02 06:00-12:00");
    }

    @Test
    void generateSchedule_restCheckSeesLateShiftBeforeTheWeek() {
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz").open(0, "08:00", "16:00");
        source.staffing.add(new StaffingSlot(0, t("08:00"), t("16:00"), 1, 1));
        source.shifts.add(new ExistingShift(99L, 1L, MONDAY.minusDays(1), t("22:00"), t("02:00")));

        GeneratedSchedule schedule = generate(DEFAULT);

        assertThat(schedule.shifts()).extracting(ScheduleShift::employeeId).containsExactly(2L);
    }

    @Test
    void generateSchedule_prefersBetterScoreAndKeepsFirstOnTie() {
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz").open(0, "08:00", "22:00");
        source.staffing.add(new StaffingSlot(0, t("09:00"), t("17:00"), 1, 1));

        assertThat(generate(DEFAULT).shifts()).extracting(ScheduleShift::employeeId).containsExactly(1L);

        source.preferences.add(new PreferenceProfile(2L, 160, t("09:00"), null, 6, true,
                PreferenceProfile.Source.CONFIGURED));
        assertThat(generate(DEFAULT).shifts()).extracting(ScheduleShift::employeeId).containsExactly(2L);
    }

    @Test
    void generateSchedule_costPriorityPicksCheaperEmployee() {
        source.employees.add(new StaffMember(1L, "Ana", "Lopez", "employee", null, 30.0, true));
        source.employees.add(new StaffMember(2L, "Ben", "Ortiz", "employee", null, 15.0, true));
        source.open(0, "08:00", "22:00");
        source.staffing.add(new StaffingSlot(0, t("09:00"), t("17:00"), 1, 1));

        assertThat(generate(DEFAULT).shifts()).extracting(ScheduleShift::employeeId).containsExactly(1L);
        assertThat(generate(new GenerationOptions(true, true, false)).shifts())
                .extracting(ScheduleShift::employeeId).containsExactly(2L);
    }

    @Test
    void generateSchedule_busyWeekKeepsHardInvariants() {
        source.employee(1L, "Ana", "Lopez").employee(2L, "Ben", "Ortiz").employee(3L, "Cara", "Diaz")
                .employee(4L, "Dev", "Shah");
        for (int day = 0; day < 7; day++) {
            source.open(day, "07:00", "23:00");
            source.staffing.add(new StaffingSlot(day, t("07:00"), t("15:00"), 1, 2));
            source.staffing.add(new StaffingSlot(day, t("15:00"), t("23:00"), 1, 2));
        }
        source.staffing.add(new StaffingSlot(4, t("22:00"), t("03:00"), 1, 1));

        for (GenerationOptions options : List.of(DEFAULT, OVERTIME)) {
            GeneratedSchedule schedule = generate(options);
            assertThat(schedule.shifts()).isNotEmpty();
            assertHardInvariants(schedule.shifts(), options.allowOvertime() ? 48 : 40);
            assertThat(schedule.stats().fairnessScore()).isBetween(0.0, 100.0);
        }
    }

    private static void assertHardInvariants(List<ScheduleShift> shifts, double weeklyLimit) {
        Map<Long, List<ScheduleShift>> byEmployee = shifts.stream()
                .collect(Collectors.groupingBy(ScheduleShift::employeeId));
        byEmployee.forEach((employeeId, own) -> {
            double hours = own.stream().mapToDouble(ScheduleShift::hours).sum();
            assertThat(hours).as("weekly hours of %s", employeeId).isLessThanOrEqualTo(weeklyLimit);
            for (ScheduleShift a : own) {
                for (ScheduleShift b : own) {
                    if (a == b) {
                        continue;
                    }
                    if (a.shiftDate().equals(b.shiftDate())) {
                        assertThat(TimeRanges.overlaps(a.startTime(), a.endTime(), b.startTime(), b.endTime()))
                                .as("overlap %s / %s", a, b).isFalse();
                    }
                    if (b.shiftDate().equals(a.shiftDate().plusDays(1))) {
                        assertThat(ConstraintChecker.restMinutes(a.startTime(), a.endTime(), b.startTime()))
                                .as("rest %s / %s", a, b).isGreaterThanOrEqualTo(8 * 60L);
                    }
                }
            }
        });
    }
}
