package io.github.riemr.roster.optimization.problem;

import io.github.riemr.roster.domain.model.Absence;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.DayClass;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.StaffingBounds;
import io.github.riemr.roster.domain.model.Team;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable problem instance built by {@link PlanningProblemFactory}.
 * Everything the model builders need is precomputed here so that they never
 * touch the raw snapshot.
 */
public final class PlanningProblem {

    private final LocalDate start;
    private final LocalDate end;
    private final List<CalendarDay> days;
    private final Map<LocalDate, CalendarDay> dayByDate;
    private final List<LocalDate> lookbackDays;
    private final Map<Long, Employee> employeesById;
    private final List<Employee> plannableEmployees;
    private final List<Team> teams;
    private final Map<Long, Team> teamByEmployee;
    private final Map<String, ShiftType> shiftTypes;
    private final Map<Long, List<Absence>> absencesByEmployee;
    private final List<AssignmentCandidate> candidates;
    private final Set<AssignmentCandidate> candidateSet;
    private final Map<DayShift, List<AssignmentCandidate>> candidatesByDayShift;
    private final List<ShiftAssignment> fixedAssignments;
    private final Set<ShiftAssignment> history;

    PlanningProblem(LocalDate start,
                    LocalDate end,
                    List<CalendarDay> days,
                    List<LocalDate> lookbackDays,
                    Map<Long, Employee> employeesById,
                    List<Employee> plannableEmployees,
                    List<Team> teams,
                    Map<Long, Team> teamByEmployee,
                    Map<String, ShiftType> shiftTypes,
                    Map<Long, List<Absence>> absencesByEmployee,
                    List<AssignmentCandidate> candidates,
                    List<ShiftAssignment> fixedAssignments,
                    Set<ShiftAssignment> history) {
        this.start = start;
        this.end = end;
        this.days = List.copyOf(days);
        this.lookbackDays = List.copyOf(lookbackDays);
        this.employeesById = Collections.unmodifiableMap(new LinkedHashMap<>(employeesById));
        this.plannableEmployees = List.copyOf(plannableEmployees);
        this.teams = List.copyOf(teams);
        this.teamByEmployee = Map.copyOf(teamByEmployee);
        this.shiftTypes = Collections.unmodifiableMap(new LinkedHashMap<>(shiftTypes));
        this.absencesByEmployee = Map.copyOf(absencesByEmployee);
        this.candidates = List.copyOf(candidates);
        this.candidateSet = Set.copyOf(candidates);
        this.fixedAssignments = List.copyOf(fixedAssignments);
        this.history = Set.copyOf(history);

        Map<LocalDate, CalendarDay> byDate = new HashMap<>();
        for (CalendarDay d : days) {
            byDate.put(d.date(), d);
        }
        this.dayByDate = Map.copyOf(byDate);

        Map<DayShift, List<AssignmentCandidate>> grouped = new HashMap<>();
        for (AssignmentCandidate c : candidates) {
            grouped.computeIfAbsent(new DayShift(c.date(), c.shiftCode()), k -> new ArrayList<>()).add(c);
        }
        this.candidatesByDayShift = Map.copyOf(grouped);
    }

    private record DayShift(LocalDate date, String shiftCode) {
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public List<CalendarDay> getDays() {
        return days;
    }

    public Optional<CalendarDay> day(LocalDate date) {
        return Optional.ofNullable(dayByDate.get(date));
    }

    public boolean isInHorizon(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /** Days before the horizon whose published shifts still influence rest and run-length rules. */
    public List<LocalDate> getLookbackDays() {
        return lookbackDays;
    }

    public Map<Long, Employee> getEmployeesById() {
        return employeesById;
    }

    /** Active employees with a team, ordered by team and member order. */
    public List<Employee> getPlannableEmployees() {
        return plannableEmployees;
    }

    public List<Team> getTeams() {
        return teams;
    }

    public Optional<Team> teamOf(long employeeId) {
        return Optional.ofNullable(teamByEmployee.get(employeeId));
    }

    public List<Employee> plannableMembers(Team team) {
        List<Employee> members = new ArrayList<>();
        for (Employee e : plannableEmployees) {
            Team t = teamByEmployee.get(e.getId());
            if (t != null && t.getId() == team.getId()) {
                members.add(e);
            }
        }
        return members;
    }

    public List<ShiftType> getShiftTypes() {
        return List.copyOf(shiftTypes.values());
    }

    public ShiftType shiftType(String code) {
        ShiftType st = shiftTypes.get(code);
        if (st == null) {
            throw new IllegalArgumentException("Unknown shift type: " + code);
        }
        return st;
    }

    public boolean hasShiftType(String code) {
        return shiftTypes.containsKey(code);
    }

    public Optional<Absence> absenceOn(long employeeId, LocalDate date) {
        for (Absence a : absencesByEmployee.getOrDefault(employeeId, List.of())) {
            if (a.covers(date)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    public boolean isAbsent(long employeeId, LocalDate date) {
        return absenceOn(employeeId, date).isPresent();
    }

    public List<AssignmentCandidate> getCandidates() {
        return candidates;
    }

    public boolean hasCandidate(long employeeId, LocalDate date, String shiftCode) {
        return candidateSet.contains(new AssignmentCandidate(employeeId, date, shiftCode));
    }

    /** Candidates for one (day, shift type), in plannable employee order. */
    public List<AssignmentCandidate> candidatesFor(LocalDate date, String shiftCode) {
        return candidatesByDayShift.getOrDefault(new DayShift(date, shiftCode), List.of());
    }

    public StaffingBounds staffingFor(CalendarDay day, String shiftCode) {
        return shiftType(shiftCode).staffingFor(day.dayClass());
    }

    public DayClass dayClassOf(LocalDate date) {
        CalendarDay d = dayByDate.get(date);
        return d != null ? d.dayClass() : PlanningCalendar.classify(date, Set.of());
    }

    public List<ShiftAssignment> getFixedAssignments() {
        return fixedAssignments;
    }

    public boolean workedInHistory(long employeeId, LocalDate date, String shiftCode) {
        return history.contains(new ShiftAssignment(employeeId, date, shiftCode));
    }

    public Set<ShiftAssignment> getHistory() {
        return history;
    }

    /** Employees who could work at least one shift on the given day. */
    public Set<Long> employeesAvailableOn(LocalDate date) {
        Set<Long> ids = new HashSet<>();
        CalendarDay day = dayByDate.get(date);
        if (day == null) {
            return ids;
        }
        for (String code : day.activeShiftCodes()) {
            for (AssignmentCandidate c : candidatesFor(date, code)) {
                ids.add(c.employeeId());
            }
        }
        return ids;
    }

    /** No one to plan or nothing to decide: the solver is not needed. */
    public boolean isEmpty() {
        return plannableEmployees.isEmpty() || candidates.isEmpty();
    }

    /** Largest weekly hours ceiling among the shift types the employee's team covers. */
    public double weeklyHoursCeilingOf(long employeeId) {
        return teamShiftTypes(employeeId).stream().mapToDouble(ShiftType::getWeeklyHoursCeiling).max().orElse(0);
    }

    /** Largest nominal weekly hours among the shift types the employee's team covers. */
    public double nominalWeeklyHoursOf(long employeeId) {
        return teamShiftTypes(employeeId).stream().mapToDouble(ShiftType::getNominalWeeklyHours).max().orElse(0);
    }

    private List<ShiftType> teamShiftTypes(long employeeId) {
        Team team = teamByEmployee.get(employeeId);
        if (team == null) {
            return List.of();
        }
        return shiftTypes.values().stream().filter(st -> team.covers(st.getCode())).toList();
    }

    /** ISO weeks (keyed by Monday) touched by the horizon, each with its horizon days. */
    public Map<LocalDate, List<LocalDate>> horizonWeeks() {
        Map<LocalDate, List<LocalDate>> weeks = new LinkedHashMap<>();
        for (CalendarDay d : days) {
            weeks.computeIfAbsent(weekStartOf(d.date()), k -> new ArrayList<>()).add(d.date());
        }
        return weeks;
    }

    /** Monday to Friday horizon days per ISO week, public holidays included; weekend-only weeks are left out. */
    public Map<LocalDate, List<LocalDate>> dayDutyWeeks() {
        Map<LocalDate, List<LocalDate>> weeks = new LinkedHashMap<>();
        horizonWeeks().forEach((monday, dates) -> {
            List<LocalDate> weekdays = dates.stream()
                    .filter(d -> d.getDayOfWeek().compareTo(DayOfWeek.SATURDAY) < 0)
                    .toList();
            if (!weekdays.isEmpty()) {
                weeks.put(monday, weekdays);
            }
        });
        return weeks;
    }

    /** Active, qualified employees who are absent on none of the given days, in snapshot order. */
    public List<Employee> dayDutyCandidates(List<LocalDate> weekdays) {
        return employeesById.values().stream()
                .filter(e -> e.isActive() && e.isDayDutyQualified())
                .filter(e -> weekdays.stream().noneMatch(d -> isAbsent(e.getId(), d)))
                .toList();
    }

    public static LocalDate weekStartOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /** All seven days of the week starting at {@code monday} lie inside the horizon. */
    public boolean isFullWeek(LocalDate monday) {
        return isInHorizon(monday) && isInHorizon(monday.plusDays(6));
    }
}
