package io.github.riemr.roster.optimization.problem;

import io.github.riemr.roster.domain.model.Absence;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.PlanningSnapshot;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.Team;
import io.github.riemr.roster.exception.RosterModelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a {@link PlanningSnapshot} and normalizes it into a {@link PlanningProblem}.
 * <p>
 * Every malformed input is collected and reported at once through {@link RosterModelException};
 * nothing is corrected silently. The single tolerated conflict is a fixed shift on a day the employee
 * is absent: absences are authoritative and the fixed shift is dropped with a warning.
 */
@Component
@Slf4j
public class PlanningProblemFactory {

    /** A week is always fully visible before the horizon so weekly ceilings see carried-over hours. */
    static final int MIN_LOOKBACK_DAYS = 6;

    public PlanningProblem create(PlanningSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        List<String> problems = new ArrayList<>();

        LocalDate start = snapshot.getStart();
        LocalDate end = snapshot.getEnd();
        if (start == null || end == null) {
            throw new RosterModelException("Planning horizon start and end are required");
        }
        if (end.isBefore(start)) {
            problems.add("Planning horizon end " + end + " is before start " + start);
        }

        Map<Long, Employee> employees = indexEmployees(snapshot.getEmployees(), problems);
        Map<String, ShiftType> shiftTypes = indexShiftTypes(snapshot.getShiftTypes(), problems);
        Map<Long, Team> teamByEmployee = indexTeams(snapshot.getTeams(), employees, shiftTypes, problems);
        Map<Long, List<Absence>> absences = indexAbsences(snapshot.getAbsences(), employees, problems);

        if (!problems.isEmpty()) {
            throw new RosterModelException(problems);
        }

        List<CalendarDay> days = PlanningCalendar.build(start, end, shiftTypes.values(), snapshot.getHolidays());

        List<Employee> plannable = new ArrayList<>();
        for (Team team : snapshot.getTeams()) {
            for (Long memberId : team.getMemberIds()) {
                Employee e = employees.get(memberId);
                if (e.isActive()) {
                    plannable.add(e);
                }
            }
        }

        List<AssignmentCandidate> candidates = new ArrayList<>();
        for (CalendarDay day : days) {
            for (String code : day.activeShiftCodes()) {
                for (Employee e : plannable) {
                    Team team = teamByEmployee.get(e.getId());
                    if (!team.covers(code)) {
                        continue;
                    }
                    if (isAbsent(absences, e.getId(), day.date())) {
                        continue;
                    }
                    candidates.add(new AssignmentCandidate(e.getId(), day.date(), code));
                }
            }
        }

        Set<AssignmentCandidate> candidateSet = new HashSet<>(candidates);
        List<ShiftAssignment> fixed = validateFixedAssignments(snapshot, employees, teamByEmployee, shiftTypes,
                absences, candidateSet, problems);
        if (!problems.isEmpty()) {
            throw new RosterModelException(problems);
        }

        int maxConsecutive = shiftTypes.values().stream()
                .mapToInt(ShiftType::getMaxConsecutiveDays).max().orElse(1);
        List<LocalDate> lookback = PlanningCalendar.lookback(start, Math.max(MIN_LOOKBACK_DAYS, maxConsecutive));
        Set<ShiftAssignment> history = new HashSet<>();
        LocalDate oldest = lookback.isEmpty() ? start : lookback.get(0);
        for (ShiftAssignment h : snapshot.getHistory()) {
            if (!h.date().isBefore(oldest) && h.date().isBefore(start) && shiftTypes.containsKey(h.shiftCode())) {
                history.add(h);
            }
        }

        log.info("Planning problem {}..{}: {} days, {} employees ({} plannable), {} shift types, {} candidates, {} fixed, {} history entries",
                start, end, days.size(), employees.size(), plannable.size(), shiftTypes.size(),
                candidates.size(), fixed.size(), history.size());

        return new PlanningProblem(start, end, days, lookback, employees, plannable, snapshot.getTeams(),
                teamByEmployee, shiftTypes, absences, candidates, fixed, history);
    }

    private Map<Long, Employee> indexEmployees(List<Employee> list, List<String> problems) {
        Map<Long, Employee> byId = new LinkedHashMap<>();
        for (Employee e : list) {
            if (byId.putIfAbsent(e.getId(), e) != null) {
                problems.add("Duplicate employee id " + e.getId());
            }
        }
        return byId;
    }

    private Map<String, ShiftType> indexShiftTypes(List<ShiftType> list, List<String> problems) {
        Map<String, ShiftType> byCode = new LinkedHashMap<>();
        for (ShiftType st : list) {
            String code = st.getCode();
            if (code == null || code.isBlank()) {
                problems.add("Shift type without code");
                continue;
            }
            if (byCode.putIfAbsent(code, st) != null) {
                problems.add("Duplicate shift type code " + code);
            }
            if (st.getStart() == null || st.getEnd() == null) {
                problems.add("Shift type " + code + " has no start/end time");
            }
            if (!(st.getHours() > 0)) {
                problems.add("Shift type " + code + " has non-positive duration " + st.getHours());
            }
            if (st.getWeekdayStaffing() == null || !st.getWeekdayStaffing().isValid()) {
                problems.add("Shift type " + code + " has invalid weekday staffing " + st.getWeekdayStaffing());
            }
            if (st.getWeekendStaffing() == null || !st.getWeekendStaffing().isValid()) {
                problems.add("Shift type " + code + " has invalid weekend staffing " + st.getWeekendStaffing());
            }
            if (st.getMaxConsecutiveDays() < 1) {
                problems.add("Shift type " + code + " has max consecutive days " + st.getMaxConsecutiveDays());
            }
            if (st.getWeeklyHoursCeiling() < st.getHours()) {
                problems.add("Shift type " + code + " weekly hours ceiling " + st.getWeeklyHoursCeiling()
                        + " is below one shift");
            }
        }
        return byCode;
    }

    private Map<Long, Team> indexTeams(List<Team> teams, Map<Long, Employee> employees,
                                       Map<String, ShiftType> shiftTypes, List<String> problems) {
        Map<Long, Team> teamByEmployee = new HashMap<>();
        Set<Long> teamIds = new HashSet<>();
        for (Team team : teams) {
            if (!teamIds.add(team.getId())) {
                problems.add("Duplicate team id " + team.getId());
            }
            for (String code : team.getEligibleShiftCodes()) {
                if (!shiftTypes.containsKey(code)) {
                    problems.add("Team " + team.getId() + " references unknown shift type " + code);
                }
            }
            for (Long memberId : team.getMemberIds()) {
                if (!employees.containsKey(memberId)) {
                    problems.add("Team " + team.getId() + " references unknown employee " + memberId);
                    continue;
                }
                Team previous = teamByEmployee.putIfAbsent(memberId, team);
                if (previous != null && previous.getId() != team.getId()) {
                    problems.add("Employee " + memberId + " is member of teams " + previous.getId()
                            + " and " + team.getId());
                } else if (previous != null) {
                    problems.add("Employee " + memberId + " listed twice in team " + team.getId());
                }
            }
        }
        return teamByEmployee;
    }

    private Map<Long, List<Absence>> indexAbsences(List<Absence> absences, Map<Long, Employee> employees,
                                                   List<String> problems) {
        Map<Long, List<Absence>> byEmployee = new HashMap<>();
        for (Absence a : absences) {
            if (a.start() == null || a.end() == null || a.end().isBefore(a.start())) {
                problems.add("Absence of employee " + a.employeeId() + " has invalid range "
                        + a.start() + ".." + a.end());
                continue;
            }
            if (!employees.containsKey(a.employeeId())) {
                problems.add("Absence references unknown employee " + a.employeeId());
                continue;
            }
            byEmployee.computeIfAbsent(a.employeeId(), k -> new ArrayList<>()).add(a);
        }
        return byEmployee;
    }

    private List<ShiftAssignment> validateFixedAssignments(PlanningSnapshot snapshot,
                                                           Map<Long, Employee> employees,
                                                           Map<Long, Team> teamByEmployee,
                                                           Map<String, ShiftType> shiftTypes,
                                                           Map<Long, List<Absence>> absences,
                                                           Set<AssignmentCandidate> candidates,
                                                           List<String> problems) {
        List<ShiftAssignment> retained = new ArrayList<>();
        Set<String> employeeDays = new HashSet<>();
        for (ShiftAssignment f : snapshot.getFixedAssignments()) {
            Employee e = employees.get(f.employeeId());
            if (e == null) {
                problems.add("Fixed assignment references unknown employee " + f.employeeId());
                continue;
            }
            if (!shiftTypes.containsKey(f.shiftCode())) {
                problems.add("Fixed assignment references unknown shift type " + f.shiftCode());
                continue;
            }
            if (f.date().isBefore(snapshot.getStart()) || f.date().isAfter(snapshot.getEnd())) {
                problems.add("Fixed assignment " + f + " lies outside the planning horizon");
                continue;
            }
            if (!employeeDays.add(f.employeeId() + "@" + f.date())) {
                problems.add("Employee " + f.employeeId() + " has several fixed assignments on " + f.date());
                continue;
            }
            Optional<Absence> absence = Optional.ofNullable(absences.get(f.employeeId()))
                    .flatMap(list -> list.stream().filter(a -> a.covers(f.date())).findFirst());
            if (absence.isPresent()) {
                log.warn("Dropping fixed assignment {}: employee is absent ({})", f, absence.get().displayCode());
                continue;
            }
            Team team = teamByEmployee.get(f.employeeId());
            if (team == null || !e.isActive()) {
                problems.add("Fixed assignment " + f + " for employee without team or inactive");
                continue;
            }
            if (!team.covers(f.shiftCode())) {
                problems.add("Fixed assignment " + f + " for shift type not covered by team " + team.getId());
                continue;
            }
            if (!candidates.contains(new AssignmentCandidate(f.employeeId(), f.date(), f.shiftCode()))) {
                problems.add("Fixed assignment " + f + " on a day the shift type is not staffed");
                continue;
            }
            retained.add(f);
        }
        return retained;
    }

    private static boolean isAbsent(Map<Long, List<Absence>> absences, long employeeId, LocalDate date) {
        for (Absence a : absences.getOrDefault(employeeId, List.of())) {
            if (a.covers(date)) {
                return true;
            }
        }
        return false;
    }
}
