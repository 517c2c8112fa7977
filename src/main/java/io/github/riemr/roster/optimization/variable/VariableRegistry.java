package io.github.riemr.roster.optimization.variable;

import com.google.ortools.sat.BoolVar;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;

import java.time.LocalDate;
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
 * Lookup of every decision and indicator variable created for one model.
 */
public final class VariableRegistry {

    private record Key(long employeeId, LocalDate date, String shiftCode) {
    }

    private record EmployeeDay(long employeeId, LocalDate date) {
    }

    private record TeamWeekShift(long teamId, LocalDate monday, String shiftCode) {
    }

    private final Map<AssignmentCandidate, BoolVar> assignmentVars = new LinkedHashMap<>();
    private final Map<EmployeeDay, List<BoolVar>> assignmentVarsByEmployeeDay = new HashMap<>();
    private final Map<Key, BoolVar> worksShiftVars = new HashMap<>();
    private final Set<Key> pinnedFalse = new HashSet<>();
    private final Set<Key> pinnedTrue = new HashSet<>();
    private final Map<TeamWeekShift, BoolVar> teamShiftVars = new HashMap<>();
    private final Map<EmployeeDay, BoolVar> dayDutyVars = new LinkedHashMap<>();

    void registerAssignment(AssignmentCandidate candidate, BoolVar var) {
        assignmentVars.put(candidate, var);
        assignmentVarsByEmployeeDay
                .computeIfAbsent(new EmployeeDay(candidate.employeeId(), candidate.date()), k -> new ArrayList<>())
                .add(var);
    }

    void registerWorksShift(long employeeId, LocalDate date, String shiftCode, BoolVar var, Boolean pinnedValue) {
        Key key = new Key(employeeId, date, shiftCode);
        worksShiftVars.put(key, var);
        if (Boolean.FALSE.equals(pinnedValue)) {
            pinnedFalse.add(key);
        } else if (Boolean.TRUE.equals(pinnedValue)) {
            pinnedTrue.add(key);
        }
    }

    void registerTeamShift(long teamId, LocalDate monday, String shiftCode, BoolVar var) {
        teamShiftVars.put(new TeamWeekShift(teamId, monday, shiftCode), var);
    }

    void registerDayDuty(long employeeId, LocalDate monday, BoolVar var) {
        dayDutyVars.put(new EmployeeDay(employeeId, monday), var);
    }

    /** Top-level assignment variables, in candidate order. */
    public Map<AssignmentCandidate, BoolVar> getAssignmentVars() {
        return Collections.unmodifiableMap(assignmentVars);
    }

    public BoolVar assignment(AssignmentCandidate candidate) {
        BoolVar var = assignmentVars.get(candidate);
        if (var == null) {
            throw new IllegalArgumentException("No decision variable for " + candidate);
        }
        return var;
    }

    public List<BoolVar> assignmentsOf(long employeeId, LocalDate date) {
        return assignmentVarsByEmployeeDay.getOrDefault(new EmployeeDay(employeeId, date), List.of());
    }

    /**
     * "Employee works shift type on day" indicator. Exists for every plannable employee, every shift type
     * and every horizon or lookback day.
     */
    public BoolVar worksShift(long employeeId, LocalDate date, String shiftCode) {
        BoolVar var = worksShiftVars.get(new Key(employeeId, date, shiftCode));
        if (var == null) {
            throw new IllegalArgumentException("No indicator for employee " + employeeId + " " + date + " " + shiftCode);
        }
        return var;
    }

    /** The indicator is fixed to false: no candidate exists or history shows no such shift. */
    public boolean isPinnedFalse(long employeeId, LocalDate date, String shiftCode) {
        return pinnedFalse.contains(new Key(employeeId, date, shiftCode));
    }

    public boolean isPinnedTrue(long employeeId, LocalDate date, String shiftCode) {
        return pinnedTrue.contains(new Key(employeeId, date, shiftCode));
    }

    /**
     * "Team works shift type in the week starting at {@code monday}" variable.
     *
     * @return empty when team rotation is off or the team does not cover the shift type
     */
    public Optional<BoolVar> teamShift(long teamId, LocalDate monday, String shiftCode) {
        return Optional.ofNullable(teamShiftVars.get(new TeamWeekShift(teamId, monday, shiftCode)));
    }

    /** Day duty variables of one week keyed by employee id, in snapshot order. */
    public Map<Long, BoolVar> dayDutiesOf(LocalDate monday) {
        Map<Long, BoolVar> week = new LinkedHashMap<>();
        dayDutyVars.forEach((key, var) -> {
            if (key.date().equals(monday)) {
                week.put(key.employeeId(), var);
            }
        });
        return week;
    }

    public int assignmentCount() {
        return assignmentVars.size();
    }

    public int indicatorCount() {
        return worksShiftVars.size();
    }

    public int pinnedCount() {
        return pinnedFalse.size() + pinnedTrue.size();
    }

    public int teamShiftCount() {
        return teamShiftVars.size();
    }

    public int dayDutyCount() {
        return dayDutyVars.size();
    }
}
