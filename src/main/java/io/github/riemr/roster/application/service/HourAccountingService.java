package io.github.riemr.roster.application.service;

import io.github.riemr.roster.application.dto.ActivityBuckets;
import io.github.riemr.roster.application.dto.EmployeeHours;
import io.github.riemr.roster.application.dto.HourAccountingSummary;
import io.github.riemr.roster.application.dto.ReportingWindow;
import io.github.riemr.roster.config.RosterAccountingProperties;
import io.github.riemr.roster.domain.model.Absence;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.PlanningSnapshot;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.Team;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hour totals for reporting.
 * <p>
 * An absence overrides any shift recorded on its days. Training absences count like a worked day with
 * {@code roster.accounting.credited-hours-per-day} hours; all other absence types credit nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HourAccountingService {

    private final RosterAccountingProperties properties;

    public HourAccountingSummary summarize(PlanningSnapshot snapshot, Collection<ShiftAssignment> assignments,
                                           ReportingWindow window) {
        return summarize(snapshot.getEmployees(), snapshot.getTeams(), snapshot.getShiftTypes(), assignments,
                snapshot.getAbsences(), window);
    }

    public HourAccountingSummary summarize(Collection<Employee> employees,
                                           Collection<Team> teams,
                                           Collection<ShiftType> shiftTypes,
                                           Collection<ShiftAssignment> assignments,
                                           Collection<Absence> absences,
                                           ReportingWindow window) {
        Map<String, ShiftType> byCode = new HashMap<>();
        shiftTypes.forEach(st -> byCode.put(st.getCode(), st));

        Map<Long, EmployeeHours> hours = new LinkedHashMap<>();
        for (Employee e : employees) {
            List<ShiftAssignment> own = assignments.stream().filter(a -> a.employeeId() == e.getId()).toList();
            List<Absence> ownAbsences = absences.stream().filter(a -> a.employeeId() == e.getId()).toList();
            hours.put(e.getId(), creditedHours(e.getId(), own, ownAbsences, byCode, window));
        }
        ActivityBuckets activity = classify(employees, teams);
        log.info("Hour accounting {}..{}: {} employees, activity {}", window.from(), window.to(), hours.size(), activity);
        return new HourAccountingSummary(window, hours, activity);
    }

    public EmployeeHours creditedHours(long employeeId,
                                       Collection<ShiftAssignment> assignments,
                                       Collection<Absence> absences,
                                       Map<String, ShiftType> shiftTypes,
                                       ReportingWindow window) {
        double shiftHours = 0;
        int retracted = 0;
        for (ShiftAssignment a : assignments) {
            if (a.employeeId() != employeeId || !window.contains(a.date())) {
                continue;
            }
            if (absences.stream().anyMatch(ab -> ab.employeeId() == employeeId && ab.covers(a.date()))) {
                retracted++;
                log.debug("Assignment {} retracted by absence", a);
                continue;
            }
            ShiftType st = shiftTypes.get(a.shiftCode());
            if (st == null) {
                throw new IllegalArgumentException("Unknown shift type in assignment " + a);
            }
            shiftHours += st.getHours();
        }

        double credited = 0;
        for (Absence ab : absences) {
            if (ab.employeeId() == employeeId && ab.type().isCreditEquivalent()) {
                credited += ab.overlapDays(window.from(), window.to()) * properties.getCreditedHoursPerDay();
            }
        }
        return new EmployeeHours(employeeId, shiftHours, credited, retracted);
    }

    /** Membership decides planning availability, the active flag decides system activity. */
    public ActivityBuckets classify(Collection<Employee> employees, Collection<Team> teams) {
        Set<Long> members = new HashSet<>();
        teams.forEach(t -> members.addAll(t.getMemberIds()));
        int withTeam = 0;
        int withoutTeam = 0;
        int inactive = 0;
        for (Employee e : employees) {
            if (!e.isActive()) {
                inactive++;
            } else if (members.contains(e.getId())) {
                withTeam++;
            } else {
                withoutTeam++;
            }
        }
        return new ActivityBuckets(withTeam, withoutTeam, inactive);
    }
}
