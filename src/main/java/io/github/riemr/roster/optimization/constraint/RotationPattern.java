package io.github.riemr.roster.optimization.constraint;

import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.Team;
import io.github.riemr.roster.exception.RosterModelException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cyclic weekly order of team shift types, such as early, night, late.
 * <p>
 * A team follows the pattern restricted to the shift types it covers: a team without nights rotates
 * early, late, early. Shift types outside the pattern have no successor.
 */
public final class RotationPattern {

    private final List<String> codes;

    private RotationPattern(List<String> codes) {
        this.codes = List.copyOf(codes);
    }

    /**
     * @param codes      configured order
     * @param shiftTypes shift types of the problem
     * @return the pattern
     * @throws RosterModelException when a code names no shift type
     */
    public static RotationPattern resolve(List<String> codes, Collection<ShiftType> shiftTypes) {
        Set<String> known = shiftTypes.stream().map(ShiftType::getCode).collect(Collectors.toSet());
        List<String> problems = new ArrayList<>();
        for (String code : codes) {
            if (!known.contains(code)) {
                problems.add("Rotation pattern references unknown shift type " + code);
            }
        }
        if (!problems.isEmpty()) {
            throw new RosterModelException(problems);
        }
        return new RotationPattern(codes);
    }

    /**
     * @return the shift type the team works in the week after a week of {@code shiftCode}, empty when the
     *         rotation does not bind that shift type for this team
     */
    public Optional<String> successorFor(Team team, String shiftCode) {
        List<String> own = codes.stream().filter(team::covers).toList();
        int i = own.indexOf(shiftCode);
        if (own.size() < 2 || i < 0) {
            return Optional.empty();
        }
        return Optional.of(own.get((i + 1) % own.size()));
    }

    @Override
    public String toString() {
        return String.join("->", codes);
    }
}
