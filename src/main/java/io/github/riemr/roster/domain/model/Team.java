package io.github.riemr.roster.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class Team {
    long id;
    String name;
    /** Member employee ids in roster display order. */
    @Singular
    List<Long> memberIds;
    @Singular
    Set<String> eligibleShiftCodes;

    public boolean covers(String shiftCode) {
        return eligibleShiftCodes.contains(shiftCode);
    }
}
