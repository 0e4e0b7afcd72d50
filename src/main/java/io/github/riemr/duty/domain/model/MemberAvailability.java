package io.github.riemr.duty.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberAvailability {
    @Builder.Default
    private List<WeeklyTimeRule> neverAvailable = new ArrayList<>();
    @Builder.Default
    private List<WeeklyTimeRule> preferredTimes = new ArrayList<>();

    public boolean hasRestrictions() {
        return neverAvailable != null && !neverAvailable.isEmpty();
    }

    public boolean hasPreferences() {
        return preferredTimes != null && !preferredTimes.isEmpty();
    }
}
