package io.github.riemr.duty.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StableMember {
    private String stableId;
    private String memberId;
    private String firstName;
    private String lastName;
    private String email;
    @Builder.Default
    private boolean active = true;

    /** 氏名 → メール → ID の順で表示名を決める */
    public String resolveDisplayName() {
        String name = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        if (!name.isEmpty()) return name;
        if (email != null && !email.isBlank()) return email;
        return memberId;
    }
}
