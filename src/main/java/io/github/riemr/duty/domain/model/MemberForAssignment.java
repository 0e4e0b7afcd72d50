package io.github.riemr.duty.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 割当候補メンバー。名簿提供元から渡され、割当処理中は変更しない。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberForAssignment {
    @JsonAlias({"userId", "id"})
    private String memberId;
    private String displayName;
    private String email;
    private double historicalPoints;
    private MemberAvailability availability;
    private MemberLimits limits;
}
