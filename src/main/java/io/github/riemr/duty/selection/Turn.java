package io.github.riemr.duty.selection;

/**
 * 順番の1枠。memberId が無い枠は巡回割当の前に除外される。
 */
public record Turn(String memberId, String memberName, String memberEmail) {

    public boolean hasMemberId() {
        return memberId != null && !memberId.isBlank();
    }
}
