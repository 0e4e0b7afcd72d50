package io.github.riemr.duty.optimization.entity;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * 1回の割当実行中だけ有効なメンバーごとの集計。実行ごとに作り直す。
 */
@Getter
@ToString
public class MemberTrackingState {

    private double sessionPoints;
    private int shiftsThisWeek;
    private int shiftsThisMonth;
    private LocalDate lastAssignedDate;

    public void recordAssignment(LocalDate date, double pointsAwarded) {
        if (pointsAwarded < 0) {
            throw new IllegalArgumentException("pointsAwarded must be >= 0: " + pointsAwarded);
        }
        sessionPoints += pointsAwarded;
        shiftsThisWeek++;
        shiftsThisMonth++;
        lastAssignedDate = date;
    }

    public void resetWeek() {
        shiftsThisWeek = 0;
    }

    public void resetMonth() {
        shiftsThisMonth = 0;
    }
}
