package io.github.riemr.duty.application.exception;

/**
 * 割当設定（設定バッグ・開始時刻など）の値が不正。
 */
public class AssignmentConfigurationException extends IllegalArgumentException {

    public AssignmentConfigurationException(String message) {
        super(message);
    }

    public AssignmentConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
