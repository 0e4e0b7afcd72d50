package io.github.riemr.duty.selection;

/**
 * 順番計算の失敗・タイムアウト・中断。
 */
public class TurnOrderProviderException extends RuntimeException {

    public TurnOrderProviderException(String message) {
        super(message);
    }

    public TurnOrderProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
