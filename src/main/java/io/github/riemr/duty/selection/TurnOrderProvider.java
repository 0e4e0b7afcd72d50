package io.github.riemr.duty.selection;

/**
 * 巡回割当に使う順番を計算する外部協調者。
 * 同じ入力には同じ順番を返すこと。失敗は例外で通知する（呼び出し側で握りつぶさない）。
 */
public interface TurnOrderProvider {

    TurnOrder computeTurnOrder(TurnOrderRequest request);
}
