package com.tenacy.labpulse.store;

import com.tenacy.labpulse.domain.AnomalyAlert;

import java.util.List;

public interface AlertSink {

    /**
     * 알림을 저장하고 가능하면 외부로 전달한다. 전달 실패는 호출자에게 전파하지 않는다.
     */
    void accept(AnomalyAlert alert);

    List<AnomalyAlert> recentAlerts(int limit);
}
