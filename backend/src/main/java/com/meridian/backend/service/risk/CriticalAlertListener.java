package com.meridian.backend.service.risk;

import com.meridian.backend.model.CriticalAlert;

@FunctionalInterface
public interface CriticalAlertListener {

    void onCriticalAlert(CriticalAlert alert);
}
