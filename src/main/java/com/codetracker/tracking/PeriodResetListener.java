package com.codetracker.tracking;

import com.codetracker.model.TimePeriod;

@FunctionalInterface
public interface PeriodResetListener {

    void onPeriodReset(TimePeriod period);
}
