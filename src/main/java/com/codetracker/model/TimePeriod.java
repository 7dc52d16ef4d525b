package com.codetracker.model;

public enum TimePeriod {
    TODAY,
    THIS_WEEK,
    THIS_MONTH,
    THIS_YEAR
}
