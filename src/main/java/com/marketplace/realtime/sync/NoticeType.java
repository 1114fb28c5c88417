package com.marketplace.realtime.sync;

public enum NoticeType {
    STATUS_CHANGED,
    NEW_REQUEST,
    REPORT_ARRIVED
}
