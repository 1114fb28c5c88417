package com.marketplace.realtime.sync;

@FunctionalInterface
public interface NoticeDispatcher {

    void dispatch(Notice notice);
}
