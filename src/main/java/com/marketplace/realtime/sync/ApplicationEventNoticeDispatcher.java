package com.marketplace.realtime.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationEventNoticeDispatcher implements NoticeDispatcher {

    private final ApplicationEventPublisher publisher;

    @Override
    public void dispatch(Notice notice) {
        log.debug("Notice {} for user {}: {}", notice.type(), notice.recipientId(), notice.title());
        publisher.publishEvent(notice);
    }
}
