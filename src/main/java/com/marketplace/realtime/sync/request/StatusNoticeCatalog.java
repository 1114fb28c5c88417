package com.marketplace.realtime.sync.request;

import com.marketplace.realtime.config.RealtimeProperties;
import com.marketplace.realtime.model.RequestStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Localized notice texts, read from the {@code messages*.properties} bundles.
 * Statuses without a {@code notice.status.<status>.title} entry have no notice.
 */
@Component
public class StatusNoticeCatalog {

    private final MessageSource messageSource;
    private final Locale locale;

    @Autowired
    public StatusNoticeCatalog(MessageSource messageSource, RealtimeProperties properties) {
        this(messageSource, properties.getNoticeLocale());
    }

    public StatusNoticeCatalog(MessageSource messageSource, Locale locale) {
        this.messageSource = messageSource;
        this.locale = locale;
    }

    public Optional<NoticeText> forStatus(RequestStatus status) {
        return lookup("notice.status." + status.wireValue());
    }

    public Optional<NoticeText> newRequest() {
        return lookup("notice.new-request");
    }

    public Optional<NoticeText> reportArrived() {
        return lookup("notice.report-arrived");
    }

    private Optional<NoticeText> lookup(String prefix) {
        String title = messageSource.getMessage(prefix + ".title", null, null, locale);
        if (title == null) {
            return Optional.empty();
        }
        String description = messageSource.getMessage(prefix + ".description", null, "", locale);
        return Optional.of(new NoticeText(title, description));
    }
}
