package com.marketplace.realtime.service;

import com.marketplace.realtime.config.ExpirationProperties;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Texts the sweep stores with cancelled requests and their notifications.
 */
@Component
public class ExpirationMessages {

    private final MessageSource messageSource;
    private final Locale locale;

    public ExpirationMessages(MessageSource messageSource, ExpirationProperties properties) {
        this.messageSource = messageSource;
        this.locale = properties.getMessageLocale();
    }

    public String pendingProviderResponse() {
        return text("expiration.pending.provider-response");
    }

    public String pendingTitle() {
        return text("expiration.pending.title");
    }

    public String pendingMessage(String listingTitle) {
        return text("expiration.pending.message", displayTitle(listingTitle));
    }

    public String acceptedProviderResponse() {
        return text("expiration.accepted.provider-response");
    }

    public String acceptedTitle() {
        return text("expiration.accepted.title");
    }

    public String acceptedMessage(String listingTitle) {
        return text("expiration.accepted.message", displayTitle(listingTitle));
    }

    private String displayTitle(String listingTitle) {
        return listingTitle != null ? listingTitle : text("expiration.untitled-listing");
    }

    private String text(String code, Object... args) {
        return messageSource.getMessage(code, args, locale);
    }
}
