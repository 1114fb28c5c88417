package com.marketplace.realtime.sync.request;

public record NoticeText(String title, String description) {
}
