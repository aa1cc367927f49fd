package com.alertrouter.model;

import com.alertrouter.model.enums.DestinationType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 通知目的地配置
 */
@Value
@Builder
public class Destination {

    DestinationType type;

    /** chat: webhook地址 */
    String webhook;

    /** chat: 频道, 仅用于展示 */
    String channel;

    /** email: 收件人 */
    List<String> recipients;

    /** 写入 DLQ 的目的地名称 */
    public String name() {
        return type.label();
    }

    public static Destination chat(String webhook, String channel) {
        return Destination.builder().type(DestinationType.CHAT).webhook(webhook).channel(channel).build();
    }

    public static Destination email(List<String> recipients) {
        return Destination.builder().type(DestinationType.EMAIL).recipients(List.copyOf(recipients)).build();
    }
}
