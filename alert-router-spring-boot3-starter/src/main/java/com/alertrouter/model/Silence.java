package com.alertrouter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 静默规则
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Silence {

    private String id;

    private String label;

    private String regex;

    /** 过期时间, now > expiresAt 后不再生效 */
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
