package com.alertrouter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 投递失败记录, 只追加不修改
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqRecord {

    private Instant when;

    private String route;

    private String destination;

    /** 序列化后的批次 */
    private String payload;

    private String error;
}
