package com.alertrouter.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@TableName("alert_router_state")
@Data
public class StateEntryEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** dedupe|silence|rate|dlq */
    private String namespace;

    /** 命名空间内唯一 */
    private String stateKey;

    private String stateValue;

    private LocalDateTime updatedAt;
}
