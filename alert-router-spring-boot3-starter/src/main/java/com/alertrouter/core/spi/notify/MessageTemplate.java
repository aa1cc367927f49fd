package com.alertrouter.core.spi.notify;

import com.alertrouter.model.Alert;

import java.util.List;

public interface MessageTemplate {
    /** 渲染标题 */
    String renderTitle(List<Alert> batch);

    /** 渲染内容 */
    String renderBody(List<Alert> batch);
}
