package com.alertrouter.core.deliver;

import com.alertrouter.core.spi.notify.MessageTemplate;
import com.alertrouter.model.Alert;

import java.util.List;

/**
 * 默认文本模板
 * 标题: 数量 + 首条告警的 severity
 * 正文: 每条告警一行 summary [sev] (instance)
 */
public class BatchFormatter implements MessageTemplate {

    @Override
    public String renderTitle(List<Alert> batch) {
        if (batch == null || batch.isEmpty()) {
            return "alerts";
        }
        String sev = batch.get(0).label("severity");
        if (sev != null) {
            return String.format("%d alert(s) severity=%s", batch.size(), sev);
        }
        return String.format("%d alert(s)", batch.size());
    }

    @Override
    public String renderBody(List<Alert> batch) {
        StringBuilder b = new StringBuilder();
        b.append('*').append(renderTitle(batch)).append("*\n");
        for (Alert a : batch) {
            b.append("- ").append(summary(a));
            String sev = a.label("severity");
            if (sev != null) {
                b.append(" [sev:").append(sev).append(']');
            }
            String inst = a.label("instance");
            if (inst != null) {
                b.append(" (").append(inst).append(')');
            }
            b.append('\n');
        }
        return b.toString();
    }

    private static String summary(Alert a) {
        // label 优先于 annotation, 都没有时用指纹前 8 位
        String s = a.label("summary");
        if (s != null) {
            return s;
        }
        s = a.annotation("summary");
        if (s != null) {
            return s;
        }
        String fp = a.getFingerprint() == null ? "" : a.getFingerprint();
        return fp.length() > 8 ? fp.substring(0, 8) : fp;
    }
}
