package com.mmbrief.runner;

/**
 * 模块说明：SkipReason（enum）。
 * 主要职责：单只标的被跳过的原因，label 写入运行摘要。
 * 使用建议：新增原因时同步更新 BriefingRunner 的异常映射。
 */
public enum SkipReason {
    PROVIDER_FETCH_FAILED("provider_fetch_failed"),
    NO_DATA("no_data"),
    STORE_WRITE_FAILED("store_write_failed"),
    ERROR("error");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SkipReason fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return ERROR;
        }
        String target = raw.trim().toLowerCase();
        for (SkipReason reason : values()) {
            if (reason.label.equals(target)) {
                return reason;
            }
        }
        return ERROR;
    }
}
