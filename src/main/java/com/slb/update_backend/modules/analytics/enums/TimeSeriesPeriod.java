package com.slb.update_backend.modules.analytics.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.slb.update_backend.common.exception.BizException;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * 时间序列区间：24h 按小时分桶，其余按天分桶。
 */
public enum TimeSeriesPeriod {
    LAST_24_HOURS("24h", Duration.ofHours(24), ChronoUnit.HOURS),
    LAST_7_DAYS("7d", Duration.ofDays(7), ChronoUnit.DAYS),
    LAST_30_DAYS("30d", Duration.ofDays(30), ChronoUnit.DAYS),
    LAST_90_DAYS("90d", Duration.ofDays(90), ChronoUnit.DAYS);

    private final String code;
    private final Duration length;
    private final ChronoUnit bucketUnit;

    TimeSeriesPeriod(String code, Duration length, ChronoUnit bucketUnit) {
        this.code = code;
        this.length = length;
        this.bucketUnit = bucketUnit;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Duration getLength() {
        return length;
    }

    public ChronoUnit getBucketUnit() {
        return bucketUnit;
    }

    public boolean isHourly() {
        return bucketUnit == ChronoUnit.HOURS;
    }

    public static TimeSeriesPeriod fromCode(String code) {
        if (code != null) {
            for (TimeSeriesPeriod p : values()) {
                if (p.code.equalsIgnoreCase(code.trim())) {
                    return p;
                }
            }
        }
        throw new BizException(400, "period 只能是 24h / 7d / 30d / 90d，实际为 '" + code + "'");
    }
}
