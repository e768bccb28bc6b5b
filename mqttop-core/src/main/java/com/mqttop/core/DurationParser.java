/**
 * 时长解析
 *
 * @author zhenglin
 * @date 2025/08/20
 */
package com.mqttop.core;

import org.springframework.boot.convert.DurationStyle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 控制负载中的时长解析
 *
 * 支持由数字和单位组成的序列，如 1m30s、1.5s、300us，单位为 ns、us、µs、ms、s、m、h。
 * 其他格式（ISO-8601 的 PT5S 等）交给 Spring 的 {@link DurationStyle}。
 */
public final class DurationParser {

    private static final String NUMBER = "(?:\\d+\\.?\\d*|\\.\\d+)";

    private static final String UNIT = "(?:ns|us|µs|μs|ms|s|m|h)";

    private static final Pattern SEQUENCE = Pattern.compile("([+-]?)((?:" + NUMBER + UNIT + ")+)");

    private static final Pattern PART = Pattern.compile("(" + NUMBER + ")(" + UNIT + ")");

    private static final Map<String, Long> UNIT_NANOS = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "μs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L);

    private DurationParser() {
    }

    /**
     * 解析时长
     *
     * @param text 时长文本
     * @return 时长
     * @throws IllegalArgumentException 格式无效或超出范围
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("时长为空");
        }
        String value = text.trim();
        if ("0".equals(value) || "+0".equals(value) || "-0".equals(value)) {
            return Duration.ZERO;
        }
        Matcher sequence = SEQUENCE.matcher(value);
        if (!sequence.matches()) {
            return DurationStyle.detectAndParse(value);
        }
        BigDecimal nanos = BigDecimal.ZERO;
        Matcher part = PART.matcher(sequence.group(2));
        while (part.find()) {
            BigDecimal amount = new BigDecimal(part.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(UNIT_NANOS.get(part.group(2)))));
        }
        try {
            long total = nanos.setScale(0, RoundingMode.DOWN).longValueExact();
            Duration duration = Duration.ofNanos(total);
            return "-".equals(sequence.group(1)) ? duration.negated() : duration;
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("时长超出范围: " + value, e);
        }
    }
}
