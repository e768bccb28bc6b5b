/**
 * MQTT主题匹配工具
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.util;

/**
 * MQTT 主题匹配工具
 * 支持 + 和 # 通配符，通配符不匹配以 $ 开头的系统主题
 */
public final class TopicMatcher {
    private TopicMatcher() {}

    public static boolean matches(String topic, String filter) {
        if (filter == null || topic == null) return false;
        if (topic.startsWith("$") && (filter.startsWith("+") || filter.startsWith("#"))) {
            return false;
        }
        if ("#".equals(filter)) return true;
        String[] t = topic.split("/", -1);
        String[] f = filter.split("/", -1);
        return matchLevels(t, f, 0, 0);
    }

    /**
     * 检查过滤器是否包含通配符
     */
    public static boolean isWildcard(String filter) {
        return filter != null && (filter.contains("+") || filter.contains("#"));
    }

    private static boolean matchLevels(String[] topic, String[] filter, int ti, int fi) {
        if (fi == filter.length) return ti == topic.length;
        String f = filter[fi];
        // # 匹配父级及其所有子级
        if ("#".equals(f)) return fi == filter.length - 1;
        if (ti == topic.length) return false;
        if ("+".equals(f) || f.equals(topic[ti])) {
            return matchLevels(topic, filter, ti + 1, fi + 1);
        }
        return false;
    }
}
